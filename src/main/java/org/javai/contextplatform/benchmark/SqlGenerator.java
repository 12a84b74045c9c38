package org.javai.contextplatform.benchmark;

import java.util.List;
import org.javai.contextplatform.asset.ContextAsset;

/**
 * Turns a natural-language question into SQL. The implementation is the system under test.
 */
@FunctionalInterface
public interface SqlGenerator {

	/**
	 * @param question the case's question
	 * @param context fixture assets the generator may draw on
	 * @throws RuntimeException on provider errors; the case is recorded as failed
	 */
	GeneratedSql generate(String question, List<ContextAsset> context);
}
