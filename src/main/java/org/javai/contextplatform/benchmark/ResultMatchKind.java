package org.javai.contextplatform.benchmark;

/**
 * How a case's generated SQL was judged.
 */
public enum ResultMatchKind {

	/** Normalised SQL text equals the expected SQL. */
	EXACT_SQL,

	/** SQL differs but the executed row set has the expected digest. */
	RESULT_EQUIVALENT,

	NONE
}
