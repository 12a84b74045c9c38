package org.javai.contextplatform.benchmark;

/**
 * A benchmark suite definition could not be read or is malformed.
 */
public class SuiteDefinitionException extends RuntimeException {

	public SuiteDefinitionException(String message) {
		super(message);
	}

	public SuiteDefinitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
