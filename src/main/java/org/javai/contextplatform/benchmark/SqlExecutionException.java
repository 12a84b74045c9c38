package org.javai.contextplatform.benchmark;

/**
 * A query could not be executed against the target connection.
 */
public class SqlExecutionException extends RuntimeException {

	public SqlExecutionException(String message) {
		super(message);
	}

	public SqlExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
