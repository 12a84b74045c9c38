package org.javai.contextplatform.benchmark;

/**
 * Executes SQL against a target connection.
 */
public interface SqlExecutor {

	/**
	 * @throws SqlExecutionException if the query fails
	 */
	RowSet execute(String sql, String connectionId);

	/**
	 * Checks that the connection is reachable before a run starts.
	 *
	 * @throws SqlExecutionException if it is not
	 */
	default void verifyConnection(String connectionId) {
	}
}
