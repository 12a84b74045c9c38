package org.javai.contextplatform.benchmark;

import java.util.Locale;

/**
 * Coarse classification of a case failure, derived from its error text.
 */
public enum FailureType {
	SYNTAX,
	SCHEMA,
	PERMISSION,
	TIMEOUT,
	RESULT_MISMATCH,
	UNKNOWN;

	public static FailureType classify(BenchmarkResult result) {
		if (result.timedOut()) {
			return TIMEOUT;
		}
		String error = result.error() == null ? "" : result.error().toLowerCase(Locale.ROOT);
		if (error.contains("syntax") || error.contains("parse")) {
			return SYNTAX;
		}
		if (error.contains("table") || error.contains("column")) {
			return SCHEMA;
		}
		if (error.contains("permission") || error.contains("access")) {
			return PERMISSION;
		}
		if (error.contains("timeout") || error.contains("timed out")) {
			return TIMEOUT;
		}
		if (error.contains("digest")) {
			return RESULT_MISMATCH;
		}
		return UNKNOWN;
	}
}
