package org.javai.contextplatform.benchmark;

/**
 * Stable characteristics of a failed case, for spotting the same failure across runs.
 *
 * @param sqlHash first 16 hex characters of the SHA-256 of the normalised actual SQL, empty if none
 */
public record FailureFingerprint(String caseId, Severity severity, FailureType failureType, String sqlHash) {

	public static FailureFingerprint of(BenchmarkResult result) {
		String sql = result.actualSql();
		String hash = sql == null || sql.isBlank()
				? ""
				: ResultDigest.sha256(SqlNormalizer.normalize(sql)).substring(0, 16);
		return new FailureFingerprint(result.caseId(), result.severity(), FailureType.classify(result), hash);
	}
}
