package org.javai.contextplatform.benchmark;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one case within a run.
 *
 * @param actualSql SQL produced by the generator, {@code null} if generation failed
 * @param actualResultDigest digest of the executed SQL's rows, when it was executed
 * @param error why the case failed, {@code null} when passed
 * @param timedOut whether a generation or execution call exceeded its timeout
 */
public record BenchmarkResult(
		String runId,
		String caseId,
		String caseName,
		Severity severity,
		ResultStatus status,
		ResultMatchKind matchKind,
		String actualSql,
		String actualResultDigest,
		String error,
		Duration duration,
		boolean timedOut) {

	public BenchmarkResult {
		Objects.requireNonNull(runId, "runId must not be null");
		Objects.requireNonNull(caseId, "caseId must not be null");
		Objects.requireNonNull(status, "status must not be null");
		matchKind = matchKind == null ? ResultMatchKind.NONE : matchKind;
		duration = duration == null ? Duration.ZERO : duration;
	}

	public static BenchmarkResult passed(String runId, BenchmarkCase benchmarkCase, ResultMatchKind matchKind,
			String actualSql, String actualResultDigest, Duration duration) {
		return new BenchmarkResult(runId, benchmarkCase.id(), benchmarkCase.name(), benchmarkCase.severity(),
				ResultStatus.PASSED, matchKind, actualSql, actualResultDigest, null, duration, false);
	}

	public static BenchmarkResult failed(String runId, BenchmarkCase benchmarkCase, String actualSql,
			String actualResultDigest, String error, Duration duration, boolean timedOut) {
		return new BenchmarkResult(runId, benchmarkCase.id(), benchmarkCase.name(), benchmarkCase.severity(),
				ResultStatus.FAILED, ResultMatchKind.NONE, actualSql, actualResultDigest, error, duration, timedOut);
	}

	public static BenchmarkResult skipped(String runId, BenchmarkCase benchmarkCase, String reason) {
		return new BenchmarkResult(runId, benchmarkCase.id(), benchmarkCase.name(), benchmarkCase.severity(),
				ResultStatus.SKIPPED, ResultMatchKind.NONE, null, null, reason, Duration.ZERO, false);
	}

	public boolean passed() {
		return status == ResultStatus.PASSED;
	}

	public boolean scored() {
		return status != ResultStatus.SKIPPED;
	}
}
