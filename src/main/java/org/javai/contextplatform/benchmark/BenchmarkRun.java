package org.javai.contextplatform.benchmark;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One execution of a suite against a connection.
 *
 * @param score weighted pass ratio in [0, 1]; {@code null} until completed and for failed runs
 * @param summary case counts, empty until the run finishes
 * @param error infrastructure failure or cancellation reason of a failed run
 * @param baselineRunId earlier run this one is compared against, or {@code null}
 */
public record BenchmarkRun(
		String id,
		String suiteId,
		String connectionId,
		RunStatus status,
		Instant startedAt,
		Instant completedAt,
		Double score,
		RunSummary summary,
		String error,
		String baselineRunId) {

	public BenchmarkRun {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(suiteId, "suiteId must not be null");
		Objects.requireNonNull(connectionId, "connectionId must not be null");
		Objects.requireNonNull(status, "status must not be null");
		summary = summary == null ? RunSummary.empty() : summary;
	}

	public static BenchmarkRun pending(String id, String suiteId, String connectionId, String baselineRunId) {
		return new BenchmarkRun(id, suiteId, connectionId, RunStatus.PENDING, null, null, null, null, null,
				baselineRunId);
	}

	public BenchmarkRun running(Instant at) {
		return new BenchmarkRun(id, suiteId, connectionId, RunStatus.RUNNING, at, null, null, summary, null,
				baselineRunId);
	}

	public BenchmarkRun completed(Instant at, double finalScore, RunSummary finalSummary) {
		return new BenchmarkRun(id, suiteId, connectionId, RunStatus.COMPLETED, startedAt, at, finalScore,
				finalSummary, null, baselineRunId);
	}

	public BenchmarkRun failed(Instant at, String reason, RunSummary finalSummary) {
		return new BenchmarkRun(id, suiteId, connectionId, RunStatus.FAILED, startedAt, at, null, finalSummary,
				reason, baselineRunId);
	}

	/**
	 * @return wall-clock duration of a finished run, else {@code null}
	 */
	public Duration duration() {
		return startedAt == null || completedAt == null ? null : Duration.between(startedAt, completedAt);
	}
}
