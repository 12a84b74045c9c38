package org.javai.contextplatform.benchmark;

import java.time.Duration;
import java.util.Set;

/**
 * Per-run settings. {@code null} fields fall back to {@link BenchmarkConfig}.
 *
 * @param tagFilter run only cases carrying one of these tags; empty runs every case
 * @param parallelism worker-pool size
 * @param caseTimeout budget for a whole case
 * @param generationTimeout budget for one SQL-generation call
 * @param baselineRunId earlier run to record as this run's baseline
 */
public record RunOptions(Set<String> tagFilter, Integer parallelism, Duration caseTimeout, Duration generationTimeout,
		String baselineRunId) {

	public RunOptions {
		tagFilter = tagFilter == null ? Set.of() : Set.copyOf(tagFilter);
		if (parallelism != null && parallelism <= 0) {
			throw new IllegalArgumentException("parallelism must be positive");
		}
	}

	public static RunOptions defaults() {
		return new RunOptions(Set.of(), null, null, null, null);
	}

	public RunOptions withTagFilter(Set<String> value) {
		return new RunOptions(value, parallelism, caseTimeout, generationTimeout, baselineRunId);
	}

	public RunOptions withParallelism(int value) {
		return new RunOptions(tagFilter, value, caseTimeout, generationTimeout, baselineRunId);
	}

	public RunOptions withCaseTimeout(Duration value) {
		return new RunOptions(tagFilter, parallelism, value, generationTimeout, baselineRunId);
	}

	public RunOptions withGenerationTimeout(Duration value) {
		return new RunOptions(tagFilter, parallelism, caseTimeout, value, baselineRunId);
	}

	public RunOptions withBaseline(String runId) {
		return new RunOptions(tagFilter, parallelism, caseTimeout, generationTimeout, runId);
	}

	int effectiveParallelism(BenchmarkConfig config) {
		return parallelism != null ? parallelism : config.parallelism();
	}

	Duration effectiveCaseTimeout(BenchmarkConfig config) {
		return caseTimeout != null ? caseTimeout : config.caseTimeout();
	}

	Duration effectiveGenerationTimeout(BenchmarkConfig config) {
		return generationTimeout != null ? generationTimeout : config.generationTimeout();
	}
}
