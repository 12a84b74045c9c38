package org.javai.contextplatform.benchmark;

import java.time.Instant;

/**
 * Run history of a suite.
 *
 * @param averageScore mean score of completed runs, {@code null} if none completed
 * @param lastScore score of the most recently started completed run
 */
public record SuiteStats(String suiteId, int totalRuns, int completedRuns, int failedRuns, Double averageScore,
		Double lastScore, Instant lastRunAt) {
}
