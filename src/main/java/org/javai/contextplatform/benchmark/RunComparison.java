package org.javai.contextplatform.benchmark;

import java.util.List;

/**
 * Difference between a run and its baseline.
 *
 * @param scoreDelta {@code score - baselineScore}; {@code null} if either run has no score
 * @param newlyFailing cases that passed in the baseline and fail now
 * @param newlyPassing cases that failed in the baseline and pass now
 */
public record RunComparison(String runId, String baselineRunId, Double score, Double baselineScore,
		Double scoreDelta, List<String> newlyFailing, List<String> newlyPassing) {

	public RunComparison {
		newlyFailing = List.copyOf(newlyFailing);
		newlyPassing = List.copyOf(newlyPassing);
	}

	public boolean isRegression() {
		return !newlyFailing.isEmpty() || (scoreDelta != null && scoreDelta < 0.0);
	}
}
