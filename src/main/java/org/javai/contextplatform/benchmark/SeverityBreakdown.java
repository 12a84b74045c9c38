package org.javai.contextplatform.benchmark;

/**
 * Pass counts for one severity within a run.
 */
public record SeverityBreakdown(int passed, int total, double weight) {

	public int failed() {
		return total - passed;
	}
}
