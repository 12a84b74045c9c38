package org.javai.contextplatform.benchmark;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Case counts of a finished run.
 *
 * @param bySeverity pass counts per severity, scored cases only
 */
public record RunSummary(int totalCases, int passed, int failed, int skipped, int timedOut,
		Map<Severity, SeverityBreakdown> bySeverity) {

	public RunSummary {
		EnumMap<Severity, SeverityBreakdown> copy = new EnumMap<>(Severity.class);
		if (bySeverity != null) {
			copy.putAll(bySeverity);
		}
		bySeverity = Collections.unmodifiableMap(copy);
	}

	public static RunSummary empty() {
		return new RunSummary(0, 0, 0, 0, 0, Map.of());
	}

	public int scored() {
		return passed + failed;
	}
}
