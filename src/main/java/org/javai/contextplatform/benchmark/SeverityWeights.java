package org.javai.contextplatform.benchmark;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-deployment scoring weights. A passed case contributes its weight to the numerator; every
 * scored case contributes its weight to the denominator. Severities missing from the map keep
 * their default weight (smoke=1, critical=2, regression=1).
 */
public record SeverityWeights(Map<Severity, Double> weights) {

	private static final Map<Severity, Double> DEFAULT_WEIGHTS = Map.of(
			Severity.SMOKE, 1.0,
			Severity.CRITICAL, 2.0,
			Severity.REGRESSION, 1.0);

	public SeverityWeights {
		EnumMap<Severity, Double> copy = new EnumMap<>(DEFAULT_WEIGHTS);
		if (weights != null) {
			copy.putAll(weights);
		}
		copy.forEach((severity, weight) -> {
			if (weight == null || weight.isNaN() || weight < 0.0) {
				throw new IllegalArgumentException("weight of " + severity.id() + " must be a non-negative number");
			}
		});
		weights = Collections.unmodifiableMap(copy);
	}

	public static SeverityWeights defaults() {
		return new SeverityWeights(Map.of());
	}

	public static SeverityWeights of(double smoke, double critical, double regression) {
		return new SeverityWeights(Map.of(
				Severity.SMOKE, smoke,
				Severity.CRITICAL, critical,
				Severity.REGRESSION, regression));
	}

	public double weight(Severity severity) {
		return weights.get(severity);
	}
}
