package org.javai.contextplatform.benchmark;

import java.util.Locale;

/**
 * Importance tier of a benchmark case, used to weight the run score.
 */
public enum Severity {
	SMOKE,
	CRITICAL,
	REGRESSION;

	public String id() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static Severity fromId(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("severity must not be blank");
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown severity '" + value + "'; expected smoke, critical or regression", e);
		}
	}
}
