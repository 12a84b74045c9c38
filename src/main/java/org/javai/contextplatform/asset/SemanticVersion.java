package org.javai.contextplatform.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Comparator;

/**
 * A {@code major.minor.patch} version of a context asset.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

	public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);

	private static final Comparator<SemanticVersion> ORDER = Comparator
			.comparingInt(SemanticVersion::major)
			.thenComparingInt(SemanticVersion::minor)
			.thenComparingInt(SemanticVersion::patch);

	public SemanticVersion {
		if (major < 0 || minor < 0 || patch < 0) {
			throw new IllegalArgumentException("version components must be non-negative");
		}
	}

	/**
	 * Parses {@code "1.2.3"}. Missing trailing components default to zero ({@code "2"} is 2.0.0).
	 *
	 * @throws IllegalArgumentException if the text is not a version
	 */
	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static SemanticVersion parse(String text) {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("version must not be blank");
		}
		String[] parts = text.trim().split("\\.");
		if (parts.length > 3) {
			throw new IllegalArgumentException("Not a semantic version: " + text);
		}
		int[] values = new int[3];
		try {
			for (int i = 0; i < parts.length; i++) {
				values[i] = Integer.parseInt(parts[i]);
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Not a semantic version: " + text, e);
		}
		return new SemanticVersion(values[0], values[1], values[2]);
	}

	public SemanticVersion nextMinor() {
		return new SemanticVersion(major, minor + 1, 0);
	}

	public SemanticVersion nextMajor() {
		return new SemanticVersion(major + 1, 0, 0);
	}

	public boolean isAfter(SemanticVersion other) {
		return compareTo(other) > 0;
	}

	@Override
	public int compareTo(SemanticVersion other) {
		return ORDER.compare(this, other);
	}

	@JsonValue
	@Override
	public String toString() {
		return major + "." + minor + "." + patch;
	}
}
