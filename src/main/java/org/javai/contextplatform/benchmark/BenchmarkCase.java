package org.javai.contextplatform.benchmark;

import java.util.Objects;
import java.util.Set;

/**
 * One question with its known-good answer.
 *
 * @param id stable case id, unique within the suite
 * @param name display name, used as the test name in reports
 * @param question natural-language question handed to the SQL generator
 * @param expectedSql reference SQL; may be {@code null} when a digest is given
 * @param expectedResultDigest digest of the expected row set; computed from {@code expectedSql}
 *        when {@code null}
 * @param severity importance tier
 * @param tags tags used to select subsets of a suite
 */
public record BenchmarkCase(
		String id,
		String name,
		String question,
		String expectedSql,
		String expectedResultDigest,
		Severity severity,
		Set<String> tags) {

	public BenchmarkCase {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("case id must not be blank");
		}
		if (question == null || question.isBlank()) {
			throw new IllegalArgumentException("case " + id + " needs a question");
		}
		if (isBlank(expectedSql) && isBlank(expectedResultDigest)) {
			throw new IllegalArgumentException("case " + id + " needs expectedSql or expectedResultDigest");
		}
		Objects.requireNonNull(severity, "severity must not be null");
		name = isBlank(name) ? id : name;
		tags = tags == null ? Set.of() : Set.copyOf(tags);
	}

	public static BenchmarkCase of(String id, String question, String expectedSql, Severity severity) {
		return new BenchmarkCase(id, id, question, expectedSql, null, severity, Set.of());
	}

	public BenchmarkCase withTags(Set<String> value) {
		return new BenchmarkCase(id, name, question, expectedSql, expectedResultDigest, severity, value);
	}

	public BenchmarkCase withExpectedResultDigest(String value) {
		return new BenchmarkCase(id, name, question, expectedSql, value, severity, tags);
	}

	/**
	 * @return {@code true} if no filter is given or the case carries any of the filter's tags
	 */
	public boolean matches(Set<String> tagFilter) {
		return tagFilter == null || tagFilter.isEmpty() || tagFilter.stream().anyMatch(tags::contains);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
