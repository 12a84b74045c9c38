package org.javai.contextplatform.benchmark;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named, ordered collection of benchmark cases and the assets they exercise.
 *
 * @param fixtureAssetIds asset versions handed to the SQL generator as context
 */
public record BenchmarkSuite(
		String id,
		String name,
		String description,
		List<BenchmarkCase> cases,
		List<String> fixtureAssetIds,
		Set<String> tags) {

	public BenchmarkSuite {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("suite id must not be blank");
		}
		name = name == null || name.isBlank() ? id : name;
		description = description == null ? "" : description;
		cases = cases == null ? List.of() : List.copyOf(cases);
		fixtureAssetIds = fixtureAssetIds == null ? List.of() : List.copyOf(fixtureAssetIds);
		tags = tags == null ? Set.of() : Set.copyOf(tags);
		Set<String> seen = new HashSet<>();
		for (BenchmarkCase benchmarkCase : cases) {
			if (!seen.add(benchmarkCase.id())) {
				throw new IllegalArgumentException("duplicate case id '" + benchmarkCase.id() + "' in suite " + id);
			}
		}
	}

	public static BenchmarkSuite of(String id, List<BenchmarkCase> cases) {
		return new BenchmarkSuite(id, id, "", cases, List.of(), Set.of());
	}

	public BenchmarkSuite withFixtures(List<String> assetIds) {
		return new BenchmarkSuite(id, name, description, cases, assetIds, tags);
	}

	/**
	 * @return the cases matching the tag filter, in suite order
	 */
	public List<BenchmarkCase> select(Set<String> tagFilter) {
		return cases.stream().filter(c -> c.matches(tagFilter)).toList();
	}
}
