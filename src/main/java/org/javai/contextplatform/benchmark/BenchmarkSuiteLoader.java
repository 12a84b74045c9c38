package org.javai.contextplatform.benchmark;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads benchmark suites from YAML.
 *
 * <pre>{@code
 * id: revenue-core
 * name: Revenue core questions
 * fixtures: [asset-id-1, asset-id-2]
 * tags: [finance]
 * cases:
 *   - id: total-revenue
 *     question: What was total revenue last quarter?
 *     expected_sql: SELECT SUM(amount) FROM orders WHERE ...
 *     severity: critical
 *     tags: [revenue]
 * }</pre>
 */
public class BenchmarkSuiteLoader {

	private final Yaml yaml = new Yaml();

	public BenchmarkSuite parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (SuiteDefinitionException e) {
			throw new SuiteDefinitionException("Invalid benchmark suite in " + path + ": " + e.getMessage(), e);
		} catch (Exception e) {
			throw new SuiteDefinitionException("Failed to read benchmark suite from path: " + path, e);
		}
	}

	public BenchmarkSuite parse(InputStream inputStream) {
		Map<String, Object> data;
		try {
			data = yaml.load(inputStream);
		} catch (Exception e) {
			throw new SuiteDefinitionException("Failed to parse benchmark suite from input stream", e);
		}
		return buildSuite(data);
	}

	public BenchmarkSuite parse(Reader reader) {
		Map<String, Object> data;
		try {
			data = yaml.load(reader);
		} catch (Exception e) {
			throw new SuiteDefinitionException("Failed to parse benchmark suite from reader", e);
		}
		return buildSuite(data);
	}

	public BenchmarkSuite parseString(String yamlContent) {
		Map<String, Object> data;
		try {
			data = yaml.load(yamlContent);
		} catch (Exception e) {
			throw new SuiteDefinitionException("Failed to parse benchmark suite from string", e);
		}
		return buildSuite(data);
	}

	@SuppressWarnings("unchecked")
	private BenchmarkSuite buildSuite(Map<String, Object> data) {
		if (data == null) {
			throw new SuiteDefinitionException("Benchmark suite definition is empty");
		}
		String id = string(data, "id", "suite");
		if (id == null) {
			throw new SuiteDefinitionException("Missing required 'id'");
		}
		Object casesValue = data.get("cases");
		if (!(casesValue instanceof List<?> caseList) || caseList.isEmpty()) {
			throw new SuiteDefinitionException("Suite '" + id + "' must define a non-empty 'cases' list");
		}
		List<BenchmarkCase> cases = new ArrayList<>();
		for (int i = 0; i < caseList.size(); i++) {
			Object entry = caseList.get(i);
			if (!(entry instanceof Map<?, ?> caseMap)) {
				throw new SuiteDefinitionException("Suite '" + id + "' case #" + (i + 1) + " must be a mapping");
			}
			cases.add(buildCase(id, i, (Map<String, Object>) caseMap));
		}
		try {
			return new BenchmarkSuite(
					id,
					string(data, "name", id),
					string(data, "description", id),
					cases,
					stringList(data, "fixtures", id),
					new LinkedHashSet<>(stringList(data, "tags", id)));
		} catch (IllegalArgumentException e) {
			throw new SuiteDefinitionException(e.getMessage(), e);
		}
	}

	private BenchmarkCase buildCase(String suiteId, int index, Map<String, Object> caseMap) {
		String where = "suite '" + suiteId + "' case #" + (index + 1);
		String severityId = string(caseMap, "severity", where);
		Severity severity;
		try {
			severity = severityId == null ? Severity.REGRESSION : Severity.fromId(severityId);
		} catch (IllegalArgumentException e) {
			throw new SuiteDefinitionException(where + ": " + e.getMessage(), e);
		}
		Set<String> tags = new LinkedHashSet<>(stringList(caseMap, "tags", where));
		try {
			return new BenchmarkCase(
					string(caseMap, "id", where),
					string(caseMap, "name", where),
					string(caseMap, "question", where),
					string(caseMap, "expected_sql", where),
					string(caseMap, "expected_result_digest", where),
					severity,
					tags);
		} catch (IllegalArgumentException e) {
			throw new SuiteDefinitionException(where + ": " + e.getMessage(), e);
		}
	}

	private String string(Map<String, Object> map, String key, String where) {
		Object value = map.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof Map<?, ?> || value instanceof List<?>) {
			throw new SuiteDefinitionException(where + ": '" + key + "' must be a scalar");
		}
		return value.toString();
	}

	private List<String> stringList(Map<String, Object> map, String key, String where) {
		Object value = map.get(key);
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new SuiteDefinitionException(where + ": '" + key + "' must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}
}
