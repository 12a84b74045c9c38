package org.javai.contextplatform.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.contextplatform.benchmark.BenchmarkConfig;
import org.javai.contextplatform.benchmark.Severity;
import org.javai.contextplatform.benchmark.SeverityWeights;
import org.javai.contextplatform.lifecycle.KeyReusePolicy;
import org.javai.contextplatform.lifecycle.LifecycleConfig;
import org.javai.contextplatform.search.SearchConfig;
import org.javai.contextplatform.telemetry.TelemetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link ContextPlatformConfig} from YAML.
 *
 * <p>Every section and key is optional; missing values keep their defaults and unknown keys are
 * ignored. Durations are written as {@code 250ms}, {@code 30s}, {@code 5m}, {@code 1h}, ISO-8601
 * ({@code PT30S}) or a bare number of milliseconds. A malformed value raises
 * {@link IllegalArgumentException} naming its key, e.g. {@code telemetry.batch_size}.</p>
 *
 * <pre>{@code
 * store:
 *   directory: /var/lib/context-assets
 * lifecycle:
 *   key_reuse_policy: reserved
 * search:
 *   keyword_weight: 0.6
 * telemetry:
 *   drain_interval: 100ms
 * benchmark:
 *   parallelism: 8
 *   severity_weights: { critical: 3 }
 * }</pre>
 */
public class ContextPlatformConfigLoader {

	public static final String DEFAULT_RESOURCE = "context-platform.yml";

	private static final Logger logger = LoggerFactory.getLogger(ContextPlatformConfigLoader.class);
	private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if there is none.
	 */
	public ContextPlatformConfig loadDefault() {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = ContextPlatformConfigLoader.class.getClassLoader();
		}
		InputStream stream = classLoader.getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			logger.debug("No {} on the classpath; using defaults", DEFAULT_RESOURCE);
			return ContextPlatformConfig.defaults();
		}
		try (stream) {
			return load(stream);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public ContextPlatformConfig load(Path path) {
		try (InputStream stream = Files.newInputStream(path)) {
			return load(stream);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read configuration from " + path, e);
		}
	}

	public ContextPlatformConfig load(InputStream inputStream) {
		Object data;
		try {
			data = yaml.load(inputStream);
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Configuration is not valid YAML: " + e.getMessage(), e);
		}
		return build(data);
	}

	public ContextPlatformConfig loadString(String yamlContent) {
		Object data;
		try {
			data = yaml.load(yamlContent);
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Configuration is not valid YAML: " + e.getMessage(), e);
		}
		return build(data);
	}

	private ContextPlatformConfig build(Object data) {
		if (data == null) {
			return ContextPlatformConfig.defaults();
		}
		Map<String, Object> root = asMap(data, "<root>");
		ContextPlatformConfig.Builder builder = ContextPlatformConfig.builder();

		Map<String, Object> store = section(root, "store");
		String directory = string(store, "store", "directory");
		if (directory != null && !directory.isBlank()) {
			builder.storeDirectory(Path.of(directory));
		}
		builder.lifecycle(lifecycle(section(root, "lifecycle")));
		builder.search(search(section(root, "search")));
		builder.telemetry(telemetry(section(root, "telemetry")));
		builder.benchmark(benchmark(section(root, "benchmark")));
		return builder.build();
	}

	private LifecycleConfig lifecycle(Map<String, Object> map) {
		LifecycleConfig.Builder builder = LifecycleConfig.builder();
		String policy = string(map, "lifecycle", "key_reuse_policy");
		if (policy != null) {
			builder.keyReusePolicy(enumValue(KeyReusePolicy.class, policy, "lifecycle.key_reuse_policy"));
		}
		Integer retries = integer(map, "lifecycle", "index_retries");
		if (retries != null) {
			builder.indexRetries(retries);
		}
		Duration backoff = duration(map, "lifecycle", "index_retry_backoff");
		if (backoff != null) {
			builder.indexRetryBackoff(backoff);
		}
		return validated("lifecycle", builder::build);
	}

	private SearchConfig search(Map<String, Object> map) {
		SearchConfig.Builder builder = SearchConfig.builder();
		Double keywordWeight = number(map, "search", "keyword_weight");
		if (keywordWeight != null) {
			builder.keywordWeight(keywordWeight);
		}
		Double threshold = number(map, "search", "semantic_threshold");
		if (threshold != null) {
			builder.semanticThreshold(threshold);
		}
		Integer limit = integer(map, "search", "default_limit");
		if (limit != null) {
			builder.defaultLimit(limit);
		}
		Integer cacheSize = integer(map, "search", "embedding_cache_size");
		if (cacheSize != null) {
			builder.embeddingCacheSize(cacheSize);
		}
		return validated("search", builder::build);
	}

	private TelemetryConfig telemetry(Map<String, Object> map) {
		TelemetryConfig.Builder builder = TelemetryConfig.builder();
		Integer capacity = integer(map, "telemetry", "queue_capacity");
		if (capacity != null) {
			builder.queueCapacity(capacity);
		}
		Integer batchSize = integer(map, "telemetry", "batch_size");
		if (batchSize != null) {
			builder.batchSize(batchSize);
		}
		Duration drain = duration(map, "telemetry", "drain_interval");
		if (drain != null) {
			builder.drainInterval(drain);
		}
		Duration reconcile = duration(map, "telemetry", "reconcile_interval");
		if (reconcile != null) {
			builder.reconcileInterval(reconcile);
		}
		return validated("telemetry", builder::build);
	}

	private BenchmarkConfig benchmark(Map<String, Object> map) {
		BenchmarkConfig.Builder builder = BenchmarkConfig.builder();
		Integer parallelism = integer(map, "benchmark", "parallelism");
		if (parallelism != null) {
			builder.parallelism(parallelism);
		}
		Duration caseTimeout = duration(map, "benchmark", "case_timeout");
		if (caseTimeout != null) {
			builder.caseTimeout(caseTimeout);
		}
		Duration generationTimeout = duration(map, "benchmark", "generation_timeout");
		if (generationTimeout != null) {
			builder.generationTimeout(generationTimeout);
		}
		Map<String, Object> weights = section(map, "benchmark", "severity_weights");
		if (!weights.isEmpty()) {
			Map<Severity, Double> parsed = new EnumMap<>(Severity.class);
			for (String name : weights.keySet()) {
				String key = "benchmark.severity_weights." + name;
				Severity severity;
				try {
					severity = Severity.fromId(name);
				} catch (IllegalArgumentException e) {
					throw new IllegalArgumentException(key + ": " + e.getMessage(), e);
				}
				parsed.put(severity, number(weights, "benchmark.severity_weights", name));
			}
			builder.severityWeights(validated("benchmark.severity_weights", () -> new SeverityWeights(parsed)));
		}
		return validated("benchmark", builder::build);
	}

	private Map<String, Object> section(Map<String, Object> parent, String name) {
		return section(parent, null, name);
	}

	private Map<String, Object> section(Map<String, Object> parent, String parentKey, String name) {
		Object value = parent.get(name);
		if (value == null) {
			return Map.of();
		}
		return asMap(value, parentKey == null ? name : parentKey + "." + name);
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> asMap(Object value, String key) {
		if (!(value instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException(key + ": expected a mapping but got '" + value + "'");
		}
		return (Map<String, Object>) map;
	}

	private String string(Map<String, Object> map, String section, String name) {
		Object value = map.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
			throw new IllegalArgumentException(section + "." + name + ": expected a scalar value");
		}
		return value.toString().trim();
	}

	private Integer integer(Map<String, Object> map, String section, String name) {
		String value = string(map, section, name);
		if (value == null) {
			return null;
		}
		try {
			return Integer.valueOf(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(section + "." + name + ": expected an integer but got '" + value + "'", e);
		}
	}

	private Double number(Map<String, Object> map, String section, String name) {
		String value = string(map, section, name);
		if (value == null) {
			return null;
		}
		try {
			return Double.valueOf(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(section + "." + name + ": expected a number but got '" + value + "'", e);
		}
	}

	private Duration duration(Map<String, Object> map, String section, String name) {
		String value = string(map, section, name);
		if (value == null) {
			return null;
		}
		String key = section + "." + name;
		String text = value.toLowerCase(Locale.ROOT);
		if (text.chars().allMatch(Character::isDigit) && !text.isEmpty()) {
			return Duration.ofMillis(Long.parseLong(text));
		}
		Matcher matcher = DURATION_PATTERN.matcher(text);
		if (matcher.matches()) {
			long amount = Long.parseLong(matcher.group(1));
			return switch (matcher.group(2)) {
				case "ms" -> Duration.ofMillis(amount);
				case "s" -> Duration.ofSeconds(amount);
				case "m" -> Duration.ofMinutes(amount);
				case "h" -> Duration.ofHours(amount);
				default -> Duration.ofDays(amount);
			};
		}
		try {
			return Duration.parse(value);
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException(key + ": expected a duration such as 250ms, 30s or PT30S but got '"
					+ value + "'", e);
		}
	}

	private <E extends Enum<E>> E enumValue(Class<E> type, String value, String key) {
		try {
			return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(key + ": unknown value '" + value + "'", e);
		}
	}

	private <T> T validated(String section, Supplier<T> factory) {
		try {
			return factory.get();
		} catch (IllegalArgumentException | NullPointerException e) {
			throw new IllegalArgumentException(section + ": " + e.getMessage(), e);
		}
	}
}
