package org.javai.contextplatform.benchmark;

import java.time.Duration;
import java.util.Objects;

/**
 * Deployment-wide benchmark settings. {@link RunOptions} override the parallelism and timeouts
 * per run.
 *
 * @param severityWeights scoring weights
 * @param parallelism default worker-pool size per run
 * @param caseTimeout default budget for a whole case
 * @param generationTimeout default budget for one SQL-generation call
 */
public record BenchmarkConfig(SeverityWeights severityWeights, int parallelism, Duration caseTimeout,
		Duration generationTimeout) {

	public static final int DEFAULT_PARALLELISM = 4;
	public static final Duration DEFAULT_CASE_TIMEOUT = Duration.ofSeconds(120);
	public static final Duration DEFAULT_GENERATION_TIMEOUT = Duration.ofSeconds(60);

	public BenchmarkConfig {
		Objects.requireNonNull(severityWeights, "severityWeights must not be null");
		Objects.requireNonNull(caseTimeout, "caseTimeout must not be null");
		Objects.requireNonNull(generationTimeout, "generationTimeout must not be null");
		if (parallelism <= 0) {
			throw new IllegalArgumentException("parallelism must be positive");
		}
		if (caseTimeout.isZero() || caseTimeout.isNegative()) {
			throw new IllegalArgumentException("caseTimeout must be positive");
		}
		if (generationTimeout.isZero() || generationTimeout.isNegative()) {
			throw new IllegalArgumentException("generationTimeout must be positive");
		}
	}

	public static BenchmarkConfig defaults() {
		return new BenchmarkConfig(SeverityWeights.defaults(), DEFAULT_PARALLELISM, DEFAULT_CASE_TIMEOUT,
				DEFAULT_GENERATION_TIMEOUT);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private SeverityWeights severityWeights = SeverityWeights.defaults();
		private int parallelism = DEFAULT_PARALLELISM;
		private Duration caseTimeout = DEFAULT_CASE_TIMEOUT;
		private Duration generationTimeout = DEFAULT_GENERATION_TIMEOUT;

		private Builder() {}

		public Builder severityWeights(SeverityWeights severityWeights) {
			this.severityWeights = severityWeights;
			return this;
		}

		public Builder parallelism(int parallelism) {
			this.parallelism = parallelism;
			return this;
		}

		public Builder caseTimeout(Duration caseTimeout) {
			this.caseTimeout = caseTimeout;
			return this;
		}

		public Builder generationTimeout(Duration generationTimeout) {
			this.generationTimeout = generationTimeout;
			return this;
		}

		public BenchmarkConfig build() {
			return new BenchmarkConfig(severityWeights, parallelism, caseTimeout, generationTimeout);
		}
	}
}
