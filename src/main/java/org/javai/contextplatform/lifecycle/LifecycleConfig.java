package org.javai.contextplatform.lifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the lifecycle manager.
 *
 * @param keyReusePolicy what happens when a deprecated key is created again
 * @param indexRetries additional index attempts after a failed upsert
 * @param indexRetryBackoff pause between index attempts
 */
public record LifecycleConfig(KeyReusePolicy keyReusePolicy, int indexRetries, Duration indexRetryBackoff) {

	public static final int DEFAULT_INDEX_RETRIES = 2;
	public static final Duration DEFAULT_INDEX_RETRY_BACKOFF = Duration.ofMillis(50);

	public LifecycleConfig {
		Objects.requireNonNull(keyReusePolicy, "keyReusePolicy must not be null");
		Objects.requireNonNull(indexRetryBackoff, "indexRetryBackoff must not be null");
		if (indexRetries < 0) {
			throw new IllegalArgumentException("indexRetries must be non-negative");
		}
		if (indexRetryBackoff.isNegative()) {
			throw new IllegalArgumentException("indexRetryBackoff must not be negative");
		}
	}

	public static LifecycleConfig defaults() {
		return new LifecycleConfig(KeyReusePolicy.RELEASE_ON_DEPRECATION, DEFAULT_INDEX_RETRIES,
				DEFAULT_INDEX_RETRY_BACKOFF);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private KeyReusePolicy keyReusePolicy = KeyReusePolicy.RELEASE_ON_DEPRECATION;
		private int indexRetries = DEFAULT_INDEX_RETRIES;
		private Duration indexRetryBackoff = DEFAULT_INDEX_RETRY_BACKOFF;

		private Builder() {}

		public Builder keyReusePolicy(KeyReusePolicy keyReusePolicy) {
			this.keyReusePolicy = keyReusePolicy;
			return this;
		}

		public Builder indexRetries(int indexRetries) {
			this.indexRetries = indexRetries;
			return this;
		}

		public Builder indexRetryBackoff(Duration indexRetryBackoff) {
			this.indexRetryBackoff = indexRetryBackoff;
			return this;
		}

		public LifecycleConfig build() {
			return new LifecycleConfig(keyReusePolicy, indexRetries, indexRetryBackoff);
		}
	}
}
