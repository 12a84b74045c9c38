package org.javai.contextplatform.telemetry;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link QueueingTelemetryCollector}.
 *
 * @param queueCapacity events buffered before new ones are dropped
 * @param batchSize maximum events applied per drain
 * @param drainInterval delay between drains
 * @param reconcileInterval delay between reconciliations of the counters against the event log
 */
public record TelemetryConfig(int queueCapacity, int batchSize, Duration drainInterval, Duration reconcileInterval) {

	public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
	public static final int DEFAULT_BATCH_SIZE = 500;
	public static final Duration DEFAULT_DRAIN_INTERVAL = Duration.ofMillis(200);
	public static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofMinutes(5);

	public TelemetryConfig {
		Objects.requireNonNull(drainInterval, "drainInterval must not be null");
		Objects.requireNonNull(reconcileInterval, "reconcileInterval must not be null");
		if (queueCapacity <= 0) {
			throw new IllegalArgumentException("queueCapacity must be positive");
		}
		if (batchSize <= 0) {
			throw new IllegalArgumentException("batchSize must be positive");
		}
		if (drainInterval.isZero() || drainInterval.isNegative()) {
			throw new IllegalArgumentException("drainInterval must be positive");
		}
		if (reconcileInterval.isZero() || reconcileInterval.isNegative()) {
			throw new IllegalArgumentException("reconcileInterval must be positive");
		}
	}

	public static TelemetryConfig defaults() {
		return new TelemetryConfig(DEFAULT_QUEUE_CAPACITY, DEFAULT_BATCH_SIZE, DEFAULT_DRAIN_INTERVAL,
				DEFAULT_RECONCILE_INTERVAL);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
		private int batchSize = DEFAULT_BATCH_SIZE;
		private Duration drainInterval = DEFAULT_DRAIN_INTERVAL;
		private Duration reconcileInterval = DEFAULT_RECONCILE_INTERVAL;

		private Builder() {}

		public Builder queueCapacity(int queueCapacity) {
			this.queueCapacity = queueCapacity;
			return this;
		}

		public Builder batchSize(int batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		public Builder drainInterval(Duration drainInterval) {
			this.drainInterval = drainInterval;
			return this;
		}

		public Builder reconcileInterval(Duration reconcileInterval) {
			this.reconcileInterval = reconcileInterval;
			return this;
		}

		public TelemetryConfig build() {
			return new TelemetryConfig(queueCapacity, batchSize, drainInterval, reconcileInterval);
		}
	}
}
