package org.javai.contextplatform.config;

import java.nio.file.Path;
import org.javai.contextplatform.benchmark.BenchmarkConfig;
import org.javai.contextplatform.lifecycle.LifecycleConfig;
import org.javai.contextplatform.search.SearchConfig;
import org.javai.contextplatform.telemetry.TelemetryConfig;

/**
 * Configuration of a whole platform instance.
 *
 * @param storeDirectory root of the file-backed asset store, or {@code null} to keep assets in memory
 */
public record ContextPlatformConfig(
		Path storeDirectory,
		LifecycleConfig lifecycle,
		SearchConfig search,
		TelemetryConfig telemetry,
		BenchmarkConfig benchmark) {

	public ContextPlatformConfig {
		lifecycle = lifecycle != null ? lifecycle : LifecycleConfig.defaults();
		search = search != null ? search : SearchConfig.defaults();
		telemetry = telemetry != null ? telemetry : TelemetryConfig.defaults();
		benchmark = benchmark != null ? benchmark : BenchmarkConfig.defaults();
	}

	public static ContextPlatformConfig defaults() {
		return new ContextPlatformConfig(null, null, null, null, null);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private Path storeDirectory;
		private LifecycleConfig lifecycle = LifecycleConfig.defaults();
		private SearchConfig search = SearchConfig.defaults();
		private TelemetryConfig telemetry = TelemetryConfig.defaults();
		private BenchmarkConfig benchmark = BenchmarkConfig.defaults();

		private Builder() {}

		public Builder storeDirectory(Path storeDirectory) {
			this.storeDirectory = storeDirectory;
			return this;
		}

		public Builder lifecycle(LifecycleConfig lifecycle) {
			this.lifecycle = lifecycle;
			return this;
		}

		public Builder search(SearchConfig search) {
			this.search = search;
			return this;
		}

		public Builder telemetry(TelemetryConfig telemetry) {
			this.telemetry = telemetry;
			return this;
		}

		public Builder benchmark(BenchmarkConfig benchmark) {
			this.benchmark = benchmark;
			return this;
		}

		public ContextPlatformConfig build() {
			return new ContextPlatformConfig(storeDirectory, lifecycle, search, telemetry, benchmark);
		}
	}
}
