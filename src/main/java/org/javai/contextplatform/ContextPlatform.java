package org.javai.contextplatform;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;
import javax.sql.DataSource;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.TagCatalog;
import org.javai.contextplatform.asset.store.AssetStore;
import org.javai.contextplatform.asset.store.InMemoryAssetStore;
import org.javai.contextplatform.asset.store.JsonFileAssetStore;
import org.javai.contextplatform.benchmark.BenchmarkEngine;
import org.javai.contextplatform.benchmark.BenchmarkRepository;
import org.javai.contextplatform.benchmark.ChatClientSqlGenerator;
import org.javai.contextplatform.benchmark.DefaultBenchmarkEngine;
import org.javai.contextplatform.benchmark.InMemoryBenchmarkRepository;
import org.javai.contextplatform.benchmark.JdbcSqlExecutor;
import org.javai.contextplatform.benchmark.SqlExecutor;
import org.javai.contextplatform.benchmark.SqlGenerator;
import org.javai.contextplatform.config.ContextPlatformConfig;
import org.javai.contextplatform.context.ContextAssetTool;
import org.javai.contextplatform.context.SqlContextFormatter;
import org.javai.contextplatform.lifecycle.DefaultLifecycleManager;
import org.javai.contextplatform.lifecycle.LifecycleManager;
import org.javai.contextplatform.search.EmbeddingSemanticSimilarity;
import org.javai.contextplatform.search.InMemorySearchIndex;
import org.javai.contextplatform.search.SearchIndex;
import org.javai.contextplatform.search.SemanticSimilarity;
import org.javai.contextplatform.telemetry.InMemoryTelemetryEventLog;
import org.javai.contextplatform.telemetry.QueueingTelemetryCollector;
import org.javai.contextplatform.telemetry.TelemetryCollector;
import org.javai.contextplatform.telemetry.TelemetryEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * A wired platform instance: asset store, tag catalog, search index, telemetry, lifecycle
 * manager and, when SQL collaborators are supplied, the benchmark engine.
 *
 * <pre>{@code
 * try (ContextPlatform platform = ContextPlatform.builder()
 *         .config(new ContextPlatformConfigLoader().loadDefault())
 *         .embeddingModel(embeddingModel)
 *         .chatClient(chatClient)
 *         .dataSources(connectionId -> dataSources.get(connectionId))
 *         .build()) {
 *     platform.lifecycleManager().create(...);
 * }
 * }</pre>
 */
public final class ContextPlatform implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ContextPlatform.class);

	private final ContextPlatformConfig config;
	private final AssetStore assetStore;
	private final TagCatalog tagCatalog;
	private final SearchIndex searchIndex;
	private final QueueingTelemetryCollector telemetry;
	private final DefaultLifecycleManager lifecycleManager;
	private final DefaultBenchmarkEngine benchmarkEngine;

	private ContextPlatform(Builder builder) {
		this.config = builder.config;
		this.assetStore = builder.assetStore != null ? builder.assetStore
				: config.storeDirectory() != null ? new JsonFileAssetStore(config.storeDirectory())
						: new InMemoryAssetStore();
		this.tagCatalog = builder.tagCatalog != null ? builder.tagCatalog : new TagCatalog();

		SemanticSimilarity similarity = builder.semanticSimilarity;
		if (similarity == null && builder.embeddingModel != null) {
			similarity = new EmbeddingSemanticSimilarity(builder.embeddingModel, config.search().embeddingCacheSize());
		}
		this.searchIndex = new InMemorySearchIndex(tagCatalog, similarity, config.search());

		TelemetryEventLog eventLog = builder.telemetryEventLog != null ? builder.telemetryEventLog
				: new InMemoryTelemetryEventLog();
		this.telemetry = new QueueingTelemetryCollector(
				assetId -> assetStore.findById(assetId).map(ContextAsset::key),
				eventLog, config.telemetry(), builder.clock);
		this.lifecycleManager = new DefaultLifecycleManager(assetStore, searchIndex, config.lifecycle(), builder.clock);

		SqlGenerator generator = builder.sqlGenerator;
		if (generator == null && builder.chatClient != null) {
			generator = new ChatClientSqlGenerator(builder.chatClient);
		}
		SqlExecutor executor = builder.sqlExecutor;
		if (executor == null && builder.dataSources != null) {
			executor = new JdbcSqlExecutor(builder.dataSources);
		}
		if (generator != null && executor != null) {
			BenchmarkRepository repository = builder.benchmarkRepository != null ? builder.benchmarkRepository
					: new InMemoryBenchmarkRepository();
			this.benchmarkEngine = new DefaultBenchmarkEngine(repository, assetStore, generator, executor, telemetry,
					config.benchmark(), builder.clock);
		} else {
			this.benchmarkEngine = null;
		}

		for (String connectionId : assetStore.connectionIds()) {
			lifecycleManager.reindex(connectionId);
		}
		logger.info("Context platform started (store={}, semantic search={}, benchmarks={})",
				assetStore.getClass().getSimpleName(), similarity != null, benchmarkEngine != null);
	}

	public static Builder builder() {
		return new Builder();
	}

	public ContextPlatformConfig config() {
		return config;
	}

	public AssetStore assetStore() {
		return assetStore;
	}

	public TagCatalog tagCatalog() {
		return tagCatalog;
	}

	public SearchIndex searchIndex() {
		return searchIndex;
	}

	public TelemetryCollector telemetry() {
		return telemetry;
	}

	public LifecycleManager lifecycleManager() {
		return lifecycleManager;
	}

	/**
	 * @throws IllegalStateException if the platform was built without a SQL generator and executor
	 */
	public BenchmarkEngine benchmarkEngine() {
		if (benchmarkEngine == null) {
			throw new IllegalStateException(
					"Benchmarks need a SqlGenerator (or ChatClient) and a SqlExecutor (or data sources)");
		}
		return benchmarkEngine;
	}

	public boolean benchmarksEnabled() {
		return benchmarkEngine != null;
	}

	public ContextAssetTool contextAssetTool(String connectionId) {
		return new ContextAssetTool(lifecycleManager, telemetry, connectionId, config.search().defaultLimit());
	}

	public SqlContextFormatter sqlContextFormatter() {
		return new SqlContextFormatter(lifecycleManager);
	}

	@Override
	public void close() {
		if (benchmarkEngine != null) {
			benchmarkEngine.close();
		}
		telemetry.close();
		logger.info("Context platform stopped");
	}

	public static final class Builder {
		private ContextPlatformConfig config = ContextPlatformConfig.defaults();
		private AssetStore assetStore;
		private TagCatalog tagCatalog;
		private SemanticSimilarity semanticSimilarity;
		private EmbeddingModel embeddingModel;
		private TelemetryEventLog telemetryEventLog;
		private SqlGenerator sqlGenerator;
		private ChatClient chatClient;
		private SqlExecutor sqlExecutor;
		private Function<String, DataSource> dataSources;
		private BenchmarkRepository benchmarkRepository;
		private Clock clock = Clock.systemUTC();

		private Builder() {}

		public Builder config(ContextPlatformConfig config) {
			this.config = Objects.requireNonNull(config, "config must not be null");
			return this;
		}

		/**
		 * Uses this store instead of the one named by the configuration.
		 */
		public Builder assetStore(AssetStore assetStore) {
			this.assetStore = assetStore;
			return this;
		}

		public Builder tagCatalog(TagCatalog tagCatalog) {
			this.tagCatalog = tagCatalog;
			return this;
		}

		public Builder semanticSimilarity(SemanticSimilarity semanticSimilarity) {
			this.semanticSimilarity = semanticSimilarity;
			return this;
		}

		/**
		 * Enables semantic search through Spring AI embeddings. Ignored if a
		 * {@link #semanticSimilarity(SemanticSimilarity)} is set.
		 */
		public Builder embeddingModel(EmbeddingModel embeddingModel) {
			this.embeddingModel = embeddingModel;
			return this;
		}

		public Builder telemetryEventLog(TelemetryEventLog telemetryEventLog) {
			this.telemetryEventLog = telemetryEventLog;
			return this;
		}

		public Builder sqlGenerator(SqlGenerator sqlGenerator) {
			this.sqlGenerator = sqlGenerator;
			return this;
		}

		/**
		 * Generates benchmark SQL with this client. Ignored if a {@link #sqlGenerator(SqlGenerator)} is set.
		 */
		public Builder chatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		public Builder sqlExecutor(SqlExecutor sqlExecutor) {
			this.sqlExecutor = sqlExecutor;
			return this;
		}

		/**
		 * Executes benchmark SQL over JDBC. Ignored if a {@link #sqlExecutor(SqlExecutor)} is set.
		 */
		public Builder dataSources(Function<String, DataSource> dataSources) {
			this.dataSources = dataSources;
			return this;
		}

		public Builder benchmarkRepository(BenchmarkRepository benchmarkRepository) {
			this.benchmarkRepository = benchmarkRepository;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock must not be null");
			return this;
		}

		public ContextPlatform build() {
			return new ContextPlatform(this);
		}
	}
}
