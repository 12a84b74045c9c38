package org.javai.contextplatform.context;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.lifecycle.LifecycleManager;
import org.javai.contextplatform.search.SearchHit;
import org.javai.contextplatform.search.SearchQuery;
import org.javai.contextplatform.search.SearchResults;
import org.javai.contextplatform.telemetry.ContextKind;
import org.javai.contextplatform.telemetry.TelemetryCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

/**
 * Exposes the published context assets of one connection to an agent.
 *
 * <p>Every asset handed to the agent is recorded as mission reuse.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ContextAssetTool tool = new ContextAssetTool(lifecycleManager, telemetry, "warehouse");
 * chatClient.prompt().user(question).tools(tool).call().content();
 * }</pre>
 */
public class ContextAssetTool {

	private static final Logger logger = LoggerFactory.getLogger(ContextAssetTool.class);

	private final LifecycleManager lifecycleManager;
	private final TelemetryCollector telemetry;
	private final String connectionId;
	private final int limit;

	public ContextAssetTool(LifecycleManager lifecycleManager, TelemetryCollector telemetry, String connectionId) {
		this(lifecycleManager, telemetry, connectionId, SearchQuery.DEFAULT_LIMIT);
	}

	public ContextAssetTool(LifecycleManager lifecycleManager, TelemetryCollector telemetry, String connectionId,
			int limit) {
		this.lifecycleManager = Objects.requireNonNull(lifecycleManager, "lifecycleManager must not be null");
		this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
		this.connectionId = Objects.requireNonNull(connectionId, "connectionId must not be null");
		if (limit <= 0) {
			throw new IllegalArgumentException("limit must be positive");
		}
		this.limit = limit;
	}

	@Tool(name = "searchContextAssets", description = """
			Search curated knowledge about the database: glossary terms, table descriptions,
			instructions and skills. Use this before writing SQL to learn what business terms mean
			and which tables hold the data.
			Returns: asset id, type, key, version, name, description, score and status.
			Hits with status 'deprecated' or 'superseded' carry a warning; prefer active hits.""")
	public List<AssetSummary> searchContextAssets(
			@ToolParam(description = "What to look for, in plain words, e.g. 'monthly revenue'") String query) {
		if (query == null || query.isBlank()) {
			return List.of();
		}
		// filter by state inside the index so drafts and verified assets never take up the limit
		SearchQuery base = SearchQuery.of(connectionId, query, limit);
		List<SearchHit> candidates = new ArrayList<>();
		for (LifecycleState state : List.of(LifecycleState.PUBLISHED, LifecycleState.DEPRECATED)) {
			SearchResults results = lifecycleManager.search(base.withState(state));
			if (results.degraded()) {
				logger.debug("Context asset search for '{}' ran degraded: {}", query, results.warning());
			}
			candidates.addAll(results.hits());
		}
		List<SearchHit> visible = candidates.stream()
				.sorted(SearchHit.RANKING)
				.limit(limit)
				.toList();
		visible.forEach(hit -> telemetry.record(hit.asset().id(), hit.asset().version(), ContextKind.MISSION));
		return visible.stream().map(AssetSummary::from).toList();
	}

	@Tool(name = "getContextAsset", description = """
			Get the full content of one context asset by type and key, for example
			type 'glossary' and key 'revenue'. Returns the current published version,
			or null if there is none.""")
	public AssetDetail getContextAsset(
			@ToolParam(description = "Asset type: glossary, table_description, instruction or skill") String assetType,
			@ToolParam(description = "Canonical key of the asset") String canonicalKey) {
		if (canonicalKey == null || canonicalKey.isBlank()) {
			return null;
		}
		AssetType type;
		try {
			type = AssetType.fromId(assetType);
		} catch (IllegalArgumentException e) {
			logger.debug("Agent asked for unknown asset type '{}'", assetType);
			return null;
		}
		return lifecycleManager.current(AssetKey.of(connectionId, type, canonicalKey))
				.filter(asset -> asset.lifecycleState() == LifecycleState.PUBLISHED)
				.map(asset -> {
					telemetry.record(asset.id(), asset.version(), ContextKind.MISSION);
					return AssetDetail.from(asset);
				})
				.orElse(null);
	}

	public String connectionId() {
		return connectionId;
	}
}
