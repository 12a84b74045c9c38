package org.javai.contextplatform.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.TagCatalog;
import org.javai.contextplatform.asset.TagCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory hybrid {@link SearchIndex}.
 *
 * <p>Every candidate in the connection is scored by the {@link KeywordScorer} and, when a
 * {@link SemanticSimilarity} is configured, by the semantic collaborator; the two are combined
 * by the {@link ScoreBlendStrategy}. A candidate is a hit when it matched at least one signal.</p>
 *
 * <p>Ranking: active versions before deprecated or superseded ones, then blended score, then
 * lifecycle rank (published &gt; verified &gt; draft &gt; deprecated), then most recently updated.</p>
 *
 * <p>If the semantic collaborator throws, the query is answered from the keyword signal alone and
 * the results are flagged as degraded.</p>
 */
public class InMemorySearchIndex implements SearchIndex {

	private static final Logger logger = LoggerFactory.getLogger(InMemorySearchIndex.class);

	private final ConcurrentHashMap<String, IndexedAsset> entries = new ConcurrentHashMap<>();
	private final TagCatalog tagCatalog;
	private final SemanticSimilarity semanticSimilarity;
	private final ScoreBlendStrategy blendStrategy;
	private final double semanticThreshold;
	private final KeywordScorer keywordScorer = new KeywordScorer();

	/**
	 * Creates a keyword-only index.
	 */
	public InMemorySearchIndex(TagCatalog tagCatalog) {
		this(tagCatalog, null, SearchConfig.defaults());
	}

	public InMemorySearchIndex(TagCatalog tagCatalog, SemanticSimilarity semanticSimilarity, SearchConfig config) {
		this(tagCatalog, semanticSimilarity, new WeightedBlendStrategy(config.keywordWeight()), config.semanticThreshold());
	}

	/**
	 * @param semanticSimilarity semantic collaborator, or {@code null} for keyword-only search
	 */
	public InMemorySearchIndex(TagCatalog tagCatalog, SemanticSimilarity semanticSimilarity,
			ScoreBlendStrategy blendStrategy, double semanticThreshold) {
		this.tagCatalog = Objects.requireNonNull(tagCatalog, "tagCatalog must not be null");
		this.semanticSimilarity = semanticSimilarity;
		this.blendStrategy = Objects.requireNonNull(blendStrategy, "blendStrategy must not be null");
		this.semanticThreshold = semanticThreshold;
	}

	@Override
	public void upsert(IndexedAsset entry) {
		Objects.requireNonNull(entry, "entry must not be null");
		entries.compute(entry.assetId(), (id, existing) -> {
			if (existing != null && existing.revision() > entry.revision()) {
				logger.debug("Ignoring stale index upsert for {} (indexed rev={}, offered rev={})",
						id, existing.revision(), entry.revision());
				return existing;
			}
			return entry;
		});
	}

	@Override
	public boolean remove(String assetId) {
		return entries.remove(assetId) != null;
	}

	@Override
	public Optional<IndexedAsset> get(String assetId) {
		return Optional.ofNullable(entries.get(assetId));
	}

	@Override
	public SearchResults search(SearchQuery query) {
		Objects.requireNonNull(query, "query must not be null");
		List<IndexedAsset> candidates = entries.values().stream()
				.filter(e -> e.asset().connectionId().equals(query.connectionId()))
				.filter(e -> query.assetType() == null || e.asset().assetType() == query.assetType())
				.filter(e -> query.state() == null || e.asset().lifecycleState() == query.state())
				.filter(e -> query.includeInactive() || e.isActive())
				.toList();

		boolean semanticAvailable = semanticSimilarity != null;
		String warning = null;
		List<SearchHit> hits = new ArrayList<>();
		for (IndexedAsset candidate : candidates) {
			ContextAsset asset = candidate.asset();
			double keyword = keywordScorer.score(query.text(), asset);
			double semantic = 0.0;
			if (semanticAvailable) {
				try {
					semantic = semanticSimilarity.similarity(query.text(), candidate.cacheKey(), searchableText(asset));
				} catch (RuntimeException e) {
					semanticAvailable = false;
					warning = "Semantic search unavailable, results are keyword-only: " + e.getMessage();
					logger.warn("Semantic similarity failed for query '{}' on connection {}; degrading to keyword search",
							query.text(), query.connectionId(), e);
				}
			}
			boolean exact = keywordScorer.isExactMatch(query.text(), asset);
			toHit(candidate, keyword, semantic, semanticAvailable, exact).ifPresent(hits::add);
		}

		boolean degraded = warning != null;
		if (degraded) {
			// hits scored before the failure carry a semantic component; rescore them uniformly
			hits.replaceAll(h -> new SearchHit(h.asset(), h.keywordScore(), h.keywordScore(), 0.0, MatchKind.KEYWORD,
					h.superseded(), h.exactMatch()));
			hits.removeIf(h -> h.keywordScore() <= 0.0);
		}
		List<SearchHit> ranked = hits.stream()
				.sorted(SearchHit.RANKING)
				.limit(query.limit())
				.toList();
		return degraded ? SearchResults.degraded(ranked, warning) : SearchResults.of(ranked);
	}

	private Optional<SearchHit> toHit(IndexedAsset candidate, double keyword, double semantic, boolean semanticUsed,
			boolean exact) {
		boolean keywordMatch = keyword > 0.0;
		boolean semanticMatch = semanticUsed && semantic >= semanticThreshold;
		if (!keywordMatch && !semanticMatch) {
			return Optional.empty();
		}
		MatchKind kind = keywordMatch && semanticMatch ? MatchKind.BOTH
				: keywordMatch ? MatchKind.KEYWORD : MatchKind.SEMANTIC;
		// an exact name or key match is never blended down
		double score = exact ? 1.0 : semanticUsed ? blendStrategy.blend(keyword, semantic) : keyword;
		return Optional.of(new SearchHit(candidate.asset(), score, keyword, semantic, kind, candidate.superseded(),
				exact));
	}

	private static String searchableText(ContextAsset asset) {
		return asset.name() + "\n" + asset.description() + "\n" + asset.contentText();
	}

	@Override
	public List<TagUsage> tags(String connectionId, TagCategory category) {
		Map<String, Set<AssetKey>> identitiesByTag = new HashMap<>();
		for (IndexedAsset entry : entries.values()) {
			if (!entry.isActive()) {
				continue;
			}
			if (connectionId != null && !entry.asset().connectionId().equals(connectionId)) {
				continue;
			}
			for (String tag : entry.asset().tags()) {
				String normalized = tag.trim().toLowerCase(Locale.ROOT);
				if (!normalized.isEmpty()) {
					identitiesByTag.computeIfAbsent(normalized, t -> new HashSet<>()).add(entry.asset().key());
				}
			}
		}
		return identitiesByTag.entrySet().stream()
				.map(e -> new TagUsage(e.getKey(), tagCatalog.categoryOf(e.getKey()), e.getValue().size()))
				.filter(usage -> category == null || usage.category() == category)
				.sorted(Comparator.comparingInt(TagUsage::usageCount).reversed().thenComparing(TagUsage::tag))
				.toList();
	}

	@Override
	public void clear(String connectionId) {
		entries.values().removeIf(e -> e.asset().connectionId().equals(connectionId));
	}

	@Override
	public int size() {
		return entries.size();
	}
}
