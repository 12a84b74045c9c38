package org.javai.contextplatform.search;

import java.util.Comparator;
import org.javai.contextplatform.asset.ContextAsset;

/**
 * One ranked search result.
 *
 * @param asset the matching asset version
 * @param score blended score in [0, 1]
 * @param keywordScore lexical signal in [0, 1]
 * @param semanticScore semantic signal in [0, 1], zero when search ran degraded
 * @param matchKind which signals matched
 * @param superseded whether a higher version of the identity is published
 * @param exactMatch whether the query equals the asset's name or canonical key
 */
public record SearchHit(ContextAsset asset, double score, double keywordScore, double semanticScore,
		MatchKind matchKind, boolean superseded, boolean exactMatch) {

	/**
	 * Active hits first, then score, exact matches, lifecycle rank and recency.
	 */
	public static final Comparator<SearchHit> RANKING = Comparator
			.comparing((SearchHit h) -> h.active()).reversed()
			.thenComparing(Comparator.comparingDouble(SearchHit::score).reversed())
			.thenComparing(Comparator.comparing((SearchHit h) -> h.exactMatch()).reversed())
			.thenComparing(Comparator.comparingInt((SearchHit h) -> h.asset().lifecycleState().searchRank()).reversed())
			.thenComparing(Comparator.comparing((SearchHit h) -> h.asset().updatedAt()).reversed());

	public SearchHit(ContextAsset asset, double score, double keywordScore, double semanticScore,
			MatchKind matchKind, boolean superseded) {
		this(asset, score, keywordScore, semanticScore, matchKind, superseded, false);
	}

	public boolean deprecated() {
		return asset.isDeprecated();
	}

	/**
	 * @return {@code false} for retired content callers should not silently rely on
	 */
	public boolean active() {
		return !deprecated() && !superseded;
	}
}
