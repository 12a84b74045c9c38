package org.javai.contextplatform.search;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a search. A degraded result was produced without the semantic signal and may be
 * incomplete; an empty, non-degraded result genuinely found nothing.
 */
public record SearchResults(List<SearchHit> hits, boolean degraded, String warning) {

	public SearchResults {
		hits = hits == null ? List.of() : List.copyOf(hits);
	}

	public static SearchResults of(List<SearchHit> hits) {
		return new SearchResults(hits, false, null);
	}

	public static SearchResults degraded(List<SearchHit> hits, String warning) {
		return new SearchResults(hits, true, warning);
	}

	public boolean isEmpty() {
		return hits.isEmpty();
	}

	public int size() {
		return hits.size();
	}

	public Optional<SearchHit> first() {
		return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
	}
}
