package org.javai.contextplatform.search;

/**
 * Configuration for hybrid search.
 *
 * @param keywordWeight weight of the keyword signal in the default blend, in [0, 1]
 * @param semanticThreshold minimum semantic similarity that counts as a semantic match
 * @param defaultLimit hit limit used by callers that do not supply one
 * @param embeddingCacheSize maximum number of cached document embeddings
 */
public record SearchConfig(double keywordWeight, double semanticThreshold, int defaultLimit, int embeddingCacheSize) {

	public SearchConfig {
		if (keywordWeight < 0.0 || keywordWeight > 1.0) {
			throw new IllegalArgumentException("keywordWeight must be between 0 and 1");
		}
		if (semanticThreshold < 0.0 || semanticThreshold > 1.0) {
			throw new IllegalArgumentException("semanticThreshold must be between 0 and 1");
		}
		if (defaultLimit <= 0) {
			throw new IllegalArgumentException("defaultLimit must be positive");
		}
		if (embeddingCacheSize <= 0) {
			throw new IllegalArgumentException("embeddingCacheSize must be positive");
		}
	}

	public static SearchConfig defaults() {
		return new SearchConfig(0.5, 0.35, SearchQuery.DEFAULT_LIMIT, 10_000);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private double keywordWeight = 0.5;
		private double semanticThreshold = 0.35;
		private int defaultLimit = SearchQuery.DEFAULT_LIMIT;
		private int embeddingCacheSize = 10_000;

		public Builder keywordWeight(double value) {
			this.keywordWeight = value;
			return this;
		}

		public Builder semanticThreshold(double value) {
			this.semanticThreshold = value;
			return this;
		}

		public Builder defaultLimit(int value) {
			this.defaultLimit = value;
			return this;
		}

		public Builder embeddingCacheSize(int value) {
			this.embeddingCacheSize = value;
			return this;
		}

		public SearchConfig build() {
			return new SearchConfig(keywordWeight, semanticThreshold, defaultLimit, embeddingCacheSize);
		}
	}
}
