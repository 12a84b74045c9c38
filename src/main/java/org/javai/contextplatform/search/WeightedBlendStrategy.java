package org.javai.contextplatform.search;

/**
 * Linear blend: {@code keywordWeight * keyword + (1 - keywordWeight) * semantic}.
 */
public class WeightedBlendStrategy implements ScoreBlendStrategy {

	private final double keywordWeight;

	public WeightedBlendStrategy(double keywordWeight) {
		if (keywordWeight < 0.0 || keywordWeight > 1.0) {
			throw new IllegalArgumentException("keywordWeight must be between 0 and 1, got " + keywordWeight);
		}
		this.keywordWeight = keywordWeight;
	}

	public double keywordWeight() {
		return keywordWeight;
	}

	@Override
	public double blend(double keywordScore, double semanticScore) {
		return keywordWeight * keywordScore + (1.0 - keywordWeight) * semanticScore;
	}
}
