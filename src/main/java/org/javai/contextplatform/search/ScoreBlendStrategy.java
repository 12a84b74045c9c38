package org.javai.contextplatform.search;

/**
 * Combines the keyword and semantic signals into one ranking score.
 */
@FunctionalInterface
public interface ScoreBlendStrategy {

	/**
	 * @param keywordScore lexical score in [0, 1]
	 * @param semanticScore semantic score in [0, 1]
	 * @return blended score in [0, 1]
	 */
	double blend(double keywordScore, double semanticScore);
}
