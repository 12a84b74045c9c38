package org.javai.contextplatform.search;

/**
 * Which signals matched a search hit.
 */
public enum MatchKind {
	SEMANTIC,
	KEYWORD,
	BOTH
}
