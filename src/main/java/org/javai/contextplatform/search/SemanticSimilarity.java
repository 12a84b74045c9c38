package org.javai.contextplatform.search;

/**
 * Semantic signal for hybrid search, backed by an embedding model or similar service.
 *
 * <p>Implementations may throw at any time; the index then answers keyword-only.</p>
 */
public interface SemanticSimilarity {

	/**
	 * @param query the query text
	 * @param documentKey stable key for the document's current content, usable as a cache key
	 * @param documentText the document text
	 * @return similarity in [0, 1]
	 */
	double similarity(String query, String documentKey, String documentText);
}
