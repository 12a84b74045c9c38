package org.javai.contextplatform.search;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * {@link SemanticSimilarity} backed by a Spring AI {@link EmbeddingModel}.
 *
 * <p>Similarity is the cosine of the query and document embeddings, clamped to [0, 1].
 * Document embeddings are cached by document key; the cache is cleared once it reaches its
 * size limit. Errors from the model propagate so the index can fall back to keyword search.</p>
 */
public class EmbeddingSemanticSimilarity implements SemanticSimilarity {

	private static final Logger logger = LoggerFactory.getLogger(EmbeddingSemanticSimilarity.class);

	private final EmbeddingModel embeddingModel;
	private final int maxCachedDocuments;
	private final Map<String, float[]> documentVectors = new ConcurrentHashMap<>();
	private volatile QueryVector lastQuery;

	public EmbeddingSemanticSimilarity(EmbeddingModel embeddingModel) {
		this(embeddingModel, SearchConfig.defaults().embeddingCacheSize());
	}

	public EmbeddingSemanticSimilarity(EmbeddingModel embeddingModel, int maxCachedDocuments) {
		this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel must not be null");
		this.maxCachedDocuments = maxCachedDocuments;
	}

	@Override
	public double similarity(String query, String documentKey, String documentText) {
		float[] queryVector = embedQuery(query);
		float[] documentVector = documentVectors.get(documentKey);
		if (documentVector == null) {
			documentVector = embeddingModel.embed(documentText);
			if (documentVectors.size() >= maxCachedDocuments) {
				logger.debug("Embedding cache reached {} entries; clearing", maxCachedDocuments);
				documentVectors.clear();
			}
			documentVectors.put(documentKey, documentVector);
		}
		return Math.max(0.0, cosine(queryVector, documentVector));
	}

	private float[] embedQuery(String query) {
		QueryVector cached = lastQuery;
		if (cached != null && cached.text().equals(query)) {
			return cached.vector();
		}
		float[] vector = embeddingModel.embed(query);
		lastQuery = new QueryVector(query, vector);
		return vector;
	}

	int cachedDocuments() {
		return documentVectors.size();
	}

	static double cosine(float[] a, float[] b) {
		if (a.length != b.length) {
			throw new IllegalArgumentException("Embedding dimensions differ: " + a.length + " vs " + b.length);
		}
		double dot = 0.0;
		double normA = 0.0;
		double normB = 0.0;
		for (int i = 0; i < a.length; i++) {
			dot += a[i] * b[i];
			normA += a[i] * a[i];
			normB += b[i] * b[i];
		}
		if (normA == 0.0 || normB == 0.0) {
			return 0.0;
		}
		return Math.min(1.0, dot / (Math.sqrt(normA) * Math.sqrt(normB)));
	}

	private record QueryVector(String text, float[] vector) {
	}
}
