package org.javai.contextplatform.testsupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.contextplatform.search.SemanticSimilarity;

/**
 * Semantic similarity with fixed scores: a rule fires when the query contains its query term and
 * the document contains its document term. The highest firing rule wins; otherwise the score is 0.
 */
public final class FixedSimilarity implements SemanticSimilarity {

	private final List<Rule> rules = new ArrayList<>();
	private final AtomicInteger calls = new AtomicInteger();
	private volatile RuntimeException failure;

	public FixedSimilarity when(String queryTerm, String documentTerm, double score) {
		rules.add(new Rule(queryTerm.toLowerCase(Locale.ROOT), documentTerm.toLowerCase(Locale.ROOT), score));
		return this;
	}

	public FixedSimilarity failWith(RuntimeException error) {
		this.failure = error;
		return this;
	}

	public FixedSimilarity recover() {
		this.failure = null;
		return this;
	}

	@Override
	public double similarity(String query, String documentKey, String documentText) {
		calls.incrementAndGet();
		if (failure != null) {
			throw failure;
		}
		String q = query.toLowerCase(Locale.ROOT);
		String d = documentText.toLowerCase(Locale.ROOT);
		return rules.stream()
				.filter(r -> q.contains(r.queryTerm()) && d.contains(r.documentTerm()))
				.mapToDouble(Rule::score)
				.max()
				.orElse(0.0);
	}

	public int calls() {
		return calls.get();
	}

	private record Rule(String queryTerm, String documentTerm, double score) {
	}
}
