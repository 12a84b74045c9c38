package org.javai.contextplatform.search;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.javai.contextplatform.asset.ContextAsset;

/**
 * Field-weighted lexical scoring.
 *
 * <p>Each distinct query term contributes the weight of the strongest field it occurs in
 * (name and canonical key 3, tags 2, description 1.5, content text 1). The sum is divided by the
 * best achievable total, so a query whose every term appears in the name scores 1. A query equal
 * to the asset's name or canonical key, ignoring case, also scores 1.</p>
 *
 * <p>Terms of four or more characters also match field terms they prefix, at half weight, so
 * "revenue" finds "revenues".</p>
 */
public class KeywordScorer {

	static final double NAME_WEIGHT = 3.0;
	static final double KEY_WEIGHT = 3.0;
	static final double TAG_WEIGHT = 2.0;
	static final double DESCRIPTION_WEIGHT = 1.5;
	static final double CONTENT_WEIGHT = 1.0;

	private static final double MAX_WEIGHT = NAME_WEIGHT;
	private static final int MIN_PREFIX_LENGTH = 4;

	private static final Set<String> STOP_WORDS = Set.of(
			"a", "an", "and", "are", "by", "for", "how", "in", "is", "me", "of", "on", "or", "show",
			"the", "to", "what", "which", "with");

	public double score(String query, ContextAsset asset) {
		String normalizedQuery = normalize(query);
		if (normalizedQuery.isEmpty()) {
			return 0.0;
		}
		if (isExactMatch(query, asset)) {
			return 1.0;
		}
		Set<String> terms = tokenize(query);
		if (terms.isEmpty()) {
			return 0.0;
		}
		List<WeightedField> fields = List.of(
				new WeightedField(tokenize(asset.name()), NAME_WEIGHT),
				new WeightedField(tokenize(asset.canonicalKey()), KEY_WEIGHT),
				new WeightedField(tokenize(String.join(" ", asset.tags())), TAG_WEIGHT),
				new WeightedField(tokenize(asset.description()), DESCRIPTION_WEIGHT),
				new WeightedField(tokenize(asset.contentText()), CONTENT_WEIGHT));
		double total = 0.0;
		for (String term : terms) {
			double best = 0.0;
			for (WeightedField field : fields) {
				best = Math.max(best, field.match(term));
			}
			total += best;
		}
		return Math.min(1.0, total / (terms.size() * MAX_WEIGHT));
	}

	/**
	 * Whether the query equals the asset's name or canonical key, ignoring case and surrounding
	 * whitespace.
	 */
	public boolean isExactMatch(String query, ContextAsset asset) {
		String normalizedQuery = normalize(query);
		return !normalizedQuery.isEmpty()
				&& (normalizedQuery.equals(normalize(asset.name())) || normalizedQuery.equals(normalize(asset.canonicalKey())));
	}

	/**
	 * Lower-cased alphanumeric terms without stop words, in first-seen order.
	 */
	public static Set<String> tokenize(String text) {
		Set<String> terms = new LinkedHashSet<>();
		if (text == null) {
			return terms;
		}
		for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
			if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
				terms.add(token);
			}
		}
		return terms;
	}

	private static String normalize(String text) {
		return text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
	}

	private record WeightedField(Set<String> terms, double weight) {

		double match(String term) {
			if (terms.contains(term)) {
				return weight;
			}
			if (term.length() >= MIN_PREFIX_LENGTH) {
				for (String candidate : terms) {
					if (candidate.startsWith(term)) {
						return weight / 2;
					}
				}
			}
			return 0.0;
		}
	}
}
