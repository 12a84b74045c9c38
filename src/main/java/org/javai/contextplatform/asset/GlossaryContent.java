package org.javai.contextplatform.asset;

import java.util.List;

/**
 * A business term and what it means in this database.
 *
 * @param term the business term, e.g. "Revenue"
 * @param definition plain-language definition
 * @param synonyms alternative names users may type
 * @param sqlExpression optional SQL fragment computing the term
 */
public record GlossaryContent(String term, String definition, List<String> synonyms, String sqlExpression)
		implements AssetContent {

	public GlossaryContent {
		synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
	}

	public GlossaryContent(String term, String definition) {
		this(term, definition, List.of(), null);
	}

	@Override
	public AssetType assetType() {
		return AssetType.GLOSSARY;
	}

	@Override
	public void validate() {
		if (AssetContent.isBlank(term)) {
			throw new InvalidAssetContentException(AssetType.GLOSSARY, "term is required");
		}
		if (AssetContent.isBlank(definition)) {
			throw new InvalidAssetContentException(AssetType.GLOSSARY, "definition is required");
		}
	}

	@Override
	public String toText() {
		StringBuilder sb = new StringBuilder(term).append(": ").append(definition);
		if (!synonyms.isEmpty()) {
			sb.append(" (also: ").append(String.join(", ", synonyms)).append(")");
		}
		if (!AssetContent.isBlank(sqlExpression)) {
			sb.append(" SQL: ").append(sqlExpression);
		}
		return sb.toString();
	}
}
