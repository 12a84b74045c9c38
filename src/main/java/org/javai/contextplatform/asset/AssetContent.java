package org.javai.contextplatform.asset;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured, type-specific payload of a context asset.
 *
 * <p>Each variant belongs to one {@link AssetType}, validates its own shape and knows how to
 * flatten itself into searchable text. Variants are immutable, so content captured in a
 * non-draft version can never change underneath a reader.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
		@JsonSubTypes.Type(value = GlossaryContent.class, name = "glossary"),
		@JsonSubTypes.Type(value = TableDescriptionContent.class, name = "table_description"),
		@JsonSubTypes.Type(value = InstructionContent.class, name = "instruction"),
		@JsonSubTypes.Type(value = SkillContent.class, name = "skill")
})
public sealed interface AssetContent
		permits GlossaryContent, TableDescriptionContent, InstructionContent, SkillContent {

	/**
	 * @return the asset type this content belongs to
	 */
	AssetType assetType();

	/**
	 * Checks the variant's schema.
	 *
	 * @throws InvalidAssetContentException if a required field is missing or inconsistent
	 */
	void validate();

	/**
	 * @return a flattened text rendering used for indexing when no explicit text is supplied
	 */
	String toText();

	static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
