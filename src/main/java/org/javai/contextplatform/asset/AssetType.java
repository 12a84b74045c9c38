package org.javai.contextplatform.asset;

import java.util.Locale;

/**
 * Kind of knowledge a {@link ContextAsset} carries.
 *
 * <p>Each type owns exactly one {@link AssetContent} variant; the store and lifecycle
 * logic stay type-agnostic and only consult this mapping when validating content.</p>
 */
public enum AssetType {

	TABLE_DESCRIPTION("table_description", TableDescriptionContent.class),
	GLOSSARY("glossary", GlossaryContent.class),
	INSTRUCTION("instruction", InstructionContent.class),
	SKILL("skill", SkillContent.class);

	private final String id;
	private final Class<? extends AssetContent> contentType;

	AssetType(String id, Class<? extends AssetContent> contentType) {
		this.id = id;
		this.contentType = contentType;
	}

	/**
	 * @return the lower-case identifier used in keys, file names and reports
	 */
	public String id() {
		return id;
	}

	public Class<? extends AssetContent> contentType() {
		return contentType;
	}

	/**
	 * Resolves a type from its identifier or enum name, ignoring case.
	 *
	 * @param value e.g. {@code "glossary"} or {@code "TABLE_DESCRIPTION"}
	 * @return the matching type
	 * @throws IllegalArgumentException if nothing matches
	 */
	public static AssetType fromId(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("asset type must not be blank");
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (AssetType type : values()) {
			if (type.id.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown asset type: " + value);
	}
}
