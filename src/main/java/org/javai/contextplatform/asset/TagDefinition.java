package org.javai.contextplatform.asset;

import java.util.Objects;

/**
 * A known tag and the category it belongs to.
 */
public record TagDefinition(String name, TagCategory category, String description) {

	public TagDefinition {
		Objects.requireNonNull(category, "category must not be null");
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("tag name must not be blank");
		}
		name = TagCatalog.normalize(name);
	}
}
