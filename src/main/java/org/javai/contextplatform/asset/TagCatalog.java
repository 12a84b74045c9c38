package org.javai.contextplatform.asset;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of tag definitions. Tags used on assets need not be registered; unregistered tags
 * fall into {@link TagCategory#DOMAIN}.
 *
 * <p>Usage counts are not kept here; they are derived from the search index on demand.</p>
 */
public class TagCatalog {

	private final Map<String, TagDefinition> definitions = new ConcurrentHashMap<>();

	public TagCatalog() {
	}

	public TagCatalog(Collection<TagDefinition> initial) {
		initial.forEach(this::define);
	}

	public void define(TagDefinition definition) {
		definitions.put(definition.name(), definition);
	}

	public void define(String name, TagCategory category, String description) {
		define(new TagDefinition(name, category, description));
	}

	public Optional<TagDefinition> find(String name) {
		return Optional.ofNullable(definitions.get(normalize(name)));
	}

	public TagCategory categoryOf(String name) {
		return find(name).map(TagDefinition::category).orElse(TagCategory.DOMAIN);
	}

	public List<TagDefinition> definitions() {
		return definitions.values().stream()
				.sorted((a, b) -> a.name().compareTo(b.name()))
				.toList();
	}

	static String normalize(String name) {
		return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
	}
}
