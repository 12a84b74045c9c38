package org.javai.contextplatform.lifecycle;

import java.util.Set;
import org.javai.contextplatform.asset.AssetContent;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetType;

/**
 * Request to create the first (or, after deprecation, next major) version of an asset.
 *
 * <pre>{@code
 * NewAsset revenue = NewAsset.builder("warehouse", AssetType.GLOSSARY, "revenue")
 *         .name("Revenue")
 *         .content(new GlossaryContent("Revenue", "Sum of net order amounts"))
 *         .tags(Set.of("finance"))
 *         .author("alice")
 *         .build();
 * }</pre>
 *
 * @param contentText searchable text; derived from the content when {@code null}
 */
public record NewAsset(
		AssetKey key,
		String name,
		String description,
		AssetContent content,
		String contentText,
		Set<String> tags,
		String author) {

	public NewAsset {
		tags = tags == null ? Set.of() : Set.copyOf(tags);
	}

	public static Builder builder(String connectionId, AssetType assetType, String canonicalKey) {
		return new Builder(AssetKey.of(connectionId, assetType, canonicalKey));
	}

	public static class Builder {
		private final AssetKey key;
		private String name;
		private String description;
		private AssetContent content;
		private String contentText;
		private Set<String> tags = Set.of();
		private String author;

		private Builder(AssetKey key) {
			this.key = key;
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder content(AssetContent content) {
			this.content = content;
			return this;
		}

		public Builder contentText(String contentText) {
			this.contentText = contentText;
			return this;
		}

		public Builder tags(Set<String> tags) {
			this.tags = tags;
			return this;
		}

		public Builder author(String author) {
			this.author = author;
			return this;
		}

		public NewAsset build() {
			return new NewAsset(key, name, description, content, contentText, tags, author);
		}
	}
}
