package org.javai.contextplatform.asset;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * One version of a piece of curated knowledge about a database.
 *
 * <p>Instances are immutable snapshots. Every stored change produces a new instance with an
 * incremented {@code revision}, which the store uses as the optimistic-concurrency token.</p>
 *
 * @param id opaque identifier of this version
 * @param key logical identity shared by all versions
 * @param version semantic version within the identity
 * @param name display name
 * @param description short description
 * @param content structured, type-specific payload
 * @param contentText searchable text rendering of the content
 * @param tags free-form tags
 * @param author who created this version
 * @param lifecycleState current state
 * @param parentAssetId id of the version this one was revised from, or {@code null}
 * @param createdAt creation time
 * @param updatedAt time of the last stored change
 * @param revision optimistic-concurrency token, starting at 0
 */
public record ContextAsset(
		String id,
		AssetKey key,
		SemanticVersion version,
		String name,
		String description,
		AssetContent content,
		String contentText,
		Set<String> tags,
		String author,
		LifecycleState lifecycleState,
		String parentAssetId,
		Instant createdAt,
		Instant updatedAt,
		long revision) {

	public ContextAsset {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(version, "version must not be null");
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(lifecycleState, "lifecycleState must not be null");
		Objects.requireNonNull(createdAt, "createdAt must not be null");
		Objects.requireNonNull(updatedAt, "updatedAt must not be null");
		tags = tags == null ? Set.of() : Set.copyOf(tags);
		description = description == null ? "" : description;
		if (contentText == null || contentText.isBlank()) {
			contentText = content.toText();
		}
	}

	@JsonIgnore
	public String connectionId() {
		return key.connectionId();
	}

	@JsonIgnore
	public AssetType assetType() {
		return key.assetType();
	}

	@JsonIgnore
	public String canonicalKey() {
		return key.canonicalKey();
	}

	@JsonIgnore
	public boolean isDeprecated() {
		return lifecycleState == LifecycleState.DEPRECATED;
	}

	/**
	 * Copy in a new state; bumps revision and {@code updatedAt}.
	 */
	public ContextAsset withState(LifecycleState newState, Instant at) {
		return new ContextAsset(id, key, version, name, description, content, contentText, tags, author,
				newState, parentAssetId, createdAt, at, revision + 1);
	}

	/**
	 * Copy with the patch's present fields applied; bumps revision and {@code updatedAt}.
	 * If the content changes but no explicit text is given, the text is re-derived.
	 */
	public ContextAsset withPatch(AssetPatch patch, Instant at) {
		AssetContent newContent = patch.content() != null ? patch.content() : content;
		String newText;
		if (patch.contentText() != null) {
			newText = patch.contentText();
		} else if (patch.content() != null) {
			newText = newContent.toText();
		} else {
			newText = contentText;
		}
		return new ContextAsset(id, key, version,
				patch.name() != null ? patch.name() : name,
				patch.description() != null ? patch.description() : description,
				newContent, newText,
				patch.tags() != null ? patch.tags() : tags,
				author, lifecycleState, parentAssetId, createdAt, at, revision + 1);
	}

	@Override
	public String toString() {
		return "ContextAsset[" + key + "@" + version + " " + lifecycleState + ", id=" + id + ", rev=" + revision + "]";
	}
}
