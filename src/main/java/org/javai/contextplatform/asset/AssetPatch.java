package org.javai.contextplatform.asset;

import java.util.Set;

/**
 * Field-level changes to a draft asset. {@code null} fields are left untouched.
 */
public record AssetPatch(String name, String description, AssetContent content, String contentText, Set<String> tags) {

	public static AssetPatch empty() {
		return new AssetPatch(null, null, null, null, null);
	}

	public static AssetPatch content(AssetContent content) {
		return new AssetPatch(null, null, content, null, null);
	}

	public AssetPatch withName(String value) {
		return new AssetPatch(value, description, content, contentText, tags);
	}

	public AssetPatch withDescription(String value) {
		return new AssetPatch(name, value, content, contentText, tags);
	}

	public AssetPatch withContent(AssetContent value) {
		return new AssetPatch(name, description, value, contentText, tags);
	}

	public AssetPatch withContentText(String value) {
		return new AssetPatch(name, description, content, value, tags);
	}

	public AssetPatch withTags(Set<String> value) {
		return new AssetPatch(name, description, content, contentText, value);
	}

	public boolean isEmpty() {
		return name == null && description == null && content == null && contentText == null && tags == null;
	}
}
