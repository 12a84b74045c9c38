package org.javai.contextplatform.search;

import java.util.Objects;
import org.javai.contextplatform.asset.ContextAsset;

/**
 * The searchable projection of one asset version.
 *
 * @param asset the asset snapshot
 * @param superseded whether a higher version of the same identity is published
 */
public record IndexedAsset(ContextAsset asset, boolean superseded) {

	public IndexedAsset {
		Objects.requireNonNull(asset, "asset must not be null");
	}

	public static IndexedAsset of(ContextAsset asset) {
		return new IndexedAsset(asset, false);
	}

	public String assetId() {
		return asset.id();
	}

	public long revision() {
		return asset.revision();
	}

	/**
	 * @return {@code true} unless deprecated or superseded
	 */
	public boolean isActive() {
		return !asset.isDeprecated() && !superseded;
	}

	/**
	 * @return key used to cache derived data; changes whenever the asset's stored state does
	 */
	public String cacheKey() {
		return asset.id() + "#" + asset.revision();
	}
}
