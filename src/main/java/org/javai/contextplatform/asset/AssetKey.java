package org.javai.contextplatform.asset;

import java.util.Objects;

/**
 * Logical identity of a context asset: all versions of one piece of knowledge share it.
 *
 * @param connectionId the database connection (tenant) the asset belongs to
 * @param assetType the asset type
 * @param canonicalKey the stable, human-chosen key within connection and type
 */
public record AssetKey(String connectionId, AssetType assetType, String canonicalKey) {

	public AssetKey {
		Objects.requireNonNull(assetType, "assetType must not be null");
		if (connectionId == null || connectionId.isBlank()) {
			throw new IllegalArgumentException("connectionId must not be blank");
		}
		if (canonicalKey == null || canonicalKey.isBlank()) {
			throw new IllegalArgumentException("canonicalKey must not be blank");
		}
	}

	public static AssetKey of(String connectionId, AssetType assetType, String canonicalKey) {
		return new AssetKey(connectionId, assetType, canonicalKey);
	}

	@Override
	public String toString() {
		return connectionId + ":" + assetType.id() + "/" + canonicalKey;
	}
}
