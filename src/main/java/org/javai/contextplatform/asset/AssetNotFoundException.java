package org.javai.contextplatform.asset;

public class AssetNotFoundException extends ContextAssetException {

	public AssetNotFoundException(String message) {
		super(message);
	}

	public static AssetNotFoundException forId(String assetId) {
		return new AssetNotFoundException("No context asset with id " + assetId);
	}

	public static AssetNotFoundException forKey(AssetKey key) {
		return new AssetNotFoundException("No context asset " + key);
	}
}
