package org.javai.contextplatform.asset;

/**
 * Raised when a create or revision would give a logical identity a second live version.
 */
public class DuplicateKeyException extends ContextAssetException {

	private final AssetKey key;
	private final String existingAssetId;

	public DuplicateKeyException(AssetKey key, String existingAssetId, String message) {
		super(message);
		this.key = key;
		this.existingAssetId = existingAssetId;
	}

	public AssetKey key() {
		return key;
	}

	public String existingAssetId() {
		return existingAssetId;
	}
}
