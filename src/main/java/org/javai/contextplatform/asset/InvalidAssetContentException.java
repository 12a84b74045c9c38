package org.javai.contextplatform.asset;

public class InvalidAssetContentException extends ContextAssetException {

	private final AssetType assetType;

	public InvalidAssetContentException(AssetType assetType, String message) {
		super("Invalid " + assetType.id() + " content: " + message);
		this.assetType = assetType;
	}

	public AssetType assetType() {
		return assetType;
	}
}
