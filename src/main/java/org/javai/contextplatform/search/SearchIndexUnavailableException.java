package org.javai.contextplatform.search;

import org.javai.contextplatform.asset.ContextAssetException;

/**
 * Raised when a committed change could not be made discoverable. The change itself is durable
 * and has been queued for re-indexing.
 */
public class SearchIndexUnavailableException extends ContextAssetException {

	private final String assetId;

	public SearchIndexUnavailableException(String assetId, String message, Throwable cause) {
		super(message, cause);
		this.assetId = assetId;
	}

	public String assetId() {
		return assetId;
	}
}
