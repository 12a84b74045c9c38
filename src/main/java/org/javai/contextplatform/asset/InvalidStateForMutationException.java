package org.javai.contextplatform.asset;

/**
 * Raised when content is edited, or a version deleted, outside the {@code DRAFT} state.
 */
public class InvalidStateForMutationException extends ContextAssetException {

	private final String assetId;
	private final LifecycleState currentState;

	public InvalidStateForMutationException(String assetId, LifecycleState currentState, String message) {
		super(message);
		this.assetId = assetId;
		this.currentState = currentState;
	}

	public String assetId() {
		return assetId;
	}

	public LifecycleState currentState() {
		return currentState;
	}
}
