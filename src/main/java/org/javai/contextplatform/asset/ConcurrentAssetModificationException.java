package org.javai.contextplatform.asset;

/**
 * Raised when an optimistic write loses to a concurrent writer. Carries what the caller needs
 * to re-read and retry.
 */
public class ConcurrentAssetModificationException extends ContextAssetException {

	private final String assetId;
	private final long expectedRevision;
	private final long currentRevision;
	private final LifecycleState currentState;

	public ConcurrentAssetModificationException(String assetId, long expectedRevision, long currentRevision,
			LifecycleState currentState) {
		super("Context asset " + assetId + " was modified concurrently: expected revision " + expectedRevision
				+ " but found " + currentRevision + " (state " + currentState + ")");
		this.assetId = assetId;
		this.expectedRevision = expectedRevision;
		this.currentRevision = currentRevision;
		this.currentState = currentState;
	}

	public String assetId() {
		return assetId;
	}

	public long expectedRevision() {
		return expectedRevision;
	}

	public long currentRevision() {
		return currentRevision;
	}

	public LifecycleState currentState() {
		return currentState;
	}
}
