package org.javai.contextplatform.asset;

/**
 * Lifecycle state of a context asset.
 *
 * <p>Legal transitions are owned by {@code LifecyclePolicy}; this enum only knows how
 * states rank against each other when search scores tie.</p>
 */
public enum LifecycleState {

	DRAFT(1),
	VERIFIED(2),
	PUBLISHED(3),
	DEPRECATED(0);

	private final int searchRank;

	LifecycleState(int searchRank) {
		this.searchRank = searchRank;
	}

	/**
	 * @return tie-break rank, higher ranks first (published &gt; verified &gt; draft &gt; deprecated)
	 */
	public int searchRank() {
		return searchRank;
	}

	public boolean isMutable() {
		return this == DRAFT;
	}
}
