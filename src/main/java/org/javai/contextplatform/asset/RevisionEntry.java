package org.javai.contextplatform.asset;

import java.time.Instant;
import java.util.Objects;

/**
 * One state transition in the append-only history of a logical identity.
 *
 * @param assetId the version that transitioned
 * @param version its semantic version
 * @param fromState state before
 * @param toState state after
 * @param by who performed the transition
 * @param note promotion note or deprecation reason, may be {@code null}
 * @param at when it happened
 */
public record RevisionEntry(
		String assetId,
		SemanticVersion version,
		LifecycleState fromState,
		LifecycleState toState,
		String by,
		String note,
		Instant at) {

	public RevisionEntry {
		Objects.requireNonNull(assetId, "assetId must not be null");
		Objects.requireNonNull(fromState, "fromState must not be null");
		Objects.requireNonNull(toState, "toState must not be null");
		Objects.requireNonNull(at, "at must not be null");
	}
}
