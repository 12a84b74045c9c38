package org.javai.contextplatform.asset;

import java.util.Set;

/**
 * Raised when a promotion or deprecation is not in the transition table, or its
 * preconditions (actor, reason) are missing.
 */
public class InvalidLifecycleTransitionException extends ContextAssetException {

	private final LifecycleState from;
	private final LifecycleState to;
	private final Set<LifecycleState> allowedTargets;

	public InvalidLifecycleTransitionException(LifecycleState from, LifecycleState to,
			Set<LifecycleState> allowedTargets, String message) {
		super(message);
		this.from = from;
		this.to = to;
		this.allowedTargets = Set.copyOf(allowedTargets);
	}

	public LifecycleState from() {
		return from;
	}

	public LifecycleState to() {
		return to;
	}

	/**
	 * @return states reachable from {@link #from()}; empty when the source is terminal
	 */
	public Set<LifecycleState> allowedTargets() {
		return allowedTargets;
	}
}
