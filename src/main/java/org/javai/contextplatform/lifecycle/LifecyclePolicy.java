package org.javai.contextplatform.lifecycle;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.InvalidLifecycleTransitionException;
import org.javai.contextplatform.asset.InvalidStateForMutationException;
import org.javai.contextplatform.asset.LifecycleState;

/**
 * The single source of truth for what may happen to an asset in each lifecycle state.
 *
 * <table>
 *   <caption>Transitions</caption>
 *   <tr><th>From</th><th>To</th><th>Precondition</th></tr>
 *   <tr><td>DRAFT</td><td>VERIFIED</td><td>promoter present</td></tr>
 *   <tr><td>VERIFIED</td><td>PUBLISHED</td><td>promoter present</td></tr>
 *   <tr><td>any but DEPRECATED</td><td>DEPRECATED</td><td>reason present</td></tr>
 * </table>
 *
 * <p>Content edits and hard deletes are only legal in {@code DRAFT}. Every mutating entry point
 * of the lifecycle manager calls one of the {@code check*} methods before touching the store.</p>
 */
public class LifecyclePolicy {

	private static final Map<LifecycleState, Set<LifecycleState>> PROMOTIONS = new EnumMap<>(LifecycleState.class);

	static {
		PROMOTIONS.put(LifecycleState.DRAFT, EnumSet.of(LifecycleState.VERIFIED));
		PROMOTIONS.put(LifecycleState.VERIFIED, EnumSet.of(LifecycleState.PUBLISHED));
		PROMOTIONS.put(LifecycleState.PUBLISHED, EnumSet.noneOf(LifecycleState.class));
		PROMOTIONS.put(LifecycleState.DEPRECATED, EnumSet.noneOf(LifecycleState.class));
	}

	/**
	 * @return every state reachable from {@code from} by promotion or deprecation
	 */
	public Set<LifecycleState> allowedTargets(LifecycleState from) {
		Set<LifecycleState> targets = EnumSet.noneOf(LifecycleState.class);
		targets.addAll(PROMOTIONS.get(from));
		if (from != LifecycleState.DEPRECATED) {
			targets.add(LifecycleState.DEPRECATED);
		}
		return targets;
	}

	public boolean canPromote(LifecycleState from, LifecycleState to) {
		return PROMOTIONS.get(from).contains(to);
	}

	public void checkPromotion(ContextAsset asset, LifecycleState target, String promotedBy) {
		LifecycleState from = asset.lifecycleState();
		if (target == null || !canPromote(from, target)) {
			String hint = target == LifecycleState.DEPRECATED ? "; use deprecate to retire an asset" : "";
			throw new InvalidLifecycleTransitionException(from, target, allowedTargets(from),
					"Cannot promote " + asset.key() + "@" + asset.version() + " from " + from + " to " + target
							+ "; allowed targets: " + allowedTargets(from) + hint);
		}
		if (isBlank(promotedBy)) {
			throw new InvalidLifecycleTransitionException(from, target, allowedTargets(from),
					"Promotion of " + asset.key() + " to " + target + " requires promotedBy");
		}
	}

	public void checkDeprecation(ContextAsset asset, String reason) {
		LifecycleState from = asset.lifecycleState();
		if (from == LifecycleState.DEPRECATED) {
			throw new InvalidLifecycleTransitionException(from, LifecycleState.DEPRECATED, allowedTargets(from),
					asset.key() + "@" + asset.version() + " is already deprecated");
		}
		if (isBlank(reason)) {
			throw new InvalidLifecycleTransitionException(from, LifecycleState.DEPRECATED, allowedTargets(from),
					"Deprecating " + asset.key() + " requires a reason");
		}
	}

	public void checkContentMutation(ContextAsset asset) {
		if (!asset.lifecycleState().isMutable()) {
			throw new InvalidStateForMutationException(asset.id(), asset.lifecycleState(),
					"Cannot edit " + asset.key() + "@" + asset.version() + " in state " + asset.lifecycleState()
							+ ": content is frozen once an asset leaves DRAFT. Create a revision of asset "
							+ asset.id() + " and edit the new draft instead.");
		}
	}

	public void checkDeletion(ContextAsset asset) {
		if (!asset.lifecycleState().isMutable()) {
			throw new InvalidStateForMutationException(asset.id(), asset.lifecycleState(),
					"Cannot delete " + asset.key() + "@" + asset.version() + " in state " + asset.lifecycleState()
							+ ": only drafts may be deleted; deprecate it instead.");
		}
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
