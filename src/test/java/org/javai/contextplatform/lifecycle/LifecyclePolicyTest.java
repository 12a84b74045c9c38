package org.javai.contextplatform.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.GlossaryContent;
import org.javai.contextplatform.asset.InvalidLifecycleTransitionException;
import org.javai.contextplatform.asset.InvalidStateForMutationException;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.SemanticVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LifecyclePolicyTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	private final LifecyclePolicy policy = new LifecyclePolicy();

	private static ContextAsset inState(LifecycleState state) {
		return new ContextAsset("a1", AssetKey.of("warehouse", AssetType.GLOSSARY, "revenue"),
				SemanticVersion.INITIAL, "Revenue", "", new GlossaryContent("Revenue", "Sum of amounts"), null, null,
				"alice", state, null, NOW, NOW, 0L);
	}

	@Test
	@DisplayName("promotion moves exactly one step forward")
	void promotionSteps() {
		assertThat(policy.canPromote(LifecycleState.DRAFT, LifecycleState.VERIFIED)).isTrue();
		assertThat(policy.canPromote(LifecycleState.VERIFIED, LifecycleState.PUBLISHED)).isTrue();
		assertThat(policy.canPromote(LifecycleState.DRAFT, LifecycleState.PUBLISHED)).isFalse();
		assertThat(policy.canPromote(LifecycleState.VERIFIED, LifecycleState.DRAFT)).isFalse();
		assertThat(policy.canPromote(LifecycleState.PUBLISHED, LifecycleState.VERIFIED)).isFalse();
		assertThat(policy.canPromote(LifecycleState.DEPRECATED, LifecycleState.PUBLISHED)).isFalse();
	}

	@Test
	@DisplayName("deprecation is reachable from every live state")
	void allowedTargets() {
		assertThat(policy.allowedTargets(LifecycleState.DRAFT))
				.containsExactlyInAnyOrder(LifecycleState.VERIFIED, LifecycleState.DEPRECATED);
		assertThat(policy.allowedTargets(LifecycleState.PUBLISHED)).containsExactly(LifecycleState.DEPRECATED);
		assertThat(policy.allowedTargets(LifecycleState.DEPRECATED)).isEmpty();
	}

	@Test
	@DisplayName("promoting to DEPRECATED hints at deprecate")
	void deprecateHint() {
		assertThatThrownBy(() -> policy.checkPromotion(inState(LifecycleState.PUBLISHED), LifecycleState.DEPRECATED,
				"bob"))
				.isInstanceOf(InvalidLifecycleTransitionException.class)
				.hasMessageContaining("use deprecate");
	}

	@Test
	@DisplayName("deprecation needs a reason")
	void deprecationReason() {
		assertThatThrownBy(() -> policy.checkDeprecation(inState(LifecycleState.VERIFIED), ""))
				.isInstanceOf(InvalidLifecycleTransitionException.class)
				.hasMessageContaining("requires a reason");
	}

	@Test
	@DisplayName("content and deletion are frozen outside DRAFT")
	void contentFrozenOutsideDraft() {
		for (LifecycleState state : new LifecycleState[] { LifecycleState.VERIFIED, LifecycleState.PUBLISHED,
				LifecycleState.DEPRECATED }) {
			ContextAsset asset = inState(state);

			assertThatThrownBy(() -> policy.checkContentMutation(asset))
					.isInstanceOf(InvalidStateForMutationException.class);
			assertThatThrownBy(() -> policy.checkDeletion(asset))
					.isInstanceOf(InvalidStateForMutationException.class);
		}
	}

	@Test
	void draftsAreMutable() {
		policy.checkContentMutation(inState(LifecycleState.DRAFT));
		policy.checkDeletion(inState(LifecycleState.DRAFT));
	}
}
