package org.javai.contextplatform.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetNotFoundException;
import org.javai.contextplatform.asset.AssetPatch;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ConcurrentAssetModificationException;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.DuplicateKeyException;
import org.javai.contextplatform.asset.GlossaryContent;
import org.javai.contextplatform.asset.InvalidAssetContentException;
import org.javai.contextplatform.asset.InvalidLifecycleTransitionException;
import org.javai.contextplatform.asset.InvalidStateForMutationException;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.RevisionEntry;
import org.javai.contextplatform.asset.SemanticVersion;
import org.javai.contextplatform.asset.TableDescriptionContent;
import org.javai.contextplatform.asset.TagCatalog;
import org.javai.contextplatform.asset.store.AssetStore;
import org.javai.contextplatform.asset.store.InMemoryAssetStore;
import org.javai.contextplatform.search.InMemorySearchIndex;
import org.javai.contextplatform.search.SearchHit;
import org.javai.contextplatform.search.SearchIndex;
import org.javai.contextplatform.search.SearchIndexUnavailableException;
import org.javai.contextplatform.search.SearchQuery;
import org.javai.contextplatform.search.SearchResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultLifecycleManager")
class DefaultLifecycleManagerTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
	private static final AssetKey REVENUE = AssetKey.of("warehouse", AssetType.GLOSSARY, "revenue");

	private InMemoryAssetStore store;
	private InMemorySearchIndex index;
	private DefaultLifecycleManager manager;

	@BeforeEach
	void setUp() {
		store = new InMemoryAssetStore();
		index = new InMemorySearchIndex(new TagCatalog());
		manager = new DefaultLifecycleManager(store, index, LifecycleConfig.defaults(), CLOCK);
	}

	private static NewAsset revenue() {
		return NewAsset.builder("warehouse", AssetType.GLOSSARY, "revenue")
				.name("Revenue")
				.description("Recognised revenue from completed orders")
				.content(new GlossaryContent("Revenue", "Sum of amount over completed orders"))
				.tags(Set.of("finance"))
				.author("alice")
				.build();
	}

	private ContextAsset published(NewAsset request) {
		ContextAsset draft = manager.create(request);
		manager.promote(draft.id(), LifecycleState.VERIFIED, "bob", "checked");
		return manager.promote(draft.id(), LifecycleState.PUBLISHED, "carol", null);
	}

	@Nested
	@DisplayName("create")
	class Create {

		@Test
		@DisplayName("stores version 1.0.0 as a draft that is immediately searchable")
		void createsSearchableDraft() {
			ContextAsset created = manager.create(revenue());

			assertThat(created.version()).isEqualTo(SemanticVersion.INITIAL);
			assertThat(created.lifecycleState()).isEqualTo(LifecycleState.DRAFT);
			assertThat(created.revision()).isZero();
			assertThat(created.contentText()).isEqualTo("Revenue: Sum of amount over completed orders");

			SearchResults results = manager.search(SearchQuery.of("warehouse", "Revenue"));
			assertThat(results.hits()).extracting(h -> h.asset().id()).containsExactly(created.id());
		}

		@Test
		@DisplayName("rejects a second live asset with the same key")
		void duplicateKey() {
			ContextAsset first = manager.create(revenue());

			assertThatThrownBy(() -> manager.create(revenue()))
					.isInstanceOf(DuplicateKeyException.class)
					.satisfies(e -> assertThat(((DuplicateKeyException) e).existingAssetId()).isEqualTo(first.id()));
			assertThat(manager.versions(REVENUE)).hasSize(1);
		}

		@Test
		@DisplayName("rejects content of another asset type")
		void contentTypeMismatch() {
			NewAsset request = NewAsset.builder("warehouse", AssetType.GLOSSARY, "orders")
					.content(new TableDescriptionContent("orders", "One row per order", List.of()))
					.author("alice")
					.build();

			assertThatThrownBy(() -> manager.create(request)).isInstanceOf(InvalidAssetContentException.class);
			assertThat(store.findByConnection("warehouse")).isEmpty();
		}

		@Test
		@DisplayName("requires an author")
		void requiresAuthor() {
			NewAsset request = NewAsset.builder("warehouse", AssetType.GLOSSARY, "revenue")
					.content(new GlossaryContent("Revenue", "Sum of amounts"))
					.build();

			assertThatThrownBy(() -> manager.create(request))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("author");
		}
	}

	@Nested
	@DisplayName("update")
	class Update {

		@Test
		@DisplayName("merges only the given fields into a draft")
		void patchesDraft() {
			ContextAsset draft = manager.create(revenue());

			ContextAsset updated = manager.update(draft.id(), AssetPatch.empty().withDescription("Net of refunds"));

			assertThat(updated.description()).isEqualTo("Net of refunds");
			assertThat(updated.name()).isEqualTo("Revenue");
			assertThat(updated.revision()).isEqualTo(1);
			assertThat(index.get(draft.id())).map(e -> e.asset().description()).contains("Net of refunds");
		}

		@Test
		@DisplayName("refuses to edit a verified asset and points at revisions")
		void frozenOutsideDraft() {
			ContextAsset draft = manager.create(revenue());
			ContextAsset verified = manager.promote(draft.id(), LifecycleState.VERIFIED, "bob", null);

			assertThatThrownBy(() -> manager.update(draft.id(),
					AssetPatch.content(new GlossaryContent("Revenue", "Something else"))))
					.isInstanceOf(InvalidStateForMutationException.class)
					.hasMessageContaining("Create a revision");
			assertThat(manager.get(draft.id())).isEqualTo(verified);
		}

		@Test
		@DisplayName("fails when the caller's revision is stale")
		void staleRevision() {
			ContextAsset draft = manager.create(revenue());
			manager.update(draft.id(), AssetPatch.empty().withName("Net revenue"));

			assertThatThrownBy(() -> manager.update(draft.id(), AssetPatch.empty().withName("Gross revenue"), 0L))
					.isInstanceOf(ConcurrentAssetModificationException.class);
			assertThat(manager.get(draft.id()).name()).isEqualTo("Net revenue");
		}

		@Test
		@DisplayName("reports unknown assets")
		void unknownAsset() {
			assertThatThrownBy(() -> manager.update("missing", AssetPatch.empty().withName("x")))
					.isInstanceOf(AssetNotFoundException.class);
		}
	}

	@Nested
	@DisplayName("promote and deprecate")
	class Transitions {

		@Test
		@DisplayName("walks draft to verified to published and records each step")
		void promotionPath() {
			ContextAsset result = published(revenue());

			assertThat(result.lifecycleState()).isEqualTo(LifecycleState.PUBLISHED);
			List<RevisionEntry> history = manager.history(REVENUE);
			assertThat(history).extracting(RevisionEntry::toState)
					.containsExactly(LifecycleState.VERIFIED, LifecycleState.PUBLISHED);
			assertThat(history).extracting(RevisionEntry::by).containsExactly("bob", "carol");
			assertThat(history.get(0).note()).isEqualTo("checked");
		}

		@Test
		@DisplayName("a published asset outranks a draft that matches the same keyword less closely")
		void publishedOutranksWeakerDraft() {
			ContextAsset draft = manager.create(revenue());
			manager.promote(draft.id(), LifecycleState.VERIFIED, "reviewer", null);
			ContextAsset revenue = manager.promote(draft.id(), LifecycleState.PUBLISHED, "lead", null);
			ContextAsset forecast = manager.create(NewAsset.builder("warehouse", AssetType.GLOSSARY, "forecast")
					.name("Forecast")
					.content(new GlossaryContent("Forecast", "Projected revenue for the next quarter"))
					.author("alice")
					.build());

			assertThat(manager.search(SearchQuery.of("warehouse", "revenue")).hits())
					.extracting(SearchHit::asset)
					.extracting(ContextAsset::id)
					.containsExactly(revenue.id(), forecast.id());
		}

		@Test
		@DisplayName("rejects skipping verification and lists the allowed targets")
		void cannotSkipVerification() {
			ContextAsset draft = manager.create(revenue());

			assertThatThrownBy(() -> manager.promote(draft.id(), LifecycleState.PUBLISHED, "bob", null))
					.isInstanceOf(InvalidLifecycleTransitionException.class)
					.satisfies(e -> assertThat(((InvalidLifecycleTransitionException) e).allowedTargets())
							.containsExactlyInAnyOrder(LifecycleState.VERIFIED, LifecycleState.DEPRECATED));
			assertThat(manager.get(draft.id()).lifecycleState()).isEqualTo(LifecycleState.DRAFT);
			assertThat(manager.history(REVENUE)).isEmpty();
		}

		@Test
		@DisplayName("requires a promoter")
		void requiresPromoter() {
			ContextAsset draft = manager.create(revenue());

			assertThatThrownBy(() -> manager.promote(draft.id(), LifecycleState.VERIFIED, " ", null))
					.isInstanceOf(InvalidLifecycleTransitionException.class);
		}

		@Test
		@DisplayName("deprecated assets stay searchable, ranked last and flagged")
		void deprecatedRankLast() {
			ContextAsset old = manager.create(revenue());
			manager.deprecate(old.id(), "alice", "replaced by net revenue");
			ContextAsset other = manager.create(NewAsset.builder("warehouse", AssetType.GLOSSARY, "bookings")
					.name("Bookings")
					.content(new GlossaryContent("Bookings", "Signed orders, a leading indicator of revenue"))
					.author("alice")
					.build());

			List<SearchHit> hits = manager.search(SearchQuery.of("warehouse", "revenue")).hits();

			assertThat(hits).extracting(h -> h.asset().id()).containsExactly(other.id(), old.id());
			assertThat(hits.get(1).deprecated()).isTrue();
		}

		@Test
		@DisplayName("a deprecated asset cannot be deprecated again")
		void deprecateTwice() {
			ContextAsset draft = manager.create(revenue());
			manager.deprecate(draft.id(), "alice", "obsolete");

			assertThatThrownBy(() -> manager.deprecate(draft.id(), "alice", "again"))
					.isInstanceOf(InvalidLifecycleTransitionException.class);
			assertThat(manager.history(REVENUE)).hasSize(1);
		}

		@Test
		@DisplayName("exactly one of two concurrent promotions wins")
		void concurrentPromotion() throws Exception {
			BarrierStore barrierStore = new BarrierStore(store);
			DefaultLifecycleManager racing = new DefaultLifecycleManager(barrierStore, index,
					LifecycleConfig.defaults(), CLOCK);
			ContextAsset draft = racing.create(revenue());

			ExecutorService pool = Executors.newFixedThreadPool(2);
			List<Throwable> failures = new ArrayList<>();
			try {
				barrierStore.arm();
				Future<ContextAsset> first = pool.submit(() ->
						racing.promote(draft.id(), LifecycleState.VERIFIED, "bob", null));
				Future<ContextAsset> second = pool.submit(() ->
						racing.promote(draft.id(), LifecycleState.VERIFIED, "carol", null));
				for (Future<ContextAsset> future : List.of(first, second)) {
					try {
						future.get(10, TimeUnit.SECONDS);
					} catch (ExecutionException e) {
						failures.add(e.getCause());
					}
				}
			} finally {
				barrierStore.disarm();
				pool.shutdownNow();
			}

			assertThat(failures).singleElement().isInstanceOf(ConcurrentAssetModificationException.class);
			assertThat(racing.get(draft.id()).lifecycleState()).isEqualTo(LifecycleState.VERIFIED);
			assertThat(racing.history(REVENUE)).hasSize(1);
		}
	}

	@Nested
	@DisplayName("revisions")
	class Revisions {

		@Test
		@DisplayName("fork a new minor draft and leave the source untouched")
		void forksDraft() {
			ContextAsset source = published(revenue());

			ContextAsset revision = manager.createRevision(source.id(), "dave");

			assertThat(revision.version()).isEqualTo(new SemanticVersion(1, 1, 0));
			assertThat(revision.lifecycleState()).isEqualTo(LifecycleState.DRAFT);
			assertThat(revision.parentAssetId()).isEqualTo(source.id());
			assertThat(revision.content()).isEqualTo(source.content());
			assertThat(manager.get(source.id())).isEqualTo(source);
		}

		@Test
		@DisplayName("allow only one open draft per identity")
		void oneOpenDraft() {
			ContextAsset source = published(revenue());
			manager.createRevision(source.id(), "dave");

			assertThatThrownBy(() -> manager.createRevision(source.id(), "erin"))
					.isInstanceOf(DuplicateKeyException.class);
			assertThat(manager.versions(REVENUE)).hasSize(2);
		}

		@Test
		@DisplayName("publishing a revision supersedes the older published version")
		void supersedesOlderPublished() {
			ContextAsset v1 = published(revenue());
			ContextAsset draft = manager.createRevision(v1.id(), "dave");
			manager.update(draft.id(), AssetPatch.content(new GlossaryContent("Revenue", "Net of refunds")));
			manager.promote(draft.id(), LifecycleState.VERIFIED, "bob", null);
			ContextAsset v2 = manager.promote(draft.id(), LifecycleState.PUBLISHED, "carol", null);

			assertThat(manager.current(REVENUE)).contains(v2);
			assertThat(manager.get(v1.id())).isEqualTo(v1);
			assertThat(index.get(v1.id())).hasValueSatisfying(e -> assertThat(e.superseded()).isTrue());
			assertThat(manager.search(SearchQuery.of("warehouse", "revenue")).first())
					.map(h -> h.asset().id()).contains(v2.id());
		}
	}

	@Nested
	@DisplayName("key reuse")
	class KeyReuse {

		@Test
		@DisplayName("a fully deprecated key is released for the next major version")
		void releasedOnDeprecation() {
			ContextAsset first = manager.create(revenue());
			manager.deprecate(first.id(), "alice", "wrong definition");

			ContextAsset second = manager.create(revenue());

			assertThat(second.version()).isEqualTo(new SemanticVersion(2, 0, 0));
			assertThat(manager.versions(REVENUE)).hasSize(2);
		}

		@Test
		@DisplayName("a reserved key can never be created again")
		void reserved() {
			DefaultLifecycleManager strict = new DefaultLifecycleManager(store, index,
					LifecycleConfig.builder().keyReusePolicy(KeyReusePolicy.RESERVED).build(), CLOCK);
			ContextAsset first = strict.create(revenue());
			strict.deprecate(first.id(), "alice", "wrong definition");

			assertThatThrownBy(() -> strict.create(revenue()))
					.isInstanceOf(DuplicateKeyException.class)
					.hasMessageContaining("reserved");
		}
	}

	@Nested
	@DisplayName("delete")
	class Delete {

		@Test
		@DisplayName("removes a draft from store and index")
		void deletesDraft() {
			ContextAsset draft = manager.create(revenue());

			List<ContextAsset> removed = manager.delete("warehouse", AssetType.GLOSSARY, "revenue", null);

			assertThat(removed).containsExactly(draft);
			assertThat(store.findById(draft.id())).isEmpty();
			assertThat(index.get(draft.id())).isEmpty();
		}

		@Test
		@DisplayName("refuses to delete anything that left draft")
		void refusesNonDraft() {
			ContextAsset verified = manager.promote(manager.create(revenue()).id(), LifecycleState.VERIFIED, "bob",
					null);

			assertThatThrownBy(() -> manager.delete("warehouse", AssetType.GLOSSARY, "revenue", null))
					.isInstanceOf(InvalidStateForMutationException.class);
			assertThat(manager.get(verified.id())).isEqualTo(verified);
		}
	}

	@Nested
	@DisplayName("index failures")
	class IndexFailures {

		private final LifecycleConfig noRetries = LifecycleConfig.builder()
				.indexRetries(0)
				.indexRetryBackoff(Duration.ZERO)
				.build();

		@Test
		@DisplayName("commit the change, queue it and report the index as unavailable")
		void queuedForReindex() {
			SearchIndex failingIndex = mock(SearchIndex.class);
			doThrow(new IllegalStateException("index down")).doNothing().when(failingIndex).upsert(any());
			DefaultLifecycleManager flaky = new DefaultLifecycleManager(store, failingIndex, noRetries, CLOCK);

			assertThatThrownBy(() -> flaky.create(revenue()))
					.isInstanceOf(SearchIndexUnavailableException.class)
					.hasCauseInstanceOf(IllegalStateException.class);
			assertThat(store.findVersions(REVENUE)).hasSize(1);
			assertThat(flaky.pendingReindex()).containsExactly(REVENUE);

			assertThat(flaky.retryPendingIndexing()).isZero();
			assertThat(flaky.pendingReindex()).isEmpty();
			verify(failingIndex, times(2)).upsert(any());
		}

		@Test
		@DisplayName("succeed when a retry gets through")
		void retried() {
			SearchIndex failingIndex = mock(SearchIndex.class);
			doThrow(new IllegalStateException("index down")).doNothing().when(failingIndex).upsert(any());
			DefaultLifecycleManager flaky = new DefaultLifecycleManager(store, failingIndex,
					LifecycleConfig.builder().indexRetries(1).indexRetryBackoff(Duration.ZERO).build(), CLOCK);

			ContextAsset created = flaky.create(revenue());

			assertThat(created.lifecycleState()).isEqualTo(LifecycleState.DRAFT);
			assertThat(flaky.pendingReindex()).isEmpty();
		}
	}

	@Test
	@DisplayName("reindex rebuilds a connection from the store")
	void reindexFromStore() {
		ContextAsset draft = manager.create(revenue());
		index.clear("warehouse");

		int indexed = manager.reindex("warehouse");

		assertThat(indexed).isEqualTo(1);
		assertThat(index.get(draft.id())).isPresent();
	}

	/**
	 * Holds the first two {@code findById} calls at a barrier once armed, so both callers read the
	 * same revision before either writes.
	 */
	private static final class BarrierStore implements AssetStore {

		private final AssetStore delegate;
		private final CyclicBarrier barrier = new CyclicBarrier(2);
		private final AtomicBoolean armed = new AtomicBoolean();

		BarrierStore(AssetStore delegate) {
			this.delegate = delegate;
		}

		void arm() {
			armed.set(true);
		}

		void disarm() {
			armed.set(false);
		}

		@Override
		public Optional<ContextAsset> findById(String assetId) {
			Optional<ContextAsset> result = delegate.findById(assetId);
			if (armed.get()) {
				try {
					barrier.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException(e);
				} catch (BrokenBarrierException | TimeoutException e) {
					throw new IllegalStateException(e);
				}
			}
			return result;
		}

		@Override
		public List<ContextAsset> findVersions(AssetKey key) {
			return delegate.findVersions(key);
		}

		@Override
		public List<ContextAsset> findByConnection(String connectionId) {
			return delegate.findByConnection(connectionId);
		}

		@Override
		public Set<String> connectionIds() {
			return delegate.connectionIds();
		}

		@Override
		public List<RevisionEntry> history(AssetKey key) {
			return delegate.history(key);
		}

		@Override
		public ContextAsset insert(AssetKey key, Function<List<ContextAsset>, ContextAsset> factory) {
			return delegate.insert(key, factory);
		}

		@Override
		public ContextAsset compareAndSet(long expectedRevision, ContextAsset updated, RevisionEntry historyEntry) {
			return delegate.compareAndSet(expectedRevision, updated, historyEntry);
		}

		@Override
		public List<ContextAsset> delete(AssetKey key, SemanticVersion version, Consumer<List<ContextAsset>> guard) {
			return delegate.delete(key, version, guard);
		}
	}
}
