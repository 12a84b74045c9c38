package org.javai.contextplatform.lifecycle;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.javai.contextplatform.asset.AssetContent;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetNotFoundException;
import org.javai.contextplatform.asset.AssetPatch;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ConcurrentAssetModificationException;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.DuplicateKeyException;
import org.javai.contextplatform.asset.InvalidAssetContentException;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.RevisionEntry;
import org.javai.contextplatform.asset.SemanticVersion;
import org.javai.contextplatform.asset.TagCategory;
import org.javai.contextplatform.asset.store.AssetStore;
import org.javai.contextplatform.search.IndexedAsset;
import org.javai.contextplatform.search.SearchIndex;
import org.javai.contextplatform.search.SearchIndexUnavailableException;
import org.javai.contextplatform.search.SearchQuery;
import org.javai.contextplatform.search.SearchResults;
import org.javai.contextplatform.search.TagUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link LifecycleManager} over an {@link AssetStore} and a {@link SearchIndex}.
 *
 * <h2>Consistency</h2>
 * <p>Each mutation is checked against the {@link LifecyclePolicy}, committed to the store with an
 * optimistic revision check, and then pushed to the index. The index step re-projects every
 * version of the identity, so a newly published revision marks older published versions as
 * superseded in the same step. Index failures are retried; a change that still cannot be
 * indexed is remembered and retried before the next mutation or on {@link #reindex(String)}.</p>
 */
public class DefaultLifecycleManager implements LifecycleManager {

	private static final Logger logger = LoggerFactory.getLogger(DefaultLifecycleManager.class);

	private final AssetStore store;
	private final SearchIndex index;
	private final LifecycleConfig config;
	private final LifecyclePolicy policy = new LifecyclePolicy();
	private final Clock clock;
	private final Set<AssetKey> pendingReindex = ConcurrentHashMap.newKeySet();
	private final Set<String> pendingRemovals = ConcurrentHashMap.newKeySet();

	public DefaultLifecycleManager(AssetStore store, SearchIndex index) {
		this(store, index, LifecycleConfig.defaults(), Clock.systemUTC());
	}

	public DefaultLifecycleManager(AssetStore store, SearchIndex index, LifecycleConfig config, Clock clock) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.index = Objects.requireNonNull(index, "index must not be null");
		this.config = config != null ? config : LifecycleConfig.defaults();
		this.clock = clock != null ? clock : Clock.systemUTC();
	}

	public LifecyclePolicy policy() {
		return policy;
	}

	@Override
	public ContextAsset create(NewAsset request) {
		Objects.requireNonNull(request, "request must not be null");
		AssetKey key = Objects.requireNonNull(request.key(), "key must not be null");
		requireText(request.author(), "author");
		validateContent(key.assetType(), request.content());
		retryPendingIndexing();

		Instant now = clock.instant();
		ContextAsset created = store.insert(key, existing -> {
			SemanticVersion version = firstVersionFor(key, existing);
			return new ContextAsset(UUID.randomUUID().toString(), key, version,
					request.name() != null ? request.name() : key.canonicalKey(),
					request.description(), request.content(), request.contentText(), request.tags(),
					request.author(), LifecycleState.DRAFT, null, now, now, 0L);
		});
		logger.info("Created context asset {}@{} (id={}, author={})",
				key, created.version(), created.id(), created.author());
		syncIndex(key, created.id());
		return created;
	}

	private SemanticVersion firstVersionFor(AssetKey key, List<ContextAsset> existing) {
		Optional<ContextAsset> live = existing.stream().filter(a -> !a.isDeprecated()).findFirst();
		if (live.isPresent()) {
			ContextAsset asset = live.get();
			throw new DuplicateKeyException(key, asset.id(),
					"A non-deprecated context asset " + key + " already exists (id=" + asset.id() + ", version="
							+ asset.version() + ", state=" + asset.lifecycleState() + "); create a revision instead");
		}
		if (existing.isEmpty()) {
			return SemanticVersion.INITIAL;
		}
		ContextAsset highest = existing.get(existing.size() - 1);
		if (config.keyReusePolicy() == KeyReusePolicy.RESERVED) {
			throw new DuplicateKeyException(key, highest.id(),
					"Canonical key " + key + " is reserved by deprecated version " + highest.version()
							+ "; create a revision of " + highest.id() + " instead");
		}
		return highest.version().nextMajor();
	}

	@Override
	public ContextAsset update(String assetId, AssetPatch patch) {
		return applyPatch(assetId, patch, null);
	}

	@Override
	public ContextAsset update(String assetId, AssetPatch patch, long expectedRevision) {
		return applyPatch(assetId, patch, expectedRevision);
	}

	private ContextAsset applyPatch(String assetId, AssetPatch patch, Long expectedRevision) {
		Objects.requireNonNull(patch, "patch must not be null");
		ContextAsset current = get(assetId);
		policy.checkContentMutation(current);
		checkRevision(current, expectedRevision);
		if (patch.content() != null) {
			validateContent(current.assetType(), patch.content());
		}
		retryPendingIndexing();

		ContextAsset updated = store.compareAndSet(current.revision(), current.withPatch(patch, clock.instant()), null);
		logger.info("Updated draft {}@{} (id={}, rev={})", updated.key(), updated.version(), updated.id(),
				updated.revision());
		syncIndex(updated.key(), updated.id());
		return updated;
	}

	@Override
	public ContextAsset promote(String assetId, LifecycleState targetState, String promotedBy, String note) {
		return applyPromotion(assetId, targetState, promotedBy, note, null);
	}

	@Override
	public ContextAsset promote(String assetId, LifecycleState targetState, String promotedBy, String note,
			long expectedRevision) {
		return applyPromotion(assetId, targetState, promotedBy, note, expectedRevision);
	}

	private ContextAsset applyPromotion(String assetId, LifecycleState targetState, String promotedBy, String note,
			Long expectedRevision) {
		ContextAsset current = get(assetId);
		policy.checkPromotion(current, targetState, promotedBy);
		checkRevision(current, expectedRevision);
		retryPendingIndexing();

		ContextAsset updated = transition(current, targetState, promotedBy, note);
		logger.info("Promoted {}@{} {} -> {} by {} (id={})", updated.key(), updated.version(),
				current.lifecycleState(), targetState, promotedBy, updated.id());
		syncIndex(updated.key(), updated.id());
		return updated;
	}

	@Override
	public ContextAsset deprecate(String assetId, String by, String reason) {
		ContextAsset current = get(assetId);
		policy.checkDeprecation(current, reason);
		retryPendingIndexing();

		ContextAsset updated = transition(current, LifecycleState.DEPRECATED, by, reason);
		logger.info("Deprecated {}@{} (id={}, by={}, reason={})", updated.key(), updated.version(), updated.id(),
				by, reason);
		syncIndex(updated.key(), updated.id());
		return updated;
	}

	private ContextAsset transition(ContextAsset current, LifecycleState target, String by, String note) {
		Instant now = clock.instant();
		RevisionEntry entry = new RevisionEntry(current.id(), current.version(), current.lifecycleState(), target,
				by, note, now);
		return store.compareAndSet(current.revision(), current.withState(target, now), entry);
	}

	@Override
	public ContextAsset createRevision(String assetId, String author) {
		requireText(author, "author");
		ContextAsset source = get(assetId);
		retryPendingIndexing();

		Instant now = clock.instant();
		ContextAsset revision = store.insert(source.key(), existing -> {
			if (existing.stream().noneMatch(a -> a.id().equals(source.id()))) {
				throw AssetNotFoundException.forId(source.id());
			}
			Optional<ContextAsset> openDraft = existing.stream()
					.filter(a -> a.lifecycleState() == LifecycleState.DRAFT)
					.findFirst();
			if (openDraft.isPresent()) {
				throw new DuplicateKeyException(source.key(), openDraft.get().id(),
						source.key() + " already has an open draft " + openDraft.get().version() + " (id="
								+ openDraft.get().id() + "); edit or delete it before creating another revision");
			}
			SemanticVersion next = existing.get(existing.size() - 1).version().nextMinor();
			return new ContextAsset(UUID.randomUUID().toString(), source.key(), next, source.name(),
					source.description(), source.content(), source.contentText(), source.tags(), author,
					LifecycleState.DRAFT, source.id(), now, now, 0L);
		});
		logger.info("Created revision {}@{} from {} (id={}, author={})", revision.key(), revision.version(),
				source.version(), revision.id(), author);
		syncIndex(revision.key(), revision.id());
		return revision;
	}

	@Override
	public List<ContextAsset> delete(String connectionId, AssetType assetType, String canonicalKey,
			SemanticVersion version) {
		AssetKey key = AssetKey.of(connectionId, assetType, canonicalKey);
		retryPendingIndexing();
		List<ContextAsset> removed = store.delete(key, version, targets -> targets.forEach(policy::checkDeletion));
		logger.info("Deleted {} draft version(s) of {}: {}", removed.size(), key,
				removed.stream().map(a -> a.version().toString()).collect(Collectors.joining(", ")));
		String firstId = removed.get(0).id();
		withIndexRetries(key, firstId, () -> {
			for (ContextAsset asset : removed) {
				index.remove(asset.id());
			}
			projectIdentity(key);
		}, () -> removed.forEach(a -> pendingRemovals.add(a.id())));
		return removed;
	}

	@Override
	public ContextAsset get(String assetId) {
		Objects.requireNonNull(assetId, "assetId must not be null");
		return store.findById(assetId).orElseThrow(() -> AssetNotFoundException.forId(assetId));
	}

	@Override
	public Optional<ContextAsset> find(AssetKey key, SemanticVersion version) {
		return store.findVersions(key).stream()
				.filter(a -> a.version().equals(version))
				.findFirst();
	}

	@Override
	public Optional<ContextAsset> current(AssetKey key) {
		List<ContextAsset> versions = store.findVersions(key);
		Optional<ContextAsset> published = versions.stream()
				.filter(a -> a.lifecycleState() == LifecycleState.PUBLISHED)
				.max(Comparator.comparing(ContextAsset::version));
		if (published.isPresent()) {
			return published;
		}
		return versions.stream()
				.filter(a -> !a.isDeprecated())
				.max(Comparator.comparing(ContextAsset::version));
	}

	@Override
	public List<ContextAsset> versions(AssetKey key) {
		return store.findVersions(key);
	}

	@Override
	public List<ContextAsset> list(String connectionId, AssetType assetType, LifecycleState state) {
		return store.findByConnection(connectionId).stream()
				.filter(a -> assetType == null || a.assetType() == assetType)
				.filter(a -> state == null || a.lifecycleState() == state)
				.toList();
	}

	@Override
	public List<RevisionEntry> history(AssetKey key) {
		return store.history(key);
	}

	@Override
	public Optional<AssetKey> identityOf(String assetId) {
		return store.findById(assetId).map(ContextAsset::key);
	}

	@Override
	public SearchResults search(SearchQuery query) {
		return index.search(query);
	}

	@Override
	public List<TagUsage> tags(String connectionId, TagCategory category) {
		return index.tags(connectionId, category);
	}

	@Override
	public int reindex(String connectionId) {
		List<ContextAsset> assets = store.findByConnection(connectionId);
		index.clear(connectionId);
		Map<AssetKey, List<ContextAsset>> byIdentity = assets.stream()
				.collect(Collectors.groupingBy(ContextAsset::key, LinkedHashMap::new, Collectors.toList()));
		byIdentity.keySet().forEach(this::projectIdentity);
		pendingReindex.removeIf(k -> k.connectionId().equals(connectionId));
		pendingRemovals.removeIf(id -> store.findById(id).isEmpty());
		logger.info("Re-indexed {} versions of {} identities for connection {}", assets.size(), byIdentity.size(),
				connectionId);
		return assets.size();
	}

	/**
	 * Replays index updates that failed earlier.
	 *
	 * @return number of identities and removals still pending
	 */
	public int retryPendingIndexing() {
		if (pendingReindex.isEmpty() && pendingRemovals.isEmpty()) {
			return 0;
		}
		for (String assetId : List.copyOf(pendingRemovals)) {
			try {
				index.remove(assetId);
				pendingRemovals.remove(assetId);
			} catch (RuntimeException e) {
				logger.warn("Index removal of {} still failing: {}", assetId, e.getMessage());
			}
		}
		for (AssetKey key : List.copyOf(pendingReindex)) {
			try {
				projectIdentity(key);
				pendingReindex.remove(key);
			} catch (RuntimeException e) {
				logger.warn("Re-indexing {} still failing: {}", key, e.getMessage());
			}
		}
		return pendingReindex.size() + pendingRemovals.size();
	}

	/**
	 * @return identities whose latest change is not yet reflected in the index
	 */
	public Set<AssetKey> pendingReindex() {
		return Set.copyOf(pendingReindex);
	}

	private void syncIndex(AssetKey key, String assetId) {
		withIndexRetries(key, assetId, () -> projectIdentity(key), () -> pendingReindex.add(key));
	}

	private void projectIdentity(AssetKey key) {
		List<ContextAsset> versions = store.findVersions(key);
		SemanticVersion highestPublished = versions.stream()
				.filter(a -> a.lifecycleState() == LifecycleState.PUBLISHED)
				.map(ContextAsset::version)
				.max(Comparator.naturalOrder())
				.orElse(null);
		for (ContextAsset version : versions) {
			boolean superseded = highestPublished != null
					&& !version.isDeprecated()
					&& highestPublished.isAfter(version.version());
			index.upsert(new IndexedAsset(version, superseded));
		}
	}

	private void withIndexRetries(AssetKey key, String assetId, Runnable action, Runnable onGiveUp) {
		RuntimeException failure = null;
		int attempts = config.indexRetries() + 1;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			try {
				action.run();
				return;
			} catch (RuntimeException e) {
				failure = e;
				logger.warn("Search index update for {} failed (attempt {}/{}): {}", key, attempt, attempts,
						e.getMessage());
				if (attempt < attempts && !pause()) {
					break;
				}
			}
		}
		onGiveUp.run();
		throw new SearchIndexUnavailableException(assetId,
				"Change to " + key + " was committed but is not yet searchable; it has been queued for re-indexing",
				failure);
	}

	private boolean pause() {
		if (config.indexRetryBackoff().isZero()) {
			return true;
		}
		try {
			Thread.sleep(config.indexRetryBackoff().toMillis());
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private static void checkRevision(ContextAsset current, Long expectedRevision) {
		if (expectedRevision != null && current.revision() != expectedRevision) {
			throw new ConcurrentAssetModificationException(current.id(), expectedRevision, current.revision(),
					current.lifecycleState());
		}
	}

	private static void validateContent(AssetType assetType, AssetContent content) {
		if (content == null) {
			throw new InvalidAssetContentException(assetType, "content is required");
		}
		if (content.assetType() != assetType) {
			throw new InvalidAssetContentException(assetType,
					"expected " + assetType.id() + " content but got " + content.assetType().id());
		}
		content.validate();
	}

	private static void requireText(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be blank");
		}
	}
}
