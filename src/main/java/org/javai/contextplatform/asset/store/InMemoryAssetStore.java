package org.javai.contextplatform.asset.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetNotFoundException;
import org.javai.contextplatform.asset.ConcurrentAssetModificationException;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.RevisionEntry;
import org.javai.contextplatform.asset.SemanticVersion;

/**
 * In-memory implementation of {@link AssetStore}.
 *
 * <p>Each logical identity owns a monitor; all reads and writes of that identity's versions
 * and history synchronise on it, so there is no store-wide lock. Subclasses persist changes
 * through the {@code write*} hooks, which run under the identity's monitor before the
 * in-memory state changes; a hook that throws leaves the store untouched.</p>
 */
public class InMemoryAssetStore implements AssetStore {

	private final ConcurrentHashMap<AssetKey, Identity> identities = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<String, AssetKey> keysById = new ConcurrentHashMap<>();

	@Override
	public Optional<ContextAsset> findById(String assetId) {
		AssetKey key = keysById.get(assetId);
		if (key == null) {
			return Optional.empty();
		}
		Identity identity = identities.get(key);
		if (identity == null) {
			return Optional.empty();
		}
		synchronized (identity) {
			return identity.versions.values().stream()
					.filter(a -> a.id().equals(assetId))
					.findFirst();
		}
	}

	@Override
	public List<ContextAsset> findVersions(AssetKey key) {
		Identity identity = identities.get(key);
		if (identity == null) {
			return List.of();
		}
		synchronized (identity) {
			return List.copyOf(identity.versions.values());
		}
	}

	@Override
	public List<ContextAsset> findByConnection(String connectionId) {
		List<ContextAsset> result = new ArrayList<>();
		identities.forEach((key, identity) -> {
			if (key.connectionId().equals(connectionId)) {
				synchronized (identity) {
					result.addAll(identity.versions.values());
				}
			}
		});
		result.sort(Comparator.comparing((ContextAsset a) -> a.key().toString()).thenComparing(ContextAsset::version));
		return result;
	}

	@Override
	public Set<String> connectionIds() {
		Set<String> ids = new TreeSet<>();
		identities.forEach((key, identity) -> {
			synchronized (identity) {
				if (!identity.versions.isEmpty()) {
					ids.add(key.connectionId());
				}
			}
		});
		return ids;
	}

	@Override
	public List<RevisionEntry> history(AssetKey key) {
		Identity identity = identities.get(key);
		if (identity == null) {
			return List.of();
		}
		synchronized (identity) {
			return List.copyOf(identity.history);
		}
	}

	@Override
	public ContextAsset insert(AssetKey key, Function<List<ContextAsset>, ContextAsset> factory) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(factory, "factory must not be null");
		Identity identity = identities.computeIfAbsent(key, k -> new Identity());
		synchronized (identity) {
			ContextAsset asset = factory.apply(List.copyOf(identity.versions.values()));
			if (!key.equals(asset.key())) {
				throw new IllegalArgumentException("Asset " + asset.id() + " does not belong to " + key);
			}
			if (identity.versions.containsKey(asset.version())) {
				throw new IllegalStateException("Version " + asset.version() + " of " + asset.key() + " already stored");
			}
			writeAsset(asset);
			identity.versions.put(asset.version(), asset);
			keysById.put(asset.id(), asset.key());
			return asset;
		}
	}

	@Override
	public ContextAsset compareAndSet(long expectedRevision, ContextAsset updated, RevisionEntry historyEntry) {
		Objects.requireNonNull(updated, "updated must not be null");
		Identity identity = identities.get(updated.key());
		if (identity == null) {
			throw AssetNotFoundException.forId(updated.id());
		}
		synchronized (identity) {
			ContextAsset stored = identity.versions.get(updated.version());
			if (stored == null || !stored.id().equals(updated.id())) {
				throw AssetNotFoundException.forId(updated.id());
			}
			if (stored.revision() != expectedRevision) {
				throw new ConcurrentAssetModificationException(stored.id(), expectedRevision, stored.revision(),
						stored.lifecycleState());
			}
			writeAsset(updated);
			if (historyEntry != null) {
				writeHistory(updated.key(), historyEntry);
				identity.history.add(historyEntry);
			}
			identity.versions.put(updated.version(), updated);
			return updated;
		}
	}

	@Override
	public List<ContextAsset> delete(AssetKey key, SemanticVersion version, Consumer<List<ContextAsset>> guard) {
		Identity identity = identities.get(key);
		if (identity == null) {
			throw AssetNotFoundException.forKey(key);
		}
		synchronized (identity) {
			List<ContextAsset> targets;
			if (version == null) {
				targets = List.copyOf(identity.versions.values());
			} else {
				ContextAsset target = identity.versions.get(version);
				targets = target == null ? List.of() : List.of(target);
			}
			if (targets.isEmpty()) {
				throw new AssetNotFoundException("No context asset " + key + (version != null ? "@" + version : ""));
			}
			if (guard != null) {
				guard.accept(targets);
			}
			for (ContextAsset target : targets) {
				deleteAsset(target);
				identity.versions.remove(target.version());
				keysById.remove(target.id());
			}
			return targets;
		}
	}

	/**
	 * Restores previously persisted state without running guards or hooks.
	 */
	protected void restore(Collection<ContextAsset> assets, Map<AssetKey, List<RevisionEntry>> history) {
		for (ContextAsset asset : assets) {
			Identity identity = identities.computeIfAbsent(asset.key(), k -> new Identity());
			synchronized (identity) {
				identity.versions.put(asset.version(), asset);
				keysById.put(asset.id(), asset.key());
			}
		}
		history.forEach((key, entries) -> {
			Identity identity = identities.computeIfAbsent(key, k -> new Identity());
			synchronized (identity) {
				identity.history.addAll(entries);
			}
		});
	}

	protected void writeAsset(ContextAsset asset) {
	}

	protected void writeHistory(AssetKey key, RevisionEntry entry) {
	}

	protected void deleteAsset(ContextAsset asset) {
	}

	private static final class Identity {
		private final NavigableMap<SemanticVersion, ContextAsset> versions = new TreeMap<>();
		private final List<RevisionEntry> history = new ArrayList<>();
	}
}
