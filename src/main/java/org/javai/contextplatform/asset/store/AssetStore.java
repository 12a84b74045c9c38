package org.javai.contextplatform.asset.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.ConcurrentAssetModificationException;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.RevisionEntry;
import org.javai.contextplatform.asset.SemanticVersion;

/**
 * Durable, versioned storage of context assets and their transition history.
 *
 * <p>Only the lifecycle manager writes to a store. Writes to one logical identity are
 * serialised; writes to different identities may proceed in parallel. Every write is
 * conditional, either on a guard that inspects all stored versions of the identity or on
 * the revision the caller last read.</p>
 */
public interface AssetStore {

	Optional<ContextAsset> findById(String assetId);

	/**
	 * @return all stored versions of the identity, lowest version first
	 */
	List<ContextAsset> findVersions(AssetKey key);

	List<ContextAsset> findByConnection(String connectionId);

	/**
	 * @return ids of the connections that have stored assets
	 */
	Set<String> connectionIds();

	/**
	 * @return the identity's transitions in the order they were appended
	 */
	List<RevisionEntry> history(AssetKey key);

	/**
	 * Inserts a new version of {@code key}. The factory receives the identity's stored versions
	 * while the identity is locked and either returns the version to insert or rejects the
	 * insert by throwing, so uniqueness checks and version numbering are atomic with the write.
	 */
	ContextAsset insert(AssetKey key, Function<List<ContextAsset>, ContextAsset> factory);

	/**
	 * Replaces a stored version if its revision still equals {@code expectedRevision}.
	 *
	 * @param historyEntry transition appended with the write, or {@code null}
	 * @throws ConcurrentAssetModificationException if another write got there first
	 */
	ContextAsset compareAndSet(long expectedRevision, ContextAsset updated, RevisionEntry historyEntry);

	/**
	 * Removes one version, or every version when {@code version} is {@code null}. The guard
	 * validates the targets while the identity is locked.
	 *
	 * @return the removed versions
	 */
	List<ContextAsset> delete(AssetKey key, SemanticVersion version, Consumer<List<ContextAsset>> guard);
}
