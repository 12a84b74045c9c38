package org.javai.contextplatform.lifecycle;

import java.util.List;
import java.util.Optional;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetNotFoundException;
import org.javai.contextplatform.asset.AssetPatch;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ConcurrentAssetModificationException;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.DuplicateKeyException;
import org.javai.contextplatform.asset.InvalidLifecycleTransitionException;
import org.javai.contextplatform.asset.InvalidStateForMutationException;
import org.javai.contextplatform.asset.LifecycleState;
import org.javai.contextplatform.asset.RevisionEntry;
import org.javai.contextplatform.asset.SemanticVersion;
import org.javai.contextplatform.asset.TagCategory;
import org.javai.contextplatform.search.SearchIndexUnavailableException;
import org.javai.contextplatform.search.SearchQuery;
import org.javai.contextplatform.search.SearchResults;
import org.javai.contextplatform.search.TagUsage;

/**
 * Governed create, edit and state transitions for context assets.
 *
 * <p>Every mutation returns only after the search index has acknowledged the change, so a
 * successful return means the new state is discoverable. If the index cannot be reached the
 * committed change is queued for re-indexing and {@link SearchIndexUnavailableException} is
 * thrown instead of a success.</p>
 */
public interface LifecycleManager {

	/**
	 * Creates version 1.0.0 of a new asset in {@code DRAFT}.
	 *
	 * @throws DuplicateKeyException if a non-deprecated version of the identity exists
	 */
	ContextAsset create(NewAsset request);

	/**
	 * Merges the patch into a draft.
	 *
	 * @throws InvalidStateForMutationException if the asset is not a draft
	 */
	ContextAsset update(String assetId, AssetPatch patch);

	/**
	 * Merges the patch into a draft, provided nobody changed it since {@code expectedRevision}.
	 *
	 * @throws ConcurrentAssetModificationException if the revision moved on
	 */
	ContextAsset update(String assetId, AssetPatch patch, long expectedRevision);

	/**
	 * @throws InvalidLifecycleTransitionException for anything but DRAFT→VERIFIED or
	 *         VERIFIED→PUBLISHED, or when {@code promotedBy} is missing
	 */
	ContextAsset promote(String assetId, LifecycleState targetState, String promotedBy, String note);

	ContextAsset promote(String assetId, LifecycleState targetState, String promotedBy, String note,
			long expectedRevision);

	/**
	 * Retires a version. Deprecated versions stay searchable but rank last and are flagged.
	 */
	ContextAsset deprecate(String assetId, String by, String reason);

	/**
	 * Forks a new draft with the next minor version above the identity's highest version.
	 *
	 * @throws DuplicateKeyException if the identity already has an open draft
	 */
	ContextAsset createRevision(String assetId, String author);

	/**
	 * Hard-deletes one draft version, or every version when {@code version} is {@code null}.
	 *
	 * @return the removed versions
	 * @throws InvalidStateForMutationException if any targeted version is not a draft
	 */
	List<ContextAsset> delete(String connectionId, AssetType assetType, String canonicalKey, SemanticVersion version);

	/**
	 * @throws AssetNotFoundException if there is no such asset
	 */
	ContextAsset get(String assetId);

	Optional<ContextAsset> find(AssetKey key, SemanticVersion version);

	/**
	 * @return the highest published version, else the highest non-deprecated one
	 */
	Optional<ContextAsset> current(AssetKey key);

	List<ContextAsset> versions(AssetKey key);

	/**
	 * @param assetType optional filter
	 * @param state optional filter
	 */
	List<ContextAsset> list(String connectionId, AssetType assetType, LifecycleState state);

	List<RevisionEntry> history(AssetKey key);

	Optional<AssetKey> identityOf(String assetId);

	SearchResults search(SearchQuery query);

	List<TagUsage> tags(String connectionId, TagCategory category);

	/**
	 * Rebuilds the connection's index entries from the store.
	 *
	 * @return number of versions indexed
	 */
	int reindex(String connectionId);
}
