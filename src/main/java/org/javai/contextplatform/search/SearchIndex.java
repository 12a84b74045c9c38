package org.javai.contextplatform.search;

import java.util.List;
import java.util.Optional;
import org.javai.contextplatform.asset.TagCategory;

/**
 * Queryable projection of asset versions, kept in step with the store by the lifecycle manager.
 */
public interface SearchIndex {

	/**
	 * Adds or replaces the entry for the asset's id. Repeating an upsert is a no-op and an
	 * upsert carrying an older revision than the indexed one is ignored.
	 */
	void upsert(IndexedAsset entry);

	/**
	 * @return {@code true} if an entry was removed
	 */
	boolean remove(String assetId);

	Optional<IndexedAsset> get(String assetId);

	SearchResults search(SearchQuery query);

	/**
	 * @param connectionId connection to aggregate over, or {@code null} for all
	 * @param category optional category filter
	 * @return tag usage, most used first
	 */
	List<TagUsage> tags(String connectionId, TagCategory category);

	/**
	 * Drops every entry of the connection.
	 */
	void clear(String connectionId);

	int size();
}
