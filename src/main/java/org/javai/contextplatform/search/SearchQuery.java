package org.javai.contextplatform.search;

import java.util.Objects;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.LifecycleState;

/**
 * A hybrid search request scoped to one connection.
 *
 * @param connectionId connection to search within
 * @param text free-text query
 * @param limit maximum number of hits
 * @param assetType optional type filter
 * @param state optional lifecycle-state filter
 * @param includeInactive whether deprecated and superseded versions are returned (ranked last)
 */
public record SearchQuery(String connectionId, String text, int limit, AssetType assetType, LifecycleState state,
		boolean includeInactive) {

	public static final int DEFAULT_LIMIT = 10;

	public SearchQuery {
		Objects.requireNonNull(connectionId, "connectionId must not be null");
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("search text must not be blank");
		}
		if (limit <= 0) {
			throw new IllegalArgumentException("limit must be positive");
		}
	}

	public static SearchQuery of(String connectionId, String text) {
		return new SearchQuery(connectionId, text, DEFAULT_LIMIT, null, null, true);
	}

	public static SearchQuery of(String connectionId, String text, int limit) {
		return new SearchQuery(connectionId, text, limit, null, null, true);
	}

	public SearchQuery withLimit(int value) {
		return new SearchQuery(connectionId, text, value, assetType, state, includeInactive);
	}

	public SearchQuery withAssetType(AssetType value) {
		return new SearchQuery(connectionId, text, limit, value, state, includeInactive);
	}

	public SearchQuery withState(LifecycleState value) {
		return new SearchQuery(connectionId, text, limit, assetType, value, includeInactive);
	}

	public SearchQuery activeOnly() {
		return new SearchQuery(connectionId, text, limit, assetType, state, false);
	}
}
