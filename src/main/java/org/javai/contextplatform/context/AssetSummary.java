package org.javai.contextplatform.context;

import org.javai.contextplatform.search.SearchHit;

/**
 * A search hit as shown to an agent.
 *
 * @param status {@code active}, {@code superseded} or {@code deprecated}
 * @param warning advice for non-active hits, {@code null} otherwise
 */
public record AssetSummary(
		String assetId,
		String assetType,
		String canonicalKey,
		String version,
		String name,
		String description,
		double score,
		String status,
		String warning) {

	static AssetSummary from(SearchHit hit) {
		var asset = hit.asset();
		String status;
		String warning = null;
		if (hit.deprecated()) {
			status = "deprecated";
			warning = "DEPRECATED: do not rely on this asset; look for a published replacement";
		} else if (hit.superseded()) {
			status = "superseded";
			warning = "A newer published version of " + asset.canonicalKey() + " exists";
		} else {
			status = "active";
		}
		return new AssetSummary(asset.id(), asset.assetType().id(), asset.canonicalKey(),
				asset.version().toString(), asset.name(), asset.description(), hit.score(), status, warning);
	}
}
