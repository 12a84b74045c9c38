package org.javai.contextplatform.context;

import java.util.List;
import java.util.Locale;
import org.javai.contextplatform.asset.ContextAsset;

/**
 * Full content of one asset, as handed to an agent.
 */
public record AssetDetail(
		String assetId,
		String assetType,
		String canonicalKey,
		String version,
		String state,
		String name,
		String description,
		String content,
		List<String> tags) {

	static AssetDetail from(ContextAsset asset) {
		return new AssetDetail(asset.id(), asset.assetType().id(), asset.canonicalKey(), asset.version().toString(),
				asset.lifecycleState().name().toLowerCase(Locale.ROOT), asset.name(), asset.description(),
				asset.contentText(), asset.tags().stream().sorted().toList());
	}
}
