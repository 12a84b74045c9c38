package org.javai.contextplatform.telemetry;

import java.util.Optional;
import org.javai.contextplatform.asset.AssetKey;

/**
 * Maps an asset version id to its logical identity. Telemetry needs nothing else from the
 * asset store.
 */
@FunctionalInterface
public interface AssetIdentityResolver {

	Optional<AssetKey> resolve(String assetId);
}
