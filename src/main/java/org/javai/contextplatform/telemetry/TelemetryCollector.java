package org.javai.contextplatform.telemetry;

import java.util.List;
import org.javai.contextplatform.asset.SemanticVersion;

/**
 * Best-effort reuse tracking.
 *
 * <p>{@link #record} never throws and never blocks on aggregation; aggregates may lag behind
 * recorded events.</p>
 */
public interface TelemetryCollector {

	/**
	 * Records that an asset version was used. Failures are logged and swallowed.
	 */
	void record(String assetId, SemanticVersion version, ContextKind contextKind);

	/**
	 * @return reuse statistics of the asset's logical identity; empty if unknown
	 */
	ReuseAggregate aggregate(String assetId);

	/**
	 * @return the most reused identities, highest count first
	 */
	List<ReuseAggregate> topReused(int limit);

	/**
	 * @return identities reused at least {@code minReuseCount} times, highest count first
	 */
	List<ReuseAggregate> highReuse(long minReuseCount);
}
