package org.javai.contextplatform.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.javai.contextplatform.asset.AssetKey;

/**
 * Reuse statistics for one logical asset identity, summed over all of its versions.
 *
 * @param key the identity, {@code null} when the asset could not be resolved
 * @param reuseCount total number of reuse events
 * @param lastReusedAt time of the latest event, {@code null} if never reused
 * @param reuseByType counts per context kind
 */
public record ReuseAggregate(AssetKey key, long reuseCount, Instant lastReusedAt, Map<ContextKind, Long> reuseByType) {

	public ReuseAggregate {
		EnumMap<ContextKind, Long> copy = new EnumMap<>(ContextKind.class);
		if (reuseByType != null) {
			copy.putAll(reuseByType);
		}
		reuseByType = Collections.unmodifiableMap(copy);
	}

	public static ReuseAggregate empty(AssetKey key) {
		return new ReuseAggregate(key, 0, null, Map.of());
	}

	public long reuseCount(ContextKind kind) {
		return reuseByType.getOrDefault(kind, 0L);
	}

	/**
	 * @return a copy that also counts {@code event}
	 */
	public ReuseAggregate plus(TelemetryEvent event) {
		EnumMap<ContextKind, Long> counts = new EnumMap<>(ContextKind.class);
		counts.putAll(reuseByType);
		counts.merge(event.contextKind(), 1L, Long::sum);
		Instant last = lastReusedAt == null || event.occurredAt().isAfter(lastReusedAt)
				? event.occurredAt() : lastReusedAt;
		return new ReuseAggregate(key, reuseCount + 1, last, counts);
	}
}
