package org.javai.contextplatform.telemetry;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.javai.contextplatform.asset.SemanticVersion;

/**
 * One observed reuse of an asset version. Events are identified by {@code eventId}, so
 * delivering the same event twice is harmless.
 */
public record TelemetryEvent(String eventId, String assetId, SemanticVersion version, ContextKind contextKind,
		Instant occurredAt) {

	public TelemetryEvent {
		Objects.requireNonNull(eventId, "eventId must not be null");
		Objects.requireNonNull(assetId, "assetId must not be null");
		Objects.requireNonNull(contextKind, "contextKind must not be null");
		Objects.requireNonNull(occurredAt, "occurredAt must not be null");
	}

	public static TelemetryEvent of(String assetId, SemanticVersion version, ContextKind contextKind, Instant at) {
		return new TelemetryEvent(UUID.randomUUID().toString(), assetId, version, contextKind, at);
	}
}
