package org.javai.contextplatform.telemetry;

import java.time.Instant;
import java.util.List;

/**
 * Append-only log of reuse events, de-duplicated by event id.
 */
public interface TelemetryEventLog {

	/**
	 * @return {@code false} if an event with the same id is already in the log
	 */
	boolean append(TelemetryEvent event);

	/**
	 * @param from inclusive lower bound, or {@code null} for the whole log
	 */
	List<TelemetryEvent> since(Instant from);

	int size();
}
