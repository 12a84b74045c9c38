package org.javai.contextplatform.telemetry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Thread-safe in-memory {@link TelemetryEventLog}.
 */
public class InMemoryTelemetryEventLog implements TelemetryEventLog {

	private final List<TelemetryEvent> events = new ArrayList<>();
	private final Set<String> eventIds = new HashSet<>();

	@Override
	public synchronized boolean append(TelemetryEvent event) {
		if (!eventIds.add(event.eventId())) {
			return false;
		}
		events.add(event);
		return true;
	}

	@Override
	public synchronized List<TelemetryEvent> since(Instant from) {
		if (from == null) {
			return List.copyOf(events);
		}
		return events.stream()
				.filter(e -> !e.occurredAt().isBefore(from))
				.toList();
	}

	@Override
	public synchronized int size() {
		return events.size();
	}
}
