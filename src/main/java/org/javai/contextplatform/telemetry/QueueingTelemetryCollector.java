package org.javai.contextplatform.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TelemetryCollector} that hands events to a single aggregator thread.
 *
 * <p>{@link #record} only offers the event to a bounded queue; when the queue is full the event
 * is dropped with a warning. The aggregator thread drains the queue in batches, appends each
 * event to the {@link TelemetryEventLog} and, if the log accepted it as new, folds it into the
 * per-identity counters. Because the log de-duplicates by event id, an event delivered twice is
 * counted once.</p>
 *
 * <p>The counters are a cache over the log: every {@code reconcileInterval} they are rebuilt by
 * re-scanning the log, which repairs increments lost to resolution failures or to events that
 * reached the log by another route.</p>
 *
 * <pre>{@code
 * try (QueueingTelemetryCollector telemetry = new QueueingTelemetryCollector(
 *         lifecycle::identityOf, new InMemoryTelemetryEventLog(), TelemetryConfig.defaults())) {
 *     telemetry.record(asset.id(), asset.version(), ContextKind.MISSION);
 *     telemetry.flush();
 *     long uses = telemetry.aggregate(asset.id()).reuseCount();
 * }
 * }</pre>
 */
public class QueueingTelemetryCollector implements TelemetryCollector, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(QueueingTelemetryCollector.class);

	private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(30);
	private static final Comparator<ReuseAggregate> MOST_REUSED_FIRST =
			Comparator.comparingLong((ReuseAggregate a) -> a.reuseCount()).reversed();

	private final AssetIdentityResolver identityResolver;
	private final TelemetryEventLog eventLog;
	private final TelemetryConfig config;
	private final Clock clock;
	private final BlockingQueue<TelemetryEvent> queue;
	private final ScheduledExecutorService aggregator;
	private final Map<AssetKey, ReuseAggregate> aggregates = new ConcurrentHashMap<>();
	private final AtomicLong dropped = new AtomicLong();
	private final AtomicBoolean closed = new AtomicBoolean();

	public QueueingTelemetryCollector(AssetIdentityResolver identityResolver, TelemetryEventLog eventLog,
			TelemetryConfig config) {
		this(identityResolver, eventLog, config, Clock.systemUTC());
	}

	public QueueingTelemetryCollector(AssetIdentityResolver identityResolver, TelemetryEventLog eventLog,
			TelemetryConfig config, Clock clock) {
		this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver must not be null");
		this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
		this.config = config != null ? config : TelemetryConfig.defaults();
		this.clock = clock != null ? clock : Clock.systemUTC();
		this.queue = new ArrayBlockingQueue<>(this.config.queueCapacity());
		this.aggregator = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread thread = new Thread(r, "telemetry-aggregator");
			thread.setDaemon(true);
			return thread;
		});
		long drainMillis = this.config.drainInterval().toMillis();
		long reconcileMillis = this.config.reconcileInterval().toMillis();
		aggregator.scheduleWithFixedDelay(this::drainSafely, drainMillis, drainMillis, TimeUnit.MILLISECONDS);
		aggregator.scheduleWithFixedDelay(this::reconcileSafely, reconcileMillis, reconcileMillis,
				TimeUnit.MILLISECONDS);
		aggregator.execute(this::reconcileSafely);
	}

	@Override
	public void record(String assetId, SemanticVersion version, ContextKind contextKind) {
		try {
			if (closed.get()) {
				dropped.incrementAndGet();
				logger.warn("Telemetry collector is closed; dropping {} reuse of asset {}", contextKind, assetId);
				return;
			}
			TelemetryEvent event = TelemetryEvent.of(assetId, version, contextKind, clock.instant());
			if (!queue.offer(event)) {
				long total = dropped.incrementAndGet();
				logger.warn("Telemetry queue full ({} events); dropping {} reuse of asset {} ({} dropped so far)",
						config.queueCapacity(), contextKind, assetId, total);
			}
		} catch (RuntimeException e) {
			dropped.incrementAndGet();
			logger.warn("Failed to record {} reuse of asset {}", contextKind, assetId, e);
		}
	}

	@Override
	public ReuseAggregate aggregate(String assetId) {
		Optional<AssetKey> key = resolve(assetId);
		return key.map(k -> aggregates.getOrDefault(k, ReuseAggregate.empty(k)))
				.orElseGet(() -> ReuseAggregate.empty(null));
	}

	@Override
	public List<ReuseAggregate> topReused(int limit) {
		return aggregates.values().stream()
				.sorted(MOST_REUSED_FIRST)
				.limit(limit)
				.toList();
	}

	@Override
	public List<ReuseAggregate> highReuse(long minReuseCount) {
		return aggregates.values().stream()
				.filter(a -> a.reuseCount() >= minReuseCount)
				.sorted(MOST_REUSED_FIRST)
				.toList();
	}

	/**
	 * @return events dropped because the queue was full, the collector closed, or recording failed
	 */
	public long droppedEvents() {
		return dropped.get();
	}

	public int queuedEvents() {
		return queue.size();
	}

	/**
	 * Blocks until every event queued before this call has been applied.
	 */
	public void flush() {
		runOnAggregator(this::drainAll, "flush");
	}

	/**
	 * Rebuilds the counters from the event log on the aggregator thread and waits for it.
	 */
	public void reconcileNow() {
		runOnAggregator(this::reconcile, "reconcile");
	}

	/**
	 * Stops accepting events, applies what is queued and stops the aggregator thread.
	 */
	@Override
	public void close() {
		if (!closed.compareAndSet(false, true)) {
			return;
		}
		flush();
		aggregator.shutdown();
		try {
			if (!aggregator.awaitTermination(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
				logger.warn("Telemetry aggregator did not stop within {}", FLUSH_TIMEOUT);
				aggregator.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			aggregator.shutdownNow();
		}
	}

	private void runOnAggregator(Runnable task, String what) {
		try {
			aggregator.submit(task).get(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while waiting for telemetry {}", what);
		} catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
			logger.warn("Telemetry {} did not complete", what, e);
		}
	}

	private void drainSafely() {
		try {
			drain(config.batchSize());
		} catch (RuntimeException e) {
			logger.warn("Telemetry drain failed", e);
		}
	}

	private void reconcileSafely() {
		try {
			reconcile();
		} catch (RuntimeException e) {
			logger.warn("Telemetry reconciliation failed", e);
		}
	}

	private void drainAll() {
		int applied;
		do {
			applied = drain(config.batchSize());
		} while (applied > 0);
	}

	private int drain(int limit) {
		List<TelemetryEvent> batch = new ArrayList<>(Math.min(limit, queue.size() + 1));
		queue.drainTo(batch, limit);
		for (TelemetryEvent event : batch) {
			if (!eventLog.append(event)) {
				continue;
			}
			Optional<AssetKey> key = resolve(event.assetId());
			if (key.isPresent()) {
				aggregates.merge(key.get(), ReuseAggregate.empty(key.get()).plus(event),
						(existing, single) -> existing.plus(event));
			} else {
				logger.debug("Telemetry event {} refers to unknown asset {}; left for reconciliation",
						event.eventId(), event.assetId());
			}
		}
		if (!batch.isEmpty()) {
			logger.debug("Applied {} telemetry events", batch.size());
		}
		return batch.size();
	}

	private void reconcile() {
		Map<AssetKey, ReuseAggregate> rebuilt = new HashMap<>();
		List<TelemetryEvent> events = eventLog.since(null);
		for (TelemetryEvent event : events) {
			resolve(event.assetId()).ifPresent(key ->
					rebuilt.merge(key, ReuseAggregate.empty(key).plus(event), (existing, single) -> existing.plus(event)));
		}
		aggregates.keySet().retainAll(rebuilt.keySet());
		aggregates.putAll(rebuilt);
		logger.debug("Reconciled telemetry aggregates for {} identities from {} events", rebuilt.size(), events.size());
	}

	private Optional<AssetKey> resolve(String assetId) {
		try {
			return identityResolver.resolve(assetId);
		} catch (RuntimeException e) {
			logger.warn("Could not resolve identity of asset {}", assetId, e);
			return Optional.empty();
		}
	}
}
