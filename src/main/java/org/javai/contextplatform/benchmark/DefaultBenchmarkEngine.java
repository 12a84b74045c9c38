package org.javai.contextplatform.benchmark;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.store.AssetStore;
import org.javai.contextplatform.telemetry.ContextKind;
import org.javai.contextplatform.telemetry.TelemetryCollector;

/**
 * Default {@link BenchmarkEngine}.
 *
 * <h2>Per case</h2>
 * <ol>
 *   <li>Ask the {@link SqlGenerator} for SQL, within the generation timeout.</li>
 *   <li>If the normalised SQL equals the expected SQL, pass with {@link ResultMatchKind#EXACT_SQL}.</li>
 *   <li>Otherwise execute it and compare the row-set digest with the expected digest (given, or
 *       computed by executing the expected SQL); equal digests pass with
 *       {@link ResultMatchKind#RESULT_EQUIVALENT}.</li>
 *   <li>Anything else, including errors and timeouts, is a failed result. Nothing is retried.</li>
 * </ol>
 *
 * <h2>Per run</h2>
 * <p>Cases run on a fixed pool of {@code parallelism} workers and share no mutable state. Calls
 * to the collaborators run on a separate pool so that a hung call can be abandoned when its
 * timeout expires. The score is computed only after every case has a result. The run fails as a
 * whole only when the connection cannot be verified, a fixture is missing, every case timed out,
 * or the caller cancelled it.</p>
 */
public class DefaultBenchmarkEngine implements BenchmarkEngine, AutoCloseable {

	private final BenchmarkRepository repository;
	private final AssetStore assetStore;
	private final SqlGenerator sqlGenerator;
	private final SqlExecutor sqlExecutor;
	private final TelemetryCollector telemetry;
	private final BenchmarkConfig config;
	private final Clock clock;
	private final BenchmarkLogger logger = new BenchmarkLogger(DefaultBenchmarkEngine.class);
	private final ExecutorService coordinator = Executors.newCachedThreadPool(daemonThreads("benchmark-run"));
	private final ExecutorService callExecutor = Executors.newCachedThreadPool(daemonThreads("benchmark-call"));

	public DefaultBenchmarkEngine(BenchmarkRepository repository, AssetStore assetStore, SqlGenerator sqlGenerator,
			SqlExecutor sqlExecutor, TelemetryCollector telemetry, BenchmarkConfig config) {
		this(repository, assetStore, sqlGenerator, sqlExecutor, telemetry, config, Clock.systemUTC());
	}

	/**
	 * @param telemetry receives fixture reuse events; may be {@code null}
	 */
	public DefaultBenchmarkEngine(BenchmarkRepository repository, AssetStore assetStore, SqlGenerator sqlGenerator,
			SqlExecutor sqlExecutor, TelemetryCollector telemetry, BenchmarkConfig config, Clock clock) {
		this.repository = Objects.requireNonNull(repository, "repository must not be null");
		this.assetStore = Objects.requireNonNull(assetStore, "assetStore must not be null");
		this.sqlGenerator = Objects.requireNonNull(sqlGenerator, "sqlGenerator must not be null");
		this.sqlExecutor = Objects.requireNonNull(sqlExecutor, "sqlExecutor must not be null");
		this.telemetry = telemetry;
		this.config = config != null ? config : BenchmarkConfig.defaults();
		this.clock = clock != null ? clock : Clock.systemUTC();
	}

	@Override
	public void registerSuite(BenchmarkSuite suite) {
		Objects.requireNonNull(suite, "suite must not be null");
		repository.saveSuite(suite);
		logger.debug("Registered benchmark suite {} with {} cases", suite.id(), suite.cases().size());
	}

	@Override
	public Optional<BenchmarkSuite> suite(String suiteId) {
		return repository.findSuite(suiteId);
	}

	@Override
	public BenchmarkRun run(String suiteId, String connectionId, RunOptions options) {
		return start(suiteId, connectionId, options).await();
	}

	@Override
	public RunHandle start(String suiteId, String connectionId, RunOptions options) {
		return start(suiteId, connectionId, options, null);
	}

	@Override
	public BenchmarkRun validateAsset(String assetId, String suiteId, String connectionId, RunOptions options) {
		Objects.requireNonNull(assetId, "assetId must not be null");
		return start(suiteId, connectionId, options, assetId).await();
	}

	private RunHandle start(String suiteId, String connectionId, RunOptions options, String validatedAssetId) {
		Objects.requireNonNull(connectionId, "connectionId must not be null");
		BenchmarkSuite suite = repository.findSuite(suiteId)
				.orElseThrow(() -> new IllegalArgumentException("Unknown benchmark suite: " + suiteId));
		RunOptions effective = options != null ? options : RunOptions.defaults();
		BenchmarkRun pending = BenchmarkRun.pending(UUID.randomUUID().toString(), suite.id(), connectionId,
				effective.baselineRunId());
		repository.saveRun(pending);

		AtomicReference<String> cancellation = new AtomicReference<>();
		CompletableFuture<BenchmarkRun> completion = CompletableFuture.supplyAsync(
				() -> execute(pending, suite, effective, validatedAssetId, cancellation), coordinator);
		return new RunHandle(pending.id(), completion, cancellation);
	}

	private BenchmarkRun execute(BenchmarkRun pending, BenchmarkSuite suite, RunOptions options,
			String validatedAssetId, AtomicReference<String> cancellation) {
		BenchmarkRun run = pending.running(clock.instant());
		repository.saveRun(run);
		List<BenchmarkCase> cases = suite.select(options.tagFilter());
		int parallelism = Math.max(1, Math.min(options.effectiveParallelism(config), cases.size()));
		logger.logRunStarted(run, cases.size(), parallelism);

		List<ContextAsset> fixtures;
		try {
			sqlExecutor.verifyConnection(run.connectionId());
		} catch (RuntimeException e) {
			throw fail(run, "Target connection " + run.connectionId() + " is unreachable: " + describe(e), List.of(), e);
		}
		try {
			fixtures = resolveFixtures(suite, validatedAssetId);
		} catch (RuntimeException e) {
			throw fail(run, describe(e), List.of(), e);
		}
		recordFixtureUse(fixtures, validatedAssetId);

		List<BenchmarkResult> results;
		try {
			results = executeCases(run, cases, fixtures, options, parallelism, cancellation);
		} catch (RuntimeException e) {
			throw fail(run, "Benchmark run aborted: " + describe(e), List.of(), e);
		}
		RunSummary summary = summarize(results, config.severityWeights());
		repository.saveResults(run.id(), results);

		String cancelReason = cancellation.get();
		if (cancelReason != null) {
			BenchmarkRun cancelled = run.failed(clock.instant(), "Cancelled: " + cancelReason, summary);
			repository.saveRun(cancelled);
			logger.logRunFinished(cancelled);
			return cancelled;
		}
		if (!results.isEmpty() && results.stream().allMatch(BenchmarkResult::timedOut)) {
			throw fail(run, "Every one of the " + results.size() + " cases timed out", null, null);
		}
		if (cases.isEmpty()) {
			logger.warn("[{}] run {} selected no cases (tag filter {})", suite.id(), run.id(), options.tagFilter());
		}
		BenchmarkRun completed = run.completed(clock.instant(), score(results, config.severityWeights()), summary);
		repository.saveRun(completed);
		logger.logRunFinished(completed);
		return completed;
	}

	/**
	 * Stores the run as failed and returns the exception to throw.
	 *
	 * @param results results to store first, or {@code null} if they already are
	 */
	private BenchmarkInfrastructureException fail(BenchmarkRun run, String reason, List<BenchmarkResult> results,
			Throwable cause) {
		if (results != null) {
			repository.saveResults(run.id(), results);
		}
		List<BenchmarkResult> stored = repository.results(run.id());
		BenchmarkRun failed = run.failed(clock.instant(), reason, summarize(stored, config.severityWeights()));
		repository.saveRun(failed);
		logger.logRunFinished(failed);
		return new BenchmarkInfrastructureException(failed, "Benchmark run " + run.id() + " failed: " + reason, cause);
	}

	private List<ContextAsset> resolveFixtures(BenchmarkSuite suite, String validatedAssetId) {
		List<String> ids = new ArrayList<>(suite.fixtureAssetIds());
		if (validatedAssetId != null && !ids.contains(validatedAssetId)) {
			ids.add(validatedAssetId);
		}
		List<ContextAsset> fixtures = new ArrayList<>();
		for (String id : ids) {
			ContextAsset asset = assetStore.findById(id)
					.orElseThrow(() -> new IllegalStateException("Fixture asset " + id + " of suite " + suite.id()
							+ " does not exist"));
			if (asset.isDeprecated()) {
				logger.warn("[{}] fixture {} ({}@{}) is deprecated and will not be used",
						suite.id(), id, asset.key(), asset.version());
				continue;
			}
			fixtures.add(asset);
		}
		return fixtures;
	}

	private void recordFixtureUse(List<ContextAsset> fixtures, String validatedAssetId) {
		if (telemetry == null) {
			return;
		}
		for (ContextAsset fixture : fixtures) {
			ContextKind kind = fixture.id().equals(validatedAssetId) ? ContextKind.VALIDATION : ContextKind.BENCHMARK;
			telemetry.record(fixture.id(), fixture.version(), kind);
		}
	}

	private List<BenchmarkResult> executeCases(BenchmarkRun run, List<BenchmarkCase> cases, List<ContextAsset> fixtures,
			RunOptions options, int parallelism, AtomicReference<String> cancellation) {
		Duration caseTimeout = options.effectiveCaseTimeout(config);
		Duration generationTimeout = options.effectiveGenerationTimeout(config);
		ExecutorService workers = Executors.newFixedThreadPool(parallelism,
				daemonThreads("benchmark-" + run.id().substring(0, 8)));
		try {
			List<Future<BenchmarkResult>> futures = new ArrayList<>(cases.size());
			for (BenchmarkCase benchmarkCase : cases) {
				futures.add(workers.submit(() -> {
					if (cancellation.get() != null) {
						return BenchmarkResult.skipped(run.id(), benchmarkCase,
								"Run cancelled before the case started: " + cancellation.get());
					}
					return runCase(run, benchmarkCase, fixtures, caseTimeout, generationTimeout);
				}));
			}
			// join barrier: results are collected in suite order once every case has finished
			List<BenchmarkResult> results = new ArrayList<>(cases.size());
			for (int i = 0; i < cases.size(); i++) {
				BenchmarkResult result = awaitCase(run, cases.get(i), futures.get(i), cancellation);
				logger.logCaseResult(run, cases.get(i), result);
				results.add(result);
			}
			return results;
		} finally {
			workers.shutdown();
		}
	}

	private BenchmarkResult awaitCase(BenchmarkRun run, BenchmarkCase benchmarkCase, Future<BenchmarkResult> future,
			AtomicReference<String> cancellation) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			cancellation.compareAndSet(null, "interrupted");
			future.cancel(true);
			return BenchmarkResult.skipped(run.id(), benchmarkCase, "Run interrupted");
		} catch (ExecutionException e) {
			return BenchmarkResult.failed(run.id(), benchmarkCase, null, null, describe(e.getCause()), Duration.ZERO,
					false);
		}
	}

	private BenchmarkResult runCase(BenchmarkRun run, BenchmarkCase benchmarkCase, List<ContextAsset> fixtures,
			Duration caseTimeout, Duration generationTimeout) {
		long started = System.nanoTime();
		long deadline = started + caseTimeout.toNanos();
		String actualSql = null;
		String actualDigest = null;
		try {
			Duration generationBudget = min(generationTimeout, remaining(deadline));
			GeneratedSql generated = call(() -> sqlGenerator.generate(benchmarkCase.question(), fixtures),
					generationBudget, "SQL generation");
			actualSql = generated == null ? null : generated.sql();
			if (actualSql == null || actualSql.isBlank()) {
				return BenchmarkResult.failed(run.id(), benchmarkCase, actualSql, null,
						"SQL generator returned no SQL", elapsed(started), false);
			}
			if (benchmarkCase.expectedSql() != null && SqlNormalizer.equivalent(actualSql, benchmarkCase.expectedSql())) {
				return BenchmarkResult.passed(run.id(), benchmarkCase, ResultMatchKind.EXACT_SQL, actualSql, null,
						elapsed(started));
			}

			String expectedDigest = expectedDigest(run, benchmarkCase, deadline);
			String sql = actualSql;
			RowSet rows = call(() -> sqlExecutor.execute(sql, run.connectionId()), remaining(deadline),
					"SQL execution");
			actualDigest = ResultDigest.of(rows);
			if (actualDigest.equals(expectedDigest)) {
				return BenchmarkResult.passed(run.id(), benchmarkCase, ResultMatchKind.RESULT_EQUIVALENT, actualSql,
						actualDigest, elapsed(started));
			}
			return BenchmarkResult.failed(run.id(), benchmarkCase, actualSql, actualDigest,
					"Result digest mismatch: expected " + abbreviate(expectedDigest) + " but got "
							+ abbreviate(actualDigest) + " (" + rows.size() + " rows)",
					elapsed(started), false);
		} catch (CallTimeoutException e) {
			return BenchmarkResult.failed(run.id(), benchmarkCase, actualSql, actualDigest, e.getMessage(),
					elapsed(started), true);
		} catch (RuntimeException e) {
			return BenchmarkResult.failed(run.id(), benchmarkCase, actualSql, actualDigest, describe(e),
					elapsed(started), false);
		}
	}

	private String expectedDigest(BenchmarkRun run, BenchmarkCase benchmarkCase, long deadline) {
		if (benchmarkCase.expectedResultDigest() != null && !benchmarkCase.expectedResultDigest().isBlank()) {
			return benchmarkCase.expectedResultDigest();
		}
		try {
			RowSet expected = call(() -> sqlExecutor.execute(benchmarkCase.expectedSql(), run.connectionId()),
					remaining(deadline), "expected SQL execution");
			return ResultDigest.of(expected);
		} catch (CallTimeoutException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new SqlExecutionException("Expected SQL of case " + benchmarkCase.id() + " failed: " + describe(e), e);
		}
	}

	private <T> T call(Callable<T> task, Duration budget, String what) {
		if (budget.isZero() || budget.isNegative()) {
			throw new CallTimeoutException("Timeout: case time budget exhausted before " + what);
		}
		Future<T> future = callExecutor.submit(task);
		try {
			return future.get(budget.toNanos(), TimeUnit.NANOSECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			throw new CallTimeoutException("Timeout: " + what + " exceeded " + budget.toMillis() + " ms");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new SqlExecutionException(what + " failed: " + describe(cause), cause);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			throw new IllegalStateException(what + " interrupted", e);
		}
	}

	@Override
	public Optional<BenchmarkRun> getRun(String runId) {
		return repository.findRun(runId);
	}

	@Override
	public List<BenchmarkRun> runs(String suiteId) {
		return repository.runs(suiteId);
	}

	@Override
	public List<BenchmarkResult> results(String runId, boolean failedOnly) {
		List<BenchmarkResult> results = repository.results(runId);
		if (!failedOnly) {
			return results;
		}
		return results.stream()
				.filter(r -> r.status() == ResultStatus.FAILED)
				.toList();
	}

	@Override
	public RunComparison compare(String runId, String baselineRunId) {
		BenchmarkRun run = repository.findRun(runId)
				.orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
		String baselineId = baselineRunId != null ? baselineRunId : run.baselineRunId();
		if (baselineId == null) {
			throw new IllegalArgumentException("Run " + runId + " has no baseline to compare against");
		}
		BenchmarkRun baseline = repository.findRun(baselineId)
				.orElseThrow(() -> new IllegalArgumentException("Unknown baseline run: " + baselineId));

		Map<String, BenchmarkResult> baselineResults = repository.results(baselineId).stream()
				.collect(Collectors.toMap(BenchmarkResult::caseId, Function.identity(), (a, b) -> a));
		List<String> newlyFailing = new ArrayList<>();
		List<String> newlyPassing = new ArrayList<>();
		for (BenchmarkResult result : repository.results(runId)) {
			BenchmarkResult before = baselineResults.get(result.caseId());
			if (before == null || !before.scored() || !result.scored()) {
				continue;
			}
			if (before.passed() && !result.passed()) {
				newlyFailing.add(result.caseId());
			} else if (!before.passed() && result.passed()) {
				newlyPassing.add(result.caseId());
			}
		}
		Double delta = run.score() != null && baseline.score() != null ? run.score() - baseline.score() : null;
		return new RunComparison(runId, baselineId, run.score(), baseline.score(), delta, newlyFailing, newlyPassing);
	}

	@Override
	public Optional<FailureFingerprint> fingerprint(BenchmarkResult result) {
		if (result == null || result.status() != ResultStatus.FAILED) {
			return Optional.empty();
		}
		return Optional.of(FailureFingerprint.of(result));
	}

	@Override
	public SuiteStats suiteStats(String suiteId) {
		List<BenchmarkRun> runs = repository.runs(suiteId);
		List<BenchmarkRun> completed = runs.stream()
				.filter(r -> r.status() == RunStatus.COMPLETED && r.score() != null)
				.toList();
		int failed = (int) runs.stream().filter(r -> r.status() == RunStatus.FAILED).count();
		Double average = completed.isEmpty() ? null
				: completed.stream().mapToDouble(BenchmarkRun::score).average().orElse(0.0);
		Double lastScore = completed.stream()
				.max(Comparator.comparing(BenchmarkRun::startedAt))
				.map(BenchmarkRun::score)
				.orElse(null);
		var lastRunAt = runs.stream()
				.map(BenchmarkRun::startedAt)
				.filter(Objects::nonNull)
				.max(Comparator.naturalOrder())
				.orElse(null);
		return new SuiteStats(suiteId, runs.size(), completed.size(), failed, average, lastScore, lastRunAt);
	}

	/**
	 * Weighted pass ratio over scored (not skipped) results; 0 when nothing was scored.
	 */
	static double score(List<BenchmarkResult> results, SeverityWeights weights) {
		double total = 0.0;
		double passed = 0.0;
		for (BenchmarkResult result : results) {
			if (!result.scored()) {
				continue;
			}
			double weight = weights.weight(result.severity());
			total += weight;
			if (result.passed()) {
				passed += weight;
			}
		}
		return total == 0.0 ? 0.0 : passed / total;
	}

	static RunSummary summarize(List<BenchmarkResult> results, SeverityWeights weights) {
		int passed = 0;
		int failed = 0;
		int skipped = 0;
		int timedOut = 0;
		Map<Severity, int[]> counts = new EnumMap<>(Severity.class);
		for (BenchmarkResult result : results) {
			switch (result.status()) {
				case PASSED -> passed++;
				case FAILED -> failed++;
				case SKIPPED -> skipped++;
			}
			if (result.timedOut()) {
				timedOut++;
			}
			if (result.scored()) {
				int[] tally = counts.computeIfAbsent(result.severity(), s -> new int[2]);
				tally[1]++;
				if (result.passed()) {
					tally[0]++;
				}
			}
		}
		Map<Severity, SeverityBreakdown> bySeverity = new EnumMap<>(Severity.class);
		counts.forEach((severity, tally) ->
				bySeverity.put(severity, new SeverityBreakdown(tally[0], tally[1], weights.weight(severity))));
		return new RunSummary(results.size(), passed, failed, skipped, timedOut, bySeverity);
	}

	@Override
	public void close() {
		coordinator.shutdownNow();
		callExecutor.shutdownNow();
	}

	private static Duration remaining(long deadlineNanos) {
		return Duration.ofNanos(deadlineNanos - System.nanoTime());
	}

	private static Duration min(Duration a, Duration b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	private static Duration elapsed(long startedNanos) {
		return Duration.ofNanos(System.nanoTime() - startedNanos);
	}

	private static String abbreviate(String digest) {
		return digest == null ? "none" : digest.substring(0, Math.min(12, digest.length()));
	}

	private static String describe(Throwable e) {
		if (e == null) {
			return "unknown error";
		}
		String message = e.getMessage();
		return message == null || message.isBlank() ? e.getClass().getSimpleName()
				: e.getClass().getSimpleName() + ": " + message;
	}

	private static ThreadFactory daemonThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return r -> {
			Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private static final class CallTimeoutException extends RuntimeException {
		CallTimeoutException(String message) {
			super(message);
		}
	}
}
