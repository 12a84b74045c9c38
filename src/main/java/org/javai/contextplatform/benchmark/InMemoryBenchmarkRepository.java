package org.javai.contextplatform.benchmark;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link BenchmarkRepository}.
 */
public class InMemoryBenchmarkRepository implements BenchmarkRepository {

	private final Map<String, BenchmarkSuite> suites = new ConcurrentHashMap<>();
	private final Map<String, BenchmarkRun> runs = new ConcurrentHashMap<>();
	private final Map<String, List<BenchmarkResult>> results = new ConcurrentHashMap<>();
	private final List<String> runOrder = new ArrayList<>();

	@Override
	public void saveSuite(BenchmarkSuite suite) {
		suites.put(suite.id(), suite);
	}

	@Override
	public Optional<BenchmarkSuite> findSuite(String suiteId) {
		return Optional.ofNullable(suites.get(suiteId));
	}

	@Override
	public List<BenchmarkSuite> suites() {
		return suites.values().stream()
				.sorted(Comparator.comparing(BenchmarkSuite::id))
				.toList();
	}

	@Override
	public synchronized void saveRun(BenchmarkRun run) {
		BenchmarkRun existing = runs.get(run.id());
		if (existing != null && existing.status().isTerminal()) {
			throw new IllegalStateException("Run " + run.id() + " is " + existing.status() + " and cannot be rewritten");
		}
		if (existing == null) {
			runOrder.add(run.id());
		}
		runs.put(run.id(), run);
	}

	@Override
	public Optional<BenchmarkRun> findRun(String runId) {
		return Optional.ofNullable(runs.get(runId));
	}

	@Override
	public synchronized List<BenchmarkRun> runs(String suiteId) {
		return runOrder.stream()
				.map(runs::get)
				.filter(r -> r.suiteId().equals(suiteId))
				.toList();
	}

	@Override
	public synchronized void saveResults(String runId, List<BenchmarkResult> runResults) {
		BenchmarkRun run = runs.get(runId);
		if (run == null) {
			throw new IllegalStateException("Unknown run " + runId);
		}
		if (run.status().isTerminal()) {
			throw new IllegalStateException("Run " + runId + " is " + run.status() + "; its results are immutable");
		}
		results.put(runId, List.copyOf(runResults));
	}

	@Override
	public List<BenchmarkResult> results(String runId) {
		return results.getOrDefault(runId, List.of());
	}
}
