package org.javai.contextplatform.benchmark;

import java.util.List;
import java.util.Optional;

/**
 * Storage for suites, runs and results. Finished runs and their results are immutable.
 */
public interface BenchmarkRepository {

	void saveSuite(BenchmarkSuite suite);

	Optional<BenchmarkSuite> findSuite(String suiteId);

	List<BenchmarkSuite> suites();

	void saveRun(BenchmarkRun run);

	Optional<BenchmarkRun> findRun(String runId);

	/**
	 * @return runs of the suite, oldest first
	 */
	List<BenchmarkRun> runs(String suiteId);

	/**
	 * Stores the results of an unfinished run.
	 *
	 * @throws IllegalStateException if the run is unknown or already finished
	 */
	void saveResults(String runId, List<BenchmarkResult> results);

	List<BenchmarkResult> results(String runId);
}
