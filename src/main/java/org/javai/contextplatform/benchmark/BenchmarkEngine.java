package org.javai.contextplatform.benchmark;

import java.util.List;
import java.util.Optional;

/**
 * Runs benchmark suites and keeps their runs and results.
 */
public interface BenchmarkEngine {

	void registerSuite(BenchmarkSuite suite);

	Optional<BenchmarkSuite> suite(String suiteId);

	/**
	 * Runs a suite and waits for it.
	 *
	 * @return the completed run, or the failed run if it was cancelled
	 * @throws BenchmarkInfrastructureException if the run failed as a whole
	 */
	BenchmarkRun run(String suiteId, String connectionId, RunOptions options);

	/**
	 * Starts a suite in the background.
	 */
	RunHandle start(String suiteId, String connectionId, RunOptions options);

	/**
	 * Runs a suite with the asset added to its fixtures, recording the use as a validation.
	 */
	BenchmarkRun validateAsset(String assetId, String suiteId, String connectionId, RunOptions options);

	Optional<BenchmarkRun> getRun(String runId);

	/**
	 * @return runs of the suite, oldest first
	 */
	List<BenchmarkRun> runs(String suiteId);

	/**
	 * @param failedOnly return only failed results (not skipped ones)
	 */
	List<BenchmarkResult> results(String runId, boolean failedOnly);

	/**
	 * @param baselineRunId run to compare against; {@code null} uses the run's recorded baseline
	 */
	RunComparison compare(String runId, String baselineRunId);

	/**
	 * @return the fingerprint of a failed result, empty for passed or skipped ones
	 */
	Optional<FailureFingerprint> fingerprint(BenchmarkResult result);

	SuiteStats suiteStats(String suiteId);
}
