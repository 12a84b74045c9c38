package org.javai.contextplatform.benchmark;

/**
 * A run failed as a whole: the target was unreachable, a fixture was missing, or every case timed
 * out. The failed run has been stored and is available from {@link #run()}.
 */
public class BenchmarkInfrastructureException extends RuntimeException {

	private final BenchmarkRun run;

	public BenchmarkInfrastructureException(BenchmarkRun run, String message, Throwable cause) {
		super(message, cause);
		this.run = run;
	}

	public BenchmarkRun run() {
		return run;
	}
}
