package org.javai.contextplatform.benchmark;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A run in progress.
 *
 * <p>Cancellation is cooperative: no case starts after {@link #cancel(String)}, calls already
 * in flight finish or time out, and the run ends {@code FAILED} with the reason.</p>
 */
public class RunHandle {

	private final String runId;
	private final CompletableFuture<BenchmarkRun> completion;
	private final AtomicReference<String> cancellationReason;

	RunHandle(String runId, CompletableFuture<BenchmarkRun> completion, AtomicReference<String> cancellationReason) {
		this.runId = runId;
		this.completion = completion;
		this.cancellationReason = cancellationReason;
	}

	public String runId() {
		return runId;
	}

	/**
	 * @return {@code false} if the run was already cancelled or finished
	 */
	public boolean cancel(String reason) {
		if (completion.isDone()) {
			return false;
		}
		return cancellationReason.compareAndSet(null, reason == null || reason.isBlank() ? "cancelled" : reason);
	}

	public boolean isCancelled() {
		return cancellationReason.get() != null;
	}

	public boolean isDone() {
		return completion.isDone();
	}

	public CompletableFuture<BenchmarkRun> completion() {
		return completion;
	}

	/**
	 * Waits for the run to finish.
	 *
	 * @return the completed run, or the failed run if it was cancelled
	 * @throws BenchmarkInfrastructureException if the run failed for an infrastructure reason
	 */
	public BenchmarkRun await() {
		try {
			return completion.join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException cause) {
				throw cause;
			}
			throw e;
		} catch (CancellationException e) {
			throw new IllegalStateException("Run " + runId + " was abandoned", e);
		}
	}
}
