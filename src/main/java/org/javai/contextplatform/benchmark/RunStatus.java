package org.javai.contextplatform.benchmark;

/**
 * {@code PENDING → RUNNING → {COMPLETED, FAILED}}. Only infrastructure faults and cancellation
 * end a run in {@code FAILED}; failing cases do not.
 */
public enum RunStatus {
	PENDING,
	RUNNING,
	COMPLETED,
	FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}
}
