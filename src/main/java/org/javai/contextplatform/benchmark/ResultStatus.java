package org.javai.contextplatform.benchmark;

public enum ResultStatus {
	PASSED,
	FAILED,
	/** Not executed because the run was cancelled first. Skipped cases are not scored. */
	SKIPPED
}
