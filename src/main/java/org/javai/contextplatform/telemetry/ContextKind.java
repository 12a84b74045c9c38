package org.javai.contextplatform.telemetry;

/**
 * What kind of work consumed an asset.
 */
public enum ContextKind {

	/** An agent used the asset while answering a user. */
	MISSION,

	/** A benchmark run used the asset as a fixture. */
	BENCHMARK,

	/** The asset was validated against a benchmark suite before promotion. */
	VALIDATION
}
