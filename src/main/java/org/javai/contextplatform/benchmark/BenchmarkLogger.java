package org.javai.contextplatform.benchmark;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured log lines for benchmark runs: one per case outcome and one per run transition.
 */
public class BenchmarkLogger {

	private final Logger logger;

	public BenchmarkLogger(Class<?> engineClass) {
		this.logger = LoggerFactory.getLogger(engineClass);
	}

	public void logRunStarted(BenchmarkRun run, int caseCount, int parallelism) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("[{}] run {} started on connection {} with {} cases (parallelism={})",
				run.suiteId(), run.id(), run.connectionId(), caseCount, parallelism);
	}

	public void logCaseResult(BenchmarkRun run, BenchmarkCase benchmarkCase, BenchmarkResult result) {
		if (result.passed()) {
			if (logger.isInfoEnabled()) {
				logger.info("[{}] run {} case='{}' severity={} passed ({}) in {} ms (question='{}')",
						run.suiteId(), run.id(), benchmarkCase.id(), benchmarkCase.severity().id(),
						result.matchKind(), toMillis(result.duration()), summarize(benchmarkCase.question()));
			}
			return;
		}
		if (logger.isWarnEnabled()) {
			logger.warn("[{}] run {} case='{}' severity={} {} after {} ms (question='{}', sql='{}'): {}",
					run.suiteId(), run.id(), benchmarkCase.id(), benchmarkCase.severity().id(),
					result.status() == ResultStatus.SKIPPED ? "skipped" : "failed",
					toMillis(result.duration()), summarize(benchmarkCase.question()),
					summarize(result.actualSql()), result.error());
		}
	}

	public void logRunFinished(BenchmarkRun run) {
		if (run.status() == RunStatus.COMPLETED) {
			if (logger.isInfoEnabled()) {
				logger.info("[{}] run {} completed: score={} passed={}/{} skipped={} in {} ms",
						run.suiteId(), run.id(), formatScore(run.score()), run.summary().passed(),
						run.summary().scored(), run.summary().skipped(), toMillis(run.duration()));
			}
		} else if (logger.isWarnEnabled()) {
			logger.warn("[{}] run {} failed after {} ms: {}", run.suiteId(), run.id(), toMillis(run.duration()),
					run.error());
		}
	}

	public void warn(String format, Object... args) {
		logger.warn(format, args);
	}

	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	private long toMillis(Duration duration) {
		return duration == null ? -1 : duration.toMillis();
	}

	private String formatScore(Double value) {
		if (value == null || value.isNaN()) {
			return "n/a";
		}
		return String.format("%.4f", value);
	}

	private String summarize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
