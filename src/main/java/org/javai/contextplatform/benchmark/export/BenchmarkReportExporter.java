package org.javai.contextplatform.benchmark.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.contextplatform.benchmark.BenchmarkResult;
import org.javai.contextplatform.benchmark.BenchmarkRun;
import org.javai.contextplatform.benchmark.ResultStatus;
import org.javai.contextplatform.benchmark.RunSummary;

/**
 * Writes a finished run and its results as JSON or JUnit XML.
 */
public class BenchmarkReportExporter {

	private final ObjectMapper objectMapper;

	public BenchmarkReportExporter() {
		this.objectMapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	public String export(BenchmarkRun run, List<BenchmarkResult> results, ReportFormat format) {
		Objects.requireNonNull(run, "run must not be null");
		Objects.requireNonNull(format, "format must not be null");
		List<BenchmarkResult> safeResults = results != null ? results : List.of();
		return switch (format) {
			case JSON -> toJson(run, safeResults);
			case JUNIT -> toJUnitXml(run, safeResults);
		};
	}

	/**
	 * Writes the report to {@code path}, creating parent directories as needed.
	 */
	public Path export(BenchmarkRun run, List<BenchmarkResult> results, ReportFormat format, Path path)
			throws IOException {
		String report = export(run, results, format);
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(path, report, StandardCharsets.UTF_8);
		return path;
	}

	private String toJson(BenchmarkRun run, List<BenchmarkResult> results) {
		ObjectNode root = objectMapper.createObjectNode();
		root.put("runId", run.id());
		root.put("suiteId", run.suiteId());
		root.put("connectionId", run.connectionId());
		root.put("status", run.status().name());
		if (run.score() != null) {
			root.put("score", run.score());
		} else {
			root.putNull("score");
		}
		root.set("startedAt", objectMapper.valueToTree(run.startedAt()));
		root.set("completedAt", objectMapper.valueToTree(run.completedAt()));
		Duration duration = run.duration();
		if (duration != null) {
			root.put("durationMs", duration.toMillis());
		}
		if (run.error() != null) {
			root.put("error", run.error());
		}
		if (run.baselineRunId() != null) {
			root.put("baselineRunId", run.baselineRunId());
		}

		RunSummary summary = run.summary();
		ObjectNode summaryNode = root.putObject("summary");
		summaryNode.put("total", summary.totalCases());
		summaryNode.put("passed", summary.passed());
		summaryNode.put("failed", summary.failed());
		summaryNode.put("skipped", summary.skipped());
		summaryNode.put("timedOut", summary.timedOut());
		ObjectNode severities = summaryNode.putObject("bySeverity");
		summary.bySeverity().forEach((severity, breakdown) -> {
			ObjectNode node = severities.putObject(severity.id());
			node.put("passed", breakdown.passed());
			node.put("total", breakdown.total());
			node.put("weight", breakdown.weight());
		});

		ArrayNode cases = root.putArray("results");
		for (BenchmarkResult result : results) {
			ObjectNode node = cases.addObject();
			node.put("caseId", result.caseId());
			node.put("caseName", result.caseName());
			node.put("severity", result.severity() != null ? result.severity().id() : null);
			node.put("status", result.status().name());
			node.put("passed", result.passed());
			node.put("matchKind", result.matchKind().name());
			node.put("durationMs", result.duration().toMillis());
			node.put("timedOut", result.timedOut());
			node.put("actualSql", result.actualSql());
			node.put("error", result.error());
		}
		try {
			return objectMapper.writeValueAsString(root);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException("Failed to render benchmark report for run " + run.id(), e);
		}
	}

	private String toJUnitXml(BenchmarkRun run, List<BenchmarkResult> results) {
		long failures = results.stream().filter(r -> r.status() == ResultStatus.FAILED).count();
		long skipped = results.stream().filter(r -> r.status() == ResultStatus.SKIPPED).count();
		String time = seconds(run.duration());
		Instant timestamp = run.startedAt();

		StringBuilder sb = new StringBuilder();
		sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
		sb.append("<testsuites name=\"").append(escapeXml(run.suiteId())).append("\"")
				.append(" tests=\"").append(results.size()).append("\"")
				.append(" failures=\"").append(failures).append("\"")
				.append(" skipped=\"").append(skipped).append("\"")
				.append(" time=\"").append(time).append("\">\n");
		sb.append("  <testsuite name=\"").append(escapeXml(run.suiteId())).append("\"")
				.append(" id=\"").append(escapeXml(run.id())).append("\"")
				.append(" tests=\"").append(results.size()).append("\"")
				.append(" failures=\"").append(failures).append("\"")
				.append(" errors=\"0\"")
				.append(" skipped=\"").append(skipped).append("\"")
				.append(" time=\"").append(time).append("\"");
		if (timestamp != null) {
			sb.append(" timestamp=\"").append(timestamp).append("\"");
		}
		sb.append(">\n");
		sb.append("    <properties>\n");
		appendProperty(sb, "connectionId", run.connectionId());
		appendProperty(sb, "status", run.status().name());
		appendProperty(sb, "score", run.score() == null ? "" : String.format(Locale.ROOT, "%.4f", run.score()));
		if (run.error() != null) {
			appendProperty(sb, "error", run.error());
		}
		sb.append("    </properties>\n");

		for (BenchmarkResult result : results) {
			sb.append("    <testcase name=\"").append(escapeXml(result.caseName())).append("\"")
					.append(" classname=\"").append(escapeXml(run.suiteId() + "."
							+ (result.severity() != null ? result.severity().id() : "unknown"))).append("\"")
					.append(" time=\"").append(seconds(result.duration())).append("\"");
			switch (result.status()) {
				case PASSED -> sb.append("/>\n");
				case SKIPPED -> sb.append(">\n      <skipped message=\"").append(escapeXml(nullToEmpty(result.error())))
						.append("\"/>\n    </testcase>\n");
				case FAILED -> {
					sb.append(">\n      <failure message=\"").append(escapeXml(nullToEmpty(result.error()))).append("\"")
							.append(" type=\"").append(result.timedOut() ? "timeout" : "failure").append("\">");
					if (result.actualSql() != null) {
						sb.append(escapeXml(result.actualSql()));
					}
					sb.append("</failure>\n    </testcase>\n");
				}
			}
		}
		sb.append("  </testsuite>\n</testsuites>\n");
		return sb.toString();
	}

	private void appendProperty(StringBuilder sb, String name, String value) {
		sb.append("      <property name=\"").append(escapeXml(name)).append("\" value=\"")
				.append(escapeXml(nullToEmpty(value))).append("\"/>\n");
	}

	private String seconds(Duration duration) {
		if (duration == null) {
			return "0.000";
		}
		return String.format(Locale.ROOT, "%.3f", duration.toMillis() / 1000.0);
	}

	private String escapeXml(String value) {
		if (value == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(value.length());
		for (char c : value.toCharArray()) {
			switch (c) {
				case '&' -> sb.append("&amp;");
				case '<' -> sb.append("&lt;");
				case '>' -> sb.append("&gt;");
				case '"' -> sb.append("&quot;");
				case '\'' -> sb.append("&apos;");
				default -> {
					// XML 1.0 forbids most control characters
					if (c < 0x20 && c != '\n' && c != '\r' && c != '\t') {
						sb.append(' ');
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}

	private String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}
