package org.javai.contextplatform.benchmark.export;

/**
 * Output formats of {@link BenchmarkReportExporter}.
 */
public enum ReportFormat {
	/** Run summary, severity breakdown and per-case results as JSON. */
	JSON("json"),
	/** JUnit XML, readable by CI systems. */
	JUNIT("xml");

	private final String fileExtension;

	ReportFormat(String fileExtension) {
		this.fileExtension = fileExtension;
	}

	public String fileExtension() {
		return fileExtension;
	}
}
