package org.javai.contextplatform.benchmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryBenchmarkRepositoryTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	private final InMemoryBenchmarkRepository repository = new InMemoryBenchmarkRepository();

	@Test
	@DisplayName("keeps runs of a suite in the order they were created")
	void runOrder() {
		repository.saveRun(BenchmarkRun.pending("r1", "suite", "warehouse", null));
		repository.saveRun(BenchmarkRun.pending("r2", "other", "warehouse", null));
		repository.saveRun(BenchmarkRun.pending("r3", "suite", "warehouse", null));
		repository.saveRun(BenchmarkRun.pending("r1", "suite", "warehouse", null).running(NOW));

		assertThat(repository.runs("suite")).extracting(BenchmarkRun::id).containsExactly("r1", "r3");
		assertThat(repository.findRun("r1")).map(BenchmarkRun::status).contains(RunStatus.RUNNING);
	}

	@Test
	@DisplayName("a finished run and its results cannot be rewritten")
	void terminalRunsAreImmutable() {
		BenchmarkRun running = BenchmarkRun.pending("r1", "suite", "warehouse", null).running(NOW);
		repository.saveRun(running);
		BenchmarkCase smoke = BenchmarkCase.of("a", "q", "SELECT 1", Severity.SMOKE);
		repository.saveResults("r1", List.of(BenchmarkResult.skipped("r1", smoke, "cancelled")));
		repository.saveRun(running.completed(NOW.plusSeconds(1), 0.0, RunSummary.empty()));

		assertThatThrownBy(() -> repository.saveRun(running.failed(NOW.plusSeconds(2), "late", RunSummary.empty())))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> repository.saveResults("r1", List.of()))
				.isInstanceOf(IllegalStateException.class);
		assertThat(repository.results("r1")).hasSize(1);
		assertThat(repository.findRun("r1")).map(BenchmarkRun::status).contains(RunStatus.COMPLETED);
	}

	@Test
	@DisplayName("lists suites by id")
	void suites() {
		BenchmarkCase smoke = BenchmarkCase.of("a", "q", "SELECT 1", Severity.SMOKE);
		repository.saveSuite(BenchmarkSuite.of("zeta", List.of(smoke)));
		repository.saveSuite(BenchmarkSuite.of("alpha", List.of(smoke)));

		assertThat(repository.suites()).extracting(BenchmarkSuite::id).containsExactly("alpha", "zeta");
		assertThat(repository.findSuite("alpha")).isPresent();
		assertThat(repository.results("unknown")).isEmpty();
	}
}
