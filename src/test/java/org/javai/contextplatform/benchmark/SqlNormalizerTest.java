package org.javai.contextplatform.benchmark;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SqlNormalizerTest {

	@Test
	@DisplayName("ignores case, whitespace and trailing semicolons")
	void cosmeticDifferences() {
		assertThat(SqlNormalizer.equivalent(
				"select  sum(amount)\nfrom orders\twhere status = 'complete';;",
				"SELECT SUM(amount) FROM orders WHERE status = 'complete'")).isTrue();
	}

	@Test
	@DisplayName("distinguishes different queries")
	void differentQueries() {
		assertThat(SqlNormalizer.equivalent("SELECT COUNT(*) FROM orders", "SELECT COUNT(id) FROM orders")).isFalse();
	}

	@Test
	@DisplayName("falls back to text comparison for SQL that does not parse")
	void unparseable() {
		assertThat(SqlNormalizer.normalize("SELEC  broken FROM")).isEqualTo("selec broken from");
		assertThat(SqlNormalizer.equivalent("SELEC broken FROM;", "selec   BROKEN from")).isTrue();
	}

	@Test
	@DisplayName("blank SQL is never equivalent to anything")
	void blank() {
		assertThat(SqlNormalizer.normalize(null)).isEmpty();
		assertThat(SqlNormalizer.normalize(" ; ")).isEmpty();
		assertThat(SqlNormalizer.equivalent("", "")).isFalse();
	}
}
