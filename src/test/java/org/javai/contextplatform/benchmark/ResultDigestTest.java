package org.javai.contextplatform.benchmark;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultDigestTest {

	@Test
	@DisplayName("row order does not matter")
	void orderInsensitive() {
		RowSet forward = RowSet.of(List.of("region", "total"), List.of(List.of("north", 10), List.of("south", 20)));
		RowSet reversed = RowSet.of(List.of("region", "total"), List.of(List.of("south", 20), List.of("north", 10)));

		assertThat(ResultDigest.of(forward)).isEqualTo(ResultDigest.of(reversed));
	}

	@Test
	@DisplayName("column labels do not matter, values do")
	void valuesOnly() {
		RowSet a = RowSet.of(List.of("count"), List.of(List.of(42L)));
		RowSet b = RowSet.of(List.of("n"), List.of(List.of(42)));
		RowSet c = RowSet.of(List.of("n"), List.of(List.of(43)));

		assertThat(ResultDigest.of(a)).isEqualTo(ResultDigest.of(b)).isNotEqualTo(ResultDigest.of(c));
	}

	@Test
	@DisplayName("numbers compare by value across types and scales")
	void numericCanonicalForm() {
		assertThat(ResultDigest.canonicalValue(new BigDecimal("10.500"))).isEqualTo("10.5");
		assertThat(ResultDigest.canonicalValue(10.5d)).isEqualTo("10.5");
		assertThat(ResultDigest.canonicalValue(new BigDecimal("0.00"))).isEqualTo("0");
		assertThat(ResultDigest.canonicalValue(new BigDecimal("1E+2"))).isEqualTo("100");
	}

	@Test
	@DisplayName("null differs from the string 'null' and row boundaries are kept")
	void nullsAndBoundaries() {
		RowSet withNull = RowSet.of(List.of("v"), List.of(Arrays.asList((Object) null)));
		RowSet withText = RowSet.of(List.of("v"), List.of(List.of("null")));
		RowSet twoColumns = RowSet.of(List.of("a", "b"), List.of(List.of("ab", "c")));
		RowSet shifted = RowSet.of(List.of("a", "b"), List.of(List.of("a", "bc")));

		assertThat(ResultDigest.of(withNull)).isNotEqualTo(ResultDigest.of(withText));
		assertThat(ResultDigest.of(twoColumns)).isNotEqualTo(ResultDigest.of(shifted));
	}

	@Test
	@DisplayName("is a hex SHA-256")
	void format() {
		assertThat(ResultDigest.of(RowSet.of(List.of(), List.of()))).hasSize(64).matches("[0-9a-f]+");
	}
}
