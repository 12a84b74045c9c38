package org.javai.contextplatform.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by a query. Values keep the types the driver produced; {@link ResultDigest}
 * canonicalises them.
 */
public record RowSet(List<String> columns, List<List<Object>> rows) {

	public RowSet {
		columns = columns == null ? List.of() : List.copyOf(columns);
		List<List<Object>> copy = new ArrayList<>();
		if (rows != null) {
			// rows may hold nulls, so List.copyOf is not an option
			rows.forEach(row -> copy.add(Collections.unmodifiableList(new ArrayList<>(row))));
		}
		rows = Collections.unmodifiableList(copy);
	}

	public static RowSet of(List<String> columns, List<List<Object>> rows) {
		return new RowSet(columns, rows);
	}

	public int size() {
		return rows.size();
	}
}
