package org.javai.contextplatform.benchmark;

import java.util.Map;

/**
 * SQL produced by a {@link SqlGenerator}, with whatever metadata the generator reports
 * (model, token counts, reasoning).
 */
public record GeneratedSql(String sql, Map<String, Object> metadata) {

	public GeneratedSql {
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public static GeneratedSql of(String sql) {
		return new GeneratedSql(sql, Map.of());
	}
}
