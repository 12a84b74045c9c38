package org.javai.contextplatform.asset;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Descriptive metadata about a database table.
 *
 * @param tableName the physical table name
 * @param summary what the table holds
 * @param columns described columns, in display order
 */
public record TableDescriptionContent(String tableName, String summary, List<ColumnDescription> columns)
		implements AssetContent {

	public TableDescriptionContent {
		columns = columns == null ? List.of() : List.copyOf(columns);
	}

	@Override
	public AssetType assetType() {
		return AssetType.TABLE_DESCRIPTION;
	}

	@Override
	public void validate() {
		if (AssetContent.isBlank(tableName)) {
			throw new InvalidAssetContentException(AssetType.TABLE_DESCRIPTION, "tableName is required");
		}
		Set<String> seen = new HashSet<>();
		for (ColumnDescription column : columns) {
			if (column == null || AssetContent.isBlank(column.name())) {
				throw new InvalidAssetContentException(AssetType.TABLE_DESCRIPTION,
						"every column of " + tableName + " needs a name");
			}
			if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
				throw new InvalidAssetContentException(AssetType.TABLE_DESCRIPTION,
						"duplicate column '" + column.name() + "' in " + tableName);
			}
		}
	}

	@Override
	public String toText() {
		StringBuilder sb = new StringBuilder(tableName);
		if (!AssetContent.isBlank(summary)) {
			sb.append(": ").append(summary);
		}
		for (ColumnDescription column : columns) {
			sb.append("\n- ").append(column.name());
			if (!AssetContent.isBlank(column.dataType())) {
				sb.append(" (").append(column.dataType()).append(")");
			}
			if (!AssetContent.isBlank(column.description())) {
				sb.append(": ").append(column.description());
			}
		}
		return sb.toString();
	}

	public record ColumnDescription(String name, String dataType, String description) {
	}
}
