package org.javai.contextplatform.benchmark;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import javax.sql.DataSource;

/**
 * {@link SqlExecutor} over JDBC, one {@link DataSource} per connection id.
 *
 * <p>Statements run read-only; a connection is opened per query and closed afterwards.</p>
 */
public class JdbcSqlExecutor implements SqlExecutor {

	private static final int VALIDATION_TIMEOUT_SECONDS = 5;

	private final Function<String, DataSource> dataSources;

	/**
	 * @param dataSources resolves a connection id to its data source, {@code null} if unknown
	 */
	public JdbcSqlExecutor(Function<String, DataSource> dataSources) {
		this.dataSources = Objects.requireNonNull(dataSources, "dataSources must not be null");
	}

	@Override
	public RowSet execute(String sql, String connectionId) {
		DataSource dataSource = dataSourceFor(connectionId);
		try (Connection connection = dataSource.getConnection()) {
			connection.setReadOnly(true);
			try (Statement statement = connection.createStatement();
					ResultSet resultSet = statement.executeQuery(sql)) {
				return read(resultSet);
			}
		} catch (SQLException e) {
			throw new SqlExecutionException("Query failed on " + connectionId + ": " + e.getMessage(), e);
		}
	}

	@Override
	public void verifyConnection(String connectionId) {
		DataSource dataSource = dataSourceFor(connectionId);
		try (Connection connection = dataSource.getConnection()) {
			if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
				throw new SqlExecutionException("Connection " + connectionId + " is not valid");
			}
		} catch (SQLException e) {
			throw new SqlExecutionException("Cannot connect to " + connectionId + ": " + e.getMessage(), e);
		}
	}

	private DataSource dataSourceFor(String connectionId) {
		DataSource dataSource = dataSources.apply(connectionId);
		if (dataSource == null) {
			throw new SqlExecutionException("No data source configured for connection " + connectionId);
		}
		return dataSource;
	}

	private static RowSet read(ResultSet resultSet) throws SQLException {
		ResultSetMetaData meta = resultSet.getMetaData();
		int columnCount = meta.getColumnCount();
		List<String> columns = new ArrayList<>(columnCount);
		for (int i = 1; i <= columnCount; i++) {
			columns.add(meta.getColumnLabel(i));
		}
		List<List<Object>> rows = new ArrayList<>();
		while (resultSet.next()) {
			List<Object> row = new ArrayList<>(columnCount);
			for (int i = 1; i <= columnCount; i++) {
				row.add(resultSet.getObject(i));
			}
			rows.add(row);
		}
		return RowSet.of(columns, rows);
	}
}
