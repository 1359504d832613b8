/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.sqlgate;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main class for running guarded SQL statements over a single JDBC connection.
 * <p>
 * Every statement is scanned for blacklisted clauses before the driver sees it, then run as a
 * {@link PreparedStatement} with its {@link Bind}s applied. Table and column names which are interpolated into SQL
 * text should first pass {@link #checkTable(String)} / {@link #checkColumn(String)}.
 * <pre>{@code
 * try (StatementGate gate = StatementGate.withUrl(JdbcUrls.mysql("localhost", null, "shop"))
 *     .user("shop")
 *     .password(password)
 *     .tableWhitelist(List.of("names_table"))
 *     .build()) {
 *   String table = gate.checkTable(requestedTable);
 *   List<Row> rows = gate.execute(format("SELECT * FROM %s WHERE last = :ln", table),
 *       List.of(Bind.of(":ln", "Doe")));
 * }}</pre>
 * A gate owns its connection exclusively and is intended for use by a single thread.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class StatementGate implements AutoCloseable {
	@NonNull
	static final String DEFAULT_STATEMENT_TERMINATOR = ";";

	@NonNull
	private final Connection connection;
	@NonNull
	private final Blacklist blacklist;
	@NonNull
	private final ParameterBinder parameterBinder;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final ErrorReporter errorReporter;
	@NonNull
	private final String statementTerminator;
	@NonNull
	private final Logger logger;

	@Nullable
	private List<String> columnWhitelist;
	@Nullable
	private List<String> tableWhitelist;
	@Nullable
	private String lastStatement;
	private boolean closed;
	@NonNull
	private DatabaseOperationSupportStatus executeLargeUpdateSupported;

	private StatementGate(@NonNull Builder builder) {
		requireNonNull(builder);

		this.blacklist = builder.blacklist == null ? Blacklist.withDefaultTokens() : builder.blacklist;
		this.parameterBinder = builder.parameterBinder == null ? ParameterBinder.withDefaultConfiguration() : builder.parameterBinder;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.errorReporter = new ErrorReporter(builder.errorDetail == null ? ErrorDetail.SANITIZED : builder.errorDetail);
		this.statementTerminator = builder.statementTerminator == null ? DEFAULT_STATEMENT_TERMINATOR : builder.statementTerminator;
		this.columnWhitelist = builder.columnWhitelist;
		this.tableWhitelist = builder.tableWhitelist;
		this.logger = Logger.getLogger(getClass().getName());
		this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.UNKNOWN;

		Connector connector = builder.connector == null ? Connector.withDriverManager() : builder.connector;
		Map<String, String> options = builder.options == null ? Map.of() : builder.options;

		try {
			this.connection = requireNonNull(connector.connect(builder.url, builder.user, builder.password, options),
					"Connector returned a null connection");
		} catch (Exception e) {
			getLogger().log(WARNING, "Unable to connect to database", e);
			throw getErrorReporter().connectionFailed(e);
		}
	}

	/**
	 * Provides a {@link StatementGate} builder for the given JDBC URL.
	 *
	 * @param url the JDBC URL to connect to, e.g. from {@link JdbcUrls}
	 * @return a {@link StatementGate} builder
	 */
	@NonNull
	public static Builder withUrl(@NonNull String url) {
		requireNonNull(url);
		return new Builder(url);
	}

	/**
	 * Connects with out-of-the-box defaults.
	 *
	 * @param url      the JDBC URL to connect to
	 * @param user     the user to authenticate as, if any
	 * @param password the user's password, if any
	 * @return a connected gate
	 * @throws GateException with {@link ErrorKind#CONNECTION_FAILED} if the connection cannot be opened
	 */
	@NonNull
	public static StatementGate connect(@NonNull String url,
																			@Nullable String user,
																			@Nullable String password) {
		requireNonNull(url);
		return withUrl(url).user(user).password(password).build();
	}

	/**
	 * Verifies {@code column} against the column whitelist, if one is set.
	 *
	 * @param column the column name to interpolate into SQL text
	 * @return {@code column}, unchanged
	 * @throws GateException with {@link ErrorKind#COLUMN_PERMISSION_DENIED} if the column is not whitelisted
	 */
	@NonNull
	public String checkColumn(@NonNull String column) {
		requireNonNull(column);
		return IdentifierGuard.check(IdentifierGuard.Kind.COLUMN, column, this.columnWhitelist);
	}

	/**
	 * Verifies {@code table} against the table whitelist, if one is set.
	 *
	 * @param table the table name to interpolate into SQL text
	 * @return {@code table}, unchanged
	 * @throws GateException with {@link ErrorKind#TABLE_PERMISSION_DENIED} if the table is not whitelisted
	 */
	@NonNull
	public String checkTable(@NonNull String table) {
		requireNonNull(table);
		return IdentifierGuard.check(IdentifierGuard.Kind.TABLE, table, this.tableWhitelist);
	}

	@NonNull
	public List<Row> execute(@NonNull String sql) {
		requireNonNull(sql);
		return execute(sql, List.of(), FetchMode.ASSOCIATIVE);
	}

	@NonNull
	public List<Row> execute(@NonNull String sql,
													 @NonNull List<Bind> binds) {
		requireNonNull(sql);
		requireNonNull(binds);

		return execute(sql, binds, FetchMode.ASSOCIATIVE);
	}

	/**
	 * Runs a statement through the gate and fetches all of its rows.
	 * <p>
	 * Statements which produce no result set yield an empty list.
	 *
	 * @param sql       the SQL text, with {@code :name} or {@code ?} placeholders
	 * @param binds     values to bind, applied in order
	 * @param fetchMode how fetched rows may be accessed
	 * @return the fetched rows
	 * @throws GateException with {@link ErrorKind#CONNECTION_CLOSED}, {@link ErrorKind#BLACKLISTED_CLAUSE} or
	 *                       {@link ErrorKind#QUERY_EXECUTION_FAILED}
	 */
	@NonNull
	public List<Row> execute(@NonNull String sql,
													 @NonNull List<Bind> binds,
													 @NonNull FetchMode fetchMode) {
		requireNonNull(sql);
		requireNonNull(binds);
		requireNonNull(fetchMode);

		return executeForResult(sql, binds, fetchMode).getRows();
	}

	@NonNull
	public QueryResult executeForResult(@NonNull String sql) {
		requireNonNull(sql);
		return executeForResult(sql, List.of(), FetchMode.ASSOCIATIVE);
	}

	@NonNull
	public QueryResult executeForResult(@NonNull String sql,
																			@NonNull List<Bind> binds) {
		requireNonNull(sql);
		requireNonNull(binds);

		return executeForResult(sql, binds, FetchMode.ASSOCIATIVE);
	}

	/**
	 * Like {@link #execute(String, List, FetchMode)}, but keeps the result's column labels even when no rows match.
	 *
	 * @param sql       the SQL text, with {@code :name} or {@code ?} placeholders
	 * @param binds     values to bind, applied in order
	 * @param fetchMode how fetched rows may be accessed
	 * @return the column labels and fetched rows
	 */
	@NonNull
	public QueryResult executeForResult(@NonNull String sql,
																			@NonNull List<Bind> binds,
																			@NonNull FetchMode fetchMode) {
		requireNonNull(sql);
		requireNonNull(binds);
		requireNonNull(fetchMode);

		return performStatement(sql, binds, (PreparedStatement preparedStatement) -> {
			long startTime = nanoTime();
			boolean hasResultSet = preparedStatement.execute();
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);

			if (!hasResultSet)
				return new StatementOperationResult<>(new QueryResult(List.of(), List.of()), executionDuration, null);

			startTime = nanoTime();

			try (ResultSet resultSet = preparedStatement.getResultSet()) {
				QueryResult queryResult = fetchRows(resultSet, fetchMode);
				Duration fetchDuration = Duration.ofNanos(nanoTime() - startTime);
				return new StatementOperationResult<>(queryResult, executionDuration, fetchDuration);
			}
		});
	}

	public long executeUpdate(@NonNull String sql) {
		requireNonNull(sql);
		return executeUpdate(sql, List.of());
	}

	/**
	 * Runs a DML or DDL statement through the gate.
	 *
	 * @param sql   the SQL text, with {@code :name} or {@code ?} placeholders
	 * @param binds values to bind, applied in order
	 * @return the number of rows affected
	 * @throws GateException with {@link ErrorKind#CONNECTION_CLOSED}, {@link ErrorKind#BLACKLISTED_CLAUSE} or
	 *                       {@link ErrorKind#QUERY_EXECUTION_FAILED}
	 */
	public long executeUpdate(@NonNull String sql,
														@NonNull List<Bind> binds) {
		requireNonNull(sql);
		requireNonNull(binds);

		return performStatement(sql, binds, (PreparedStatement preparedStatement) -> {
			long startTime = nanoTime();
			long updateCount;

			// Use the appropriate "large" value if we know it.
			// If we don't know it, detect it and store it.
			if (getExecuteLargeUpdateSupported() == DatabaseOperationSupportStatus.YES) {
				updateCount = preparedStatement.executeLargeUpdate();
			} else if (getExecuteLargeUpdateSupported() == DatabaseOperationSupportStatus.NO) {
				updateCount = preparedStatement.executeUpdate();
			} else {
				// If the driver doesn't support executeLargeUpdate, then UnsupportedOperationException is thrown.
				try {
					updateCount = preparedStatement.executeLargeUpdate();
					setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.YES);
				} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
					setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.NO);
					updateCount = preparedStatement.executeUpdate();
				}
			}

			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
			return new StatementOperationResult<>(updateCount, executionDuration, null);
		});
	}

	/**
	 * Does {@code table} exist and is it readable?
	 *
	 * @param table the table name
	 * @return {@code true} if a probe query against the table succeeds
	 * @throws GateException with {@link ErrorKind#CONNECTION_CLOSED} if the gate is closed, or
	 *                       {@link ErrorKind#TABLE_PERMISSION_DENIED} if the table is not whitelisted
	 */
	public boolean tableExists(@NonNull String table) {
		requireNonNull(table);

		ensureOpen();

		String checkedTable = checkTable(table);
		return probe(format("SELECT 1 FROM %s LIMIT 1", checkedTable));
	}

	/**
	 * Does {@code column} exist in {@code table} and is it readable?
	 *
	 * @param column the column name
	 * @param table  the table name
	 * @return {@code true} if a probe query against the column succeeds
	 */
	public boolean columnExists(@NonNull String column,
															@NonNull String table) {
		requireNonNull(column);
		requireNonNull(table);

		ensureOpen();

		String checkedColumn = checkColumn(column);
		String checkedTable = checkTable(table);
		return probe(format("SELECT %s FROM %s LIMIT 1", checkedColumn, checkedTable));
	}

	public int columnCount(@NonNull String table) {
		requireNonNull(table);

		ensureOpen();

		String checkedTable = checkTable(table);
		return executeForResult(format("SELECT * FROM %s LIMIT 1", checkedTable)).getColumnCount();
	}

	/**
	 * Describes the columns of {@code table} using {@link DatabaseMetaData}.
	 * <p>
	 * The table name is converted to the database's identifier storage case before lookup, so {@code names_table}
	 * finds {@code NAMES_TABLE} on databases which store unquoted identifiers in upper case.
	 *
	 * @param table the table name
	 * @return the table's columns in ordinal order, or an empty list if none are visible
	 */
	@NonNull
	public List<ColumnInfo> columnInfo(@NonNull String table) {
		requireNonNull(table);

		ensureOpen();

		String checkedTable = checkTable(table);

		try {
			DatabaseMetaData databaseMetaData = this.connection.getMetaData();
			String tableNamePattern = escapeSearchString(storageCaseIdentifier(databaseMetaData, checkedTable),
					databaseMetaData.getSearchStringEscape());
			List<ColumnInfo> columns = new ArrayList<>();

			try (ResultSet resultSet = databaseMetaData.getColumns(this.connection.getCatalog(), null, tableNamePattern, "%")) {
				while (resultSet.next()) {
					int size = resultSet.getInt("COLUMN_SIZE");
					Integer columnSize = resultSet.wasNull() ? null : size;
					int nullable = resultSet.getInt("NULLABLE");
					Boolean columnNullable = nullable == DatabaseMetaData.columnNullableUnknown ? null : nullable == DatabaseMetaData.columnNullable;

					columns.add(new ColumnInfo(resultSet.getString("COLUMN_NAME"), resultSet.getString("TYPE_NAME"),
							resultSet.getInt("DATA_TYPE"), columnSize, columnNullable, resultSet.getString("COLUMN_DEF"),
							resultSet.getInt("ORDINAL_POSITION")));
				}
			}

			columns.sort((column1, column2) -> Integer.compare(column1.getOrdinalPosition(), column2.getOrdinalPosition()));
			return Collections.unmodifiableList(columns);
		} catch (SQLException e) {
			throw getErrorReporter().queryExecutionFailed(e);
		}
	}

	/**
	 * Fetches every value of {@code column} in {@code table}.
	 *
	 * @param column the column name
	 * @param table  the table name
	 * @return the column's values in result order; SQL {@code NULL}s are {@code null} elements
	 */
	@NonNull
	public List<@Nullable Object> columnData(@NonNull String column,
																					 @NonNull String table) {
		requireNonNull(column);
		requireNonNull(table);

		ensureOpen();

		String checkedColumn = checkColumn(column);
		String checkedTable = checkTable(table);
		List<Row> rows = execute(format("SELECT %s FROM %s", checkedColumn, checkedTable), List.of(), FetchMode.NUMERIC);
		List<Object> values = new ArrayList<>(rows.size());

		for (Row row : rows)
			values.add(row.get(0));

		return Collections.unmodifiableList(values);
	}

	public long rowTotal(@NonNull String table) {
		requireNonNull(table);

		ensureOpen();

		String checkedTable = checkTable(table);
		List<Row> rows = execute(format("SELECT COUNT(*) FROM %s", checkedTable), List.of(), FetchMode.NUMERIC);
		Object count = rows.get(0).get(0);

		if (!(count instanceof Number))
			throw new GateException(ErrorKind.QUERY_EXECUTION_FAILED);

		return ((Number) count).longValue();
	}

	/**
	 * Fetches the positional values of the {@code index}th (0-based) row of {@code table}, in result order.
	 *
	 * @param index 0-based row index
	 * @param table the table name
	 * @return the row's values, or empty if {@code index} is negative or not less than the row count
	 */
	@NonNull
	public Optional<List<@Nullable Object>> rowData(int index,
																									@NonNull String table) {
		requireNonNull(table);

		ensureOpen();

		String checkedTable = checkTable(table);
		List<Row> rows = execute(format("SELECT * FROM %s", checkedTable), List.of(), FetchMode.NUMERIC);

		if (index < 0 || index >= rows.size())
			return Optional.empty();

		return Optional.of(rows.get(index).asList());
	}

	/**
	 * Switches the connection's current catalog (database).
	 *
	 * @param catalog the catalog to use
	 */
	public void useCatalog(@NonNull String catalog) {
		requireNonNull(catalog);
		ensureOpen();

		try {
			this.connection.setCatalog(catalog);
		} catch (SQLException e) {
			throw getErrorReporter().queryExecutionFailed(e);
		}
	}

	/**
	 * Closes the underlying connection. Closing a closed gate is a no-op.
	 *
	 * @throws GateException with {@link ErrorKind#CONNECTION_FAILED} if the driver fails to close the connection; the gate
	 *                       is closed regardless
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;

		try {
			this.connection.close();
		} catch (SQLException e) {
			getLogger().log(WARNING, "Unable to close database connection", e);
			throw getErrorReporter().connectionFailed(e);
		}
	}

	public boolean isClosed() {
		return this.closed;
	}

	/**
	 * The most recently prepared statement text, terminator included, before placeholder rewriting.
	 *
	 * @return the last prepared statement, or empty if nothing has been prepared yet
	 */
	@NonNull
	public Optional<String> getLastStatement() {
		return Optional.ofNullable(this.lastStatement);
	}

	/**
	 * The live blacklist consulted for every statement; changes take effect immediately.
	 *
	 * @return this gate's blacklist
	 */
	@NonNull
	public Blacklist getBlacklist() {
		return this.blacklist;
	}

	@NonNull
	public Optional<List<String>> getColumnWhitelist() {
		return Optional.ofNullable(this.columnWhitelist);
	}

	/**
	 * Sets the column whitelist. The list is held by reference and read at check time.
	 *
	 * @param columnWhitelist permitted column names, or {@code null} to permit any column
	 */
	public void setColumnWhitelist(@Nullable List<String> columnWhitelist) {
		this.columnWhitelist = columnWhitelist;
	}

	@NonNull
	public Optional<List<String>> getTableWhitelist() {
		return Optional.ofNullable(this.tableWhitelist);
	}

	/**
	 * Sets the table whitelist. The list is held by reference and read at check time.
	 *
	 * @param tableWhitelist permitted table names, or {@code null} to permit any table
	 */
	public void setTableWhitelist(@Nullable List<String> tableWhitelist) {
		this.tableWhitelist = tableWhitelist;
	}

	@NonNull
	public ErrorDetail getErrorDetail() {
		return getErrorReporter().getErrorDetail();
	}

	@NonNull
	public String getStatementTerminator() {
		return this.statementTerminator;
	}

	/**
	 * Runs a probe query, mapping a failed execution to {@code false}. Every other failure propagates.
	 */
	protected boolean probe(@NonNull String sql) {
		requireNonNull(sql);

		try {
			executeForResult(sql);
			return true;
		} catch (GateException e) {
			if (e.getErrorKind() == ErrorKind.QUERY_EXECUTION_FAILED)
				return false;

			throw e;
		}
	}

	protected void ensureOpen() {
		if (isClosed())
			throw getErrorReporter().connectionClosed();
	}

	@NonNull
	protected <R> R performStatement(@NonNull String sql,
																	 @NonNull List<Bind> binds,
																	 @NonNull StatementOperation<R> statementOperation) {
		requireNonNull(sql);
		requireNonNull(binds);
		requireNonNull(statementOperation);

		for (Bind bind : binds)
			requireNonNull(bind, "Binds must not contain null elements");

		if (sql.isBlank())
			throw new IllegalArgumentException("SQL statement must not be blank");

		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration fetchDuration = null;
		Exception exception = null;
		Throwable thrown = null;
		boolean rejected = false;

		try {
			try {
				ensureOpen();
				ClauseScanner.scan(sql, getBlacklist());
			} catch (GateException e) {
				rejected = true;
				throw e;
			}

			NamedParameterSql namedParameterSql = NamedParameterSql.parse(sql);
			long startTime = nanoTime();

			try (PreparedStatement preparedStatement = this.connection.prepareStatement(namedParameterSql.getJdbcSql() + getStatementTerminator())) {
				this.lastStatement = sql + getStatementTerminator();
				bindParameters(preparedStatement, namedParameterSql, binds);
				preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				StatementOperationResult<R> statementOperationResult = statementOperation.perform(preparedStatement);
				executionDuration = statementOperationResult.getExecutionDuration().orElse(null);
				fetchDuration = statementOperationResult.getFetchDuration().orElse(null);

				return statementOperationResult.getValue();
			}
		} catch (GateException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Exception e) {
			exception = e;
			GateException wrapped = getErrorReporter().queryExecutionFailed(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			StatementLog statementLog = StatementLog.withSql(sql)
					.binds(binds)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.fetchDuration(fetchDuration)
					.exception(exception)
					.rejected(rejected)
					.build();

			try {
				getStatementLogger().log(statementLog);
			} catch (Throwable loggerFailure) {
				if (thrown != null) {
					thrown.addSuppressed(loggerFailure);
				} else if (loggerFailure instanceof RuntimeException) {
					throw (RuntimeException) loggerFailure;
				} else if (loggerFailure instanceof Error) {
					throw (Error) loggerFailure;
				} else {
					throw new RuntimeException(loggerFailure);
				}
			}
		}
	}

	protected void bindParameters(@NonNull PreparedStatement preparedStatement,
																@NonNull NamedParameterSql namedParameterSql,
																@NonNull List<Bind> binds) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(namedParameterSql);
		requireNonNull(binds);

		for (Bind bind : binds) {
			requireNonNull(bind);

			Object value = bind.getValue().orElse(null);
			SQLType sqlType = bind.getSqlType().orElse(null);
			String name = bind.getName().orElse(null);

			if (name != null) {
				List<Integer> positions = namedParameterSql.positionsOf(name);

				if (positions.isEmpty())
					throw new SQLException(format("Statement has no parameter named %s", bind.getParameterDescription()));

				// A name which occurs more than once is bound at every occurrence
				for (Integer position : positions)
					getParameterBinder().bindParameter(preparedStatement, position, value, sqlType);
			} else {
				if (namedParameterSql.hasNamedParameters())
					throw new SQLException(format("Positional parameter %s cannot be bound to a statement with named parameters",
							bind.getParameterDescription()));

				getParameterBinder().bindParameter(preparedStatement, bind.getPosition().get(), value, sqlType);
			}
		}
	}

	@NonNull
	protected QueryResult fetchRows(@NonNull ResultSet resultSet,
																	@NonNull FetchMode fetchMode) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(fetchMode);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnLabels = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columnLabels.add(resultSetMetaData.getColumnLabel(i));

		columnLabels = List.copyOf(columnLabels);
		List<Row> rows = new ArrayList<>();

		while (resultSet.next()) {
			List<Object> values = new ArrayList<>(columnCount);

			for (int i = 1; i <= columnCount; ++i)
				values.add(resultSet.getObject(i));

			rows.add(new Row(fetchMode, columnLabels, values));
		}

		return new QueryResult(columnLabels, rows);
	}

	@NonNull
	protected String storageCaseIdentifier(@NonNull DatabaseMetaData databaseMetaData,
																				 @NonNull String identifier) throws SQLException {
		requireNonNull(databaseMetaData);
		requireNonNull(identifier);

		if (databaseMetaData.storesUpperCaseIdentifiers())
			return identifier.toUpperCase(Locale.ROOT);

		if (databaseMetaData.storesLowerCaseIdentifiers())
			return identifier.toLowerCase(Locale.ROOT);

		return identifier;
	}

	@NonNull
	protected String escapeSearchString(@NonNull String string,
																			@Nullable String searchStringEscape) {
		requireNonNull(string);

		if (searchStringEscape == null || searchStringEscape.isEmpty())
			return string;

		return string.replace(searchStringEscape, searchStringEscape + searchStringEscape)
				.replace("_", searchStringEscape + "_")
				.replace("%", searchStringEscape + "%");
	}

	@NonNull
	protected ParameterBinder getParameterBinder() {
		return this.parameterBinder;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	protected ErrorReporter getErrorReporter() {
		return this.errorReporter;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected DatabaseOperationSupportStatus getExecuteLargeUpdateSupported() {
		return this.executeLargeUpdateSupported;
	}

	protected void setExecuteLargeUpdateSupported(@NonNull DatabaseOperationSupportStatus executeLargeUpdateSupported) {
		requireNonNull(executeLargeUpdateSupported);
		this.executeLargeUpdateSupported = executeLargeUpdateSupported;
	}

	@FunctionalInterface
	protected interface StatementOperation<R> {
		@NonNull
		StatementOperationResult<R> perform(@NonNull PreparedStatement preparedStatement) throws Exception;
	}

	protected static final class StatementOperationResult<R> {
		@NonNull
		private final R value;
		@Nullable
		private final Duration executionDuration;
		@Nullable
		private final Duration fetchDuration;

		StatementOperationResult(@NonNull R value,
														 @Nullable Duration executionDuration,
														 @Nullable Duration fetchDuration) {
			requireNonNull(value);

			this.value = value;
			this.executionDuration = executionDuration;
			this.fetchDuration = fetchDuration;
		}

		@NonNull
		R getValue() {
			return this.value;
		}

		@NonNull
		Optional<Duration> getExecutionDuration() {
			return Optional.ofNullable(this.executionDuration);
		}

		@NonNull
		Optional<Duration> getFetchDuration() {
			return Optional.ofNullable(this.fetchDuration);
		}
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}

	/**
	 * Builder used to construct instances of {@link StatementGate}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String url;
		@Nullable
		private String user;
		@Nullable
		private String password;
		@Nullable
		private Map<String, String> options;
		@Nullable
		private Connector connector;
		@Nullable
		private Blacklist blacklist;
		@Nullable
		private List<String> columnWhitelist;
		@Nullable
		private List<String> tableWhitelist;
		@Nullable
		private ParameterBinder parameterBinder;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private ErrorDetail errorDetail;
		@Nullable
		private String statementTerminator;

		private Builder(@NonNull String url) {
			this.url = requireNonNull(url);
		}

		@NonNull
		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		/**
		 * Driver properties passed through to the {@link Connector}, e.g. connect or socket timeouts.
		 *
		 * @param options driver properties (null for none)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder options(@Nullable Map<String, String> options) {
			this.options = options;
			return this;
		}

		@NonNull
		public Builder connector(@Nullable Connector connector) {
			this.connector = connector;
			return this;
		}

		/**
		 * @param blacklist the blacklist to consult (null for {@link Blacklist#withDefaultTokens()})
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder blacklist(@Nullable Blacklist blacklist) {
			this.blacklist = blacklist;
			return this;
		}

		@NonNull
		public Builder columnWhitelist(@Nullable List<String> columnWhitelist) {
			this.columnWhitelist = columnWhitelist;
			return this;
		}

		@NonNull
		public Builder tableWhitelist(@Nullable List<String> tableWhitelist) {
			this.tableWhitelist = tableWhitelist;
			return this;
		}

		@NonNull
		public Builder parameterBinder(@Nullable ParameterBinder parameterBinder) {
			this.parameterBinder = parameterBinder;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * @param errorDetail how much driver detail failures expose (null for {@link ErrorDetail#SANITIZED})
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder errorDetail(@Nullable ErrorDetail errorDetail) {
			this.errorDetail = errorDetail;
			return this;
		}

		/**
		 * Text appended to every statement before it is prepared. Use {@code ""} for drivers which reject a trailing
		 * terminator.
		 *
		 * @param statementTerminator the terminator (null for <code>{@value StatementGate#DEFAULT_STATEMENT_TERMINATOR}</code>)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder statementTerminator(@Nullable String statementTerminator) {
			this.statementTerminator = statementTerminator;
			return this;
		}

		/**
		 * Connects and constructs a {@code StatementGate}.
		 *
		 * @return a connected {@code StatementGate}
		 * @throws GateException with {@link ErrorKind#CONNECTION_FAILED} if the connection cannot be opened
		 */
		@NonNull
		public StatementGate build() {
			return new StatementGate(this);
		}
	}
}
