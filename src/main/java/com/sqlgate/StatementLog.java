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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A collection of SQL statement execution diagnostics.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String sql;
	@NonNull
	private final List<Bind> binds;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration fetchDuration;
	@Nullable
	private final Exception exception;
	private final boolean rejected;

	/**
	 * Creates a {@code StatementLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code StatementLog}
	 */
	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.binds = builder.binds == null ? List.of() : List.copyOf(builder.binds);
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.fetchDuration = builder.fetchDuration;
		this.exception = builder.exception;
		this.rejected = builder.rejected == null ? false : builder.rejected;

		Duration totalDuration = Duration.ZERO;

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.fetchDuration != null)
			totalDuration = totalDuration.plus(this.fetchDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code sql}.
	 *
	 * @param sql the statement text as submitted to the gate
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("sql=%s", getSql()));

		if (getBinds().size() > 0)
			components.add(format("binds=%s", getBinds()));

		components.add(format("totalDuration=%s", getTotalDuration()));

		Duration preparationDuration = getPreparationDuration().orElse(null);

		if (preparationDuration != null)
			components.add(format("preparationDuration=%s", preparationDuration));

		Duration executionDuration = getExecutionDuration().orElse(null);

		if (executionDuration != null)
			components.add(format("executionDuration=%s", executionDuration));

		Duration fetchDuration = getFetchDuration().orElse(null);

		if (fetchDuration != null)
			components.add(format("fetchDuration=%s", fetchDuration));

		if (isRejected())
			components.add("rejected=true");

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getSql(), statementLog.getSql())
				&& Objects.equals(getBinds(), statementLog.getBinds())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getFetchDuration(), statementLog.getFetchDuration())
				&& Objects.equals(getException(), statementLog.getException())
				&& isRejected() == statementLog.isRejected();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getBinds(), getPreparationDuration(), getExecutionDuration(), getFetchDuration(),
				getException(), isRejected());
	}

	/**
	 * The statement text as submitted to the gate, before placeholder rewriting and without terminator.
	 *
	 * @return the statement text
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<Bind> getBinds() {
		return this.binds;
	}

	/**
	 * How long did it take to prepare the statement and bind data to it?
	 *
	 * @return how long preparation and binding took, if the statement got that far
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	/**
	 * How long did it take to execute the SQL statement?
	 *
	 * @return how long it took to execute the SQL statement, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to fetch rows from the {@link java.sql.ResultSet}?
	 *
	 * @return how long it took to fetch rows, if available
	 */
	@NonNull
	public Optional<Duration> getFetchDuration() {
		return Optional.ofNullable(this.fetchDuration);
	}

	/**
	 * This is the sum of {@link #getPreparationDuration()} + {@link #getExecutionDuration()} +
	 * {@link #getFetchDuration()}.
	 *
	 * @return how long the statement took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	/**
	 * The exception that occurred, unsanitized.
	 * <p>
	 * For driver failures this is the driver's own exception, not the {@link GateException} the caller sees.
	 *
	 * @return the exception that occurred, if any
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Was the statement rejected (blacklisted clause, closed gate) before reaching the driver?
	 *
	 * @return {@code true} if the driver was never asked to prepare the statement
	 */
	public boolean isRejected() {
		return this.rejected;
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@Nullable
		private List<Bind> binds;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration fetchDuration;
		@Nullable
		private Exception exception;
		@Nullable
		private Boolean rejected;

		private Builder(@NonNull String sql) {
			requireNonNull(sql);
			this.sql = sql;
		}

		@NonNull
		public Builder binds(@Nullable List<Bind> binds) {
			this.binds = binds;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder fetchDuration(@Nullable Duration fetchDuration) {
			this.fetchDuration = fetchDuration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public Builder rejected(@Nullable Boolean rejected) {
			this.rejected = rejected;
			return this;
		}

		/**
		 * Constructs a {@code StatementLog} instance.
		 *
		 * @return a {@code StatementLog} instance
		 */
		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
