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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Column labels and rows produced by a gated statement.
 * <p>
 * Unlike a bare {@code List<Row>}, this keeps the column labels available when no rows matched.
 * Statements which produce no result set (e.g. DDL) yield no columns and no rows.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryResult {
	@NonNull
	private final List<String> columnLabels;
	@NonNull
	private final List<Row> rows;

	QueryResult(@NonNull List<String> columnLabels,
							@NonNull List<Row> rows) {
		requireNonNull(columnLabels);
		requireNonNull(rows);

		this.columnLabels = List.copyOf(columnLabels);
		this.rows = List.copyOf(rows);
	}

	@NonNull
	public List<String> getColumnLabels() {
		return this.columnLabels;
	}

	public int getColumnCount() {
		return this.columnLabels.size();
	}

	@NonNull
	public List<Row> getRows() {
		return this.rows;
	}

	public int getRowCount() {
		return this.rows.size();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumnLabels(), getRows());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryResult))
			return false;

		QueryResult queryResult = (QueryResult) object;

		return Objects.equals(queryResult.getColumnLabels(), getColumnLabels())
				&& Objects.equals(queryResult.getRows(), getRows());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columnLabels=%s, rowCount=%d}", getClass().getSimpleName(), getColumnLabels(), getRowCount());
	}
}
