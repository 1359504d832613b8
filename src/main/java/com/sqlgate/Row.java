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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single fetched row.
 * <p>
 * Which accessors are available depends on the {@link FetchMode} the row was fetched with: label-based access
 * ({@link #get(String)}, {@link #asMap()}) for {@link FetchMode#ASSOCIATIVE} and {@link FetchMode#BOTH}, position-based
 * access ({@link #get(int)}, {@link #asList()}) for {@link FetchMode#NUMERIC} and {@link FetchMode#BOTH}.
 * Disallowed access throws {@link IllegalStateException}.
 * <p>
 * If a result has duplicate column labels, the label-based view holds the value of the last such column.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Row {
	@NonNull
	private final FetchMode fetchMode;
	@NonNull
	private final List<String> columnLabels;
	@NonNull
	private final List<@Nullable Object> values;
	@Nullable
	private final Map<String, @Nullable Object> valuesByLabel;

	Row(@NonNull FetchMode fetchMode,
			@NonNull List<String> columnLabels,
			@NonNull List<@Nullable Object> values) {
		requireNonNull(fetchMode);
		requireNonNull(columnLabels);
		requireNonNull(values);

		if (columnLabels.size() != values.size())
			throw new IllegalArgumentException(format("Got %d column labels but %d values", columnLabels.size(), values.size()));

		this.fetchMode = fetchMode;
		this.columnLabels = columnLabels;
		// Values may be null, so List.copyOf is not an option
		this.values = Collections.unmodifiableList(new ArrayList<>(values));

		if (fetchMode.permitsLabels()) {
			Map<String, Object> valuesByLabel = new LinkedHashMap<>(values.size());

			for (int i = 0; i < columnLabels.size(); ++i)
				valuesByLabel.put(columnLabels.get(i), values.get(i));

			this.valuesByLabel = Collections.unmodifiableMap(valuesByLabel);
		} else {
			this.valuesByLabel = null;
		}
	}

	/**
	 * @param columnLabel the column label as reported by the driver
	 * @return the column's value, or {@code null} if the value is SQL {@code NULL} or no such column exists
	 * @throws IllegalStateException if this row was fetched with {@link FetchMode#NUMERIC}
	 */
	@Nullable
	public Object get(@NonNull String columnLabel) {
		requireNonNull(columnLabel);
		return asMap().get(columnLabel);
	}

	/**
	 * @param index 0-based column position
	 * @return the column's value, or {@code null} if the value is SQL {@code NULL}
	 * @throws IllegalStateException     if this row was fetched with {@link FetchMode#ASSOCIATIVE}
	 * @throws IndexOutOfBoundsException if there is no such column
	 */
	@Nullable
	public Object get(int index) {
		return asList().get(index);
	}

	@NonNull
	public Map<String, @Nullable Object> asMap() {
		if (this.valuesByLabel == null)
			throw new IllegalStateException(format("Columns of a row fetched with %s.%s cannot be accessed by label",
					FetchMode.class.getSimpleName(), getFetchMode().name()));

		return this.valuesByLabel;
	}

	@NonNull
	public List<@Nullable Object> asList() {
		if (!getFetchMode().permitsPositions())
			throw new IllegalStateException(format("Columns of a row fetched with %s.%s cannot be accessed by position",
					FetchMode.class.getSimpleName(), getFetchMode().name()));

		return this.values;
	}

	@NonNull
	public FetchMode getFetchMode() {
		return this.fetchMode;
	}

	@NonNull
	public List<String> getColumnLabels() {
		return this.columnLabels;
	}

	public int getColumnCount() {
		return this.columnLabels.size();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFetchMode(), getColumnLabels(), this.values);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row))
			return false;

		Row row = (Row) object;

		return Objects.equals(row.getFetchMode(), getFetchMode())
				&& Objects.equals(row.getColumnLabels(), getColumnLabels())
				&& Objects.equals(row.values, this.values);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{fetchMode=%s, columnLabels=%s, values=%s}", getClass().getSimpleName(),
				getFetchMode().name(), getColumnLabels(), this.values);
	}
}
