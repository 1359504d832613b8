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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes one table column, as reported by {@link java.sql.DatabaseMetaData#getColumns}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnInfo {
	@NonNull
	private final String name;
	@NonNull
	private final String typeName;
	private final int jdbcType;
	@Nullable
	private final Integer size;
	@Nullable
	private final Boolean nullable;
	@Nullable
	private final String defaultValue;
	private final int ordinalPosition;

	ColumnInfo(@NonNull String name,
						 @NonNull String typeName,
						 int jdbcType,
						 @Nullable Integer size,
						 @Nullable Boolean nullable,
						 @Nullable String defaultValue,
						 int ordinalPosition) {
		requireNonNull(name);
		requireNonNull(typeName);

		this.name = name;
		this.typeName = typeName;
		this.jdbcType = jdbcType;
		this.size = size;
		this.nullable = nullable;
		this.defaultValue = defaultValue;
		this.ordinalPosition = ordinalPosition;
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * @return the database-specific type name, e.g. {@code VARCHAR}
	 */
	@NonNull
	public String getTypeName() {
		return this.typeName;
	}

	/**
	 * @return the type as a {@link java.sql.Types} constant
	 */
	public int getJdbcType() {
		return this.jdbcType;
	}

	@NonNull
	public Optional<Integer> getSize() {
		return Optional.ofNullable(this.size);
	}

	/**
	 * @return whether the column accepts {@code NULL}, or empty if the driver does not know
	 */
	@NonNull
	public Optional<Boolean> getNullable() {
		return Optional.ofNullable(this.nullable);
	}

	@NonNull
	public Optional<String> getDefaultValue() {
		return Optional.ofNullable(this.defaultValue);
	}

	/**
	 * @return the column's 1-based position in its table
	 */
	public int getOrdinalPosition() {
		return this.ordinalPosition;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getTypeName(), getJdbcType(), getSize(), getNullable(), getDefaultValue(),
				getOrdinalPosition());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnInfo))
			return false;

		ColumnInfo columnInfo = (ColumnInfo) object;

		return Objects.equals(columnInfo.getName(), getName())
				&& Objects.equals(columnInfo.getTypeName(), getTypeName())
				&& columnInfo.getJdbcType() == getJdbcType()
				&& Objects.equals(columnInfo.getSize(), getSize())
				&& Objects.equals(columnInfo.getNullable(), getNullable())
				&& Objects.equals(columnInfo.getDefaultValue(), getDefaultValue())
				&& columnInfo.getOrdinalPosition() == getOrdinalPosition();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, typeName=%s, jdbcType=%d, size=%s, nullable=%s, defaultValue=%s}",
				getClass().getSimpleName(), getName(), getTypeName(), getJdbcType(), this.size, this.nullable, this.defaultValue);
	}
}
