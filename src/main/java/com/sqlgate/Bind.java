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
import java.sql.SQLType;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A value to bind to a prepared statement parameter, identified either by name or by 1-based position.
 * <p>
 * Names may be given with or without their leading colon, so {@code Bind.of(":ln", "Doe")} and
 * {@code Bind.of("ln", "Doe")} are equivalent. If no {@link SQLType} is supplied, the driver infers the type from the
 * value.
 * <pre>{@code
 * List<Row> rows = gate.execute("SELECT * FROM names_table WHERE last = :ln",
 *   List.of(Bind.of(":ln", "Doe")));}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Bind {
	@Nullable
	private final String name;
	@Nullable
	private final Integer position;
	@Nullable
	private final Object value;
	@Nullable
	private final SQLType sqlType;

	private Bind(@Nullable String name,
							 @Nullable Integer position,
							 @Nullable Object value,
							 @Nullable SQLType sqlType) {
		this.name = name;
		this.position = position;
		this.value = value;
		this.sqlType = sqlType;
	}

	@NonNull
	public static Bind of(@NonNull String name,
												@Nullable Object value) {
		requireNonNull(name);
		return of(name, value, null);
	}

	@NonNull
	public static Bind of(@NonNull String name,
												@Nullable Object value,
												@Nullable SQLType sqlType) {
		requireNonNull(name);

		String normalizedName = name.startsWith(":") ? name.substring(1) : name;

		if (normalizedName.isBlank())
			throw new IllegalArgumentException(format("Illegal parameter name '%s'", name));

		return new Bind(normalizedName, null, value, sqlType);
	}

	@NonNull
	public static Bind of(int position,
												@Nullable Object value) {
		return of(position, value, null);
	}

	@NonNull
	public static Bind of(int position,
												@Nullable Object value,
												@Nullable SQLType sqlType) {
		if (position < 1)
			throw new IllegalArgumentException(format("Parameter positions start at 1 (was %d)", position));

		return new Bind(null, position, value, sqlType);
	}

	/**
	 * @return the parameter name without its leading colon, or empty if this bind is positional
	 */
	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	/**
	 * @return the 1-based parameter position, or empty if this bind is named
	 */
	@NonNull
	public Optional<Integer> getPosition() {
		return Optional.ofNullable(this.position);
	}

	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	@NonNull
	public Optional<SQLType> getSqlType() {
		return Optional.ofNullable(this.sqlType);
	}

	/**
	 * @return {@code :name} for named binds, {@code #position} for positional binds
	 */
	@NonNull
	public String getParameterDescription() {
		return this.name != null ? ":" + this.name : "#" + this.position;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.name, this.position, this.value, this.sqlType);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Bind))
			return false;

		Bind bind = (Bind) object;

		return Objects.equals(bind.name, this.name)
				&& Objects.equals(bind.position, this.position)
				&& Objects.equals(bind.value, this.value)
				&& Objects.equals(bind.sqlType, this.sqlType);
	}

	@Override
	@NonNull
	public String toString() {
		if (this.sqlType == null)
			return format("%s{parameter=%s, value=%s}", getClass().getSimpleName(), getParameterDescription(), this.value);

		return format("%s{parameter=%s, value=%s, sqlType=%s}", getClass().getSimpleName(), getParameterDescription(),
				this.value, this.sqlType.getName());
	}
}
