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

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;

/**
 * Contract for binding a single value to a {@link PreparedStatement} parameter.
 * <p>
 * Implementations must be threadsafe.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ParameterBinder {
	/**
	 * Binds a single value to a SQL prepared statement.
	 * <p>
	 * Unlike most of the API, {@code value} may be {@code null}, in which case SQL {@code NULL} should be bound.
	 *
	 * @param preparedStatement the prepared statement to bind to
	 * @param parameterIndex    the 1-based JDBC index of the parameter we are binding
	 * @param value             the value to bind, or {@code null}
	 * @param sqlType           the explicit SQL type of the value, or {@code null} to let the driver infer it
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull PreparedStatement preparedStatement,
										 int parameterIndex,
										 @Nullable Object value,
										 @Nullable SQLType sqlType) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ParameterBinder withDefaultConfiguration() {
		return new DefaultParameterBinder();
	}
}
