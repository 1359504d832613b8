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
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * Opens the single JDBC {@link Connection} a {@link StatementGate} owns.
 * <p>
 * Implementations might use {@link DriverManager} (see {@link #withDriverManager()}), a pooled
 * {@link javax.sql.DataSource}, or a test double.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface Connector {
	/**
	 * Opens a connection.
	 *
	 * @param url      the JDBC URL, e.g. from {@link JdbcUrls}
	 * @param user     the user to authenticate as, if any
	 * @param password the user's password, if any
	 * @param options  driver properties, e.g. timeouts
	 * @return an open connection
	 * @throws SQLException if the connection cannot be opened
	 */
	@NonNull
	Connection connect(@NonNull String url,
										 @Nullable String user,
										 @Nullable String password,
										 @NonNull Map<String, String> options) throws SQLException;

	/**
	 * Acquires a connector backed by {@link DriverManager#getConnection(String, Properties)}.
	 * <p>
	 * Options are passed through as driver properties. A non-null {@code user} or {@code password} takes precedence over
	 * {@code user} and {@code password} entries in the options.
	 *
	 * @return a {@link DriverManager}-backed connector
	 */
	@NonNull
	static Connector withDriverManager() {
		return (url, user, password, options) -> {
			requireNonNull(url);
			requireNonNull(options);

			Properties properties = new Properties();
			properties.putAll(options);

			if (user != null)
				properties.setProperty("user", user);

			if (password != null)
				properties.setProperty("password", password);

			return DriverManager.getConnection(url, properties);
		};
	}
}
