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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Builds JDBC URLs for common engines.
 * <p>
 * A {@code null} or empty host means {@code localhost}. A {@code null} port or an empty database name is omitted, so the
 * driver's default applies.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class JdbcUrls {
	@NonNull
	static final String DEFAULT_HOST = "localhost";

	private JdbcUrls() {
		// Non-instantiable
	}

	@NonNull
	public static String mysql(@Nullable String host,
														 @Nullable Integer port,
														 @Nullable String database) {
		return hierarchical("jdbc:mysql://", host, port, database);
	}

	@NonNull
	public static String mariadb(@Nullable String host,
															 @Nullable Integer port,
															 @Nullable String database) {
		return hierarchical("jdbc:mariadb://", host, port, database);
	}

	@NonNull
	public static String postgresql(@Nullable String host,
																	@Nullable Integer port,
																	@Nullable String database) {
		return hierarchical("jdbc:postgresql://", host, port, database);
	}

	@NonNull
	public static String db2(@Nullable String host,
													 @Nullable Integer port,
													 @NonNull String database) {
		requireNonNull(database);
		return hierarchical("jdbc:db2://", host, port, database);
	}

	/**
	 * Microsoft SQL Server, e.g. {@code jdbc:sqlserver://localhost:1433;databaseName=shop}.
	 */
	@NonNull
	public static String sqlServer(@Nullable String host,
																 @Nullable Integer port,
																 @Nullable String database) {
		String url = "jdbc:sqlserver://" + hostAndPort(host, port);
		return isEmpty(database) ? url : format("%s;databaseName=%s", url, database);
	}

	/**
	 * Oracle thin driver, by service name, e.g. {@code jdbc:oracle:thin:@//localhost:1521/XEPDB1}.
	 */
	@NonNull
	public static String oracle(@Nullable String host,
															@Nullable Integer port,
															@NonNull String serviceName) {
		requireNonNull(serviceName);
		return format("jdbc:oracle:thin:@//%s/%s", hostAndPort(host, port), serviceName);
	}

	@NonNull
	public static String sqlite(@NonNull String path) {
		requireNonNull(path);
		return "jdbc:sqlite:" + path;
	}

	@NonNull
	public static String sqliteMemory() {
		return "jdbc:sqlite::memory:";
	}

	@NonNull
	public static String hsqldbMemory(@NonNull String name) {
		requireNonNull(name);
		return "jdbc:hsqldb:mem:" + name;
	}

	@NonNull
	public static String h2Memory(@NonNull String name) {
		requireNonNull(name);
		return "jdbc:h2:mem:" + name;
	}

	@NonNull
	public static String h2File(@NonNull String path) {
		requireNonNull(path);
		return "jdbc:h2:file:" + path;
	}

	@NonNull
	private static String hierarchical(@NonNull String prefix,
																		 @Nullable String host,
																		 @Nullable Integer port,
																		 @Nullable String database) {
		requireNonNull(prefix);
		return format("%s%s/%s", prefix, hostAndPort(host, port), isEmpty(database) ? "" : database);
	}

	@NonNull
	private static String hostAndPort(@Nullable String host,
																		@Nullable Integer port) {
		String resolvedHost = isEmpty(host) ? DEFAULT_HOST : host;

		if (port == null)
			return resolvedHost;

		if (port < 1 || port > 65535)
			throw new IllegalArgumentException(format("Illegal port %d", port));

		return resolvedHost + ":" + port;
	}

	private static boolean isEmpty(@Nullable String string) {
		return string == null || string.isBlank();
	}
}
