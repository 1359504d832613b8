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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
final class TestGates {
	private TestGates() {}

	static StatementGate.@NonNull Builder inMemory(@NonNull String databaseName) {
		requireNonNull(databaseName);

		return StatementGate.withUrl(JdbcUrls.hsqldbMemory(databaseName))
				.user("sa")
				.password("");
	}

	@NonNull
	static StatementGate createGate(@NonNull String databaseName) {
		requireNonNull(databaseName);
		return inMemory(databaseName).build();
	}

	static void createNamesTable(@NonNull StatementGate gate) {
		requireNonNull(gate);

		gate.executeUpdate("CREATE TABLE names_table (first_name VARCHAR(255), last_name VARCHAR(255))");
		gate.executeUpdate("INSERT INTO names_table VALUES ('John', 'Doe')");
		gate.executeUpdate("INSERT INTO names_table VALUES ('Jane', 'Doe')");
		gate.executeUpdate("INSERT INTO names_table VALUES ('Max', 'Mustermann')");
	}

	/**
	 * Opens real HSQLDB connections, but counts and records every {@code prepareStatement} call made on them.
	 */
	static final class CountingConnector implements Connector {
		@NonNull
		private final AtomicInteger prepareCount = new AtomicInteger();
		@NonNull
		private final List<String> preparedSql = new CopyOnWriteArrayList<>();

		@Override
		@NonNull
		public Connection connect(@NonNull String url,
															String user,
															String password,
															@NonNull Map<String, String> options) throws SQLException {
			Connection connection = Connector.withDriverManager().connect(url, user, password, options);

			return (Connection) Proxy.newProxyInstance(CountingConnector.class.getClassLoader(), new Class<?>[]{Connection.class},
					(proxy, method, args) -> {
						if (method.getName().equals("prepareStatement")) {
							this.prepareCount.incrementAndGet();
							this.preparedSql.add((String) args[0]);
						}

						try {
							return method.invoke(connection, args);
						} catch (InvocationTargetException e) {
							throw e.getCause();
						}
					});
		}

		int getPrepareCount() {
			return this.prepareCount.get();
		}

		@NonNull
		List<String> getPreparedSql() {
			return this.preparedSql;
		}
	}
}
