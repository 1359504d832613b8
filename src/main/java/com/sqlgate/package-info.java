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

/**
 * SqlGate runs SQL statements through a guard before they reach a JDBC connection.
 * <p>
 * Every statement is scanned against a {@link com.sqlgate.Blacklist} of forbidden tokens, identifiers can be checked
 * against column and table whitelists, values are bound as prepared-statement parameters, and driver failures are
 * reported as classified {@link com.sqlgate.GateException}s.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * StatementGate gate = StatementGate.withUrl(JdbcUrls.mysql("localhost", 3306, "shop"))
 *   .user("app")
 *   .password(password)
 *   .columnWhitelist(List.of("first_name", "last_name"))
 *   .tableWhitelist(List.of("customer"))
 *   .build();
 *
 * // Queries
 * String sql = format("SELECT %s FROM %s WHERE last_name = :ln",
 *   gate.checkColumn("first_name"), gate.checkTable("customer"));
 * List&lt;Row&gt; rows = gate.execute(sql, List.of(Bind.of("ln", "Doe")));
 *
 * // Statements
 * long updateCount = gate.executeUpdate("UPDATE customer SET last_name = ? WHERE id = ?",
 *   List.of(Bind.of(1, "Smith"), Bind.of(2, 123)));
 *
 * // Helpers
 * boolean exists = gate.tableExists("customer");
 * long total = gate.rowTotal("customer");</pre>
 *
 * @since 1.0.0
 */
package com.sqlgate;
