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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * @since 1.0.0
 */
public class JdbcUrlsTests {
	@Test
	public void testHierarchicalUrls() {
		Assertions.assertEquals("jdbc:mysql://db.example.com:3306/shop", JdbcUrls.mysql("db.example.com", 3306, "shop"));
		Assertions.assertEquals("jdbc:mariadb://localhost/", JdbcUrls.mariadb(null, null, null));
		Assertions.assertEquals("jdbc:postgresql://localhost:5432/shop", JdbcUrls.postgresql("", 5432, "shop"));
		Assertions.assertEquals("jdbc:db2://host:50000/SAMPLE", JdbcUrls.db2("host", 50000, "SAMPLE"));
	}

	@Test
	public void testVendorSpecificUrls() {
		Assertions.assertEquals("jdbc:sqlserver://localhost:1433;databaseName=shop", JdbcUrls.sqlServer(null, 1433, "shop"));
		Assertions.assertEquals("jdbc:sqlserver://host", JdbcUrls.sqlServer("host", null, " "));
		Assertions.assertEquals("jdbc:oracle:thin:@//host:1521/XEPDB1", JdbcUrls.oracle("host", 1521, "XEPDB1"));
	}

	@Test
	public void testEmbeddedUrls() {
		Assertions.assertEquals("jdbc:sqlite:/tmp/app.db", JdbcUrls.sqlite("/tmp/app.db"));
		Assertions.assertEquals("jdbc:sqlite::memory:", JdbcUrls.sqliteMemory());
		Assertions.assertEquals("jdbc:hsqldb:mem:test", JdbcUrls.hsqldbMemory("test"));
		Assertions.assertEquals("jdbc:h2:mem:test", JdbcUrls.h2Memory("test"));
		Assertions.assertEquals("jdbc:h2:file:./data/app", JdbcUrls.h2File("./data/app"));
	}

	@Test
	public void testIllegalPort() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> JdbcUrls.mysql("host", 0, "shop"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> JdbcUrls.mysql("host", 65536, "shop"));
	}
}
