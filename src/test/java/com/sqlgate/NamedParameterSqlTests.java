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

import java.util.List;

/**
 * @since 1.0.0
 */
public class NamedParameterSqlTests {
	@Test
	public void testNamedParametersAreRewritten() {
		NamedParameterSql namedParameterSql = NamedParameterSql.parse("SELECT * FROM t WHERE a = :first AND b = :second");

		Assertions.assertEquals("SELECT * FROM t WHERE a = ? AND b = ?", namedParameterSql.getJdbcSql());
		Assertions.assertEquals(List.of("first", "second"), namedParameterSql.getParameterNames());
		Assertions.assertEquals(2, namedParameterSql.getParameterCount());
		Assertions.assertTrue(namedParameterSql.hasNamedParameters());
	}

	@Test
	public void testRepeatedNameOccupiesEveryPosition() {
		NamedParameterSql namedParameterSql = NamedParameterSql.parse("SELECT * FROM t WHERE a = :x OR b = :y OR c = :x");

		Assertions.assertEquals(List.of(1, 3), namedParameterSql.positionsOf("x"));
		Assertions.assertEquals(List.of(1, 3), namedParameterSql.positionsOf(":x"), "Leading colon should be optional");
		Assertions.assertEquals(List.of(2), namedParameterSql.positionsOf("y"));
		Assertions.assertEquals(List.of(), namedParameterSql.positionsOf("z"));
	}

	@Test
	public void testQuotedTextAndCommentsAreLeftAlone() {
		String sql = "SELECT ':notparam', \"col:name\", `x:y`, [a:b] FROM t -- :comment\nWHERE a = :real /* :block */";
		NamedParameterSql namedParameterSql = NamedParameterSql.parse(sql);

		Assertions.assertEquals(List.of("real"), namedParameterSql.getParameterNames());
		Assertions.assertEquals(sql.replace(":real", "?"), namedParameterSql.getJdbcSql());
	}

	@Test
	public void testEscapedQuotesAndDollarQuoting() {
		NamedParameterSql escapedQuote = NamedParameterSql.parse("SELECT 'it''s :not' FROM t WHERE a = :yes");
		Assertions.assertEquals(List.of("yes"), escapedQuote.getParameterNames());

		NamedParameterSql dollarQuoted = NamedParameterSql.parse("SELECT $body$ :not $body$, :yes");
		Assertions.assertEquals(List.of("yes"), dollarQuoted.getParameterNames());
	}

	@Test
	public void testTypeCastIsNotAParameter() {
		NamedParameterSql namedParameterSql = NamedParameterSql.parse("SELECT :value::text");

		Assertions.assertEquals("SELECT ?::text", namedParameterSql.getJdbcSql());
		Assertions.assertEquals(List.of("value"), namedParameterSql.getParameterNames());
	}

	@Test
	public void testPositionalParametersAreCounted() {
		NamedParameterSql namedParameterSql = NamedParameterSql.parse("INSERT INTO t VALUES (?, ?, '?')");

		Assertions.assertEquals(2, namedParameterSql.getParameterCount());
		Assertions.assertFalse(namedParameterSql.hasNamedParameters());
		Assertions.assertEquals("INSERT INTO t VALUES (?, ?, '?')", namedParameterSql.getJdbcSql());
	}

	@Test
	public void testMixedParametersAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> NamedParameterSql.parse("SELECT * FROM t WHERE a = :a AND b = ?"));
	}
}
