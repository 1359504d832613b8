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

import java.util.Arrays;
import java.util.List;

/**
 * @since 1.0.0
 */
public class RowTests {
	@Test
	public void testDuplicateLabelsKeepLastValue() {
		Row row = new Row(FetchMode.BOTH, List.of("ID", "ID"), List.of(1, 2));

		Assertions.assertEquals(2, row.get("ID"), "Later column should win for a duplicated label");
		Assertions.assertEquals(List.of(1, 2), row.asList(), "Positions should keep every value");
	}

	@Test
	public void testNullValuesAreKept() {
		Row row = new Row(FetchMode.BOTH, List.of("A", "B"), Arrays.asList("x", null));

		Assertions.assertNull(row.get("B"));
		Assertions.assertNull(row.get(1));
		Assertions.assertTrue(row.asMap().containsKey("B"));
	}

	@Test
	public void testMismatchedSizesRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new Row(FetchMode.BOTH, List.of("A"), List.of(1, 2)));
	}

	@Test
	public void testAccessRestrictedByFetchMode() {
		Row associative = new Row(FetchMode.ASSOCIATIVE, List.of("A"), List.of(1));
		Row numeric = new Row(FetchMode.NUMERIC, List.of("A"), List.of(1));

		Assertions.assertThrows(IllegalStateException.class, associative::asList);
		Assertions.assertThrows(IllegalStateException.class, numeric::asMap);
		Assertions.assertEquals(1, numeric.getColumnCount());
		Assertions.assertEquals(List.of("A"), numeric.getColumnLabels(), "Labels are known regardless of fetch mode");
	}
}
