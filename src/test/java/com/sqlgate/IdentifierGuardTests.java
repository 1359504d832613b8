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

import java.util.ArrayList;
import java.util.List;

/**
 * @since 1.0.0
 */
public class IdentifierGuardTests {
	@Test
	public void testMissingWhitelistAllowsEverything() {
		Assertions.assertEquals("anything", IdentifierGuard.check(IdentifierGuard.Kind.COLUMN, "anything", null));
		Assertions.assertEquals("any_table", IdentifierGuard.check(IdentifierGuard.Kind.TABLE, "any_table", null));
	}

	@Test
	public void testExactMemberPasses() {
		List<String> whitelist = List.of("first_name", "last_name");
		Assertions.assertEquals("last_name", IdentifierGuard.check(IdentifierGuard.Kind.COLUMN, "last_name", whitelist));
	}

	@Test
	public void testCaseVariantsAndPaddingFail() {
		List<String> whitelist = List.of("Name");

		GateException e = Assertions.assertThrows(GateException.class,
				() -> IdentifierGuard.check(IdentifierGuard.Kind.COLUMN, "name", whitelist));
		Assertions.assertEquals(ErrorKind.COLUMN_PERMISSION_DENIED, e.getErrorKind());

		Assertions.assertThrows(GateException.class, () -> IdentifierGuard.check(IdentifierGuard.Kind.COLUMN, " Name", whitelist));
	}

	@Test
	public void testTableKindUsesTableErrorKind() {
		GateException e = Assertions.assertThrows(GateException.class,
				() -> IdentifierGuard.check(IdentifierGuard.Kind.TABLE, "users", List.of("names_table")));

		Assertions.assertEquals(ErrorKind.TABLE_PERMISSION_DENIED, e.getErrorKind());
		Assertions.assertEquals(4, e.getCode());
		Assertions.assertFalse(e.getMessage().contains("users"), "Message should not echo the rejected identifier");
	}

	@Test
	public void testEmptyWhitelistDeniesEverything() {
		Assertions.assertThrows(GateException.class,
				() -> IdentifierGuard.check(IdentifierGuard.Kind.TABLE, "names_table", List.of()));
	}

	@Test
	public void testGateReadsWhitelistByReference() {
		try (StatementGate gate = TestGates.createGate("identifier_guard_reference")) {
			List<String> columns = new ArrayList<>(List.of("first_name"));
			gate.setColumnWhitelist(columns);

			Assertions.assertThrows(GateException.class, () -> gate.checkColumn("ssn"));

			columns.add("ssn");
			Assertions.assertEquals("ssn", gate.checkColumn("ssn"), "Caller mutations should be visible at check time");

			gate.setColumnWhitelist(null);
			Assertions.assertEquals("anything", gate.checkColumn("anything"));
		}
	}
}
