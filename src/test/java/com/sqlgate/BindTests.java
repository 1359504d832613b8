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

import java.sql.JDBCType;
import java.util.Optional;

/**
 * @since 1.0.0
 */
public class BindTests {
	@Test
	public void testNamedBind() {
		Bind bind = Bind.of(":ln", "Doe");

		Assertions.assertEquals(Optional.of("ln"), bind.getName(), "Leading colon should be stripped");
		Assertions.assertEquals(Optional.empty(), bind.getPosition());
		Assertions.assertEquals(":ln", bind.getParameterDescription());
		Assertions.assertEquals(Bind.of("ln", "Doe"), bind);
	}

	@Test
	public void testPositionalBind() {
		Bind bind = Bind.of(2, null, JDBCType.INTEGER);

		Assertions.assertEquals(Optional.of(2), bind.getPosition());
		Assertions.assertEquals(Optional.empty(), bind.getValue());
		Assertions.assertEquals(Optional.of(JDBCType.INTEGER), bind.getSqlType());
		Assertions.assertEquals("#2", bind.getParameterDescription());
	}

	@Test
	public void testIllegalBinds() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Bind.of(0, "x"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Bind.of(":", "x"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Bind.of(" ", "x"));
	}
}
