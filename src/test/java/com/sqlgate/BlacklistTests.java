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
public class BlacklistTests {
	@Test
	public void testDefaultTokens() {
		Blacklist blacklist = Blacklist.withDefaultTokens();

		Assertions.assertEquals(List.of("DROP", "DELETE", "--", "/*", "xp_", ";"), blacklist.list(), "Wrong default tokens");
		Assertions.assertFalse(blacklist.contains(Blacklist.MYSQL_COMMENT_TOKEN), "MySQL comment token should be opt-in");
	}

	@Test
	public void testAddIgnoresCaseInsensitiveDuplicates() {
		Blacklist blacklist = Blacklist.withDefaultTokens();

		Assertions.assertFalse(blacklist.add("drop"), "Case-insensitive duplicate should not be added");
		Assertions.assertTrue(blacklist.add("TRUNCATE"), "New token should be added");
		Assertions.assertFalse(blacklist.add("truncate"), "Case-insensitive duplicate should not be added");
		Assertions.assertEquals(7, blacklist.size());
		Assertions.assertEquals("TRUNCATE", blacklist.list().get(6), "New tokens should be appended in original casing");
	}

	@Test
	public void testAddFirstTokenIsDetectedAsDuplicate() {
		// The first entry sits at index 0, which must still count as "found"
		Blacklist blacklist = Blacklist.withDefaultTokens();

		Assertions.assertFalse(blacklist.add("DROP"));
		Assertions.assertEquals(6, blacklist.size());
	}

	@Test
	public void testAddThenRemove() {
		Blacklist blacklist = Blacklist.withDefaultTokens();

		blacklist.add("Truncate");
		Assertions.assertTrue(blacklist.remove("TRUNCATE"), "Removal should be case-insensitive");
		Assertions.assertFalse(blacklist.list().stream().anyMatch(token -> token.equalsIgnoreCase("truncate")),
				"Token should be gone after removal");
	}

	@Test
	public void testRemoveIsIdempotent() {
		Blacklist blacklist = Blacklist.withDefaultTokens();

		Assertions.assertTrue(blacklist.remove("delete"));
		List<String> afterFirstRemoval = blacklist.list();

		Assertions.assertFalse(blacklist.remove("delete"), "Second removal should be a no-op");
		Assertions.assertFalse(blacklist.remove("not-present"), "Removing an absent token should be a no-op");
		Assertions.assertEquals(afterFirstRemoval, blacklist.list());
	}

	@Test
	public void testBlankTokensRejected() {
		Blacklist blacklist = Blacklist.empty();

		Assertions.assertThrows(IllegalArgumentException.class, () -> blacklist.add(""));
		Assertions.assertThrows(IllegalArgumentException.class, () -> blacklist.add("   "));
		Assertions.assertThrows(NullPointerException.class, () -> blacklist.add(null));
		Assertions.assertTrue(blacklist.isEmpty());
	}

	@Test
	public void testListIsSnapshot() {
		Blacklist blacklist = Blacklist.withTokens(List.of("DROP"));
		List<String> snapshot = blacklist.list();

		blacklist.add("ALTER");

		Assertions.assertEquals(List.of("DROP"), snapshot, "Earlier snapshot should not change");
		Assertions.assertThrows(UnsupportedOperationException.class, () -> snapshot.add("GRANT"));
	}

	@Test
	public void testWithTokensCollapsesDuplicates() {
		Blacklist blacklist = Blacklist.withTokens(List.of("drop", "DROP", "Alter"));
		Assertions.assertEquals(List.of("drop", "Alter"), blacklist.list());
	}
}
