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
import java.util.Collection;

import static java.util.Objects.requireNonNull;

/**
 * Validates a table or column name against an optional whitelist before the caller interpolates it into SQL.
 * <p>
 * A {@code null} whitelist means "no restriction" for that identifier class. Otherwise the name must be an exact,
 * case-sensitive member of the whitelist: {@code "Name"} and {@code "name"} are different identifiers, and no
 * trimming or partial matching takes place.
 * <pre>{@code
 * String sql = format("SELECT %s FROM %s WHERE %s = :ln",
 *   gate.checkColumn(firstName), gate.checkTable(table), gate.checkColumn(lastName));}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class IdentifierGuard {
	private IdentifierGuard() {
		// Non-instantiable
	}

	/**
	 * Identifier classes, each with its own whitelist and error classification.
	 */
	public enum Kind {
		COLUMN(ErrorKind.COLUMN_PERMISSION_DENIED),
		TABLE(ErrorKind.TABLE_PERMISSION_DENIED);

		@NonNull
		private final ErrorKind errorKind;

		Kind(@NonNull ErrorKind errorKind) {
			this.errorKind = requireNonNull(errorKind);
		}

		@NonNull
		public ErrorKind getErrorKind() {
			return this.errorKind;
		}
	}

	/**
	 * Checks {@code name} against {@code whitelist}.
	 *
	 * @param kind      which class of identifier is being checked
	 * @param name      the identifier to check
	 * @param whitelist the permitted identifiers, or {@code null} for no restriction
	 * @return {@code name}, unchanged
	 * @throws GateException with {@link ErrorKind#COLUMN_PERMISSION_DENIED} or {@link ErrorKind#TABLE_PERMISSION_DENIED}
	 *                       if a whitelist is present and does not contain {@code name}
	 */
	@NonNull
	public static String check(@NonNull Kind kind,
														 @NonNull String name,
														 @Nullable Collection<String> whitelist) {
		requireNonNull(kind);
		requireNonNull(name);

		if (whitelist == null)
			return name;

		// Collection::contains is equals-based, so this is a strict, case-sensitive match.
		// The rejected name is not echoed back.
		if (!whitelist.contains(name))
			throw new GateException(kind.getErrorKind());

		return name;
	}
}
