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
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Heuristic scanner which rejects statements containing blacklisted tokens outside of quoted string literals.
 * <p>
 * The statement's whitespace is collapsed, single- and double-quoted spans are removed, and what remains is searched
 * case-insensitively for any blacklist entry taken as literal text. This is a string-token filter, not a SQL parser:
 * escaped quotes inside literals, nested quoting and comment syntax which is not itself blacklisted are not
 * understood. Bind values through {@link Bind} rather than relying on this scanner.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ClauseScanner {
	@NonNull
	private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
	@NonNull
	private static final Pattern STRING_LITERAL_PATTERN = Pattern.compile("\".*?\"|'.*?'", Pattern.DOTALL);

	private ClauseScanner() {
		// Non-instantiable
	}

	/**
	 * Verifies that {@code statement} contains no blacklisted clause.
	 *
	 * @param statement the raw SQL statement
	 * @param blacklist the forbidden tokens, or {@code null} for none
	 * @throws GateException with {@link ErrorKind#BLACKLISTED_CLAUSE} if a blacklisted token is found
	 */
	public static void scan(@NonNull String statement,
													@Nullable Blacklist blacklist) {
		requireNonNull(statement);

		if (blacklist == null || blacklist.isEmpty())
			return;

		Optional<String> blacklistedClause = findBlacklistedClause(statement, blacklist.list());

		if (blacklistedClause.isPresent())
			throw new GateException(ErrorKind.BLACKLISTED_CLAUSE,
					format("Your query statement contains a blacklisted clause: '%s'.", blacklistedClause.get()));
	}

	/**
	 * Finds the blacklist entry which matches first in {@code statement}, ignoring quoted string literals.
	 *
	 * @param statement the raw SQL statement
	 * @param tokens    the forbidden tokens
	 * @return the matching entry as it appears in {@code tokens}, or empty if the statement is clean
	 */
	@NonNull
	public static Optional<String> findBlacklistedClause(@NonNull String statement,
																											 @NonNull Collection<String> tokens) {
		requireNonNull(statement);
		requireNonNull(tokens);

		// A blank alternative would match every statement
		List<String> usableTokens = tokens.stream()
				.filter(token -> token != null && !token.isBlank())
				.collect(Collectors.toList());

		if (usableTokens.isEmpty())
			return Optional.empty();

		Matcher matcher = blacklistPattern(usableTokens).matcher(stripStringLiterals(statement));

		if (!matcher.find())
			return Optional.empty();

		String matched = matcher.group();

		return Optional.of(usableTokens.stream()
				.filter(token -> token.equalsIgnoreCase(matched))
				.findFirst()
				.orElse(matched));
	}

	/**
	 * Collapses whitespace runs to single spaces, then removes every quoted span (non-greedy).
	 *
	 * @param statement the raw SQL statement
	 * @return the statement text with literals removed
	 */
	@NonNull
	static String stripStringLiterals(@NonNull String statement) {
		requireNonNull(statement);

		String normalized = WHITESPACE_PATTERN.matcher(statement).replaceAll(" ");
		return STRING_LITERAL_PATTERN.matcher(normalized).replaceAll("");
	}

	@NonNull
	static Pattern blacklistPattern(@NonNull Collection<String> tokens) {
		requireNonNull(tokens);

		// Each entry is quoted so that e.g. "/*" is literal text and not regex syntax
		String alternation = tokens.stream()
				.map(Pattern::quote)
				.collect(Collectors.joining("|"));

		return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
	}
}
