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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mutable set of forbidden substrings consulted by {@link ClauseScanner} before every gated statement.
 * <p>
 * Duplicate detection, removal and matching are case-insensitive. Entries keep the casing they were added with and
 * are listed in insertion order. Entries are literal text, never regular expressions.
 * <p>
 * This class is intended for use by a single thread.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class Blacklist {
	/**
	 * Tokens every new {@link StatementGate} starts with, unless told otherwise.
	 */
	@NonNull
	public static final List<String> DEFAULT_TOKENS = List.of("DROP", "DELETE", "--", "/*", "xp_", ";");

	/**
	 * MySQL's end-of-line comment marker. Not part of {@link #DEFAULT_TOKENS}, but commonly added for MySQL targets.
	 */
	@NonNull
	public static final String MYSQL_COMMENT_TOKEN = "#";

	@NonNull
	private final List<String> tokens;

	private Blacklist(@NonNull Collection<String> tokens) {
		requireNonNull(tokens);

		this.tokens = new ArrayList<>(tokens.size());

		for (String token : tokens)
			add(token);
	}

	@NonNull
	public static Blacklist withDefaultTokens() {
		return new Blacklist(DEFAULT_TOKENS);
	}

	@NonNull
	public static Blacklist withTokens(@NonNull Collection<String> tokens) {
		requireNonNull(tokens);
		return new Blacklist(tokens);
	}

	@NonNull
	public static Blacklist empty() {
		return new Blacklist(List.of());
	}

	/**
	 * Adds a token unless a case-insensitive duplicate is already present.
	 *
	 * @param token the token to add
	 * @return {@code true} if the token was added, {@code false} if it was already present
	 * @throws IllegalArgumentException if {@code token} is blank, since an empty alternative would match every statement
	 */
	public boolean add(@NonNull String token) {
		requireNonNull(token);

		if (token.isBlank())
			throw new IllegalArgumentException(format("Blacklist tokens must not be blank (was '%s')", token));

		if (indexOf(token).isPresent())
			return false;

		this.tokens.add(token);
		return true;
	}

	/**
	 * Removes the first token which matches {@code token} case-insensitively. Removing an absent token is a no-op.
	 *
	 * @param token the token to remove
	 * @return {@code true} if a token was removed
	 */
	public boolean remove(@NonNull String token) {
		requireNonNull(token);

		OptionalInt index = indexOf(token);

		if (index.isEmpty())
			return false;

		this.tokens.remove(index.getAsInt());
		return true;
	}

	public boolean contains(@NonNull String token) {
		requireNonNull(token);
		return indexOf(token).isPresent();
	}

	/**
	 * @return an unmodifiable snapshot of the current tokens, in insertion order
	 */
	@NonNull
	public List<String> list() {
		return List.copyOf(this.tokens);
	}

	public boolean isEmpty() {
		return this.tokens.isEmpty();
	}

	public int size() {
		return this.tokens.size();
	}

	@NonNull
	private OptionalInt indexOf(@NonNull String token) {
		requireNonNull(token);

		String normalizedToken = normalize(token);

		for (int i = 0; i < this.tokens.size(); ++i)
			if (normalize(this.tokens.get(i)).equals(normalizedToken))
				return OptionalInt.of(i);

		return OptionalInt.empty();
	}

	@NonNull
	private static String normalize(@NonNull String token) {
		return token.toLowerCase(Locale.ROOT);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{tokens=%s}", getClass().getSimpleName(), this.tokens);
	}
}
