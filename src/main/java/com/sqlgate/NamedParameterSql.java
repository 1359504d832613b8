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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text with its {@code :name} placeholders rewritten to JDBC {@code ?} placeholders.
 * <p>
 * Quoted text (single, double, backtick, bracket and dollar quoting) and comments are skipped, and the Postgres cast
 * operator {@code ::} is not treated as a placeholder. A statement may use named placeholders or positional {@code ?}
 * placeholders, but not both.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class NamedParameterSql {
	@NonNull
	private final String sql;
	@NonNull
	private final String jdbcSql;
	@NonNull
	private final List<String> parameterNames;
	private final int parameterCount;

	private NamedParameterSql(@NonNull String sql,
														@NonNull String jdbcSql,
														@NonNull List<String> parameterNames,
														int parameterCount) {
		requireNonNull(sql);
		requireNonNull(jdbcSql);
		requireNonNull(parameterNames);

		this.sql = sql;
		this.jdbcSql = jdbcSql;
		this.parameterNames = parameterNames;
		this.parameterCount = parameterCount;
	}

	/**
	 * Parses {@code sql}.
	 *
	 * @param sql SQL text which may contain {@code :name} or {@code ?} placeholders
	 * @return the parsed SQL
	 * @throws IllegalArgumentException if named and positional placeholders are mixed
	 */
	@NonNull
	public static NamedParameterSql parse(@NonNull String sql) {
		requireNonNull(sql);

		StringBuilder jdbcSql = new StringBuilder(sql.length());
		List<String> parameterNames = new ArrayList<>();
		int positionalParameterCount = 0;

		boolean inSingleQuote = false;
		boolean inSingleQuoteEscapesBackslash = false;
		boolean inDoubleQuote = false;
		boolean inBacktickQuote = false;
		boolean inBracketQuote = false;
		boolean inLineComment = false;
		boolean inBlockComment = false;
		String dollarQuoteDelimiter = null;

		for (int i = 0; i < sql.length(); ) {
			if (dollarQuoteDelimiter != null) {
				if (sql.startsWith(dollarQuoteDelimiter, i)) {
					jdbcSql.append(dollarQuoteDelimiter);
					i += dollarQuoteDelimiter.length();
					dollarQuoteDelimiter = null;
				} else {
					jdbcSql.append(sql.charAt(i));
					++i;
				}

				continue;
			}

			char c = sql.charAt(i);

			if (inLineComment) {
				jdbcSql.append(c);
				++i;

				if (c == '\n' || c == '\r')
					inLineComment = false;

				continue;
			}

			if (inBlockComment) {
				jdbcSql.append(c);

				if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
					jdbcSql.append('/');
					i += 2;
					inBlockComment = false;
				} else {
					++i;
				}

				continue;
			}

			if (inSingleQuote) {
				jdbcSql.append(c);

				if (inSingleQuoteEscapesBackslash && c == '\\' && i + 1 < sql.length()) {
					jdbcSql.append(sql.charAt(i + 1));
					i += 2;
					continue;
				}

				if (c == '\'') {
					// Escaped quote: ''
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
						jdbcSql.append('\'');
						i += 2;
						continue;
					}

					inSingleQuote = false;
					inSingleQuoteEscapesBackslash = false;
				}

				++i;
				continue;
			}

			if (inDoubleQuote) {
				jdbcSql.append(c);

				if (c == '"') {
					// Escaped quote: ""
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
						jdbcSql.append('"');
						i += 2;
						continue;
					}

					inDoubleQuote = false;
				}

				++i;
				continue;
			}

			if (inBacktickQuote) {
				jdbcSql.append(c);

				if (c == '`')
					inBacktickQuote = false;

				++i;
				continue;
			}

			if (inBracketQuote) {
				jdbcSql.append(c);

				if (c == ']')
					inBracketQuote = false;

				++i;
				continue;
			}

			// Not inside string/comment
			if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
				jdbcSql.append("--");
				i += 2;
				inLineComment = true;
				continue;
			}

			if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
				jdbcSql.append("/*");
				i += 2;
				inBlockComment = true;
				continue;
			}

			if ((c == 'E' || c == 'e') && i + 1 < sql.length() && sql.charAt(i + 1) == '\''
					&& (i == 0 || !Character.isJavaIdentifierPart(sql.charAt(i - 1)))) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				jdbcSql.append(c).append('\'');
				i += 2;
				continue;
			}

			if (c == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '"') {
				inDoubleQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '`') {
				inBacktickQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '[') {
				inBracketQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '$') {
				String delimiter = parseDollarQuoteDelimiter(sql, i);

				if (delimiter != null) {
					jdbcSql.append(delimiter);
					i += delimiter.length();
					dollarQuoteDelimiter = delimiter;
					continue;
				}
			}

			if (c == '?') {
				++positionalParameterCount;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == ':' && i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
				// Postgres type-cast operator (::), do not treat second ':' as a parameter prefix.
				jdbcSql.append("::");
				i += 2;
				continue;
			}

			if (c == ':' && i + 1 < sql.length() && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
				int nameStartIndex = i + 1;
				int nameEndIndex = nameStartIndex + 1;

				while (nameEndIndex < sql.length() && Character.isJavaIdentifierPart(sql.charAt(nameEndIndex)))
					++nameEndIndex;

				parameterNames.add(sql.substring(nameStartIndex, nameEndIndex));
				jdbcSql.append('?');
				i = nameEndIndex;
				continue;
			}

			jdbcSql.append(c);
			++i;
		}

		if (positionalParameterCount > 0 && parameterNames.size() > 0)
			throw new IllegalArgumentException(format("Named (':name') and positional ('?') parameters cannot be mixed in the same statement. SQL: %s", sql));

		int parameterCount = parameterNames.size() > 0 ? parameterNames.size() : positionalParameterCount;

		return new NamedParameterSql(sql, jdbcSql.toString(), List.copyOf(parameterNames), parameterCount);
	}

	@Nullable
	private static String parseDollarQuoteDelimiter(@NonNull String sql,
																									int startIndex) {
		requireNonNull(sql);

		if (startIndex < 0 || startIndex >= sql.length())
			return null;

		if (sql.charAt(startIndex) != '$')
			return null;

		int i = startIndex + 1;

		while (i < sql.length()) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(startIndex, i + 1);

			if (!Character.isJavaIdentifierPart(c))
				return null;

			++i;
		}

		return null;
	}

	/**
	 * @param name the parameter name, with or without its leading colon
	 * @return the 1-based JDBC positions the name occupies, in order; empty if the name does not occur
	 */
	@NonNull
	public List<Integer> positionsOf(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = name.startsWith(":") ? name.substring(1) : name;
		List<Integer> positions = new ArrayList<>();

		for (int i = 0; i < this.parameterNames.size(); ++i)
			if (this.parameterNames.get(i).equals(normalizedName))
				positions.add(i + 1);

		return positions;
	}

	public boolean hasNamedParameters() {
		return this.parameterNames.size() > 0;
	}

	/**
	 * @return the SQL as originally supplied
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * @return the SQL with every named placeholder replaced by {@code ?}
	 */
	@NonNull
	public String getJdbcSql() {
		return this.jdbcSql;
	}

	/**
	 * @return placeholder names in order of occurrence (one entry per occurrence); empty for positional SQL
	 */
	@NonNull
	public List<String> getParameterNames() {
		return this.parameterNames;
	}

	public int getParameterCount() {
		return this.parameterCount;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof NamedParameterSql))
			return false;

		return Objects.equals(((NamedParameterSql) object).getSql(), getSql());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{jdbcSql=%s, parameterNames=%s}", getClass().getSimpleName(), getJdbcSql(), getParameterNames());
	}
}
