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

package com.sqlgate.html;

import com.sqlgate.ErrorKind;
import com.sqlgate.FetchMode;
import com.sqlgate.GateException;
import com.sqlgate.QueryResult;
import com.sqlgate.Row;
import com.sqlgate.StatementGate;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Renders the result of a gated statement as an HTML table, optionally one page at a time.
 * <p>
 * Statements run through {@link StatementGate#executeForResult(String, List, FetchMode)}, so the gate's blacklist
 * applies. Labels, values and links are HTML-escaped.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class HtmlTableRenderer {
	@NonNull
	static final String TABLE_CLASS = "SqlGateTable";
	@NonNull
	static final String PAGINATION_CLASS = "SqlGatePagination";

	@NonNull
	private static final String BACKGROUND_COLOR = "#CCC";
	@NonNull
	private static final String ODD_ROW_COLOR = "#F9F9F9";
	@NonNull
	private static final String EVEN_ROW_COLOR = "#F0F0F0";
	@NonNull
	private static final String HEADER_COLOR = "#9C9C9C";
	@NonNull
	private static final Pattern DIGITS_PATTERN = Pattern.compile("\\d+");

	@NonNull
	private final StatementGate statementGate;
	private boolean useDefaultStyles;

	public HtmlTableRenderer(@NonNull StatementGate statementGate) {
		requireNonNull(statementGate);

		this.statementGate = statementGate;
		this.useDefaultStyles = true;
	}

	/**
	 * Renders every row {@code statement} produces.
	 *
	 * @param statement the SQL statement
	 * @return the HTML table
	 */
	@NonNull
	public String render(@NonNull String statement) {
		requireNonNull(statement);

		QueryResult queryResult = getStatementGate().executeForResult(statement, List.of(), FetchMode.NUMERIC);
		return renderTable(queryResult);
	}

	/**
	 * Renders the page of rows {@code pageRequest} asks for, followed by pagination links if there is more than one
	 * page.
	 * <p>
	 * The statement is run once to count rows, then again with {@code LIMIT} and {@code OFFSET} appended. A page number
	 * beyond the last page shows the last page.
	 *
	 * @param statement   the SQL statement, which must not contain its own {@code LIMIT} or {@code OFFSET}
	 * @param pageRequest which page to show
	 * @return the HTML table and pagination links
	 * @throws GateException with {@link ErrorKind#INVALID_PAGINATION} if the statement contains {@code LIMIT} or
	 *                       {@code OFFSET}, or the requested page is not a positive number
	 */
	@NonNull
	public String render(@NonNull String statement,
											 @NonNull PageRequest pageRequest) {
		requireNonNull(statement);
		requireNonNull(pageRequest);

		String upperCaseStatement = statement.toUpperCase(Locale.ROOT);

		if (upperCaseStatement.contains("LIMIT") || upperCaseStatement.contains("OFFSET"))
			throw new GateException(ErrorKind.INVALID_PAGINATION,
					"Your paginated statement cannot have a LIMIT or OFFSET clause.");

		int requestedPage = parsePage(pageRequest.getPageValue().orElse(null));
		int rowsPerPage = pageRequest.getRowsPerPage();

		long totalRows = getStatementGate().executeForResult(statement, List.of(), FetchMode.NUMERIC).getRowCount();
		int totalPages = (int) ((totalRows + rowsPerPage - 1) / rowsPerPage);
		int page = Math.max(1, Math.min(requestedPage, totalPages));
		long offset = (long) rowsPerPage * (page - 1);

		QueryResult queryResult = getStatementGate().executeForResult(
				format("%s LIMIT %d OFFSET %d", statement, rowsPerPage, offset), List.of(), FetchMode.NUMERIC);

		StringBuilder html = new StringBuilder(renderTable(queryResult));

		if (totalPages > 1)
			html.append(renderPagination(pageRequest, page, totalPages));

		return html.toString();
	}

	@NonNull
	protected String renderTable(@NonNull QueryResult queryResult) {
		requireNonNull(queryResult);

		StringBuilder html = new StringBuilder();

		html.append(format("<table class=\"%s\"%s>\n", TABLE_CLASS,
				style(format("width:100%%; background-color:%s; text-align:center", BACKGROUND_COLOR))));
		html.append(format("<tr class=\"headerRow\"%s>\n", style(format("padding:3px 12px; background-color:%s", HEADER_COLOR))));

		List<String> columnLabels = queryResult.getColumnLabels();

		for (int i = 0; i < columnLabels.size(); ++i)
			html.append(format("<th class=\"col%d\">%s</th>\n", i + 1, escapeHtml(columnLabels.get(i))));

		html.append("</tr>\n");

		int rowNumber = 1;

		for (Row row : queryResult.getRows()) {
			boolean odd = rowNumber % 2 == 1;

			html.append(format("<tr class=\"row%d %s\"%s>\n", rowNumber, odd ? "oddRow" : "evenRow",
					style(format("padding:3px 12px; background-color:%s;", odd ? ODD_ROW_COLOR : EVEN_ROW_COLOR))));

			List<@Nullable Object> values = row.asList();

			for (int i = 0; i < values.size(); ++i) {
				Object value = values.get(i);
				html.append(format("<td class=\"col%d\">%s</td>\n", i + 1, value == null ? "" : escapeHtml(value.toString())));
			}

			html.append("</tr>\n");
			++rowNumber;
		}

		html.append("</table>");

		return html.toString();
	}

	@NonNull
	protected String renderPagination(@NonNull PageRequest pageRequest,
																		int page,
																		int totalPages) {
		requireNonNull(pageRequest);

		StringBuilder html = new StringBuilder();

		html.append(format("\n<p class=\"%s\">\n", PAGINATION_CLASS));
		html.append(page > 1 ? link(pageRequest, page - 1, "&lt;") : "&lt;").append("\n");

		for (int i = 1; i <= totalPages; ++i)
			html.append(i == page ? String.valueOf(i) : link(pageRequest, i, String.valueOf(i))).append("\n");

		html.append(page < totalPages ? link(pageRequest, page + 1, "&gt;") : "&gt;").append("\n");
		html.append("</p>\n");

		return html.toString();
	}

	@NonNull
	protected String link(@NonNull PageRequest pageRequest,
												int page,
												@NonNull String text) {
		requireNonNull(pageRequest);
		requireNonNull(text);

		String href = updateQueryString(pageRequest.getRequestUri(), pageRequest.getQueryParameterName(), page);
		return format("<a href=\"%s\">%s</a>", escapeHtml(href), text);
	}

	/**
	 * Points {@code requestUri} at {@code page}: an existing {@code name=value} parameter is replaced, otherwise one is
	 * appended.
	 */
	@NonNull
	static String updateQueryString(@NonNull String requestUri,
																	@NonNull String queryParameterName,
																	int page) {
		requireNonNull(requestUri);
		requireNonNull(queryParameterName);

		Pattern parameterPattern = Pattern.compile(format("([?&])%s=[^&#]*", Pattern.quote(queryParameterName)));
		Matcher matcher = parameterPattern.matcher(requestUri);

		if (matcher.find())
			return matcher.replaceAll("$1" + Matcher.quoteReplacement(format("%s=%d", queryParameterName, page)));

		String separator;

		if (!requestUri.contains("?"))
			separator = "?";
		else if (requestUri.endsWith("?") || requestUri.endsWith("&"))
			separator = "";
		else
			separator = "&";

		return format("%s%s%s=%d", requestUri, separator, queryParameterName, page);
	}

	/**
	 * Parses the raw page value: absent means page 1; anything other than a positive whole number is rejected.
	 */
	static int parsePage(@Nullable String pageValue) {
		if (pageValue == null)
			return 1;

		String trimmedPageValue = pageValue.trim();

		if (!DIGITS_PATTERN.matcher(trimmedPageValue).matches())
			throw new GateException(ErrorKind.INVALID_PAGINATION, "The requested page must be a positive number.");

		int page;

		try {
			page = Integer.parseInt(trimmedPageValue);
		} catch (NumberFormatException e) {
			throw new GateException(ErrorKind.INVALID_PAGINATION, "The requested page must be a positive number.");
		}

		if (page < 1)
			throw new GateException(ErrorKind.INVALID_PAGINATION, "The requested page must be a positive number.");

		return page;
	}

	@NonNull
	static String escapeHtml(@NonNull String string) {
		requireNonNull(string);

		StringBuilder escaped = new StringBuilder(string.length());

		for (int i = 0; i < string.length(); ++i) {
			char c = string.charAt(i);

			switch (c) {
				case '&':
					escaped.append("&amp;");
					break;
				case '<':
					escaped.append("&lt;");
					break;
				case '>':
					escaped.append("&gt;");
					break;
				case '"':
					escaped.append("&quot;");
					break;
				case '\'':
					escaped.append("&#39;");
					break;
				default:
					escaped.append(c);
			}
		}

		return escaped.toString();
	}

	@NonNull
	private String style(@NonNull String css) {
		requireNonNull(css);
		return isUseDefaultStyles() ? format(" style=\"%s\"", css) : "";
	}

	/**
	 * @param useDefaultStyles whether to emit inline default styles (on by default)
	 * @return this renderer, for chaining
	 */
	@NonNull
	public HtmlTableRenderer useDefaultStyles(boolean useDefaultStyles) {
		this.useDefaultStyles = useDefaultStyles;
		return this;
	}

	public boolean isUseDefaultStyles() {
		return this.useDefaultStyles;
	}

	@NonNull
	protected StatementGate getStatementGate() {
		return this.statementGate;
	}
}
