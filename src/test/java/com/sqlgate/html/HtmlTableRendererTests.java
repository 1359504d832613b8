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

import com.sqlgate.Bind;
import com.sqlgate.ErrorKind;
import com.sqlgate.GateException;
import com.sqlgate.JdbcUrls;
import com.sqlgate.StatementGate;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class HtmlTableRendererTests {
	@Test
	public void testRenderTable() {
		try (StatementGate gate = createPeopleGate("html_render_table")) {
			String html = new HtmlTableRenderer(gate).useDefaultStyles(false)
					.render("SELECT first_name, last_name FROM people ORDER BY first_name");

			Assertions.assertEquals("<table class=\"SqlGateTable\">\n"
					+ "<tr class=\"headerRow\">\n"
					+ "<th class=\"col1\">FIRST_NAME</th>\n"
					+ "<th class=\"col2\">LAST_NAME</th>\n"
					+ "</tr>\n"
					+ "<tr class=\"row1 oddRow\">\n"
					+ "<td class=\"col1\">Jane</td>\n"
					+ "<td class=\"col2\">Doe</td>\n"
					+ "</tr>\n"
					+ "<tr class=\"row2 evenRow\">\n"
					+ "<td class=\"col1\">John</td>\n"
					+ "<td class=\"col2\">Doe</td>\n"
					+ "</tr>\n"
					+ "<tr class=\"row3 oddRow\">\n"
					+ "<td class=\"col1\">Max</td>\n"
					+ "<td class=\"col2\"></td>\n"
					+ "</tr>\n"
					+ "</table>", html);
		}
	}

	@Test
	public void testDefaultStyles() {
		try (StatementGate gate = createPeopleGate("html_default_styles")) {
			String html = new HtmlTableRenderer(gate).render("SELECT first_name FROM people");

			Assertions.assertTrue(html.startsWith("<table class=\"SqlGateTable\" style=\"width:100%; background-color:#CCC; text-align:center\">"),
					"Table should carry default inline styles");
			Assertions.assertTrue(html.contains("background-color:#F0F0F0;"), "Even rows should be shaded");
		}
	}

	@Test
	public void testValuesAreEscaped() {
		try (StatementGate gate = createPeopleGate("html_escaping")) {
			gate.executeUpdate("INSERT INTO people VALUES (:fn, 'x')",
					List.of(Bind.of("fn", "<script>alert(\"hi\")</script>")));

			String html = new HtmlTableRenderer(gate).useDefaultStyles(false)
					.render("SELECT first_name FROM people WHERE last_name = 'x'");

			Assertions.assertTrue(html.contains("&lt;script&gt;alert(&quot;hi&quot;)&lt;/script&gt;"), "Markup should be escaped");
			Assertions.assertFalse(html.contains("<script>"));
		}
	}

	@Test
	public void testPaginatedRender() {
		try (StatementGate gate = createPeopleGate("html_paginated")) {
			PageRequest pageRequest = PageRequest.withRowsPerPage(2, "/people?sort=last&pg=1").pageValue("2").build();

			String html = new HtmlTableRenderer(gate).useDefaultStyles(false)
					.render("SELECT first_name FROM people ORDER BY first_name", pageRequest);

			Assertions.assertTrue(html.contains("<td class=\"col1\">Max</td>"), "Second page should show the third row");
			Assertions.assertFalse(html.contains("Jane"), "First page rows should not be shown");
			Assertions.assertTrue(html.endsWith("\n<p class=\"SqlGatePagination\">\n"
					+ "<a href=\"/people?sort=last&amp;pg=1\">&lt;</a>\n"
					+ "<a href=\"/people?sort=last&amp;pg=1\">1</a>\n"
					+ "2\n"
					+ "&gt;\n"
					+ "</p>\n"), "Wrong pagination links");
		}
	}

	@Test
	public void testSinglePageHasNoPagination() {
		try (StatementGate gate = createPeopleGate("html_single_page")) {
			PageRequest pageRequest = PageRequest.withRowsPerPage(10, "/people").build();
			String html = new HtmlTableRenderer(gate).render("SELECT first_name FROM people", pageRequest);

			Assertions.assertFalse(html.contains(HtmlTableRenderer.PAGINATION_CLASS));
		}
	}

	@Test
	public void testPageBeyondLastIsClamped() {
		try (StatementGate gate = createPeopleGate("html_clamped_page")) {
			PageRequest pageRequest = PageRequest.withRowsPerPage(2, "/people").pageValue("99").build();
			String html = new HtmlTableRenderer(gate).useDefaultStyles(false)
					.render("SELECT first_name FROM people ORDER BY first_name", pageRequest);

			Assertions.assertTrue(html.contains("Max"), "Should show the last page");
			Assertions.assertTrue(html.contains("<a href=\"/people?pg=1\">&lt;</a>"));
		}
	}

	@Test
	public void testEmptyResultShowsFirstPage() {
		try (StatementGate gate = createPeopleGate("html_empty_result")) {
			PageRequest pageRequest = PageRequest.withRowsPerPage(2, "/people").pageValue("3").build();
			String html = new HtmlTableRenderer(gate).render("SELECT first_name FROM people WHERE 1 = 0", pageRequest);

			Assertions.assertTrue(html.endsWith("</table>"), "Empty result should render a header-only table");
		}
	}

	@Test
	public void testStatementWithLimitRejected() {
		try (StatementGate gate = createPeopleGate("html_limit_rejected")) {
			HtmlTableRenderer renderer = new HtmlTableRenderer(gate);
			PageRequest pageRequest = PageRequest.withRowsPerPage(2, "/people").build();

			GateException e = Assertions.assertThrows(GateException.class,
					() -> renderer.render("SELECT first_name FROM people limit 5", pageRequest));
			Assertions.assertEquals(ErrorKind.INVALID_PAGINATION, e.getErrorKind());

			e = Assertions.assertThrows(GateException.class,
					() -> renderer.render("SELECT first_name FROM people OFFSET 1 ROWS", pageRequest));
			Assertions.assertEquals(ErrorKind.INVALID_PAGINATION, e.getErrorKind());
		}
	}

	@Test
	public void testInvalidPageValues() {
		for (String pageValue : new String[]{"0", "-1", "abc", "1.5", "", "99999999999"}) {
			GateException e = Assertions.assertThrows(GateException.class, () -> HtmlTableRenderer.parsePage(pageValue),
					"Page value '" + pageValue + "' should be rejected");
			Assertions.assertEquals(ErrorKind.INVALID_PAGINATION, e.getErrorKind());
		}

		Assertions.assertEquals(1, HtmlTableRenderer.parsePage(null));
		Assertions.assertEquals(4, HtmlTableRenderer.parsePage(" 4 "));
	}

	@Test
	public void testUpdateQueryString() {
		Assertions.assertEquals("/people?pg=3", HtmlTableRenderer.updateQueryString("/people", "pg", 3));
		Assertions.assertEquals("/people?pg=3", HtmlTableRenderer.updateQueryString("/people?", "pg", 3));
		Assertions.assertEquals("/people?sort=last&pg=3", HtmlTableRenderer.updateQueryString("/people?sort=last", "pg", 3));
		Assertions.assertEquals("/people?pg=3&sort=last", HtmlTableRenderer.updateQueryString("/people?pg=1&sort=last", "pg", 3));
		Assertions.assertEquals("/people?xpg=7&pg=3", HtmlTableRenderer.updateQueryString("/people?xpg=7", "pg", 3),
				"Only the exact parameter should be replaced");
	}

	@Test
	public void testPageRequestValidation() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> PageRequest.withRowsPerPage(0, "/people").build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> PageRequest.withRowsPerPage(5, "/people").queryParameterName(" ").build());
		Assertions.assertEquals(PageRequest.DEFAULT_QUERY_PARAMETER_NAME, PageRequest.withRowsPerPage(5, "/people").build().getQueryParameterName());
	}

	@NonNull
	private StatementGate createPeopleGate(@NonNull String databaseName) {
		requireNonNull(databaseName);

		StatementGate gate = StatementGate.withUrl(JdbcUrls.hsqldbMemory(databaseName))
				.user("sa")
				.password("")
				.build();

		gate.executeUpdate("CREATE TABLE people (first_name VARCHAR(255), last_name VARCHAR(255))");
		gate.executeUpdate("INSERT INTO people VALUES ('John', 'Doe')");
		gate.executeUpdate("INSERT INTO people VALUES ('Jane', 'Doe')");
		gate.executeUpdate("INSERT INTO people (first_name) VALUES ('Max')");

		return gate;
	}
}
