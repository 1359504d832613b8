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

import java.time.Duration;
import java.util.List;

/**
 * @since 1.0.0
 */
public class DefaultStatementLoggerTests {
	@Test
	public void testFormatSuccessfulStatement() {
		StatementLog statementLog = StatementLog.withSql("SELECT * FROM t WHERE a = :ln AND b = ?")
				.binds(List.of(Bind.of("ln", "Doe"), Bind.of(1, 5), Bind.of(2, null)))
				.preparationDuration(Duration.ofMillis(1))
				.executionDuration(Duration.ofMillis(2))
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);

		Assertions.assertEquals("SELECT * FROM t WHERE a = :ln AND b = ?\n"
				+ "Parameters: :ln='Doe', #1=5, #2=null\n"
				+ "PT0.001S preparing statement, PT0.002S executing statement", formatted);
	}

	@Test
	public void testFormatRejectedAndFailedStatements() {
		GateException rejection = new GateException(ErrorKind.BLACKLISTED_CLAUSE);
		DefaultStatementLogger statementLogger = new DefaultStatementLogger();

		String rejected = statementLogger.formatStatementLog(StatementLog.withSql("DROP TABLE t")
				.exception(rejection)
				.rejected(true)
				.build());
		String failed = statementLogger.formatStatementLog(StatementLog.withSql("SELECT * FROM t")
				.exception(new IllegalStateException("bad"))
				.build());

		Assertions.assertEquals("DROP TABLE t\nRejected due to " + rejection, rejected);
		Assertions.assertEquals("SELECT * FROM t\nFailed due to java.lang.IllegalStateException: bad", failed);
	}

	@Test
	public void testLongParametersAreEllipsized() {
		String longValue = "x".repeat(DefaultStatementLogger.MAXIMUM_PARAMETER_LOGGING_LENGTH + 20);
		String formatted = new DefaultStatementLogger().formatStatementLog(StatementLog.withSql("SELECT :v")
				.binds(List.of(Bind.of("v", longValue)))
				.build());

		String expectedValue = "x".repeat(DefaultStatementLogger.MAXIMUM_PARAMETER_LOGGING_LENGTH) + "...";
		Assertions.assertEquals("SELECT :v\nParameters: :v='" + expectedValue + "'", formatted);
	}

	@Test
	public void testTotalDurationSumsPhases() {
		StatementLog statementLog = StatementLog.withSql("SELECT 1")
				.preparationDuration(Duration.ofMillis(1))
				.executionDuration(Duration.ofMillis(2))
				.fetchDuration(Duration.ofMillis(3))
				.build();

		Assertions.assertEquals(Duration.ofMillis(6), statementLog.getTotalDuration());
		Assertions.assertFalse(statementLog.isRejected());
	}
}
