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

import static java.util.Objects.requireNonNull;

/**
 * Classifies every failure a {@link StatementGate} can report.
 * <p>
 * Each kind carries a small, stable numeric code which is exposed via {@link GateException#getCode()}.
 *
 * @since 1.0.0
 */
public enum ErrorKind {
	/**
	 * The driver rejected the connection parameters, or the connection could not be closed cleanly.
	 */
	CONNECTION_FAILED(1, "Unable to connect to the database."),
	/**
	 * The statement contains a forbidden token outside of string literals.
	 */
	BLACKLISTED_CLAUSE(2, "Your query statement contains a blacklisted clause."),
	/**
	 * A column name is not present in an active column whitelist.
	 */
	COLUMN_PERMISSION_DENIED(3, "You do not have permission to query one of the columns in your statement."),
	/**
	 * A table name is not present in an active table whitelist.
	 */
	TABLE_PERMISSION_DENIED(4, "You do not have permission to query one of the tables in your statement."),
	/**
	 * The driver rejected the statement during prepare, bind, execute or fetch.
	 */
	QUERY_EXECUTION_FAILED(5, "Unable to execute your query statement."),
	/**
	 * Pagination parameters supplied to the HTML renderer are unusable.
	 */
	INVALID_PAGINATION(6, "Your pagination parameters are invalid."),
	/**
	 * An operation was attempted after the gate was closed.
	 */
	CONNECTION_CLOSED(7, "The database connection has been closed.");

	private final int code;
	@NonNull
	private final String defaultMessage;

	ErrorKind(int code,
						@NonNull String defaultMessage) {
		requireNonNull(defaultMessage);

		this.code = code;
		this.defaultMessage = defaultMessage;
	}

	public int getCode() {
		return this.code;
	}

	/**
	 * The generic, non-revealing message used when no more specific (and safe) message is available.
	 *
	 * @return the default message for this kind
	 */
	@NonNull
	public String getDefaultMessage() {
		return this.defaultMessage;
	}
}
