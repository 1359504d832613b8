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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The single classified error type thrown by {@link StatementGate} and its collaborators.
 * <p>
 * Every instance carries an {@link ErrorKind} and its numeric code. Messages are safe to show to end users
 * unless the gate was configured with {@link ErrorDetail#VERBOSE}, and {@link #toString()} never includes a stack trace.
 * <p>
 * If the {@code cause} of this exception is a {@link SQLException}, {@link #getSqlState()} is shorthand for
 * the corresponding {@link SQLException} value. In {@link ErrorDetail#SANITIZED} mode the driver exception is not
 * attached as a cause, but its SQLState is still recorded.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class GateException extends RuntimeException {
	@Nonnull
	private final ErrorKind errorKind;
	@Nullable
	private final String sqlState;

	/**
	 * Creates a {@code GateException} of the given kind with that kind's default message.
	 *
	 * @param errorKind the classification of this exception
	 */
	public GateException(@Nonnull ErrorKind errorKind) {
		this(errorKind, requireNonNull(errorKind).getDefaultMessage());
	}

	/**
	 * Creates a {@code GateException} of the given kind with the given {@code message}.
	 *
	 * @param errorKind the classification of this exception
	 * @param message   a message describing this exception
	 */
	public GateException(@Nonnull ErrorKind errorKind,
											 @Nonnull String message) {
		this(errorKind, message, null, null);
	}

	/**
	 * Creates a {@code GateException} which wraps the given {@code cause}.
	 *
	 * @param errorKind the classification of this exception
	 * @param message   a message describing this exception
	 * @param cause     the cause of this exception
	 */
	public GateException(@Nonnull ErrorKind errorKind,
											 @Nonnull String message,
											 @Nullable Throwable cause) {
		this(errorKind, message, cause, cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null);
	}

	GateException(@Nonnull ErrorKind errorKind,
								@Nonnull String message,
								@Nullable Throwable cause,
								@Nullable String sqlState) {
		super(requireNonNull(message), cause);
		requireNonNull(errorKind);

		this.errorKind = errorKind;
		this.sqlState = sqlState;
	}

	@Override
	@Nonnull
	public String toString() {
		if (getSqlState().isPresent())
			return format("%s: [%d]: %s (sqlState=%s)", getClass().getName(), getCode(), getMessage(), getSqlState().get());

		return format("%s: [%d]: %s", getClass().getName(), getCode(), getMessage());
	}

	@Nonnull
	public ErrorKind getErrorKind() {
		return this.errorKind;
	}

	/**
	 * @return the numeric code of this exception's {@link ErrorKind}
	 */
	public int getCode() {
		return getErrorKind().getCode();
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@Nonnull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}
}
