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
import java.io.PrintStream;
import java.sql.SQLException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps connection, driver and check failures into {@link GateException}s.
 * <p>
 * With {@link ErrorDetail#SANITIZED} (the default) driver messages never reach the exception message and the driver
 * exception is not attached as a cause, so that printing or serializing a {@link GateException} cannot leak schema or
 * driver internals. The driver exception remains available to operators through {@link StatementLogger}.
 * <p>
 * This class also owns the process-wide "echo uncaught errors" toggle consulted by
 * {@link #uncaughtExceptionHandler(PrintStream)}. The library never installs that handler itself; hosts opt in.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ErrorReporter {
	@NonNull
	static final String UNCAUGHT_ERROR_PREFIX = "[Uncaught SqlGate Error]: ";
	@NonNull
	static final String UNCAUGHT_ERROR_NOTICE = "To see uncaught errors, call ErrorReporter.setEchoUncaughtErrors(true).";

	private static volatile boolean echoUncaughtErrors = false;

	@NonNull
	private final ErrorDetail errorDetail;

	public ErrorReporter(@NonNull ErrorDetail errorDetail) {
		requireNonNull(errorDetail);
		this.errorDetail = errorDetail;
	}

	@NonNull
	public static ErrorReporter withDefaultConfiguration() {
		return new ErrorReporter(ErrorDetail.SANITIZED);
	}

	@NonNull
	public GateException connectionFailed(@NonNull Exception cause) {
		requireNonNull(cause);
		return fromDriverFailure(ErrorKind.CONNECTION_FAILED, cause);
	}

	@NonNull
	public GateException queryExecutionFailed(@NonNull Exception cause) {
		requireNonNull(cause);

		if (cause instanceof GateException gateException)
			return gateException;

		return fromDriverFailure(ErrorKind.QUERY_EXECUTION_FAILED, cause);
	}

	@NonNull
	public GateException connectionClosed() {
		return new GateException(ErrorKind.CONNECTION_CLOSED);
	}

	@NonNull
	private GateException fromDriverFailure(@NonNull ErrorKind errorKind,
																					@NonNull Exception cause) {
		requireNonNull(errorKind);
		requireNonNull(cause);

		String sqlState = cause instanceof SQLException sqlException ? sqlException.getSQLState() : null;

		if (getErrorDetail() == ErrorDetail.VERBOSE) {
			String detail = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
			return new GateException(errorKind, format("%s Driver said: %s", errorKind.getDefaultMessage(), detail), cause, sqlState);
		}

		return new GateException(errorKind, errorKind.getDefaultMessage(), null, sqlState);
	}

	/**
	 * Produces the line printed for an uncaught throwable, honoring {@link #isEchoUncaughtErrors()}.
	 *
	 * @param throwable the uncaught throwable
	 * @return the line to print
	 */
	@NonNull
	public static String describeUncaught(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		if (!isEchoUncaughtErrors())
			return UNCAUGHT_ERROR_PREFIX + UNCAUGHT_ERROR_NOTICE;

		String message = throwable instanceof GateException ? throwable.toString() : throwable.getMessage();
		return UNCAUGHT_ERROR_PREFIX + (message == null ? throwable.getClass().getName() : message);
	}

	/**
	 * Provides a handler the host application may install, e.g. via {@link Thread#setDefaultUncaughtExceptionHandler}.
	 * <p>
	 * Classified errors are described per {@link #describeUncaught(Throwable)}. Other throwables are delegated to
	 * {@code fallback} if one is given, and otherwise described the same way.
	 *
	 * @param out      where to print
	 * @param fallback handler for throwables which are not {@link GateException}s, if any
	 * @return an uncaught exception handler
	 */
	public static Thread.@NonNull UncaughtExceptionHandler uncaughtExceptionHandler(@NonNull PrintStream out,
																																				 Thread.@Nullable UncaughtExceptionHandler fallback) {
		requireNonNull(out);

		return (thread, throwable) -> {
			if (!(throwable instanceof GateException) && fallback != null) {
				fallback.uncaughtException(thread, throwable);
				return;
			}

			out.println(describeUncaught(throwable));
		};
	}

	public static Thread.@NonNull UncaughtExceptionHandler uncaughtExceptionHandler(@NonNull PrintStream out) {
		requireNonNull(out);
		return uncaughtExceptionHandler(out, null);
	}

	public static boolean isEchoUncaughtErrors() {
		return echoUncaughtErrors;
	}

	public static void setEchoUncaughtErrors(boolean echoUncaughtErrors) {
		ErrorReporter.echoUncaughtErrors = echoUncaughtErrors;
	}

	@NonNull
	public ErrorDetail getErrorDetail() {
		return this.errorDetail;
	}
}
