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
import javax.annotation.concurrent.ThreadSafe;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLType;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ParameterBinder}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultParameterBinder implements ParameterBinder {
	@Override
	public void bindParameter(@Nonnull PreparedStatement preparedStatement,
														int parameterIndex,
														@Nullable Object value,
														@Nullable SQLType sqlType) throws SQLException {
		requireNonNull(preparedStatement);

		if (value == null) {
			bindNull(preparedStatement, parameterIndex, sqlType);
			return;
		}

		Object normalizedValue = normalizeParameter(value);

		if (sqlType != null) {
			if (trySetObject(preparedStatement, parameterIndex, normalizedValue, sqlType))
				return;

			// Drivers which predate JDBC 4.2 only understand the vendor type number
			Integer vendorTypeNumber = sqlType.getVendorTypeNumber();

			if (vendorTypeNumber != null) {
				preparedStatement.setObject(parameterIndex, normalizedValue, vendorTypeNumber);
				return;
			}
		}

		if (normalizedValue instanceof LocalDate localDate) {
			if (!trySetObject(preparedStatement, parameterIndex, localDate, Types.DATE))
				preparedStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate)); // fallback

			return;
		}

		if (normalizedValue instanceof LocalTime localTime) {
			// Some drivers used to offset LocalTime; safest is a tz-free string.
			preparedStatement.setString(parameterIndex, localTime.toString());
			return;
		}

		if (normalizedValue instanceof LocalDateTime localDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime)); // fallback

			return;
		}

		if (normalizedValue instanceof Instant instant) {
			preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(instant));
			return;
		}

		// Everything else
		preparedStatement.setObject(parameterIndex, normalizedValue);
	}

	protected void bindNull(@Nonnull PreparedStatement preparedStatement,
													int parameterIndex,
													@Nullable SQLType sqlType) throws SQLException {
		requireNonNull(preparedStatement);

		if (sqlType != null && sqlType.getVendorTypeNumber() != null) {
			preparedStatement.setNull(parameterIndex, sqlType.getVendorTypeNumber());
			return;
		}

		Optional<Integer> parameterSqlType = determineParameterSqlType(preparedStatement, parameterIndex);
		preparedStatement.setNull(parameterIndex, parameterSqlType.orElse(Types.NULL));
	}

	protected boolean trySetObject(@Nonnull PreparedStatement preparedStatement,
																 int parameterIndex,
																 @Nullable Object value,
																 @Nonnull SQLType sqlType) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(sqlType);

		try {
			preparedStatement.setObject(parameterIndex, value, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	protected boolean trySetObject(@Nonnull PreparedStatement preparedStatement,
																 int parameterIndex,
																 @Nullable Object value,
																 int sqlType) throws SQLException {
		requireNonNull(preparedStatement);

		try {
			preparedStatement.setObject(parameterIndex, value, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	@Nonnull
	protected Optional<Integer> determineParameterSqlType(@Nonnull PreparedStatement preparedStatement,
																												int parameterIndex) throws SQLException {
		requireNonNull(preparedStatement);

		try {
			ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

			if (parameterMetaData == null)
				return Optional.empty();

			return Optional.of(parameterMetaData.getParameterType(parameterIndex));
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return Optional.empty();
		}
	}

	/**
	 * Massages a value into a JDBC-friendly format if needed.
	 * <p>
	 * For example, enums are bound by name and locales by language tag.
	 *
	 * @param value the value to (possibly) massage
	 * @return the result of the massaging process
	 */
	@Nonnull
	protected Object normalizeParameter(@Nonnull Object value) {
		requireNonNull(value);

		// Coerce legacy types to java.time whenever possible
		if (value instanceof java.sql.Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (value instanceof java.sql.Date date)
			return date.toLocalDate();
		if (value instanceof java.sql.Time time)
			return time.toLocalTime();
		if (value instanceof Date date)
			return Instant.ofEpochMilli(date.getTime());
		if (value instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();
		if (value instanceof Locale)
			return ((Locale) value).toLanguageTag();
		if (value instanceof Currency)
			return ((Currency) value).getCurrencyCode();
		if (value instanceof Enum)
			return ((Enum<?>) value).name();
		if (value instanceof ZoneId)
			return ((ZoneId) value).getId();
		if (value instanceof TimeZone)
			return ((TimeZone) value).getID();

		return value;
	}
}
