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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes which page of a paginated table the current HTTP request asks for.
 * <p>
 * The page value is taken verbatim from the request's query string (e.g. {@code ?pg=3}) and validated when the table
 * is rendered, not here.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class PageRequest {
	@NonNull
	public static final String DEFAULT_QUERY_PARAMETER_NAME = "pg";

	private final int rowsPerPage;
	@NonNull
	private final String requestUri;
	@NonNull
	private final String queryParameterName;
	@Nullable
	private final String pageValue;

	private PageRequest(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.rowsPerPage < 1)
			throw new IllegalArgumentException(format("Rows per page must be greater than zero (was %d)", builder.rowsPerPage));

		String queryParameterName = builder.queryParameterName == null ? DEFAULT_QUERY_PARAMETER_NAME : builder.queryParameterName;

		if (queryParameterName.isBlank())
			throw new IllegalArgumentException("Query parameter name must not be blank");

		this.rowsPerPage = builder.rowsPerPage;
		this.requestUri = requireNonNull(builder.requestUri);
		this.queryParameterName = queryParameterName;
		this.pageValue = builder.pageValue;
	}

	/**
	 * Provides a {@link PageRequest} builder.
	 *
	 * @param rowsPerPage how many rows each page shows
	 * @param requestUri  the current request URI including its query string, e.g. {@code /people?sort=last&pg=2}
	 * @return a {@link PageRequest} builder
	 */
	@NonNull
	public static Builder withRowsPerPage(int rowsPerPage,
																				@NonNull String requestUri) {
		requireNonNull(requestUri);
		return new Builder(rowsPerPage, requestUri);
	}

	public int getRowsPerPage() {
		return this.rowsPerPage;
	}

	@NonNull
	public String getRequestUri() {
		return this.requestUri;
	}

	@NonNull
	public String getQueryParameterName() {
		return this.queryParameterName;
	}

	/**
	 * @return the raw page value from the query string, or empty if the request did not specify a page
	 */
	@NonNull
	public Optional<String> getPageValue() {
		return Optional.ofNullable(this.pageValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRowsPerPage(), getRequestUri(), getQueryParameterName(), getPageValue());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PageRequest))
			return false;

		PageRequest pageRequest = (PageRequest) object;

		return pageRequest.getRowsPerPage() == getRowsPerPage()
				&& Objects.equals(pageRequest.getRequestUri(), getRequestUri())
				&& Objects.equals(pageRequest.getQueryParameterName(), getQueryParameterName())
				&& Objects.equals(pageRequest.getPageValue(), getPageValue());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rowsPerPage=%d, requestUri=%s, queryParameterName=%s, pageValue=%s}", getClass().getSimpleName(),
				getRowsPerPage(), getRequestUri(), getQueryParameterName(), this.pageValue);
	}

	/**
	 * Builder used to construct instances of {@link PageRequest}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		private final int rowsPerPage;
		@NonNull
		private final String requestUri;
		@Nullable
		private String queryParameterName;
		@Nullable
		private String pageValue;

		private Builder(int rowsPerPage,
										@NonNull String requestUri) {
			this.rowsPerPage = rowsPerPage;
			this.requestUri = requireNonNull(requestUri);
		}

		/**
		 * @param queryParameterName the query string parameter carrying the page number (null for
		 *                           <code>{@value PageRequest#DEFAULT_QUERY_PARAMETER_NAME}</code>)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder queryParameterName(@Nullable String queryParameterName) {
			this.queryParameterName = queryParameterName;
			return this;
		}

		/**
		 * @param pageValue the raw value of the page parameter (null if the request did not specify one)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder pageValue(@Nullable String pageValue) {
			this.pageValue = pageValue;
			return this;
		}

		@NonNull
		public PageRequest build() {
			return new PageRequest(this);
		}
	}
}
