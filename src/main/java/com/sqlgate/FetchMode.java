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

/**
 * Controls how the columns of a fetched {@link Row} may be accessed.
 *
 * @since 1.0.0
 */
public enum FetchMode {
	/**
	 * Columns keyed by column label. The default.
	 */
	ASSOCIATIVE,
	/**
	 * Columns by 0-based position.
	 */
	NUMERIC,
	/**
	 * Columns by label and by position.
	 */
	BOTH;

	boolean permitsLabels() {
		return this != NUMERIC;
	}

	boolean permitsPositions() {
		return this != ASSOCIATIVE;
	}
}
