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
 * How much driver detail a {@link GateException} may carry.
 *
 * @since 1.0.0
 */
public enum ErrorDetail {
	/**
	 * Generic messages only; the driver exception is not attached as a cause.
	 * <p>
	 * This is the default.
	 */
	SANITIZED,
	/**
	 * Driver messages are appended to the generic message and the driver exception is attached as a cause.
	 * <p>
	 * Useful during development. Do not expose to end users, since driver messages can reveal schema details.
	 */
	VERBOSE
}
