/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.kiln.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Exception thrown at startup when a route cannot be registered: its regular expression does not compile,
 * it names an unknown type tag, or it declares the same group name twice.
 */
@NotThreadSafe
public final class RouteRegistrationException extends IllegalArgumentException {
	public RouteRegistrationException(@Nullable String message) {
		super(message);
	}

	public RouteRegistrationException(@Nullable String message,
																		@Nullable Throwable cause) {
		super(message, cause);
	}
}
