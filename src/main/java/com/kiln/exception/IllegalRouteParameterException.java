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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a value captured by a typed route group cannot be coerced to the group's type,
 * for example {@code 99999999999} captured by {@code (number:\d+)}.
 */
@NotThreadSafe
public final class IllegalRouteParameterException extends BadRequestException {
	@NonNull
	private final String routeParameterName;
	@Nullable
	private final String routeParameterValue;

	public IllegalRouteParameterException(@Nullable String message,
																				@Nullable Throwable cause,
																				@NonNull String routeParameterName,
																				@Nullable String routeParameterValue) {
		super(message, cause);
		this.routeParameterName = requireNonNull(routeParameterName);
		this.routeParameterValue = routeParameterValue;
	}

	@NonNull
	public String getRouteParameterName() {
		return this.routeParameterName;
	}

	@NonNull
	public Optional<String> getRouteParameterValue() {
		return Optional.ofNullable(this.routeParameterValue);
	}
}
