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

package com.kiln.converter;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Thrown if an error occurs during value conversion.
 * <p>
 * For example, {@code "99999999999"} cannot be converted to an {@link Integer} without overflow.
 */
@NotThreadSafe
public class ValueConversionException extends Exception {
	@Nullable
	private final String fromValue;
	@NonNull
	private final Class<?> toType;

	public ValueConversionException(@Nullable String message,
																	@Nullable String fromValue,
																	@NonNull Class<?> toType) {
		super(message);

		requireNonNull(toType);

		this.fromValue = fromValue;
		this.toType = toType;
	}

	public ValueConversionException(@Nullable String message,
																	@Nullable Throwable cause,
																	@Nullable String fromValue,
																	@NonNull Class<?> toType) {
		super(message, cause);

		requireNonNull(toType);

		this.fromValue = fromValue;
		this.toType = toType;
	}

	/**
	 * The value that could not be converted.
	 *
	 * @return the value, or {@link Optional#empty()} if it was {@code null}
	 */
	@NonNull
	public Optional<String> getFromValue() {
		return Optional.ofNullable(this.fromValue);
	}

	/**
	 * The type to which conversion was attempted.
	 *
	 * @return the 'to' type
	 */
	@NonNull
	public Class<?> getToType() {
		return this.toType;
	}
}
