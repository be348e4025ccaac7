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

import java.util.Optional;

/**
 * Contract for converting raw text, for example a path segment captured by a route or a value read from a properties file, into a typed value.
 *
 * @param <T> the type produced by this converter
 */
public interface ValueConverter<T> {
	/**
	 * Converts {@code from} to an instance of {@code T}.
	 *
	 * @param from the text from which to convert. May be {@code null}
	 * @return the {@code T} representation of {@code from}, or {@link Optional#empty()} if {@code from} is {@code null} or blank
	 * @throws ValueConversionException if {@code from} cannot be represented as a {@code T}
	 */
	@NonNull
	Optional<T> convert(@Nullable String from) throws ValueConversionException;

	/**
	 * The 'converting to' type.
	 *
	 * @return the type represented by {@code T}
	 */
	@NonNull
	Class<T> getToType();
}
