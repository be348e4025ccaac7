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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Convenience superclass which trims input and wraps conversion failures in {@link ValueConversionException}.
 * <p>
 * Subclasses implement {@link #performConversion(String)}, which is never invoked with blank input.
 * <p>
 * For example:
 * <pre>{@code ValueConverter<Slug> slugConverter = new FromStringValueConverter<>(Slug.class) {
 *   @Override
 *   public Optional<Slug> performConversion(String from) {
 *     return Optional.of(new Slug(from.toLowerCase(Locale.ROOT)));
 *   }
 * };}</pre>
 *
 * @param <T> the type produced by this converter
 */
@ThreadSafe
public abstract class FromStringValueConverter<T> implements ValueConverter<T> {
	@NonNull
	private final Class<T> toType;

	public FromStringValueConverter(@NonNull Class<T> toType) {
		requireNonNull(toType);
		this.toType = toType;
	}

	@NonNull
	@Override
	public final Optional<T> convert(@Nullable String from) throws ValueConversionException {
		String trimmed = from == null ? null : from.trim();

		if (trimmed == null || trimmed.isEmpty())
			return Optional.empty();

		try {
			return performConversion(trimmed);
		} catch (ValueConversionException e) {
			throw e;
		} catch (Exception e) {
			throw new ValueConversionException(format("Unable to convert value '%s' to an instance of %s",
					trimmed, getToType().getSimpleName()), e, trimmed, getToType());
		}
	}

	/**
	 * Performs the conversion.
	 *
	 * @param from the trimmed, non-blank value to convert
	 * @return the converted value
	 * @throws Exception if an error occurs during conversion
	 */
	@NonNull
	public abstract Optional<T> performConversion(@NonNull String from) throws Exception;

	@NonNull
	@Override
	public Class<T> getToType() {
		return this.toType;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{toType=%s}", getClass().getSimpleName(), getToType().getSimpleName());
	}
}
