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

package com.kiln;

import com.kiln.converter.ValueConversionException;
import com.kiln.converter.ValueConverter;
import com.kiln.converter.ValueConverters;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps route type tags, like the {@code number} in {@code (number:\d+)}, to the converters that turn captured text into typed values.
 * <p>
 * Out of the box, these tags are understood:
 * <ul>
 *   <li>{@code number}, {@code int}, {@code integer} - {@link Integer}</li>
 *   <li>{@code long} - {@link Long}</li>
 *   <li>{@code float}, {@code double} - {@link Double}</li>
 *   <li>{@code decimal} - {@link BigDecimal}</li>
 *   <li>{@code word}, {@code string}, {@code str}, {@code slug} - {@link String}</li>
 *   <li>{@code bool}, {@code boolean} - {@link Boolean}</li>
 *   <li>{@code uuid} - {@link UUID}</li>
 *   <li>{@code date} - {@link LocalDate} (ISO-8601)</li>
 * </ul>
 * Tags are case-insensitive. Instances are immutable; use {@link #withDefaults()} or {@link #builder()} to acquire one.
 */
@ThreadSafe
public final class ParamCoercion {
	@NonNull
	private static final ParamCoercion DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = builder().build();
	}

	@NonNull
	private final Map<String, ValueConverter<?>> valueConvertersByTypeTag;

	/**
	 * Acquires an instance which understands only the default type tags.
	 *
	 * @return the default instance
	 */
	@NonNull
	public static ParamCoercion withDefaults() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Acquires a builder seeded with the default type tags.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private ParamCoercion(@NonNull Builder builder) {
		requireNonNull(builder);
		this.valueConvertersByTypeTag = Collections.unmodifiableMap(new LinkedHashMap<>(builder.valueConvertersByTypeTag));
	}

	/**
	 * Is {@code typeTag} registered?
	 *
	 * @param typeTag the type tag to check
	 * @return {@code true} if a converter exists for the tag
	 */
	@NonNull
	public Boolean isKnownTypeTag(@Nullable String typeTag) {
		return typeTag != null && this.valueConvertersByTypeTag.containsKey(normalizeTypeTag(typeTag));
	}

	/**
	 * The type produced for values captured under {@code typeTag}.
	 *
	 * @param typeTag the type tag
	 * @return the produced type, or {@link Optional#empty()} if the tag is unknown
	 */
	@NonNull
	public Optional<Class<?>> typeForTypeTag(@NonNull String typeTag) {
		requireNonNull(typeTag);

		ValueConverter<?> valueConverter = this.valueConvertersByTypeTag.get(normalizeTypeTag(typeTag));
		return valueConverter == null ? Optional.empty() : Optional.of(valueConverter.getToType());
	}

	/**
	 * Coerces a captured value.
	 *
	 * @param typeTag  the registered type tag, or {@code null} to keep the raw string
	 * @param rawValue the captured text
	 * @return the typed value
	 * @throws ValueConversionException if the text cannot be represented as the tag's type
	 */
	@NonNull
	public Object coerce(@Nullable String typeTag,
											 @NonNull String rawValue) throws ValueConversionException {
		requireNonNull(rawValue);

		if (typeTag == null)
			return rawValue;

		ValueConverter<?> valueConverter = this.valueConvertersByTypeTag.get(normalizeTypeTag(typeTag));

		if (valueConverter == null)
			throw new IllegalArgumentException(format("Unknown type tag '%s'. Known tags are %s", typeTag, getTypeTags()));

		// Blank captures (for example from \w*) stay as empty strings rather than becoming null
		Optional<?> converted = valueConverter.convert(rawValue);
		return converted.isPresent() ? converted.get() : rawValue;
	}

	@NonNull
	public Set<String> getTypeTags() {
		return this.valueConvertersByTypeTag.keySet();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{typeTags=%s}", getClass().getSimpleName(), getTypeTags());
	}

	@NonNull
	private static String normalizeTypeTag(@NonNull String typeTag) {
		return typeTag.trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Builder used to construct instances of {@link ParamCoercion}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<String, ValueConverter<?>> valueConvertersByTypeTag;

		private Builder() {
			this.valueConvertersByTypeTag = new LinkedHashMap<>();

			for (String typeTag : new String[]{"number", "int", "integer"})
				typeTag(typeTag, Integer.class);

			typeTag("long", Long.class);
			typeTag("float", Double.class);
			typeTag("double", Double.class);
			typeTag("decimal", BigDecimal.class);

			for (String typeTag : new String[]{"word", "string", "str", "slug"})
				typeTag(typeTag, String.class);

			typeTag("bool", Boolean.class);
			typeTag("boolean", Boolean.class);
			typeTag("uuid", UUID.class);
			typeTag("date", LocalDate.class);
		}

		/**
		 * Registers (or replaces) a type tag which produces instances of {@code type} using the default converter for that type.
		 *
		 * @param typeTag the tag, for example {@code cents}
		 * @param type    the type to produce
		 * @return this builder
		 * @throws IllegalArgumentException if no default converter exists for {@code type}
		 */
		@NonNull
		public Builder typeTag(@NonNull String typeTag,
													 @NonNull Class<?> type) {
			requireNonNull(typeTag);
			requireNonNull(type);

			ValueConverter<?> valueConverter = ValueConverters.forType(type).orElseThrow(() ->
					new IllegalArgumentException(format("No default converter exists for %s; register a %s for type tag '%s' instead",
							type.getName(), ValueConverter.class.getSimpleName(), typeTag)));

			return typeTag(typeTag, valueConverter);
		}

		/**
		 * Registers (or replaces) a type tag backed by a custom converter.
		 *
		 * @param typeTag        the tag, for example {@code sku}
		 * @param valueConverter the converter to apply to captured values
		 * @return this builder
		 */
		@NonNull
		public Builder typeTag(@NonNull String typeTag,
													 @NonNull ValueConverter<?> valueConverter) {
			requireNonNull(typeTag);
			requireNonNull(valueConverter);

			String normalizedTypeTag = normalizeTypeTag(typeTag);

			if (!normalizedTypeTag.matches("[a-z_][a-z0-9_]*"))
				throw new IllegalArgumentException(format("Illegal type tag '%s'. Type tags must be alphanumeric identifiers", typeTag));

			this.valueConvertersByTypeTag.put(normalizedTypeTag, valueConverter);
			return this;
		}

		@NonNull
		public ParamCoercion build() {
			return new ParamCoercion(this);
		}
	}
}
