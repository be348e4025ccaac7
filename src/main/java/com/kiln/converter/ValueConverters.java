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

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Out-of-the-box {@link ValueConverter} instances, keyed by the type they produce.
 * <p>
 * Converters for {@link Enum} types are generated on demand and cached.
 */
@ThreadSafe
public final class ValueConverters {
	@NonNull
	private static final Map<Class<?>, Class<?>> PRIMITIVE_TYPES_TO_NONPRIMITIVE_EQUIVALENTS;
	@NonNull
	private static final ConcurrentHashMap<Class<?>, ValueConverter<?>> VALUE_CONVERTERS_BY_TYPE;

	static {
		PRIMITIVE_TYPES_TO_NONPRIMITIVE_EQUIVALENTS = Map.of(
				int.class, Integer.class,
				long.class, Long.class,
				double.class, Double.class,
				float.class, Float.class,
				boolean.class, Boolean.class,
				short.class, Short.class
		);

		VALUE_CONVERTERS_BY_TYPE = new ConcurrentHashMap<>();

		register(new FromStringValueConverter<>(String.class) {
			@NonNull
			@Override
			public Optional<String> performConversion(@NonNull String from) {
				return Optional.of(from);
			}
		});

		register(new FromStringValueConverter<>(Integer.class) {
			@NonNull
			@Override
			public Optional<Integer> performConversion(@NonNull String from) {
				return Optional.of(Integer.parseInt(from));
			}
		});

		register(new FromStringValueConverter<>(Long.class) {
			@NonNull
			@Override
			public Optional<Long> performConversion(@NonNull String from) {
				return Optional.of(Long.parseLong(from));
			}
		});

		register(new FromStringValueConverter<>(Short.class) {
			@NonNull
			@Override
			public Optional<Short> performConversion(@NonNull String from) {
				return Optional.of(Short.parseShort(from));
			}
		});

		register(new FromStringValueConverter<>(Double.class) {
			@NonNull
			@Override
			public Optional<Double> performConversion(@NonNull String from) {
				return Optional.of(Double.parseDouble(from));
			}
		});

		register(new FromStringValueConverter<>(Float.class) {
			@NonNull
			@Override
			public Optional<Float> performConversion(@NonNull String from) {
				return Optional.of(Float.parseFloat(from));
			}
		});

		register(new FromStringValueConverter<>(BigInteger.class) {
			@NonNull
			@Override
			public Optional<BigInteger> performConversion(@NonNull String from) {
				return Optional.of(new BigInteger(from));
			}
		});

		register(new FromStringValueConverter<>(BigDecimal.class) {
			@NonNull
			@Override
			public Optional<BigDecimal> performConversion(@NonNull String from) {
				return Optional.of(new BigDecimal(from));
			}
		});

		// Only "true" and "false" are accepted; Boolean.parseBoolean would quietly map typos to false
		register(new FromStringValueConverter<>(Boolean.class) {
			@NonNull
			@Override
			public Optional<Boolean> performConversion(@NonNull String from) throws ValueConversionException {
				String normalized = from.toLowerCase(Locale.ROOT);

				if ("true".equals(normalized))
					return Optional.of(true);
				if ("false".equals(normalized))
					return Optional.of(false);

				throw new ValueConversionException(format("'%s' is not a boolean value", from), from, Boolean.class);
			}
		});

		register(new FromStringValueConverter<>(UUID.class) {
			@NonNull
			@Override
			public Optional<UUID> performConversion(@NonNull String from) {
				return Optional.of(UUID.fromString(from));
			}
		});

		register(new FromStringValueConverter<>(LocalDate.class) {
			@NonNull
			@Override
			public Optional<LocalDate> performConversion(@NonNull String from) {
				return Optional.of(LocalDate.parse(from));
			}
		});

		register(new FromStringValueConverter<>(LocalDateTime.class) {
			@NonNull
			@Override
			public Optional<LocalDateTime> performConversion(@NonNull String from) {
				return Optional.of(LocalDateTime.parse(from));
			}
		});

		register(new FromStringValueConverter<>(Instant.class) {
			@NonNull
			@Override
			public Optional<Instant> performConversion(@NonNull String from) {
				return Optional.of(Instant.parse(from));
			}
		});

		register(new FromStringValueConverter<>(Duration.class) {
			@NonNull
			@Override
			public Optional<Duration> performConversion(@NonNull String from) {
				return Optional.of(Duration.parse(from));
			}
		});
	}

	private ValueConverters() {
		// Cannot instantiate
	}

	private static void register(@NonNull ValueConverter<?> valueConverter) {
		requireNonNull(valueConverter);
		VALUE_CONVERTERS_BY_TYPE.put(valueConverter.getToType(), valueConverter);
	}

	/**
	 * Acquires the default converter which produces instances of {@code toType}.
	 * <p>
	 * Primitive types are mapped to their wrapper equivalents, and converters for enums are generated on first use
	 * (matching on {@link Enum#name()}, case-insensitively).
	 *
	 * @param toType the type to convert to
	 * @param <T>    the type to convert to
	 * @return the converter, or {@link Optional#empty()} if none is available
	 */
	@NonNull
	@SuppressWarnings({"unchecked", "rawtypes"})
	public static <T> Optional<ValueConverter<T>> forType(@NonNull Class<T> toType) {
		requireNonNull(toType);

		Class<?> normalizedToType = PRIMITIVE_TYPES_TO_NONPRIMITIVE_EQUIVALENTS.getOrDefault(toType, toType);
		ValueConverter<?> valueConverter = VALUE_CONVERTERS_BY_TYPE.get(normalizedToType);

		if (valueConverter == null && normalizedToType.isEnum())
			valueConverter = VALUE_CONVERTERS_BY_TYPE.computeIfAbsent(normalizedToType,
					(type) -> new EnumValueConverter((Class<? extends Enum>) type));

		return Optional.ofNullable((ValueConverter<T>) valueConverter);
	}

	@ThreadSafe
	private static final class EnumValueConverter<E extends Enum<E>> extends FromStringValueConverter<E> {
		EnumValueConverter(@NonNull Class<E> enumType) {
			super(enumType);
		}

		@NonNull
		@Override
		public Optional<E> performConversion(@NonNull String from) throws ValueConversionException {
			for (E enumConstant : getToType().getEnumConstants())
				if (enumConstant.name().equalsIgnoreCase(from))
					return Optional.of(enumConstant);

			throw new ValueConversionException(format("'%s' is not a valid %s value", from, getToType().getSimpleName()),
					from, getToType());
		}
	}
}
