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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration values declared alongside a {@link Route} and handed to its {@link ActionFactory} on every match.
 * <p>
 * For example, a static-file action might be registered with {@code RouteArguments.of(Map.of("root", Path.of("/srv/www")))}.
 */
@ThreadSafe
public final class RouteArguments {
	@NonNull
	private static final RouteArguments EMPTY;

	static {
		EMPTY = new RouteArguments(Map.of());
	}

	@NonNull
	private final Map<String, Object> values;

	@NonNull
	public static RouteArguments empty() {
		return EMPTY;
	}

	/**
	 * Acquires arguments backed by a copy of {@code values}.
	 *
	 * @param values the argument values, none of which may be {@code null}
	 * @return the arguments
	 */
	@NonNull
	public static RouteArguments of(@NonNull Map<String, ?> values) {
		requireNonNull(values);

		if (values.isEmpty())
			return EMPTY;

		Map<String, Object> copy = new LinkedHashMap<>(values.size());

		values.forEach((name, value) -> copy.put(requireNonNull(name), requireNonNull(value,
				() -> format("Route argument '%s' must not be null", name))));

		return new RouteArguments(Collections.unmodifiableMap(copy));
	}

	private RouteArguments(@NonNull Map<String, Object> values) {
		this.values = values;
	}

	@NonNull
	public Optional<Object> get(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.values.get(name));
	}

	/**
	 * Acquires a typed argument value.
	 *
	 * @param name the argument name
	 * @param type the expected type
	 * @param <T>  the expected type
	 * @return the value, or {@link Optional#empty()} if there is no argument with that name
	 * @throws IllegalArgumentException if the argument exists but is not an instance of {@code type}
	 */
	@NonNull
	public <T> Optional<T> get(@NonNull String name,
														 @NonNull Class<T> type) {
		requireNonNull(name);
		requireNonNull(type);

		Object value = this.values.get(name);

		if (value == null)
			return Optional.empty();

		if (!type.isInstance(value))
			throw new IllegalArgumentException(format("Route argument '%s' is a %s, not a %s", name,
					value.getClass().getName(), type.getName()));

		return Optional.of(type.cast(value));
	}

	@NonNull
	public Map<String, Object> asMap() {
		return this.values;
	}

	@NonNull
	public Boolean isEmpty() {
		return this.values.isEmpty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{values=%s}", getClass().getSimpleName(), this.values);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RouteArguments routeArguments))
			return false;

		return Objects.equals(this.values, routeArguments.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.values);
	}
}
