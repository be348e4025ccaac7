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
 * Typed values extracted from a request path by a route's capture groups, created fresh for every request.
 * <p>
 * Given the route {@code /validate/} + {@code (number:\d+)/(word:\w+)} and the path {@code /validate/42/justatest},
 * {@code get("number")} is the {@link Integer} {@code 42} and {@code get("word")} is the {@link String} {@code "justatest"}.
 */
@ThreadSafe
public final class RouteParameters {
	@NonNull
	private static final RouteParameters EMPTY;

	static {
		EMPTY = new RouteParameters(Map.of());
	}

	@NonNull
	private final Map<String, Object> values;

	@NonNull
	public static RouteParameters empty() {
		return EMPTY;
	}

	@NonNull
	static RouteParameters of(@NonNull Map<String, Object> values) {
		requireNonNull(values);
		return values.isEmpty() ? EMPTY : new RouteParameters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
	}

	private RouteParameters(@NonNull Map<String, Object> values) {
		this.values = values;
	}

	@NonNull
	public Optional<Object> get(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.values.get(name));
	}

	/**
	 * Acquires a typed parameter value.
	 *
	 * @param name the capture group name
	 * @param type the type the group's tag coerces to
	 * @param <T>  the type the group's tag coerces to
	 * @return the value, or {@link Optional#empty()} if the group did not participate in the match
	 * @throws IllegalArgumentException if the value is not an instance of {@code type}
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
			throw new IllegalArgumentException(format("Route parameter '%s' is a %s, not a %s", name,
					value.getClass().getName(), type.getName()));

		return Optional.of(type.cast(value));
	}

	@NonNull
	public Optional<Integer> getInteger(@NonNull String name) {
		return get(name, Integer.class);
	}

	/**
	 * The parameter's value as text, whatever its coerced type.
	 *
	 * @param name the capture group name
	 * @return the value's string form, or {@link Optional#empty()} if absent
	 */
	@NonNull
	public Optional<String> getString(@NonNull String name) {
		return get(name).map(String::valueOf);
	}

	@NonNull
	public Map<String, Object> asMap() {
		return this.values;
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

		if (!(object instanceof RouteParameters routeParameters))
			return false;

		return Objects.equals(this.values, routeParameters.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.values);
	}
}
