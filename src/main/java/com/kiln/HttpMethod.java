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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Typesafe representation of the HTTP request methods Kiln dispatches.
 * <p>
 * Each value corresponds to the {@link Action} method of the same name, in lowercase.
 */
public enum HttpMethod {
	GET,
	HEAD,
	POST,
	PUT,
	PATCH,
	DELETE,
	OPTIONS,
	TRACE,
	CONNECT;

	@NonNull
	private static final Map<String, HttpMethod> HTTP_METHODS_BY_NAME;

	static {
		HTTP_METHODS_BY_NAME = Arrays.stream(HttpMethod.values())
				.collect(Collectors.toUnmodifiableMap(HttpMethod::name, Function.identity()));
	}

	/**
	 * Given a request-line method token, returns the corresponding enum value.
	 * <p>
	 * Method tokens are case-sensitive, so {@code get} does not match {@link #GET}.
	 *
	 * @param methodToken the method token from the request line
	 * @return the matching method, or {@link Optional#empty()} if Kiln does not support it
	 */
	@NonNull
	public static Optional<HttpMethod> fromMethodToken(@NonNull String methodToken) {
		requireNonNull(methodToken);
		return Optional.ofNullable(HTTP_METHODS_BY_NAME.get(methodToken));
	}

	/**
	 * The name of the {@link Action} method which handles this HTTP method, for example {@code get}.
	 *
	 * @return the action method name
	 */
	@NonNull
	public String getActionMethodName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
