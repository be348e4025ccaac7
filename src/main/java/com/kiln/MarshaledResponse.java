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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A finished response, ready to be written to the wire: status, headers in write order, cookies, and body bytes.
 * <p>
 * {@code Set-Cookie} headers are not stored in {@link #getHeaders()}; each of {@link #getCookies()} is written as
 * its own {@code Set-Cookie} line after the other headers.
 */
@ThreadSafe
public final class MarshaledResponse {
	@NonNull
	private static final byte[] EMPTY_BODY;

	static {
		EMPTY_BODY = new byte[0];
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;
	@NonNull
	private final Map<String, List<String>> headers;
	@NonNull
	private final List<ResponseCookie> cookies;
	@NonNull
	private final byte[] body;

	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	@NonNull
	public static Builder withStatusCode(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode.getStatusCode()).reasonPhrase(statusCode.getReasonPhrase());
	}

	private MarshaledResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;

		if (this.statusCode < 100 || this.statusCode > 999)
			throw new IllegalArgumentException(format("Illegal status code %d", this.statusCode));

		String reasonPhrase = builder.reasonPhrase;

		if (reasonPhrase == null)
			reasonPhrase = StatusCode.reasonPhraseFor(this.statusCode);

		this.reasonPhrase = reasonPhrase;

		Map<String, List<String>> headers = new LinkedHashMap<>(builder.headers.size());

		for (Entry<String, List<String>> entry : builder.headers.entrySet()) {
			validateHeaderName(entry.getKey());

			for (String value : entry.getValue())
				validateHeaderValue(entry.getKey(), value);

			headers.put(entry.getKey(), List.copyOf(entry.getValue()));
		}

		this.headers = Collections.unmodifiableMap(headers);
		this.cookies = List.copyOf(builder.cookies);
		this.body = builder.body == null ? EMPTY_BODY : builder.body;
	}

	private static void validateHeaderName(@NonNull String name) {
		if (name.isEmpty())
			throw new IllegalArgumentException("Header name must not be empty");

		for (int i = 0; i < name.length(); ++i) {
			char c = name.charAt(i);

			if (c <= ' ' || c >= 127 || c == ':')
				throw new IllegalArgumentException(format("Illegal header name '%s'", name));
		}
	}

	private static void validateHeaderValue(@NonNull String name,
																					@NonNull String value) {
		if (value.indexOf('\r') != -1 || value.indexOf('\n') != -1)
			throw new IllegalArgumentException(format("Illegal line break in value of header '%s'", name));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, cookies=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), getCookies(), format("%d bytes", getBody().length));
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}

	/**
	 * Headers in the order they will be written, with names as given.
	 */
	@NonNull
	public Map<String, List<String>> getHeaders() {
		return this.headers;
	}

	/**
	 * The first value of the named header, matched case-insensitively.
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getHeaderValues(name);
		return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	@NonNull
	public List<String> getHeaderValues(@NonNull String name) {
		requireNonNull(name);

		List<String> values = new ArrayList<>();

		for (Entry<String, List<String>> entry : getHeaders().entrySet())
			if (entry.getKey().equalsIgnoreCase(name))
				values.addAll(entry.getValue());

		return values;
	}

	@NonNull
	public List<ResponseCookie> getCookies() {
		return this.cookies;
	}

	@NonNull
	public byte[] getBody() {
		return this.body;
	}

	/**
	 * The body decoded with the charset named by {@code Content-Type}, or UTF-8 if none is named.
	 */
	@NonNull
	public String getBodyAsString() {
		String contentType = getHeader("Content-Type").orElse(null);
		Charset charset = Utilities.charsetForName(Utilities.extractCharsetNameFromHeaderValue(contentType).orElse(null), StandardCharsets.UTF_8);
		return new String(getBody(), charset);
	}

	/**
	 * Builder used to construct instances of {@link MarshaledResponse} via {@link MarshaledResponse#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Integer statusCode;
		@NonNull
		private final Map<String, List<String>> headers;
		@NonNull
		private final List<ResponseCookie> cookies;
		@Nullable
		private String reasonPhrase;
		@Nullable
		private byte[] body;

		private Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);

			this.statusCode = statusCode;
			this.headers = new LinkedHashMap<>();
			this.cookies = new ArrayList<>();
		}

		@NonNull
		public Builder reasonPhrase(@Nullable String reasonPhrase) {
			this.reasonPhrase = reasonPhrase;
			return this;
		}

		/**
		 * Appends a header value, keeping any values already added under the same name.
		 */
		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.computeIfAbsent(name, ignored -> new ArrayList<>()).add(value);
			return this;
		}

		@NonNull
		public Builder cookie(@NonNull ResponseCookie cookie) {
			requireNonNull(cookie);
			this.cookies.add(cookie);
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public MarshaledResponse build() {
			return new MarshaledResponse(this);
		}
	}
}
