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

import com.kiln.internal.reactor.Header;
import com.kiln.internal.reactor.ParsedResponse;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The response to an {@link OutboundRequest}.
 * <p>
 * Header lookups are case-insensitive.  {@code Set-Cookie} values which cannot be parsed are left out of
 * {@link #getCookies()} but remain visible through {@link #getHeaderValues(String)}.
 */
@ThreadSafe
public final class OutboundResponse {
	@NonNull
	private final String protocol;
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
	static OutboundResponse fromParsedResponse(@NonNull ParsedResponse parsedResponse) {
		requireNonNull(parsedResponse);
		return new OutboundResponse(parsedResponse);
	}

	private OutboundResponse(@NonNull ParsedResponse parsedResponse) {
		this.protocol = parsedResponse.protocol();
		this.statusCode = parsedResponse.statusCode();
		this.reasonPhrase = parsedResponse.reasonPhrase();
		this.body = parsedResponse.body() == null ? new byte[0] : parsedResponse.body();

		Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		List<ResponseCookie> cookies = new ArrayList<>();

		for (Header header : parsedResponse.headers()) {
			headers.computeIfAbsent(header.name(), ignored -> new ArrayList<>()).add(header.value());

			if (header.name().equalsIgnoreCase("Set-Cookie"))
				ResponseCookie.fromSetCookieHeaderValue(header.value()).ifPresent(cookies::add);
		}

		for (Map.Entry<String, List<String>> entry : headers.entrySet())
			entry.setValue(List.copyOf(entry.getValue()));

		this.headers = Collections.unmodifiableMap(headers);
		this.cookies = List.copyOf(cookies);
	}

	@NonNull
	public String getProtocol() {
		return this.protocol;
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
	 * All headers, keyed case-insensitively, with values in the order received.
	 */
	@NonNull
	public Map<String, List<String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public List<String> getHeaderValues(@NonNull String name) {
		requireNonNull(name);
		return this.headers.getOrDefault(name, List.of());
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		List<String> values = getHeaderValues(name);
		return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	@NonNull
	public List<ResponseCookie> getCookies() {
		return this.cookies;
	}

	@NonNull
	public Optional<ResponseCookie> getCookie(@NonNull String name) {
		requireNonNull(name);

		for (ResponseCookie cookie : this.cookies)
			if (cookie.getName().equals(name))
				return Optional.of(cookie);

		return Optional.empty();
	}

	/**
	 * The media type from {@code Content-Type}, lowercased and without parameters.
	 */
	@NonNull
	public Optional<String> getContentType() {
		return Utilities.extractContentTypeFromHeaderValue(getHeader("Content-Type").orElse(null));
	}

	/**
	 * The charset named by {@code Content-Type}, if any.
	 */
	@NonNull
	public Optional<String> getContentEncoding() {
		return Utilities.extractCharsetNameFromHeaderValue(getHeader("Content-Type").orElse(null));
	}

	/**
	 * Whether the server offered to keep the connection open.  Outbound connections are never reused, so this is
	 * informational.
	 */
	@NonNull
	public Boolean isPersistent() {
		List<String> connectionValues = getHeaderValues("Connection");

		if (Utilities.containsHeaderToken(connectionValues, "close"))
			return false;

		if (Request.HTTP_1_0.equals(getProtocol()))
			return Utilities.containsHeaderToken(connectionValues, "keep-alive");

		return true;
	}

	@NonNull
	public byte[] getBody() {
		return this.body;
	}

	/**
	 * The body decoded with {@link #getContentEncoding()}, or UTF-8 if none is named or it is unsupported.
	 */
	@NonNull
	public String getBodyAsString() {
		Charset charset = Utilities.charsetForName(getContentEncoding().orElse(null), StandardCharsets.UTF_8);
		return new String(getBody(), charset);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{protocol=%s, statusCode=%s, reasonPhrase=%s, headers=%s, body=%s}", getClass().getSimpleName(),
				getProtocol(), getStatusCode(), getReasonPhrase(), getHeaders(), format("%d bytes", getBody().length));
	}
}
