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
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable HTTP request, as parsed off the wire or constructed for a {@link Simulator}.
 * <p>
 * Header names are case-insensitive.  Query parameters, and form parameters from an
 * {@code application/x-www-form-urlencoded} body, are decoded eagerly.
 * <p>
 * Instances are acquired through {@link #with(String, String)}.
 */
@ThreadSafe
public final class Request {
	@NonNull
	public static final String HTTP_1_0;
	@NonNull
	public static final String HTTP_1_1;
	@NonNull
	private static final String FORM_URLENCODED_CONTENT_TYPE;
	@NonNull
	private static final byte[] EMPTY_BODY;

	static {
		HTTP_1_0 = "HTTP/1.0";
		HTTP_1_1 = "HTTP/1.1";
		FORM_URLENCODED_CONTENT_TYPE = "application/x-www-form-urlencoded";
		EMPTY_BODY = new byte[0];
	}

	@NonNull
	private final String methodToken;
	@Nullable
	private final HttpMethod httpMethod;
	@NonNull
	private final String target;
	@NonNull
	private final String path;
	@Nullable
	private final String queryString;
	@NonNull
	private final String protocol;
	@NonNull
	private final Map<String, List<String>> headers;
	@NonNull
	private final Map<String, String> cookies;
	@NonNull
	private final Map<String, List<String>> queryParameters;
	@NonNull
	private final Map<String, List<String>> formParameters;
	@NonNull
	private final byte[] body;
	@Nullable
	private final Long contentLength;
	@Nullable
	private final String contentType;
	@Nullable
	private final InetSocketAddress remoteAddress;
	@Nullable
	private final InetSocketAddress localAddress;

	/**
	 * Acquires a builder for a request with the given request-line method token and target.
	 *
	 * @param methodToken the method token, for example {@code GET}. Unsupported tokens are allowed and result in a 405 response
	 * @param target      the request target, for example {@code /validate/42/justatest?verbose=true}
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String methodToken,
														 @NonNull String target) {
		requireNonNull(methodToken);
		requireNonNull(target);

		return new Builder(methodToken, target);
	}

	/**
	 * Acquires a builder for a request with the given method and target.
	 *
	 * @param httpMethod the HTTP method
	 * @param target     the request target
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull HttpMethod httpMethod,
														 @NonNull String target) {
		requireNonNull(httpMethod);
		return with(httpMethod.name(), target);
	}

	private Request(@NonNull Builder builder) {
		requireNonNull(builder);

		this.methodToken = builder.methodToken;
		this.httpMethod = HttpMethod.fromMethodToken(builder.methodToken).orElse(null);
		this.protocol = builder.protocol;
		this.body = builder.body == null ? EMPTY_BODY : builder.body;
		this.remoteAddress = builder.remoteAddress;
		this.localAddress = builder.localAddress;

		String target = builder.target.isEmpty() ? "/" : builder.target;

		// Absolute-form targets ("http://example.com/path") are reduced to their path and query
		int schemeIndex = target.indexOf("://");

		if (schemeIndex > 0 && !target.startsWith("/")) {
			int pathIndex = target.indexOf('/', schemeIndex + 3);
			target = pathIndex == -1 ? "/" : target.substring(pathIndex);
		}

		// Clients that omit the leading slash are tolerated
		if (!target.startsWith("/") && !"*".equals(target))
			target = "/" + target;

		this.target = target;

		int fragmentIndex = target.indexOf('#');
		String targetWithoutFragment = fragmentIndex == -1 ? target : target.substring(0, fragmentIndex);
		int queryIndex = targetWithoutFragment.indexOf('?');
		String rawPath = queryIndex == -1 ? targetWithoutFragment : targetWithoutFragment.substring(0, queryIndex);

		this.queryString = queryIndex == -1 ? null : targetWithoutFragment.substring(queryIndex + 1);
		this.path = Utilities.percentDecode(rawPath, StandardCharsets.UTF_8);

		Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (Entry<String, List<String>> entry : builder.headers.entrySet())
			headers.computeIfAbsent(entry.getKey(), ignored -> new ArrayList<>()).addAll(entry.getValue());

		for (Entry<String, List<String>> entry : headers.entrySet())
			entry.setValue(Collections.unmodifiableList(entry.getValue()));

		this.headers = Collections.unmodifiableMap(headers);
		this.cookies = Utilities.extractCookiesFromHeaderValue(getHeader("Cookie").orElse(null));

		Long contentLength = null;
		String contentLengthHeaderValue = getHeader("Content-Length").orElse(null);

		if (contentLengthHeaderValue != null) {
			try {
				contentLength = Long.parseLong(contentLengthHeaderValue.trim());
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(format("Illegal Content-Length header value '%s'", contentLengthHeaderValue), e);
			}
		}

		this.contentLength = contentLength;

		this.queryParameters = this.queryString == null
				? Map.of()
				: unmodifiableMultimap(Utilities.extractParametersFromQuery(this.queryString, StandardCharsets.UTF_8));

		String contentTypeHeaderValue = getHeader("Content-Type").orElse(null);
		this.contentType = Utilities.extractContentTypeFromHeaderValue(contentTypeHeaderValue).orElse(null);

		if (isFormUrlEncoded() && this.body.length > 0) {
			Charset charset = Utilities.charsetForName(Utilities.extractCharsetNameFromHeaderValue(contentTypeHeaderValue).orElse(null), StandardCharsets.UTF_8);
			this.formParameters = unmodifiableMultimap(Utilities.extractParametersFromQuery(new String(this.body, charset), charset));
		} else {
			this.formParameters = Map.of();
		}
	}

	@NonNull
	private static Map<String, List<String>> unmodifiableMultimap(@NonNull Map<String, List<String>> multimap) {
		Map<String, List<String>> copy = new LinkedHashMap<>(multimap.size());

		for (Entry<String, List<String>> entry : multimap.entrySet())
			copy.put(entry.getKey(), List.copyOf(entry.getValue()));

		return Collections.unmodifiableMap(copy);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, target=%s, protocol=%s}", getClass().getSimpleName(), getMethodToken(), getTarget(), getProtocol());
	}

	/**
	 * The method token exactly as it appeared on the request line.
	 *
	 * @return the method token
	 */
	@NonNull
	public String getMethodToken() {
		return this.methodToken;
	}

	/**
	 * The HTTP method, if Kiln supports the method token.
	 *
	 * @return the HTTP method, or {@link Optional#empty()} for unsupported tokens
	 */
	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return Optional.ofNullable(this.httpMethod);
	}

	/**
	 * The request target with any absolute-form prefix removed, for example {@code /search?q=kiln}.
	 *
	 * @return the request target
	 */
	@NonNull
	public String getTarget() {
		return this.target;
	}

	/**
	 * The percent-decoded path component of the target, for example {@code /search}.
	 *
	 * @return the path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public Optional<String> getQueryString() {
		return Optional.ofNullable(this.queryString);
	}

	/**
	 * The protocol version, either {@link #HTTP_1_0} or {@link #HTTP_1_1}.
	 *
	 * @return the protocol version
	 */
	@NonNull
	public String getProtocol() {
		return this.protocol;
	}

	/**
	 * All header values, keyed case-insensitively and in the order received.
	 *
	 * @return the headers
	 */
	@NonNull
	public Map<String, List<String>> getHeaders() {
		return this.headers;
	}

	/**
	 * A single header value.  Repeated list-valued headers are joined, otherwise the last value wins.
	 *
	 * @param name the case-insensitive header name
	 * @return the header value, or {@link Optional#empty()} if the header is absent
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		List<String> values = this.headers.get(name);
		return values == null ? Optional.empty() : Utilities.combineHeaderValues(name, values);
	}

	@NonNull
	public List<String> getHeaderValues(@NonNull String name) {
		requireNonNull(name);
		return this.headers.getOrDefault(name, List.of());
	}

	@NonNull
	public Map<String, String> getCookies() {
		return this.cookies;
	}

	@NonNull
	public Optional<String> getCookie(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.cookies.get(name));
	}

	@NonNull
	public Map<String, List<String>> getQueryParameters() {
		return this.queryParameters;
	}

	/**
	 * Parameters decoded from an {@code application/x-www-form-urlencoded} body.
	 *
	 * @return the form parameters, empty for other content types
	 */
	@NonNull
	public Map<String, List<String>> getFormParameters() {
		return this.formParameters;
	}

	/**
	 * The first value of a query or form parameter.  Query parameters take precedence.
	 *
	 * @param name the parameter name
	 * @return the value, or {@link Optional#empty()} if neither the query nor the form has it
	 */
	@NonNull
	public Optional<String> getParameter(@NonNull String name) {
		requireNonNull(name);

		List<String> values = this.queryParameters.get(name);

		if (values == null || values.isEmpty())
			values = this.formParameters.get(name);

		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	/**
	 * The request body, which is empty (never {@code null}) if none was sent.
	 * <p>
	 * The returned array is a copy.
	 *
	 * @return the body bytes
	 */
	@NonNull
	public byte[] getBody() {
		return this.body.length == 0 ? this.body : Arrays.copyOf(this.body, this.body.length);
	}

	/**
	 * The request body decoded with the charset declared by {@code Content-Type}, or UTF-8.
	 *
	 * @return the body as text
	 */
	@NonNull
	public String getBodyAsString() {
		Charset charset = Utilities.charsetForName(
				Utilities.extractCharsetNameFromHeaderValue(getHeader("Content-Type").orElse(null)).orElse(null),
				StandardCharsets.UTF_8);

		return new String(this.body, charset);
	}

	@NonNull
	public Optional<Long> getContentLength() {
		return Optional.ofNullable(this.contentLength);
	}

	/**
	 * The lowercased media type of the body, without parameters, for example {@code multipart/form-data}.
	 *
	 * @return the media type, or {@link Optional#empty()} if no {@code Content-Type} header was sent
	 */
	@NonNull
	public Optional<String> getContentType() {
		return Optional.ofNullable(this.contentType);
	}

	@NonNull
	public Boolean isFormUrlEncoded() {
		return FORM_URLENCODED_CONTENT_TYPE.equals(this.contentType);
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@NonNull
	public Optional<InetSocketAddress> getLocalAddress() {
		return Optional.ofNullable(this.localAddress);
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String methodToken;
		@NonNull
		private final String target;
		@NonNull
		private final Map<String, List<String>> headers;
		@NonNull
		private String protocol;
		@Nullable
		private byte[] body;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private InetSocketAddress localAddress;

		private Builder(@NonNull String methodToken,
										@NonNull String target) {
			this.methodToken = methodToken;
			this.target = target;
			this.headers = new LinkedHashMap<>();
			this.protocol = HTTP_1_1;
		}

		@NonNull
		public Builder protocol(@NonNull String protocol) {
			this.protocol = requireNonNull(protocol);
			return this;
		}

		/**
		 * Appends a header value, keeping any values already added under the same name.
		 *
		 * @param name  the header name
		 * @param value the header value
		 * @return this builder
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
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder body(@Nullable String body) {
			this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder localAddress(@Nullable InetSocketAddress localAddress) {
			this.localAddress = localAddress;
			return this;
		}

		/**
		 * Builds the request.
		 *
		 * @return the request
		 * @throws IllegalArgumentException if the target or a parameter contains malformed percent-encoding, or Content-Length is not a number
		 */
		@NonNull
		public Request build() {
			return new Request(this);
		}
	}
}
