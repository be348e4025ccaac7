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
import java.io.ByteArrayOutputStream;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of HTTP text-handling utilities shared by the server and the outbound client.
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final Set<String> COMMA_JOINABLE_HEADER_NAMES;
	@NonNull
	private static final DateTimeFormatter HTTP_DATE_FORMATTER;

	static {
		// Cookie is joined with "; " separately.  Set-Cookie is never joined
		COMMA_JOINABLE_HEADER_NAMES = Set.of(
				"accept",
				"accept-charset",
				"accept-encoding",
				"accept-language",
				"allow",
				"cache-control",
				"connection",
				"pragma",
				"te",
				"trailer",
				"transfer-encoding",
				"upgrade",
				"vary",
				"via",
				"warning"
		);

		HTTP_DATE_FORMATTER = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Parses a query string such as {@code "a=1&b=2&a=%20"} (or an {@code application/x-www-form-urlencoded} body) into an
	 * ordered multimap of names to values.
	 * <p>
	 * {@code +} decodes to a space. Pairs without a name are ignored and names without a value map to the empty string.
	 *
	 * @param query   the raw query string, without the leading {@code ?}
	 * @param charset the charset used to interpret percent-escaped bytes
	 * @return the parameters, in first-seen name order
	 * @throws IllegalArgumentException if the query contains malformed percent-encoding
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull List<@NonNull String>> extractParametersFromQuery(@NonNull String query,
																																											 @NonNull Charset charset) {
		requireNonNull(query);
		requireNonNull(charset);

		Map<String, List<String>> parameters = new LinkedHashMap<>();

		for (String pair : query.split("&")) {
			if (pair.isEmpty())
				continue;

			int equalsIndex = pair.indexOf('=');
			String rawName = equalsIndex == -1 ? pair : pair.substring(0, equalsIndex);
			String rawValue = equalsIndex == -1 ? "" : pair.substring(equalsIndex + 1);

			if (rawName.isBlank())
				continue;

			String name = percentDecode(rawName.replace('+', ' '), charset);
			String value = percentDecode(rawValue.replace('+', ' '), charset);

			parameters.computeIfAbsent(name, ignored -> new ArrayList<>()).add(value);
		}

		return parameters;
	}

	/**
	 * Encodes parameters as {@code application/x-www-form-urlencoded} text, suitable for a query string or a request body.
	 *
	 * @param parameters the parameters to encode
	 * @return the encoded text, for example {@code "q=hello+world&page=2"}
	 */
	@NonNull
	public static String encodeParameters(@NonNull Map<@NonNull String, @NonNull List<@NonNull String>> parameters) {
		requireNonNull(parameters);

		StringBuilder encoded = new StringBuilder();

		for (Entry<String, List<String>> entry : parameters.entrySet()) {
			for (String value : entry.getValue()) {
				if (encoded.length() > 0)
					encoded.append('&');

				encoded.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
						.append('=')
						.append(URLEncoder.encode(value, StandardCharsets.UTF_8));
			}
		}

		return encoded.toString();
	}

	/**
	 * Percent-decodes a string into bytes, then interprets those bytes using {@code charset}.
	 * <p>
	 * {@code +} is not treated specially.
	 *
	 * @param string  the text to decode
	 * @param charset the charset used to interpret decoded bytes
	 * @return the decoded text
	 * @throws IllegalArgumentException if a {@code %} is not followed by two hex digits
	 */
	@NonNull
	public static String percentDecode(@NonNull String string,
																		 @NonNull Charset charset) {
		requireNonNull(string);
		requireNonNull(charset);

		if (string.indexOf('%') == -1)
			return string;

		StringBuilder decoded = new StringBuilder(string.length());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		for (int i = 0; i < string.length(); ) {
			char c = string.charAt(i);

			if (c != '%') {
				decoded.append(c);
				i++;
				continue;
			}

			// Consecutive escapes form one byte sequence so multibyte characters decode correctly
			bytes.reset();

			while (i < string.length() && string.charAt(i) == '%') {
				if (i + 2 >= string.length())
					throw new IllegalArgumentException(format("Truncated percent-encoding in '%s'", string));

				int high = Character.digit(string.charAt(i + 1), 16);
				int low = Character.digit(string.charAt(i + 2), 16);

				if (high < 0 || low < 0)
					throw new IllegalArgumentException(format("Invalid percent-encoding in '%s'", string));

				bytes.write((high << 4) | low);
				i += 3;
			}

			decoded.append(bytes.toString(charset));
		}

		return decoded.toString();
	}

	/**
	 * Parses a {@code Cookie} request header value such as {@code "a=1; b=\"two\""} into a map of cookie names to values.
	 * <p>
	 * Cookie names are case-sensitive. If a name appears more than once, the first value wins.
	 *
	 * @param cookieHeaderValue the header value, possibly {@code null}
	 * @return the cookies, in header order
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull String> extractCookiesFromHeaderValue(@Nullable String cookieHeaderValue) {
		if (cookieHeaderValue == null || cookieHeaderValue.isBlank())
			return Map.of();

		Map<String, String> cookies = new LinkedHashMap<>();

		for (String component : cookieHeaderValue.split(";")) {
			int equalsIndex = component.indexOf('=');

			if (equalsIndex <= 0)
				continue;

			String name = component.substring(0, equalsIndex).trim();
			String value = unquote(component.substring(equalsIndex + 1).trim());

			if (!name.isEmpty())
				cookies.putIfAbsent(name, value);
		}

		return Collections.unmodifiableMap(cookies);
	}

	/**
	 * Extracts the media type (without parameters) from a {@code Content-Type} header value.
	 * <p>
	 * For example, {@code "text/html; charset=UTF-8"} becomes {@code "text/html"}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the lowercased media type if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> extractContentTypeFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		if (contentTypeHeaderValue == null)
			return Optional.empty();

		int semicolonIndex = contentTypeHeaderValue.indexOf(';');
		String contentType = (semicolonIndex == -1 ? contentTypeHeaderValue : contentTypeHeaderValue.substring(0, semicolonIndex)).trim();

		return contentType.isEmpty() ? Optional.empty() : Optional.of(contentType.toLowerCase(Locale.ROOT));
	}

	/**
	 * Extracts the {@code charset} parameter from a {@code Content-Type} header value.
	 * <p>
	 * For example, {@code "text/html; charset=UTF-8"} yields {@code "UTF-8"}.  The name is not validated.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the charset name if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> extractCharsetNameFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		if (contentTypeHeaderValue == null)
			return Optional.empty();

		String[] components = contentTypeHeaderValue.split(";");

		for (int i = 1; i < components.length; i++) {
			String component = components[i].trim();
			int equalsIndex = component.indexOf('=');

			if (equalsIndex > 0 && component.substring(0, equalsIndex).trim().equalsIgnoreCase("charset")) {
				String charsetName = unquote(component.substring(equalsIndex + 1).trim());
				return charsetName.isEmpty() ? Optional.empty() : Optional.of(charsetName);
			}
		}

		return Optional.empty();
	}

	/**
	 * Resolves a charset name leniently.
	 *
	 * @param charsetName the charset name, possibly {@code null} or unsupported
	 * @param fallback    the charset to use if {@code charsetName} cannot be resolved
	 * @return the resolved charset
	 */
	@NonNull
	public static Charset charsetForName(@Nullable String charsetName,
																			 @NonNull Charset fallback) {
		requireNonNull(fallback);

		if (charsetName == null)
			return fallback;

		try {
			return Charset.forName(charsetName);
		} catch (RuntimeException e) {
			return fallback;
		}
	}

	/**
	 * Collapses the values of a repeated header into one value.
	 * <p>
	 * List-valued headers like {@code Accept} are joined with {@code ", "} and {@code Cookie} with {@code "; "}.  For every
	 * other header the last value wins.
	 *
	 * @param headerName the header name
	 * @param values     the values in the order they were received
	 * @return the combined value, or {@link Optional#empty()} if there are no values
	 */
	@NonNull
	public static Optional<@NonNull String> combineHeaderValues(@NonNull String headerName,
																															@NonNull List<@NonNull String> values) {
		requireNonNull(headerName);
		requireNonNull(values);

		if (values.isEmpty())
			return Optional.empty();

		if (values.size() == 1)
			return Optional.of(values.get(0));

		String normalizedHeaderName = headerName.toLowerCase(Locale.ROOT);

		if ("cookie".equals(normalizedHeaderName))
			return Optional.of(String.join("; ", values));

		if (COMMA_JOINABLE_HEADER_NAMES.contains(normalizedHeaderName))
			return Optional.of(String.join(", ", values));

		return Optional.of(values.get(values.size() - 1));
	}

	/**
	 * Does any of the comma-separated values contain {@code token}, case-insensitively?
	 * <p>
	 * For example, {@code Connection: keep-alive, Upgrade} contains the token {@code upgrade}.
	 *
	 * @param values the header values to search
	 * @param token  the token to find
	 * @return {@code true} if the token is present
	 */
	@NonNull
	public static Boolean containsHeaderToken(@Nullable List<@NonNull String> values,
																						@NonNull String token) {
		requireNonNull(token);

		if (values == null)
			return false;

		for (String value : values)
			for (String part : value.split(","))
				if (token.equalsIgnoreCase(part.trim()))
					return true;

		return false;
	}

	/**
	 * Formats an instant as an IMF-fixdate, for example {@code Sun, 06 Nov 1994 08:49:37 GMT}.
	 *
	 * @param instant the instant to format
	 * @return the formatted date
	 */
	@NonNull
	public static String formatHttpDate(@NonNull Instant instant) {
		requireNonNull(instant);
		return HTTP_DATE_FORMATTER.format(instant);
	}

	@NonNull
	private static String unquote(@NonNull String value) {
		if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"')
			return value.substring(1, value.length() - 1);

		return value;
	}
}
