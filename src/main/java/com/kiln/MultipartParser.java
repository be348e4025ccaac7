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

import com.kiln.exception.BadRequestException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.net.URLConnection;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Splits a {@code multipart/form-data} request body into {@link MultipartField} instances, grouped by field name in
 * the order they were sent.
 * <p>
 * Any structural problem with the body is reported as a {@link BadRequestException}, which becomes a {@code 400}.
 */
@ThreadSafe
final class MultipartParser {
	@NonNull
	private static final Integer MAXIMUM_MULTIPART_FIELDS;
	@NonNull
	private static final Integer MAXIMUM_BOUNDARY_LENGTH;
	@NonNull
	private static final String DEFAULT_FILE_CONTENT_TYPE;
	@NonNull
	private static final byte[] CRLF;
	@NonNull
	private static final byte[] HEADER_TERMINATOR;

	static {
		MAXIMUM_MULTIPART_FIELDS = 1_000;
		MAXIMUM_BOUNDARY_LENGTH = 70;
		DEFAULT_FILE_CONTENT_TYPE = "text/plain";
		CRLF = new byte[]{'\r', '\n'};
		HEADER_TERMINATOR = new byte[]{'\r', '\n', '\r', '\n'};
	}

	private MultipartParser() {
		// Non-instantiable
	}

	/**
	 * Parses the body of {@code request}.
	 *
	 * @param request the request
	 * @return the fields by name, or an empty map if the request is not {@code multipart/form-data}
	 * @throws BadRequestException if the boundary is missing or illegal, or the body is not well-formed
	 */
	@NonNull
	static Map<String, List<MultipartField>> extractMultipartFields(@NonNull Request request) {
		requireNonNull(request);

		String contentTypeHeaderValue = request.getHeader("Content-Type").orElse(null);

		if (!"multipart/form-data".equals(Utilities.extractContentTypeFromHeaderValue(contentTypeHeaderValue).orElse(null)))
			return Map.of();

		int semicolonIndex = contentTypeHeaderValue.indexOf(';');
		String boundary = semicolonIndex == -1 ? null : extractParameters(contentTypeHeaderValue.substring(semicolonIndex + 1)).get("boundary");

		if (boundary == null || boundary.isEmpty())
			throw new BadRequestException("Multipart request must include a non-empty 'boundary' parameter in its Content-Type header");

		if (boundary.length() > MAXIMUM_BOUNDARY_LENGTH || !isValidBoundary(boundary))
			throw new BadRequestException(format("Illegal multipart boundary '%s'", boundary));

		byte[] body = request.getBody();
		byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.US_ASCII);
		byte[] partDelimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.US_ASCII);
		Map<String, List<MultipartField>> multipartFieldsByName = new LinkedHashMap<>();

		int position = indexOf(body, delimiter, 0);

		// Anything before the first delimiter is preamble, but the delimiter must start a line
		while (position > 0 && (position < 2 || body[position - 2] != '\r' || body[position - 1] != '\n'))
			position = indexOf(body, delimiter, position + 1);

		if (position == -1)
			throw new BadRequestException("Multipart body does not contain its boundary");

		int fieldCount = 0;

		while (true) {
			position += delimiter.length;

			if (startsWith(body, position, new byte[]{'-', '-'}))
				break;

			// Transport padding is allowed between the delimiter and its line break
			while (position < body.length && (body[position] == ' ' || body[position] == '\t'))
				++position;

			if (!startsWith(body, position, CRLF))
				throw new BadRequestException("Multipart boundary is not followed by a line break");

			position += CRLF.length;

			int headersEnd = startsWith(body, position, CRLF) ? position : indexOf(body, HEADER_TERMINATOR, position);

			if (headersEnd == -1)
				throw new BadRequestException("Multipart part headers are not terminated");

			Map<String, String> headers = parseHeaders(new String(body, position, headersEnd - position, StandardCharsets.UTF_8));
			int dataStart = headersEnd + (headersEnd == position ? CRLF.length : HEADER_TERMINATOR.length);
			int dataEnd = indexOf(body, partDelimiter, dataStart);

			if (dataEnd == -1)
				throw new BadRequestException("Multipart body is missing its closing boundary");

			if (++fieldCount > MAXIMUM_MULTIPART_FIELDS)
				throw new BadRequestException(format("Too many multipart fields. Maximum allowed is %s", MAXIMUM_MULTIPART_FIELDS));

			MultipartField multipartField = toMultipartField(headers, Arrays.copyOfRange(body, dataStart, dataEnd));

			if (multipartField != null)
				multipartFieldsByName.computeIfAbsent(multipartField.getName(), ignored -> new ArrayList<>()).add(multipartField);

			position = dataEnd + CRLF.length;
		}

		Map<String, List<MultipartField>> unmodifiable = new LinkedHashMap<>(multipartFieldsByName.size());

		for (Entry<String, List<MultipartField>> entry : multipartFieldsByName.entrySet())
			unmodifiable.put(entry.getKey(), List.copyOf(entry.getValue()));

		return Collections.unmodifiableMap(unmodifiable);
	}

	// Parts without a form-data name are skipped
	@Nullable
	private static MultipartField toMultipartField(@NonNull Map<String, String> headers,
																								 @NonNull byte[] data) {
		String contentDisposition = headers.get("Content-Disposition");

		if (contentDisposition == null)
			throw new BadRequestException("Multipart part is missing its Content-Disposition header");

		int semicolonIndex = contentDisposition.indexOf(';');
		String dispositionType = (semicolonIndex == -1 ? contentDisposition : contentDisposition.substring(0, semicolonIndex)).trim();

		if (!"form-data".equalsIgnoreCase(dispositionType))
			throw new BadRequestException(format("Unsupported multipart disposition '%s'", dispositionType));

		Map<String, String> parameters = semicolonIndex == -1 ? Map.of() : extractParameters(contentDisposition.substring(semicolonIndex + 1));
		String name = parameters.get("name");

		if (name == null || name.isEmpty())
			return null;

		String filename = parameters.get("filename");
		String contentTypeHeaderValue = headers.get("Content-Type");
		String contentType = Utilities.extractContentTypeFromHeaderValue(contentTypeHeaderValue).orElse(null);
		String charsetName = Utilities.extractCharsetNameFromHeaderValue(contentTypeHeaderValue).orElse(null);
		Charset charset = charsetName == null ? null : Utilities.charsetForName(charsetName, StandardCharsets.UTF_8);

		if (filename != null && (contentType == null || "application/octet-stream".equals(contentType))) {
			String guessedContentType = URLConnection.guessContentTypeFromName(filename);
			contentType = guessedContentType == null ? (contentType == null ? DEFAULT_FILE_CONTENT_TYPE : contentType) : guessedContentType;
		}

		return MultipartField.with(name, data)
				.filename(filename)
				.contentType(contentType)
				.charset(charset)
				.build();
	}

	@NonNull
	private static Map<String, String> parseHeaders(@NonNull String block) {
		Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (block.isEmpty())
			return headers;

		for (String line : block.split("\r\n")) {
			int colonIndex = line.indexOf(':');

			if (colonIndex <= 0)
				throw new BadRequestException(format("Malformed multipart header line '%s'", line));

			headers.put(line.substring(0, colonIndex).trim(), line.substring(colonIndex + 1).trim());
		}

		return headers;
	}

	// Parses "; name=value; other=\"quoted; value\"" into lowercased names and unquoted values
	@NonNull
	private static Map<String, String> extractParameters(@NonNull String parameters) {
		Map<String, String> values = new LinkedHashMap<>();
		int i = 0;

		while (i < parameters.length()) {
			while (i < parameters.length() && (parameters.charAt(i) == ';' || Character.isWhitespace(parameters.charAt(i))))
				++i;

			int nameStart = i;

			while (i < parameters.length() && parameters.charAt(i) != '=' && parameters.charAt(i) != ';')
				++i;

			String name = parameters.substring(nameStart, i).trim().toLowerCase(Locale.ROOT);

			if (i >= parameters.length() || parameters.charAt(i) == ';') {
				if (!name.isEmpty())
					values.put(name, "");

				continue;
			}

			++i;

			while (i < parameters.length() && Character.isWhitespace(parameters.charAt(i)))
				++i;

			StringBuilder value = new StringBuilder();

			if (i < parameters.length() && parameters.charAt(i) == '"') {
				++i;

				while (i < parameters.length() && parameters.charAt(i) != '"') {
					char c = parameters.charAt(i++);

					if (c == '\\' && i < parameters.length())
						c = parameters.charAt(i++);

					value.append(c);
				}

				if (i >= parameters.length())
					throw new BadRequestException(format("Unterminated quoted parameter '%s'", name));

				++i;
			} else {
				while (i < parameters.length() && parameters.charAt(i) != ';')
					value.append(parameters.charAt(i++));
			}

			if (!name.isEmpty())
				values.putIfAbsent(name, value.toString().trim());
		}

		return values;
	}

	// RFC 2046 bchars
	@NonNull
	private static Boolean isValidBoundary(@NonNull String boundary) {
		for (int i = 0; i < boundary.length(); i++) {
			char c = boundary.charAt(i);
			boolean alphanumeric = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');

			if (!alphanumeric && "'()+_,-./:=? ".indexOf(c) == -1)
				return false;
		}

		return boundary.charAt(boundary.length() - 1) != ' ';
	}

	@NonNull
	private static Boolean startsWith(@NonNull byte[] bytes,
																		int offset,
																		@NonNull byte[] prefix) {
		if (offset < 0 || offset + prefix.length > bytes.length)
			return false;

		for (int i = 0; i < prefix.length; i++)
			if (bytes[offset + i] != prefix[i])
				return false;

		return true;
	}

	private static int indexOf(@NonNull byte[] bytes,
														 @NonNull byte[] target,
														 int fromIndex) {
		for (int i = Math.max(fromIndex, 0); i <= bytes.length - target.length; i++)
			if (startsWith(bytes, i, target))
				return i;

		return -1;
	}
}
