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

import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Status codes Kiln raises itself or that actions commonly set, with the reason phrases written on status lines.
 * Actions may use numbers outside this list via {@link ActionContext#setStatus(Integer, String)}.
 */
public enum StatusCode {
	HTTP_100(100, "Continue"),
	HTTP_101(101, "Switching Protocols"),
	HTTP_200(200, "OK"),
	HTTP_201(201, "Created"),
	HTTP_202(202, "Accepted"),
	HTTP_204(204, "No Content"),
	HTTP_206(206, "Partial Content"),
	HTTP_301(301, "Moved Permanently"),
	HTTP_302(302, "Found"),
	HTTP_303(303, "See Other"),
	HTTP_304(304, "Not Modified"),
	HTTP_307(307, "Temporary Redirect"),
	HTTP_308(308, "Permanent Redirect"),
	HTTP_400(400, "Bad Request"),
	HTTP_401(401, "Unauthorized"),
	HTTP_403(403, "Forbidden"),
	HTTP_404(404, "Not Found"),
	HTTP_405(405, "Method Not Allowed"),
	HTTP_406(406, "Not Acceptable"),
	HTTP_408(408, "Request Timeout"),
	HTTP_409(409, "Conflict"),
	HTTP_410(410, "Gone"),
	HTTP_411(411, "Length Required"),
	HTTP_412(412, "Precondition Failed"),
	HTTP_413(413, "Content Too Large"),
	HTTP_414(414, "URI Too Long"),
	HTTP_415(415, "Unsupported Media Type"),
	HTTP_422(422, "Unprocessable Content"),
	HTTP_429(429, "Too Many Requests"),
	HTTP_431(431, "Request Header Fields Too Large"),
	HTTP_500(500, "Internal Server Error"),
	HTTP_501(501, "Not Implemented"),
	HTTP_502(502, "Bad Gateway"),
	HTTP_503(503, "Service Unavailable"),
	HTTP_504(504, "Gateway Timeout"),
	HTTP_505(505, "HTTP Version Not Supported");

	// Indexed by status number; codes are always three digits.
	@NonNull
	private static final StatusCode[] BY_NUMBER = new StatusCode[1000];

	static {
		for (StatusCode statusCode : values())
			BY_NUMBER[statusCode.statusCode] = statusCode;
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(int statusCode,
						 @NonNull String reasonPhrase) {
		this.statusCode = statusCode;
		this.reasonPhrase = requireNonNull(reasonPhrase);
	}

	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return statusCode >= 0 && statusCode < BY_NUMBER.length ? Optional.ofNullable(BY_NUMBER[statusCode]) : Optional.empty();
	}

	/**
	 * The reason phrase for {@code statusCode}, or {@code "Unknown"} for numbers this enum does not list.
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		return fromStatusCode(statusCode).map(StatusCode::getReasonPhrase).orElse("Unknown");
	}

	/**
	 * Whether responses with {@code statusCode} must be sent without a body: any {@code 1xx}, {@code 204} and
	 * {@code 304}, listed here or not.
	 */
	@NonNull
	public static Boolean forbidsBody(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return (statusCode >= 100 && statusCode < 200) || statusCode == 204 || statusCode == 304;
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}

	@Override
	public String toString() {
		return format("%d %s", this.statusCode, this.reasonPhrase);
	}
}
