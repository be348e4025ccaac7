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
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A cookie as written in a {@code Set-Cookie} response header.
 * <p>
 * Used both for cookies an action sets via {@link ActionContext#setCookie(ResponseCookie)} and for cookies parsed from
 * an {@link OutboundResponse}.
 */
@ThreadSafe
public final class ResponseCookie {
	@NonNull
	private static final Pattern COOKIE_NAME_PATTERN;
	@NonNull
	private static final Pattern COOKIE_VALUE_PATTERN;

	static {
		COOKIE_NAME_PATTERN = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");
		// RFC 6265 cookie-octets, optionally wrapped in double quotes
		COOKIE_VALUE_PATTERN = Pattern.compile("\"?[\\x21\\x23-\\x2B\\x2D-\\x3A\\x3C-\\x5B\\x5D-\\x7E]*\"?");
	}

	@NonNull
	private final String name;
	@NonNull
	private final String value;
	@Nullable
	private final Duration maxAge;
	@Nullable
	private final Instant expires;
	@Nullable
	private final String domain;
	@Nullable
	private final String path;
	@NonNull
	private final Boolean secure;
	@NonNull
	private final Boolean httpOnly;
	@Nullable
	private final SameSite sameSite;

	@NonNull
	public static Builder with(@NonNull String name,
														 @Nullable String value) {
		requireNonNull(name);
		return new Builder(name, value);
	}

	/**
	 * Parses a {@code Set-Cookie} header value.  Unrecognized attributes are ignored.
	 *
	 * @param setCookieHeaderValue the header value, for example {@code id=a3fWa; Path=/; HttpOnly}
	 * @return the cookie, or {@link Optional#empty()} if the value has no usable {@code name=value} pair
	 */
	@NonNull
	public static Optional<ResponseCookie> fromSetCookieHeaderValue(@Nullable String setCookieHeaderValue) {
		if (setCookieHeaderValue == null)
			return Optional.empty();

		String[] components = setCookieHeaderValue.split(";");
		String nameValuePair = components[0].trim();
		int equalsIndex = nameValuePair.indexOf('=');

		if (equalsIndex <= 0)
			return Optional.empty();

		String name = nameValuePair.substring(0, equalsIndex).trim();
		String value = nameValuePair.substring(equalsIndex + 1).trim();

		if (!COOKIE_NAME_PATTERN.matcher(name).matches())
			return Optional.empty();

		Builder builder = new Builder(name, value);

		for (int i = 1; i < components.length; ++i) {
			String component = components[i].trim();

			if (component.isEmpty())
				continue;

			int attributeEqualsIndex = component.indexOf('=');
			String attributeName = (attributeEqualsIndex == -1 ? component : component.substring(0, attributeEqualsIndex)).trim().toLowerCase(Locale.ROOT);
			String attributeValue = attributeEqualsIndex == -1 ? null : component.substring(attributeEqualsIndex + 1).trim();

			switch (attributeName) {
				case "path" -> builder.path(attributeValue);
				case "domain" -> builder.domain(attributeValue);
				case "secure" -> builder.secure(true);
				case "httponly" -> builder.httpOnly(true);
				case "samesite" -> builder.sameSite(attributeValue == null ? null : SameSite.fromHeaderValue(attributeValue).orElse(null));
				case "max-age" -> {
					try {
						if (attributeValue != null)
							builder.maxAge(Duration.ofSeconds(Long.parseLong(attributeValue)));
					} catch (NumberFormatException ignored) {
						// Per RFC 6265 5.2.2, an unparseable Max-Age is ignored
					}
				}
				case "expires" -> {
					try {
						if (attributeValue != null)
							builder.expires(ZonedDateTime.parse(attributeValue, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
					} catch (DateTimeParseException ignored) {
						// Per RFC 6265 5.2.1, an unparseable Expires is ignored
					}
				}
				default -> {
					// Unknown attributes are ignored
				}
			}
		}

		try {
			return Optional.of(builder.build());
		} catch (IllegalArgumentException e) {
			return Optional.empty();
		}
	}

	private ResponseCookie(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name;
		this.value = builder.value == null ? "" : builder.value;
		this.maxAge = builder.maxAge;
		this.expires = builder.expires;
		this.domain = builder.domain;
		this.path = builder.path;
		this.secure = builder.secure == null ? false : builder.secure;
		this.httpOnly = builder.httpOnly == null ? false : builder.httpOnly;
		this.sameSite = builder.sameSite;

		if (!COOKIE_NAME_PATTERN.matcher(this.name).matches())
			throw new IllegalArgumentException(format("Illegal cookie name '%s'", this.name));

		if (!COOKIE_VALUE_PATTERN.matcher(this.value).matches())
			throw new IllegalArgumentException(format("Illegal value for cookie '%s'", this.name));

		if (this.path != null && (this.path.contains(";") || this.path.chars().anyMatch(Character::isISOControl)))
			throw new IllegalArgumentException(format("Illegal path for cookie '%s'", this.name));

		if (this.domain != null && (this.domain.contains(";") || this.domain.chars().anyMatch(Character::isWhitespace)))
			throw new IllegalArgumentException(format("Illegal domain for cookie '%s'", this.name));
	}

	/**
	 * Formats this cookie as a {@code Set-Cookie} header value.
	 *
	 * @return the header value
	 */
	@NonNull
	public String toSetCookieHeaderValue() {
		List<String> components = new ArrayList<>(8);

		components.add(format("%s=%s", getName(), getValue()));

		if (getPath().isPresent())
			components.add(format("Path=%s", getPath().get()));

		if (getDomain().isPresent())
			components.add(format("Domain=%s", getDomain().get()));

		if (getExpires().isPresent())
			components.add(format("Expires=%s", Utilities.formatHttpDate(getExpires().get())));

		if (getMaxAge().isPresent())
			components.add(format("Max-Age=%d", Math.max(0, getMaxAge().get().toSeconds())));

		if (getSecure())
			components.add("Secure");

		if (getHttpOnly())
			components.add("HttpOnly");

		if (getSameSite().isPresent())
			components.add(format("SameSite=%s", getSameSite().get().getHeaderValue()));

		return String.join("; ", components);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getValue(), getMaxAge(), getExpires(), getDomain(), getPath(), getSecure(),
				getHttpOnly(), getSameSite());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResponseCookie responseCookie))
			return false;

		return Objects.equals(getName(), responseCookie.getName())
				&& Objects.equals(getValue(), responseCookie.getValue())
				&& Objects.equals(getMaxAge(), responseCookie.getMaxAge())
				&& Objects.equals(getExpires(), responseCookie.getExpires())
				&& Objects.equals(getDomain(), responseCookie.getDomain())
				&& Objects.equals(getPath(), responseCookie.getPath())
				&& Objects.equals(getSecure(), responseCookie.getSecure())
				&& Objects.equals(getHttpOnly(), responseCookie.getHttpOnly())
				&& Objects.equals(getSameSite(), responseCookie.getSameSite());
	}

	@Override
	@NonNull
	public String toString() {
		return toSetCookieHeaderValue();
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public String getValue() {
		return this.value;
	}

	@NonNull
	public Optional<Duration> getMaxAge() {
		return Optional.ofNullable(this.maxAge);
	}

	@NonNull
	public Optional<Instant> getExpires() {
		return Optional.ofNullable(this.expires);
	}

	@NonNull
	public Optional<String> getDomain() {
		return Optional.ofNullable(this.domain);
	}

	@NonNull
	public Optional<String> getPath() {
		return Optional.ofNullable(this.path);
	}

	@NonNull
	public Boolean getSecure() {
		return this.secure;
	}

	@NonNull
	public Boolean getHttpOnly() {
		return this.httpOnly;
	}

	@NonNull
	public Optional<SameSite> getSameSite() {
		return Optional.ofNullable(this.sameSite);
	}

	public enum SameSite {
		STRICT("Strict"),
		LAX("Lax"),
		NONE("None");

		@NonNull
		private final String headerValue;

		SameSite(@NonNull String headerValue) {
			requireNonNull(headerValue);
			this.headerValue = headerValue;
		}

		@NonNull
		public static Optional<SameSite> fromHeaderValue(@NonNull String headerValue) {
			requireNonNull(headerValue);

			headerValue = headerValue.trim();

			for (SameSite sameSite : values())
				if (headerValue.equalsIgnoreCase(sameSite.getHeaderValue()))
					return Optional.of(sameSite);

			return Optional.empty();
		}

		@NonNull
		public String getHeaderValue() {
			return this.headerValue;
		}
	}

	/**
	 * Builder used to construct instances of {@link ResponseCookie} via {@link ResponseCookie#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String name;
		@Nullable
		private final String value;
		@Nullable
		private Duration maxAge;
		@Nullable
		private Instant expires;
		@Nullable
		private String domain;
		@Nullable
		private String path;
		@Nullable
		private Boolean secure;
		@Nullable
		private Boolean httpOnly;
		@Nullable
		private SameSite sameSite;

		private Builder(@NonNull String name,
										@Nullable String value) {
			requireNonNull(name);
			this.name = name;
			this.value = value;
		}

		@NonNull
		public Builder maxAge(@Nullable Duration maxAge) {
			this.maxAge = maxAge;
			return this;
		}

		@NonNull
		public Builder expires(@Nullable Instant expires) {
			this.expires = expires;
			return this;
		}

		@NonNull
		public Builder domain(@Nullable String domain) {
			this.domain = domain;
			return this;
		}

		@NonNull
		public Builder path(@Nullable String path) {
			this.path = path;
			return this;
		}

		@NonNull
		public Builder secure(@Nullable Boolean secure) {
			this.secure = secure;
			return this;
		}

		@NonNull
		public Builder httpOnly(@Nullable Boolean httpOnly) {
			this.httpOnly = httpOnly;
			return this;
		}

		@NonNull
		public Builder sameSite(@Nullable SameSite sameSite) {
			this.sameSite = sameSite;
			return this;
		}

		@NonNull
		public ResponseCookie build() {
			return new ResponseCookie(this);
		}
	}
}
