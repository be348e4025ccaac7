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

import com.kiln.exception.RouteRegistrationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The path-matching half of a {@link Route}: an optional literal and an optional regular expression.
 * <ul>
 *   <li>Literal only: the path must equal the literal</li>
 *   <li>Literal and regex: the path must start with the literal and the remainder must fully match the regex</li>
 *   <li>Regex only: the whole path must fully match the regex</li>
 * </ul>
 * The regex may contain typed capture groups of the form {@code (label:subpattern)}, where {@code label} is either
 * {@code name} or {@code name@typeTag}.  With an explicit type tag, the tag must be known to {@link ParamCoercion}.
 * Without one, the name itself is used as the tag if {@link ParamCoercion} knows it (so {@code (number:\d+)} yields an
 * {@link Integer}) and the value is otherwise kept as a {@link String}.  Ordinary groups are matched but not exposed.
 */
@ThreadSafe
public final class RoutePattern {
	@NonNull
	private static final Pattern LABEL_PATTERN;

	static {
		LABEL_PATTERN = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(?:@([A-Za-z_][A-Za-z0-9_]*))?:");
	}

	@Nullable
	private final String literal;
	@Nullable
	private final String regex;
	@Nullable
	private final Pattern compiledRegex;
	@NonNull
	private final List<CaptureGroup> captureGroups;

	/**
	 * Compiles a pattern, failing fast on anything that could only fail later at request time.
	 *
	 * @param literal       the literal path or prefix, or {@code null}
	 * @param regex         the regular expression, or {@code null}
	 * @param paramCoercion the type tags available to capture groups
	 * @return the compiled pattern
	 * @throws RouteRegistrationException if both parts are missing, the regex does not compile, a type tag is unknown or a group name repeats
	 */
	@NonNull
	public static RoutePattern of(@Nullable String literal,
																@Nullable String regex,
																@NonNull ParamCoercion paramCoercion) {
		requireNonNull(paramCoercion);
		return new RoutePattern(literal, regex, paramCoercion);
	}

	private RoutePattern(@Nullable String literal,
											 @Nullable String regex,
											 @NonNull ParamCoercion paramCoercion) {
		if (literal != null && literal.isEmpty())
			literal = null;

		if (regex != null && regex.isEmpty())
			regex = null;

		if (literal == null && regex == null)
			throw new RouteRegistrationException("A route pattern needs a literal path, a regular expression, or both");

		this.literal = literal;
		this.regex = regex;

		if (regex == null) {
			this.compiledRegex = null;
			this.captureGroups = List.of();
			return;
		}

		List<CaptureGroup> captureGroups = new ArrayList<>();
		String javaRegex = rewriteCaptureGroups(regex, captureGroups, paramCoercion);

		try {
			this.compiledRegex = Pattern.compile(javaRegex);
		} catch (PatternSyntaxException e) {
			throw new RouteRegistrationException(format("Invalid regular expression '%s' in route pattern", regex), e);
		}

		this.captureGroups = Collections.unmodifiableList(captureGroups);
	}

	// Turns "(number:\d+)/(slug@word:\w+)" into "(?<kiln0>\d+)/(?<kiln1>\w+)".
	// Java group names cannot contain underscores, so generated names stand in for the declared ones.
	@NonNull
	private static String rewriteCaptureGroups(@NonNull String regex,
																						 @NonNull List<CaptureGroup> captureGroups,
																						 @NonNull ParamCoercion paramCoercion) {
		StringBuilder javaRegex = new StringBuilder(regex.length() + 16);
		Set<String> names = new LinkedHashSet<>();
		Matcher labelMatcher = LABEL_PATTERN.matcher(regex);
		boolean inCharacterClass = false;

		for (int i = 0; i < regex.length(); i++) {
			char c = regex.charAt(i);

			if (c == '\\') {
				javaRegex.append(c);

				if (i + 1 < regex.length())
					javaRegex.append(regex.charAt(++i));

				continue;
			}

			if (inCharacterClass) {
				if (c == ']')
					inCharacterClass = false;

				javaRegex.append(c);
				continue;
			}

			if (c == '[') {
				inCharacterClass = true;
				javaRegex.append(c);
				continue;
			}

			if (c == '(' && i + 1 < regex.length() && regex.charAt(i + 1) != '?') {
				labelMatcher.region(i + 1, regex.length());

				if (labelMatcher.lookingAt()) {
					String name = labelMatcher.group(1);
					String explicitTypeTag = labelMatcher.group(2);
					String typeTag;

					if (explicitTypeTag != null) {
						if (!paramCoercion.isKnownTypeTag(explicitTypeTag))
							throw new RouteRegistrationException(format("Unknown type tag '%s' for group '%s' in route pattern '%s'. Known tags are %s",
									explicitTypeTag, name, regex, paramCoercion.getTypeTags()));

						typeTag = explicitTypeTag;
					} else {
						typeTag = paramCoercion.isKnownTypeTag(name) ? name : null;
					}

					if (!names.add(name))
						throw new RouteRegistrationException(format("Duplicate group name '%s' in route pattern '%s'", name, regex));

					String groupName = "kiln" + captureGroups.size();
					captureGroups.add(new CaptureGroup(name, groupName, typeTag));
					javaRegex.append("(?<").append(groupName).append('>');
					i = labelMatcher.end() - 1;
					continue;
				}
			}

			javaRegex.append(c);
		}

		return javaRegex.toString();
	}

	/**
	 * Matches a path, returning the raw captured text of each typed group that participated in the match.
	 *
	 * @param path the decoded request path
	 * @return the captures by declared group name, or {@link Optional#empty()} if the path does not match
	 */
	@NonNull
	public Optional<Map<String, String>> match(@NonNull String path) {
		requireNonNull(path);

		if (this.compiledRegex == null)
			return path.equals(this.literal) ? Optional.of(Map.of()) : Optional.empty();

		String candidate = path;

		if (this.literal != null) {
			if (!path.startsWith(this.literal))
				return Optional.empty();

			candidate = path.substring(this.literal.length());
		}

		Matcher matcher = this.compiledRegex.matcher(candidate);

		if (!matcher.matches())
			return Optional.empty();

		if (this.captureGroups.isEmpty())
			return Optional.of(Map.of());

		Map<String, String> captures = new LinkedHashMap<>(this.captureGroups.size());

		for (CaptureGroup captureGroup : this.captureGroups) {
			String value = matcher.group(captureGroup.getGroupName());

			if (value != null)
				captures.put(captureGroup.getName(), value);
		}

		return Optional.of(captures);
	}

	@NonNull
	public Optional<String> getLiteral() {
		return Optional.ofNullable(this.literal);
	}

	@NonNull
	public Optional<String> getRegex() {
		return Optional.ofNullable(this.regex);
	}

	@NonNull
	public List<CaptureGroup> getCaptureGroups() {
		return this.captureGroups;
	}

	@Override
	@NonNull
	public String toString() {
		if (this.literal == null)
			return this.regex;

		return this.regex == null ? this.literal : this.literal + this.regex;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RoutePattern routePattern))
			return false;

		return Objects.equals(this.literal, routePattern.literal)
				&& Objects.equals(this.regex, routePattern.regex);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.literal, this.regex);
	}

	/**
	 * A typed capture group declared in a route's regex.
	 */
	@ThreadSafe
	public static final class CaptureGroup {
		@NonNull
		private final String name;
		@NonNull
		private final String groupName;
		@Nullable
		private final String typeTag;

		CaptureGroup(@NonNull String name,
								 @NonNull String groupName,
								 @Nullable String typeTag) {
			this.name = requireNonNull(name);
			this.groupName = requireNonNull(groupName);
			this.typeTag = typeTag;
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@NonNull
		String getGroupName() {
			return this.groupName;
		}

		/**
		 * The type tag used to coerce this group's value.
		 *
		 * @return the tag, or {@link Optional#empty()} if values stay strings
		 */
		@NonNull
		public Optional<String> getTypeTag() {
			return Optional.ofNullable(this.typeTag);
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{name=%s, typeTag=%s}", getClass().getSimpleName(), getName(), this.typeTag);
		}
	}
}
