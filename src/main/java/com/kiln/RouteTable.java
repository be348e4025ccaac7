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

import com.kiln.converter.ValueConversionException;
import com.kiln.exception.IllegalRouteParameterException;
import com.kiln.exception.RouteRegistrationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered, immutable collection of {@link Route} instances.
 * <p>
 * Routes are evaluated in registration order and the first match wins.  Every pattern is compiled and validated when the
 * table is built, so an unknown type tag or a bad regex fails at startup rather than on some later request.
 * <p>
 * Example:
 * <pre>{@code RouteTable routeTable = RouteTable.builder()
 *   .literal("/", HomeAction.class)
 *   .prefixed("/validate/", "(number:\\d+)/(word:\\w+)", ValidateAction.class)
 *   .route("/static/", "(file:.+)", ActionReference.of(StaticAction.class), Map.of("root", "/srv/www"))
 *   .regex("/reports/(id@uuid:[0-9a-f-]{36})", ActionReference.named("com.example.ReportAction"))
 *   .group("/api/", apiRouteTable)
 *   .build();}</pre>
 */
@ThreadSafe
public final class RouteTable {
	@NonNull
	private final List<Route> routes;
	@NonNull
	private final ParamCoercion paramCoercion;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private RouteTable(@NonNull Builder builder) {
		requireNonNull(builder);

		this.paramCoercion = builder.paramCoercion;

		List<Route> routes = new ArrayList<>(builder.registrations.size());

		for (Registration registration : builder.registrations)
			routes.add(new Route(RoutePattern.of(registration.literal, registration.regex, this.paramCoercion),
					registration.actionReference, registration.routeArguments));

		this.routes = Collections.unmodifiableList(routes);
	}

	/**
	 * Walks the table in order and resolves the first route whose pattern matches {@code path}.
	 * <p>
	 * Resolution has no side effects: the same table and path always produce the same outcome.
	 *
	 * @param path           the decoded request path
	 * @param actionRegistry resolves named action references
	 * @return the match, or {@link Optional#empty()} if no route matches
	 * @throws IllegalRouteParameterException                if a captured value cannot be coerced to its group's type
	 * @throws com.kiln.exception.ActionResolutionException if the matching route's named action cannot be resolved
	 */
	@NonNull
	public Optional<RouteMatch> resolve(@NonNull String path,
																			@NonNull ActionRegistry actionRegistry) {
		requireNonNull(path);
		requireNonNull(actionRegistry);

		for (Route route : this.routes) {
			Optional<Map<String, String>> captures = route.getRoutePattern().match(path);

			if (captures.isEmpty())
				continue;

			RouteParameters routeParameters = coerce(route, captures.get());
			return Optional.of(new RouteMatch(route, route.getActionReference().resolve(actionRegistry), routeParameters));
		}

		return Optional.empty();
	}

	@NonNull
	private RouteParameters coerce(@NonNull Route route,
																 @NonNull Map<String, String> captures) {
		if (captures.isEmpty())
			return RouteParameters.empty();

		Map<String, Object> values = new LinkedHashMap<>(captures.size());

		for (RoutePattern.CaptureGroup captureGroup : route.getRoutePattern().getCaptureGroups()) {
			String rawValue = captures.get(captureGroup.getName());

			if (rawValue == null)
				continue;

			String typeTag = captureGroup.getTypeTag().orElse(null);

			try {
				values.put(captureGroup.getName(), this.paramCoercion.coerce(typeTag, rawValue));
			} catch (ValueConversionException e) {
				throw new IllegalRouteParameterException(format("Illegal value '%s' for route parameter '%s' of type '%s'",
						rawValue, captureGroup.getName(), typeTag), e, captureGroup.getName(), rawValue);
			}
		}

		return RouteParameters.of(values);
	}

	@NonNull
	public List<Route> getRoutes() {
		return this.routes;
	}

	@NonNull
	public ParamCoercion getParamCoercion() {
		return this.paramCoercion;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{routes=%s}", getClass().getSimpleName(), getRoutes());
	}

	@NotThreadSafe
	private static final class Registration {
		@Nullable
		private final String literal;
		@Nullable
		private final String regex;
		@NonNull
		private final ActionReference actionReference;
		@NonNull
		private final RouteArguments routeArguments;

		private Registration(@Nullable String literal,
												 @Nullable String regex,
												 @NonNull ActionReference actionReference,
												 @NonNull RouteArguments routeArguments) {
			this.literal = literal;
			this.regex = regex;
			this.actionReference = requireNonNull(actionReference);
			this.routeArguments = requireNonNull(routeArguments);
		}
	}

	/**
	 * Builder used to construct instances of {@link RouteTable}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final List<Registration> registrations;
		@NonNull
		private ParamCoercion paramCoercion;

		private Builder() {
			this.registrations = new ArrayList<>();
			this.paramCoercion = ParamCoercion.withDefaults();
		}

		/**
		 * The type tags available to this table's capture groups.
		 *
		 * @param paramCoercion the type tags
		 * @return this builder
		 */
		@NonNull
		public Builder paramCoercion(@NonNull ParamCoercion paramCoercion) {
			this.paramCoercion = requireNonNull(paramCoercion);
			return this;
		}

		/**
		 * Appends a route.
		 *
		 * @param pattern         the literal path, or the literal prefix if {@code regex} is present. May be {@code null} if {@code regex} is present
		 * @param regex           the regex which must fully match the path (or the part after {@code pattern}), or {@code null}
		 * @param actionReference the action
		 * @param routeArguments  arguments handed to the action's factory, or {@code null} for none
		 * @return this builder
		 */
		@NonNull
		public Builder route(@Nullable String pattern,
												 @Nullable String regex,
												 @NonNull ActionReference actionReference,
												 @Nullable Map<String, ?> routeArguments) {
			requireNonNull(actionReference);

			this.registrations.add(new Registration(pattern, regex, actionReference,
					routeArguments == null ? RouteArguments.empty() : RouteArguments.of(routeArguments)));

			return this;
		}

		@NonNull
		public Builder literal(@NonNull String path,
													 @NonNull Class<? extends Action> actionClass) {
			requireNonNull(path);
			return route(path, null, ActionReference.of(actionClass), null);
		}

		@NonNull
		public Builder literal(@NonNull String path,
													 @NonNull ActionReference actionReference) {
			requireNonNull(path);
			return route(path, null, actionReference, null);
		}

		@NonNull
		public Builder regex(@NonNull String regex,
												 @NonNull Class<? extends Action> actionClass) {
			requireNonNull(regex);
			return route(null, regex, ActionReference.of(actionClass), null);
		}

		@NonNull
		public Builder regex(@NonNull String regex,
												 @NonNull ActionReference actionReference) {
			requireNonNull(regex);
			return route(null, regex, actionReference, null);
		}

		@NonNull
		public Builder prefixed(@NonNull String prefix,
														@NonNull String regex,
														@NonNull Class<? extends Action> actionClass) {
			requireNonNull(prefix);
			requireNonNull(regex);
			return route(prefix, regex, ActionReference.of(actionClass), null);
		}

		@NonNull
		public Builder prefixed(@NonNull String prefix,
														@NonNull String regex,
														@NonNull ActionReference actionReference) {
			requireNonNull(prefix);
			requireNonNull(regex);
			return route(prefix, regex, actionReference, null);
		}

		/**
		 * Appends every route of {@code routeTable} beneath {@code prefix}, in the child table's order.
		 * <p>
		 * The prefix is consumed before the child's patterns are matched, so a child literal of {@code "users"} under a
		 * prefix of {@code "/api/"} serves {@code /api/users} and a child regex only sees the text after the prefix.
		 * Child patterns are recompiled against this builder's {@link ParamCoercion}.
		 *
		 * @param prefix     the literal path prefix shared by the group
		 * @param routeTable the routes to mount
		 * @return this builder
		 */
		@NonNull
		public Builder group(@NonNull String prefix,
												 @NonNull RouteTable routeTable) {
			requireNonNull(prefix);
			requireNonNull(routeTable);

			if (prefix.isEmpty())
				throw new RouteRegistrationException("A route group needs a non-empty prefix");

			for (Route route : routeTable.getRoutes()) {
				RoutePattern routePattern = route.getRoutePattern();
				String literal = prefix + routePattern.getLiteral().orElse("");
				this.registrations.add(new Registration(literal, routePattern.getRegex().orElse(null),
						route.getActionReference(), route.getRouteArguments()));
			}

			return this;
		}

		/**
		 * Compiles every registered pattern and builds the table.
		 *
		 * @return the table
		 * @throws com.kiln.exception.RouteRegistrationException if any pattern is invalid
		 */
		@NonNull
		public RouteTable build() {
			return new RouteTable(this);
		}
	}
}
