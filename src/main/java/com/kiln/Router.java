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
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Resolves request paths against the currently published {@link RouteTable}.
 * <p>
 * The table is swapped atomically by {@link #reload(RouteTable)}, so a resolution always sees one complete table.
 */
@ThreadSafe
public final class Router {
	@NonNull
	private static final Logger logger;

	static {
		logger = Logger.getLogger(Router.class.getName());
	}

	@NonNull
	private final AtomicReference<RouteTable> routeTable;
	@NonNull
	private final ActionRegistry actionRegistry;

	public Router(@NonNull RouteTable routeTable,
								@NonNull ActionRegistry actionRegistry) {
		requireNonNull(routeTable);
		requireNonNull(actionRegistry);

		this.routeTable = new AtomicReference<>(routeTable);
		this.actionRegistry = actionRegistry;
	}

	/**
	 * Resolves a request to a route.
	 * <p>
	 * The method does not take part in matching; whether the matched action supports it is decided at dispatch.
	 *
	 * @param httpMethod the request's method, or {@code null} if unsupported
	 * @param path       the decoded request path
	 * @return the match, or {@link Optional#empty()} on a routing miss
	 */
	@NonNull
	public Optional<RouteMatch> resolve(@Nullable HttpMethod httpMethod,
																			@NonNull String path) {
		requireNonNull(path);

		Optional<RouteMatch> routeMatch = this.routeTable.get().resolve(path, this.actionRegistry);

		if (routeMatch.isEmpty())
			logger.finer(format("No route matches %s %s", httpMethod == null ? "(unsupported method)" : httpMethod.name(), path));

		return routeMatch;
	}

	/**
	 * Atomically publishes a new route table.  Requests already resolved keep the route they matched.
	 *
	 * @param routeTable the table to publish
	 * @return the table that was replaced
	 */
	@NonNull
	public RouteTable reload(@NonNull RouteTable routeTable) {
		requireNonNull(routeTable);

		RouteTable previous = this.routeTable.getAndSet(routeTable);
		logger.info(format("Published a new route table with %d routes", routeTable.getRoutes().size()));
		return previous;
	}

	@NonNull
	public RouteTable getRouteTable() {
		return this.routeTable.get();
	}

	@NonNull
	public ActionRegistry getActionRegistry() {
		return this.actionRegistry;
	}
}
