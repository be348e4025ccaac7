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

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The result of resolving a request path: the matching route, its resolved factory and arguments, and the typed parameters
 * captured from the path.
 */
@ThreadSafe
public final class RouteMatch {
	@NonNull
	private final Route route;
	@NonNull
	private final ActionFactory actionFactory;
	@NonNull
	private final RouteParameters routeParameters;

	RouteMatch(@NonNull Route route,
						 @NonNull ActionFactory actionFactory,
						 @NonNull RouteParameters routeParameters) {
		requireNonNull(route);
		requireNonNull(actionFactory);
		requireNonNull(routeParameters);

		this.route = route;
		this.actionFactory = actionFactory;
		this.routeParameters = routeParameters;
	}

	@NonNull
	public Route getRoute() {
		return this.route;
	}

	@NonNull
	public ActionFactory getActionFactory() {
		return this.actionFactory;
	}

	@NonNull
	public RouteArguments getRouteArguments() {
		return this.route.getRouteArguments();
	}

	@NonNull
	public RouteParameters getRouteParameters() {
		return this.routeParameters;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{route=%s, routeParameters=%s}", getClass().getSimpleName(), getRoute(), getRouteParameters());
	}
}
