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
 * A registration entry in a {@link RouteTable}: a path pattern, the action it resolves to, and the arguments handed to
 * the action's factory on every match.
 */
@ThreadSafe
public final class Route {
	@NonNull
	private final RoutePattern routePattern;
	@NonNull
	private final ActionReference actionReference;
	@NonNull
	private final RouteArguments routeArguments;

	Route(@NonNull RoutePattern routePattern,
				@NonNull ActionReference actionReference,
				@NonNull RouteArguments routeArguments) {
		requireNonNull(routePattern);
		requireNonNull(actionReference);
		requireNonNull(routeArguments);

		this.routePattern = routePattern;
		this.actionReference = actionReference;
		this.routeArguments = routeArguments;
	}

	@NonNull
	public RoutePattern getRoutePattern() {
		return this.routePattern;
	}

	@NonNull
	public ActionReference getActionReference() {
		return this.actionReference;
	}

	@NonNull
	public RouteArguments getRouteArguments() {
		return this.routeArguments;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{pattern=%s, action=%s}", getClass().getSimpleName(), getRoutePattern(), getActionReference());
	}
}
