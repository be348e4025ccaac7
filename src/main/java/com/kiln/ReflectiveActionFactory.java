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
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Instantiates actions through their {@code (RouteArguments)} or no-argument constructor.
 */
@ThreadSafe
final class ReflectiveActionFactory implements ActionFactory {
	@NonNull
	private final Class<? extends Action> actionClass;
	@NonNull
	private final Constructor<? extends Action> constructor;
	@NonNull
	private final Boolean acceptsRouteArguments;

	ReflectiveActionFactory(@NonNull Class<? extends Action> actionClass) {
		requireNonNull(actionClass);

		this.actionClass = actionClass;

		Constructor<? extends Action> constructor;
		boolean acceptsRouteArguments;

		try {
			constructor = actionClass.getConstructor(RouteArguments.class);
			acceptsRouteArguments = true;
		} catch (NoSuchMethodException e) {
			try {
				constructor = actionClass.getConstructor();
				acceptsRouteArguments = false;
			} catch (NoSuchMethodException e2) {
				throw new IllegalArgumentException(format("Unable to create instances of %s because it has no public constructor "
						+ "accepting %s and no public no-argument constructor. Register an %s instead", actionClass.getName(),
						RouteArguments.class.getSimpleName(), ActionFactory.class.getSimpleName()), e2);
			}
		}

		this.constructor = constructor;
		this.acceptsRouteArguments = acceptsRouteArguments;
	}

	@NonNull
	@Override
	public Action create(@NonNull RouteArguments routeArguments) throws Exception {
		requireNonNull(routeArguments);

		try {
			return this.acceptsRouteArguments ? this.constructor.newInstance(routeArguments) : this.constructor.newInstance();
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();

			if (cause instanceof Exception exception)
				throw exception;
			if (cause instanceof Error error)
				throw error;

			throw e;
		}
	}

	@NonNull
	@Override
	public Class<? extends Action> getActionClass() {
		return this.actionClass;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{actionClass=%s}", getClass().getSimpleName(), this.actionClass.getName());
	}
}
