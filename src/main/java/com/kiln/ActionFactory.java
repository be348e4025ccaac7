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

import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Creates a fresh {@link Action} for each matched request, given the arguments declared on the matching {@link Route}.
 * <p>
 * Every factory declares the class of the actions it creates, so Kiln can answer {@code 405 Method Not Allowed}
 * without instantiating anything.
 */
public interface ActionFactory {
	/**
	 * Creates an action instance.
	 *
	 * @param routeArguments the arguments declared on the matching route
	 * @return a new action
	 * @throws Exception if the action cannot be created
	 */
	@NonNull
	Action create(@NonNull RouteArguments routeArguments) throws Exception;

	/**
	 * The class of the actions this factory creates.  Its overridden verb methods decide which HTTP methods the route
	 * accepts.
	 *
	 * @return the action class
	 */
	@NonNull
	Class<? extends Action> getActionClass();

	/**
	 * Acquires a factory which instantiates {@code actionClass} reflectively, preferring a public constructor which
	 * accepts {@link RouteArguments} and otherwise using the no-argument constructor.
	 *
	 * @param actionClass the action class
	 * @return a reflective factory
	 * @throws IllegalArgumentException if {@code actionClass} has neither constructor
	 */
	@NonNull
	static ActionFactory forClass(@NonNull Class<? extends Action> actionClass) {
		requireNonNull(actionClass);
		return new ReflectiveActionFactory(actionClass);
	}

	/**
	 * Acquires a factory backed by a function, for example a constructor reference like {@code StaticAction::new}.
	 *
	 * @param actionClass the class of the actions created
	 * @param function    creates an action from route arguments
	 * @param <A>         the action type
	 * @return the factory
	 */
	@NonNull
	static <A extends Action> ActionFactory of(@NonNull Class<A> actionClass,
																						 @NonNull Function<RouteArguments, A> function) {
		requireNonNull(actionClass);
		requireNonNull(function);

		return new ActionFactory() {
			@NonNull
			@Override
			public Action create(@NonNull RouteArguments routeArguments) {
				A action = function.apply(routeArguments);

				if (!actionClass.isInstance(action))
					throw new IllegalStateException(format("Factory for %s returned %s", actionClass.getName(), action));

				return action;
			}

			@NonNull
			@Override
			public Class<? extends Action> getActionClass() {
				return actionClass;
			}
		};
	}
}
