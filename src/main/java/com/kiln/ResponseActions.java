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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps status codes to the actions which render them, for example the page shown for {@code 404 Not Found}.
 * <p>
 * Response actions are invoked by {@link ActionContext#raiseResponse(StatusCode)}, with the status already applied to
 * the context.  They receive {@link RouteArguments} holding the raised {@link StatusCode} under
 * {@value #STATUS_CODE_ARGUMENT_NAME}.  Codes without a registration are rendered by {@link StatusAction}.
 */
@ThreadSafe
public final class ResponseActions {
	/**
	 * Name of the route argument which carries the raised {@link StatusCode}.
	 */
	@NonNull
	public static final String STATUS_CODE_ARGUMENT_NAME = "statusCode";

	@NonNull
	private static final ActionFactory DEFAULT_ACTION_FACTORY;
	@NonNull
	private static final ResponseActions DEFAULT_INSTANCE;

	static {
		DEFAULT_ACTION_FACTORY = ActionFactory.of(StatusAction.class, routeArguments -> new StatusAction());
		DEFAULT_INSTANCE = builder().build();
	}

	@NonNull
	private final Map<StatusCode, ActionFactory> actionFactoriesByStatusCode;

	@NonNull
	public static ResponseActions withDefaults() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private ResponseActions(@NonNull Builder builder) {
		requireNonNull(builder);
		this.actionFactoriesByStatusCode = Collections.unmodifiableMap(new EnumMap<>(builder.actionFactoriesByStatusCode));
	}

	/**
	 * The factory registered for {@code statusCode}, or the default factory.
	 */
	@NonNull
	public ActionFactory getActionFactory(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		return this.actionFactoriesByStatusCode.getOrDefault(statusCode, DEFAULT_ACTION_FACTORY);
	}

	@NonNull
	RouteArguments routeArgumentsFor(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		return RouteArguments.of(Map.of(STATUS_CODE_ARGUMENT_NAME, statusCode));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{registeredStatusCodes=%s}", getClass().getSimpleName(), this.actionFactoriesByStatusCode.keySet());
	}

	/**
	 * Builder used to construct instances of {@link ResponseActions} via {@link ResponseActions#builder()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<StatusCode, ActionFactory> actionFactoriesByStatusCode;

		private Builder() {
			this.actionFactoriesByStatusCode = new EnumMap<>(StatusCode.class);
		}

		@NonNull
		public Builder register(@NonNull StatusCode statusCode,
														@NonNull ActionFactory actionFactory) {
			requireNonNull(statusCode);
			requireNonNull(actionFactory);

			this.actionFactoriesByStatusCode.put(statusCode, actionFactory);
			return this;
		}

		@NonNull
		public Builder register(@NonNull StatusCode statusCode,
														@NonNull Class<? extends Action> actionClass) {
			requireNonNull(actionClass);
			return register(statusCode, ActionFactory.forClass(actionClass));
		}

		@NonNull
		public ResponseActions build() {
			return new ResponseActions(this);
		}
	}
}
