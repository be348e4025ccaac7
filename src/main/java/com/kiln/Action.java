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

/**
 * Handles requests for the routes it is registered under.
 * <p>
 * An instance is created for every matched request, so fields may safely hold request-scoped state.  Kiln invokes the
 * method named after the request's HTTP method, in lowercase: a {@code POST} is handled by {@link #post(ActionContext)}.
 * <p>
 * Only overridden methods count as supported.  A request whose method is not overridden receives
 * {@code 405 Method Not Allowed} and the action is never instantiated.  {@code HEAD} requests fall back to
 * {@link #get(ActionContext)} when {@link #head(ActionContext)} is not overridden.
 * <p>
 * Responses are produced through the context:
 * <pre>{@code public class ValidateAction implements Action {
 *   @Override
 *   public void get(ActionContext context) {
 *     Integer number = context.getParams().getInteger("number").orElseThrow();
 *     context.setContentType("text/plain; charset=UTF-8");
 *     context.composeHeaders();
 *     context.write("Number is " + number);
 *   }
 * }}</pre>
 */
public interface Action {
	default void get(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void head(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void post(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void put(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void patch(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void delete(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void options(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void trace(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}

	default void connect(@NonNull ActionContext context) throws Exception {
		context.raiseResponse(StatusCode.HTTP_405);
	}
}
