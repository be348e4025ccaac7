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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The response action used for any status code without a registration in {@link ResponseActions}.
 * <p>
 * Renders {@code <html><body><h1>404 Not Found</h1></body></html>} for every HTTP method.  Subclasses can override
 * {@link #render(ActionContext)} to change the page for all methods at once.
 */
public class StatusAction implements Action {
	@Override
	public void get(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void head(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void post(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void put(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void patch(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void delete(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void options(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void trace(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	@Override
	public void connect(@NonNull ActionContext context) throws Exception {
		render(context);
	}

	protected void render(@NonNull ActionContext context) throws Exception {
		requireNonNull(context);

		context.setContentType("text/html; charset=UTF-8");
		context.composeHeaders();

		if (!StatusCode.forbidsBody(context.getStatusCode()))
			context.write(format("<html><body><h1>%d %s</h1></body></html>", context.getStatusCode(), context.getReasonPhrase()));
	}
}
