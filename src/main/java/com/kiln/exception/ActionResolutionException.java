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

package com.kiln.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a named action reference cannot be turned into an action factory at match time,
 * for example because the dotted class name it refers to is not on the classpath.
 */
@NotThreadSafe
public final class ActionResolutionException extends RuntimeException {
	@NonNull
	private final String actionName;

	public ActionResolutionException(@Nullable String message,
																	 @Nullable Throwable cause,
																	 @NonNull String actionName) {
		super(message, cause);
		this.actionName = requireNonNull(actionName);
	}

	@NonNull
	public String getActionName() {
		return this.actionName;
	}
}
