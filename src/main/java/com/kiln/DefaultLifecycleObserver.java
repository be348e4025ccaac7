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
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes an access line per finished request to the {@code com.kiln.access} logger at {@link Level#FINE}.
 */
@ThreadSafe
final class DefaultLifecycleObserver implements LifecycleObserver {
	@NonNull
	private static final DefaultLifecycleObserver DEFAULT_INSTANCE = new DefaultLifecycleObserver();

	@NonNull
	private final Logger accessLogger;

	@NonNull
	static DefaultLifecycleObserver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultLifecycleObserver() {
		this.accessLogger = Logger.getLogger("com.kiln.access");
	}

	@Override
	public void didFinishRequestHandling(@NonNull Request request,
																			 @Nullable RouteMatch routeMatch,
																			 @NonNull MarshaledResponse marshaledResponse,
																			 @NonNull Duration duration,
																			 @NonNull List<@NonNull Throwable> throwables) {
		if (!this.accessLogger.isLoggable(Level.FINE))
			return;

		this.accessLogger.fine(String.format("%s %s %s %d %d bytes %.1fms%s", request.getMethodToken(), request.getTarget(),
				request.getProtocol(), marshaledResponse.getStatusCode(), marshaledResponse.getBody().length,
				duration.toNanos() / 1_000_000D, throwables.isEmpty() ? "" : " (" + throwables.size() + " failures)"));
	}
}
