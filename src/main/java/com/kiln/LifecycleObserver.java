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

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Read-only hooks into Kiln's lifecycle: startup and shutdown, connections, request handling, and worker processes.
 * <p>
 * Methods are invoked on the thread that performed the work, which for connection and request events is the reactor
 * thread, so implementations must not block.  Exceptions thrown by implementations are logged and otherwise ignored.
 * <p>
 * {@link #defaultInstance()} writes an access log and otherwise relies on these defaults.
 */
public interface LifecycleObserver {
	/**
	 * Called before Kiln starts.
	 */
	default void willStartKiln(@NonNull Kiln kiln) {
		// No-op by default
	}

	/**
	 * Called after Kiln starts, either as a single process, a worker, or a supervising parent.
	 */
	default void didStartKiln(@NonNull Kiln kiln) {
		// No-op by default
	}

	/**
	 * Called if Kiln failed to start.
	 */
	default void didFailToStartKiln(@NonNull Kiln kiln,
																	@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before Kiln stops.
	 */
	default void willStopKiln(@NonNull Kiln kiln) {
		// No-op by default
	}

	/**
	 * Called after Kiln stops.
	 */
	default void didStopKiln(@NonNull Kiln kiln) {
		// No-op by default
	}

	/**
	 * Called after a listener accepts an inbound connection.
	 */
	default void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called after an inbound connection is closed.
	 */
	default void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called after a request has been fully parsed, before routing.
	 */
	default void didStartRequestHandling(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called once the response for a request is final, before it is written.
	 *
	 * @param request           the request
	 * @param routeMatch        the matched route, or {@code null} if routing missed or failed
	 * @param marshaledResponse the response about to be written
	 * @param duration          time from dispatch to completion
	 * @param throwables        anything thrown during handling, in order of occurrence
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@Nullable RouteMatch routeMatch,
																				@NonNull MarshaledResponse marshaledResponse,
																				@NonNull Duration duration,
																				@NonNull List<@NonNull Throwable> throwables) {
		// No-op by default
	}

	/**
	 * Called after a worker process is launched, including restarts.
	 */
	default void didStartWorker(@NonNull Integer workerId,
															@NonNull Long pid) {
		// No-op by default
	}

	/**
	 * Called when a worker process exits while Kiln is running.
	 */
	default void didDetectWorkerExit(@NonNull Integer workerId,
																	 @NonNull Long pid,
																	 @NonNull Integer exitCode) {
		// No-op by default
	}

	/**
	 * Called when a worker could not be relaunched and the supervisor has given up.
	 */
	default void didFailToRestartWorker(@NonNull Integer workerId,
																			@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when Kiln emits a log event.
	 * <p>
	 * The default implementation writes {@link LogEvent#describe()} to the {@code com.kiln} {@link Logger} at the
	 * event type's {@link LogEventType#getLevel() level}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		Logger.getLogger("com.kiln").log(logEvent.getLogEventType().getLevel(), logEvent.describe(), logEvent.getThrowable().orElse(null));
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
