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

import java.util.logging.Level;

/**
 * Kinds of {@link LogEvent} that Kiln reports through {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 */
public enum LogEventType {
	/**
	 * An action's factory or verb method threw.
	 */
	ACTION_FAILED(Level.SEVERE),
	/**
	 * A response action threw while rendering a status response, so a failsafe response was written instead.
	 */
	RESPONSE_ACTION_FAILED(Level.SEVERE),
	/**
	 * A deferred response was finished more than once, or an action threw after its response was already finished.
	 */
	RESPONSE_ALREADY_FINISHED(Level.WARNING),
	/**
	 * A dispatched request went unanswered for longer than the response timeout, so the connection answered
	 * {@code 503} and closed.
	 */
	RESPONSE_TIMED_OUT(Level.WARNING),
	/**
	 * A static file could not be read, so the action was told to respond some other way.
	 */
	STATIC_FILE_UNREADABLE(Level.WARNING),
	/**
	 * The request could not be parsed and a canned error response was written.
	 */
	SERVER_UNPARSEABLE_REQUEST(Level.FINE),
	/**
	 * An unexpected error occurred inside the reactor while servicing a channel.
	 */
	SERVER_INTERNAL_ERROR(Level.SEVERE),
	/**
	 * A {@link LifecycleObserver} method threw.
	 */
	LIFECYCLE_OBSERVER_FAILED(Level.WARNING),
	/**
	 * A worker process exited while Kiln was running.
	 */
	WORKER_EXITED(Level.WARNING),
	/**
	 * A worker process could not be launched.
	 */
	WORKER_LAUNCH_FAILED(Level.WARNING),
	/**
	 * Too many consecutive worker launches failed and the supervisor gave up.
	 */
	WORKER_RESTART_LIMIT_EXCEEDED(Level.SEVERE),
	/**
	 * An outbound request callback threw.
	 */
	OUTBOUND_CALLBACK_FAILED(Level.SEVERE);

	@NonNull
	private final Level level;

	LogEventType(@NonNull Level level) {
		this.level = level;
	}

	/**
	 * The level the default {@link LifecycleObserver} logs this kind of event at.
	 */
	@NonNull
	public Level getLevel() {
		return this.level;
	}
}
