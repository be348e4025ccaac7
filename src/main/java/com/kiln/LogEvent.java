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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Something worth reporting that Kiln recovered from, delivered to
 * {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 * <p>
 * Events raised while handling a request carry that request.  Events raised by a worker process or the supervisor
 * carry the worker id.
 */
@ThreadSafe
public final class LogEvent {
	@NonNull
	private final LogEventType logEventType;
	@NonNull
	private final String message;
	@Nullable
	private final Throwable throwable;
	@Nullable
	private final Request request;
	@Nullable
	private final Integer workerId;

	@NonNull
	public static Builder with(@NonNull LogEventType logEventType,
														 @NonNull String message) {
		return new Builder(requireNonNull(logEventType), requireNonNull(message));
	}

	private LogEvent(@NonNull Builder builder) {
		this.logEventType = builder.logEventType;
		this.message = builder.message;
		this.throwable = builder.throwable;
		this.request = builder.request;
		this.workerId = builder.workerId;
	}

	/**
	 * One line for a log file: type, worker and request target where known, then the message.
	 */
	@NonNull
	public String describe() {
		StringBuilder description = new StringBuilder("[").append(this.logEventType.name()).append(']');

		if (this.workerId != null)
			description.append(" worker=").append(this.workerId);

		if (this.request != null)
			description.append(' ').append(this.request.getMethodToken()).append(' ').append(this.request.getTarget());

		return description.append(' ').append(this.message).toString();
	}

	@Override
	@NonNull
	public String toString() {
		return String.format("%s{%s}", getClass().getSimpleName(), describe());
	}

	@NonNull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	@NonNull
	public String getMessage() {
		return this.message;
	}

	@NonNull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	@NonNull
	public Optional<Request> getRequest() {
		return Optional.ofNullable(this.request);
	}

	@NonNull
	public Optional<Integer> getWorkerId() {
		return Optional.ofNullable(this.workerId);
	}

	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final LogEventType logEventType;
		@NonNull
		private final String message;
		@Nullable
		private Throwable throwable;
		@Nullable
		private Request request;
		@Nullable
		private Integer workerId;

		private Builder(@NonNull LogEventType logEventType,
										@NonNull String message) {
			this.logEventType = logEventType;
			this.message = message;
		}

		@NonNull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@NonNull
		public Builder request(@Nullable Request request) {
			this.request = request;
			return this;
		}

		@NonNull
		public Builder workerId(@Nullable Integer workerId) {
			this.workerId = workerId;
			return this;
		}

		@NonNull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}
}
