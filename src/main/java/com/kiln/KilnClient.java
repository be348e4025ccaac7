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

import com.kiln.internal.reactor.Reactor;
import com.kiln.internal.reactor.ReactorListener;
import com.kiln.internal.reactor.ReactorOptions;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs {@link OutboundRequest}s for code which is not itself a Kiln server, on a dedicated reactor thread.
 * <p>
 * Inside actions, use {@link ActionContext#newOutboundRequest(String, Integer)} instead, which shares the server's
 * reactor.  Instances must be closed; their reactor thread keeps the JVM alive until then.
 * <pre>{@code try (KilnClient client = KilnClient.withDefaults()) {
 *   OutboundResponse response = client.newRequest("localhost", 8080).open("/health").get();
 * }}</pre>
 */
@ThreadSafe
public final class KilnClient implements AutoCloseable {
	@NonNull
	private static final Logger logger;
	@NonNull
	private static final Duration CLOSE_TIMEOUT;

	static {
		logger = Logger.getLogger(KilnClient.class.getName());
		CLOSE_TIMEOUT = Duration.ofSeconds(5);
	}

	@NonNull
	private final Reactor reactor;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Integer maximumResponseSizeInBytes;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	@NonNull
	public static KilnClient withDefaults() {
		return withRequestTimeout(KilnConfig.DEFAULT_OUTBOUND_REQUEST_TIMEOUT);
	}

	@NonNull
	public static KilnClient withRequestTimeout(@NonNull Duration requestTimeout) {
		return withRequestTimeout(requestTimeout, LifecycleObserver.defaultInstance());
	}

	/**
	 * @param requestTimeout    the default timeout for requests
	 * @param lifecycleObserver receives log events, such as failures of request callbacks
	 */
	@NonNull
	public static KilnClient withRequestTimeout(@NonNull Duration requestTimeout,
																							@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(requestTimeout);
		requireNonNull(lifecycleObserver);

		return new KilnClient(requestTimeout, KilnConfig.DEFAULT_MAXIMUM_OUTBOUND_RESPONSE_SIZE_IN_BYTES, lifecycleObserver);
	}

	/**
	 * Vends a client which applies the outbound settings of {@code kilnConfig}: request timeout, maximum response
	 * size and lifecycle observer.
	 */
	@NonNull
	public static KilnClient fromConfig(@NonNull KilnConfig kilnConfig) {
		requireNonNull(kilnConfig);

		return new KilnClient(kilnConfig.getOutboundRequestTimeout(), kilnConfig.getMaximumOutboundResponseSizeInBytes(),
				kilnConfig.getLifecycleObserver());
	}

	private KilnClient(@NonNull Duration requestTimeout,
										 @NonNull Integer maximumResponseSizeInBytes,
										 @NonNull LifecycleObserver lifecycleObserver) {
		this.requestTimeout = requestTimeout;
		this.maximumResponseSizeInBytes = maximumResponseSizeInBytes;
		this.lifecycleObserver = lifecycleObserver;

		ReactorOptions reactorOptions = new ReactorOptions()
				.withThreadName("kiln-client")
				.withMaximumResponseSize(maximumResponseSizeInBytes);

		try {
			this.reactor = new Reactor(reactorOptions, new ReactorListener() {
				@Override
				public void didFailUnexpectedly(String message, Throwable throwable) {
					logEvent(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, message).throwable(throwable).build());
				}
			});
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to open a selector for outbound requests", e);
		}

		this.reactor.start();
	}

	/**
	 * Creates a request to {@code host:port}, which runs on this client's reactor once opened.
	 */
	@NonNull
	public OutboundRequest newRequest(@NonNull String host,
																		@NonNull Integer port) {
		requireNonNull(host);
		requireNonNull(port);

		return new OutboundRequest(this.reactor, host, port, this.requestTimeout, this::logEvent);
	}

	/**
	 * Stops the reactor.  Requests still in flight fail with {@link OutboundFailureReason#REACTOR_STOPPED}.
	 */
	@Override
	public void close() {
		this.reactor.stop();

		if (this.reactor.inReactorThread())
			return;

		try {
			if (!this.reactor.join(CLOSE_TIMEOUT))
				logger.warning(format("Client reactor did not stop within %s", CLOSE_TIMEOUT));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@NonNull
	public Integer getMaximumResponseSizeInBytes() {
		return this.maximumResponseSizeInBytes;
	}

	@NonNull
	public Boolean isOpen() {
		return this.reactor.isRunning();
	}

	private void logEvent(@NonNull LogEvent logEvent) {
		try {
			this.lifecycleObserver.didReceiveLogEvent(logEvent);
		} catch (Throwable t) {
			logger.log(Level.WARNING, format("%s::didReceiveLogEvent failed for %s", LifecycleObserver.class.getSimpleName(), logEvent), t);
		}
	}
}
