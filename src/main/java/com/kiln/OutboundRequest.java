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

import com.kiln.internal.reactor.ClientResponseHandler;
import com.kiln.internal.reactor.ParsedResponse;
import com.kiln.internal.reactor.Reactor;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An asynchronous HTTP/1.1 request to another server, run on a {@link Reactor} without blocking it.
 * <p>
 * Configure the request with the {@code set*} methods, then call {@link #open(String)} exactly once.  The returned
 * future completes exactly once, on the reactor thread, either with an {@link OutboundResponse} or exceptionally with
 * an {@link OutboundRequestException} describing why.  Each request uses its own connection, which is closed after
 * the response.
 * <p>
 * Parameters are sent in the query string for {@code GET}, {@code HEAD}, {@code DELETE}, {@code OPTIONS} and
 * {@code TRACE}, and as an {@code application/x-www-form-urlencoded} body for other methods.
 * <pre>{@code
 * context.defer();
 * context.newOutboundRequest("api.example.com", 80)
 *   .setParameter("q", "kiln")
 *   .onFinished(response -> {
 *     context.composeHeaders();
 *     context.write(response.getBody());
 *     context.finish();
 *   })
 *   .onFailure(context::fail)
 *   .open("/search");
 * }</pre>
 */
@NotThreadSafe
public final class OutboundRequest {
	@NonNull
	private static final Logger logger;
	@NonNull
	private static final Set<HttpMethod> QUERY_PARAMETER_HTTP_METHODS;
	@NonNull
	private static final Set<String> MANAGED_HEADER_NAMES;

	static {
		logger = Logger.getLogger(OutboundRequest.class.getName());
		QUERY_PARAMETER_HTTP_METHODS = EnumSet.of(HttpMethod.GET, HttpMethod.HEAD, HttpMethod.DELETE, HttpMethod.OPTIONS, HttpMethod.TRACE);
		MANAGED_HEADER_NAMES = Set.of("host", "content-length", "connection", "cookie", "transfer-encoding");
	}

	@NonNull
	private final Reactor reactor;
	@NonNull
	private final String host;
	@NonNull
	private final Integer port;
	@NonNull
	private final Consumer<LogEvent> logEventSink;
	@NonNull
	private final Map<String, List<String>> parameters;
	@NonNull
	private final Map<String, String> headers;
	@NonNull
	private final Map<String, String> cookies;
	@NonNull
	private final CompletableFuture<OutboundResponse> future;
	@NonNull
	private HttpMethod httpMethod;
	@NonNull
	private Duration timeout;
	@Nullable
	private byte[] body;
	@Nullable
	private String path;

	OutboundRequest(@NonNull Reactor reactor,
									@NonNull String host,
									@NonNull Integer port,
									@NonNull Duration timeout,
									@NonNull Consumer<LogEvent> logEventSink) {
		requireNonNull(reactor);
		requireNonNull(host);
		requireNonNull(port);
		requireNonNull(timeout);
		requireNonNull(logEventSink);

		if (host.isBlank())
			throw new IllegalArgumentException("Host must not be blank");

		if (port < 1 || port > 65535)
			throw new IllegalArgumentException(format("Illegal port %d", port));

		this.reactor = reactor;
		this.host = host;
		this.port = port;
		this.timeout = timeout;
		this.logEventSink = logEventSink;
		this.httpMethod = HttpMethod.GET;
		this.parameters = new LinkedHashMap<>();
		this.headers = new LinkedHashMap<>();
		this.cookies = new LinkedHashMap<>();
		this.future = new CompletableFuture<>();
	}

	@NonNull
	public OutboundRequest setMethod(@NonNull HttpMethod httpMethod) {
		requireNonNull(httpMethod);
		ensureNotOpened();
		this.httpMethod = httpMethod;
		return this;
	}

	/**
	 * Adds a parameter value.  Repeated calls with the same name send the name repeatedly, in call order.
	 */
	@NonNull
	public OutboundRequest setParameter(@NonNull String name,
																			@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);
		ensureNotOpened();

		this.parameters.computeIfAbsent(name, ignored -> new ArrayList<>()).add(value);
		return this;
	}

	@NonNull
	public OutboundRequest setParameters(@NonNull Map<String, String> parameters) {
		requireNonNull(parameters);

		for (Entry<String, String> entry : parameters.entrySet())
			setParameter(entry.getKey(), entry.getValue());

		return this;
	}

	/**
	 * Sets a header, replacing any value previously set under the same name.  {@code Host}, {@code Content-Length},
	 * {@code Connection} and {@code Cookie} are managed by the request and cannot be set here.
	 */
	@NonNull
	public OutboundRequest setHeader(@NonNull String name,
																	 @NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);
		ensureNotOpened();

		if (MANAGED_HEADER_NAMES.contains(name.toLowerCase(Locale.ROOT)))
			throw new IllegalArgumentException(format("Header '%s' is managed automatically", name));

		if (name.isEmpty() || name.indexOf(':') != -1 || name.indexOf(' ') != -1 || containsLineBreak(name) || containsLineBreak(value))
			throw new IllegalArgumentException(format("Illegal header '%s'", name));

		this.headers.keySet().removeIf(existingName -> existingName.equalsIgnoreCase(name));
		this.headers.put(name, value);
		return this;
	}

	@NonNull
	public OutboundRequest setCookie(@NonNull String name,
																	 @NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);
		ensureNotOpened();

		if (name.isEmpty() || name.indexOf('=') != -1 || name.indexOf(';') != -1 || value.indexOf(';') != -1
				|| containsLineBreak(name) || containsLineBreak(value))
			throw new IllegalArgumentException(format("Illegal cookie '%s'", name));

		this.cookies.put(name, value);
		return this;
	}

	/**
	 * Sends {@code body} as the request body.  Parameters then always go in the query string.
	 */
	@NonNull
	public OutboundRequest setBody(@Nullable byte[] body) {
		ensureNotOpened();
		this.body = body;
		return this;
	}

	@NonNull
	public OutboundRequest setTimeout(@NonNull Duration timeout) {
		requireNonNull(timeout);
		ensureNotOpened();

		if (timeout.isNegative() || timeout.isZero())
			throw new IllegalArgumentException("Timeout must be positive");

		this.timeout = timeout;
		return this;
	}

	/**
	 * Registers a callback for a successful response.  Exceptions thrown by the callback are reported as
	 * {@link LogEventType#OUTBOUND_CALLBACK_FAILED} log events.
	 */
	@NonNull
	public OutboundRequest onFinished(@NonNull Consumer<OutboundResponse> callback) {
		requireNonNull(callback);

		this.future.whenComplete((response, throwable) -> {
			if (response != null)
				runCallback(() -> callback.accept(response));
		});

		return this;
	}

	/**
	 * Registers a callback for failure.  Exceptions thrown by the callback are reported as
	 * {@link LogEventType#OUTBOUND_CALLBACK_FAILED} log events.
	 */
	@NonNull
	public OutboundRequest onFailure(@NonNull Consumer<OutboundRequestException> callback) {
		requireNonNull(callback);

		this.future.whenComplete((response, throwable) -> {
			if (throwable != null)
				runCallback(() -> callback.accept(toOutboundRequestException(throwable)));
		});

		return this;
	}

	/**
	 * Sends the request.
	 *
	 * @param path the request target, starting with {@code /}; may already carry a query string
	 * @return a future completed on the reactor thread
	 * @throws IllegalStateException if the request was already opened
	 */
	@NonNull
	public CompletableFuture<OutboundResponse> open(@NonNull String path) {
		requireNonNull(path);

		if (!path.startsWith("/"))
			throw new IllegalArgumentException(format("Path '%s' must start with '/'", path));

		if (containsLineBreak(path) || path.indexOf(' ') != -1)
			throw new IllegalArgumentException(format("Illegal path '%s'", path));

		ensureNotOpened();
		this.path = path;

		byte[] requestBytes = toRequestBytes(path);
		// Resolved later, off the reactor thread
		InetSocketAddress address = InetSocketAddress.createUnresolved(getHost(), getPort());

		logger.log(Level.FINE, () -> format("Opening %s http://%s:%d%s", getHttpMethod().name(), getHost(), getPort(), path));

		this.reactor.connect(address, requestBytes, getHttpMethod() == HttpMethod.HEAD, getTimeout(), new ClientResponseHandler() {
			@Override
			public void onResponse(@NonNull ParsedResponse response) {
				OutboundResponse outboundResponse;

				try {
					outboundResponse = OutboundResponse.fromParsedResponse(response);
				} catch (RuntimeException e) {
					future.completeExceptionally(new OutboundRequestException(OutboundFailureReason.MALFORMED_RESPONSE,
							format("Unable to interpret response from %s:%d", getHost(), getPort()), e));
					return;
				}

				future.complete(outboundResponse);
			}

			@Override
			public void onFailure(@NonNull OutboundRequestException exception) {
				future.completeExceptionally(exception);
			}
		});

		return this.future;
	}

	@NonNull
	byte[] toRequestBytes(@NonNull String path) {
		requireNonNull(path);

		String encodedParameters = Utilities.encodeParameters(this.parameters);
		boolean parametersInBody = this.body == null && !QUERY_PARAMETER_HTTP_METHODS.contains(getHttpMethod());
		String target = path;

		if (!parametersInBody && !encodedParameters.isEmpty())
			target = target + (target.indexOf('?') == -1 ? "?" : "&") + encodedParameters;

		byte[] requestBody = this.body;

		if (parametersInBody)
			requestBody = encodedParameters.getBytes(StandardCharsets.UTF_8);

		StringBuilder head = new StringBuilder();
		head.append(getHttpMethod().name()).append(' ').append(target).append(" HTTP/1.1\r\n");
		head.append("Host: ").append(getHost());

		if (getPort() != 80)
			head.append(':').append(getPort());

		head.append("\r\n");

		boolean hasContentType = false;

		for (Entry<String, String> header : this.headers.entrySet()) {
			if (header.getKey().equalsIgnoreCase("Content-Type"))
				hasContentType = true;

			head.append(header.getKey()).append(": ").append(header.getValue()).append("\r\n");
		}

		if (!this.cookies.isEmpty()) {
			List<String> cookiePairs = new ArrayList<>(this.cookies.size());

			for (Entry<String, String> cookie : this.cookies.entrySet())
				cookiePairs.add(cookie.getKey() + "=" + cookie.getValue());

			head.append("Cookie: ").append(String.join("; ", cookiePairs)).append("\r\n");
		}

		if (parametersInBody && !hasContentType)
			head.append("Content-Type: application/x-www-form-urlencoded\r\n");

		if (requestBody != null)
			head.append("Content-Length: ").append(requestBody.length).append("\r\n");

		head.append("Connection: close\r\n\r\n");

		ByteArrayOutputStream requestBytes = new ByteArrayOutputStream();
		requestBytes.writeBytes(head.toString().getBytes(StandardCharsets.ISO_8859_1));

		if (requestBody != null)
			requestBytes.writeBytes(requestBody);

		return requestBytes.toByteArray();
	}

	private void runCallback(@NonNull Runnable callback) {
		try {
			callback.run();
		} catch (Throwable t) {
			this.logEventSink.accept(LogEvent.with(LogEventType.OUTBOUND_CALLBACK_FAILED,
					format("Callback for outbound request to %s:%d failed", getHost(), getPort())).throwable(t).build());
		}
	}

	@NonNull
	private static OutboundRequestException toOutboundRequestException(@NonNull Throwable throwable) {
		Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null ? throwable.getCause() : throwable;

		if (cause instanceof OutboundRequestException outboundRequestException)
			return outboundRequestException;

		return new OutboundRequestException(OutboundFailureReason.CONNECTION_CLOSED, cause.getMessage(), cause);
	}

	private void ensureNotOpened() {
		if (this.path != null)
			throw new IllegalStateException("This request has already been opened and cannot be reused");
	}

	private static boolean containsLineBreak(@NonNull String string) {
		return string.indexOf('\r') != -1 || string.indexOf('\n') != -1;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{httpMethod=%s, host=%s, port=%s, path=%s}", getClass().getSimpleName(),
				getHttpMethod(), getHost(), getPort(), this.path);
	}

	@NonNull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Duration getTimeout() {
		return this.timeout;
	}
}
