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

import com.kiln.exception.BadRequestException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLConnection;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Everything an {@link Action} sees of a single request/response exchange.
 * <p>
 * The response is buffered: status, headers and cookies are set first and frozen by {@link #composeHeaders()}, after
 * which body bytes may be {@link #write(byte[]) written}.  Nothing reaches the socket until the response is finished,
 * which happens automatically when the verb method returns, unless the action called {@link #defer()}.  A deferred
 * action must eventually call {@link #finish()} (or {@link #fail(Throwable)}), from any thread.
 * <p>
 * Apart from {@link #finish()} and {@link #fail(Throwable)}, this class is intended for use by a single thread at a
 * time.
 */
@NotThreadSafe
public final class ActionContext {
	@NonNull
	private static final String DEFAULT_CONTENT_TYPE;

	static {
		DEFAULT_CONTENT_TYPE = "text/html; charset=UTF-8";
	}

	@NonNull
	private final ActionDispatcher actionDispatcher;
	@NonNull
	private final Request request;
	@NonNull
	private final Consumer<MarshaledResponse> completionHandler;
	@NonNull
	private final Boolean requestPersistent;
	@NonNull
	private final Long startedAtNanos;
	@NonNull
	private final AtomicBoolean finished;
	@NonNull
	private final List<Throwable> throwables;
	@NonNull
	private final Map<String, List<String>> headers;
	@NonNull
	private final Map<String, ResponseCookie> cookiesByName;
	@NonNull
	private final ByteArrayOutputStream body;
	@Nullable
	private RouteMatch routeMatch;
	@Nullable
	private Map<String, List<MultipartField>> multipartFields;
	@NonNull
	private Integer statusCode;
	@Nullable
	private String reasonPhrase;
	@NonNull
	private String contentType;
	@NonNull
	private Boolean persistent;
	@NonNull
	private Boolean headersComposed;
	@NonNull
	private Boolean deferred;
	@NonNull
	private Boolean raisingResponse;

	ActionContext(@NonNull ActionDispatcher actionDispatcher,
								@NonNull Request request,
								@NonNull Consumer<MarshaledResponse> completionHandler) {
		requireNonNull(actionDispatcher);
		requireNonNull(request);
		requireNonNull(completionHandler);

		this.actionDispatcher = actionDispatcher;
		this.request = request;
		this.completionHandler = completionHandler;
		this.requestPersistent = isPersistent(request);
		this.startedAtNanos = System.nanoTime();
		this.finished = new AtomicBoolean(false);
		this.throwables = Collections.synchronizedList(new ArrayList<>());
		this.headers = new LinkedHashMap<>();
		this.cookiesByName = new LinkedHashMap<>();
		this.body = new ByteArrayOutputStream();
		this.statusCode = StatusCode.HTTP_200.getStatusCode();
		this.contentType = DEFAULT_CONTENT_TYPE;
		this.persistent = true;
		this.headersComposed = false;
		this.deferred = false;
		this.raisingResponse = false;
	}

	@NonNull
	private static Boolean isPersistent(@NonNull Request request) {
		List<String> connectionHeaderValues = request.getHeaderValues("Connection");

		if (Utilities.containsHeaderToken(connectionHeaderValues, "close"))
			return false;

		if (Request.HTTP_1_0.equals(request.getProtocol()))
			return Utilities.containsHeaderToken(connectionHeaderValues, "keep-alive");

		return true;
	}

	// Request access

	@NonNull
	public Request getRequest() {
		return this.request;
	}

	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return getRequest().getHttpMethod();
	}

	@NonNull
	public String getPath() {
		return getRequest().getPath();
	}

	/**
	 * The typed values captured by the matched route, or empty parameters if no route matched.
	 */
	@NonNull
	public RouteParameters getParams() {
		RouteMatch routeMatch = this.routeMatch;
		return routeMatch == null ? RouteParameters.empty() : routeMatch.getRouteParameters();
	}

	@NonNull
	public Optional<RouteMatch> getRouteMatch() {
		return Optional.ofNullable(this.routeMatch);
	}

	/**
	 * The first value of a query parameter or, failing that, of a form parameter.
	 */
	@NonNull
	public Optional<String> getParameter(@NonNull String name) {
		requireNonNull(name);
		return getRequest().getParameter(name);
	}

	@NonNull
	public Map<String, List<String>> getQueryParameters() {
		return getRequest().getQueryParameters();
	}

	@NonNull
	public Map<String, List<String>> getFormParameters() {
		return getRequest().getFormParameters();
	}

	/**
	 * The fields of a {@code multipart/form-data} body, parsed on first access.  Requests of any other content type
	 * have none.
	 *
	 * @return the fields by name, in the order they were sent
	 * @throws BadRequestException if the body is not well-formed multipart content
	 */
	@NonNull
	public Map<String, List<MultipartField>> getMultipartFields() {
		if (this.multipartFields == null)
			this.multipartFields = MultipartParser.extractMultipartFields(getRequest());

		return this.multipartFields;
	}

	@NonNull
	public Optional<MultipartField> getMultipartField(@NonNull String name) {
		requireNonNull(name);

		List<MultipartField> fields = getMultipartFields().get(name);
		return fields == null || fields.isEmpty() ? Optional.empty() : Optional.of(fields.get(0));
	}

	@NonNull
	public Map<String, List<String>> getHeaders() {
		return getRequest().getHeaders();
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);
		return getRequest().getHeader(name);
	}

	@NonNull
	public Map<String, String> getCookies() {
		return getRequest().getCookies();
	}

	@NonNull
	public byte[] getBody() {
		return getRequest().getBody();
	}

	// Response composition

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		String reasonPhrase = this.reasonPhrase;

		if (reasonPhrase != null)
			return reasonPhrase;

		return StatusCode.reasonPhraseFor(this.statusCode);
	}

	public void setStatus(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		setStatus(statusCode.getStatusCode(), statusCode.getReasonPhrase());
	}

	public void setStatus(@NonNull Integer statusCode,
												@Nullable String reasonPhrase) {
		requireNonNull(statusCode);
		ensureHeadersNotComposed();

		if (statusCode < 100 || statusCode > 999)
			throw new IllegalArgumentException(format("Illegal status code %d", statusCode));

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	public void setContentType(@NonNull String contentType) {
		requireNonNull(contentType);
		ensureHeadersNotComposed();

		this.contentType = contentType;
	}

	/**
	 * Sets a response header, replacing any values already set under the same name (compared case-insensitively).
	 */
	public void setHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);
		ensureHeadersNotComposed();

		if (name.equalsIgnoreCase("Content-Type")) {
			this.contentType = value;
			return;
		}

		this.headers.keySet().removeIf(existingName -> existingName.equalsIgnoreCase(name));
		this.headers.put(name, new ArrayList<>(List.of(value)));
	}

	public void addHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);
		ensureHeadersNotComposed();

		if (name.equalsIgnoreCase("Content-Type")) {
			this.contentType = value;
			return;
		}

		for (Entry<String, List<String>> entry : this.headers.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name)) {
				entry.getValue().add(value);
				return;
			}
		}

		this.headers.put(name, new ArrayList<>(List.of(value)));
	}

	/**
	 * Sets a cookie, replacing any cookie already set with the same name.
	 */
	public void setCookie(@NonNull ResponseCookie responseCookie) {
		requireNonNull(responseCookie);
		ensureHeadersNotComposed();

		this.cookiesByName.put(responseCookie.getName(), responseCookie);
	}

	/**
	 * Controls whether the connection may be reused after this response.  A request which itself asked for the
	 * connection to be closed is never made persistent by this method.
	 */
	public void setPersistent(@NonNull Boolean persistent) {
		requireNonNull(persistent);
		ensureHeadersNotComposed();

		this.persistent = persistent;
	}

	@NonNull
	public Boolean isPersistent() {
		return this.persistent && this.requestPersistent;
	}

	/**
	 * Freezes status, headers and cookies so the body can be written.  Calling this more than once has no effect.
	 */
	public void composeHeaders() {
		this.headersComposed = true;
	}

	@NonNull
	public Boolean isHeadersComposed() {
		return this.headersComposed;
	}

	/**
	 * Appends bytes to the response body.
	 *
	 * @throws IllegalStateException if headers have not been composed or the response is finished
	 */
	public void write(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		if (!this.headersComposed)
			throw new IllegalStateException("Headers must be composed before writing the response body");

		ensureNotFinished();

		this.body.write(bytes, 0, bytes.length);
	}

	/**
	 * Appends text to the response body, encoded with the charset named by the content type (UTF-8 if none).
	 *
	 * @throws IllegalStateException if headers have not been composed or the response is finished
	 */
	public void write(@NonNull String text) {
		requireNonNull(text);

		Charset charset = Utilities.charsetForName(Utilities.extractCharsetNameFromHeaderValue(this.contentType).orElse(null), StandardCharsets.UTF_8);
		write(text.getBytes(charset));
	}

	/**
	 * Responds with {@code 307 Temporary Redirect} to {@code location} and composes headers.
	 */
	public void redirect(@NonNull String location) {
		requireNonNull(location);

		setStatus(StatusCode.HTTP_307);
		setHeader("Location", location);
		composeHeaders();
	}

	/**
	 * Sends the file at {@code path} as an attachment and composes headers.  The content type is guessed from the
	 * file name, falling back to {@code text/plain}.
	 * <p>
	 * If the file cannot be read, nothing about the response changes and {@code false} is returned.
	 *
	 * @param path     the file to send
	 * @param filename the name offered to the client, or {@code null} to use the file's own name
	 * @return {@code true} if the file was written to the response body
	 * @throws IllegalStateException if headers have already been composed
	 */
	@NonNull
	public Boolean serveStaticFile(@NonNull Path path,
																 @Nullable String filename) {
		requireNonNull(path);
		ensureHeadersNotComposed();

		byte[] bytes;

		try {
			bytes = Files.readAllBytes(path);
		} catch (IOException | SecurityException e) {
			this.actionDispatcher.logEvent(LogEvent.with(LogEventType.STATIC_FILE_UNREADABLE, format("Unable to read static file %s", path))
					.throwable(e)
					.request(getRequest())
					.build());
			return false;
		}

		if (filename == null)
			filename = path.getFileName() == null ? path.toString() : path.getFileName().toString();

		String contentType = URLConnection.guessContentTypeFromName(filename);

		setContentType(contentType == null ? "text/plain" : contentType);
		setHeader("Content-Disposition", format("attachment; filename=\"%s\"", filename.replace("\\", "\\\\").replace("\"", "\\\"")));
		composeHeaders();
		write(bytes);

		return true;
	}

	/**
	 * Renders the response action registered for {@code statusCode} and finishes the response.
	 *
	 * @throws IllegalStateException if headers have already been composed
	 * @throws Exception             if the response action fails
	 */
	public void raiseResponse(@NonNull StatusCode statusCode) throws Exception {
		requireNonNull(statusCode);
		ensureHeadersNotComposed();

		if (this.raisingResponse)
			throw new IllegalStateException(format("A response action tried to raise %s while rendering another response", statusCode));

		setStatus(statusCode);

		this.raisingResponse = true;

		try {
			this.actionDispatcher.renderResponseAction(this, statusCode);
		} finally {
			this.raisingResponse = false;
		}

		composeHeaders();

		if (!isFinished())
			finish();
	}

	/**
	 * Marks the response as asynchronous: it is not finished when the verb method returns.
	 */
	public void defer() {
		ensureNotFinished();
		this.deferred = true;
	}

	@NonNull
	public Boolean isDeferred() {
		return this.deferred;
	}

	@NonNull
	public Boolean isFinished() {
		return this.finished.get();
	}

	/**
	 * Completes the response and hands it to the connection for writing.  Safe to call from any thread.
	 *
	 * @throws IllegalStateException if the response was already finished
	 */
	public void finish() {
		if (!this.finished.compareAndSet(false, true))
			throw new IllegalStateException("Response has already been finished");

		this.headersComposed = true;

		MarshaledResponse marshaledResponse = toMarshaledResponse();

		this.actionDispatcher.didFinish(this, marshaledResponse);
		this.completionHandler.accept(marshaledResponse);
	}

	/**
	 * Discards anything composed so far and finishes with {@code 500 Internal Server Error}, closing the connection
	 * afterwards.  If the response is already finished, the failure is only logged.
	 */
	public void fail(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		this.throwables.add(throwable);

		if (isFinished()) {
			this.actionDispatcher.logEvent(LogEvent.with(LogEventType.RESPONSE_ALREADY_FINISHED,
							format("Action failed after its response to %s %s was finished", getRequest().getMethodToken(), getRequest().getPath()))
					.throwable(throwable)
					.request(getRequest())
					.build());
			return;
		}

		this.actionDispatcher.logEvent(LogEvent.with(LogEventType.ACTION_FAILED,
						format("An error occurred while handling %s %s", getRequest().getMethodToken(), getRequest().getPath()))
				.throwable(throwable)
				.request(getRequest())
				.build());

		resetResponse();
		this.persistent = false;

		try {
			raiseResponse(StatusCode.HTTP_500);
		} catch (Throwable responseActionThrowable) {
			this.throwables.add(responseActionThrowable);

			this.actionDispatcher.logEvent(LogEvent.with(LogEventType.RESPONSE_ACTION_FAILED,
							"The response action for 500 failed, writing a failsafe response instead")
					.throwable(responseActionThrowable)
					.request(getRequest())
					.build());

			if (!isFinished()) {
				resetResponse();
				this.persistent = false;
				setStatus(StatusCode.HTTP_500);
				setContentType("text/plain; charset=UTF-8");
				composeHeaders();
				write("500 Internal Server Error");
				finish();
			}
		}
	}

	@NonNull
	List<Throwable> getThrowables() {
		synchronized (this.throwables) {
			return List.copyOf(this.throwables);
		}
	}

	@NonNull
	Long getStartedAtNanos() {
		return this.startedAtNanos;
	}

	void setRouteMatch(@Nullable RouteMatch routeMatch) {
		this.routeMatch = routeMatch;
	}

	/**
	 * Creates an outbound request which runs on the reactor serving this request.
	 *
	 * @throws IllegalStateException if no reactor is available, for example under a simulator without a client
	 */
	@NonNull
	public OutboundRequest newOutboundRequest(@NonNull String host,
																						@NonNull Integer port) {
		requireNonNull(host);
		requireNonNull(port);

		return this.actionDispatcher.newOutboundRequest(host, port);
	}

	/**
	 * Answers {@code 400 Bad Request} for a request that routing or the action refused.  Once headers are composed
	 * this is treated like any other failure.
	 */
	void reject(@NonNull BadRequestException exception) {
		requireNonNull(exception);

		if (isFinished() || isHeadersComposed()) {
			fail(exception);
			return;
		}

		this.throwables.add(exception);
		resetResponse();

		try {
			raiseResponse(StatusCode.HTTP_400);
		} catch (Throwable t) {
			fail(t);
		}
	}

	private void resetResponse() {
		this.statusCode = StatusCode.HTTP_200.getStatusCode();
		this.reasonPhrase = null;
		this.contentType = DEFAULT_CONTENT_TYPE;
		this.headers.clear();
		this.cookiesByName.clear();
		this.body.reset();
		this.headersComposed = false;
		this.deferred = false;
	}

	private void ensureHeadersNotComposed() {
		if (this.headersComposed)
			throw new IllegalStateException("Headers have already been composed");
	}

	private void ensureNotFinished() {
		if (isFinished())
			throw new IllegalStateException("Response has already been finished");
	}

	@NonNull
	private MarshaledResponse toMarshaledResponse() {
		Boolean bodyless = StatusCode.forbidsBody(this.statusCode);
		Boolean headRequest = getRequest().getHttpMethod().orElse(null) == HttpMethod.HEAD;
		byte[] bodyBytes = this.body.toByteArray();

		MarshaledResponse.Builder builder = MarshaledResponse.withStatusCode(this.statusCode)
				.reasonPhrase(getReasonPhrase())
				.header("Date", Utilities.formatHttpDate(Instant.now()))
				.header("Server", this.actionDispatcher.getServerName());

		if (!bodyless) {
			builder.header("Content-Type", this.contentType);
			// HEAD keeps the length of the body it would have received
			builder.header("Content-Length", String.valueOf(bodyBytes.length));
		}

		if (!isPersistent())
			builder.header("Connection", "close");
		else if (Request.HTTP_1_0.equals(getRequest().getProtocol()))
			builder.header("Connection", "keep-alive");

		for (Entry<String, List<String>> entry : this.headers.entrySet()) {
			String name = entry.getKey();

			if (name.equalsIgnoreCase("Content-Length") || name.equalsIgnoreCase("Connection")
					|| name.equalsIgnoreCase("Date") || name.equalsIgnoreCase("Server")
					|| name.equalsIgnoreCase("Content-Type"))
				continue;

			for (String value : entry.getValue())
				builder.header(name, value);
		}

		for (ResponseCookie cookie : this.cookiesByName.values())
			builder.cookie(cookie);

		if (!bodyless && !headRequest)
			builder.body(bodyBytes);

		return builder.build();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{request=%s, statusCode=%s, headersComposed=%s, deferred=%s, finished=%s}", getClass().getSimpleName(),
				getRequest(), getStatusCode(), isHeadersComposed(), isDeferred(), isFinished());
	}
}
