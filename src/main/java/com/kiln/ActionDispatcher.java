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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns a parsed {@link Request} into a {@link MarshaledResponse}: resolves the route, checks the HTTP method against
 * the action class, instantiates the action and invokes the matching verb method.
 * <p>
 * Failures never escape {@link #dispatch(Request, Consumer)}.  A routing miss becomes {@code 404}, a bad route parameter
 * {@code 400}, an unsupported method {@code 405} with an {@code Allow} header, and anything thrown by action code
 * {@code 500} followed by a connection close.
 */
@ThreadSafe
public final class ActionDispatcher {
	@NonNull
	private static final Logger logger;
	// Entries live as long as their class, so classes from a discarded reload class loader can still be unloaded
	@NonNull
	private static final ClassValue<Set<HttpMethod>> OVERRIDDEN_HTTP_METHODS_BY_ACTION_CLASS;

	static {
		logger = Logger.getLogger(ActionDispatcher.class.getName());
		OVERRIDDEN_HTTP_METHODS_BY_ACTION_CLASS = new ClassValue<>() {
			@Override
			@NonNull
			protected Set<HttpMethod> computeValue(@NonNull Class<?> actionClass) {
				Set<HttpMethod> httpMethods = EnumSet.noneOf(HttpMethod.class);

				for (HttpMethod httpMethod : HttpMethod.values()) {
					try {
						if (actionClass.getMethod(httpMethod.getActionMethodName(), ActionContext.class).getDeclaringClass() != Action.class)
							httpMethods.add(httpMethod);
					} catch (NoSuchMethodException e) {
						// Every verb is declared on Action, so this cannot happen
						throw new IllegalStateException(e);
					}
				}

				return Collections.unmodifiableSet(httpMethods);
			}
		};
	}

	@NonNull
	private final Router router;
	@NonNull
	private final ResponseActions responseActions;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final String serverName;
	@Nullable
	private final BiFunction<String, Integer, OutboundRequest> outboundRequestFactory;

	ActionDispatcher(@NonNull Router router,
									 @NonNull ResponseActions responseActions,
									 @NonNull LifecycleObserver lifecycleObserver,
									 @NonNull String serverName,
									 @Nullable BiFunction<String, Integer, OutboundRequest> outboundRequestFactory) {
		requireNonNull(router);
		requireNonNull(responseActions);
		requireNonNull(lifecycleObserver);
		requireNonNull(serverName);

		this.router = router;
		this.responseActions = responseActions;
		this.lifecycleObserver = lifecycleObserver;
		this.serverName = serverName;
		this.outboundRequestFactory = outboundRequestFactory;
	}

	/**
	 * Handles a request.  {@code completionHandler} is invoked exactly once with the final response, either before this
	 * method returns or later, from whichever thread finishes a deferred action.
	 *
	 * @param request           the request to handle
	 * @param completionHandler receives the response
	 */
	public void dispatch(@NonNull Request request,
											 @NonNull Consumer<MarshaledResponse> completionHandler) {
		requireNonNull(request);
		requireNonNull(completionHandler);

		try {
			this.lifecycleObserver.didStartRequestHandling(request);
		} catch (Throwable t) {
			logObserverFailure("didStartRequestHandling", t);
		}

		ActionContext context = new ActionContext(this, request, completionHandler);

		try {
			// A form body has to declare its length up front
			if (request.isFormUrlEncoded() && request.getContentLength().isEmpty()) {
				context.raiseResponse(StatusCode.HTTP_411);
				return;
			}

			RouteMatch routeMatch = getRouter().resolve(request.getHttpMethod().orElse(null), request.getPath()).orElse(null);

			if (routeMatch == null) {
				context.raiseResponse(StatusCode.HTTP_404);
				return;
			}

			context.setRouteMatch(routeMatch);

			ActionFactory actionFactory = routeMatch.getActionFactory();
			HttpMethod httpMethod = request.getHttpMethod().orElse(null);
			Class<? extends Action> actionClass = actionFactory.getActionClass();
			Set<HttpMethod> supportedHttpMethods = supportedHttpMethods(actionClass);

			if (httpMethod == null || !supportedHttpMethods.contains(httpMethod)) {
				context.setHeader("Allow", supportedHttpMethods.stream().map(HttpMethod::name).collect(Collectors.joining(", ")));
				context.raiseResponse(StatusCode.HTTP_405);
				return;
			}

			Action action = actionFactory.create(routeMatch.getRouteArguments());

			invoke(action, resolveInvokedHttpMethod(actionClass, httpMethod), context);

			if (!context.isDeferred() && !context.isFinished())
				context.finish();
		} catch (BadRequestException e) {
			logger.log(Level.FINE, format("Rejecting %s %s: %s", request.getMethodToken(), request.getPath(), e.getMessage()));
			context.reject(e);
		} catch (Throwable t) {
			context.fail(t);
		}
	}

	void renderResponseAction(@NonNull ActionContext context,
														@NonNull StatusCode statusCode) throws Exception {
		requireNonNull(context);
		requireNonNull(statusCode);

		ActionFactory actionFactory = getResponseActions().getActionFactory(statusCode);
		Action action = actionFactory.create(getResponseActions().routeArgumentsFor(statusCode));
		HttpMethod httpMethod = context.getRequest().getHttpMethod().orElse(HttpMethod.GET);
		Set<HttpMethod> supportedHttpMethods = supportedHttpMethods(action.getClass());

		if (!supportedHttpMethods.contains(httpMethod))
			httpMethod = HttpMethod.GET;

		if (!supportedHttpMethods.contains(httpMethod))
			throw new IllegalStateException(format("Response action %s for %s does not implement %s",
					action.getClass().getName(), statusCode, httpMethod.getActionMethodName()));

		invoke(action, resolveInvokedHttpMethod(action.getClass(), httpMethod), context);
	}

	void didFinish(@NonNull ActionContext context,
								 @NonNull MarshaledResponse marshaledResponse) {
		requireNonNull(context);
		requireNonNull(marshaledResponse);

		Duration duration = Duration.ofNanos(System.nanoTime() - context.getStartedAtNanos());

		try {
			this.lifecycleObserver.didFinishRequestHandling(context.getRequest(), context.getRouteMatch().orElse(null),
					marshaledResponse, duration, context.getThrowables());
		} catch (Throwable t) {
			logObserverFailure("didFinishRequestHandling", t);
		}
	}

	void logEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			this.lifecycleObserver.didReceiveLogEvent(logEvent);
		} catch (Throwable t) {
			logger.log(Level.WARNING, format("%s::didReceiveLogEvent failed for %s", LifecycleObserver.class.getSimpleName(), logEvent), t);
		}
	}

	@NonNull
	OutboundRequest newOutboundRequest(@NonNull String host,
																		 @NonNull Integer port) {
		if (this.outboundRequestFactory == null)
			throw new IllegalStateException("Outbound requests are not available here because there is no reactor to run them on");

		return this.outboundRequestFactory.apply(host, port);
	}

	private void logObserverFailure(@NonNull String methodName,
																	@NonNull Throwable throwable) {
		logEvent(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
				format("%s::%s failed", LifecycleObserver.class.getSimpleName(), methodName)).throwable(throwable).build());
	}

	/**
	 * The methods an action class can serve: those whose verb method it overrides, plus {@code HEAD} wherever
	 * {@code GET} is overridden.
	 *
	 * @param actionClass the action class
	 * @return the supported methods, in declaration order
	 */
	@NonNull
	static Set<HttpMethod> supportedHttpMethods(@NonNull Class<? extends Action> actionClass) {
		requireNonNull(actionClass);

		Set<HttpMethod> overriddenHttpMethods = overriddenHttpMethods(actionClass);

		if (!overriddenHttpMethods.contains(HttpMethod.GET) || overriddenHttpMethods.contains(HttpMethod.HEAD))
			return overriddenHttpMethods;

		Set<HttpMethod> supportedHttpMethods = EnumSet.copyOf(overriddenHttpMethods);
		supportedHttpMethods.add(HttpMethod.HEAD);
		return Collections.unmodifiableSet(supportedHttpMethods);
	}

	@NonNull
	static Set<HttpMethod> overriddenHttpMethods(@NonNull Class<? extends Action> actionClass) {
		return OVERRIDDEN_HTTP_METHODS_BY_ACTION_CLASS.get(actionClass);
	}

	@NonNull
	private static HttpMethod resolveInvokedHttpMethod(@NonNull Class<? extends Action> actionClass,
																										 @NonNull HttpMethod httpMethod) {
		if (httpMethod == HttpMethod.HEAD && !overriddenHttpMethods(actionClass).contains(HttpMethod.HEAD))
			return HttpMethod.GET;

		return httpMethod;
	}

	private static void invoke(@NonNull Action action,
														 @NonNull HttpMethod httpMethod,
														 @NonNull ActionContext context) throws Exception {
		switch (httpMethod) {
			case GET -> action.get(context);
			case HEAD -> action.head(context);
			case POST -> action.post(context);
			case PUT -> action.put(context);
			case PATCH -> action.patch(context);
			case DELETE -> action.delete(context);
			case OPTIONS -> action.options(context);
			case TRACE -> action.trace(context);
			case CONNECT -> action.connect(context);
		}
	}

	@NonNull
	public Router getRouter() {
		return this.router;
	}

	@NonNull
	public ResponseActions getResponseActions() {
		return this.responseActions;
	}

	@NonNull
	public String getServerName() {
		return this.serverName;
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
