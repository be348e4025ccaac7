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

/**
 * Dispatches requests in-memory, without sockets.  Acquired via {@link Kiln#runSimulator(KilnConfig, java.util.function.Consumer)}.
 * <p>
 * Responses are exactly what would have been written to the wire, minus connection-level framing: status,
 * headers (including {@code Date}, {@code Server}, {@code Content-Length} and any {@code Connection} header) and body.
 */
public interface Simulator {
	/**
	 * Dispatches {@code request} and waits for its response, including responses finished later by deferred actions.
	 *
	 * @param request the request to dispatch
	 * @return the response
	 * @throws IllegalStateException if no response arrives in time
	 */
	@NonNull
	MarshaledResponse performRequest(@NonNull Request request);

	/**
	 * The router used for dispatch, for example to {@link Router#reload(RouteTable)} mid-test.
	 */
	@NonNull
	Router getRouter();
}
