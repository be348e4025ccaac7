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

/**
 * Why an {@link OutboundRequest} failed.
 */
public enum OutboundFailureReason {
	/**
	 * The host could not be resolved or the TCP connection could not be established.
	 */
	CONNECT_FAILED,
	/**
	 * The peer reset the connection while the request was being written or the response read.
	 */
	CONNECTION_RESET,
	/**
	 * The peer closed the connection before the response was complete.
	 */
	CONNECTION_CLOSED,
	/**
	 * The response could not be parsed.
	 */
	MALFORMED_RESPONSE,
	/**
	 * The response was larger than the configured maximum outbound response size.
	 */
	RESPONSE_TOO_LARGE,
	/**
	 * No complete response arrived within the request's timeout.
	 */
	TIMED_OUT,
	/**
	 * The reactor running the request was stopped first.
	 */
	REACTOR_STOPPED
}
