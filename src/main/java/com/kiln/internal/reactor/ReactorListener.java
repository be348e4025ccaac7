/**
 * MIT License
 *
 * Copyright (c) 2022 Elliot Barlas
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.kiln.internal.reactor;

import com.kiln.Request;

import java.net.InetSocketAddress;

/**
 * Listener for connection-level events a {@link Reactor} cannot report through a response.
 * Invoked on the reactor thread; implementations must not block.
 */
public interface ReactorListener {

    ReactorListener NOOP = new ReactorListener() {
    };

    /**
     * Called when a connection is accepted.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    default void didAcceptConnection(InetSocketAddress remoteAddress) {
    }

    /**
     * Called when an accepted connection is closed for any reason.
     */
    default void didCloseConnection(InetSocketAddress remoteAddress) {
    }

    /**
     * Called when a connection is refused because the connection limit is reached.
     */
    default void didRejectConnection(InetSocketAddress remoteAddress) {
    }

    /**
     * Called when a request could not be parsed and a canned error response is being written.
     */
    default void didRejectMalformedRequest(InetSocketAddress remoteAddress, MalformedRequestException exception) {
    }

    /**
     * Called when a dispatched request was not answered within the response timeout. A {@code 503} is being written
     * and any later response to {@code request} is discarded.
     */
    default void didTimeOutResponse(InetSocketAddress remoteAddress, Request request) {
    }

    /**
     * Called when servicing a channel failed unexpectedly. The channel has been closed.
     */
    default void didFailUnexpectedly(String message, Throwable throwable) {
    }
}
