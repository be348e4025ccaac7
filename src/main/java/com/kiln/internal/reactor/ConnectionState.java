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

/**
 * Lifecycle of a {@link ServerConnection}, from the first request byte to socket release.
 * <pre>
 * AWAITING_REQUEST_LINE -> PARSING_HEADERS -> [AWAITING_BODY] -> READY_TO_DISPATCH -> DISPATCHED
 *         ^                                                                              |
 *         +------------------------ response written, persistent ------------------------+
 *
 * any state -> CLOSING (error response queued, or non-persistent response) -> CLOSED
 * </pre>
 */
public enum ConnectionState {
    AWAITING_REQUEST_LINE,
    PARSING_HEADERS,
    AWAITING_BODY,
    READY_TO_DISPATCH,
    DISPATCHED,
    CLOSING,
    CLOSED
}
