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

import com.kiln.StatusCode;

/**
 * Raised by {@link RequestParser} when a request cannot be accepted. The connection answers with
 * {@link #getStatusCode()} and closes.
 */
public class MalformedRequestException extends RuntimeException {
    private final StatusCode statusCode;

    MalformedRequestException(StatusCode statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    MalformedRequestException(String message) {
        this(StatusCode.HTTP_400, message);
    }

    MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = StatusCode.HTTP_400;
    }

    public StatusCode getStatusCode() {
        return statusCode;
    }
}
