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

import java.net.InetAddress;
import java.time.Duration;

/**
 * Tuning knobs for a {@link Reactor} and the connections it serves.
 */
public class ReactorOptions {

    private Duration resolution = Duration.ofMillis(100);
    private Duration idleTimeout = Duration.ofSeconds(60);
    private int readBufferSize = 1_024 * 64;
    private int acceptLength = 0;
    private int maxConnections = 0;
    private int maximumRequestLineSize = 1_024 * 8;
    private int maximumHeaderSize = 1_024 * 64;
    private int maximumBodySize = 1_024 * 1_024 * 10;
    private int maximumResponseSize = 1_024 * 1_024 * 10;
    private int maximumPersistentRequests = 0;
    private Duration responseTimeout = Duration.ZERO;
    private int resolverThreads = 2;
    private HostResolver hostResolver = InetAddress::getByName;
    private String threadName = "kiln-reactor";

    public Duration resolution() {
        return resolution;
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    public int readBufferSize() {
        return readBufferSize;
    }

    public int acceptLength() {
        return acceptLength;
    }

    public int maxConnections() {
        return maxConnections;
    }

    public int maximumRequestLineSize() {
        return maximumRequestLineSize;
    }

    public int maximumHeaderSize() {
        return maximumHeaderSize;
    }

    public int maximumBodySize() {
        return maximumBodySize;
    }

    public int maximumResponseSize() {
        return maximumResponseSize;
    }

    /**
     * Requests served on one connection before it is closed; zero means unlimited.
     */
    public int maximumPersistentRequests() {
        return maximumPersistentRequests;
    }

    /**
     * How long a dispatched request may go unanswered before the server answers for it; zero disables the check.
     */
    public Duration responseTimeout() {
        return responseTimeout;
    }

    public int resolverThreads() {
        return resolverThreads;
    }

    public HostResolver hostResolver() {
        return hostResolver;
    }

    public String threadName() {
        return threadName;
    }

    public ReactorOptions withResolution(Duration resolution) {
        this.resolution = resolution;
        return this;
    }

    public ReactorOptions withIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
        return this;
    }

    public ReactorOptions withReadBufferSize(int readBufferSize) {
        this.readBufferSize = readBufferSize;
        return this;
    }

    public ReactorOptions withAcceptLength(int acceptLength) {
        this.acceptLength = acceptLength;
        return this;
    }

    public ReactorOptions withMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
        return this;
    }

    public ReactorOptions withMaximumRequestLineSize(int maximumRequestLineSize) {
        this.maximumRequestLineSize = maximumRequestLineSize;
        return this;
    }

    public ReactorOptions withMaximumHeaderSize(int maximumHeaderSize) {
        this.maximumHeaderSize = maximumHeaderSize;
        return this;
    }

    public ReactorOptions withMaximumBodySize(int maximumBodySize) {
        this.maximumBodySize = maximumBodySize;
        return this;
    }

    public ReactorOptions withMaximumResponseSize(int maximumResponseSize) {
        this.maximumResponseSize = maximumResponseSize;
        return this;
    }

    public ReactorOptions withMaximumPersistentRequests(int maximumPersistentRequests) {
        this.maximumPersistentRequests = maximumPersistentRequests;
        return this;
    }

    public ReactorOptions withResponseTimeout(Duration responseTimeout) {
        this.responseTimeout = responseTimeout;
        return this;
    }

    public ReactorOptions withResolverThreads(int resolverThreads) {
        this.resolverThreads = resolverThreads;
        return this;
    }

    public ReactorOptions withHostResolver(HostResolver hostResolver) {
        this.hostResolver = hostResolver;
        return this;
    }

    public ReactorOptions withThreadName(String threadName) {
        this.threadName = threadName;
        return this;
    }
}
