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

import com.kiln.OutboundFailureReason;
import com.kiln.OutboundRequestException;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One outbound exchange: non-blocking connect, request write, response read. The connection is never reused.
 */
class ClientConnection implements ReactorChannel {

    private static final Logger logger = Logger.getLogger(ClientConnection.class.getName());

    private final Reactor reactor;
    private final InetSocketAddress address;
    private final ByteBuffer writeBuffer;
    private final Duration timeout;
    private final ClientResponseHandler handler;
    private final ByteTokenizer byteTokenizer;
    private final ResponseParser responseParser;
    private final String id;
    private SocketChannel socketChannel;
    private SelectionKey selectionKey;
    private Cancellable timeoutTask;
    private boolean completed;

    ClientConnection(Reactor reactor, InetSocketAddress address, byte[] requestBytes, boolean headRequest,
                     Duration timeout, ClientResponseHandler handler) {
        this.reactor = reactor;
        this.address = address;
        this.writeBuffer = ByteBuffer.wrap(requestBytes);
        this.timeout = timeout;
        this.handler = handler;
        this.byteTokenizer = new ByteTokenizer();
        this.responseParser = new ResponseParser(byteTokenizer, headRequest, reactor.options().maximumResponseSize());
        this.id = "client-" + reactor.nextConnectionId();
    }

    void start() {
        timeoutTask = reactor.schedule(this::onTimeout, timeout);
        try {
            socketChannel = SocketChannel.open();
            socketChannel.configureBlocking(false);
            socketChannel.setOption(StandardSocketOptions.TCP_NODELAY, true);
            selectionKey = socketChannel.register(reactor.selector(), 0, this);
        } catch (IOException e) {
            fail(OutboundFailureReason.CONNECT_FAILED, "Unable to connect to " + address, e);
            return;
        }
        if (address.isUnresolved()) {
            resolve();
        } else {
            connect(address);
        }
    }

    private void resolve() {
        String host = address.getHostString();
        try {
            reactor.resolve(() -> {
                try {
                    InetAddress resolved = reactor.options().hostResolver().resolve(host);
                    reactor.execute(() -> connect(new InetSocketAddress(resolved, address.getPort())));
                } catch (IOException | RuntimeException e) {
                    reactor.execute(() -> fail(OutboundFailureReason.CONNECT_FAILED, "Unable to resolve " + host, e));
                }
            });
        } catch (RejectedExecutionException e) {
            fail(OutboundFailureReason.REACTOR_STOPPED, "Reactor stopped before " + host + " was resolved", e);
        }
    }

    private void connect(InetSocketAddress target) {
        // timed out or stopped while resolving
        if (completed) {
            return;
        }
        try {
            logger.log(Level.FINE, () -> "connect id=" + id + " address=" + target);
            if (socketChannel.connect(target)) {
                onConnected();
            } else {
                selectionKey.interestOps(SelectionKey.OP_CONNECT);
            }
        } catch (IOException | UnresolvedAddressException e) {
            fail(OutboundFailureReason.CONNECT_FAILED, "Unable to connect to " + target, e);
        }
    }

    @Override
    public void onConnectable() {
        try {
            if (socketChannel.finishConnect()) {
                onConnected();
            }
        } catch (IOException e) {
            fail(OutboundFailureReason.CONNECT_FAILED, "Unable to connect to " + address, e);
        }
    }

    private void onConnected() throws IOException {
        selectionKey.interestOps(SelectionKey.OP_WRITE);
        doWrite();
    }

    @Override
    public void onWritable() {
        try {
            doWrite();
        } catch (IOException e) {
            fail(OutboundFailureReason.CONNECTION_RESET, "Connection to " + address + " failed while writing the request", e);
        }
    }

    private void doWrite() throws IOException {
        socketChannel.write(writeBuffer);
        if (!writeBuffer.hasRemaining()) {
            selectionKey.interestOps(SelectionKey.OP_READ);
        }
    }

    @Override
    public void onReadable() {
        try {
            ByteBuffer buffer = reactor.readBuffer();
            buffer.clear();
            int numBytes = socketChannel.read(buffer);
            if (numBytes < 0) {
                ParsedResponse response = responseParser.endOfStream();
                if (response == null) {
                    fail(OutboundFailureReason.CONNECTION_CLOSED, "Connection to " + address + " closed before the response was complete", null);
                } else {
                    complete(response);
                }
                return;
            }
            buffer.flip();
            byteTokenizer.add(buffer);
            if (responseParser.parse()) {
                complete(responseParser.response());
            }
        } catch (ResponseTooLargeException e) {
            fail(OutboundFailureReason.RESPONSE_TOO_LARGE, "Response from " + address + " rejected: " + e.getMessage(), e);
        } catch (MalformedResponseException e) {
            fail(OutboundFailureReason.MALFORMED_RESPONSE, "Malformed response from " + address + ": " + e.getMessage(), e);
        } catch (IOException e) {
            fail(OutboundFailureReason.CONNECTION_RESET, "Connection to " + address + " failed while reading the response", e);
        }
    }

    private void onTimeout() {
        timeoutTask = null;
        fail(OutboundFailureReason.TIMED_OUT, "No response from " + address + " within " + timeout.toMillis() + "ms", null);
    }

    private void complete(ParsedResponse response) {
        if (completed) {
            return;
        }
        completed = true;
        release();
        logger.log(Level.FINE, () -> "response id=" + id + " status=" + response.statusCode());
        handler.onResponse(response);
    }

    private void fail(OutboundFailureReason reason, String message, Throwable cause) {
        if (completed) {
            return;
        }
        completed = true;
        release();
        logger.log(Level.FINE, "failure id=" + id + " reason=" + reason, cause);
        handler.onFailure(new OutboundRequestException(reason, message, cause));
    }

    private void release() {
        if (timeoutTask != null) {
            timeoutTask.cancel();
            timeoutTask = null;
        }
        if (selectionKey != null) {
            selectionKey.cancel();
        }
        Reactor.closeQuietly(socketChannel);
    }

    @Override
    public void failSafeClose() {
        if (reactor.isStopping()) {
            fail(OutboundFailureReason.REACTOR_STOPPED, "Reactor stopped before the response to " + address + " arrived", null);
        } else {
            fail(OutboundFailureReason.CONNECTION_CLOSED, "Connection to " + address + " was closed", null);
        }
    }

    @Override
    public String toString() {
        return "ClientConnection{id=" + id + ", address=" + address + "}";
    }
}
