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

import com.kiln.MarshaledResponse;
import com.kiln.Request;
import com.kiln.ResponseCookie;
import com.kiln.StatusCode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One accepted socket and the request/response exchanges on it.
 * <p>
 * Reads feed a {@link RequestParser}; a complete request is handed to the {@link RequestHandler} with reading
 * suspended until its response has been fully written, so at most one response is in flight. Persistent
 * connections then resume reading, first parsing any pipelined bytes already buffered.
 * <p>
 * A request left unanswered past the response timeout is answered {@code 503} and the connection closed; the late
 * response, if it ever arrives, is dropped. Once a connection has served the configured maximum of persistent
 * requests, the last response carries {@code Connection: close}.
 *
 * <pre>
 *              Read                 Request
 *              Partial              Pipelined
 *              +-----+                +-----+                  Write
 *              |     |                |     |                  Partial
 *              |     v                |     v                  +-----+
 *            +-+--------+  Read-     ++-------+-+  Write-    +-+--------+  Complete    +----------+
 *    Accept  |          |  Complete  |          |  Partial   |          |  Non-        |          |
 * ---------->| READABLE +----------->| DISPATCH +----------->| WRITABLE +------------->|  CLOSED  |
 *            |          |            |          |            |          |  Persistent  |          |
 *            +----+-----+            +----------+            +-+--------+              +----------+
 *                 ^                                            |
 *                 +--------------------------------------------+
 *                          Write Complete Persistent
 * </pre>
 */
class ServerConnection implements ReactorChannel {

    private static final Logger logger = Logger.getLogger(ServerConnection.class.getName());

    static final String HEADER_CONNECTION = "Connection";
    static final String HEADER_CONTENT_LENGTH = "Content-Length";

    static final String KEEP_ALIVE = "keep-alive";
    static final String CLOSE = "close";

    private static final byte[] COLON_SPACE = ": ".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final Reactor reactor;
    private final RequestHandler handler;
    private final SocketChannel socketChannel;
    private final SelectionKey selectionKey;
    private final ByteTokenizer byteTokenizer;
    private final String id;
    private final InetSocketAddress remoteAddress;
    private final InetSocketAddress localAddress;
    private final AtomicBoolean closed;
    private RequestParser requestParser;
    private ByteBuffer writeBuffer;
    private Cancellable idleTimeoutTask;
    private Cancellable responseTimeoutTask;
    private boolean awaitingResponse;
    private int requestCount;
    private ConnectionState phase;
    private boolean httpOneDotZero;
    private boolean keepAlive;
    private boolean closeAfterResponse;

    ServerConnection(Reactor reactor, SocketChannel socketChannel, InetSocketAddress remoteAddress,
                     RequestHandler handler) throws IOException {
        this.reactor = reactor;
        this.handler = handler;
        this.socketChannel = socketChannel;
        this.remoteAddress = remoteAddress;
        SocketAddress socketAddress = socketChannel.getLocalAddress();
        this.localAddress = socketAddress instanceof InetSocketAddress inetSocketAddress ? inetSocketAddress : null;
        byteTokenizer = new ByteTokenizer();
        id = reactor.nextConnectionId();
        closed = new AtomicBoolean(false);
        requestParser = new RequestParser(byteTokenizer, reactor.options());
        selectionKey = socketChannel.register(reactor.selector(), SelectionKey.OP_READ, this);
        idleTimeoutTask = reactor.schedule(this::onIdleTimeout, reactor.options().idleTimeout());
        logger.log(Level.FINE, () -> "accept id=" + id + " remote_address=" + remoteAddress);
    }

    ConnectionState state() {
        if (closed.get()) {
            return ConnectionState.CLOSED;
        }
        return phase != null ? phase : requestParser.connectionState();
    }

    private void onIdleTimeout() {
        idleTimeoutTask = null;
        logger.log(Level.FINE, () -> "idle_timeout id=" + id + " state=" + state());
        failSafeClose();
    }

    @Override
    public void onReadable() {
        try {
            doOnReadable();
        } catch (MalformedRequestException e) {
            respondToMalformedRequest(e);
        } catch (IOException e) {
            // transport fault: no response is possible
            logger.log(Level.FINE, "read_error id=" + id, e);
            failSafeClose();
        }
    }

    private void doOnReadable() throws IOException {
        ByteBuffer buffer = reactor.readBuffer();
        buffer.clear();
        int numBytes = socketChannel.read(buffer);
        if (numBytes < 0) {
            logger.log(Level.FINE, () -> "read_close id=" + id + " state=" + state());
            failSafeClose();
            return;
        }
        buffer.flip();
        byteTokenizer.add(buffer);
        logger.log(Level.FINEST, () -> "read_bytes id=" + id + " read_bytes=" + numBytes + " request_bytes=" + byteTokenizer.remaining());
        if (requestParser.parse()) {
            onParseRequest();
        }
    }

    private void respondToMalformedRequest(MalformedRequestException e) {
        logger.log(Level.FINE, "malformed_request id=" + id, e);
        reactor.listener().didRejectMalformedRequest(remoteAddress, e);
        if (selectionKey.interestOps() != 0) {
            selectionKey.interestOps(0);
        }
        cancelIdleTimeout();
        writeFinalResponse(e.getStatusCode());
    }

    private void onResponseTimeout(Request request) {
        responseTimeoutTask = null;
        if (!awaitingResponse || closed.get()) {
            return;
        }
        awaitingResponse = false;
        logger.log(Level.FINE, () -> "response_timeout id=" + id + " request=" + request.getMethodToken() + " " + request.getTarget());
        reactor.listener().didTimeOutResponse(remoteAddress, request);
        writeFinalResponse(StatusCode.HTTP_503);
    }

    // An empty response after which the connection closes
    private void writeFinalResponse(StatusCode statusCode) {
        closeAfterResponse = true;
        phase = ConnectionState.CLOSING;
        writeBuffer = ByteBuffer.wrap(("HTTP/1.1 " + statusCode.getStatusCode() + " " + statusCode.getReasonPhrase()
                + "\r\nConnection: close\r\nContent-Length: 0\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
        try {
            doOnWritable();
        } catch (IOException ioException) {
            failSafeClose();
        }
    }

    private void onParseRequest() {
        if (selectionKey.interestOps() != 0) {
            selectionKey.interestOps(0);
        }
        cancelIdleTimeout();
        Request request = requestParser.request(remoteAddress, localAddress);
        requestCount++;
        applyConnectionPolicy(requestParser.version(), requestParser.headers());
        int maximumPersistentRequests = reactor.options().maximumPersistentRequests();
        if (maximumPersistentRequests > 0 && requestCount >= maximumPersistentRequests) {
            closeAfterResponse = true;
        }
        byteTokenizer.compact();
        requestParser = new RequestParser(byteTokenizer, reactor.options());
        phase = ConnectionState.DISPATCHED;
        awaitingResponse = true;
        Duration responseTimeout = reactor.options().responseTimeout();
        if (!responseTimeout.isZero()) {
            responseTimeoutTask = reactor.schedule(() -> onResponseTimeout(request), responseTimeout);
        }
        logger.log(Level.FINE, () -> "dispatch id=" + id + " request=" + request.getMethodToken() + " " + request.getTarget());
        handler.handle(request, this::onResponse);
    }

    private void onResponse(MarshaledResponse marshaledResponse) {
        // enqueuing ensures the callback works the same whether invoked inline
        // from the reactor thread or later from a background thread
        reactor.execute(() -> {
            try {
                prepareToWriteResponse(marshaledResponse);
            } catch (IOException e) {
                logger.log(Level.FINE, "response_ready_error id=" + id, e);
                failSafeClose();
            }
        });
    }

    private void prepareToWriteResponse(MarshaledResponse marshaledResponse) throws IOException {
        if (closed.get()) {
            return;
        }
        if (!awaitingResponse) {
            logger.log(Level.FINE, () -> "late_response id=" + id + " status=" + marshaledResponse.getStatusCode());
            return;
        }
        awaitingResponse = false;
        cancelResponseTimeout();
        boolean responseAsksToClose = hasHeaderToken(marshaledResponse.getHeaderValues(HEADER_CONNECTION), CLOSE);
        if (responseAsksToClose) {
            closeAfterResponse = true;
        }
        List<Header> headers = new ArrayList<>();
        if (closeAfterResponse && !responseAsksToClose) {
            headers.add(new Header(HEADER_CONNECTION, CLOSE));
        } else if (httpOneDotZero && keepAlive && !closeAfterResponse
                && marshaledResponse.getHeaderValues(HEADER_CONNECTION).isEmpty()) {
            headers.add(new Header(HEADER_CONNECTION, KEEP_ALIVE));
        }
        boolean bodyless = StatusCode.forbidsBody(marshaledResponse.getStatusCode());
        if (!bodyless && marshaledResponse.getHeader(HEADER_CONTENT_LENGTH).isEmpty()) {
            headers.add(new Header(HEADER_CONTENT_LENGTH, Integer.toString(marshaledResponse.getBody().length)));
        }
        writeBuffer = ByteBuffer.wrap(serialize(httpOneDotZero ? Request.HTTP_1_0 : Request.HTTP_1_1, marshaledResponse, headers));
        if (closeAfterResponse) {
            phase = ConnectionState.CLOSING;
        }
        logger.log(Level.FINE, () -> "response_ready id=" + id + " status=" + marshaledResponse.getStatusCode() + " num_bytes=" + writeBuffer.remaining());
        doOnWritable();
    }

    static byte[] serialize(String version, MarshaledResponse response, List<Header> extraHeaders) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256 + response.getBody().length);
        out.writeBytes(version.getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(SPACE);
        out.writeBytes(Integer.toString(response.getStatusCode()).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(SPACE);
        out.writeBytes(response.getReasonPhrase().getBytes(StandardCharsets.ISO_8859_1));
        out.writeBytes(CRLF);
        boolean connectionOverridden = false;
        for (Header header : extraHeaders) {
            connectionOverridden |= header.name().equalsIgnoreCase(HEADER_CONNECTION);
        }
        for (Map.Entry<String, List<String>> entry : response.getHeaders().entrySet()) {
            if (connectionOverridden && entry.getKey().equalsIgnoreCase(HEADER_CONNECTION)) {
                continue;
            }
            for (String value : entry.getValue()) {
                appendHeader(out, entry.getKey(), value);
            }
        }
        for (Header header : extraHeaders) {
            appendHeader(out, header.name(), header.value());
        }
        for (ResponseCookie cookie : response.getCookies()) {
            appendHeader(out, "Set-Cookie", cookie.toSetCookieHeaderValue());
        }
        out.writeBytes(CRLF);
        out.writeBytes(response.getBody());
        return out.toByteArray();
    }

    private static void appendHeader(ByteArrayOutputStream out, String name, String value) {
        out.writeBytes(name.getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(COLON_SPACE);
        out.writeBytes(value.getBytes(StandardCharsets.ISO_8859_1));
        out.writeBytes(CRLF);
    }

    @Override
    public void onWritable() {
        try {
            doOnWritable();
        } catch (IOException e) {
            logger.log(Level.FINE, "write_error id=" + id, e);
            failSafeClose();
        }
    }

    private void doOnWritable() throws IOException {
        int numBytes = socketChannel.write(writeBuffer);
        if (!writeBuffer.hasRemaining()) { // response fully written
            writeBuffer = null;
            logger.log(Level.FINEST, () -> "write_response id=" + id + " num_bytes=" + numBytes);
            if (closeAfterResponse) { // non-persistent connection, close now
                logger.log(Level.FINE, () -> "close_after_response id=" + id);
                failSafeClose();
            } else { // persistent connection
                phase = null;
                boolean pipelined;
                try {
                    pipelined = requestParser.parse();
                } catch (MalformedRequestException e) {
                    respondToMalformedRequest(e);
                    return;
                }
                if (pipelined) { // subsequent request in buffer
                    logger.log(Level.FINE, () -> "pipeline_request id=" + id + " request_bytes=" + byteTokenizer.remaining());
                    try {
                        onParseRequest();
                    } catch (MalformedRequestException e) {
                        respondToMalformedRequest(e);
                    }
                } else { // switch back to read mode
                    idleTimeoutTask = reactor.schedule(this::onIdleTimeout, reactor.options().idleTimeout());
                    selectionKey.interestOps(SelectionKey.OP_READ);
                }
            }
        } else { // response not fully written, switch to or remain in write mode
            if ((selectionKey.interestOps() & SelectionKey.OP_WRITE) == 0) {
                selectionKey.interestOps(SelectionKey.OP_WRITE);
            }
            logger.log(Level.FINEST, () -> "write id=" + id + " num_bytes=" + numBytes);
        }
    }

    private void cancelIdleTimeout() {
        if (idleTimeoutTask != null) {
            idleTimeoutTask.cancel();
            idleTimeoutTask = null;
        }
    }

    private void cancelResponseTimeout() {
        if (responseTimeoutTask != null) {
            responseTimeoutTask.cancel();
            responseTimeoutTask = null;
        }
    }

    @Override
    public void failSafeClose() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cancelIdleTimeout();
        cancelResponseTimeout();
        selectionKey.cancel();
        Reactor.closeQuietly(socketChannel);
        reactor.connectionClosed(remoteAddress);
    }

    private void applyConnectionPolicy(String version, List<Header> headers) {
        closeAfterResponse = false;
        httpOneDotZero = version.equalsIgnoreCase(Request.HTTP_1_0);

        List<String> connectionValues = new ArrayList<>();
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(HEADER_CONNECTION)) {
                connectionValues.add(header.value());
            }
        }
        boolean hasClose = hasHeaderToken(connectionValues, CLOSE);
        boolean hasKeepAlive = hasHeaderToken(connectionValues, KEEP_ALIVE);

        if (hasClose) {
            keepAlive = false;
            closeAfterResponse = true;
        } else if (httpOneDotZero) {
            keepAlive = hasKeepAlive;
            closeAfterResponse = !keepAlive;
        } else {
            keepAlive = true;
        }
    }

    private static boolean hasHeaderToken(List<String> values, String token) {
        for (String value : values) {
            for (String part : value.split(",")) {
                if (token.equalsIgnoreCase(part.trim())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ServerConnection{id=" + id + ", remoteAddress=" + remoteAddress + ", state=" + state() + "}";
    }
}
