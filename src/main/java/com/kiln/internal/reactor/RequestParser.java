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
import com.kiln.StatusCode;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Incremental HTTP/1.x request parser over a {@link ByteTokenizer}.
 * <p>
 * {@link #parse()} consumes as many tokens as are buffered and returns {@code true} once a complete request is
 * available. A partial request leaves the parser in its current state, so feeding bytes one at a time or all at once
 * yields the same request.
 */
class RequestParser {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";
    private static final String CHUNKED = "chunked";
    private static final byte[] EMPTY_BODY = new byte[]{};

    private static final int RADIX_HEX = 16;

    private static final Pattern METHOD_PATTERN = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");
    private static final Pattern VERSION_PATTERN = Pattern.compile("HTTP/\\d\\.\\d");

    enum State {
        REQUEST_LINE(p -> p.tokenizer.nextLine(), RequestParser::parseRequestLine),
        HEADER(p -> p.tokenizer.nextLine(), RequestParser::parseHeader),
        BODY(p -> p.tokenizer.next(p.contentLength), RequestParser::parseBody),
        CHUNK_SIZE(p -> p.tokenizer.nextLine(), RequestParser::parseChunkSize),
        CHUNK_DATA(p -> p.tokenizer.next(p.chunkSize), RequestParser::parseChunkData),
        CHUNK_DATA_END(p -> p.tokenizer.nextLine(), RequestParser::parseChunkDataEnd),
        CHUNK_TRAILER(p -> p.tokenizer.nextLine(), RequestParser::parseChunkTrailer),
        DONE(null, null);

        final Function<RequestParser, byte[]> tokenSupplier;
        final BiConsumer<RequestParser, byte[]> tokenConsumer;

        State(Function<RequestParser, byte[]> tokenSupplier, BiConsumer<RequestParser, byte[]> tokenConsumer) {
            this.tokenSupplier = tokenSupplier;
            this.tokenConsumer = tokenConsumer;
        }
    }

    private final ByteTokenizer tokenizer;
    private final ReactorOptions options;

    private State state = State.REQUEST_LINE;
    private int contentLength;
    private int chunkSize;
    private int headerBytes;
    private final ByteArrayOutputStream chunks = new ByteArrayOutputStream();

    private String method;
    private String target;
    private String version;
    private final List<Header> headers = new ArrayList<>();
    private byte[] body;

    RequestParser(ByteTokenizer tokenizer, ReactorOptions options) {
        this.tokenizer = tokenizer;
        this.options = options;
    }

    boolean parse() {
        while (state != State.DONE) {
            byte[] token = state.tokenSupplier.apply(this);
            if (token == null) {
                enforcePendingLimits();
                return false;
            }
            state.tokenConsumer.accept(this, token);
        }
        return true;
    }

    State state() {
        return state;
    }

    ConnectionState connectionState() {
        switch (state) {
            case REQUEST_LINE:
                return ConnectionState.AWAITING_REQUEST_LINE;
            case HEADER:
                return ConnectionState.PARSING_HEADERS;
            case DONE:
                return ConnectionState.READY_TO_DISPATCH;
            default:
                return ConnectionState.AWAITING_BODY;
        }
    }

    /**
     * Whether any bytes of a request have been consumed, used to tell an idle connection from one that stalled
     * mid-request.
     */
    boolean hasStarted() {
        return state != State.REQUEST_LINE;
    }

    String version() {
        return version;
    }

    List<Header> headers() {
        return headers;
    }

    Request request(InetSocketAddress remoteAddress, InetSocketAddress localAddress) {
        Request.Builder builder = Request.with(method, target)
                .protocol(version)
                .body(body)
                .remoteAddress(remoteAddress)
                .localAddress(localAddress);
        for (Header header : headers) {
            builder.header(header.name(), header.value());
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedRequestException("invalid request: " + e.getMessage(), e);
        }
    }

    private void enforcePendingLimits() {
        int pending = tokenizer.remaining();
        if (state == State.REQUEST_LINE && pending > options.maximumRequestLineSize()) {
            throw new MalformedRequestException(StatusCode.HTTP_414, "request line too long");
        }
        if ((state == State.HEADER || state == State.CHUNK_TRAILER)
                && headerBytes + pending > options.maximumHeaderSize()) {
            throw new MalformedRequestException(StatusCode.HTTP_431, "request headers too large");
        }
        // chunk-size lines carry extensions at most, so a request line's allowance is ample
        if ((state == State.CHUNK_SIZE || state == State.CHUNK_DATA_END)
                && pending > options.maximumRequestLineSize()) {
            throw new MalformedRequestException("chunk size line too long");
        }
    }

    private void parseRequestLine(byte[] token) {
        if (token.length == 0) { // tolerate empty lines ahead of the request line
            return;
        }
        if (token.length > options.maximumRequestLineSize()) {
            throw new MalformedRequestException(StatusCode.HTTP_414, "request line too long");
        }
        requireAscii(token, "request line");
        String line = new String(token, StandardCharsets.US_ASCII);
        String[] parts = line.split(" ", -1);
        if (parts.length != 2 && parts.length != 3) {
            throw new MalformedRequestException("malformed request line");
        }
        if (!METHOD_PATTERN.matcher(parts[0]).matches()) {
            throw new MalformedRequestException("invalid method");
        }
        if (parts[1].isEmpty() || !isVisible(parts[1])) {
            throw new MalformedRequestException("invalid request target");
        }
        method = parts[0];
        target = parts[1];
        if (parts.length == 2) { // simple request line without a version
            version = Request.HTTP_1_0;
        } else {
            if (!VERSION_PATTERN.matcher(parts[2]).matches()) {
                throw new MalformedRequestException("invalid version");
            }
            if (!parts[2].equals(Request.HTTP_1_0) && !parts[2].equals(Request.HTTP_1_1)) {
                throw new MalformedRequestException(StatusCode.HTTP_505, "unsupported version " + parts[2]);
            }
            version = parts[2];
        }
        state = State.HEADER;
    }

    private void parseHeader(byte[] token) {
        headerBytes += token.length + CRLF.length;
        if (headerBytes > options.maximumHeaderSize()) {
            throw new MalformedRequestException(StatusCode.HTTP_431, "request headers too large");
        }
        if (token.length != 0) {
            headers.add(parseHeaderLine(token));
            return;
        }

        // CR-LF on own line, end of headers
        Long contentLength = findContentLength();
        boolean hasTransferEncodingHeader = hasTransferEncodingHeader();
        List<String> transferEncodings = findTransferEncodings();

        if (hasTransferEncodingHeader && transferEncodings.isEmpty()) {
            throw new MalformedRequestException("invalid transfer-encoding header value");
        }

        if (contentLength != null && hasTransferEncodingHeader) {
            throw new MalformedRequestException("multiple message lengths");
        }

        if (contentLength == null) {
            if (hasTransferEncodingHeader) {
                if (!hasOnlyChunkedEncoding(transferEncodings)) {
                    throw new MalformedRequestException("unsupported transfer-encoding");
                }
                state = State.CHUNK_SIZE;
            } else {
                body = EMPTY_BODY;
                state = State.DONE;
            }
        } else if (contentLength > options.maximumBodySize()) {
            throw new MalformedRequestException(StatusCode.HTTP_413, "declared content-length exceeds limit");
        } else if (contentLength == 0) {
            body = EMPTY_BODY;
            state = State.DONE;
        } else {
            this.contentLength = contentLength.intValue();
            state = State.BODY;
        }
    }

    private static Header parseHeaderLine(byte[] line) {
        if (line[0] == ' ' || line[0] == '\t') {
            throw new MalformedRequestException("obsolete line folding");
        }
        int colonIndex = indexOfColon(line);
        if (colonIndex <= 0) {
            throw new MalformedRequestException("malformed header line");
        }
        if (line[colonIndex - 1] == ' ' || line[colonIndex - 1] == '\t') {
            throw new MalformedRequestException("whitespace before header colon");
        }
        for (int i = 0; i < colonIndex; i++) {
            int b = line[i] & 0xFF;
            if (b > 0x7F || b <= 0x20) {
                throw new MalformedRequestException("invalid header name");
            }
        }
        int valueStart = colonIndex + 1;
        while (valueStart < line.length && (line[valueStart] == ' ' || line[valueStart] == '\t')) {
            valueStart++;
        }
        int valueEnd = line.length;
        while (valueEnd > valueStart && (line[valueEnd - 1] == ' ' || line[valueEnd - 1] == '\t')) {
            valueEnd--;
        }
        return new Header(
                new String(line, 0, colonIndex, StandardCharsets.US_ASCII),
                new String(line, valueStart, valueEnd - valueStart, StandardCharsets.ISO_8859_1));
    }

    private static int indexOfColon(byte[] line) {
        for (int i = 0; i < line.length; i++) {
            if (line[i] == ':') {
                return i;
            }
        }
        return -1;
    }

    private static boolean isVisible(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c <= 0x20 || c >= 0x7F) {
                return false;
            }
        }
        return true;
    }

    private static void requireAscii(byte[] token, String field) {
        for (byte b : token) {
            if ((b & 0x80) != 0) {
                throw new MalformedRequestException("non-ascii " + field);
            }
        }
    }

    private void parseChunkSize(byte[] token) {
        if (token.length > options.maximumRequestLineSize()) {
            throw new MalformedRequestException("chunk size line too long");
        }
        int end = token.length;
        for (int i = 0; i < token.length; i++) {
            if (token[i] == ';') {
                end = i;
                break;
            }
        }
        String sizeToken = new String(token, 0, end, StandardCharsets.US_ASCII).trim();
        if (sizeToken.isEmpty()) {
            throw new MalformedRequestException("invalid chunk size");
        }
        long size;
        try {
            size = Long.parseLong(sizeToken, RADIX_HEX);
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("invalid chunk size", e);
        }
        if (size < 0) {
            throw new MalformedRequestException("invalid chunk size");
        }
        if (size > options.maximumBodySize() - chunks.size()) {
            throw new MalformedRequestException(StatusCode.HTTP_413, "chunked body exceeds limit");
        }
        chunkSize = (int) size;
        state = chunkSize == 0
                ? State.CHUNK_TRAILER
                : State.CHUNK_DATA;
    }

    private void parseChunkData(byte[] token) {
        chunks.write(token, 0, token.length);
        state = State.CHUNK_DATA_END;
    }

    private void parseChunkDataEnd(byte[] token) {
        if (token.length != 0) {
            throw new MalformedRequestException("missing CRLF after chunk data");
        }
        state = State.CHUNK_SIZE;
    }

    private void parseChunkTrailer(byte[] token) {
        headerBytes += token.length + CRLF.length;
        if (headerBytes > options.maximumHeaderSize()) {
            throw new MalformedRequestException(StatusCode.HTTP_431, "request trailers too large");
        }
        if (token.length == 0) { // blank line indicates end of trailers
            body = chunks.toByteArray();
            state = State.DONE;
        }
    }

    private void parseBody(byte[] token) {
        body = token;
        state = State.DONE;
    }

    private Long findContentLength() {
        Long contentLength = null;
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_CONTENT_LENGTH)) {
                continue;
            }
            // a comma-separated list of identical values is equivalent to one value
            for (String part : header.value().split(",", -1)) {
                long parsed;
                try {
                    parsed = Long.parseLong(part.trim());
                } catch (NumberFormatException e) {
                    throw new MalformedRequestException("invalid content-length header value", e);
                }
                if (parsed < 0) {
                    throw new MalformedRequestException("invalid content-length header value");
                }
                if (contentLength != null && contentLength != parsed) {
                    throw new MalformedRequestException("conflicting content-length header values");
                }
                contentLength = parsed;
            }
        }
        return contentLength;
    }

    private boolean hasTransferEncodingHeader() {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                return true;
            }
        }
        return false;
    }

    private List<String> findTransferEncodings() {
        List<String> transferEncodings = new ArrayList<>();
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                continue;
            }
            for (String part : header.value().split(",")) {
                String normalized = normalizeTransferEncoding(part);
                if (normalized != null) {
                    transferEncodings.add(normalized);
                }
            }
        }
        return transferEncodings;
    }

    private static String normalizeTransferEncoding(String value) {
        String trimmed = value.trim();
        int semicolon = trimmed.indexOf(';');
        String token = (semicolon == -1 ? trimmed : trimmed.substring(0, semicolon)).trim();
        return token.isEmpty() ? null : token.toLowerCase(Locale.ROOT);
    }

    private static boolean hasOnlyChunkedEncoding(List<String> transferEncodings) {
        return transferEncodings.size() == 1 && CHUNKED.equals(transferEncodings.get(0));
    }

}
