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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental HTTP/1.x response parser for outbound requests. Handles Content-Length, chunked and
 * read-until-close framing, and skips interim {@code 1xx} responses.
 */
class ResponseParser {

    private static final byte[] EMPTY_BODY = new byte[]{};
    private static final int RADIX_HEX = 16;

    private static final Pattern STATUS_LINE_PATTERN = Pattern.compile("(HTTP/\\d\\.\\d) (\\d{3})(?: (.*))?");

    enum State {
        STATUS_LINE(p -> p.tokenizer.nextLine(), ResponseParser::parseStatusLine),
        HEADER(p -> p.tokenizer.nextLine(), ResponseParser::parseHeader),
        BODY(p -> p.tokenizer.next(p.contentLength), ResponseParser::parseBody),
        BODY_UNTIL_CLOSE(p -> null, null),
        CHUNK_SIZE(p -> p.tokenizer.nextLine(), ResponseParser::parseChunkSize),
        CHUNK_DATA(p -> p.tokenizer.next(p.chunkSize), ResponseParser::parseChunkData),
        CHUNK_DATA_END(p -> p.tokenizer.nextLine(), ResponseParser::parseChunkDataEnd),
        CHUNK_TRAILER(p -> p.tokenizer.nextLine(), ResponseParser::parseChunkTrailer),
        DONE(null, null);

        final Function<ResponseParser, byte[]> tokenSupplier;
        final BiConsumer<ResponseParser, byte[]> tokenConsumer;

        State(Function<ResponseParser, byte[]> tokenSupplier, BiConsumer<ResponseParser, byte[]> tokenConsumer) {
            this.tokenSupplier = tokenSupplier;
            this.tokenConsumer = tokenConsumer;
        }
    }

    private final ByteTokenizer tokenizer;
    private final boolean headRequest;
    private final int maximumResponseSize;

    private State state = State.STATUS_LINE;
    private int contentLength;
    private int chunkSize;
    private final ByteArrayOutputStream chunks = new ByteArrayOutputStream();

    private String protocol;
    private int statusCode;
    private String reasonPhrase;
    private List<Header> headers = new ArrayList<>();
    private byte[] body;

    ResponseParser(ByteTokenizer tokenizer, boolean headRequest, int maximumResponseSize) {
        this.tokenizer = tokenizer;
        this.headRequest = headRequest;
        this.maximumResponseSize = maximumResponseSize;
    }

    /**
     * @throws ResponseTooLargeException once more than {@code maximumResponseSize} bytes have arrived, or a declared
     *                                   length says they will
     */
    boolean parse() {
        enforceSizeLimit();
        while (state != State.DONE) {
            byte[] token = state.tokenSupplier.apply(this);
            if (token == null) {
                return false;
            }
            state.tokenConsumer.accept(this, token);
        }
        return true;
    }

    /**
     * Called when the peer closes the connection.
     *
     * @return the response, if end-of-stream completes it
     */
    ParsedResponse endOfStream() {
        enforceSizeLimit();
        if (state == State.BODY_UNTIL_CLOSE) {
            body = tokenizer.drain();
            state = State.DONE;
        }
        return state == State.DONE ? response() : null;
    }

    ParsedResponse response() {
        return new ParsedResponse(protocol, statusCode, reasonPhrase, List.copyOf(headers), body);
    }

    private void enforceSizeLimit() {
        if (state != State.DONE && tokenizer.received() > maximumResponseSize) {
            throw new ResponseTooLargeException("response exceeds " + maximumResponseSize + " bytes");
        }
    }

    private void parseStatusLine(byte[] token) {
        String line = new String(token, StandardCharsets.ISO_8859_1);
        Matcher matcher = STATUS_LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new MalformedResponseException("malformed status line: " + line);
        }
        protocol = matcher.group(1);
        statusCode = Integer.parseInt(matcher.group(2));
        reasonPhrase = matcher.group(3) == null ? "" : matcher.group(3);
        headers = new ArrayList<>();
        state = State.HEADER;
    }

    private void parseHeader(byte[] token) {
        if (token.length != 0) {
            int colonIndex = -1;
            for (int i = 0; i < token.length; i++) {
                if (token[i] == ':') {
                    colonIndex = i;
                    break;
                }
            }
            if (colonIndex <= 0) {
                throw new MalformedResponseException("malformed header line");
            }
            String name = new String(token, 0, colonIndex, StandardCharsets.US_ASCII).trim();
            String value = new String(token, colonIndex + 1, token.length - colonIndex - 1, StandardCharsets.ISO_8859_1).trim();
            headers.add(new Header(name, value));
            return;
        }

        // interim responses carry no body and are followed by the real one
        if (statusCode >= 100 && statusCode < 200 && statusCode != 101) {
            state = State.STATUS_LINE;
            return;
        }

        if (headRequest || statusCode == 204 || statusCode == 304 || statusCode < 200) {
            body = EMPTY_BODY;
            state = State.DONE;
            return;
        }

        String transferEncoding = headerValue("Transfer-Encoding");
        if (transferEncoding != null && transferEncoding.toLowerCase(Locale.ROOT).contains("chunked")) {
            state = State.CHUNK_SIZE;
            return;
        }

        String contentLengthValue = headerValue("Content-Length");
        if (contentLengthValue == null) {
            state = State.BODY_UNTIL_CLOSE;
            return;
        }
        long declaredLength;
        try {
            declaredLength = Long.parseLong(contentLengthValue.trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("invalid content-length header value", e);
        }
        if (declaredLength < 0) {
            throw new MalformedResponseException("invalid content-length header value");
        }
        if (declaredLength > maximumResponseSize) {
            throw new ResponseTooLargeException("declared content-length " + declaredLength + " exceeds " + maximumResponseSize + " bytes");
        }
        contentLength = (int) declaredLength;
        if (contentLength == 0) {
            body = EMPTY_BODY;
            state = State.DONE;
        } else {
            state = State.BODY;
        }
    }

    private String headerValue(String name) {
        String value = null;
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                value = header.value();
            }
        }
        return value;
    }

    private void parseBody(byte[] token) {
        body = token;
        state = State.DONE;
    }

    private void parseChunkSize(byte[] token) {
        String line = new String(token, StandardCharsets.US_ASCII);
        int semicolon = line.indexOf(';');
        String sizeToken = (semicolon == -1 ? line : line.substring(0, semicolon)).trim();
        long size;
        try {
            size = Long.parseLong(sizeToken, RADIX_HEX);
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("invalid chunk size", e);
        }
        if (size < 0) {
            throw new MalformedResponseException("invalid chunk size");
        }
        if (size > maximumResponseSize - chunks.size()) {
            throw new ResponseTooLargeException("chunked body exceeds " + maximumResponseSize + " bytes");
        }
        chunkSize = (int) size;
        state = chunkSize == 0 ? State.CHUNK_TRAILER : State.CHUNK_DATA;
    }

    private void parseChunkData(byte[] token) {
        chunks.write(token, 0, token.length);
        state = State.CHUNK_DATA_END;
    }

    private void parseChunkDataEnd(byte[] token) {
        if (token.length != 0) {
            throw new MalformedResponseException("missing CRLF after chunk data");
        }
        state = State.CHUNK_SIZE;
    }

    private void parseChunkTrailer(byte[] token) {
        if (token.length == 0) {
            body = chunks.toByteArray();
            state = State.DONE;
        }
    }

}
