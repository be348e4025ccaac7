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

package com.kiln.internal.reactor;

import com.kiln.Request;
import com.kiln.StatusCode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestParserTests {

    private static final ReactorOptions DEFAULT_OPTIONS = new ReactorOptions();

    @Test
    public void simpleGet() {
        String raw = "GET /validate/42/justatest?verbose=true HTTP/1.1\r\nHost: localhost\r\nAccept: */*\r\n\r\n";
        Request request = parseWhole(raw, DEFAULT_OPTIONS);

        assertEquals("GET", request.getMethodToken());
        assertEquals("/validate/42/justatest", request.getPath());
        assertEquals(Optional.of("verbose=true"), request.getQueryString());
        assertEquals(Request.HTTP_1_1, request.getProtocol());
        assertEquals(Optional.of("localhost"), request.getHeader("host"));
        assertEquals(0, request.getBody().length);
    }

    @Test
    public void byteAtATimeMatchesWholeBuffer() {
        List<String> raws = List.of(
                "GET / HTTP/1.1\r\nHost: a\r\n\r\n",
                "POST /form HTTP/1.1\r\nContent-Type: application/x-www-form-urlencoded\r\nContent-Length: 11\r\n\r\nname=value1",
                "PUT /chunks HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n5;ext=1\r\nhello\r\n6\r\n world\r\n0\r\nTrailer: x\r\n\r\n",
                "\r\nGET /after-blank-line HTTP/1.0\r\n\r\n");

        for (String raw : raws) {
            Request whole = parseWhole(raw, DEFAULT_OPTIONS);
            Request incremental = parseByteAtATime(raw, DEFAULT_OPTIONS);

            assertEquals(whole.getMethodToken(), incremental.getMethodToken(), raw);
            assertEquals(whole.getTarget(), incremental.getTarget(), raw);
            assertEquals(whole.getProtocol(), incremental.getProtocol(), raw);
            assertEquals(whole.getHeaders(), incremental.getHeaders(), raw);
            assertArrayEquals(whole.getBody(), incremental.getBody(), raw);
        }
    }

    @Test
    public void chunkedBodyIsReassembled() {
        Request request = parseByteAtATime("POST /x HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n5\r\nhello\r\n6\r\n world\r\n0\r\n\r\n",
                DEFAULT_OPTIONS);

        assertEquals("hello world", new String(request.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void missingVersionMeansHttp10() {
        Request request = parseWhole("GET /legacy\r\n\r\n", DEFAULT_OPTIONS);

        assertEquals(Request.HTTP_1_0, request.getProtocol());
        assertEquals("/legacy", request.getPath());
    }

    @Test
    public void partialRequestIsNotComplete() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, DEFAULT_OPTIONS);

        tokenizer.add(ascii("POST /x HTTP/1.1\r\nContent-Length: 10\r\n\r\nabc"));

        assertFalse(parser.parse());
        assertTrue(parser.hasStarted());
        assertEquals(ConnectionState.AWAITING_BODY, parser.connectionState());

        tokenizer.add(ascii("defghij"));

        assertTrue(parser.parse());
        assertEquals(ConnectionState.READY_TO_DISPATCH, parser.connectionState());
    }

    @Test
    public void pipelinedRequestsParseInOrder() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ascii("GET /first HTTP/1.1\r\n\r\nGET /second HTTP/1.1\r\n\r\n"));

        RequestParser first = new RequestParser(tokenizer, DEFAULT_OPTIONS);
        assertTrue(first.parse());
        assertEquals("/first", first.request(null, null).getPath());

        tokenizer.compact();

        RequestParser second = new RequestParser(tokenizer, DEFAULT_OPTIONS);
        assertTrue(second.parse());
        assertEquals("/second", second.request(null, null).getPath());
        assertEquals(0, tokenizer.remaining());
    }

    @Test
    public void requestLineTooLong() {
        ReactorOptions options = new ReactorOptions().withMaximumRequestLineSize(32);
        String longTarget = "/" + "a".repeat(100);

        assertStatus(StatusCode.HTTP_414, "GET " + longTarget + " HTTP/1.1\r\n\r\n", options);
        // Also detected before the line terminator arrives
        assertStatus(StatusCode.HTTP_414, "GET " + longTarget, options);
    }

    @Test
    public void headersTooLarge() {
        ReactorOptions options = new ReactorOptions().withMaximumHeaderSize(64);

        assertStatus(StatusCode.HTTP_431, "GET / HTTP/1.1\r\nX-Big: " + "b".repeat(100) + "\r\n\r\n", options);
    }

    @Test
    public void bodyTooLarge() {
        ReactorOptions options = new ReactorOptions().withMaximumBodySize(10);

        assertStatus(StatusCode.HTTP_413, "POST / HTTP/1.1\r\nContent-Length: 100\r\n\r\n", options);
        assertStatus(StatusCode.HTTP_413, "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n20\r\n", options);
    }

    @Test
    public void chunkSizesCannotOverflowTheLimit() {
        ReactorOptions options = new ReactorOptions().withMaximumBodySize(10);

        assertStatus(StatusCode.HTTP_413,
                "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n1\r\na\r\n7fffffffffffffff\r\n", options);
        assertStatus(StatusCode.HTTP_413,
                "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n5\r\nabcde\r\n6\r\n", options);
        assertStatus(StatusCode.HTTP_413,
                "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n7fffffffffffffff\r\n", DEFAULT_OPTIONS);
    }

    @Test
    public void unterminatedChunkSizeLineIsBounded() {
        ReactorOptions options = new ReactorOptions().withMaximumRequestLineSize(32);
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, options);

        tokenizer.add(ascii("POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n"));
        assertFalse(parser.parse());
        tokenizer.add(ascii("0".repeat(16)));
        assertFalse(parser.parse());
        tokenizer.add(ascii("0".repeat(64)));

        MalformedRequestException e = assertThrows(MalformedRequestException.class, parser::parse);
        assertEquals(StatusCode.HTTP_400, e.getStatusCode());

        assertStatus(StatusCode.HTTP_400,
                "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n" + "0".repeat(64) + "1\r\n", options);
    }

    @Test
    public void unterminatedChunkDataIsBounded() {
        ReactorOptions options = new ReactorOptions().withMaximumRequestLineSize(32);
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, options);

        tokenizer.add(ascii("POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n1\r\na"));
        assertFalse(parser.parse());
        tokenizer.add(ascii("x".repeat(64)));

        assertThrows(MalformedRequestException.class, parser::parse);
    }

    @Test
    public void unsupportedVersion() {
        assertStatus(StatusCode.HTTP_505, "GET / HTTP/2.0\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400, "GET / HTTP/one\r\n\r\n", DEFAULT_OPTIONS);
    }

    @Test
    public void ambiguousFramingIsRejected() {
        assertStatus(StatusCode.HTTP_400,
                "POST / HTTP/1.1\r\nContent-Length: 5\r\nTransfer-Encoding: chunked\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400,
                "POST / HTTP/1.1\r\nContent-Length: 5\r\nContent-Length: 6\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400,
                "POST / HTTP/1.1\r\nTransfer-Encoding: gzip\r\n\r\n", DEFAULT_OPTIONS);
    }

    @Test
    public void malformedLinesAreRejected() {
        assertStatus(StatusCode.HTTP_400, "GET\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400, "G(T / HTTP/1.1\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400, "GET / HTTP/1.1\r\nNoColon\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400, "GET / HTTP/1.1\r\nName : value\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400, "GET / HTTP/1.1\r\nA: b\r\n folded\r\n\r\n", DEFAULT_OPTIONS);
        assertStatus(StatusCode.HTTP_400, "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\nzz\r\n", DEFAULT_OPTIONS);
    }

    private static void assertStatus(StatusCode expected, String raw, ReactorOptions options) {
        MalformedRequestException e = assertThrows(MalformedRequestException.class, () -> parseWhole(raw, options));
        assertEquals(expected, e.getStatusCode(), raw);
    }

    private static Request parseWhole(String raw, ReactorOptions options) {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, options);
        tokenizer.add(ascii(raw));
        assertTrue(parser.parse(), "request should be complete");
        return parser.request(null, null);
    }

    private static Request parseByteAtATime(String raw, ReactorOptions options) {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, options);
        byte[] bytes = ascii(raw);
        for (int i = 0; i < bytes.length; i++) {
            tokenizer.add(new byte[]{bytes[i]});
            boolean done = parser.parse();
            assertEquals(i == bytes.length - 1, done, "completion at byte " + i);
        }
        return parser.request(null, null);
    }

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }
}
