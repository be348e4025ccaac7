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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResponseParserTests {

    private static final int MAXIMUM_RESPONSE_SIZE = 1_024;

    @Test
    public void contentLengthBody() {
        ParsedResponse response = parseByteAtATime(
                "HTTP/1.1 200 OK\r\nContent-Type: text/plain\r\nSet-Cookie: a=1\r\nSet-Cookie: b=2\r\nContent-Length: 5\r\n\r\nhello", false);

        assertEquals("HTTP/1.1", response.protocol());
        assertEquals(200, response.statusCode());
        assertEquals("OK", response.reasonPhrase());
        assertEquals(4, response.headers().size());
        assertEquals("hello", body(response));
    }

    @Test
    public void chunkedBody() {
        ParsedResponse response = parseByteAtATime(
                "HTTP/1.1 201 Created\r\nTransfer-Encoding: chunked\r\n\r\n3\r\nabc\r\n2;x=y\r\nde\r\n0\r\n\r\n", false);

        assertEquals(201, response.statusCode());
        assertEquals("abcde", body(response));
    }

    @Test
    public void bodyDelimitedByClose() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        ResponseParser parser = new ResponseParser(tokenizer, false, MAXIMUM_RESPONSE_SIZE);

        tokenizer.add(ascii("HTTP/1.0 200 OK\r\n\r\npart one, "));
        assertFalse(parser.parse());
        tokenizer.add(ascii("part two"));
        assertFalse(parser.parse());

        ParsedResponse response = parser.endOfStream();
        assertEquals("part one, part two", body(response));
    }

    @Test
    public void truncatedResponseIsIncomplete() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        ResponseParser parser = new ResponseParser(tokenizer, false, MAXIMUM_RESPONSE_SIZE);

        tokenizer.add(ascii("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\nabc"));
        assertFalse(parser.parse());
        assertNull(parser.endOfStream());
    }

    @Test
    public void bodylessResponses() {
        assertEquals("", body(parseWhole("HTTP/1.1 200 OK\r\nContent-Length: 42\r\n\r\n", true)));
        assertEquals("", body(parseWhole("HTTP/1.1 204 No Content\r\n\r\n", false)));
        assertEquals("", body(parseWhole("HTTP/1.1 304 Not Modified\r\nContent-Length: 7\r\n\r\n", false)));
    }

    @Test
    public void interimResponsesAreSkipped() {
        ParsedResponse response = parseWhole(
                "HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 200 OK\r\nContent-Length: 2\r\n\r\nok", false);

        assertEquals(200, response.statusCode());
        assertEquals(1, response.headers().size());
        assertEquals("ok", body(response));
    }

    @Test
    public void missingReasonPhrase() {
        ParsedResponse response = parseWhole("HTTP/1.1 200\r\nContent-Length: 0\r\n\r\n", false);

        assertEquals(200, response.statusCode());
        assertEquals("", response.reasonPhrase());
    }

    @Test
    public void malformedResponses() {
        assertThrows(MalformedResponseException.class, () -> parseWhole("SMTP ready\r\n\r\n", false));
        assertThrows(MalformedResponseException.class, () -> parseWhole("HTTP/1.1 200 OK\r\nbroken\r\n\r\n", false));
        assertThrows(MalformedResponseException.class, () -> parseWhole("HTTP/1.1 200 OK\r\nContent-Length: x\r\n\r\n", false));
        assertThrows(MalformedResponseException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\nnope\r\n", false));
    }

    @Test
    public void declaredLengthOverLimitIsRejected() {
        assertThrows(ResponseTooLargeException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nContent-Length: 2147483647\r\n\r\n", false));
        assertThrows(ResponseTooLargeException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nContent-Length: 99999999999999\r\n\r\n", false));
        assertThrows(ResponseTooLargeException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nContent-Length: 1025\r\n\r\n", false));
    }

    @Test
    public void chunkSizesCannotOverflowTheLimit() {
        assertThrows(ResponseTooLargeException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n7fffffff\r\n", false));
        assertThrows(ResponseTooLargeException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n1\r\na\r\n7fffffffffffffff\r\n", false));
        assertThrows(ResponseTooLargeException.class,
                () -> parseWhole("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n200\r\n" + "a".repeat(512)
                        + "\r\n201\r\n", false));
    }

    @Test
    public void unboundedInputIsCutOff() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        ResponseParser parser = new ResponseParser(tokenizer, false, MAXIMUM_RESPONSE_SIZE);

        tokenizer.add(ascii("HTTP/1.0 200 OK\r\n\r\n"));
        assertFalse(parser.parse());
        tokenizer.add(new byte[MAXIMUM_RESPONSE_SIZE]);
        assertThrows(ResponseTooLargeException.class, parser::parse);

        ByteTokenizer headerTokenizer = new ByteTokenizer();
        ResponseParser headerParser = new ResponseParser(headerTokenizer, false, MAXIMUM_RESPONSE_SIZE);
        headerTokenizer.add(ascii("HTTP/1.1 200 OK\r\nX-Filler: " + "x".repeat(MAXIMUM_RESPONSE_SIZE)));
        assertThrows(ResponseTooLargeException.class, headerParser::parse);
    }

    private static ParsedResponse parseWhole(String raw, boolean headRequest) {
        ByteTokenizer tokenizer = new ByteTokenizer();
        ResponseParser parser = new ResponseParser(tokenizer, headRequest, MAXIMUM_RESPONSE_SIZE);
        tokenizer.add(ascii(raw));
        assertTrue(parser.parse(), "response should be complete");
        return parser.response();
    }

    private static ParsedResponse parseByteAtATime(String raw, boolean headRequest) {
        ByteTokenizer tokenizer = new ByteTokenizer();
        ResponseParser parser = new ResponseParser(tokenizer, headRequest, MAXIMUM_RESPONSE_SIZE);
        byte[] bytes = ascii(raw);
        for (int i = 0; i < bytes.length; i++) {
            tokenizer.add(new byte[]{bytes[i]});
            assertEquals(i == bytes.length - 1, parser.parse(), "completion at byte " + i);
        }
        return parser.response();
    }

    private static String body(ParsedResponse response) {
        return new String(response.body(), StandardCharsets.UTF_8);
    }

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }
}
