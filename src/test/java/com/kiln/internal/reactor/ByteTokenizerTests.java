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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ByteTokenizerTests {

    @Test
    public void linesAreTakenWithoutTerminator() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ascii("GET / HTTP/1.1\r\nHost: a\r\n\r\n"));

        assertArrayEquals(ascii("GET / HTTP/1.1"), tokenizer.nextLine());
        assertArrayEquals(ascii("Host: a"), tokenizer.nextLine());
        assertArrayEquals(new byte[0], tokenizer.nextLine());
        assertNull(tokenizer.nextLine());
        assertEquals(0, tokenizer.remaining());
    }

    @Test
    public void terminatorSplitAcrossReads() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ascii("abc\r"));
        assertNull(tokenizer.nextLine());

        tokenizer.add(ascii("\nrest"));
        assertArrayEquals(ascii("abc"), tokenizer.nextLine());
        assertEquals(4, tokenizer.remaining());
    }

    @Test
    public void loneCarriageReturnIsNotATerminator() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ascii("a\rb\r\n"));
        assertArrayEquals(ascii("a\rb"), tokenizer.nextLine());
    }

    @Test
    public void fixedLengthRunsWaitForEnoughBytes() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ByteBuffer.wrap(ascii("hello")));

        assertNull(tokenizer.next(6));
        assertArrayEquals(ascii("hel"), tokenizer.next(3));
        tokenizer.add(ascii(" there\r\n"));
        assertArrayEquals(ascii("lo there"), tokenizer.nextLine());
    }

    @Test
    public void compactionKeepsUnconsumedBytesAndScanProgress() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ascii("one\r\ntwo-part"));
        assertArrayEquals(ascii("one"), tokenizer.nextLine());
        assertNull(tokenizer.nextLine());

        tokenizer.compact();
        assertEquals(8, tokenizer.remaining());

        tokenizer.add(ascii("\r\n"));
        assertArrayEquals(ascii("two-part"), tokenizer.nextLine());

        tokenizer.compact();
        assertEquals(0, tokenizer.remaining());
    }

    @Test
    public void drainTakesEverything() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        tokenizer.add(ascii("x\r\nbody without length"));
        tokenizer.nextLine();

        assertArrayEquals(ascii("body without length"), tokenizer.drain());
        assertEquals(0, tokenizer.remaining());
        assertArrayEquals(new byte[0], tokenizer.drain());
    }

    @Test
    public void byteAtATimeInputFindsEveryLine() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        byte[] input = ascii("first\r\nsecond\r\n");
        int lines = 0;

        for (byte b : input) {
            tokenizer.add(new byte[]{b});
            if (tokenizer.nextLine() != null) {
                lines++;
            }
        }

        assertEquals(2, lines);
        assertEquals(0, tokenizer.remaining());
    }

    private static byte[] ascii(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }
}
