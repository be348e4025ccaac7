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

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Bytes received on one connection that no parser has consumed yet.
 * <p>
 * Input is appended at the tail and taken from the head, either as CRLF-terminated lines or as runs of a known
 * length. A line search that comes up short records how far it got, so input arriving a few bytes at a time is
 * scanned once rather than once per read.
 */
final class ByteTokenizer {
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] EMPTY = new byte[0];

    private byte[] buffer = EMPTY;
    private int head;
    private int tail;
    // No CRLF starts at an index below this one.
    private int scanMark;
    private long received;

    int remaining() {
        return tail - head;
    }

    /**
     * Total bytes added over the tokenizer's lifetime, consumed or not.
     */
    long received() {
        return received;
    }

    /**
     * Moves unconsumed bytes to the front of the buffer, releasing the consumed prefix.
     */
    void compact() {
        if (head == 0) {
            return;
        }
        int unconsumed = remaining();
        if (unconsumed == 0) {
            buffer = EMPTY;
        } else {
            System.arraycopy(buffer, head, buffer, 0, unconsumed);
        }
        scanMark = Math.max(0, scanMark - head);
        head = 0;
        tail = unconsumed;
    }

    void add(ByteBuffer source) {
        int count = source.remaining();
        reserve(count);
        source.get(buffer, tail, count);
        tail += count;
        received += count;
    }

    void add(byte[] source) {
        reserve(source.length);
        System.arraycopy(source, 0, buffer, tail, source.length);
        tail += source.length;
        received += source.length;
    }

    private void reserve(int count) {
        if (buffer.length - tail >= count) {
            return;
        }
        int required = tail + count;
        buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
    }

    /**
     * Takes the next line without its CRLF terminator, or returns {@code null} if no complete line is buffered.
     */
    byte[] nextLine() {
        for (int i = Math.max(head, scanMark); i + 1 < tail; i++) {
            if (buffer[i] == CR && buffer[i + 1] == LF) {
                byte[] line = Arrays.copyOfRange(buffer, head, i);
                head = i + 2;
                scanMark = head;
                return line;
            }
        }
        scanMark = Math.max(head, tail - 1);
        return null;
    }

    /**
     * Takes exactly {@code length} bytes, or returns {@code null} if fewer are buffered.
     */
    byte[] next(int length) {
        if (remaining() < length) {
            return null;
        }
        byte[] run = Arrays.copyOfRange(buffer, head, head + length);
        head += length;
        return run;
    }

    /**
     * Takes everything buffered.
     */
    byte[] drain() {
        byte[] rest = Arrays.copyOfRange(buffer, head, tail);
        head = tail;
        scanMark = tail;
        return rest;
    }
}
