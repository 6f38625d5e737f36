/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.actuator.logfile;

import dev.nishisan.actuator.common.RangeNotSatisfiableException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, in-memory byte sink for emitted log lines.
 *
 * <p>
 * Lines are stored UTF-8 encoded, each followed by {@code '\n'}. Reads address the
 * buffer by byte offset using HTTP range semantics so a "tail the log" client can poll
 * for whatever was appended since its last request.
 * </p>
 */
public final class LogCapture {
    private static final int INITIAL_CAPACITY = 8 * 1024;
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
    private static final byte LINE_TERMINATOR = '\n';

    private final ReentrantLock lock = new ReentrantLock();
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;

    /**
     * Appends {@code line} followed by a line terminator.
     *
     * @param line the text to append, never {@code null}
     */
    public void append(String line) {
        byte[] bytes = Objects.requireNonNull(line, "line").getBytes(StandardCharsets.UTF_8);
        lock.lock();
        try {
            ensureCapacity((long) length + bytes.length + 1);
            System.arraycopy(bytes, 0, buffer, length, bytes.length);
            length += bytes.length;
            buffer[length++] = LINE_TERMINATOR;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Describes the whole captured document, for clients that did not ask for a range.
     */
    public LogFileRange getRange() {
        long total = length();
        return new LogFileRange(0, total, total);
    }

    /**
     * Returns the bytes addressed by a single {@code bytes=} range specifier.
     *
     * @param rangeHeader {@code bytes=start-end}, {@code bytes=start-} or {@code bytes=-suffix}
     * @return the inclusive slice and its resolved bounds
     * @throws dev.nishisan.actuator.common.InvalidArgumentException if the header cannot be parsed
     * @throws RangeNotSatisfiableException if the range starts past the end of the log or is empty
     */
    public LogSlice getLogfile(String rangeHeader) {
        ByteRange range = ByteRange.parse(rangeHeader);
        lock.lock();
        try {
            long total = length;
            long start;
            long end;
            if (range.isSuffix()) {
                start = Math.max(0L, total - range.last());
                end = total - 1;
            } else {
                start = range.first();
                end = range.last() == null ? total - 1 : Math.min(range.last(), total - 1);
            }
            if (start > total || start > end) {
                throw new RangeNotSatisfiableException(range.raw(), total);
            }
            byte[] content = Arrays.copyOfRange(buffer, (int) start, (int) end + 1);
            return new LogSlice(content, start, end, total);
        } finally {
            lock.unlock();
        }
    }

    public long length() {
        lock.lock();
        try {
            return length;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards everything captured so far.
     */
    public void reset() {
        lock.lock();
        try {
            buffer = new byte[INITIAL_CAPACITY];
            length = 0;
        } finally {
            lock.unlock();
        }
    }

    private void ensureCapacity(long required) {
        if (required <= buffer.length) {
            return;
        }
        if (required > MAX_CAPACITY) {
            throw new IllegalStateException("Log capture buffer is full (" + length + " bytes)");
        }
        long grown = Math.max(required, (long) buffer.length * 2);
        buffer = Arrays.copyOf(buffer, (int) Math.min(grown, MAX_CAPACITY));
    }
}
