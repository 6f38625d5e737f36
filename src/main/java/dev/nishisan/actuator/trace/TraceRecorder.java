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

package dev.nishisan.actuator.trace;

import dev.nishisan.actuator.buffer.RingBuffer;

import java.util.Objects;

/**
 * Keeps the most recent HTTP exchanges reported by the adapter layer.
 */
public final class TraceRecorder {
    private final RingBuffer<TraceRecord> records;

    public TraceRecorder(int capacity) {
        this.records = new RingBuffer<>(capacity);
    }

    public void addRecord(TraceRecord record) {
        records.push(Objects.requireNonNull(record, "record"));
    }

    public HttpTraceReport getHttpTrace() {
        return new HttpTraceReport(records.snapshot());
    }

    public int capacity() {
        return records.getCapacity();
    }
}
