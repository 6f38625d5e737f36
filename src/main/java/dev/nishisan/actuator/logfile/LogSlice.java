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

import java.nio.charset.StandardCharsets;

/**
 * Bytes {@code [start, end]} (inclusive) of the captured log.
 *
 * @param content the slice
 * @param start   first byte offset
 * @param end     last byte offset
 * @param total   log length when the slice was taken
 */
public record LogSlice(byte[] content, long start, long end, long total) {

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /**
     * Value for the {@code Content-Range} response header, in the {@code bytes start-end/end}
     * form expected by the monitoring UI.
     */
    public String contentRange() {
        return "bytes " + start + "-" + end + "/" + end;
    }
}
