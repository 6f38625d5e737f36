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

import dev.nishisan.actuator.common.InvalidArgumentException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single HTTP byte-range specifier, before it is resolved against a document length.
 * Either bound may be absent: {@code bytes=N-} has no last position and {@code bytes=-N}
 * has no first position (its {@code last} then holds the suffix length).
 */
record ByteRange(Long first, Long last, String raw) {

    private static final Pattern RANGE = Pattern.compile("^\\s*bytes\\s*=\\s*(\\d*)\\s*-\\s*(\\d*)\\s*$");

    static ByteRange parse(String header) {
        if (header == null || header.isBlank()) {
            throw new InvalidArgumentException("Range header is empty");
        }
        Matcher matcher = RANGE.matcher(header);
        if (!matcher.matches()) {
            throw new InvalidArgumentException("Unsupported range header: " + header);
        }
        String first = matcher.group(1);
        String last = matcher.group(2);
        if (first.isEmpty() && last.isEmpty()) {
            throw new InvalidArgumentException("Range header has no bounds: " + header);
        }
        try {
            return new ByteRange(first.isEmpty() ? null : Long.parseLong(first),
                    last.isEmpty() ? null : Long.parseLong(last),
                    header.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Range bound out of range: " + header, e);
        }
    }

    boolean isSuffix() {
        return first == null;
    }
}
