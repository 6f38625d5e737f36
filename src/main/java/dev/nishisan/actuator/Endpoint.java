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

package dev.nishisan.actuator;

import java.util.Optional;

/**
 * Introspection endpoints served by an adapter under the management URL.
 */
public enum Endpoint {
    ENV("env"),
    INFO("info"),
    HEALTH("health"),
    METRICS("metrics"),
    LOGGERS("loggers"),
    LOGFILE("logfile"),
    HTTP_TRACE("httptrace", "trace"),
    THREAD_DUMP("threaddump", "dump");

    private final String path;
    private final String alias;

    Endpoint(String path) {
        this(path, null);
    }

    Endpoint(String path, String alias) {
        this.path = path;
        this.alias = alias;
    }

    public String path() {
        return path;
    }

    /**
     * Resolves the first path segment after the management prefix, accepting the legacy
     * {@code trace} and {@code dump} aliases.
     */
    public static Optional<Endpoint> fromPath(String segment) {
        for (Endpoint endpoint : values()) {
            if (endpoint.path.equals(segment) || segment.equals(endpoint.alias)) {
                return Optional.of(endpoint);
            }
        }
        return Optional.empty();
    }
}
