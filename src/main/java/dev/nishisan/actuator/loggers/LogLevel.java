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

package dev.nishisan.actuator.loggers;

import dev.nishisan.actuator.common.InvalidArgumentException;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Logger levels as the monitoring UI names them, mapped onto {@link java.util.logging.Level}.
 */
public enum LogLevel {
    OFF(Level.OFF),
    ERROR(Level.SEVERE),
    WARN(Level.WARNING),
    INFO(Level.INFO),
    DEBUG(Level.FINE),
    TRACE(Level.FINEST);

    private final Level julLevel;

    LogLevel(Level julLevel) {
        this.julLevel = julLevel;
    }

    public Level toJulLevel() {
        return julLevel;
    }

    /**
     * Maps any JUL level, including custom ones, to the closest name by numeric value.
     */
    public static LogLevel fromJulLevel(Level level) {
        int value = level.intValue();
        if (value == Level.OFF.intValue()) {
            return OFF;
        }
        if (value >= Level.SEVERE.intValue()) {
            return ERROR;
        }
        if (value >= Level.WARNING.intValue()) {
            return WARN;
        }
        if (value >= Level.INFO.intValue()) {
            return INFO;
        }
        if (value >= Level.FINE.intValue()) {
            return DEBUG;
        }
        return TRACE;
    }

    /**
     * @throws InvalidArgumentException if {@code name} is not one of the constants (case-insensitive)
     */
    public static LogLevel parse(String name) {
        try {
            return LogLevel.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Unknown log level: " + name, e);
        }
    }
}
