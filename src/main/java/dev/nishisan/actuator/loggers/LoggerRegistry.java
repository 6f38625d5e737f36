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
import dev.nishisan.actuator.common.LoggerNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Reads and changes {@code java.util.logging} logger levels.
 *
 * <p>
 * The JUL root logger (empty name) is exposed as {@value #ROOT_NAME}. Loggers whose
 * level is changed through this registry are kept strongly reachable; JUL only holds
 * weak references, so an otherwise unused logger would lose its level on the next GC.
 * </p>
 */
public final class LoggerRegistry {
    public static final String ROOT_NAME = "ROOT";
    private static final LogLevel DEFAULT_EFFECTIVE_LEVEL = LogLevel.INFO;

    private final LogManager logManager = LogManager.getLogManager();
    private final Map<String, Logger> retained = new ConcurrentHashMap<>();

    public LoggersReport getLoggers() {
        List<String> names = new ArrayList<>();
        Enumeration<String> enumeration = logManager.getLoggerNames();
        while (enumeration.hasMoreElements()) {
            String name = enumeration.nextElement();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        Collections.sort(names);

        Map<String, LoggerConfig> loggers = new LinkedHashMap<>();
        Logger root = logManager.getLogger("");
        if (root != null) {
            loggers.put(ROOT_NAME, describe(root));
        }
        for (String name : names) {
            Logger logger = logManager.getLogger(name);
            if (logger != null) {
                loggers.put(name, describe(logger));
            }
        }
        return new LoggersReport(List.of(LogLevel.values()), Collections.unmodifiableMap(loggers));
    }

    /**
     * @throws LoggerNotFoundException if JUL has no logger with that name
     */
    public LoggerConfig getLogger(String name) {
        requireName(name);
        Logger logger = logManager.getLogger(toJulName(name));
        if (logger == null) {
            throw new LoggerNotFoundException(name);
        }
        return describe(logger);
    }

    /**
     * Sets or clears the configured level of {@code name}, creating the logger if needed.
     *
     * @param name  logger name, {@value #ROOT_NAME} for the root logger
     * @param level level name, or {@code null} to inherit from the parent again
     * @throws InvalidArgumentException if the name is blank or the level unknown
     */
    public void setLoggerLevel(String name, String level) {
        requireName(name);
        Level julLevel = level == null ? null : LogLevel.parse(level).toJulLevel();
        String julName = toJulName(name);
        Logger logger = retained.computeIfAbsent(julName, Logger::getLogger);
        logger.setLevel(julLevel);
    }

    private static LoggerConfig describe(Logger logger) {
        Level configured = logger.getLevel();
        return new LoggerConfig(
                configured == null ? null : LogLevel.fromJulLevel(configured),
                effectiveLevel(logger));
    }

    private static LogLevel effectiveLevel(Logger logger) {
        for (Logger current = logger; current != null; current = current.getParent()) {
            Level level = current.getLevel();
            if (level != null) {
                return LogLevel.fromJulLevel(level);
            }
        }
        return DEFAULT_EFFECTIVE_LEVEL;
    }

    private static String toJulName(String name) {
        return ROOT_NAME.equalsIgnoreCase(name) ? "" : name;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Logger name must not be blank");
        }
    }
}
