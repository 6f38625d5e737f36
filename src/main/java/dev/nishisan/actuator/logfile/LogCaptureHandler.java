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

import java.util.Objects;
import java.util.logging.ErrorManager;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * {@link Handler} that feeds every published record into a {@link LogCapture}.
 * The engine attaches it to the root logger while it is running.
 */
public final class LogCaptureHandler extends Handler {
    private final LogCapture capture;

    public LogCaptureHandler(LogCapture capture) {
        this(capture, new LogLineFormatter(), Level.ALL);
    }

    public LogCaptureHandler(LogCapture capture, Formatter formatter, Level level) {
        this.capture = Objects.requireNonNull(capture, "capture");
        setFormatter(Objects.requireNonNull(formatter, "formatter"));
        setLevel(Objects.requireNonNull(level, "level"));
    }

    @Override
    public void publish(LogRecord record) {
        if (!isLoggable(record)) {
            return;
        }
        String line;
        try {
            line = getFormatter().format(record);
        } catch (RuntimeException e) {
            reportError(null, e, ErrorManager.FORMAT_FAILURE);
            return;
        }
        try {
            capture.append(stripTrailingNewline(line));
        } catch (RuntimeException e) {
            reportError(null, e, ErrorManager.WRITE_FAILURE);
        }
    }

    @Override
    public void flush() {
        // in-memory, nothing buffered
    }

    @Override
    public void close() {
        setLevel(Level.OFF);
    }

    private static String stripTrailingNewline(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
