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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Single-line formatter: {@code <timestamp> <LEVEL> <thread-id> --- <logger> : <message>},
 * followed by the stack trace when the record carries a throwable.
 */
public class LogLineFormatter extends Formatter {
    public static final String DEFAULT_PATTERN = "%1$tF %1$tT.%1$tL %2$-7s %3$d --- %4$s : %5$s%6$s";

    private final String pattern;

    public LogLineFormatter() {
        this(DEFAULT_PATTERN);
    }

    public LogLineFormatter(String pattern) {
        this.pattern = pattern;
    }

    @Override
    public String format(LogRecord record) {
        ZonedDateTime time = ZonedDateTime.ofInstant(record.getInstant(), ZoneId.systemDefault());
        String throwable = "";
        if (record.getThrown() != null) {
            StringWriter sw = new StringWriter();
            try (PrintWriter pw = new PrintWriter(sw)) {
                pw.println();
                record.getThrown().printStackTrace(pw);
            }
            throwable = sw.toString();
        }
        return String.format(pattern,
                time,
                record.getLevel().getName(),
                record.getLongThreadID(),
                record.getLoggerName(),
                formatMessage(record),
                throwable);
    }
}
