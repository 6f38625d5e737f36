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

package dev.nishisan.actuator.metrics;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the resident set size of the current process.
 *
 * <p>
 * On Linux the value comes from the {@code VmRSS} line of {@code /proc/self/status}.
 * Elsewhere, or when that file cannot be read, the committed heap plus non-heap memory
 * is used as an approximation.
 * </p>
 */
class ProcessMemoryReader {
    private static final Logger LOGGER = Logger.getLogger(ProcessMemoryReader.class.getName());
    private static final Path PROC_STATUS = Path.of("/proc/self/status");

    private final Path statusFile;

    ProcessMemoryReader() {
        this(PROC_STATUS);
    }

    ProcessMemoryReader(Path statusFile) {
        this.statusFile = statusFile;
    }

    long residentSetBytes() {
        if (Files.isReadable(statusFile)) {
            try {
                Long rss = parseVmRss(Files.readAllLines(statusFile));
                if (rss != null) {
                    return rss;
                }
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Could not read " + statusFile + ", falling back to JVM memory", e);
            }
        }
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        return memory.getHeapMemoryUsage().getCommitted() + memory.getNonHeapMemoryUsage().getCommitted();
    }

    static Long parseVmRss(List<String> lines) {
        for (String line : lines) {
            if (!line.startsWith("VmRSS:")) {
                continue;
            }
            String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
            try {
                long value = Long.parseLong(parts[0]);
                // the kernel always reports kB here
                return parts.length > 1 && parts[1].equalsIgnoreCase("kB") ? value * 1024L : value;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
