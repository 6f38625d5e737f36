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

package dev.nishisan.actuator.health;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reports DOWN when the free space of the file store holding {@code path} drops below
 * a threshold.
 */
public final class DiskSpaceHealthIndicator implements HealthIndicator {
    public static final String NAME = "diskSpace";
    public static final long DEFAULT_THRESHOLD_BYTES = 100L * 1024 * 1024;

    private final Path path;
    private final long thresholdBytes;
    private final DiskUsageProvider usageProvider;

    public DiskSpaceHealthIndicator(Path path, long thresholdBytes) {
        this(path, thresholdBytes, DiskUsageProvider.fileStore());
    }

    public DiskSpaceHealthIndicator(Path path, long thresholdBytes, DiskUsageProvider usageProvider) {
        if (thresholdBytes < 0) {
            throw new IllegalArgumentException("thresholdBytes must not be negative");
        }
        this.path = Objects.requireNonNull(path, "path");
        this.thresholdBytes = thresholdBytes;
        this.usageProvider = Objects.requireNonNull(usageProvider, "usageProvider");
    }

    @Override
    public HealthReport health() throws IOException {
        DiskUsage usage = usageProvider.usage(path);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total", usage.total());
        details.put("free", usage.free());
        details.put("threshold", thresholdBytes);
        return usage.free() < thresholdBytes ? HealthReport.down(details) : HealthReport.up(details);
    }

    public Path path() {
        return path;
    }

    public long thresholdBytes() {
        return thresholdBytes;
    }
}
