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

import java.util.Locale;

/**
 * Metric names reported by the built-in JVM provider.
 */
public final class ActuatorMetrics {
    public static final String MEMORY_RSS = "memory.rss";
    public static final String THREAD_COUNT = "thread.count";
    public static final String THREADS_DAEMON = "jvm.threads.daemon";
    public static final String THREADS_PEAK = "jvm.threads.peak";
    public static final String HEAP_USED = "jvm.memory.heap.used";
    public static final String NON_HEAP_USED = "jvm.memory.nonheap.used";
    public static final String CLASSES_LOADED = "jvm.classes.loaded";
    public static final String PROCESS_UPTIME = "process.uptime";
    public static final String CPU_COUNT = "system.cpu.count";

    private static final String GC_PREFIX = "jvm.gc.";
    private static final String POOL_PREFIX = "jvm.memory.pool.";

    private ActuatorMetrics() {
    }

    public static String gcCount(String collector) {
        return GC_PREFIX + normalize(collector) + ".count";
    }

    public static String gcTime(String collector) {
        return GC_PREFIX + normalize(collector) + ".time";
    }

    public static String poolUsed(String pool) {
        return POOL_PREFIX + normalize(pool) + ".used";
    }

    /**
     * {@code "G1 Young Generation"} becomes {@code "g1_young_generation"}.
     */
    static String normalize(String resourceName) {
        return resourceName.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }
}
