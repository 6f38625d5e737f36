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

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Process and JVM metrics read from the platform MXBeans.
 *
 * <p>
 * Garbage collector and memory pool metrics are discovered on every call, so a
 * collector or pool that appears later is reported without re-registration.
 * </p>
 */
public final class JvmMetricProvider implements MetricProvider {
    private final Map<String, Supplier<Metric>> fixed = new LinkedHashMap<>();

    public JvmMetricProvider() {
        this(new ProcessMemoryReader());
    }

    JvmMetricProvider(ProcessMemoryReader memoryReader) {
        fixed.put(ActuatorMetrics.MEMORY_RSS, () -> Metric.of(ActuatorMetrics.MEMORY_RSS,
                "Resident set size of the process", "bytes", Statistic.VALUE, memoryReader.residentSetBytes()));
        fixed.put(ActuatorMetrics.THREAD_COUNT, () -> Metric.of(ActuatorMetrics.THREAD_COUNT,
                "Live threads, daemon and non-daemon", null, Statistic.COUNT,
                ManagementFactory.getThreadMXBean().getThreadCount()));
        fixed.put(ActuatorMetrics.THREADS_DAEMON, () -> Metric.of(ActuatorMetrics.THREADS_DAEMON,
                "Live daemon threads", null, Statistic.COUNT,
                ManagementFactory.getThreadMXBean().getDaemonThreadCount()));
        fixed.put(ActuatorMetrics.THREADS_PEAK, () -> Metric.of(ActuatorMetrics.THREADS_PEAK,
                "Peak live thread count since JVM start", null, Statistic.COUNT,
                ManagementFactory.getThreadMXBean().getPeakThreadCount()));
        fixed.put(ActuatorMetrics.HEAP_USED, () -> Metric.of(ActuatorMetrics.HEAP_USED,
                "Used heap memory", "bytes", Statistic.VALUE,
                ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getUsed()));
        fixed.put(ActuatorMetrics.NON_HEAP_USED, () -> Metric.of(ActuatorMetrics.NON_HEAP_USED,
                "Used non-heap memory", "bytes", Statistic.VALUE,
                ManagementFactory.getMemoryMXBean().getNonHeapMemoryUsage().getUsed()));
        fixed.put(ActuatorMetrics.CLASSES_LOADED, () -> Metric.of(ActuatorMetrics.CLASSES_LOADED,
                "Classes currently loaded", null, Statistic.COUNT,
                ManagementFactory.getClassLoadingMXBean().getLoadedClassCount()));
        fixed.put(ActuatorMetrics.PROCESS_UPTIME, () -> Metric.of(ActuatorMetrics.PROCESS_UPTIME,
                "JVM uptime", "seconds", Statistic.VALUE,
                ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0));
        fixed.put(ActuatorMetrics.CPU_COUNT, () -> Metric.of(ActuatorMetrics.CPU_COUNT,
                "Processors available to the JVM", null, Statistic.COUNT,
                Runtime.getRuntime().availableProcessors()));
    }

    @Override
    public Set<String> metricNames() {
        Set<String> names = new TreeSet<>(fixed.keySet());
        for (GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
            names.add(ActuatorMetrics.gcCount(gc.getName()));
            names.add(ActuatorMetrics.gcTime(gc.getName()));
        }
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.isValid()) {
                names.add(ActuatorMetrics.poolUsed(pool.getName()));
            }
        }
        return names;
    }

    @Override
    public Optional<Metric> measure(String name) {
        Supplier<Metric> supplier = fixed.get(name);
        if (supplier != null) {
            return Optional.of(supplier.get());
        }
        for (GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
            if (name.equals(ActuatorMetrics.gcCount(gc.getName()))) {
                return Optional.of(Metric.of(name, "Collections run by " + gc.getName(), null,
                        Statistic.COUNT, Math.max(0L, gc.getCollectionCount())));
            }
            if (name.equals(ActuatorMetrics.gcTime(gc.getName()))) {
                return Optional.of(Metric.of(name, "Accumulated collection time of " + gc.getName(), "milliseconds",
                        Statistic.TOTAL, Math.max(0L, gc.getCollectionTime())));
            }
        }
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (name.equals(ActuatorMetrics.poolUsed(pool.getName())) && pool.isValid()) {
                return Optional.of(Metric.of(name, "Used memory in pool " + pool.getName(), "bytes",
                        Statistic.VALUE, pool.getUsage().getUsed()));
            }
        }
        return Optional.empty();
    }
}
