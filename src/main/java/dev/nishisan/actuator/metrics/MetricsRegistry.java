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

import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.common.MetricNotFoundException;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Enumerates and measures metrics across a list of {@link MetricProvider}s. The first
 * provider that knows a name wins.
 */
public final class MetricsRegistry {
    private final List<MetricProvider> providers = new CopyOnWriteArrayList<>();

    public MetricsRegistry() {
        this(List.of(new JvmMetricProvider()));
    }

    public MetricsRegistry(List<MetricProvider> providers) {
        Objects.requireNonNull(providers, "providers").forEach(this::addProvider);
    }

    public void addProvider(MetricProvider provider) {
        providers.add(Objects.requireNonNull(provider, "provider"));
    }

    public MetricNamesReport getMetricNames() {
        SortedSet<String> names = new TreeSet<>();
        for (MetricProvider provider : providers) {
            names.addAll(provider.metricNames());
        }
        return new MetricNamesReport(Collections.unmodifiableSortedSet(names));
    }

    /**
     * @throws InvalidArgumentException if {@code name} is blank
     * @throws MetricNotFoundException  if no provider reports {@code name}
     */
    public Metric getMetricMeasurement(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Metric name must not be blank");
        }
        for (MetricProvider provider : providers) {
            Optional<Metric> metric = provider.measure(name);
            if (metric.isPresent()) {
                return metric.get();
            }
        }
        throw new MetricNotFoundException(name);
    }
}
