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

import java.util.Optional;
import java.util.Set;

/**
 * Source of metrics for the {@link MetricsRegistry}. Implementations compute values on every
 * call; the registry never caches them.
 */
public interface MetricProvider {

    /**
     * Names this provider can report right now. May change between calls for
     * dynamically discovered resources.
     */
    Set<String> metricNames();

    /**
     * @param name metric name
     * @return the current value, or empty if this provider does not know {@code name}
     */
    Optional<Metric> measure(String name);
}
