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

import java.util.List;
import java.util.Objects;

/**
 * A metric value computed at request time.
 *
 * @param name          metric name, e.g. {@code memory.rss}
 * @param description   optional human readable description
 * @param baseUnit      optional unit, e.g. {@code bytes}
 * @param measurements  ordered measurements
 * @param availableTags always empty, kept for wire compatibility with actuator clients
 */
public record Metric(
        String name,
        String description,
        String baseUnit,
        List<Measurement> measurements,
        List<Object> availableTags) {

    public Metric {
        Objects.requireNonNull(name, "name");
        measurements = List.copyOf(Objects.requireNonNull(measurements, "measurements"));
        availableTags = availableTags == null ? List.of() : List.copyOf(availableTags);
    }

    public static Metric of(String name, String description, String baseUnit, Statistic statistic, double value) {
        return new Metric(name, description, baseUnit, List.of(new Measurement(statistic, value)), List.of());
    }
}
