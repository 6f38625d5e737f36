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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a health check. For the aggregate report, {@code details} maps each
 * indicator name to that indicator's own report.
 *
 * @param status  the folded or reported status
 * @param details free-form details, insertion ordered
 */
public record HealthReport(HealthStatus status, Map<String, Object> details) {

    public HealthReport {
        Objects.requireNonNull(status, "status");
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthReport of(HealthStatus status) {
        return new HealthReport(status, Map.of());
    }

    public static HealthReport up(Map<String, Object> details) {
        return new HealthReport(HealthStatus.UP, details);
    }

    public static HealthReport down(Map<String, Object> details) {
        return new HealthReport(HealthStatus.DOWN, details);
    }

    /**
     * HTTP status an adapter should answer with: 200 for UP and UNKNOWN,
     * 503 for DOWN and OUT_OF_SERVICE.
     */
    public int httpStatus() {
        return status.httpStatus();
    }
}
