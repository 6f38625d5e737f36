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

import dev.nishisan.actuator.common.UnavailableException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a fixed, ordered set of named {@link HealthIndicator}s and folds their reports.
 *
 * <h2>Folding rules</h2>
 * <ul>
 * <li>any indicator DOWN, directly or through a nested report in its details: DOWN</li>
 * <li>otherwise any OUT_OF_SERVICE: OUT_OF_SERVICE</li>
 * <li>otherwise every indicator UP: UP</li>
 * <li>otherwise (some UNKNOWN, or no indicators at all): UNKNOWN</li>
 * </ul>
 *
 * <p>
 * An indicator that throws is reported as DOWN with an {@code error} detail; the
 * failure never reaches the caller of {@link #getHealth()}.
 * </p>
 */
public final class HealthAggregator {
    private static final Logger LOGGER = Logger.getLogger(HealthAggregator.class.getName());

    private final Map<String, HealthIndicator> indicators;

    public HealthAggregator(Map<String, HealthIndicator> indicators) {
        Objects.requireNonNull(indicators, "indicators");
        Map<String, HealthIndicator> copy = new LinkedHashMap<>();
        indicators.forEach((name, indicator) -> copy.put(
                Objects.requireNonNull(name, "indicator name"),
                Objects.requireNonNull(indicator, "indicator " + name)));
        this.indicators = Collections.unmodifiableMap(copy);
    }

    public HealthReport getHealth() {
        Map<String, HealthReport> reports = new LinkedHashMap<>();
        indicators.forEach((name, indicator) -> reports.put(name, evaluate(name, indicator)));
        return new HealthReport(fold(reports.values()), new LinkedHashMap<>(reports));
    }

    public Collection<String> indicatorNames() {
        return indicators.keySet();
    }

    static HealthStatus fold(Collection<HealthReport> reports) {
        if (reports.isEmpty()) {
            return HealthStatus.UNKNOWN;
        }
        boolean allUp = true;
        boolean outOfService = false;
        for (HealthReport report : reports) {
            if (isDown(report)) {
                return HealthStatus.DOWN;
            }
            switch (report.status()) {
                case OUT_OF_SERVICE:
                    outOfService = true;
                    allUp = false;
                    break;
                case UNKNOWN:
                    allUp = false;
                    break;
                default:
                    break;
            }
        }
        if (outOfService) {
            return HealthStatus.OUT_OF_SERVICE;
        }
        return allUp ? HealthStatus.UP : HealthStatus.UNKNOWN;
    }

    private static boolean isDown(HealthReport report) {
        if (report.status() == HealthStatus.DOWN) {
            return true;
        }
        for (Object detail : report.details().values()) {
            if (detail instanceof HealthReport && isDown((HealthReport) detail)) {
                return true;
            }
        }
        return false;
    }

    private static HealthReport evaluate(String name, HealthIndicator indicator) {
        try {
            HealthReport report = indicator.health();
            return report != null ? report : HealthReport.of(HealthStatus.UNKNOWN);
        } catch (Throwable e) {
            UnavailableException failure = new UnavailableException(name, e);
            LOGGER.log(Level.WARNING, "Health indicator '" + name + "' failed", failure);
            return HealthReport.down(Map.of("error", e.getClass().getName() + ": " + e.getMessage()));
        }
    }
}
