package dev.nishisan.actuator.health;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthAggregatorTest {

    private static HealthAggregator aggregator(Object... nameAndIndicator) {
        Map<String, HealthIndicator> indicators = new LinkedHashMap<>();
        for (int i = 0; i < nameAndIndicator.length; i += 2) {
            indicators.put((String) nameAndIndicator[i], (HealthIndicator) nameAndIndicator[i + 1]);
        }
        return new HealthAggregator(indicators);
    }

    private static HealthIndicator fixed(HealthStatus status) {
        return () -> HealthReport.of(status);
    }

    @Test
    void allUpIsUp() {
        HealthReport report = aggregator("db", fixed(HealthStatus.UP), "cache", fixed(HealthStatus.UP)).getHealth();

        assertEquals(HealthStatus.UP, report.status());
        assertEquals(200, report.httpStatus());
        assertEquals(List.of("db", "cache"), List.copyOf(report.details().keySet()));
    }

    @Test
    void anyDownIsDown() {
        HealthReport report = aggregator("db", fixed(HealthStatus.UP), "cache", fixed(HealthStatus.DOWN)).getHealth();

        assertEquals(HealthStatus.DOWN, report.status());
        assertEquals(503, report.httpStatus());
    }

    @Test
    void nestedDownDetailIsDown() {
        HealthIndicator composite = () -> HealthReport.up(Map.of("replica", HealthReport.of(HealthStatus.DOWN)));

        assertEquals(HealthStatus.DOWN, aggregator("db", composite).getHealth().status());
    }

    @Test
    void outOfServiceWinsOverUnknown() {
        HealthReport report = aggregator(
                "a", fixed(HealthStatus.UNKNOWN),
                "b", fixed(HealthStatus.OUT_OF_SERVICE),
                "c", fixed(HealthStatus.UP)).getHealth();

        assertEquals(HealthStatus.OUT_OF_SERVICE, report.status());
        assertEquals(503, report.httpStatus());
    }

    @Test
    void unknownWithoutDownIsUnknown() {
        HealthReport report = aggregator("a", fixed(HealthStatus.UP), "b", fixed(HealthStatus.UNKNOWN)).getHealth();

        assertEquals(HealthStatus.UNKNOWN, report.status());
        assertEquals(200, report.httpStatus());
    }

    @Test
    void noIndicatorsIsUnknown() {
        assertEquals(HealthStatus.UNKNOWN, aggregator().getHealth().status());
    }

    @Test
    void failingIndicatorBecomesDownWithError() {
        HealthIndicator failing = () -> {
            throw new IOException("connection refused");
        };

        HealthReport report = aggregator("db", failing, "cache", fixed(HealthStatus.UP)).getHealth();

        assertEquals(HealthStatus.DOWN, report.status());
        HealthReport db = (HealthReport) report.details().get("db");
        assertEquals(HealthStatus.DOWN, db.status());
        assertEquals("java.io.IOException: connection refused", db.details().get("error"));
        assertEquals(HealthStatus.UP, ((HealthReport) report.details().get("cache")).status());
    }

    @Test
    void indicatorErrorBecomesDown() {
        HealthIndicator broken = () -> {
            throw new NoClassDefFoundError("com/acme/Driver");
        };

        HealthReport report = assertDoesNotThrow(
                () -> aggregator("db", broken, "cache", fixed(HealthStatus.UP)).getHealth());

        assertEquals(HealthStatus.DOWN, report.status());
        HealthReport db = (HealthReport) report.details().get("db");
        assertEquals("java.lang.NoClassDefFoundError: com/acme/Driver", db.details().get("error"));
        assertEquals(HealthStatus.UP, ((HealthReport) report.details().get("cache")).status());
    }

    @Test
    void nullReportIsUnknown() {
        HealthReport report = aggregator("lazy", (HealthIndicator) () -> null).getHealth();

        assertEquals(HealthStatus.UNKNOWN, report.status());
    }
}
