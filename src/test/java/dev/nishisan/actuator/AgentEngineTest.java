package dev.nishisan.actuator;

import dev.nishisan.actuator.common.EndpointDisabledException;
import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.health.DiskSpaceHealthIndicator;
import dev.nishisan.actuator.health.DiskUsage;
import dev.nishisan.actuator.health.HealthReport;
import dev.nishisan.actuator.health.HealthStatus;
import dev.nishisan.actuator.loggers.LogLevel;
import dev.nishisan.actuator.registration.MockRegistryServer;
import dev.nishisan.actuator.registration.RegistrationConfig;
import dev.nishisan.actuator.registration.RegistrationPhase;
import dev.nishisan.actuator.registration.RegistrationRequest;
import dev.nishisan.actuator.trace.TraceRecord;
import dev.nishisan.actuator.trace.TraceRequest;
import dev.nishisan.actuator.trace.TraceResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(60)
class AgentEngineTest {

    private static AgentConfig.Builder config() {
        return AgentConfig.builder("orders", "http://localhost:8000/", "http://localhost:8000/actuator")
                .appDescription("Order service");
    }

    private static TraceRecord trace(String uri) {
        return TraceRecord.of(Instant.now(), new TraceRequest("GET", uri, Map.of()),
                new TraceResponse(200, Map.of()), 1);
    }

    @Test
    void indexLinksEveryEnabledEndpoint() {
        try (AgentEngine engine = AgentEngine.builder(config().disableEndpoint(Endpoint.ENV).build()).build()) {
            Map<String, IndexReport.Link> links = engine.getIndex().links();

            assertEquals("http://localhost:8000/actuator", links.get("self").href());
            assertEquals("http://localhost:8000/actuator/health", links.get("health").href());
            assertEquals("http://localhost:8000/actuator/threaddump", links.get("threaddump").href());
            assertFalse(links.containsKey("env"));
            assertFalse(links.get("metrics").templated());
        }
    }

    @Test
    void disabledEndpointsAreRejected() {
        AgentConfig config = config()
                .disableEndpoint(Endpoint.ENV)
                .disableEndpoint(Endpoint.HTTP_TRACE)
                .build();
        try (AgentEngine engine = AgentEngine.builder(config).build()) {
            assertThrows(EndpointDisabledException.class, engine::getEnvironment);
            assertThrows(EndpointDisabledException.class, engine::getHttpTrace);

            // recording stays silent while the endpoint is off
            engine.addTraceRecord(trace("/ignored"));
            assertNotNull(engine.getHealth());
        }
    }

    @Test
    void appInfoMergesAdditionalInfo() {
        AgentConfig config = config()
                .additionalAppInfo(Map.of("build", Map.of("version", "1.0"), "app", Map.of("owner", "team-a")))
                .build();
        try (AgentEngine engine = AgentEngine.builder(config).build()) {
            Map<String, Object> info = engine.getAppInfo();

            @SuppressWarnings("unchecked")
            Map<String, Object> app = (Map<String, Object>) info.get("app");
            assertEquals("orders", app.get("name"));
            assertEquals("Order service", app.get("description"));
            assertEquals("team-a", app.get("owner"));
            assertEquals(Map.of("version", "1.0"), info.get("build"));
        }
    }

    @Test
    void healthCombinesDiskSpaceAndCustomIndicators() {
        AgentConfig config = config().diskSpaceThresholdBytes(10_000_000L).build();
        try (AgentEngine engine = AgentEngine.builder(config)
                .diskUsageProvider(path -> new DiskUsage(100_000_000L, 9_999_999L))
                .healthIndicator("db", () -> HealthReport.up(Map.of("pool", 4)))
                .build()) {
            HealthReport health = engine.getHealth();

            assertEquals(HealthStatus.DOWN, health.status());
            assertEquals(503, health.httpStatus());
            assertEquals(List.of(DiskSpaceHealthIndicator.NAME, "db"), List.copyOf(health.details().keySet()));
            HealthReport disk = (HealthReport) health.details().get(DiskSpaceHealthIndicator.NAME);
            assertEquals(9_999_999L, disk.details().get("free"));
        }
    }

    @Test
    void diskSpaceCheckCanBeDisabled() {
        try (AgentEngine engine = AgentEngine.builder(config().diskSpaceCheck(false).build())
                .healthIndicator("db", () -> HealthReport.up(Map.of()))
                .build()) {
            HealthReport health = engine.getHealth();

            assertEquals(HealthStatus.UP, health.status());
            assertFalse(health.details().containsKey(DiskSpaceHealthIndicator.NAME));
        }
    }

    @Test
    void tracesAreKeptUpToCapacity() {
        try (AgentEngine engine = AgentEngine.builder(config().traceCapacity(2).build()).build()) {
            engine.addTraceRecord(trace("/1"));
            engine.addTraceRecord(trace("/2"));
            engine.addTraceRecord(trace("/3"));

            List<TraceRecord> traces = engine.getHttpTrace().traces();
            assertEquals(2, traces.size());
            assertEquals("/2", traces.get(0).request().uri());
        }
    }

    @Test
    void capturesRootLoggerOutputWhileStarted() {
        Logger logger = Logger.getLogger("dev.nishisan.actuator.test.engine");
        try (AgentEngine engine = AgentEngine.builder(config().build()).build()) {
            engine.start();
            logger.warning("captured by the engine");

            String content = engine.getLogfile("bytes=0-").contentAsString();
            assertTrue(content.contains("captured by the engine"));
            assertTrue(engine.getLogRange().total() > 0);

            engine.stop();
            long length = engine.getLogRange().total();
            logger.warning("after stop");
            assertEquals(length, engine.getLogRange().total());
        }
    }

    @Test
    void loggerLevelsRoundTrip() {
        String name = "dev.nishisan.actuator.test.engine.levels";
        try (AgentEngine engine = AgentEngine.builder(config().build()).build()) {
            engine.setLoggerLevel(name, "TRACE");
            assertEquals(LogLevel.TRACE, engine.getLogger(name).configuredLevel());
            assertTrue(engine.getLoggers().loggers().containsKey(name));

            engine.setLoggerLevel(name, null);
            assertNull(engine.getLogger(name).configuredLevel());

            assertThrows(InvalidArgumentException.class, () -> engine.setLoggerLevel("", "INFO"));
            assertThrows(InvalidArgumentException.class, () -> engine.getMetricMeasurement(""));
        }
    }

    @Test
    void registrationRequestCarriesFixedStartup() {
        AgentConfig config = config().metadata("zone", "a").metadata("startup", "overridden").build();
        try (AgentEngine engine = AgentEngine.builder(config).build()) {
            RegistrationRequest first = engine.registrationRequest();
            RegistrationRequest second = engine.registrationRequest();

            assertEquals("http://localhost:8000", first.serviceUrl());
            assertEquals("http://localhost:8000/actuator/health", first.healthUrl());
            assertEquals("a", first.metadata().get("zone"));
            assertEquals(engine.startup().toString(), first.metadata().get("startup"));
            assertEquals(first.metadata(), second.metadata());
            assertTrue(engine.getRegistrationState().isEmpty());
        }
    }

    @Test
    void registersWithRegistryAndDeregistersOnStop() throws Exception {
        try (MockRegistryServer registry = new MockRegistryServer()) {
            AgentConfig config = config()
                    .registration(RegistrationConfig.builder(registry.registrationUrl())
                            .interval(Duration.ofMillis(200))
                            .build())
                    .logCapture(false)
                    .build();
            AgentEngine engine = AgentEngine.builder(config).build();
            engine.start();

            await("registered").atMost(Duration.ofSeconds(15))
                    .until(() -> registry.registrations().size() >= 2);
            assertEquals(MockRegistryServer.INSTANCE_ID, engine.getRegistrationState().orElseThrow().instanceId());
            assertEquals(engine.startup().toString(),
                    registry.registrations().get(1).path("metadata").path("startup").asText());

            engine.stop();
            engine.close();
            assertEquals(List.of(MockRegistryServer.INSTANCE_ID), registry.deletions());
            assertEquals(RegistrationPhase.STOPPED, engine.getRegistrationState().orElseThrow().phase());
        }
    }
}
