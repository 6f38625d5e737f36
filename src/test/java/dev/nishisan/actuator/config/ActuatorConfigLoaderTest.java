package dev.nishisan.actuator.config;

import dev.nishisan.actuator.AgentConfig;
import dev.nishisan.actuator.Endpoint;
import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.registration.RegistrationConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActuatorConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadFullConfiguration() throws IOException {
        Path yamlFile = tempDir.resolve("actuator.yaml");
        String yamlContent =
            "app:\n" +
            "  name: orders\n" +
            "  description: Order service\n" +
            "  serviceUrl: http://${HOST:localhost}:8000/\n" +
            "  managementUrl: http://${HOST:localhost}:8000/actuator/\n" +
            "  metadata:\n" +
            "    zone: ${ZONE}\n" +
            "  info:\n" +
            "    build:\n" +
            "      version: 1.2.3\n" +
            "registration:\n" +
            "  url: http://admin:8080/instances\n" +
            "  interval: 30s\n" +
            "  timeout: 500ms\n" +
            "  username: admin\n" +
            "  password: ${ADMIN_PASSWORD:changeit}\n" +
            "trace:\n" +
            "  capacity: 25\n" +
            "health:\n" +
            "  diskSpace:\n" +
            "    path: " + tempDir.toString().replace("\\", "/") + "\n" +
            "    threshold: 2048\n" +
            "logging:\n" +
            "  capture: false\n" +
            "endpoints:\n" +
            "  disabled: [env, dump]\n";
        Files.writeString(yamlFile, yamlContent);

        Map<String, String> env = new HashMap<>();
        env.put("ZONE", "eu-west-1");

        AgentConfig config = ActuatorConfigLoader.convertToDomain(ActuatorConfigLoader.load(yamlFile, env::get));

        assertEquals("orders", config.appName());
        assertEquals("Order service", config.appDescription());
        assertEquals("http://localhost:8000", config.serviceUrl());
        assertEquals("http://localhost:8000/actuator", config.managementUrl());
        assertEquals("http://localhost:8000/actuator/health", config.healthUrl());
        assertEquals(Map.of("zone", "eu-west-1"), config.metadata());
        assertEquals(Map.of("version", "1.2.3"), config.additionalAppInfo().get("build"));
        assertEquals(25, config.traceCapacity());
        assertEquals(2048L, config.diskSpaceThresholdBytes());
        assertFalse(config.logCaptureEnabled());
        assertFalse(config.isEnabled(Endpoint.ENV));
        assertFalse(config.isEnabled(Endpoint.THREAD_DUMP));
        assertTrue(config.isEnabled(Endpoint.HEALTH));

        RegistrationConfig registration = config.registration().orElseThrow();
        assertEquals("http://admin:8080/instances", registration.registrationUrl().toString());
        assertEquals(Duration.ofSeconds(30), registration.interval());
        assertEquals(Duration.ofMillis(500), registration.requestTimeout());
        assertEquals("admin", registration.username());
        assertEquals("changeit", registration.password());
    }

    @Test
    void shouldApplyDefaultsForMinimalConfiguration() throws IOException {
        Path yamlFile = tempDir.resolve("minimal.yaml");
        Files.writeString(yamlFile,
            "app:\n" +
            "  name: tiny\n" +
            "  serviceUrl: http://localhost:9000\n" +
            "  managementUrl: http://localhost:9000/actuator\n");

        AgentConfig config = ActuatorConfigLoader.convertToDomain(ActuatorConfigLoader.load(yamlFile, name -> null));

        assertTrue(config.registration().isEmpty());
        assertEquals(100, config.traceCapacity());
        assertTrue(config.diskSpaceCheckEnabled());
        assertTrue(config.logCaptureEnabled());
        assertTrue(config.disabledEndpoints().isEmpty());
    }

    @Test
    void shouldFailWhenVariableMissingAndNoDefault() throws IOException {
        Path yamlFile = tempDir.resolve("missing.yaml");
        Files.writeString(yamlFile, "app:\n  name: ${APP_NAME}\n");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> ActuatorConfigLoader.load(yamlFile, name -> null));

        assertTrue(exception.getMessage().contains("APP_NAME"));
    }

    @Test
    void shouldRejectMissingAppSection() {
        assertThrows(InvalidArgumentException.class,
                () -> ActuatorConfigLoader.convertToDomain(new ActuatorYamlConfig()));
    }

    @Test
    void shouldRejectUnknownEndpoint() {
        ActuatorYamlConfig yaml = new ActuatorYamlConfig();
        AppConfig app = new AppConfig();
        app.setName("svc");
        app.setServiceUrl("http://h");
        app.setManagementUrl("http://h/actuator");
        yaml.setApp(app);
        EndpointsConfig endpoints = new EndpointsConfig();
        endpoints.setDisabled(java.util.List.of("beans"));
        yaml.setEndpoints(endpoints);

        assertThrows(InvalidArgumentException.class, () -> ActuatorConfigLoader.convertToDomain(yaml));
    }

    @Test
    void shouldRoundTripThroughSave() throws IOException {
        ActuatorYamlConfig yaml = new ActuatorYamlConfig();
        AppConfig app = new AppConfig();
        app.setName("saved");
        app.setServiceUrl("http://h:1");
        app.setManagementUrl("http://h:1/actuator");
        yaml.setApp(app);
        Path yamlFile = tempDir.resolve("saved.yaml");

        ActuatorConfigLoader.save(yamlFile, yaml);
        ActuatorYamlConfig loaded = ActuatorConfigLoader.load(yamlFile, name -> null);

        assertEquals("saved", loaded.getApp().getName());
        assertEquals("http://h:1/actuator", loaded.getApp().getManagementUrl());
    }

    @Test
    void shouldParseDurations() {
        assertEquals(Duration.ofSeconds(10), ActuatorConfigLoader.parseDuration("10s"));
        assertEquals(Duration.ofMinutes(5), ActuatorConfigLoader.parseDuration("5m"));
        assertEquals(Duration.ofHours(2), ActuatorConfigLoader.parseDuration("2h"));
        assertEquals(Duration.ofMillis(500), ActuatorConfigLoader.parseDuration("500ms"));
        assertEquals(Duration.ofSeconds(15), ActuatorConfigLoader.parseDuration("PT15S"));
        assertNull(ActuatorConfigLoader.parseDuration(" "));
        assertThrows(InvalidArgumentException.class, () -> ActuatorConfigLoader.parseDuration("soon"));
    }
}
