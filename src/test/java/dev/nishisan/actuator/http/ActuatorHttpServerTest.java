package dev.nishisan.actuator.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nishisan.actuator.AgentConfig;
import dev.nishisan.actuator.AgentEngine;
import dev.nishisan.actuator.Endpoint;
import dev.nishisan.actuator.health.DiskUsage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(60)
class ActuatorHttpServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private AgentEngine engine;
    private ActuatorHttpServer server;
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        AgentConfig config = AgentConfig.builder("orders", "http://localhost:8000", "http://localhost:8000/actuator")
                .appDescription("Order service")
                .diskSpaceThresholdBytes(10_000_000L)
                .logCapture(false)
                .disableEndpoint(Endpoint.ENV)
                .build();
        engine = AgentEngine.builder(config)
                .diskUsageProvider(path -> new DiskUsage(100_000_000L, 9_999_999L))
                .build();
        server = new ActuatorHttpServer(engine, new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        server.start();
        base = "http://127.0.0.1:" + server.port() + ActuatorHttpServer.DEFAULT_MANAGEMENT_PATH;
    }

    @AfterEach
    void tearDown() {
        server.close();
        engine.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private HttpResponse<String> get(String path, String range) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path)).header("Range", range).GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    @Test
    void indexListsLinksWithActuatorContentType() throws Exception {
        HttpResponse<String> response = get("");

        assertEquals(200, response.statusCode());
        assertEquals(ActuatorHttpServer.ACTUATOR_CONTENT_TYPE, response.headers().firstValue("Content-Type").orElse(""));
        JsonNode links = json(response).path("_links");
        assertEquals("http://localhost:8000/actuator/health", links.path("health").path("href").asText());
        assertTrue(links.path("env").isMissingNode());
    }

    @Test
    void healthAnswers503WhenDown() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(503, response.statusCode());
        JsonNode body = json(response);
        assertEquals("DOWN", body.path("status").asText());
        JsonNode disk = body.path("details").path("diskSpace");
        assertEquals("DOWN", disk.path("status").asText());
        assertEquals(9_999_999L, disk.path("details").path("free").asLong());
        assertEquals(10_000_000L, disk.path("details").path("threshold").asLong());
    }

    @Test
    void infoReportsApplication() throws Exception {
        JsonNode app = json(get("/info")).path("app");

        assertEquals("orders", app.path("name").asText());
        assertEquals("Order service", app.path("description").asText());
    }

    @Test
    void metricsListAndMeasure() throws Exception {
        JsonNode names = json(get("/metrics")).path("names");
        assertTrue(names.isArray());
        boolean found = false;
        for (JsonNode name : names) {
            found |= "memory.rss".equals(name.asText());
        }
        assertTrue(found);

        JsonNode rss = json(get("/metrics/memory.rss"));
        assertEquals("memory.rss", rss.path("name").asText());
        assertEquals("VALUE", rss.path("measurements").get(0).path("statistic").asText());
        assertTrue(rss.path("measurements").get(0).path("value").asDouble() > 10_000);

        HttpResponse<String> missing = get("/metrics/no.such.metric");
        assertEquals(404, missing.statusCode());
        assertEquals("Not Found", json(missing).path("error").asText());
    }

    @Test
    void loggerLevelCanBeChanged() throws Exception {
        String name = "dev.nishisan.actuator.test.http";

        HttpResponse<String> set = post("/loggers/" + name, "{\"configuredLevel\":\"DEBUG\"}");
        assertEquals(204, set.statusCode());

        JsonNode logger = json(get("/loggers/" + name));
        assertEquals("DEBUG", logger.path("configuredLevel").asText());
        assertEquals("DEBUG", logger.path("effectiveLevel").asText());
        assertTrue(json(get("/loggers")).path("loggers").has(name));

        assertEquals(204, post("/loggers/" + name, "{\"configuredLevel\":null}").statusCode());
        assertTrue(json(get("/loggers/" + name)).path("configuredLevel").isNull());

        assertEquals(400, post("/loggers/" + name, "{\"configuredLevel\":\"LOUD\"}").statusCode());
        assertEquals(400, post("/loggers/" + name, "not json").statusCode());
        assertEquals(405, post("/loggers", "{}").statusCode());
    }

    @Test
    void logfileServesRanges() throws Exception {
        engine.logCapture().append("hello log");

        JsonNode range = json(get("/logfile"));
        assertEquals(10, range.path("total").asLong());

        HttpResponse<String> full = get("/logfile", "bytes=0-");
        assertEquals(206, full.statusCode());
        assertEquals("hello log\n", full.body());
        assertEquals("bytes 0-9/9", full.headers().firstValue("Content-Range").orElse(""));
        assertEquals("bytes", full.headers().firstValue("Accept-Ranges").orElse(""));
        assertEquals("text/html; charset=UTF-8", full.headers().firstValue("Content-Type").orElse(""));

        HttpResponse<String> tail = get("/logfile", "bytes=-4");
        assertEquals(206, tail.statusCode());
        assertEquals("log\n", tail.body());

        assertEquals(416, get("/logfile", "bytes=500-").statusCode());
        assertEquals(400, get("/logfile", "lines=1-2").statusCode());
    }

    @Test
    void applicationRequestsAreTraced() throws Exception {
        server.createApplicationContext("/hello", exchange -> {
            byte[] body = "hi".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        HttpResponse<String> hello = client.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/hello?x=1")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals("hi", hello.body());

        await("trace recorded").atMost(Duration.ofSeconds(5)).until(() -> engine.getHttpTrace().traces().stream()
                .anyMatch(t -> t.request().uri().equals("/hello?x=1")));

        JsonNode traces = json(get("/httptrace")).path("traces");
        JsonNode helloTrace = null;
        for (JsonNode trace : traces) {
            if ("/hello?x=1".equals(trace.path("request").path("uri").asText())) {
                helloTrace = trace;
            }
        }
        assertNotNull(helloTrace);
        assertEquals("GET", helloTrace.path("request").path("method").asText());
        assertEquals(200, helloTrace.path("response").path("status").asInt());
        assertTrue(helloTrace.path("timestamp").isTextual());
        assertTrue(helloTrace.has("timeTaken"));
    }

    @Test
    void aliasesResolve() throws Exception {
        assertEquals(200, get("/trace").statusCode());
        HttpResponse<String> dump = get("/dump");
        assertEquals(200, dump.statusCode());
        assertTrue(json(dump).path("threads").isArray());
    }

    @Test
    void unknownAndDisabledEndpointsAre404() throws Exception {
        assertEquals(404, get("/env").statusCode());
        assertEquals(404, get("/beans").statusCode());
        assertEquals(404, get("/health/extra").statusCode());
    }

    @Test
    void unsupportedMethodIs405() throws Exception {
        assertEquals(405, post("/health", "{}").statusCode());
    }
}
