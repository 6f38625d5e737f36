package dev.nishisan.actuator.registration;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpRegistryTransportTest {

    @Test
    void instanceUriAppendsEncodedId() {
        HttpRegistryTransport transport = new HttpRegistryTransport(
                RegistrationConfig.builder("http://registry:8080/instances/").build());

        assertEquals("http://registry:8080/instances/abc%2F1", transport.instanceUri("abc/1").toString());
    }

    @Test
    void registerReturnsAssignedId() throws Exception {
        try (MockRegistryServer registry = new MockRegistryServer()) {
            HttpRegistryTransport transport = new HttpRegistryTransport(
                    RegistrationConfig.builder(registry.registrationUrl()).build());

            String id = transport.register(new RegistrationRequest("svc", "http://h/actuator",
                    "http://h/actuator/health", "http://h", Map.of("startup", "now")));

            assertEquals(MockRegistryServer.INSTANCE_ID, id);
            assertEquals("svc", registry.registrations().get(0).path("name").asText());
            assertTrue(registry.authorizations().isEmpty());
        }
    }

    @Test
    void rejectionCarriesStatusCode() throws Exception {
        try (MockRegistryServer registry = new MockRegistryServer()) {
            registry.registerStatus(401);
            HttpRegistryTransport transport = new HttpRegistryTransport(
                    RegistrationConfig.builder(registry.registrationUrl()).build());

            RemoteRegistrationException e = assertThrows(RemoteRegistrationException.class,
                    () -> transport.register(new RegistrationRequest("svc", "m", "h", "s", Map.of())));
            assertEquals(401, e.statusCode());
        }
    }

    @Test
    void deregisterDeletesInstance() throws Exception {
        try (MockRegistryServer registry = new MockRegistryServer()) {
            HttpRegistryTransport transport = new HttpRegistryTransport(
                    RegistrationConfig.builder(registry.registrationUrl()).build());

            transport.deregister("instance-42");

            assertEquals("instance-42", registry.deletions().get(0));
        }
    }

    @Test
    void stalledResponseBodyTimesOut() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/instances", exchange -> {
            try {
                exchange.sendResponseHeaders(201, 100);
                OutputStream os = exchange.getResponseBody();
                os.write("{\"id\":".getBytes(StandardCharsets.UTF_8));
                os.flush();
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                exchange.close();
            }
        });
        server.start();
        try {
            HttpRegistryTransport transport = new HttpRegistryTransport(RegistrationConfig
                    .builder("http://127.0.0.1:" + server.getAddress().getPort() + "/instances")
                    .requestTimeout(Duration.ofSeconds(1))
                    .build());

            RemoteRegistrationException e = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> assertThrows(RemoteRegistrationException.class,
                            () -> transport.register(new RegistrationRequest("svc", "m", "h", "s", Map.of()))));
            assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        } finally {
            release.countDown();
            server.stop(0);
        }
    }
}
