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

package dev.nishisan.actuator.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import dev.nishisan.actuator.AgentEngine;
import dev.nishisan.actuator.Endpoint;
import dev.nishisan.actuator.common.EndpointDisabledException;
import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.common.NotFoundException;
import dev.nishisan.actuator.common.RangeNotSatisfiableException;
import dev.nishisan.actuator.health.HealthReport;
import dev.nishisan.actuator.logfile.LogSlice;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves the engine's endpoints over the JDK's built-in HTTP server.
 *
 * <p>
 * All routes live under one management path (default {@code /actuator}):
 * <ul>
 * <li>{@code GET /} index of links</li>
 * <li>{@code GET /env}, {@code /info}, {@code /health}, {@code /httptrace}, {@code /threaddump}</li>
 * <li>{@code GET /metrics} and {@code /metrics/<name>}</li>
 * <li>{@code GET /loggers}, {@code /loggers/<name>} and {@code POST /loggers/<name>}</li>
 * <li>{@code GET /logfile}, answering 206 with a body when a {@code Range} header is present</li>
 * </ul>
 * Application contexts added through {@link #createApplicationContext(String, HttpHandler)} are
 * traced by an {@link HttpTraceFilter}.
 * </p>
 */
public final class ActuatorHttpServer implements Closeable {
    private static final Logger LOGGER = Logger.getLogger(ActuatorHttpServer.class.getName());

    public static final String DEFAULT_MANAGEMENT_PATH = "/actuator";
    public static final String ACTUATOR_CONTENT_TYPE = "application/vnd.spring-boot.actuator.v2+json;charset=UTF-8";
    static final String LOGFILE_CONTENT_TYPE = "text/html; charset=UTF-8";

    private final AgentEngine engine;
    private final InetSocketAddress address;
    private final String managementPath;
    private final ObjectMapper mapper;
    private final HttpTraceFilter traceFilter;
    private HttpServer server;
    private ExecutorService executor;

    public ActuatorHttpServer(AgentEngine engine, InetSocketAddress address) {
        this(engine, address, DEFAULT_MANAGEMENT_PATH);
    }

    public ActuatorHttpServer(AgentEngine engine, InetSocketAddress address, String managementPath) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.address = Objects.requireNonNull(address, "address");
        Objects.requireNonNull(managementPath, "managementPath");
        String path = managementPath.startsWith("/") ? managementPath : "/" + managementPath;
        this.managementPath = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        this.mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.traceFilter = new HttpTraceFilter(engine);
    }

    /**
     * Binds the server and starts serving. The port is available from {@link #port()} afterwards.
     */
    public synchronized void start() throws IOException {
        if (server != null) {
            return;
        }
        server = HttpServer.create(address, 0);
        HttpContext context = server.createContext(managementPath, this::handle);
        context.getFilters().add(traceFilter);
        AtomicInteger threadCounter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "actuator-http-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        LOGGER.info(() -> "Actuator endpoints served at http://" + address.getHostString() + ":" + port()
                + managementPath);
    }

    /**
     * Registers an application handler on the same server, traced into the httptrace endpoint.
     */
    public synchronized HttpContext createApplicationContext(String path, HttpHandler handler) {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        HttpContext context = server.createContext(path, handler);
        context.getFilters().add(traceFilter);
        return context;
    }

    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    public String managementPath() {
        return managementPath;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
        executor = null;
        LOGGER.info("Actuator HTTP server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            route(exchange);
        } catch (MethodNotAllowed e) {
            sendError(exchange, 405, "Method Not Allowed", e);
        } catch (RangeNotSatisfiableException e) {
            exchange.getResponseHeaders().set("Content-Range", "bytes */" + e.totalLength());
            sendError(exchange, 416, "Range Not Satisfiable", e);
        } catch (NotFoundException e) {
            sendError(exchange, 404, "Not Found", e);
        } catch (InvalidArgumentException e) {
            sendError(exchange, 400, "Bad Request", e);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Error serving " + exchange.getRequestURI(), e);
            sendError(exchange, 500, "Internal Server Error", e);
        } finally {
            exchange.close();
        }
    }

    private void route(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String prefix = "/".equals(managementPath) ? "" : managementPath;
        String rest = exchange.getRequestURI().getPath().substring(prefix.length());
        if (rest.isEmpty() || "/".equals(rest)) {
            requireGet(exchange);
            sendJson(exchange, 200, engine.getIndex());
            return;
        }
        if (!rest.startsWith("/")) {
            throw new NotFoundException("path", exchange.getRequestURI().getPath());
        }
        rest = rest.substring(1);
        int slash = rest.indexOf('/');
        String segment = slash < 0 ? rest : rest.substring(0, slash);
        String name = slash < 0 ? null : rest.substring(slash + 1);
        if (name != null && name.isEmpty()) {
            name = null;
        }

        Optional<Endpoint> resolved = Endpoint.fromPath(segment);
        if (resolved.isEmpty()) {
            throw new NotFoundException("endpoint", segment);
        }
        Endpoint endpoint = resolved.get();
        if (!engine.config().isEnabled(endpoint)) {
            throw new EndpointDisabledException(endpoint.path());
        }
        if (name != null && endpoint != Endpoint.METRICS && endpoint != Endpoint.LOGGERS) {
            throw new NotFoundException("path", exchange.getRequestURI().getPath());
        }

        switch (endpoint) {
            case ENV:
                requireGet(exchange);
                sendJson(exchange, 200, engine.getEnvironment());
                break;
            case INFO:
                requireGet(exchange);
                sendJson(exchange, 200, engine.getAppInfo());
                break;
            case HEALTH:
                requireGet(exchange);
                HealthReport health = engine.getHealth();
                sendJson(exchange, health.httpStatus(), health);
                break;
            case METRICS:
                requireGet(exchange);
                sendJson(exchange, 200, name == null ? engine.getMetricNames() : engine.getMetricMeasurement(name));
                break;
            case LOGGERS:
                handleLoggers(exchange, method, name);
                break;
            case LOGFILE:
                requireGet(exchange);
                handleLogfile(exchange);
                break;
            case HTTP_TRACE:
                requireGet(exchange);
                sendJson(exchange, 200, engine.getHttpTrace());
                break;
            case THREAD_DUMP:
                requireGet(exchange);
                sendJson(exchange, 200, engine.getThreadDump());
                break;
            default:
                throw new NotFoundException("endpoint", segment);
        }
    }

    private void handleLoggers(HttpExchange exchange, String method, String name) throws IOException {
        if ("POST".equals(method)) {
            if (name == null) {
                throw new MethodNotAllowed();
            }
            engine.setLoggerLevel(name, readConfiguredLevel(exchange));
            exchange.sendResponseHeaders(204, -1);
            return;
        }
        requireGet(exchange);
        sendJson(exchange, 200, name == null ? engine.getLoggers() : engine.getLogger(name));
    }

    private String readConfiguredLevel(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        if (body.length == 0) {
            return null;
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Malformed logger level body", e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidArgumentException("Logger level body must be a JSON object");
        }
        JsonNode level = node.get("configuredLevel");
        return level == null || level.isNull() ? null : level.asText();
    }

    private void handleLogfile(HttpExchange exchange) throws IOException {
        String range = exchange.getRequestHeaders().getFirst("Range");
        if (range == null) {
            sendJson(exchange, 200, engine.getLogRange());
            return;
        }
        LogSlice slice = engine.getLogfile(range);
        exchange.getResponseHeaders().set("Content-Type", LOGFILE_CONTENT_TYPE);
        exchange.getResponseHeaders().set("Accept-Ranges", "bytes");
        exchange.getResponseHeaders().set("Content-Range", slice.contentRange());
        byte[] content = slice.content();
        exchange.sendResponseHeaders(206, content.length == 0 ? -1 : content.length);
        if (content.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(content);
            }
        }
    }

    private static void requireGet(HttpExchange exchange) {
        if (!"GET".equals(exchange.getRequestMethod())) {
            throw new MethodNotAllowed();
        }
    }

    private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", ACTUATOR_CONTENT_TYPE);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int status, String error, Exception e) throws IOException {
        if (exchange.getResponseCode() != -1) {
            // headers already out, nothing sensible left to send
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", e.getMessage());
        sendJson(exchange, status, body);
    }

    /**
     * Raised by routes that only accept other methods.
     */
    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed() {
            super("Method not allowed", null, false, false);
        }
    }
}
