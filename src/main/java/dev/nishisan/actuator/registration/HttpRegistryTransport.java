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

package dev.nishisan.actuator.registration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link RegistryTransport} speaking the Spring Boot Admin registration protocol over
 * the JDK {@link HttpClient}:
 * <ul>
 * <li>{@code POST <registrationUrl>} with the JSON {@link RegistrationRequest}, answered by {@code {"id": ...}}</li>
 * <li>{@code DELETE <registrationUrl>/<id>}</li>
 * </ul>
 */
public final class HttpRegistryTransport implements RegistryTransport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI registrationUrl;
    private final Duration requestTimeout;
    private final String authorization;
    private final HttpClient client;

    public HttpRegistryTransport(RegistrationConfig config) {
        Objects.requireNonNull(config, "config");
        this.registrationUrl = config.registrationUrl();
        this.requestTimeout = config.requestTimeout();
        this.authorization = config.hasCredentials()
                ? "Basic " + Base64.getEncoder().encodeToString(
                        (config.username() + ":" + Objects.toString(config.password(), ""))
                                .getBytes(StandardCharsets.UTF_8))
                : null;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public String register(RegistrationRequest request) throws RemoteRegistrationException {
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(request);
        } catch (IOException e) {
            throw new RemoteRegistrationException("Could not serialize registration request", e);
        }
        HttpRequest httpRequest = newRequest(registrationUrl)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<String> response = send(httpRequest);
        requireSuccess(response, "Registration");

        String id;
        try {
            JsonNode node = MAPPER.readTree(response.body());
            id = node == null ? null : node.path("id").asText(null);
        } catch (IOException e) {
            throw new RemoteRegistrationException("Registry answered an unreadable body", response.statusCode(), e);
        }
        if (id == null || id.isBlank()) {
            throw new RemoteRegistrationException("Registry answer has no instance id", response.statusCode(), null);
        }
        return id;
    }

    @Override
    public void deregister(String instanceId) throws RemoteRegistrationException {
        Objects.requireNonNull(instanceId, "instanceId");
        HttpRequest httpRequest = newRequest(instanceUri(instanceId))
                .DELETE()
                .build();
        requireSuccess(send(httpRequest), "Deregistration");
    }

    URI instanceUri(String instanceId) {
        String base = registrationUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + URLEncoder.encode(instanceId, StandardCharsets.UTF_8));
    }

    private HttpRequest.Builder newRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    /**
     * Bounds the whole exchange, body included, by the request timeout. {@link HttpRequest#timeout()}
     * alone stops counting once the response headers arrive.
     */
    private HttpResponse<String> send(HttpRequest request) throws RemoteRegistrationException {
        CompletableFuture<HttpResponse<String>> pending =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        try {
            return pending.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new RemoteRegistrationException(request.method() + " " + request.uri()
                    + " timed out after " + requestTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RemoteRegistrationException(request.method() + " " + request.uri() + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new RemoteRegistrationException(request.method() + " " + request.uri() + " interrupted", e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String operation)
            throws RemoteRegistrationException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RemoteRegistrationException(operation + " rejected with HTTP " + status, status, null);
        }
    }
}
