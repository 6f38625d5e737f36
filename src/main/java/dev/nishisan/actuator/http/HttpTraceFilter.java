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

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

import dev.nishisan.actuator.AgentEngine;
import dev.nishisan.actuator.trace.TraceRecord;
import dev.nishisan.actuator.trace.TraceRequest;
import dev.nishisan.actuator.trace.TraceResponse;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records every exchange passing through a context into the engine's trace buffer.
 * Attach it to application contexts with {@code context.getFilters().add(filter)}.
 */
public final class HttpTraceFilter extends Filter {
    private static final Logger LOGGER = Logger.getLogger(HttpTraceFilter.class.getName());

    private final AgentEngine engine;

    public HttpTraceFilter(AgentEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        Instant requestTime = Instant.now();
        long startNanos = System.nanoTime();
        TraceRequest request = new TraceRequest(exchange.getRequestMethod(),
                exchange.getRequestURI().toString(), exchange.getRequestHeaders());
        try {
            chain.doFilter(exchange);
        } finally {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
            try {
                // -1 when the handler never sent headers
                TraceResponse response = new TraceResponse(exchange.getResponseCode(),
                        exchange.getResponseHeaders());
                engine.addTraceRecord(TraceRecord.of(requestTime, request, response, durationMs));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Could not record trace for " + request.uri(), e);
            }
        }
    }

    @Override
    public String description() {
        return "Records HTTP exchanges for the httptrace endpoint";
    }
}
