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

package dev.nishisan.actuator.trace;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed HTTP exchange as seen by the adapter layer.
 *
 * @param requestTime when the request arrived
 * @param principal   authenticated principal, if the adapter knows one
 * @param session     session id, if the adapter knows one
 * @param request     request line and headers
 * @param response    response status and headers
 * @param durationMs  time between request arrival and response completion
 */
public record TraceRecord(
        @JsonProperty("timestamp") Instant requestTime,
        String principal,
        String session,
        TraceRequest request,
        TraceResponse response,
        @JsonProperty("timeTaken") long durationMs) {

    public TraceRecord {
        Objects.requireNonNull(requestTime, "requestTime");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(response, "response");
    }

    public static TraceRecord of(Instant requestTime, TraceRequest request, TraceResponse response, long durationMs) {
        return new TraceRecord(requestTime, null, null, request, response, durationMs);
    }
}
