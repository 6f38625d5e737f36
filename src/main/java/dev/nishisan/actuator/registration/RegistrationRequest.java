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

import java.util.Map;
import java.util.Objects;

/**
 * Document posted to the monitoring registry on every registration tick.
 */
public record RegistrationRequest(
        String name,
        String managementUrl,
        String healthUrl,
        String serviceUrl,
        Map<String, Object> metadata) {

    public RegistrationRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(managementUrl, "managementUrl");
        Objects.requireNonNull(healthUrl, "healthUrl");
        Objects.requireNonNull(serviceUrl, "serviceUrl");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
