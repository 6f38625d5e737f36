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

package dev.nishisan.actuator.common;

import java.util.Objects;

/**
 * Raised when an introspection request names a resource (metric, logger, log range,
 * endpoint) that the agent does not know about.
 */
public class NotFoundException extends RuntimeException {
    private final String resourceType;
    private final String resourceName;

    public NotFoundException(String resourceType, String resourceName) {
        this(resourceType, resourceName, resourceType + " not found: " + resourceName);
    }

    protected NotFoundException(String resourceType, String resourceName, String message) {
        super(message);
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
        this.resourceName = resourceName;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceName() {
        return resourceName;
    }
}
