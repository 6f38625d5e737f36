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

/**
 * A registration or deregistration call did not succeed: network error, timeout,
 * non-2xx answer or an answer without an instance id.
 */
public class RemoteRegistrationException extends Exception {
    private final int statusCode;

    public RemoteRegistrationException(String message) {
        this(message, -1, null);
    }

    public RemoteRegistrationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RemoteRegistrationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status answered by the registry, or {@code -1} when no answer was received
     */
    public int statusCode() {
        return statusCode;
    }
}
