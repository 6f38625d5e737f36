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

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration parameters for the {@link RegistrationClient} and {@link HttpRegistryTransport}.
 */
public final class RegistrationConfig {
    private final URI registrationUrl;
    private final Duration interval;
    private final Duration requestTimeout;
    private final String username;
    private final String password;

    private RegistrationConfig(Builder builder) {
        this.registrationUrl = builder.registrationUrl;
        this.interval = builder.interval;
        this.requestTimeout = builder.requestTimeout;
        this.username = builder.username;
        this.password = builder.password;
    }

    public URI registrationUrl() {
        return registrationUrl;
    }

    public Duration interval() {
        return interval;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public static Builder builder(URI registrationUrl) {
        return new Builder(registrationUrl);
    }

    public static Builder builder(String registrationUrl) {
        return new Builder(URI.create(Objects.requireNonNull(registrationUrl, "registrationUrl")));
    }

    public static final class Builder {
        private final URI registrationUrl;
        private Duration interval = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private String username;
        private String password;

        private Builder(URI registrationUrl) {
            this.registrationUrl = Objects.requireNonNull(registrationUrl, "registrationUrl");
        }

        public Builder interval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("Registration interval must be positive: " + interval);
            }
            this.interval = interval;
            return this;
        }

        public Builder requestTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("Request timeout must be positive: " + timeout);
            }
            this.requestTimeout = timeout;
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public RegistrationConfig build() {
            return new RegistrationConfig(this);
        }
    }
}
