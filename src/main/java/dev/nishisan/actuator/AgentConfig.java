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

package dev.nishisan.actuator;

import dev.nishisan.actuator.buffer.RingBuffer;
import dev.nishisan.actuator.health.DiskSpaceHealthIndicator;
import dev.nishisan.actuator.logfile.LogLineFormatter;
import dev.nishisan.actuator.registration.RegistrationConfig;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration of an {@link AgentEngine}.
 */
public final class AgentConfig {
    private final String appName;
    private final String appDescription;
    private final String serviceUrl;
    private final String managementUrl;
    private final RegistrationConfig registration;
    private final Map<String, String> metadata;
    private final Map<String, Object> additionalAppInfo;
    private final int traceCapacity;
    private final boolean diskSpaceCheckEnabled;
    private final Path diskSpacePath;
    private final long diskSpaceThresholdBytes;
    private final boolean logCaptureEnabled;
    private final String logFormat;
    private final Set<Endpoint> disabledEndpoints;

    private AgentConfig(Builder builder) {
        this.appName = builder.appName;
        this.appDescription = builder.appDescription;
        this.serviceUrl = stripTrailingSlash(builder.serviceUrl);
        this.managementUrl = stripTrailingSlash(builder.managementUrl);
        this.registration = builder.registration;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.additionalAppInfo = Collections.unmodifiableMap(new LinkedHashMap<>(builder.additionalAppInfo));
        this.traceCapacity = builder.traceCapacity;
        this.diskSpaceCheckEnabled = builder.diskSpaceCheckEnabled;
        this.diskSpacePath = builder.diskSpacePath;
        this.diskSpaceThresholdBytes = builder.diskSpaceThresholdBytes;
        this.logCaptureEnabled = builder.logCaptureEnabled;
        this.logFormat = builder.logFormat;
        this.disabledEndpoints = builder.disabledEndpoints.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.disabledEndpoints));
    }

    public String appName() {
        return appName;
    }

    public String appDescription() {
        return appDescription;
    }

    public String serviceUrl() {
        return serviceUrl;
    }

    public String managementUrl() {
        return managementUrl;
    }

    public String healthUrl() {
        return managementUrl + "/" + Endpoint.HEALTH.path();
    }

    /**
     * @return registration settings, empty when the agent should not advertise itself
     */
    public Optional<RegistrationConfig> registration() {
        return Optional.ofNullable(registration);
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Map<String, Object> additionalAppInfo() {
        return additionalAppInfo;
    }

    public int traceCapacity() {
        return traceCapacity;
    }

    public boolean diskSpaceCheckEnabled() {
        return diskSpaceCheckEnabled;
    }

    public Path diskSpacePath() {
        return diskSpacePath;
    }

    public long diskSpaceThresholdBytes() {
        return diskSpaceThresholdBytes;
    }

    public boolean logCaptureEnabled() {
        return logCaptureEnabled;
    }

    public String logFormat() {
        return logFormat;
    }

    public Set<Endpoint> disabledEndpoints() {
        return disabledEndpoints;
    }

    public boolean isEnabled(Endpoint endpoint) {
        return !disabledEndpoints.contains(endpoint);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder(String appName, String serviceUrl, String managementUrl) {
        return new Builder(appName, serviceUrl, managementUrl);
    }

    public static final class Builder {
        private final String appName;
        private final String serviceUrl;
        private final String managementUrl;
        private String appDescription;
        private RegistrationConfig registration;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private final Map<String, Object> additionalAppInfo = new LinkedHashMap<>();
        private int traceCapacity = RingBuffer.DEFAULT_CAPACITY;
        private boolean diskSpaceCheckEnabled = true;
        private Path diskSpacePath = Path.of(".");
        private long diskSpaceThresholdBytes = DiskSpaceHealthIndicator.DEFAULT_THRESHOLD_BYTES;
        private boolean logCaptureEnabled = true;
        private String logFormat = LogLineFormatter.DEFAULT_PATTERN;
        private final Set<Endpoint> disabledEndpoints = EnumSet.noneOf(Endpoint.class);

        private Builder(String appName, String serviceUrl, String managementUrl) {
            this.appName = Objects.requireNonNull(appName, "appName");
            this.serviceUrl = Objects.requireNonNull(serviceUrl, "serviceUrl");
            this.managementUrl = Objects.requireNonNull(managementUrl, "managementUrl");
        }

        public Builder appDescription(String description) {
            this.appDescription = description;
            return this;
        }

        public Builder registration(RegistrationConfig registration) {
            this.registration = registration;
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            Objects.requireNonNull(metadata, "metadata").forEach(this::metadata);
            return this;
        }

        public Builder additionalAppInfo(Map<String, Object> info) {
            this.additionalAppInfo.putAll(Objects.requireNonNull(info, "info"));
            return this;
        }

        public Builder traceCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("traceCapacity must be positive");
            }
            this.traceCapacity = capacity;
            return this;
        }

        public Builder diskSpaceCheck(boolean enabled) {
            this.diskSpaceCheckEnabled = enabled;
            return this;
        }

        public Builder diskSpacePath(Path path) {
            this.diskSpacePath = Objects.requireNonNull(path, "path");
            return this;
        }

        public Builder diskSpaceThresholdBytes(long thresholdBytes) {
            if (thresholdBytes < 0) {
                throw new IllegalArgumentException("diskSpaceThresholdBytes must not be negative");
            }
            this.diskSpaceThresholdBytes = thresholdBytes;
            return this;
        }

        public Builder logCapture(boolean enabled) {
            this.logCaptureEnabled = enabled;
            return this;
        }

        public Builder logFormat(String pattern) {
            this.logFormat = Objects.requireNonNull(pattern, "pattern");
            return this;
        }

        public Builder disableEndpoint(Endpoint endpoint) {
            this.disabledEndpoints.add(Objects.requireNonNull(endpoint, "endpoint"));
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
