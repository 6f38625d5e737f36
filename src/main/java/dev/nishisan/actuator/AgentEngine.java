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

import dev.nishisan.actuator.common.EndpointDisabledException;
import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.env.EnvironmentProvider;
import dev.nishisan.actuator.env.EnvironmentReport;
import dev.nishisan.actuator.health.DiskSpaceHealthIndicator;
import dev.nishisan.actuator.health.DiskUsageProvider;
import dev.nishisan.actuator.health.HealthAggregator;
import dev.nishisan.actuator.health.HealthIndicator;
import dev.nishisan.actuator.health.HealthReport;
import dev.nishisan.actuator.logfile.LogCapture;
import dev.nishisan.actuator.logfile.LogCaptureHandler;
import dev.nishisan.actuator.logfile.LogFileRange;
import dev.nishisan.actuator.logfile.LogLineFormatter;
import dev.nishisan.actuator.logfile.LogSlice;
import dev.nishisan.actuator.loggers.LoggerConfig;
import dev.nishisan.actuator.loggers.LoggerRegistry;
import dev.nishisan.actuator.loggers.LoggersReport;
import dev.nishisan.actuator.metrics.JvmMetricProvider;
import dev.nishisan.actuator.metrics.Metric;
import dev.nishisan.actuator.metrics.MetricNamesReport;
import dev.nishisan.actuator.metrics.MetricProvider;
import dev.nishisan.actuator.metrics.MetricsRegistry;
import dev.nishisan.actuator.registration.HttpRegistryTransport;
import dev.nishisan.actuator.registration.RegistrationClient;
import dev.nishisan.actuator.registration.RegistrationConfig;
import dev.nishisan.actuator.registration.RegistrationRequest;
import dev.nishisan.actuator.registration.RegistrationState;
import dev.nishisan.actuator.registration.RegistryTransport;
import dev.nishisan.actuator.threads.ThreadDump;
import dev.nishisan.actuator.threads.ThreadDumpProvider;
import dev.nishisan.actuator.trace.HttpTraceReport;
import dev.nishisan.actuator.trace.TraceRecord;
import dev.nishisan.actuator.trace.TraceRecorder;

import java.io.Closeable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composition root of the monitoring agent and the single object adapters call into.
 *
 * <p>
 * Each operation delegates to one component. The engine itself only validates input
 * and rejects calls to endpoints disabled in the {@link AgentConfig}.
 * </p>
 *
 * <p>
 * Construct one instance per process with {@link #builder(AgentConfig)}, hand it to the
 * adapters, call {@link #start()} once the host is serving and {@link #stop()} on shutdown.
 * </p>
 */
public final class AgentEngine implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(AgentEngine.class.getName());

    private final AgentConfig config;
    private final Instant startup;
    private final TraceRecorder traceRecorder;
    private final LogCapture logCapture;
    private final LogCaptureHandler logCaptureHandler;
    private final MetricsRegistry metricsRegistry;
    private final LoggerRegistry loggerRegistry;
    private final HealthAggregator healthAggregator;
    private final EnvironmentProvider environmentProvider;
    private final ThreadDumpProvider threadDumpProvider;
    private final RegistrationClient registrationClient;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private AgentEngine(Builder builder) {
        this.config = builder.config;
        this.startup = Instant.now();
        this.traceRecorder = new TraceRecorder(config.traceCapacity());
        this.logCapture = new LogCapture();
        this.logCaptureHandler = new LogCaptureHandler(logCapture, new LogLineFormatter(config.logFormat()), Level.ALL);
        this.metricsRegistry = new MetricsRegistry(builder.metricProviders);
        this.loggerRegistry = new LoggerRegistry();
        this.environmentProvider = builder.environmentProvider;
        this.threadDumpProvider = new ThreadDumpProvider();

        Map<String, HealthIndicator> indicators = new LinkedHashMap<>();
        if (config.diskSpaceCheckEnabled()) {
            indicators.put(DiskSpaceHealthIndicator.NAME, new DiskSpaceHealthIndicator(
                    config.diskSpacePath(), config.diskSpaceThresholdBytes(), builder.diskUsageProvider));
        }
        indicators.putAll(builder.healthIndicators);
        this.healthAggregator = new HealthAggregator(indicators);

        Optional<RegistrationConfig> registration = config.registration();
        if (registration.isPresent()) {
            RegistrationConfig rc = registration.get();
            RegistryTransport transport = builder.registryTransport != null
                    ? builder.registryTransport
                    : new HttpRegistryTransport(rc);
            this.registrationClient = new RegistrationClient(transport, this::registrationRequest,
                    rc.interval(), rc.requestTimeout());
        } else {
            this.registrationClient = null;
        }
    }

    /**
     * Attaches log capture to the root logger and starts self-registration.
     * Calling it again is a no-op.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Agent engine already stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (config.logCaptureEnabled()) {
            Logger.getLogger("").addHandler(logCaptureHandler);
        }
        if (registrationClient != null) {
            registrationClient.start();
        }
        LOGGER.info(() -> "Agent engine started for '" + config.appName() + "', management at "
                + config.managementUrl());
    }

    /**
     * Stops registration (deregistering if needed) and detaches log capture.
     * Idempotent; no registration tick runs after this returns.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (registrationClient != null) {
            registrationClient.stop();
        }
        if (started.get() && config.logCaptureEnabled()) {
            Logger.getLogger("").removeHandler(logCaptureHandler);
        }
        LOGGER.info(() -> "Agent engine stopped for '" + config.appName() + "'");
    }

    @Override
    public void close() {
        stop();
    }

    public IndexReport getIndex() {
        Map<String, IndexReport.Link> links = new LinkedHashMap<>();
        links.put("self", new IndexReport.Link(config.managementUrl(), false));
        for (Endpoint endpoint : Endpoint.values()) {
            if (config.isEnabled(endpoint)) {
                links.put(endpoint.path(), new IndexReport.Link(config.managementUrl() + "/" + endpoint.path(), false));
            }
        }
        return new IndexReport(Collections.unmodifiableMap(links));
    }

    public EnvironmentReport getEnvironment() {
        requireEnabled(Endpoint.ENV);
        return environmentProvider.getEnvironment();
    }

    /**
     * Application name and description under {@code app}, merged with the configured
     * additional info. An additional {@code app} map adds to the generated one.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getAppInfo() {
        requireEnabled(Endpoint.INFO);
        Map<String, Object> app = new LinkedHashMap<>();
        app.put("name", config.appName());
        app.put("description", config.appDescription());

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("app", app);
        config.additionalAppInfo().forEach((key, value) -> {
            if ("app".equals(key) && value instanceof Map) {
                app.putAll((Map<String, Object>) value);
            } else {
                info.put(key, value);
            }
        });
        return Collections.unmodifiableMap(info);
    }

    public HealthReport getHealth() {
        requireEnabled(Endpoint.HEALTH);
        return healthAggregator.getHealth();
    }

    public MetricNamesReport getMetricNames() {
        requireEnabled(Endpoint.METRICS);
        return metricsRegistry.getMetricNames();
    }

    public Metric getMetricMeasurement(String name) {
        requireEnabled(Endpoint.METRICS);
        return metricsRegistry.getMetricMeasurement(name);
    }

    public LoggersReport getLoggers() {
        requireEnabled(Endpoint.LOGGERS);
        return loggerRegistry.getLoggers();
    }

    public LoggerConfig getLogger(String name) {
        requireEnabled(Endpoint.LOGGERS);
        return loggerRegistry.getLogger(name);
    }

    public void setLoggerLevel(String name, String level) {
        requireEnabled(Endpoint.LOGGERS);
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Logger name must not be blank");
        }
        loggerRegistry.setLoggerLevel(name, level);
        LOGGER.info(() -> "Logger '" + name + "' level set to " + (level == null ? "<inherited>" : level));
    }

    public LogFileRange getLogRange() {
        requireEnabled(Endpoint.LOGFILE);
        return logCapture.getRange();
    }

    public LogSlice getLogfile(String rangeHeader) {
        requireEnabled(Endpoint.LOGFILE);
        return logCapture.getLogfile(rangeHeader);
    }

    /**
     * Stores a completed exchange. Ignored when the trace endpoint is disabled.
     */
    public void addTraceRecord(TraceRecord record) {
        Objects.requireNonNull(record, "record");
        if (config.isEnabled(Endpoint.HTTP_TRACE)) {
            traceRecorder.addRecord(record);
        }
    }

    public HttpTraceReport getHttpTrace() {
        requireEnabled(Endpoint.HTTP_TRACE);
        return traceRecorder.getHttpTrace();
    }

    public ThreadDump getThreadDump() {
        requireEnabled(Endpoint.THREAD_DUMP);
        return threadDumpProvider.getThreadDump();
    }

    /**
     * @return the registration progress, empty when no registry is configured
     */
    public Optional<RegistrationState> getRegistrationState() {
        return Optional.ofNullable(registrationClient).map(RegistrationClient::state);
    }

    /**
     * The document advertised to the registry on every tick. {@code metadata.startup}
     * is fixed at engine construction.
     */
    public RegistrationRequest registrationRequest() {
        Map<String, Object> metadata = new LinkedHashMap<>(config.metadata());
        metadata.put("startup", startup.toString());
        return new RegistrationRequest(config.appName(), config.managementUrl(), config.healthUrl(),
                config.serviceUrl(), metadata);
    }

    public AgentConfig config() {
        return config;
    }

    public Instant startup() {
        return startup;
    }

    /**
     * Direct access to the captured log, e.g. for adapters that forward their own output.
     */
    public LogCapture logCapture() {
        return logCapture;
    }

    private void requireEnabled(Endpoint endpoint) {
        if (!config.isEnabled(endpoint)) {
            throw new EndpointDisabledException(endpoint.path());
        }
    }

    public static Builder builder(AgentConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final AgentConfig config;
        private final Map<String, HealthIndicator> healthIndicators = new LinkedHashMap<>();
        private final List<MetricProvider> metricProviders = new ArrayList<>(List.of(new JvmMetricProvider()));
        private RegistryTransport registryTransport;
        private EnvironmentProvider environmentProvider = new EnvironmentProvider();
        private DiskUsageProvider diskUsageProvider = DiskUsageProvider.fileStore();

        private Builder(AgentConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /**
         * Adds an indicator reported under {@code name}, after the built-in disk space check.
         */
        public Builder healthIndicator(String name, HealthIndicator indicator) {
            if (name == null || name.isBlank()) {
                throw new InvalidArgumentException("Health indicator name must not be blank");
            }
            healthIndicators.put(name, Objects.requireNonNull(indicator, "indicator"));
            return this;
        }

        public Builder metricProvider(MetricProvider provider) {
            metricProviders.add(Objects.requireNonNull(provider, "provider"));
            return this;
        }

        /**
         * Replaces the HTTP registry transport, e.g. with a framework-specific client.
         */
        public Builder registryTransport(RegistryTransport transport) {
            this.registryTransport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        public Builder environmentProvider(EnvironmentProvider provider) {
            this.environmentProvider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        public Builder diskUsageProvider(DiskUsageProvider provider) {
            this.diskUsageProvider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        public AgentEngine build() {
            return new AgentEngine(this);
        }
    }
}
