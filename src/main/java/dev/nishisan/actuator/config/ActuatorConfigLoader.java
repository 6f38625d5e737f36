package dev.nishisan.actuator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import dev.nishisan.actuator.AgentConfig;
import dev.nishisan.actuator.Endpoint;
import dev.nishisan.actuator.common.InvalidArgumentException;
import dev.nishisan.actuator.registration.RegistrationConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the agent configuration from YAML, resolving {@code ${VAR}} and
 * {@code ${VAR:default}} placeholders against the environment first.
 */
public class ActuatorConfigLoader {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private ActuatorConfigLoader() {
    }

    public static ActuatorYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static ActuatorYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        String processedContent = resolveVariables(content, envProvider);
        return mapper.readValue(processedContent, ActuatorYamlConfig.class);
    }

    /**
     * Loads and converts in one step.
     */
    public static AgentConfig loadAgentConfig(Path yamlFile) throws IOException {
        return convertToDomain(load(yamlFile));
    }

    public static void save(Path yamlFile, ActuatorYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            builder.append(content, i, matcher.start());
            builder.append(getReplacement(matcher.group(1), envProvider));
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new InvalidArgumentException(
                "Environment variable '" + varName + "' not found and no default value provided.");
    }

    public static AgentConfig convertToDomain(ActuatorYamlConfig yamlConfig) {
        AppConfig app = yamlConfig.getApp();
        if (app == null) {
            throw new InvalidArgumentException("App configuration is missing");
        }
        if (isBlank(app.getName()) || isBlank(app.getServiceUrl()) || isBlank(app.getManagementUrl())) {
            throw new InvalidArgumentException("app.name, app.serviceUrl and app.managementUrl are required");
        }

        AgentConfig.Builder builder = AgentConfig.builder(app.getName(), app.getServiceUrl(), app.getManagementUrl())
                .appDescription(app.getDescription());
        if (app.getMetadata() != null) {
            builder.metadata(app.getMetadata());
        }
        if (app.getInfo() != null) {
            builder.additionalAppInfo(app.getInfo());
        }

        RegistrationPolicyConfig registration = yamlConfig.getRegistration();
        if (registration != null && !isBlank(registration.getUrl())) {
            RegistrationConfig.Builder rb = RegistrationConfig.builder(registration.getUrl().trim());
            Duration interval = parseDuration(registration.getInterval());
            if (interval != null) {
                rb.interval(interval);
            }
            Duration timeout = parseDuration(registration.getTimeout());
            if (timeout != null) {
                rb.requestTimeout(timeout);
            }
            if (!isBlank(registration.getUsername())) {
                rb.credentials(registration.getUsername(), registration.getPassword());
            }
            builder.registration(rb.build());
        }

        if (yamlConfig.getTrace() != null) {
            builder.traceCapacity(yamlConfig.getTrace().getCapacity());
        }

        HealthPolicyConfig health = yamlConfig.getHealth();
        if (health != null && health.getDiskSpace() != null) {
            HealthPolicyConfig.DiskSpaceConfig disk = health.getDiskSpace();
            builder.diskSpaceCheck(disk.isEnabled());
            if (!isBlank(disk.getPath())) {
                builder.diskSpacePath(Path.of(disk.getPath()));
            }
            if (disk.getThreshold() != null) {
                builder.diskSpaceThresholdBytes(disk.getThreshold());
            }
        }

        LoggingPolicyConfig logging = yamlConfig.getLogging();
        if (logging != null) {
            builder.logCapture(logging.isCapture());
            if (!isBlank(logging.getFormat())) {
                builder.logFormat(logging.getFormat());
            }
        }

        EndpointsConfig endpoints = yamlConfig.getEndpoints();
        if (endpoints != null && endpoints.getDisabled() != null) {
            for (String name : endpoints.getDisabled()) {
                Endpoint endpoint = Endpoint.fromPath(name == null ? "" : name.trim())
                        .orElseThrow(() -> new InvalidArgumentException("Unknown endpoint: " + name));
                builder.disableEndpoint(endpoint);
            }
        }

        return builder.build();
    }

    /**
     * Accepts ISO-8601 ({@code PT10S}) or the short forms {@code 500ms}, {@code 10s}, {@code 5m}, {@code 2h}.
     *
     * @return the parsed duration, {@code null} for blank input
     */
    public static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String value = s.trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            try {
                if (value.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
                } else if (value.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
                } else if (value.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
                } else if (value.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
                }
            } catch (NumberFormatException nfe) {
                throw new InvalidArgumentException("Invalid duration: " + s, nfe);
            }
            throw new InvalidArgumentException("Invalid duration: " + s, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
