package dev.nishisan.actuator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ActuatorYamlConfig {

    @JsonProperty("app")
    private AppConfig app;

    @JsonProperty("registration")
    private RegistrationPolicyConfig registration;

    @JsonProperty("trace")
    private TracePolicyConfig trace;

    @JsonProperty("health")
    private HealthPolicyConfig health;

    @JsonProperty("logging")
    private LoggingPolicyConfig logging;

    @JsonProperty("endpoints")
    private EndpointsConfig endpoints;

    public AppConfig getApp() {
        return app;
    }

    public void setApp(AppConfig app) {
        this.app = app;
    }

    public RegistrationPolicyConfig getRegistration() {
        return registration;
    }

    public void setRegistration(RegistrationPolicyConfig registration) {
        this.registration = registration;
    }

    public TracePolicyConfig getTrace() {
        return trace;
    }

    public void setTrace(TracePolicyConfig trace) {
        this.trace = trace;
    }

    public HealthPolicyConfig getHealth() {
        return health;
    }

    public void setHealth(HealthPolicyConfig health) {
        this.health = health;
    }

    public LoggingPolicyConfig getLogging() {
        return logging;
    }

    public void setLogging(LoggingPolicyConfig logging) {
        this.logging = logging;
    }

    public EndpointsConfig getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(EndpointsConfig endpoints) {
        this.endpoints = endpoints;
    }
}
