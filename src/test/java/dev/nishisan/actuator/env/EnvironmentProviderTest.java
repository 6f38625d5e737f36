package dev.nishisan.actuator.env;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentProviderTest {

    @Test
    void exposesEnvironmentAndSystemProperties() {
        Properties props = new Properties();
        props.setProperty("app.mode", "test");
        EnvironmentProvider provider = new EnvironmentProvider(
                () -> Map.of("ZETA", "last", "ALPHA", "first"), () -> props);

        EnvironmentReport report = provider.getEnvironment();

        assertTrue(report.activeProfiles().isEmpty());
        assertEquals(2, report.propertySources().size());
        EnvironmentReport.PropertySource env = report.propertySources().get(0);
        assertEquals(EnvironmentProvider.SYSTEM_ENVIRONMENT, env.name());
        assertEquals("ALPHA", env.properties().keySet().iterator().next());
        assertEquals("first", env.properties().get("ALPHA").value());

        EnvironmentReport.PropertySource system = report.propertySources().get(1);
        assertEquals(EnvironmentProvider.SYSTEM_PROPERTIES, system.name());
        assertEquals("test", system.properties().get("app.mode").value());
    }

    @Test
    void defaultProviderReadsProcessEnvironment() {
        EnvironmentReport report = new EnvironmentProvider().getEnvironment();

        assertEquals(System.getenv().size(), report.propertySources().get(0).properties().size());
        assertEquals(System.getProperty("java.version"),
                report.propertySources().get(1).properties().get("java.version").value());
    }
}
