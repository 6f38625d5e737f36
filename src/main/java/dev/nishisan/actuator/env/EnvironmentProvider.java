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

package dev.nishisan.actuator.env;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Snapshots environment variables (source {@value #SYSTEM_ENVIRONMENT}) and JVM system
 * properties (source {@value #SYSTEM_PROPERTIES}).
 */
public final class EnvironmentProvider {
    public static final String SYSTEM_ENVIRONMENT = "systemEnvironment";
    public static final String SYSTEM_PROPERTIES = "systemProperties";

    private final Supplier<Map<String, String>> environment;
    private final Supplier<Properties> systemProperties;

    public EnvironmentProvider() {
        this(System::getenv, System::getProperties);
    }

    public EnvironmentProvider(Supplier<Map<String, String>> environment, Supplier<Properties> systemProperties) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties");
    }

    public EnvironmentReport getEnvironment() {
        Map<String, EnvironmentReport.PropertyValue> env = new TreeMap<>();
        environment.get().forEach((key, value) -> env.put(key, new EnvironmentReport.PropertyValue(value)));

        Map<String, EnvironmentReport.PropertyValue> props = new TreeMap<>();
        Properties properties = systemProperties.get();
        for (String key : properties.stringPropertyNames()) {
            props.put(key, new EnvironmentReport.PropertyValue(properties.getProperty(key)));
        }

        return new EnvironmentReport(List.of(), List.of(
                new EnvironmentReport.PropertySource(SYSTEM_ENVIRONMENT, env),
                new EnvironmentReport.PropertySource(SYSTEM_PROPERTIES, props)));
    }
}
