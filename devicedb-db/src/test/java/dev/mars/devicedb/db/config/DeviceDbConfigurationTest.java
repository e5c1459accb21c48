package dev.mars.devicedb.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import dev.mars.devicedb.db.DeviceDbDefaults;
import dev.mars.devicedb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DeviceDbConfigurationTest {

    @Test
    void testDefaultProfileLoadsDefaults() {
        DeviceDbConfiguration configuration = new DeviceDbConfiguration("default", Map.of());

        DatabaseConfig config = configuration.getDatabaseConfig();
        assertEquals("DeviceDB", config.getName());
        assertEquals(Path.of("data").resolve("devicedb.db"), config.getFilePath());
        assertEquals(DeviceDbDefaults.DEFAULT_MAX_CONNECTIONS, config.getMaxConnections());
        assertEquals("profile:default", config.getConfigSource());
        assertEquals(Duration.ofMinutes(5), configuration.getHealthCheckConfig().getInterval());
        assertTrue(configuration.getMetricsConfig().isEnabled());
    }

    @Test
    void testProfileOverridesDefaults() {
        DeviceDbConfiguration configuration = new DeviceDbConfiguration("test", Map.of());

        DatabaseConfig config = configuration.getDatabaseConfig();
        assertEquals("test", configuration.getProfile());
        assertEquals("DeviceDBTest", config.getName());
        assertEquals(4, config.getMaxConnections());
        assertEquals(2000, config.getBusyTimeoutMs());
        assertTrue(config.isEnablePerformanceLog());
        assertEquals(List.of("PRAGMA cache_size = 2000", "PRAGMA temp_store = MEMORY"), config.getInitStatements());
        assertEquals(Path.of("target/test-data").resolve("devicedb.db"), config.getFilePath());
        assertEquals("devicedb-test", configuration.getMetricsConfig().getInstanceId());
        assertEquals(Duration.ofSeconds(2), configuration.getHealthCheckConfig().getTimeout());
    }

    @Test
    void testHealthAndMetricsSettingsReachDatabaseConfig() {
        Map<String, String> env = Map.of(
            "DEVICEDB_HEALTH_ENABLED", "false",
            "DEVICEDB_METRICS_ENABLED", "false"
        );

        DatabaseConfig config = new DeviceDbConfiguration("test", env).getDatabaseConfig();

        assertFalse(config.isHealthCheckEnabled());
        assertFalse(config.isMetricsEnabled());
        assertEquals(Duration.ofSeconds(2), config.getHealthCheckTimeout());
        assertEquals(Duration.ofSeconds(30), config.getHealthCheckInterval());
        assertEquals("devicedb-test", config.getMetricsInstanceId());
    }

    @Test
    void testGeneratedInstanceIdIsStable() {
        DeviceDbConfiguration configuration = new DeviceDbConfiguration("default", Map.of());

        String instanceId = configuration.getMetricsConfig().getInstanceId();

        assertTrue(instanceId.startsWith("devicedb-"));
        assertEquals(instanceId, configuration.getMetricsConfig().getInstanceId());
        assertEquals(instanceId, configuration.getDatabaseConfig().getMetricsInstanceId());
    }

    @Test
    void testEnvironmentOverridesProfile() {
        Map<String, String> env = Map.of(
            "DEVICEDB_DATABASE_POOL_MAX", "7",
            "DEVICEDB_DATABASE_NAME", "FromEnv",
            "DEVICEDB_PROFILE", "ignored",
            "OTHER_VARIABLE", "ignored"
        );

        DeviceDbConfiguration configuration = new DeviceDbConfiguration("test", env);

        assertEquals(7, configuration.getDatabaseConfig().getMaxConnections());
        assertEquals("FromEnv", configuration.getDatabaseConfig().getName());
        assertNull(configuration.getString("devicedb.profile", null));
        assertNull(configuration.getString("other.variable", null));
    }

    @Test
    void testAbsolutePathIsNotResolvedAgainstDataDirectory() {
        Path absolute = Path.of("/var/lib/devicedb/main.db").toAbsolutePath();
        DeviceDbConfiguration configuration = new DeviceDbConfiguration("default",
            Map.of("DEVICEDB_DATABASE_PATH", absolute.toString()));

        assertEquals(absolute, configuration.getDatabaseConfig().getFilePath());
    }

    @Test
    void testInvalidConfigurationFailsFast() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new DeviceDbConfiguration("invalid", Map.of()));

        assertTrue(e.getMessage().startsWith("Configuration validation failed: "));
        assertTrue(e.getMessage().contains("Max connections must be between 1 and 100"));
        assertTrue(e.getMessage().contains("Health check timeout must be shorter than the health check interval"));
    }

    @Test
    void testTypedGettersFallBackOnBadValues() {
        DeviceDbConfiguration configuration = new DeviceDbConfiguration("default",
            Map.of("DEVICEDB_CUSTOM_NUMBER", "not-a-number", "DEVICEDB_CUSTOM_DURATION", "soon"));

        assertEquals(3, configuration.getInt("devicedb.custom.number", 3));
        assertEquals(3L, configuration.getLong("devicedb.custom.number", 3L));
        assertEquals(Duration.ofSeconds(1), configuration.getDuration("devicedb.custom.duration", Duration.ofSeconds(1)));
        assertTrue(configuration.getBoolean("devicedb.missing", true));
    }

    @Test
    void testSplitStatements() {
        assertEquals(List.of("PRAGMA a = 1", "PRAGMA b = 2"),
            DeviceDbConfiguration.splitStatements(" PRAGMA a = 1 ;; PRAGMA b = 2; "));
        assertTrue(DeviceDbConfiguration.splitStatements("").isEmpty());
    }
}
