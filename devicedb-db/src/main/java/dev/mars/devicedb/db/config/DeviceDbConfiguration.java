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


import dev.mars.devicedb.api.DbResult;
import dev.mars.devicedb.db.DeviceDbDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

/**
 * Layered properties configuration for DeviceDB.
 *
 * Sources, later ones overriding earlier ones:
 * <ol>
 *   <li>{@code /devicedb-default.properties} on the classpath</li>
 *   <li>{@code /devicedb-<profile>.properties} on the classpath</li>
 *   <li>{@code DEVICEDB_*} environment variables ({@code DEVICEDB_DATABASE_NAME} becomes
 *       {@code devicedb.database.name})</li>
 *   <li>{@code devicedb.*} system properties</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class DeviceDbConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(DeviceDbConfiguration.class);

    public static final String DATABASE_NAME = "devicedb.database.name";
    public static final String DATABASE_PATH = "devicedb.database.path";
    public static final String POOL_MAX = "devicedb.database.pool.max";
    public static final String BUSY_TIMEOUT_MS = "devicedb.database.busy.timeout.ms";
    public static final String WAL_ENABLED = "devicedb.database.wal.enabled";
    public static final String FOREIGN_KEYS_ENABLED = "devicedb.database.foreign.keys.enabled";
    public static final String SLOW_QUERY_THRESHOLD_MS = "devicedb.database.slow.query.threshold.ms";
    public static final String PERFORMANCE_LOG_ENABLED = "devicedb.database.performance.log.enabled";
    public static final String INIT_SQL = "devicedb.database.init.sql";
    public static final String DATA_DIR = "devicedb.data.dir";
    public static final String HEALTH_ENABLED = "devicedb.health.enabled";
    public static final String HEALTH_INTERVAL = "devicedb.health.interval";
    public static final String HEALTH_TIMEOUT = "devicedb.health.timeout";
    public static final String METRICS_ENABLED = "devicedb.metrics.enabled";
    public static final String METRICS_INSTANCE_ID = "devicedb.metrics.instance.id";

    private final Properties properties;
    private final String profile;
    private final String generatedInstanceId = "devicedb-" + UUID.randomUUID().toString().substring(0, 8);

    public DeviceDbConfiguration() {
        this(getActiveProfile());
    }

    public DeviceDbConfiguration(String profile) {
        this(profile, System.getenv());
    }

    /**
     * Loads the configuration with an explicit environment, so tests can supply
     * overrides without touching the real process environment.
     */
    public DeviceDbConfiguration(String profile, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        validateConfiguration();
        logger.info("Loaded DeviceDB configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("devicedb.profile",
               System.getenv("DEVICEDB_PROFILE") != null ? System.getenv("DEVICEDB_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/devicedb-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/devicedb-" + profile + ".properties");
        }

        environment.forEach((key, value) -> {
            if (key.startsWith(DeviceDbDefaults.ENV_PREFIX) && !"DEVICEDB_PROFILE".equals(key)) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        // System properties win over the environment
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(DeviceDbDefaults.PROPERTY_PREFIX)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        DbResult<Boolean> databaseValidation = getDatabaseConfig().validate();
        if (databaseValidation.isError()) {
            errors.add(databaseValidation.errorMessage());
        }

        validateHealthCheckConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.info("Configuration validation passed");
    }

    private void validateHealthCheckConfig(List<String> errors) {
        if (!getBoolean(HEALTH_ENABLED, true)) {
            return;
        }
        Duration timeout = getDuration(HEALTH_TIMEOUT, DeviceDbDefaults.DEFAULT_HEALTH_CHECK_TIMEOUT);
        Duration interval = getDuration(HEALTH_INTERVAL, DeviceDbDefaults.DEFAULT_HEALTH_CHECK_INTERVAL);
        if (timeout.compareTo(interval) >= 0) {
            errors.add("Health check timeout must be shorter than the health check interval");
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public String getProfile() {
        return profile;
    }

    public Path getDataDirectory() {
        return Path.of(getString(DATA_DIR, "data"));
    }

    /**
     * Builds the database configuration described by the {@code devicedb.database.*} keys.
     * A relative database path is resolved against the data directory.
     */
    public DatabaseConfig getDatabaseConfig() {
        String name = getString(DATABASE_NAME, "");
        String rawPath = getString(DATABASE_PATH, "");
        Path filePath = null;
        if (!rawPath.isBlank()) {
            Path path = Path.of(rawPath);
            filePath = path.isAbsolute() ? path : getDataDirectory().resolve(path);
        }

        return DatabaseConfig.builder()
            .name(name)
            .filePath(filePath)
            .maxConnections(getInt(POOL_MAX, DeviceDbDefaults.DEFAULT_MAX_CONNECTIONS))
            .busyTimeoutMs(getLong(BUSY_TIMEOUT_MS, DeviceDbDefaults.DEFAULT_BUSY_TIMEOUT_MS))
            .enableWal(getBoolean(WAL_ENABLED, true))
            .enableForeignKeys(getBoolean(FOREIGN_KEYS_ENABLED, true))
            .slowQueryThresholdMs(getLong(SLOW_QUERY_THRESHOLD_MS, DeviceDbDefaults.DEFAULT_SLOW_QUERY_THRESHOLD_MS))
            .enablePerformanceLog(getBoolean(PERFORMANCE_LOG_ENABLED, false))
            .initStatements(splitStatements(getString(INIT_SQL, "")))
            .healthCheckInterval(getDuration(HEALTH_INTERVAL, DeviceDbDefaults.DEFAULT_HEALTH_CHECK_INTERVAL))
            .healthCheckEnabled(getBoolean(HEALTH_ENABLED, true))
            .healthCheckTimeout(getDuration(HEALTH_TIMEOUT, DeviceDbDefaults.DEFAULT_HEALTH_CHECK_TIMEOUT))
            .metricsEnabled(getBoolean(METRICS_ENABLED, true))
            .metricsInstanceId(getString(METRICS_INSTANCE_ID, generatedInstanceId))
            .configSource("profile:" + profile)
            .build();
    }

    public HealthCheckConfig getHealthCheckConfig() {
        return new HealthCheckConfig(
            getBoolean(HEALTH_ENABLED, true),
            getDuration(HEALTH_INTERVAL, DeviceDbDefaults.DEFAULT_HEALTH_CHECK_INTERVAL),
            getDuration(HEALTH_TIMEOUT, DeviceDbDefaults.DEFAULT_HEALTH_CHECK_TIMEOUT)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean(METRICS_ENABLED, true),
            getString(METRICS_INSTANCE_ID, generatedInstanceId)
        );
    }

    static List<String> splitStatements(String sql) {
        List<String> statements = new ArrayList<>();
        for (String part : sql.split(";")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    public static class HealthCheckConfig {
        private final boolean enabled;
        private final Duration interval;
        private final Duration timeout;

        public HealthCheckConfig(boolean enabled, Duration interval, Duration timeout) {
            this.enabled = enabled;
            this.interval = interval;
            this.timeout = timeout;
        }

        public boolean isEnabled() { return enabled; }
        public Duration getInterval() { return interval; }
        public Duration getTimeout() { return timeout; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }
}
