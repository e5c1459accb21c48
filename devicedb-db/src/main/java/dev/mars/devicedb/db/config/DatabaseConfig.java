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

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable configuration of one logical embedded database.
 *
 * Instances are created through {@link #builder()} and never change afterwards,
 * so a manager may hold its config for its whole life without copying.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class DatabaseConfig {
    private final String name;
    private final Path filePath;
    private final String connectionName;
    private final int maxConnections;
    private final long busyTimeoutMs;
    private final boolean enableWal;
    private final boolean enableForeignKeys;
    private final List<String> initStatements;
    private final long slowQueryThresholdMs;
    private final boolean enablePerformanceLog;
    private final Duration healthCheckInterval;
    private final boolean healthCheckEnabled;
    private final Duration healthCheckTimeout;
    private final boolean metricsEnabled;
    private final String metricsInstanceId;
    private final String configSource;

    private DatabaseConfig(Builder builder) {
        this.name = builder.name;
        this.filePath = builder.filePath;
        this.connectionName = builder.connectionName != null
            ? builder.connectionName
            : builder.name + "_" + UUID.randomUUID();
        this.maxConnections = builder.maxConnections;
        this.busyTimeoutMs = builder.busyTimeoutMs;
        this.enableWal = builder.enableWal;
        this.enableForeignKeys = builder.enableForeignKeys;
        this.initStatements = List.copyOf(builder.initStatements);
        this.slowQueryThresholdMs = builder.slowQueryThresholdMs;
        this.enablePerformanceLog = builder.enablePerformanceLog;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.healthCheckEnabled = builder.healthCheckEnabled;
        this.healthCheckTimeout = builder.healthCheckTimeout;
        this.metricsEnabled = builder.metricsEnabled;
        this.metricsInstanceId = builder.metricsInstanceId;
        this.configSource = builder.configSource;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration, for deriving variants.
     */
    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .filePath(filePath)
            .connectionName(connectionName)
            .maxConnections(maxConnections)
            .busyTimeoutMs(busyTimeoutMs)
            .enableWal(enableWal)
            .enableForeignKeys(enableForeignKeys)
            .initStatements(initStatements)
            .slowQueryThresholdMs(slowQueryThresholdMs)
            .enablePerformanceLog(enablePerformanceLog)
            .healthCheckInterval(healthCheckInterval)
            .healthCheckEnabled(healthCheckEnabled)
            .healthCheckTimeout(healthCheckTimeout)
            .metricsEnabled(metricsEnabled)
            .metricsInstanceId(metricsInstanceId)
            .configSource(configSource);
    }

    /**
     * Checks the configuration without touching the filesystem.
     *
     * @return success, or an error listing every violated rule
     */
    public DbResult<Boolean> validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Database name must not be empty");
        }
        if (filePath == null || filePath.toString().isBlank()) {
            errors.add("Database file path must not be empty");
        }
        if (maxConnections < 1 || maxConnections > DeviceDbDefaults.MAX_POOL_SIZE) {
            errors.add("Max connections must be between 1 and " + DeviceDbDefaults.MAX_POOL_SIZE);
        }
        if (busyTimeoutMs < DeviceDbDefaults.MIN_BUSY_TIMEOUT_MS) {
            errors.add("Busy timeout must be at least " + DeviceDbDefaults.MIN_BUSY_TIMEOUT_MS + "ms");
        }
        if (slowQueryThresholdMs < 0) {
            errors.add("Slow query threshold must be non-negative");
        }
        if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
            errors.add("Health check interval must be positive");
        }
        if (healthCheckTimeout.isNegative() || healthCheckTimeout.isZero()) {
            errors.add("Health check timeout must be positive");
        }

        if (!errors.isEmpty()) {
            return DbResult.error(String.join(", ", errors));
        }
        return DbResult.success(true);
    }

    public boolean isValid() {
        return validate().isSuccess();
    }

    public String getName() {
        return name;
    }

    public Path getFilePath() {
        return filePath;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public long getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public boolean isEnableWal() {
        return enableWal;
    }

    public boolean isEnableForeignKeys() {
        return enableForeignKeys;
    }

    /**
     * SQL statements run once on the primary connection after it is configured.
     */
    public List<String> getInitStatements() {
        return initStatements;
    }

    public long getSlowQueryThresholdMs() {
        return slowQueryThresholdMs;
    }

    public boolean isEnablePerformanceLog() {
        return enablePerformanceLog;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    /**
     * Whether {@code initialize()} starts the periodic health check.
     */
    public boolean isHealthCheckEnabled() {
        return healthCheckEnabled;
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    /**
     * Whether the manager binds its meters to the meter registry.
     */
    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /**
     * Value of the {@code instance} tag on every meter, or {@code null} for no tag.
     */
    public String getMetricsInstanceId() {
        return metricsInstanceId;
    }

    /**
     * Where this configuration came from, e.g. a file path or {@code "environment"}.
     */
    public String getConfigSource() {
        return configSource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatabaseConfig that = (DatabaseConfig) o;
        return maxConnections == that.maxConnections &&
               busyTimeoutMs == that.busyTimeoutMs &&
               enableWal == that.enableWal &&
               enableForeignKeys == that.enableForeignKeys &&
               slowQueryThresholdMs == that.slowQueryThresholdMs &&
               enablePerformanceLog == that.enablePerformanceLog &&
               Objects.equals(name, that.name) &&
               Objects.equals(filePath, that.filePath) &&
               Objects.equals(initStatements, that.initStatements) &&
               healthCheckEnabled == that.healthCheckEnabled &&
               metricsEnabled == that.metricsEnabled &&
               Objects.equals(healthCheckInterval, that.healthCheckInterval) &&
               Objects.equals(healthCheckTimeout, that.healthCheckTimeout) &&
               Objects.equals(metricsInstanceId, that.metricsInstanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, filePath, maxConnections, busyTimeoutMs, enableWal, enableForeignKeys,
            initStatements, slowQueryThresholdMs, enablePerformanceLog, healthCheckInterval,
            healthCheckEnabled, healthCheckTimeout, metricsEnabled, metricsInstanceId);
    }

    @Override
    public String toString() {
        return "DatabaseConfig{" +
                "name='" + name + '\'' +
                ", filePath=" + filePath +
                ", maxConnections=" + maxConnections +
                ", busyTimeoutMs=" + busyTimeoutMs +
                ", enableWal=" + enableWal +
                ", enableForeignKeys=" + enableForeignKeys +
                ", initStatements=" + initStatements.size() +
                ", healthCheckEnabled=" + healthCheckEnabled +
                ", metricsEnabled=" + metricsEnabled +
                ", configSource='" + configSource + '\'' +
                '}';
    }

    public static final class Builder {
        private String name;
        private Path filePath;
        private String connectionName;
        private int maxConnections = DeviceDbDefaults.DEFAULT_MAX_CONNECTIONS;
        private long busyTimeoutMs = DeviceDbDefaults.DEFAULT_BUSY_TIMEOUT_MS;
        private boolean enableWal = true;
        private boolean enableForeignKeys = true;
        private List<String> initStatements = new ArrayList<>();
        private long slowQueryThresholdMs = DeviceDbDefaults.DEFAULT_SLOW_QUERY_THRESHOLD_MS;
        private boolean enablePerformanceLog = false;
        private Duration healthCheckInterval = DeviceDbDefaults.DEFAULT_HEALTH_CHECK_INTERVAL;
        private boolean healthCheckEnabled = true;
        private Duration healthCheckTimeout = DeviceDbDefaults.DEFAULT_HEALTH_CHECK_TIMEOUT;
        private boolean metricsEnabled = true;
        private String metricsInstanceId;
        private String configSource = "programmatic";

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath == null || filePath.isBlank() ? null : Path.of(filePath);
            return this;
        }

        /**
         * Overrides the generated connection name. By default it is the database
         * name followed by a random UUID so that two managers never collide.
         */
        public Builder connectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder busyTimeoutMs(long busyTimeoutMs) {
            this.busyTimeoutMs = busyTimeoutMs;
            return this;
        }

        public Builder enableWal(boolean enableWal) {
            this.enableWal = enableWal;
            return this;
        }

        public Builder enableForeignKeys(boolean enableForeignKeys) {
            this.enableForeignKeys = enableForeignKeys;
            return this;
        }

        public Builder initStatements(List<String> initStatements) {
            this.initStatements = new ArrayList<>(Objects.requireNonNull(initStatements, "initStatements"));
            return this;
        }

        public Builder addInitStatement(String statement) {
            this.initStatements.add(Objects.requireNonNull(statement, "statement"));
            return this;
        }

        public Builder slowQueryThresholdMs(long slowQueryThresholdMs) {
            this.slowQueryThresholdMs = slowQueryThresholdMs;
            return this;
        }

        public Builder enablePerformanceLog(boolean enablePerformanceLog) {
            this.enablePerformanceLog = enablePerformanceLog;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
            return this;
        }

        public Builder healthCheckEnabled(boolean healthCheckEnabled) {
            this.healthCheckEnabled = healthCheckEnabled;
            return this;
        }

        public Builder healthCheckTimeout(Duration healthCheckTimeout) {
            this.healthCheckTimeout = Objects.requireNonNull(healthCheckTimeout, "healthCheckTimeout");
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder metricsInstanceId(String metricsInstanceId) {
            this.metricsInstanceId = metricsInstanceId;
            return this;
        }

        public Builder configSource(String configSource) {
            this.configSource = configSource;
            return this;
        }

        public DatabaseConfig build() {
            return new DatabaseConfig(this);
        }
    }
}
