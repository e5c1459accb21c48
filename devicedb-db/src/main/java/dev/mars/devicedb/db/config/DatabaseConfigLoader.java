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


import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.devicedb.api.DbResult;
import dev.mars.devicedb.db.DeviceDbDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Reads and writes {@link DatabaseConfig} from external sources: JSON files, properties
 * files and environment variables.
 *
 * Every loader validates the result and returns a {@link DbResult}; nothing here throws
 * for bad input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class DatabaseConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfigLoader.class);

    public static final String DEFAULT_ENV_PREFIX = "DB_";

    private static final ObjectMapper MAPPER = createObjectMapper();

    private DatabaseConfigLoader() {
    }

    /**
     * Loads a configuration from a file, choosing the format by extension:
     * {@code .json} is read as JSON, anything else as a properties file.
     */
    public static DbResult<DatabaseConfig> fromFile(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".json") ? fromJsonFile(file) : fromPropertiesFile(file);
    }

    public static DbResult<DatabaseConfig> fromJsonFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return DbResult.error("Config file does not exist: " + file);
        }
        try {
            ConfigDocument document = MAPPER.readValue(file.toFile(), ConfigDocument.class);
            DatabaseConfig config = document.toBuilder()
                .configSource(file.toString())
                .build();
            return validated(config, file.toString());
        } catch (IOException e) {
            logger.warn("Failed to parse JSON config {}: {}", file, e.getMessage());
            return DbResult.error("Failed to parse JSON config: " + e.getMessage());
        }
    }

    /**
     * Reads a properties file with keys {@code database.name}, {@code database.path},
     * {@code database.maxConnections}, {@code database.busyTimeout},
     * {@code database.enableWAL} and {@code database.enableForeignKeys}.
     */
    public static DbResult<DatabaseConfig> fromPropertiesFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return DbResult.error("Config file does not exist: " + file);
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
        } catch (IOException e) {
            logger.warn("Failed to read properties config {}: {}", file, e.getMessage());
            return DbResult.error("Failed to read properties config: " + e.getMessage());
        }

        DatabaseConfig.Builder builder = DatabaseConfig.builder()
            .name(props.getProperty("database.name", ""))
            .filePath(props.getProperty("database.path", ""))
            .configSource(file.toString());
        try {
            builder.maxConnections(Integer.parseInt(props.getProperty("database.maxConnections",
                String.valueOf(DeviceDbDefaults.DEFAULT_MAX_CONNECTIONS)).trim()));
            builder.busyTimeoutMs(Long.parseLong(props.getProperty("database.busyTimeout",
                String.valueOf(DeviceDbDefaults.DEFAULT_BUSY_TIMEOUT_MS)).trim()));
        } catch (NumberFormatException e) {
            return DbResult.error("Invalid numeric value in " + file + ": " + e.getMessage());
        }
        builder.enableWal(Boolean.parseBoolean(props.getProperty("database.enableWAL", "true").trim()));
        builder.enableForeignKeys(Boolean.parseBoolean(props.getProperty("database.enableForeignKeys", "true").trim()));

        return validated(builder.build(), file.toString());
    }

    public static DbResult<DatabaseConfig> fromEnvironment() {
        return fromEnvironment(DEFAULT_ENV_PREFIX, System.getenv());
    }

    /**
     * Builds a configuration from {@code <prefix>NAME}, {@code <prefix>PATH},
     * {@code <prefix>MAX_CONNECTIONS} and {@code <prefix>BUSY_TIMEOUT}.
     */
    public static DbResult<DatabaseConfig> fromEnvironment(String prefix, Map<String, String> environment) {
        DatabaseConfig.Builder builder = DatabaseConfig.builder()
            .name(environment.getOrDefault(prefix + "NAME", ""))
            .filePath(environment.getOrDefault(prefix + "PATH", ""))
            .configSource("environment");
        try {
            String maxConnections = environment.get(prefix + "MAX_CONNECTIONS");
            if (maxConnections != null) {
                builder.maxConnections(Integer.parseInt(maxConnections.trim()));
            }
            String busyTimeout = environment.get(prefix + "BUSY_TIMEOUT");
            if (busyTimeout != null) {
                builder.busyTimeoutMs(Long.parseLong(busyTimeout.trim()));
            }
        } catch (NumberFormatException e) {
            return DbResult.error("Invalid numeric environment value: " + e.getMessage());
        }
        return validated(builder.build(), "environment");
    }

    /**
     * Writes the configuration as JSON, creating parent directories when needed.
     */
    public static DbResult<Boolean> saveToJsonFile(DatabaseConfig config, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), ConfigDocument.from(config));
            logger.info("Saved database config '{}' to {}", config.getName(), file);
            return DbResult.success(true);
        } catch (IOException e) {
            logger.warn("Failed to save database config to {}: {}", file, e.getMessage());
            return DbResult.error("Failed to save config: " + e.getMessage());
        }
    }

    private static DbResult<DatabaseConfig> validated(DatabaseConfig config, String source) {
        DbResult<Boolean> validation = config.validate();
        if (validation.isError()) {
            logger.warn("Invalid database config from {}: {}", source, validation.errorMessage());
            return DbResult.error(validation.errorMessage());
        }
        logger.debug("Loaded database config {} from {}", config, source);
        return DbResult.success(config);
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * JSON shape of a database config file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class ConfigDocument {
        @JsonProperty("dbName")
        public String dbName;
        @JsonProperty("filePath")
        public String filePath;
        @JsonProperty("maxConnections")
        public Integer maxConnections;
        @JsonProperty("busyTimeout")
        public Long busyTimeout;
        @JsonProperty("enableWAL")
        public Boolean enableWal;
        @JsonProperty("enableForeignKeys")
        public Boolean enableForeignKeys;
        @JsonProperty("initSql")
        public List<String> initSql;
        @JsonProperty("slowQueryThreshold")
        public Long slowQueryThreshold;
        @JsonProperty("enablePerformanceLog")
        public Boolean enablePerformanceLog;
        @JsonProperty("healthCheckInterval")
        public Duration healthCheckInterval;

        static ConfigDocument from(DatabaseConfig config) {
            ConfigDocument document = new ConfigDocument();
            document.dbName = config.getName();
            document.filePath = config.getFilePath() != null ? config.getFilePath().toString() : null;
            document.maxConnections = config.getMaxConnections();
            document.busyTimeout = config.getBusyTimeoutMs();
            document.enableWal = config.isEnableWal();
            document.enableForeignKeys = config.isEnableForeignKeys();
            document.initSql = new ArrayList<>(config.getInitStatements());
            document.slowQueryThreshold = config.getSlowQueryThresholdMs();
            document.enablePerformanceLog = config.isEnablePerformanceLog();
            document.healthCheckInterval = config.getHealthCheckInterval();
            return document;
        }

        DatabaseConfig.Builder toBuilder() {
            DatabaseConfig.Builder builder = DatabaseConfig.builder()
                .name(dbName != null ? dbName : "")
                .filePath(filePath);
            if (maxConnections != null) builder.maxConnections(maxConnections);
            if (busyTimeout != null) builder.busyTimeoutMs(busyTimeout);
            if (enableWal != null) builder.enableWal(enableWal);
            if (enableForeignKeys != null) builder.enableForeignKeys(enableForeignKeys);
            if (initSql != null) builder.initStatements(initSql);
            if (slowQueryThreshold != null) builder.slowQueryThresholdMs(slowQueryThreshold);
            if (enablePerformanceLog != null) builder.enablePerformanceLog(enablePerformanceLog);
            if (healthCheckInterval != null) builder.healthCheckInterval(healthCheckInterval);
            return builder;
        }
    }
}
