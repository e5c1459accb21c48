package dev.mars.devicedb.device.registry;

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
import dev.mars.devicedb.api.database.DatabaseType;
import dev.mars.devicedb.db.DeviceDbDefaults;
import dev.mars.devicedb.db.config.DatabaseConfig;
import dev.mars.devicedb.db.manager.BaseDatabaseManager;
import dev.mars.devicedb.db.stats.DatabaseStats;
import dev.mars.devicedb.device.DeviceDatabaseManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Owns the database managers of the application, one per {@link DatabaseType}.
 *
 * <p>The registry is an ordinary object: whoever creates it controls its lifetime and
 * passes it to the components that need a database. Database types are enabled by
 * registering a factory; {@link DatabaseType#DEVICE_DB} is registered by default.
 *
 * <pre>{@code
 * try (DatabaseRegistry registry = new DatabaseRegistry()) {
 *     registry.initialize(Path.of("data"));
 *     registry.deviceDatabase().ifPresent(db -> db.getAllCameras());
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class DatabaseRegistry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseRegistry.class);

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<DatabaseType, Function<DatabaseConfig, ? extends BaseDatabaseManager>> factories =
        new EnumMap<>(DatabaseType.class);
    private final Map<DatabaseType, DatabaseConfig> customConfigs = new EnumMap<>(DatabaseType.class);
    private final Map<DatabaseType, BaseDatabaseManager> databases = new EnumMap<>(DatabaseType.class);
    private Path dataDirectory;
    private boolean initialized;

    public DatabaseRegistry() {
        this(null, Clock.systemDefaultZone());
    }

    /**
     * @param meterRegistry registry the managers bind their metrics to, or {@code null}
     *                      for a private registry per manager
     * @param clock         source of backup timestamps
     */
    public DatabaseRegistry(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = Objects.requireNonNull(clock, "clock");
        factories.put(DatabaseType.DEVICE_DB, config -> new DeviceDatabaseManager(config, meterRegistry));
    }

    /**
     * Enables a database type. Must be called before {@link #initialize(Path)}.
     */
    public synchronized void registerDatabaseFactory(DatabaseType type,
                                                     Function<DatabaseConfig, ? extends BaseDatabaseManager> factory) {
        if (initialized) {
            throw new IllegalStateException("Cannot register database factories after initialization");
        }
        factories.put(type, Objects.requireNonNull(factory, "factory"));
    }

    /**
     * Replaces the default configuration of one database type. Must be called before
     * {@link #initialize(Path)}.
     */
    public synchronized DbResult<Boolean> setCustomConfig(DatabaseType type, DatabaseConfig config) {
        if (initialized) {
            return DbResult.error("Cannot change configuration after initialization");
        }
        DbResult<Boolean> validation = config.validate();
        if (validation.isError()) {
            return validation;
        }
        customConfigs.put(type, config);
        logger.info("Custom configuration set for {}: {}", type, config);
        return DbResult.success(true);
    }

    public synchronized void resetToDefaultConfig(DatabaseType type) {
        customConfigs.remove(type);
    }

    /**
     * Creates the data directory and opens every enabled database. Databases that fail to
     * open are left out; the result reports how many opened.
     */
    public synchronized DbResult<Integer> initialize(Path dataDirectory) {
        if (initialized) {
            logger.warn("Database registry is already initialized");
            return DbResult.success(databases.size());
        }
        try {
            Files.createDirectories(dataDirectory);
        } catch (IOException e) {
            logger.error("Cannot create data directory {}: {}", dataDirectory, e.getMessage());
            return DbResult.error("Cannot create data directory: " + e.getMessage());
        }
        this.dataDirectory = dataDirectory;

        List<String> failures = new ArrayList<>();
        for (Map.Entry<DatabaseType, Function<DatabaseConfig, ? extends BaseDatabaseManager>> entry : factories.entrySet()) {
            DatabaseType type = entry.getKey();
            DatabaseConfig config = getConfig(type);
            BaseDatabaseManager manager = entry.getValue().apply(config);
            if (manager.initialize()) {
                databases.put(type, manager);
            } else {
                failures.add(type.logicalName());
                manager.close();
            }
        }
        initialized = true;

        logger.info("Database registry initialized in {}: {}/{} databases available",
            dataDirectory, databases.size(), factories.size());
        if (!failures.isEmpty()) {
            return DbResult.error("Failed to initialize databases: " + String.join(", ", failures));
        }
        return DbResult.success(databases.size());
    }

    /**
     * Configuration used for a type: the custom one if set, otherwise
     * {@code <dataDir>/<logicalname>.db} with default pool settings.
     */
    public synchronized DatabaseConfig getConfig(DatabaseType type) {
        DatabaseConfig custom = customConfigs.get(type);
        if (custom != null) {
            return custom;
        }
        Path base = dataDirectory != null ? dataDirectory : Path.of("data");
        return DatabaseConfig.builder()
            .name(type.logicalName())
            .filePath(base.resolve(type.defaultFileName()))
            .maxConnections(DeviceDbDefaults.DEFAULT_MAX_CONNECTIONS)
            .busyTimeoutMs(DeviceDbDefaults.DEFAULT_BUSY_TIMEOUT_MS)
            .configSource("registry-default")
            .build();
    }

    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }
        for (BaseDatabaseManager manager : databases.values()) {
            manager.close();
        }
        databases.clear();
        initialized = false;
        logger.info("Database registry shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public synchronized Optional<BaseDatabaseManager> getDatabase(DatabaseType type) {
        return Optional.ofNullable(databases.get(type));
    }

    public synchronized <T extends BaseDatabaseManager> Optional<T> getDatabase(DatabaseType type, Class<T> managerType) {
        BaseDatabaseManager manager = databases.get(type);
        return managerType.isInstance(manager) ? Optional.of(managerType.cast(manager)) : Optional.empty();
    }

    public Optional<DeviceDatabaseManager> deviceDatabase() {
        return getDatabase(DatabaseType.DEVICE_DB, DeviceDatabaseManager.class);
    }

    public synchronized boolean isDatabaseAvailable(DatabaseType type) {
        BaseDatabaseManager manager = databases.get(type);
        return manager != null && manager.isInitialized();
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    /**
     * Creates the tables of every open database.
     *
     * @return how many databases had all their tables created
     */
    public synchronized DbResult<Integer> createAllDatabases() {
        return forEachDatabase("create tables", BaseDatabaseManager::createAllTables);
    }

    public synchronized DbResult<Integer> optimizeAllDatabases() {
        return forEachDatabase("optimize", BaseDatabaseManager::optimizeDatabase);
    }

    /**
     * Backs up every open database into {@code backupDirectory} with timestamped names.
     */
    public synchronized DbResult<Integer> backupAllDatabases(Path backupDirectory) {
        try {
            Files.createDirectories(backupDirectory);
        } catch (IOException e) {
            logger.error("Cannot create backup directory {}: {}", backupDirectory, e.getMessage());
            return DbResult.error("Cannot create backup directory: " + e.getMessage());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return forEachDatabaseTyped("backup", (type, manager) ->
            manager.backupDatabase(BackupFiles.nextBackupFile(backupDirectory, type, now)));
    }

    /**
     * Restores every open database from its newest backup in {@code backupDirectory}.
     * A database without a backup counts as a failure.
     */
    public synchronized DbResult<Integer> restoreAllDatabases(Path backupDirectory) {
        return forEachDatabaseTyped("restore", (type, manager) -> {
            Optional<Path> latest;
            try {
                latest = BackupFiles.findLatestBackup(backupDirectory, type);
            } catch (IOException e) {
                logger.error("Cannot list backups in {}: {}", backupDirectory, e.getMessage());
                return false;
            }
            if (latest.isEmpty()) {
                logger.warn("No backup of {} found in {}", type.logicalName(), backupDirectory);
                return false;
            }
            return manager.restoreDatabase(latest.get());
        });
    }

    /**
     * Runs the health check of every open database now.
     */
    public synchronized Map<DatabaseType, Boolean> getDatabaseHealthStatus() {
        Map<DatabaseType, Boolean> status = new EnumMap<>(DatabaseType.class);
        databases.forEach((type, manager) -> status.put(type, manager.healthCheck()));
        return status;
    }

    public synchronized Map<DatabaseType, DatabaseStats> getAllDatabaseStats() {
        Map<DatabaseType, DatabaseStats> stats = new EnumMap<>(DatabaseType.class);
        databases.forEach((type, manager) -> stats.put(type, manager.getStatistics()));
        return stats;
    }

    private DbResult<Integer> forEachDatabase(String operation, Predicate<BaseDatabaseManager> action) {
        return forEachDatabaseTyped(operation, (type, manager) -> action.test(manager));
    }

    private DbResult<Integer> forEachDatabaseTyped(String operation, DatabaseAction action) {
        if (!initialized) {
            return DbResult.error("Database registry is not initialized");
        }
        int succeeded = 0;
        List<String> failures = new ArrayList<>();
        for (Map.Entry<DatabaseType, BaseDatabaseManager> entry : databases.entrySet()) {
            boolean ok;
            try {
                ok = action.apply(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                logger.error("Exception during {} of {}: {}", operation, entry.getKey(), e.getMessage(), e);
                ok = false;
            }
            if (ok) {
                succeeded++;
            } else {
                failures.add(entry.getKey().logicalName());
            }
        }
        logger.info("{} completed for {}/{} databases", operation, succeeded, databases.size());
        if (!failures.isEmpty()) {
            return DbResult.error(operation + " failed for: " + String.join(", ", failures));
        }
        return DbResult.success(succeeded);
    }

    @FunctionalInterface
    private interface DatabaseAction {
        boolean apply(DatabaseType type, BaseDatabaseManager manager);
    }
}
