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
import dev.mars.devicedb.db.config.DatabaseConfig;
import dev.mars.devicedb.db.manager.BaseDatabaseManager;
import dev.mars.devicedb.device.DeviceDatabaseManager;
import dev.mars.devicedb.device.camera.CameraInfo;
import dev.mars.devicedb.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
class DatabaseRegistryTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-07-13T10:15:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private DatabaseRegistry registry;
    private Path dataDir;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new DatabaseRegistry(meterRegistry, FIXED_CLOCK);
        dataDir = tempDir.resolve("data");
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void testInitializeOpensDeviceDatabase() {
        DbResult<Integer> result = registry.initialize(dataDir);

        assertEquals(1, result.data());
        assertTrue(registry.isInitialized());
        assertTrue(registry.isDatabaseAvailable(DatabaseType.DEVICE_DB));
        assertFalse(registry.isDatabaseAvailable(DatabaseType.CONFIG_DB));
        assertTrue(Files.exists(dataDir.resolve("devicedb.db")));
        assertTrue(registry.deviceDatabase().orElseThrow().isInitialized());
        assertSame(meterRegistry, registry.deviceDatabase().orElseThrow().getMeterRegistry());
        assertTrue(registry.getDatabase(DatabaseType.CONFIG_DB).isEmpty());
    }

    @Test
    void testSecondInitializeIsNoOp() {
        registry.initialize(dataDir);
        DeviceDatabaseManager first = registry.deviceDatabase().orElseThrow();

        assertEquals(1, registry.initialize(dataDir).data());
        assertSame(first, registry.deviceDatabase().orElseThrow());
    }

    @Test
    void testDefaultConfig() {
        registry.initialize(dataDir);

        DatabaseConfig config = registry.getConfig(DatabaseType.DEVICE_DB);
        assertEquals("DeviceDB", config.getName());
        assertEquals(dataDir.resolve("devicedb.db"), config.getFilePath());
        assertEquals(10, config.getMaxConnections());
        assertEquals(5000, config.getBusyTimeoutMs());
    }

    @Test
    void testAdditionalDatabaseTypes() {
        registry.registerDatabaseFactory(DatabaseType.CONFIG_DB, config -> new DeviceDatabaseManager(config, meterRegistry));

        assertEquals(2, registry.initialize(dataDir).data());

        assertTrue(registry.getDatabase(DatabaseType.CONFIG_DB, DeviceDatabaseManager.class).isPresent());
        assertTrue(Files.exists(dataDir.resolve("configdb.db")));
        assertEquals(2, registry.getDatabaseHealthStatus().size());
        assertThrows(IllegalStateException.class,
            () -> registry.registerDatabaseFactory(DatabaseType.DATA_DB, DeviceDatabaseManager::new));
    }

    @Test
    void testCustomConfig() {
        DatabaseConfig custom = DatabaseConfig.builder()
            .name("DeviceDB")
            .filePath(tempDir.resolve("custom").resolve("device.db"))
            .maxConnections(2)
            .build();

        assertTrue(registry.setCustomConfig(DatabaseType.DEVICE_DB, custom).isSuccess());
        assertTrue(registry.setCustomConfig(DatabaseType.DEVICE_DB,
            custom.toBuilder().maxConnections(0).build()).isError());
        registry.initialize(dataDir);

        assertEquals(2, registry.deviceDatabase().orElseThrow().getConfig().getMaxConnections());
        assertTrue(Files.exists(tempDir.resolve("custom").resolve("device.db")));
        assertEquals("Cannot change configuration after initialization",
            registry.setCustomConfig(DatabaseType.DEVICE_DB, custom).errorMessage());
    }

    @Test
    void testResetToDefaultConfig() {
        registry.setCustomConfig(DatabaseType.DEVICE_DB, DatabaseConfig.builder()
            .name("Custom")
            .filePath(tempDir.resolve("custom.db"))
            .build());
        registry.resetToDefaultConfig(DatabaseType.DEVICE_DB);

        assertEquals("DeviceDB", registry.getConfig(DatabaseType.DEVICE_DB).getName());
    }

    @Test
    void testFailedDatabaseIsLeftOut() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        registry.setCustomConfig(DatabaseType.DEVICE_DB, DatabaseConfig.builder()
            .name("DeviceDB")
            .filePath(blocker.resolve("devicedb.db"))
            .build());

        DbResult<Integer> result = registry.initialize(dataDir);

        assertEquals("Failed to initialize databases: DeviceDB", result.errorMessage());
        assertTrue(registry.isInitialized());
        assertTrue(registry.deviceDatabase().isEmpty());
    }

    @Test
    void testBackupAndRestoreAll() {
        registry.initialize(dataDir);
        DeviceDatabaseManager device = registry.deviceDatabase().orElseThrow();
        device.addCamera(CameraInfo.of("A", "1", "USB3", "SN-1", "Basler"));
        Path backups = tempDir.resolve("backups");

        assertEquals(1, registry.backupAllDatabases(backups).data());
        assertTrue(Files.exists(backups.resolve("DeviceDB_20250713_101500_000.db")));

        device.addCamera(CameraInfo.of("B", "1", "USB3", "SN-2", "Basler"));
        assertEquals(1, registry.backupAllDatabases(backups).data(), "same timestamp gets a sequence suffix");
        assertTrue(Files.exists(backups.resolve("DeviceDB_20250713_101500_000_1.db")));

        device.addCamera(CameraInfo.of("C", "1", "USB3", "SN-3", "Basler"));
        assertEquals(1, registry.restoreAllDatabases(backups).data());

        assertEquals(2, device.getAllCameras().data().size());
    }

    @Test
    void testRestoreWithoutBackups() {
        registry.initialize(dataDir);

        DbResult<Integer> result = registry.restoreAllDatabases(tempDir.resolve("empty"));

        assertEquals("restore failed for: DeviceDB", result.errorMessage());
        assertTrue(registry.isDatabaseAvailable(DatabaseType.DEVICE_DB));
    }

    @Test
    void testMaintenanceAcrossDatabases() {
        registry.initialize(dataDir);

        assertEquals(1, registry.createAllDatabases().data());
        assertEquals(1, registry.optimizeAllDatabases().data());
        assertEquals(Map.of(DatabaseType.DEVICE_DB, true), registry.getDatabaseHealthStatus());
        assertTrue(registry.getAllDatabaseStats().get(DatabaseType.DEVICE_DB).totalQueries() > 0);
    }

    @Test
    void testShutdown() {
        registry.initialize(dataDir);
        BaseDatabaseManager device = registry.getDatabase(DatabaseType.DEVICE_DB).orElseThrow();

        registry.shutdown();

        assertFalse(registry.isInitialized());
        assertFalse(device.isInitialized());
        assertTrue(registry.deviceDatabase().isEmpty());
        assertEquals("Database registry is not initialized", registry.optimizeAllDatabases().errorMessage());
        assertTrue(registry.getDatabaseHealthStatus().isEmpty());
    }
}
