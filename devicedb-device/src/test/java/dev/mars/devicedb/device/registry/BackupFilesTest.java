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


import dev.mars.devicedb.api.database.DatabaseType;
import dev.mars.devicedb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class BackupFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void testBackupFileName() {
        String name = BackupFiles.backupFileName(DatabaseType.DEVICE_DB,
            LocalDateTime.of(2025, 7, 13, 9, 5, 3, 42_000_000));

        assertEquals("DeviceDB_20250713_090503_042.db", name);
        assertTrue(BackupFiles.isBackupOf(DatabaseType.DEVICE_DB, name));
        assertTrue(BackupFiles.isBackupOf(DatabaseType.DEVICE_DB, "DeviceDB_20250713_090503_042_3.db"));
        assertFalse(BackupFiles.isBackupOf(DatabaseType.CONFIG_DB, name));
        assertFalse(BackupFiles.isBackupOf(DatabaseType.DEVICE_DB, "DeviceDB_latest.db"));
    }

    @Test
    void testNextBackupFileSkipsExistingNames() throws IOException {
        LocalDateTime now = LocalDateTime.of(2025, 7, 13, 10, 15, 0);

        Path first = BackupFiles.nextBackupFile(tempDir, DatabaseType.DEVICE_DB, now);
        assertEquals(tempDir.resolve("DeviceDB_20250713_101500_000.db"), first);

        Files.createFile(first);
        Path second = BackupFiles.nextBackupFile(tempDir, DatabaseType.DEVICE_DB, now);
        assertEquals(tempDir.resolve("DeviceDB_20250713_101500_000_1.db"), second);

        Files.createFile(second);
        assertEquals(tempDir.resolve("DeviceDB_20250713_101500_000_2.db"),
            BackupFiles.nextBackupFile(tempDir, DatabaseType.DEVICE_DB, now));
    }

    @Test
    void testFindLatestBackup() throws IOException {
        Files.createFile(tempDir.resolve("DeviceDB_20250101_000000_000.db"));
        Files.createFile(tempDir.resolve("DeviceDB_20250713_101500_250.db"));
        Files.createFile(tempDir.resolve("DeviceDB_20250713_101500_250_2.db"));
        Files.createFile(tempDir.resolve("DeviceDB_20250713_101500_250_10.db"));
        Files.createFile(tempDir.resolve("DeviceDB_20250401_235959_999.db"));
        Files.createFile(tempDir.resolve("DeviceDB_20991231_000000_000.db.tmp"));
        Files.createFile(tempDir.resolve("ConfigDB_20260101_000000_000.db"));

        Optional<Path> latest = BackupFiles.findLatestBackup(tempDir, DatabaseType.DEVICE_DB);

        assertEquals(Optional.of(tempDir.resolve("DeviceDB_20250713_101500_250_10.db")), latest);
    }

    @Test
    void testNoBackups() throws IOException {
        assertTrue(BackupFiles.findLatestBackup(tempDir, DatabaseType.DEVICE_DB).isEmpty());
        assertTrue(BackupFiles.findLatestBackup(tempDir.resolve("missing"), DatabaseType.DEVICE_DB).isEmpty());
    }
}
