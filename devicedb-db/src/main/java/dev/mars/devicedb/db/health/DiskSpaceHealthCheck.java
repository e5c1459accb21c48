package dev.mars.devicedb.db.health;

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


import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reports degraded when the volume holding the database has less free space than the
 * configured minimum.
 */
public class DiskSpaceHealthCheck implements HealthCheck {
    private final Path databaseFile;
    private final long minFreeBytes;

    public DiskSpaceHealthCheck(Path databaseFile, long minFreeBytes) {
        this.databaseFile = databaseFile;
        this.minFreeBytes = minFreeBytes;
    }

    @Override
    public HealthStatus check(String component) {
        Path directory = databaseFile.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return HealthStatus.unhealthy(component, "Database directory does not exist: " + directory);
        }
        try {
            FileStore store = Files.getFileStore(directory);
            long usable = store.getUsableSpace();
            long total = store.getTotalSpace();
            Map<String, Object> details = Map.of(
                "usableBytes", usable,
                "totalBytes", total,
                "path", directory.toString()
            );
            if (usable < minFreeBytes) {
                return HealthStatus.degraded(component,
                    "Low disk space: " + (usable / (1024 * 1024)) + " MB free", details);
            }
            return HealthStatus.healthy(component, details);
        } catch (IOException e) {
            return HealthStatus.unhealthy(component, "Cannot read disk space: " + e.getMessage());
        }
    }
}
