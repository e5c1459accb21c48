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
import dev.mars.devicedb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DatabaseConfigTest {

    private static DatabaseConfig.Builder valid() {
        return DatabaseConfig.builder()
            .name("DeviceDB")
            .filePath(Path.of("data", "devicedb.db"));
    }

    @Test
    void testDefaults() {
        DatabaseConfig config = valid().build();

        assertTrue(config.isValid());
        assertEquals(DeviceDbDefaults.DEFAULT_MAX_CONNECTIONS, config.getMaxConnections());
        assertEquals(DeviceDbDefaults.DEFAULT_BUSY_TIMEOUT_MS, config.getBusyTimeoutMs());
        assertTrue(config.isEnableWal());
        assertTrue(config.isEnableForeignKeys());
        assertTrue(config.getInitStatements().isEmpty());
        assertFalse(config.isEnablePerformanceLog());
        assertEquals("programmatic", config.getConfigSource());
        assertTrue(config.isHealthCheckEnabled());
        assertEquals(DeviceDbDefaults.DEFAULT_HEALTH_CHECK_TIMEOUT, config.getHealthCheckTimeout());
        assertTrue(config.isMetricsEnabled());
        assertNull(config.getMetricsInstanceId());
    }

    @Test
    void testGeneratedConnectionNamesAreUnique() {
        DatabaseConfig first = valid().build();
        DatabaseConfig second = valid().build();

        assertTrue(first.getConnectionName().startsWith("DeviceDB_"));
        assertNotEquals(first.getConnectionName(), second.getConnectionName());
    }

    @Test
    void testExplicitConnectionNameIsKept() {
        DatabaseConfig config = valid().connectionName("device-main").build();
        assertEquals("device-main", config.getConnectionName());
    }

    @Test
    void testValidationCollectsAllErrors() {
        DatabaseConfig config = DatabaseConfig.builder()
            .name(" ")
            .filePath("")
            .maxConnections(0)
            .busyTimeoutMs(500)
            .build();

        DbResult<Boolean> result = config.validate();

        assertTrue(result.isError());
        assertTrue(result.errorMessage().contains("Database name must not be empty"));
        assertTrue(result.errorMessage().contains("Database file path must not be empty"));
        assertTrue(result.errorMessage().contains("Max connections must be between 1 and 100"));
        assertTrue(result.errorMessage().contains("Busy timeout must be at least 1000ms"));
    }

    @Test
    void testPoolSizeBounds() {
        assertTrue(valid().maxConnections(1).build().isValid());
        assertTrue(valid().maxConnections(100).build().isValid());
        assertFalse(valid().maxConnections(101).build().isValid());
    }

    @Test
    void testHealthTimeoutMustBePositive() {
        DbResult<Boolean> result = valid().healthCheckTimeout(Duration.ofSeconds(-1)).build().validate();

        assertTrue(result.isError());
        assertEquals("Health check timeout must be positive", result.errorMessage());
    }

    @Test
    void testHealthIntervalMustBePositive() {
        DbResult<Boolean> result = valid().healthCheckInterval(Duration.ZERO).build().validate();

        assertTrue(result.isError());
        assertEquals("Health check interval must be positive", result.errorMessage());
    }

    @Test
    void testToBuilderDerivesVariant() {
        DatabaseConfig original = valid()
            .addInitStatement("PRAGMA cache_size = 2000")
            .enablePerformanceLog(true)
            .build();

        DatabaseConfig variant = original.toBuilder().maxConnections(4).build();

        assertEquals(4, variant.getMaxConnections());
        assertEquals(original.getName(), variant.getName());
        assertEquals(original.getConnectionName(), variant.getConnectionName());
        assertEquals(original.getInitStatements(), variant.getInitStatements());
        assertTrue(variant.isEnablePerformanceLog());
        assertNotEquals(original, variant);
        assertEquals(original, original.toBuilder().build());
    }

    @Test
    void testInitStatementsAreImmutable() {
        DatabaseConfig config = valid().addInitStatement("PRAGMA cache_size = 2000").build();
        assertThrows(UnsupportedOperationException.class, () -> config.getInitStatements().add("VACUUM"));
    }
}
