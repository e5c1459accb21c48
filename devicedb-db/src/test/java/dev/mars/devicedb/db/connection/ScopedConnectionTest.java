package dev.mars.devicedb.db.connection;

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


import dev.mars.devicedb.db.config.DatabaseConfig;
import dev.mars.devicedb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
class ScopedConnectionTest {

    @TempDir
    Path tempDir;

    private ConnectionPool newPool(int max) {
        DatabaseConfig config = DatabaseConfig.builder()
            .name("ScopedTest")
            .filePath(tempDir.resolve("scoped.db"))
            .build();
        return new ConnectionPool("scoped-test", max, new SqliteConnectionFactory(config));
    }

    @Test
    void testCloseReleasesToPool() {
        try (ConnectionPool pool = newPool(2)) {
            try (ScopedConnection scoped = pool.acquireScoped()) {
                assertTrue(scoped.isValid());
                assertTrue(scoped.isPooled());
                assertEquals(1, pool.usedCount());
            }
            assertEquals(0, pool.usedCount());
            assertEquals(1, pool.availableCount());
        }
    }

    @Test
    void testCloseIsIdempotent() {
        try (ConnectionPool pool = newPool(2)) {
            ScopedConnection scoped = pool.acquireScoped();
            scoped.close();
            scoped.close();

            assertFalse(scoped.isValid());
            assertThrows(IllegalStateException.class, scoped::connection);
            assertEquals(1, pool.availableCount());
        }
    }

    @Test
    void testUnavailableWhenPoolExhausted() throws InterruptedException {
        try (ConnectionPool pool = newPool(1)) {
            try (ScopedConnection first = pool.acquireScoped()) {
                AtomicReference<ScopedConnection> second = new AtomicReference<>();
                Thread other = new Thread(() -> {
                    try (ScopedConnection scoped = pool.acquireScoped()) {
                        second.set(scoped);
                    }
                });
                other.start();
                other.join();

                assertTrue(first.isValid());
                assertFalse(second.get().isValid());
                assertTrue(second.get().unavailableReason().contains("exhausted"));
                IllegalStateException e = assertThrows(IllegalStateException.class, second.get()::connection);
                assertTrue(e.getMessage().startsWith("No connection available"));
            }
        }
    }

    @Test
    void testBorrowedConnectionIsNotClosed() throws SQLException {
        DatabaseConfig config = DatabaseConfig.builder()
            .name("ScopedTest")
            .filePath(tempDir.resolve("borrowed.db"))
            .build();
        try (Connection raw = new SqliteConnectionFactory(config).open()) {
            ScopedConnection scoped = ScopedConnection.borrowed(raw, "primary");
            assertFalse(scoped.isPooled());
            assertSame(raw, scoped.connection());

            scoped.close();

            assertFalse(raw.isClosed());
            assertFalse(scoped.isValid());
        }
    }
}
