package dev.mars.devicedb.db.metrics;

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


import dev.mars.devicedb.db.connection.PoolSnapshot;
import dev.mars.devicedb.db.stats.QueryStatistics;
import dev.mars.devicedb.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DatabaseMetricsTest {

    private SimpleMeterRegistry registry;
    private QueryStatistics statistics;
    private AtomicReference<PoolSnapshot> snapshot;
    private DatabaseMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        statistics = new QueryStatistics("MetricsTest", 1000, false);
        snapshot = new AtomicReference<>(new PoolSnapshot("metrics-pool", 4, 0, 0, 0, 0, 0, 0, 0, 0));
        metrics = new DatabaseMetrics("MetricsTest", statistics, snapshot::get);
        metrics.bindTo(registry);
    }

    @Test
    void testCountersAreTaggedWithDatabase() {
        metrics.recordTransactionCommitted();
        metrics.recordTransactionCommitted();
        metrics.recordTransactionRolledBack();
        metrics.recordTransactionBeginFailure();
        metrics.recordBackup();
        metrics.recordOptimization();

        assertEquals(2.0, registry.get("devicedb.transactions.committed").tag("database", "MetricsTest").counter().count());
        assertEquals(1.0, registry.get("devicedb.transactions.rolled_back").counter().count());
        assertEquals(1.0, registry.get("devicedb.transactions.begin_failures").counter().count());
        assertEquals(1.0, registry.get("devicedb.backups").counter().count());
        assertEquals(1.0, registry.get("devicedb.optimizations").counter().count());
    }

    @Test
    void testInstanceTagIsAddedWhenConfigured() {
        SimpleMeterRegistry tagged = new SimpleMeterRegistry();
        new DatabaseMetrics("MetricsTest", "edge-01", statistics, snapshot::get).bindTo(tagged);
        statistics.record("SELECT 1", true, 1.0);

        assertEquals(1.0, tagged.get("devicedb.queries.total")
            .tag("database", "MetricsTest").tag("instance", "edge-01").functionCounter().count());
        assertNull(registry.find("devicedb.queries.total").tag("instance", "edge-01").functionCounter());
    }

    @Test
    void testHealthFailuresCountOnlyUnhealthyResults() {
        metrics.recordHealthCheck(true);
        metrics.recordHealthCheck(false);

        assertEquals(1.0, registry.get("devicedb.health.failures").counter().count());
    }

    @Test
    void testQueryCountersFollowStatistics() {
        statistics.record("SELECT 1", true, 1.0);
        statistics.record("SELECT broken", false, 1.0);
        metrics.recordQueryTime(Duration.ofMillis(12));

        assertEquals(2.0, registry.get("devicedb.queries.total").functionCounter().count());
        assertEquals(1.0, registry.get("devicedb.queries.successful").functionCounter().count());
        assertEquals(1.0, registry.get("devicedb.queries.failed").functionCounter().count());
        assertEquals(1, registry.get("devicedb.query.time").timer().count());
        assertEquals(12.0, registry.get("devicedb.query.time").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void testPoolGaugesReadLatestSnapshot() {
        snapshot.set(new PoolSnapshot("metrics-pool", 4, 3, 1, 2, 2, 1, 3, 0, 0));

        assertEquals(3.0, registry.get("devicedb.pool.connections.total").gauge().value());
        assertEquals(2.0, registry.get("devicedb.pool.connections.active").gauge().value());
        assertEquals(1.0, registry.get("devicedb.pool.connections.idle").gauge().value());
        assertEquals(2.0, registry.get("devicedb.pool.threads").gauge().value());
        assertEquals(1.0, registry.get("devicedb.pool.transactions.active").gauge().value());
    }
}
