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
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer binding for one database manager.
 *
 * Pool gauges read a snapshot supplier, so they keep working when the manager
 * replaces its pool across close and re-initialize. Query counters are function
 * counters over {@link QueryStatistics}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class DatabaseMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMetrics.class);

    private final String databaseName;
    private final Tags tags;
    private final QueryStatistics statistics;
    private final Supplier<PoolSnapshot> poolSnapshot;

    private Timer queryTime;
    private Counter transactionsCommitted;
    private Counter transactionsRolledBack;
    private Counter transactionBeginFailures;
    private Counter backups;
    private Counter optimizations;
    private Counter healthCheckFailures;

    public DatabaseMetrics(String databaseName, QueryStatistics statistics, Supplier<PoolSnapshot> poolSnapshot) {
        this(databaseName, null, statistics, poolSnapshot);
    }

    /**
     * @param instanceId value of the {@code instance} tag, or {@code null} to tag by database only
     */
    public DatabaseMetrics(String databaseName, String instanceId, QueryStatistics statistics,
                           Supplier<PoolSnapshot> poolSnapshot) {
        this.databaseName = databaseName;
        this.tags = instanceId == null || instanceId.isBlank()
            ? Tags.of("database", databaseName)
            : Tags.of("database", databaseName, "instance", instanceId);
        this.statistics = statistics;
        this.poolSnapshot = poolSnapshot;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        queryTime = Timer.builder("devicedb.query.time")
            .description("Time taken to execute recorded statements")
            .tags(tags)
            .register(registry);

        transactionsCommitted = Counter.builder("devicedb.transactions.committed")
            .description("Transactions committed")
            .tags(tags)
            .register(registry);

        transactionsRolledBack = Counter.builder("devicedb.transactions.rolled_back")
            .description("Transactions rolled back")
            .tags(tags)
            .register(registry);

        transactionBeginFailures = Counter.builder("devicedb.transactions.begin_failures")
            .description("Transactions that could not be started")
            .tags(tags)
            .register(registry);

        backups = Counter.builder("devicedb.backups")
            .description("Successful database backups")
            .tags(tags)
            .register(registry);

        optimizations = Counter.builder("devicedb.optimizations")
            .description("Successful optimize runs")
            .tags(tags)
            .register(registry);

        healthCheckFailures = Counter.builder("devicedb.health.failures")
            .description("Failed health checks")
            .tags(tags)
            .register(registry);

        FunctionCounter.builder("devicedb.queries.total", statistics, QueryStatistics::getTotalQueries)
            .description("Statements recorded")
            .tags(tags)
            .register(registry);

        FunctionCounter.builder("devicedb.queries.successful", statistics, QueryStatistics::getSuccessfulQueries)
            .description("Statements that completed")
            .tags(tags)
            .register(registry);

        FunctionCounter.builder("devicedb.queries.failed", statistics, QueryStatistics::getFailedQueries)
            .description("Statements that failed")
            .tags(tags)
            .register(registry);

        FunctionCounter.builder("devicedb.queries.slow", statistics, QueryStatistics::getSlowQueries)
            .description("Statements slower than the slow query threshold")
            .tags(tags)
            .register(registry);

        Gauge.builder("devicedb.pool.connections.total", poolSnapshot, s -> s.get().total())
            .description("Open pooled connections")
            .tags(tags)
            .register(registry);

        Gauge.builder("devicedb.pool.connections.active", poolSnapshot, s -> s.get().used())
            .description("Pooled connections in use")
            .tags(tags)
            .register(registry);

        Gauge.builder("devicedb.pool.connections.idle", poolSnapshot, s -> s.get().available())
            .description("Idle pooled connections")
            .tags(tags)
            .register(registry);

        Gauge.builder("devicedb.pool.threads", poolSnapshot, s -> s.get().threadSlots())
            .description("Threads holding pool slots")
            .tags(tags)
            .register(registry);

        Gauge.builder("devicedb.pool.transactions.active", poolSnapshot, s -> s.get().activeTransactions())
            .description("Threads with a pinned transaction connection")
            .tags(tags)
            .register(registry);

        logger.info("Database metrics bound to registry for '{}' with tags {}", databaseName, tags);
    }

    public void recordQueryTime(Duration duration) {
        if (queryTime != null) {
            queryTime.record(duration);
        }
    }

    public void recordTransactionCommitted() {
        if (transactionsCommitted != null) {
            transactionsCommitted.increment();
        }
    }

    public void recordTransactionRolledBack() {
        if (transactionsRolledBack != null) {
            transactionsRolledBack.increment();
        }
    }

    public void recordTransactionBeginFailure() {
        if (transactionBeginFailures != null) {
            transactionBeginFailures.increment();
        }
    }

    public void recordBackup() {
        if (backups != null) {
            backups.increment();
        }
    }

    public void recordOptimization() {
        if (optimizations != null) {
            optimizations.increment();
        }
    }

    public void recordHealthCheck(boolean healthy) {
        if (!healthy && healthCheckFailures != null) {
            healthCheckFailures.increment();
        }
    }
}
