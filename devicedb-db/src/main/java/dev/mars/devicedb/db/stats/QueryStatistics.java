package dev.mars.devicedb.db.stats;

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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe query counters for a database manager.
 *
 * Uses its own lock, independent of the connection pool, so recording never
 * contends with connection bookkeeping.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class QueryStatistics {
    private static final Logger logger = LoggerFactory.getLogger(QueryStatistics.class);

    private final String databaseName;
    private final long slowQueryThresholdMs;
    private final boolean performanceLogEnabled;
    private final ReentrantLock lock = new ReentrantLock();

    private long totalQueries;
    private long successfulQueries;
    private long failedQueries;
    private long slowQueries;
    private double avgQueryTimeMs;
    private Instant lastQueryTime = Instant.now();

    public QueryStatistics(String databaseName, long slowQueryThresholdMs, boolean performanceLogEnabled) {
        this.databaseName = databaseName;
        this.slowQueryThresholdMs = slowQueryThresholdMs;
        this.performanceLogEnabled = performanceLogEnabled;
    }

    /**
     * Records one statement execution.
     *
     * @param sql       the statement, used only for slow-query logging
     * @param success   whether it completed
     * @param elapsedMs wall-clock execution time
     */
    public void record(String sql, boolean success, double elapsedMs) {
        boolean slow = slowQueryThresholdMs > 0 && elapsedMs > slowQueryThresholdMs;
        lock.lock();
        try {
            totalQueries++;
            if (success) {
                successfulQueries++;
            } else {
                failedQueries++;
            }
            if (slow) {
                slowQueries++;
            }
            avgQueryTimeMs = (avgQueryTimeMs * (totalQueries - 1) + elapsedMs) / totalQueries;
            lastQueryTime = Instant.now();
        } finally {
            lock.unlock();
        }

        if (slow) {
            logger.warn("Slow query on '{}' took {} ms: {}", databaseName, String.format("%.1f", elapsedMs), sql);
        } else if (performanceLogEnabled) {
            logger.info("Query on '{}' took {} ms ({}): {}", databaseName,
                String.format("%.1f", elapsedMs), success ? "ok" : "failed", sql);
        }
    }

    public DatabaseStats snapshot() {
        lock.lock();
        try {
            return new DatabaseStats(totalQueries, successfulQueries, failedQueries, slowQueries,
                avgQueryTimeMs, lastQueryTime);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            totalQueries = 0;
            successfulQueries = 0;
            failedQueries = 0;
            slowQueries = 0;
            avgQueryTimeMs = 0.0;
            lastQueryTime = Instant.now();
        } finally {
            lock.unlock();
        }
        logger.info("Statistics reset for '{}'", databaseName);
    }

    public long getTotalQueries() {
        lock.lock();
        try {
            return totalQueries;
        } finally {
            lock.unlock();
        }
    }

    public long getSuccessfulQueries() {
        lock.lock();
        try {
            return successfulQueries;
        } finally {
            lock.unlock();
        }
    }

    public long getFailedQueries() {
        lock.lock();
        try {
            return failedQueries;
        } finally {
            lock.unlock();
        }
    }

    public long getSlowQueries() {
        lock.lock();
        try {
            return slowQueries;
        } finally {
            lock.unlock();
        }
    }
}
