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


import java.time.Instant;

/**
 * Snapshot of query statistics for one database.
 *
 * @param totalQueries      statements recorded since the last reset
 * @param successfulQueries statements that completed
 * @param failedQueries     statements that failed, including ones that found no connection
 * @param slowQueries       statements slower than the configured threshold
 * @param avgQueryTimeMs    running mean execution time
 * @param lastQueryTime     time of the most recent record or reset
 */
public record DatabaseStats(
    long totalQueries,
    long successfulQueries,
    long failedQueries,
    long slowQueries,
    double avgQueryTimeMs,
    Instant lastQueryTime
) {
    public double successRate() {
        return totalQueries == 0 ? 0.0 : (double) successfulQueries / totalQueries;
    }
}
