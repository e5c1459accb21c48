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


/**
 * Point-in-time view of a {@link ConnectionPool}, taken under the pool lock.
 *
 * @param name               pool name
 * @param maxConnections     configured capacity
 * @param total              open connections, including ones being opened
 * @param available          idle connections across all threads
 * @param used               connections handed out, including pinned transaction connections
 * @param threadSlots        threads currently known to the pool
 * @param activeTransactions threads with a pinned transaction connection
 * @param created            connections opened since the pool was created
 * @param reaped             connections closed because their thread exited
 * @param exhausted          acquires refused because the pool was at capacity
 */
public record PoolSnapshot(
    String name,
    int maxConnections,
    int total,
    int available,
    int used,
    int threadSlots,
    int activeTransactions,
    long created,
    long reaped,
    long exhausted
) {
    public double utilization() {
        return maxConnections == 0 ? 0.0 : (double) used / maxConnections;
    }
}
