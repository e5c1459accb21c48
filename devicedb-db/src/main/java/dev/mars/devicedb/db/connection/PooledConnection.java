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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;

/**
 * One open engine connection owned by a {@link ConnectionPool}.
 *
 * The owner is the thread that opened the connection; the pool only ever hands it
 * back to that thread. Equality is identity.
 */
public final class PooledConnection {
    private static final Logger logger = LoggerFactory.getLogger(PooledConnection.class);

    private final long id;
    private final String name;
    private final ThreadToken owner;
    private final Connection connection;
    private final Instant createdAt;

    PooledConnection(long id, String poolName, ThreadToken owner, Connection connection) {
        this.id = id;
        this.name = poolName + "_" + id + "_t" + owner.id();
        this.owner = Objects.requireNonNull(owner, "owner");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.createdAt = Instant.now();
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public ThreadToken owner() {
        return owner;
    }

    public Connection connection() {
        return connection;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Closes the engine connection. Failures are logged; the connection is discarded either way.
     */
    void closeQuietly() {
        try {
            connection.close();
            logger.debug("Closed connection {}", name);
        } catch (SQLException e) {
            logger.warn("Failed to close connection {}: {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "PooledConnection{" + name + "}";
    }
}
