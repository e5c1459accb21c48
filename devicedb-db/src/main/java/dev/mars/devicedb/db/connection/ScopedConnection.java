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


import java.sql.Connection;
import java.util.Objects;

/**
 * Handle to a connection for the duration of a try-with-resources block.
 *
 * <p>A pooled handle releases its connection back to the pool on {@link #close()}; if the
 * connection is the thread's pinned transaction connection it stays pinned. A borrowed
 * handle wraps a connection owned elsewhere (the manager's primary connection) and never
 * closes it. An unavailable handle reports {@link #isValid()} {@code false}.
 *
 * <pre>{@code
 * try (ScopedConnection scoped = provider.acquireConnection()) {
 *     if (!scoped.isValid()) {
 *         return DbResult.error("No connection available");
 *     }
 *     try (PreparedStatement ps = scoped.connection().prepareStatement(sql)) { ... }
 * }
 * }</pre>
 *
 * Not thread-safe; a handle belongs to the thread that acquired it.
 */
public final class ScopedConnection implements AutoCloseable {
    private final ConnectionPool pool;
    private final PooledConnection pooled;
    private final Connection connection;
    private final String name;
    private final String unavailableReason;
    private boolean closed;

    private ScopedConnection(ConnectionPool pool, PooledConnection pooled, Connection connection,
                             String name, String unavailableReason) {
        this.pool = pool;
        this.pooled = pooled;
        this.connection = connection;
        this.name = name;
        this.unavailableReason = unavailableReason;
    }

    static ScopedConnection pooled(ConnectionPool pool, PooledConnection pooled) {
        return new ScopedConnection(Objects.requireNonNull(pool, "pool"), pooled,
            pooled.connection(), pooled.name(), null);
    }

    /**
     * Wraps a connection owned by someone else. Closing the handle leaves it open.
     */
    public static ScopedConnection borrowed(Connection connection, String name) {
        return new ScopedConnection(null, null, Objects.requireNonNull(connection, "connection"), name, null);
    }

    public static ScopedConnection unavailable(String reason) {
        return new ScopedConnection(null, null, null, null, reason);
    }

    public boolean isValid() {
        return connection != null && !closed;
    }

    /**
     * Whether the connection came from a pool rather than being borrowed.
     */
    public boolean isPooled() {
        return pooled != null;
    }

    /**
     * @throws IllegalStateException if the handle is unavailable or already closed
     */
    public Connection connection() {
        if (connection == null) {
            throw new IllegalStateException("No connection available: " + unavailableReason);
        }
        if (closed) {
            throw new IllegalStateException("Scoped connection " + name + " already released");
        }
        return connection;
    }

    public String name() {
        return name;
    }

    /**
     * Why no connection was available, or {@code null} for a valid handle.
     */
    public String unavailableReason() {
        return unavailableReason;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pool != null) {
            pool.release(pooled);
        }
    }

    @Override
    public String toString() {
        if (connection == null) {
            return "ScopedConnection{unavailable: " + unavailableReason + "}";
        }
        return "ScopedConnection{" + name + (closed ? ", released" : "") + "}";
    }
}
