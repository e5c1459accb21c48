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

import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, thread-affine pool of connections to one embedded database file.
 *
 * <p>Idle connections are kept in a queue per owning thread and are only ever handed back
 * to the thread that opened them. A thread may pin one connection for the duration of a
 * transaction; while pinned, {@link #acquire()} on that thread returns the pinned
 * connection and {@link #release(PooledConnection)} leaves it in place. Slots of threads
 * that have exited are reaped at the start of every acquire, release and begin.
 *
 * <p>All bookkeeping happens under a single lock. Opening, committing, rolling back and
 * closing engine connections happen with the lock released; capacity for a connection
 * being opened is reserved first so the bound holds while the lock is free.
 * Exhaustion is reported as an empty result, never by waiting.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final String name;
    private final int maxConnections;
    private final ConnectionFactory connectionFactory;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ThreadToken, ThreadSlot> slots = new HashMap<>();
    private final Set<PooledConnection> inUse = new HashSet<>();
    // Includes connections currently being opened outside the lock
    private int totalConnections;
    private boolean closed;

    private final AtomicLong connectionIds = new AtomicLong();
    private final AtomicLong connectionsCreated = new AtomicLong();
    private final AtomicLong connectionsReaped = new AtomicLong();
    private final AtomicLong exhaustedAcquires = new AtomicLong();

    public ConnectionPool(String name, int maxConnections, ConnectionFactory connectionFactory) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1: " + maxConnections);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maxConnections = maxConnections;
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        logger.info("Created connection pool '{}' with max {} connections", name, maxConnections);
    }

    /**
     * Acquires a connection for the calling thread.
     *
     * <p>Precedence: the thread's pinned transaction connection, then an idle connection
     * previously opened by this thread, then a newly opened connection if capacity allows.
     *
     * @return the connection, or empty when the pool is exhausted, closed, or the engine
     *         refused to open a connection
     */
    public Optional<PooledConnection> acquire() {
        ThreadToken token = ThreadToken.current();
        List<PooledConnection> reaped = List.of();

        lock.lock();
        try {
            if (closed) {
                logger.debug("Acquire on closed pool '{}'", name);
                return Optional.empty();
            }
            reaped = reapDeadThreadsLocked();

            ThreadSlot slot = slots.computeIfAbsent(token, ThreadSlot::new);
            if (slot.activeTransaction != null) {
                return Optional.of(slot.activeTransaction);
            }

            PooledConnection idle = slot.idle.pollFirst();
            if (idle != null) {
                inUse.add(idle);
                return Optional.of(idle);
            }

            if (totalConnections >= maxConnections) {
                exhaustedAcquires.incrementAndGet();
                logger.debug("Connection pool '{}' exhausted ({}/{}), thread {}",
                    name, totalConnections, maxConnections, token.threadName());
                return Optional.empty();
            }
            totalConnections++;
        } finally {
            lock.unlock();
            closeAll(reaped);
        }

        return openReserved(token);
    }

    /**
     * Acquires a connection wrapped in a scoped handle that releases it on close.
     */
    public ScopedConnection acquireScoped() {
        return acquire()
            .map(connection -> ScopedConnection.pooled(this, connection))
            .orElseGet(() -> ScopedConnection.unavailable("Connection pool '" + name + "' exhausted"));
    }

    private Optional<PooledConnection> openReserved(ThreadToken token) {
        PooledConnection created = null;
        try {
            created = new PooledConnection(connectionIds.incrementAndGet(), name, token, connectionFactory.open());
        } catch (SQLException | RuntimeException e) {
            logger.warn("Failed to open connection for pool '{}': {}", name, e.getMessage());
        }

        boolean discard = false;
        lock.lock();
        try {
            if (created == null) {
                totalConnections--;
                return Optional.empty();
            }
            if (closed) {
                totalConnections--;
                discard = true;
                return Optional.empty();
            }
            inUse.add(created);
            connectionsCreated.incrementAndGet();
            logger.debug("Opened connection {} ({}/{})", created.name(), totalConnections, maxConnections);
            return Optional.of(created);
        } finally {
            lock.unlock();
            if (discard) {
                created.closeQuietly();
            }
        }
    }

    /**
     * Returns a connection to its owning thread's idle queue.
     *
     * <p>Releasing a connection that is not in use, or that is the owning thread's pinned
     * transaction connection, does nothing. A connection whose owning thread has exited
     * is closed instead of being queued.
     */
    public void release(PooledConnection connection) {
        if (connection == null) {
            return;
        }
        List<PooledConnection> toClose = new ArrayList<>();

        lock.lock();
        try {
            toClose.addAll(reapDeadThreadsLocked());

            if (!inUse.contains(connection)) {
                return;
            }
            ThreadSlot slot = slots.get(connection.owner());
            if (slot != null && slot.activeTransaction == connection) {
                return;
            }

            inUse.remove(connection);
            if (slot == null || closed) {
                totalConnections--;
                toClose.add(connection);
            } else {
                slot.idle.addFirst(connection);
            }
        } finally {
            lock.unlock();
            closeAll(toClose);
        }
    }

    /**
     * Closes and forgets a connection that is in use, e.g. after it became unusable.
     */
    void discard(PooledConnection connection) {
        boolean removed;
        lock.lock();
        try {
            removed = inUse.remove(connection);
            if (removed) {
                totalConnections--;
                ThreadSlot slot = slots.get(connection.owner());
                if (slot != null && slot.activeTransaction == connection) {
                    slot.activeTransaction = null;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed) {
            logger.warn("Discarding connection {}", connection.name());
            connection.closeQuietly();
        }
    }

    /**
     * Pins a connection to the calling thread and starts a transaction on it.
     * Calling this again on a thread that already has a transaction returns the same
     * connection without starting another one.
     *
     * @return the pinned connection, or empty when no connection could be obtained or
     *         the engine refused to start the transaction
     */
    public Optional<PooledConnection> beginThreadTransaction() {
        ThreadToken token = ThreadToken.current();

        lock.lock();
        try {
            ThreadSlot slot = slots.get(token);
            if (slot != null && slot.activeTransaction != null) {
                logger.debug("Thread {} already has an active transaction on {}",
                    token.threadName(), slot.activeTransaction.name());
                return Optional.of(slot.activeTransaction);
            }
        } finally {
            lock.unlock();
        }

        Optional<PooledConnection> acquired = acquire();
        if (acquired.isEmpty()) {
            logger.warn("Cannot begin transaction on pool '{}': no connection available", name);
            return Optional.empty();
        }

        PooledConnection connection = acquired.get();
        try {
            connection.connection().setAutoCommit(false);
        } catch (SQLException e) {
            logger.warn("Failed to begin transaction on {}: {}", connection.name(), e.getMessage());
            release(connection);
            return Optional.empty();
        }

        lock.lock();
        try {
            ThreadSlot slot = slots.computeIfAbsent(token, ThreadSlot::new);
            slot.activeTransaction = connection;
        } finally {
            lock.unlock();
        }
        logger.debug("Began transaction on {}", connection.name());
        return Optional.of(connection);
    }

    /**
     * Commits the calling thread's transaction and returns its connection to the idle queue.
     *
     * @return {@code false} when the thread has no transaction or the commit failed
     *         (in which case the transaction has been rolled back)
     */
    public boolean commitThreadTransaction() {
        return endThreadTransaction(true);
    }

    /**
     * Rolls back the calling thread's transaction and returns its connection to the idle queue.
     *
     * @return {@code false} when the thread has no transaction or the rollback failed
     */
    public boolean rollbackThreadTransaction() {
        return endThreadTransaction(false);
    }

    private boolean endThreadTransaction(boolean commit) {
        ThreadToken token = ThreadToken.current();
        PooledConnection connection;

        lock.lock();
        try {
            ThreadSlot slot = slots.get(token);
            connection = slot != null ? slot.activeTransaction : null;
            if (connection != null) {
                slot.activeTransaction = null;
            }
        } finally {
            lock.unlock();
        }

        if (connection == null) {
            logger.warn("No active transaction to {} on thread {}",
                commit ? "commit" : "roll back", token.threadName());
            return false;
        }

        boolean success = commit ? commit(connection) : rollback(connection);

        try {
            connection.connection().setAutoCommit(true);
            release(connection);
        } catch (SQLException e) {
            logger.warn("Failed to restore auto-commit on {}: {}", connection.name(), e.getMessage());
            discard(connection);
        }
        return success;
    }

    private boolean commit(PooledConnection connection) {
        try {
            connection.connection().commit();
            logger.debug("Committed transaction on {}", connection.name());
            return true;
        } catch (SQLException e) {
            logger.error("Commit failed on {}: {}", connection.name(), e.getMessage());
            rollback(connection);
            return false;
        }
    }

    private boolean rollback(PooledConnection connection) {
        try {
            connection.connection().rollback();
            logger.debug("Rolled back transaction on {}", connection.name());
            return true;
        } catch (SQLException e) {
            logger.error("Rollback failed on {}: {}", connection.name(), e.getMessage());
            return false;
        }
    }

    /**
     * Whether the calling thread currently has a pinned transaction connection.
     */
    public boolean hasActiveTransaction() {
        lock.lock();
        try {
            ThreadSlot slot = slots.get(ThreadToken.current());
            return slot != null && slot.activeTransaction != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes every idle connection across all threads.
     *
     * @return how many connections were closed
     */
    public int forceCloseIdleConnections() {
        List<PooledConnection> toClose = new ArrayList<>();
        lock.lock();
        try {
            for (ThreadSlot slot : slots.values()) {
                toClose.addAll(slot.idle);
                slot.idle.clear();
            }
            totalConnections -= toClose.size();
        } finally {
            lock.unlock();
        }
        closeAll(toClose);
        if (!toClose.isEmpty()) {
            logger.info("Force closed {} idle connections in pool '{}'", toClose.size(), name);
        }
        return toClose.size();
    }

    /**
     * Removes slots of exited threads. Their idle connections, and any connections they
     * still held, are returned for closing once the lock is released.
     */
    private List<PooledConnection> reapDeadThreadsLocked() {
        List<PooledConnection> toClose = null;
        Iterator<ThreadSlot> it = slots.values().iterator();
        while (it.hasNext()) {
            ThreadSlot slot = it.next();
            if (slot.token.isAlive()) {
                continue;
            }
            if (toClose == null) {
                toClose = new ArrayList<>();
            }
            toClose.addAll(slot.idle);

            if (slot.activeTransaction != null) {
                logger.warn("Thread {} exited with an open transaction on {}, rolling back",
                    slot.token.threadName(), slot.activeTransaction.name());
            }
            Iterator<PooledConnection> used = inUse.iterator();
            while (used.hasNext()) {
                PooledConnection connection = used.next();
                if (connection.owner() == slot.token) {
                    if (connection != slot.activeTransaction) {
                        logger.warn("Thread {} exited without releasing {}",
                            slot.token.threadName(), connection.name());
                    }
                    used.remove();
                    toClose.add(connection);
                }
            }
            it.remove();
            logger.debug("Reaped slot of exited thread {}", slot.token.threadName());
        }
        if (toClose == null) {
            return List.of();
        }
        totalConnections -= toClose.size();
        connectionsReaped.addAndGet(toClose.size());
        return toClose;
    }

    /**
     * Reaps slots of exited threads without acquiring anything.
     */
    public void reapDeadThreads() {
        List<PooledConnection> reaped;
        lock.lock();
        try {
            reaped = reapDeadThreadsLocked();
        } finally {
            lock.unlock();
        }
        closeAll(reaped);
    }

    private static void closeAll(Collection<PooledConnection> connections) {
        for (PooledConnection connection : connections) {
            connection.closeQuietly();
        }
    }

    public int availableCount() {
        lock.lock();
        try {
            int available = 0;
            for (ThreadSlot slot : slots.values()) {
                available += slot.idle.size();
            }
            return available;
        } finally {
            lock.unlock();
        }
    }

    public int usedCount() {
        lock.lock();
        try {
            return inUse.size();
        } finally {
            lock.unlock();
        }
    }

    public int totalConnections() {
        lock.lock();
        try {
            return totalConnections;
        } finally {
            lock.unlock();
        }
    }

    public int threadSlotCount() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }

    public PoolSnapshot snapshot() {
        lock.lock();
        try {
            int available = 0;
            int transactions = 0;
            for (ThreadSlot slot : slots.values()) {
                available += slot.idle.size();
                if (slot.activeTransaction != null) {
                    transactions++;
                }
            }
            return new PoolSnapshot(name, maxConnections, totalConnections, available, inUse.size(),
                slots.size(), transactions, connectionsCreated.get(), connectionsReaped.get(),
                exhaustedAcquires.get());
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes all idle and in-use connections. Further acquires return empty.
     */
    @Override
    public void close() {
        List<PooledConnection> toClose = new ArrayList<>();
        int leaked;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (ThreadSlot slot : slots.values()) {
                toClose.addAll(slot.idle);
                slot.idle.clear();
            }
            leaked = inUse.size();
            toClose.addAll(inUse);
            inUse.clear();
            slots.clear();
            totalConnections -= toClose.size();
        } finally {
            lock.unlock();
        }

        if (leaked > 0) {
            logger.warn("Closing pool '{}' with {} connections still in use", name, leaked);
        }
        closeAll(toClose);
        logger.info("Connection pool '{}' closed ({} connections)", name, toClose.size());
    }
}
