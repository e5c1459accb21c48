package dev.mars.devicedb.db.manager;

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
import dev.mars.devicedb.api.events.DatabaseEventListener;
import dev.mars.devicedb.api.table.TableOperations;
import dev.mars.devicedb.api.table.TableType;
import dev.mars.devicedb.db.DeviceDbDefaults;
import dev.mars.devicedb.db.config.DatabaseConfig;
import dev.mars.devicedb.db.connection.ConnectionPool;
import dev.mars.devicedb.db.connection.ConnectionProvider;
import dev.mars.devicedb.db.connection.PoolSnapshot;
import dev.mars.devicedb.db.connection.ScopedConnection;
import dev.mars.devicedb.db.connection.SqliteConnectionFactory;
import dev.mars.devicedb.db.health.DiskSpaceHealthCheck;
import dev.mars.devicedb.db.health.HealthCheckManager;
import dev.mars.devicedb.db.health.HealthStatus;
import dev.mars.devicedb.db.health.OverallHealthStatus;
import dev.mars.devicedb.db.metrics.DatabaseMetrics;
import dev.mars.devicedb.db.stats.DatabaseStats;
import dev.mars.devicedb.db.stats.QueryStatistics;
import dev.mars.devicedb.db.transaction.TransactionCallback;
import dev.mars.devicedb.db.transaction.TransactionFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Owns one embedded database: its primary connection, connection pool, table registry,
 * query statistics and periodic health check.
 *
 * <p>Subclasses declare their tables in {@link #registerTables()}, which runs on every
 * {@link #initialize()}. Table handlers reach the database through
 * {@link #acquireConnection()} and {@link #executeWithConnection(String, ConnectionCallback)}.
 *
 * <p>Transactions are bound to the calling thread: between {@link #beginTransaction()} and
 * {@link #commitTransaction()} every connection acquired on that thread is the same pinned
 * connection. Lifecycle and maintenance operations are serialized by a manager lock;
 * statements on the primary connection are serialized by a separate primary lock.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DeviceDatabaseManager manager = new DeviceDatabaseManager(config)) {
 *     if (!manager.initialize()) {
 *         throw new IllegalStateException("Database unavailable");
 *     }
 *     manager.executeInTransaction(() -> table.insert(camera).isSuccess());
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public abstract class BaseDatabaseManager implements ConnectionProvider, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BaseDatabaseManager.class);

    public static final String HEALTH_CHECK_DATABASE = "database";
    public static final String HEALTH_CHECK_POOL = "connection-pool";
    public static final String HEALTH_CHECK_DISK = "disk-space";

    private final DatabaseConfig config;
    private final SqliteConnectionFactory connectionFactory;
    private final QueryStatistics statistics;
    private final DatabaseMetrics metrics;
    private final MeterRegistry meterRegistry;
    private final List<DatabaseEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<TableType, TableOperations> tables = Collections.synchronizedMap(new LinkedHashMap<>());

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final ReentrantLock primaryLock = new ReentrantLock();

    private volatile ManagerState state = ManagerState.UNINITIALIZED;
    private volatile ConnectionPool pool;
    private volatile HealthCheckManager healthCheckManager;
    private Connection primaryConnection;
    private boolean primaryTransactionActive;

    protected BaseDatabaseManager(DatabaseConfig config) {
        this(config, null);
    }

    protected BaseDatabaseManager(DatabaseConfig config, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.connectionFactory = new SqliteConnectionFactory(config);
        this.statistics = new QueryStatistics(config.getName(), config.getSlowQueryThresholdMs(),
            config.isEnablePerformanceLog());
        this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        this.metrics = new DatabaseMetrics(config.getName(), config.getMetricsInstanceId(), statistics,
            this::getPoolSnapshot);
        if (config.isMetricsEnabled()) {
            this.metrics.bindTo(this.meterRegistry);
        } else {
            logger.info("Metrics disabled for database '{}'", config.getName());
        }
    }

    /**
     * Registers this database's table handlers via {@link #registerTable(TableOperations)}.
     * Called during every {@link #initialize()}, before the tables are created.
     */
    protected abstract void registerTables();

    // ========================================
    // Lifecycle
    // ========================================

    /**
     * Opens the database, creates its tables and starts the periodic health check.
     * Calling this on a ready manager does nothing and returns {@code true}.
     *
     * @return whether the manager is ready
     */
    public boolean initialize() {
        lifecycleLock.lock();
        try {
            if (state == ManagerState.READY) {
                logger.warn("Database '{}' is already initialized", config.getName());
                return true;
            }

            DbResult<Boolean> validation = config.validate();
            if (validation.isError()) {
                logger.error("Invalid configuration for database '{}': {}", config.getName(), validation.errorMessage());
                notifyError("Invalid configuration: " + validation.errorMessage());
                notifyInitialized(false);
                return false;
            }

            state = ManagerState.OPENING;
            logger.info("Initializing database '{}' at {}", config.getName(), config.getFilePath());
            try {
                createDatabaseDirectory();
                Connection primary = connectionFactory.openPrimary();
                primaryLock.lock();
                try {
                    primaryConnection = primary;
                } finally {
                    primaryLock.unlock();
                }
                runInitStatements();

                registerTables();
                if (!createAllTables()) {
                    throw new IllegalStateException("Failed to create tables for database '" + config.getName() + "'");
                }

                pool = new ConnectionPool(config.getConnectionName(), config.getMaxConnections(), connectionFactory);
                if (config.isHealthCheckEnabled()) {
                    startHealthChecks();
                } else {
                    logger.info("Periodic health checks disabled for database '{}'", config.getName());
                }

                state = ManagerState.READY;
                logger.info("Database '{}' initialized with {} tables, pool size {}",
                    config.getName(), tables.size(), config.getMaxConnections());
                notifyInitialized(true);
                return true;
            } catch (SQLException | IOException | RuntimeException e) {
                logger.error("Failed to initialize database '{}': {}", config.getName(), e.getMessage(), e);
                releaseResources();
                state = ManagerState.UNINITIALIZED;
                notifyError("Initialization failed: " + e.getMessage());
                notifyInitialized(false);
                return false;
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void createDatabaseDirectory() throws IOException {
        Path parent = config.getFilePath().toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            logger.info("Created database directory: {}", parent);
        }
    }

    private void runInitStatements() throws SQLException {
        for (String sql : config.getInitStatements()) {
            if (sql == null || sql.isBlank()) {
                continue;
            }
            if (!executeOnPrimary(sql)) {
                throw new SQLException("Init statement failed: " + sql);
            }
        }
    }

    private void startHealthChecks() {
        HealthCheckManager manager = new HealthCheckManager(config.getName(),
            config.getHealthCheckInterval(), config.getHealthCheckTimeout());
        manager.registerHealthCheck(HEALTH_CHECK_DATABASE, this::checkDatabase);
        manager.registerHealthCheck(HEALTH_CHECK_POOL, this::checkConnectionPool);
        manager.registerHealthCheck(HEALTH_CHECK_DISK,
            new DiskSpaceHealthCheck(config.getFilePath(), DeviceDbDefaults.MIN_FREE_DISK_BYTES));
        manager.start();
        healthCheckManager = manager;
    }

    /**
     * Stops the health check, forgets the registered tables and closes every connection.
     * The manager may be initialized again afterwards.
     */
    @Override
    public void close() {
        lifecycleLock.lock();
        try {
            if (state == ManagerState.UNINITIALIZED || state == ManagerState.CLOSED) {
                return;
            }
            state = ManagerState.CLOSING;
            logger.info("Closing database '{}'", config.getName());
            releaseResources();
            state = ManagerState.CLOSED;
            logger.info("Database '{}' closed", config.getName());
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void releaseResources() {
        HealthCheckManager health = healthCheckManager;
        healthCheckManager = null;
        if (health != null) {
            health.stop();
        }

        tables.clear();

        ConnectionPool current = pool;
        pool = null;
        if (current != null) {
            current.close();
        }

        primaryLock.lock();
        try {
            if (primaryConnection != null) {
                try {
                    primaryConnection.close();
                } catch (SQLException e) {
                    logger.warn("Failed to close primary connection of '{}': {}", config.getName(), e.getMessage());
                }
                primaryConnection = null;
            }
            primaryTransactionActive = false;
        } finally {
            primaryLock.unlock();
        }
    }

    // ========================================
    // Connections and statements
    // ========================================

    /**
     * Acquires a connection for the calling thread from the pool.
     *
     * <p>While the manager is opening, the initializing thread borrows the primary
     * connection instead; no other thread is handed the primary.
     */
    @Override
    public ScopedConnection acquireConnection() {
        ConnectionPool current = pool;
        if (current != null) {
            return current.acquireScoped();
        }
        if (lifecycleLock.isHeldByCurrentThread()) {
            primaryLock.lock();
            try {
                if (primaryConnection != null) {
                    return ScopedConnection.borrowed(primaryConnection, config.getConnectionName() + "_primary");
                }
            } finally {
                primaryLock.unlock();
            }
        }
        return ScopedConnection.unavailable("Database '" + config.getName() + "' is not initialized");
    }

    /**
     * Runs statement work on a scoped connection and records it in the statistics.
     * Failing to obtain a connection counts as a failed query.
     *
     * @param sql  the statement being run, for statistics and logging
     * @param work the work to run
     */
    public <T> DbResult<T> executeWithConnection(String sql, ConnectionCallback<T> work) {
        long start = System.nanoTime();
        try (ScopedConnection scoped = acquireConnection()) {
            if (!scoped.isValid()) {
                recordQuery(sql, false, start);
                logger.warn("No connection available for '{}': {}", config.getName(), scoped.unavailableReason());
                return DbResult.error("No database connection available: " + scoped.unavailableReason());
            }
            T result = work.apply(scoped.connection());
            recordQuery(sql, true, start);
            return DbResult.success(result);
        } catch (SQLException e) {
            recordQuery(sql, false, start);
            String message = Objects.requireNonNullElse(e.getMessage(), e.toString());
            logger.warn("Statement failed on '{}': {} [{}]", config.getName(), message, sql);
            return DbResult.error(message);
        } catch (RuntimeException e) {
            recordQuery(sql, false, start);
            logger.error("Unexpected error running statement on '{}': {} [{}]", config.getName(), e.getMessage(), sql);
            throw e;
        }
    }

    /**
     * Executes a parameterized statement on a pooled connection.
     *
     * @return whether the statement succeeded
     */
    public boolean executeQueryWithStats(String sql, Object... params) {
        return executeWithConnection(sql, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    ps.setObject(i + 1, params[i]);
                }
                ps.execute();
                return true;
            }
        }).isSuccess();
    }

    private boolean executeOnPrimary(String sql) {
        long start = System.nanoTime();
        primaryLock.lock();
        try {
            if (primaryConnection == null) {
                recordQuery(sql, false, start);
                return false;
            }
            try (Statement stmt = primaryConnection.createStatement()) {
                stmt.execute(sql);
                recordQuery(sql, true, start);
                return true;
            } catch (SQLException e) {
                recordQuery(sql, false, start);
                logger.warn("Statement failed on primary connection of '{}': {} [{}]",
                    config.getName(), e.getMessage(), sql);
                return false;
            }
        } finally {
            primaryLock.unlock();
        }
    }

    private void recordQuery(String sql, boolean success, long startNanos) {
        long elapsedNanos = System.nanoTime() - startNanos;
        statistics.record(sql, success, elapsedNanos / 1_000_000.0);
        metrics.recordQueryTime(Duration.ofNanos(elapsedNanos));
    }

    // ========================================
    // Transactions
    // ========================================

    /**
     * Starts a transaction bound to the calling thread. Idempotent per thread.
     */
    public boolean beginTransaction() {
        ConnectionPool current = pool;
        boolean started;
        if (current != null) {
            started = current.beginThreadTransaction().isPresent();
        } else {
            started = beginPrimaryTransaction();
        }

        if (started) {
            notifyListeners(l -> l.onTransactionBegin(config.getName()));
        } else {
            metrics.recordTransactionBeginFailure();
            logger.warn("Failed to begin transaction on '{}'", config.getName());
        }
        return started;
    }

    /**
     * Commits the calling thread's transaction.
     *
     * @return {@code false} when no transaction was active or the commit failed
     */
    public boolean commitTransaction() {
        ConnectionPool current = pool;
        boolean committed = current != null ? current.commitThreadTransaction() : endPrimaryTransaction(true);
        if (committed) {
            metrics.recordTransactionCommitted();
            notifyListeners(l -> l.onTransactionCommitted(config.getName()));
        }
        return committed;
    }

    /**
     * Rolls back the calling thread's transaction.
     *
     * @return {@code false} when no transaction was active or the rollback failed
     */
    public boolean rollbackTransaction() {
        ConnectionPool current = pool;
        boolean rolledBack = current != null ? current.rollbackThreadTransaction() : endPrimaryTransaction(false);
        if (rolledBack) {
            metrics.recordTransactionRolledBack();
            notifyListeners(l -> l.onTransactionRolledBack(config.getName()));
        }
        return rolledBack;
    }

    /**
     * Whether the calling thread is inside a transaction on this database.
     */
    public boolean isInTransaction() {
        ConnectionPool current = pool;
        if (current != null) {
            return current.hasActiveTransaction();
        }
        primaryLock.lock();
        try {
            return primaryTransactionActive && lifecycleLock.isHeldByCurrentThread();
        } finally {
            primaryLock.unlock();
        }
    }

    private boolean beginPrimaryTransaction() {
        if (!lifecycleLock.isHeldByCurrentThread()) {
            logger.warn("Database '{}' is not initialized, cannot begin transaction", config.getName());
            return false;
        }
        primaryLock.lock();
        try {
            if (primaryConnection == null) {
                return false;
            }
            if (primaryTransactionActive) {
                return true;
            }
            primaryConnection.setAutoCommit(false);
            primaryTransactionActive = true;
            return true;
        } catch (SQLException e) {
            logger.warn("Failed to begin transaction on primary connection of '{}': {}",
                config.getName(), e.getMessage());
            return false;
        } finally {
            primaryLock.unlock();
        }
    }

    private boolean endPrimaryTransaction(boolean commit) {
        primaryLock.lock();
        try {
            if (!primaryTransactionActive || primaryConnection == null || !lifecycleLock.isHeldByCurrentThread()) {
                logger.warn("No active transaction to {} on '{}'", commit ? "commit" : "roll back", config.getName());
                return false;
            }
            primaryTransactionActive = false;
            try {
                if (commit) {
                    primaryConnection.commit();
                } else {
                    primaryConnection.rollback();
                }
                return true;
            } catch (SQLException e) {
                logger.error("Failed to {} transaction on primary connection of '{}': {}",
                    commit ? "commit" : "roll back", config.getName(), e.getMessage());
                if (commit) {
                    try {
                        primaryConnection.rollback();
                    } catch (SQLException rollbackError) {
                        logger.error("Rollback after failed commit also failed on '{}': {}",
                            config.getName(), rollbackError.getMessage());
                    }
                }
                return false;
            } finally {
                try {
                    primaryConnection.setAutoCommit(true);
                } catch (SQLException e) {
                    logger.warn("Failed to restore auto-commit on primary connection of '{}': {}",
                        config.getName(), e.getMessage());
                }
            }
        } finally {
            primaryLock.unlock();
        }
    }

    /**
     * Runs the callback in a transaction and commits only when it returns {@code true}.
     * Returning {@code false} or {@code null} rolls back.
     *
     * @return whether the transaction was committed
     */
    public boolean executeInTransaction(TransactionCallback<Boolean> callback) {
        TransactionOutcome<Boolean> outcome = runInTransaction(callback, Boolean.TRUE::equals);
        return outcome.status() == TransactionStatus.COMMITTED;
    }

    /**
     * Runs the callback in a transaction and commits only when it returns a successful
     * {@link DbResult}.
     *
     * @return the callback's result, or an error if the transaction could not be
     *         started or committed
     */
    public <T> DbResult<T> executeInTransactionResult(TransactionCallback<DbResult<T>> callback) {
        TransactionOutcome<DbResult<T>> outcome = runInTransaction(callback, r -> r != null && r.isSuccess());
        switch (outcome.status()) {
            case BEGIN_FAILED:
                return DbResult.error("Failed to begin transaction on '" + config.getName() + "'");
            case COMMIT_FAILED:
                return DbResult.error("Failed to commit transaction on '" + config.getName() + "'");
            default:
                DbResult<T> result = outcome.result();
                return result != null ? result : DbResult.error("Transaction callback returned no result");
        }
    }

    /**
     * Runs the callback in a transaction and commits only when {@code success} accepts
     * its result; otherwise rolls back. The result is returned either way.
     *
     * @throws IllegalStateException      if the transaction could not be started
     * @throws TransactionFailedException if the commit failed
     */
    public <T> T executeInTransaction(TransactionCallback<T> callback, Predicate<? super T> success) {
        TransactionOutcome<T> outcome = runInTransaction(callback, success);
        switch (outcome.status()) {
            case BEGIN_FAILED:
                throw new IllegalStateException("Failed to begin transaction on '" + config.getName() + "'");
            case COMMIT_FAILED:
                throw new TransactionFailedException("Failed to commit transaction on '" + config.getName() + "'");
            default:
                return outcome.result();
        }
    }

    /**
     * A callback running inside a transaction already open on this thread joins it:
     * it neither commits nor rolls back, leaving the decision to the outermost caller.
     */
    private <T> TransactionOutcome<T> runInTransaction(TransactionCallback<T> callback, Predicate<? super T> success) {
        Objects.requireNonNull(callback, "callback");
        if (isInTransaction()) {
            T joined = invoke(callback, false);
            boolean ok = success.test(joined);
            return new TransactionOutcome<>(ok ? TransactionStatus.COMMITTED : TransactionStatus.ROLLED_BACK, joined);
        }

        if (!beginTransaction()) {
            return new TransactionOutcome<>(TransactionStatus.BEGIN_FAILED, null);
        }

        T result = invoke(callback, true);

        boolean ok;
        try {
            ok = success.test(result);
        } catch (RuntimeException e) {
            rollbackTransaction();
            throw e;
        }

        if (!ok) {
            rollbackTransaction();
            logger.debug("Transaction on '{}' rolled back: callback reported failure", config.getName());
            return new TransactionOutcome<>(TransactionStatus.ROLLED_BACK, result);
        }
        if (!commitTransaction()) {
            return new TransactionOutcome<>(TransactionStatus.COMMIT_FAILED, result);
        }
        return new TransactionOutcome<>(TransactionStatus.COMMITTED, result);
    }

    private <T> T invoke(TransactionCallback<T> callback, boolean owner) {
        try {
            return callback.execute();
        } catch (RuntimeException | Error e) {
            if (owner) {
                rollbackTransaction();
            }
            throw e;
        } catch (Exception e) {
            if (owner) {
                rollbackTransaction();
            }
            throw new TransactionFailedException("Transaction callback failed on '" + config.getName() + "'", e);
        }
    }

    private enum TransactionStatus {
        BEGIN_FAILED, COMMITTED, ROLLED_BACK, COMMIT_FAILED
    }

    private record TransactionOutcome<T>(TransactionStatus status, T result) {
    }

    // ========================================
    // Maintenance
    // ========================================

    /**
     * Runs {@code SELECT 1} on the primary connection and notifies listeners.
     */
    public boolean healthCheck() {
        boolean healthy = false;
        long start = System.nanoTime();
        primaryLock.lock();
        try {
            if (state == ManagerState.READY && primaryConnection != null) {
                try (Statement stmt = primaryConnection.createStatement();
                     ResultSet rs = stmt.executeQuery("SELECT 1")) {
                    healthy = rs.next() && rs.getInt(1) == 1;
                } catch (SQLException e) {
                    logger.warn("Health check failed for '{}': {}", config.getName(), e.getMessage());
                }
                recordQuery("SELECT 1", healthy, start);
            }
        } finally {
            primaryLock.unlock();
        }

        metrics.recordHealthCheck(healthy);
        final boolean result = healthy;
        notifyListeners(l -> l.onHealthCheckCompleted(config.getName(), result));
        return healthy;
    }

    private HealthStatus checkDatabase(String component) {
        if (healthCheck()) {
            return HealthStatus.healthy(component, Map.of("sizeBytes", getDatabaseSize()));
        }
        return HealthStatus.unhealthy(component, "Database '" + config.getName() + "' did not answer SELECT 1");
    }

    private HealthStatus checkConnectionPool(String component) {
        ConnectionPool current = pool;
        if (current != null) {
            current.reapDeadThreads();
        }
        PoolSnapshot snapshot = getPoolSnapshot();
        Map<String, Object> details = Map.of(
            "total", snapshot.total(),
            "used", snapshot.used(),
            "available", snapshot.available(),
            "max", snapshot.maxConnections()
        );
        if (snapshot.used() >= snapshot.maxConnections()) {
            return HealthStatus.degraded(component, "Connection pool at capacity", details);
        }
        return HealthStatus.healthy(component, details);
    }

    /**
     * Runs all registered health checks now. With periodic checks disabled only the
     * database and pool checks run.
     */
    public OverallHealthStatus runHealthChecks() {
        HealthCheckManager health = healthCheckManager;
        if (health == null && state == ManagerState.READY) {
            Map<String, HealthStatus> components = new LinkedHashMap<>();
            components.put(HEALTH_CHECK_DATABASE, checkDatabase(HEALTH_CHECK_DATABASE));
            components.put(HEALTH_CHECK_POOL, checkConnectionPool(HEALTH_CHECK_POOL));
            return new OverallHealthStatus(config.getName(), components, Instant.now());
        }
        if (health == null) {
            return new OverallHealthStatus(config.getName(),
                Map.of(HEALTH_CHECK_DATABASE, HealthStatus.unhealthy(HEALTH_CHECK_DATABASE, "Database not initialized")),
                Instant.now());
        }
        return health.runHealthChecks();
    }

    /**
     * Latest results of the periodic health checks.
     */
    public OverallHealthStatus getHealthStatus() {
        HealthCheckManager health = healthCheckManager;
        if (health == null) {
            return new OverallHealthStatus(config.getName(), Map.of(), Instant.now());
        }
        return health.getOverallHealth();
    }

    /**
     * Checkpoints the WAL, then runs {@code VACUUM} and {@code ANALYZE}.
     *
     * <p>Idle pooled connections are closed first. If any connection is still in use the
     * optimization is refused and no statement is executed.
     */
    public boolean optimizeDatabase() {
        lifecycleLock.lock();
        try {
            ConnectionPool current = pool;
            if (state != ManagerState.READY || current == null) {
                logger.warn("Cannot optimize database '{}': not initialized", config.getName());
                return false;
            }

            current.forceCloseIdleConnections();
            int used = current.usedCount();
            if (used > 0) {
                logger.warn("Cannot optimize database '{}': {} connections still in use", config.getName(), used);
                return false;
            }

            if (config.isEnableWal() && !executeOnPrimary("PRAGMA wal_checkpoint(TRUNCATE)")) {
                logger.warn("WAL checkpoint failed for '{}', continuing with VACUUM", config.getName());
            }
            boolean vacuumed = executeOnPrimary("VACUUM");
            boolean analyzed = executeOnPrimary("ANALYZE");

            if (vacuumed && analyzed) {
                metrics.recordOptimization();
                logger.info("Database '{}' optimized, size now {} bytes", config.getName(), getDatabaseSize());
                return true;
            }
            return false;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Writes a consistent copy of the live database to {@code target} with
     * {@code VACUUM INTO}. An existing target file is not overwritten.
     */
    public boolean backupDatabase(Path target) {
        lifecycleLock.lock();
        try {
            if (state != ManagerState.READY) {
                logger.warn("Cannot back up database '{}': not initialized", config.getName());
                return false;
            }
            if (Files.exists(target)) {
                logger.warn("Backup target already exists: {}", target);
                return false;
            }
            try {
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                logger.error("Cannot create backup directory for {}: {}", target, e.getMessage());
                notifyError("Backup failed: " + e.getMessage());
                return false;
            }

            String escaped = target.toAbsolutePath().toString().replace("'", "''");
            boolean backedUp = executeOnPrimary("VACUUM INTO '" + escaped + "'");
            if (backedUp) {
                metrics.recordBackup();
                logger.info("Database '{}' backed up to {}", config.getName(), target);
            } else {
                notifyError("Backup to " + target + " failed");
            }
            return backedUp;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Replaces the database file with {@code backup} and re-initializes the manager.
     * The manager is closed during the restore; connections held by other threads
     * become invalid.
     */
    public boolean restoreDatabase(Path backup) {
        if (!Files.isRegularFile(backup)) {
            logger.warn("Backup file does not exist: {}", backup);
            return false;
        }

        lifecycleLock.lock();
        try {
            Path databaseFile = config.getFilePath().toAbsolutePath();
            Path staged = databaseFile.resolveSibling(databaseFile.getFileName() + ".restore");
            try {
                Files.createDirectories(databaseFile.getParent());
                Files.copy(backup, staged, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                logger.error("Cannot stage backup {} for restore: {}", backup, e.getMessage());
                notifyError("Restore failed: " + e.getMessage());
                return false;
            }

            close();
            try {
                Files.deleteIfExists(walFile(databaseFile));
                Files.deleteIfExists(shmFile(databaseFile));
                Files.move(staged, databaseFile, StandardCopyOption.REPLACE_EXISTING);
                logger.info("Restored database '{}' from {}", config.getName(), backup);
            } catch (IOException e) {
                logger.error("Failed to replace database file of '{}': {}", config.getName(), e.getMessage());
                notifyError("Restore failed: " + e.getMessage());
                try {
                    Files.deleteIfExists(staged);
                } catch (IOException cleanup) {
                    logger.warn("Failed to remove staged restore file {}: {}", staged, cleanup.getMessage());
                }
                initialize();
                return false;
            }
            return initialize();
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Size in bytes of the database file plus its WAL and shared-memory files.
     */
    public long getDatabaseSize() {
        Path databaseFile = config.getFilePath().toAbsolutePath();
        return fileSize(databaseFile) + fileSize(walFile(databaseFile)) + fileSize(shmFile(databaseFile));
    }

    private static Path walFile(Path databaseFile) {
        return databaseFile.resolveSibling(databaseFile.getFileName() + "-wal");
    }

    private static Path shmFile(Path databaseFile) {
        return databaseFile.resolveSibling(databaseFile.getFileName() + "-shm");
    }

    private static long fileSize(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            logger.debug("Cannot read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    // ========================================
    // Tables
    // ========================================

    /**
     * Registers a table handler, replacing any handler of the same type.
     */
    protected void registerTable(TableOperations table) {
        TableOperations previous = tables.put(table.tableType(), table);
        if (previous != null) {
            logger.warn("Replaced table handler for {} on '{}'", table.tableType(), config.getName());
        }
        logger.debug("Registered table '{}' on '{}'", table.tableName(), config.getName());
    }

    public Optional<TableOperations> getTable(TableType type) {
        return Optional.ofNullable(tables.get(type));
    }

    public Set<TableType> getRegisteredTableTypes() {
        synchronized (tables) {
            return Set.copyOf(tables.keySet());
        }
    }

    private List<TableOperations> tableSnapshot() {
        synchronized (tables) {
            return new ArrayList<>(tables.values());
        }
    }

    public boolean createAllTables() {
        return forEachTable("create", TableOperations::createTable);
    }

    public boolean dropAllTables() {
        return forEachTable("drop", TableOperations::dropTable);
    }

    public boolean truncateAllTables() {
        return forEachTable("truncate", TableOperations::truncateTable);
    }

    /**
     * Applies an operation to every registered table. A failure or exception on one table
     * does not stop the others.
     *
     * @return whether the operation succeeded on every table
     */
    private boolean forEachTable(String operation, Predicate<TableOperations> action) {
        List<TableOperations> snapshot = tableSnapshot();
        int succeeded = 0;
        for (TableOperations table : snapshot) {
            try {
                if (action.test(table)) {
                    succeeded++;
                } else {
                    logger.warn("Failed to {} table '{}' on '{}'", operation, table.tableName(), config.getName());
                }
            } catch (RuntimeException e) {
                logger.error("Exception during {} of table '{}' on '{}': {}",
                    operation, table.tableName(), config.getName(), e.getMessage(), e);
            }
        }
        logger.info("{} tables on '{}': {}/{} succeeded", operation, config.getName(), succeeded, snapshot.size());
        return succeeded == snapshot.size();
    }

    /**
     * Row count per registered table; tables whose count failed are omitted.
     */
    public Map<TableType, Long> getTableCounts() {
        Map<TableType, Long> counts = new EnumMap<>(TableType.class);
        for (TableOperations table : tableSnapshot()) {
            DbResult<Long> count = table.getTotalCount();
            if (count.isSuccess()) {
                counts.put(table.tableType(), count.data());
            }
        }
        return counts;
    }

    // ========================================
    // Statistics, state and listeners
    // ========================================

    public DatabaseStats getStatistics() {
        return statistics.snapshot();
    }

    public void resetStatistics() {
        statistics.reset();
    }

    public PoolSnapshot getPoolSnapshot() {
        ConnectionPool current = pool;
        if (current == null) {
            return new PoolSnapshot(config.getConnectionName(), config.getMaxConnections(), 0, 0, 0, 0, 0, 0, 0, 0);
        }
        return current.snapshot();
    }

    /**
     * The live pool, present only while the manager is ready.
     */
    public Optional<ConnectionPool> getConnectionPool() {
        return Optional.ofNullable(pool);
    }

    public ManagerState getState() {
        return state;
    }

    public boolean isInitialized() {
        return state == ManagerState.READY;
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    public String getName() {
        return config.getName();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public void addListener(DatabaseEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(DatabaseEventListener listener) {
        listeners.remove(listener);
    }

    protected void notifyError(String message) {
        notifyListeners(l -> l.onError(config.getName(), message));
    }

    private void notifyInitialized(boolean success) {
        notifyListeners(l -> l.onInitialized(config.getName(), success));
    }

    private void notifyListeners(java.util.function.Consumer<DatabaseEventListener> event) {
        for (DatabaseEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Database event listener {} failed on '{}': {}",
                    listener.getClass().getSimpleName(), config.getName(), e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + config.getName() + '\'' +
                ", state=" + state +
                ", file=" + config.getFilePath() +
                '}';
    }
}
