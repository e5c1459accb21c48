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


import dev.mars.devicedb.db.DeviceDbDefaults;
import dev.mars.devicedb.db.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Opens SQLite connections for a {@link DatabaseConfig}.
 *
 * Busy timeout, foreign keys and cache size are passed to the driver through
 * {@link SQLiteConfig}; journal mode, synchronous mode, temp store and recursive
 * triggers are applied as pragmas after the connection is open.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class SqliteConnectionFactory implements ConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(SqliteConnectionFactory.class);

    private final DatabaseConfig config;
    private final String url;

    public SqliteConnectionFactory(DatabaseConfig config) {
        this.config = config;
        this.url = "jdbc:sqlite:" + config.getFilePath().toAbsolutePath();
    }

    /**
     * Opens a pool connection. Pragma failures are logged and tolerated.
     */
    @Override
    public Connection open() throws SQLException {
        Connection connection = DriverManager.getConnection(url, driverConfig().toProperties());
        try {
            applyPragmas(connection, false);
        } catch (SQLException e) {
            logger.warn("Failed to configure pool connection for '{}': {}", config.getName(), e.getMessage());
        }
        return connection;
    }

    /**
     * Opens the manager's primary connection. Failing to enable foreign keys or WAL
     * when configured is fatal; the connection is closed and the error rethrown.
     */
    public Connection openPrimary() throws SQLException {
        Connection connection = DriverManager.getConnection(url, driverConfig().toProperties());
        try {
            applyPragmas(connection, true);
            return connection;
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private SQLiteConfig driverConfig() {
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, config.getBusyTimeoutMs()));
        sqliteConfig.enforceForeignKeys(config.isEnableForeignKeys());
        sqliteConfig.setCacheSize(DeviceDbDefaults.CACHE_SIZE_PAGES);
        return sqliteConfig;
    }

    private void applyPragmas(Connection connection, boolean strict) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            if (config.isEnableForeignKeys()) {
                try (ResultSet rs = stmt.executeQuery("PRAGMA foreign_keys")) {
                    if (!rs.next() || rs.getInt(1) != 1) {
                        throw new SQLException("Foreign key enforcement could not be enabled");
                    }
                }
            }

            if (config.isEnableWal()) {
                try (ResultSet rs = stmt.executeQuery("PRAGMA journal_mode = WAL")) {
                    String mode = rs.next() ? rs.getString(1) : null;
                    if (mode == null || !"wal".equals(mode.toLowerCase(Locale.ROOT))) {
                        throw new SQLException("WAL journal mode could not be enabled, engine reported: " + mode);
                    }
                }
            }

            executeOptional(stmt, "PRAGMA synchronous = NORMAL", strict);
            executeOptional(stmt, "PRAGMA temp_store = MEMORY", strict);
            executeOptional(stmt, "PRAGMA recursive_triggers = OFF", strict);
        }
        logger.debug("Configured connection for '{}' (wal={}, foreignKeys={})",
            config.getName(), config.isEnableWal(), config.isEnableForeignKeys());
    }

    private void executeOptional(Statement stmt, String pragma, boolean logAsWarning) {
        try {
            stmt.execute(pragma);
        } catch (SQLException e) {
            if (logAsWarning) {
                logger.warn("Failed to apply '{}' on '{}': {}", pragma, config.getName(), e.getMessage());
            } else {
                logger.debug("Failed to apply '{}' on '{}': {}", pragma, config.getName(), e.getMessage());
            }
        }
    }

    public DatabaseConfig getConfig() {
        return config;
    }
}
