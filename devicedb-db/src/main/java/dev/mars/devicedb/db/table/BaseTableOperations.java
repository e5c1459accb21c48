package dev.mars.devicedb.db.table;

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
import dev.mars.devicedb.api.table.TableOperations;
import dev.mars.devicedb.api.table.TableType;
import dev.mars.devicedb.db.manager.BaseDatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common schema operations and statement helpers for table handlers.
 *
 * Every statement runs through the owning manager, so it uses the calling thread's
 * pinned transaction connection when one is active and is always recorded in the
 * manager's statistics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public abstract class BaseTableOperations implements TableOperations {
    private static final Logger logger = LoggerFactory.getLogger(BaseTableOperations.class);

    protected final BaseDatabaseManager database;
    private final String tableName;
    private final TableType tableType;

    protected BaseTableOperations(BaseDatabaseManager database, TableType tableType) {
        this(database, tableType, tableType.defaultTableName());
    }

    protected BaseTableOperations(BaseDatabaseManager database, TableType tableType, String tableName) {
        this.database = Objects.requireNonNull(database, "database");
        this.tableType = Objects.requireNonNull(tableType, "tableType");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
    }

    /**
     * DDL creating the table and its indexes and triggers, executed in order.
     * Every statement must be idempotent ({@code IF NOT EXISTS}).
     */
    protected abstract List<String> schemaStatements();

    @Override
    public boolean createTable() {
        for (String ddl : schemaStatements()) {
            DbResult<Boolean> result = database.executeWithConnection(ddl, connection -> {
                try (Statement stmt = connection.createStatement()) {
                    stmt.execute(ddl);
                    return true;
                }
            });
            if (result.isError()) {
                logger.error("Failed to create table '{}': {}", tableName, result.errorMessage());
                return false;
            }
        }
        logger.debug("Table '{}' ready", tableName);
        return true;
    }

    @Override
    public boolean dropTable() {
        return executeUpdate("DROP TABLE IF EXISTS " + tableName).isSuccess();
    }

    @Override
    public boolean truncateTable() {
        return executeUpdate("DELETE FROM " + tableName).isSuccess();
    }

    @Override
    public boolean tableExists() {
        return queryForObject("SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
            rs -> rs.getLong(1) > 0, tableName)
            .map(found -> found.orElse(false))
            .orElse(false);
    }

    @Override
    public DbResult<Long> getTotalCount() {
        return queryForObject("SELECT COUNT(*) FROM " + tableName, rs -> rs.getLong(1))
            .map(count -> count.orElse(0L));
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public TableType tableType() {
        return tableType;
    }

    /**
     * Executes an INSERT, UPDATE, DELETE or DDL statement.
     *
     * @return the number of affected rows
     */
    protected DbResult<Integer> executeUpdate(String sql, Object... params) {
        return database.executeWithConnection(sql, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, params);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Executes an INSERT and returns the generated row id.
     */
    protected DbResult<Long> executeInsert(String sql, Object... params) {
        return database.executeWithConnection(sql, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, params);
                ps.executeUpdate();
            }
            // Same connection, so last_insert_rowid() refers to the insert above
            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
            }
            throw new SQLException("Insert into " + tableName + " returned no row id");
        });
    }

    protected <T> DbResult<List<T>> queryForList(String sql, RowMapper<T> mapper, Object... params) {
        return database.executeWithConnection(sql, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    List<T> rows = new ArrayList<>();
                    while (rs.next()) {
                        rows.add(mapper.map(rs));
                    }
                    return rows;
                }
            }
        });
    }

    /**
     * Runs a query expected to return at most one row.
     */
    protected <T> DbResult<Optional<T>> queryForObject(String sql, RowMapper<T> mapper, Object... params) {
        return database.executeWithConnection(sql, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.<T>empty();
                }
            }
        });
    }

    private static void bind(PreparedStatement ps, Object[] params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }

    /**
     * Maps the current row of a result set.
     */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
