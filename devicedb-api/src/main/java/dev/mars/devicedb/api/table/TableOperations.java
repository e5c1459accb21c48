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
package dev.mars.devicedb.api.table;

import dev.mars.devicedb.api.DbResult;

/**
 * Schema operations every registered table handler provides.
 *
 * <p>Database managers run these over all registered tables as a batch. An implementation
 * may report failure either by returning {@code false} or by throwing a runtime exception;
 * in both cases the failure is confined to that table.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface TableOperations {

    /**
     * Creates the table together with its indexes and triggers. Must be idempotent.
     */
    boolean createTable();

    boolean dropTable();

    /**
     * Deletes every row while keeping the schema.
     */
    boolean truncateTable();

    boolean tableExists();

    /**
     * Counts the rows currently stored in the table.
     */
    DbResult<Long> getTotalCount();

    String tableName();

    TableType tableType();
}
