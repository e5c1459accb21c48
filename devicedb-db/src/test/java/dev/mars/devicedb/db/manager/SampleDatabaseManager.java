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


import dev.mars.devicedb.db.config.DatabaseConfig;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Minimal manager with a single audit table, used to exercise the base lifecycle.
 */
class SampleDatabaseManager extends BaseDatabaseManager {
    private SampleTable auditTable;

    SampleDatabaseManager(DatabaseConfig config) {
        super(config);
    }

    SampleDatabaseManager(DatabaseConfig config, MeterRegistry meterRegistry) {
        super(config, meterRegistry);
    }

    @Override
    protected void registerTables() {
        auditTable = new SampleTable(this);
        registerTable(auditTable);
    }

    SampleTable auditTable() {
        return auditTable;
    }

    boolean insertEntry(String action) {
        return executeQueryWithStats("INSERT INTO operation_audit (action) VALUES (?)", action);
    }

    long countEntries() {
        return auditTable.getTotalCount().orElse(-1L);
    }
}
