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
package dev.mars.devicedb.api.database;

import java.util.Locale;

/**
 * Logical databases of the device application. Each type maps to one store file.
 */
public enum DatabaseType {
    DEVICE_DB("DeviceDB"),
    CONFIG_DB("ConfigDB"),
    DATA_DB("DataDB"),
    EXPERIMENT_DB("ExperimentDB"),
    SYSTEM_DB("SystemDB");

    private final String logicalName;

    DatabaseType(String logicalName) {
        this.logicalName = logicalName;
    }

    /**
     * Name used for logging, connection names and backup file prefixes.
     */
    public String logicalName() {
        return logicalName;
    }

    /**
     * Default store file name, e.g. {@code devicedb.db}.
     */
    public String defaultFileName() {
        return logicalName.toLowerCase(Locale.ROOT) + ".db";
    }
}
