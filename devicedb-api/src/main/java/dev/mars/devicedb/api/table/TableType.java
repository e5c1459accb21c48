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

/**
 * Identifies the tables a database manager can register. Each manager holds at most
 * one handler per type.
 */
public enum TableType {
    CAMERA_INFO("camera_info"),
    CAMERA_CONFIG("camera_config"),
    CAMERA_STATUS("camera_status"),
    CALIBRATION_PARAMS("calibration_params"),
    DEVICE_MAINTENANCE("device_maintenance"),
    OBJECTIVE_FOCAL_PARAMS("objective_focal_params"),
    USER_INFO("user_info"),
    OPERATION_AUDIT("operation_audit");

    private final String defaultTableName;

    TableType(String defaultTableName) {
        this.defaultTableName = defaultTableName;
    }

    public String defaultTableName() {
        return defaultTableName;
    }
}
