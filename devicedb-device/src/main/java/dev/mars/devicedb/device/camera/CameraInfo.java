package dev.mars.devicedb.device.camera;

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


import java.time.LocalDateTime;

/**
 * A camera known to the device database.
 *
 * @param id             row id, {@link #UNSAVED_ID} before the camera is stored
 * @param name           display name, required
 * @param version        firmware or model version
 * @param connectionType how the camera is attached, e.g. {@code USB3} or {@code GigE}
 * @param serialNumber   unique serial number, required
 * @param manufacturer   vendor name
 * @param createdAt      set by the database on insert
 * @param updatedAt      maintained by the database on every update
 */
public record CameraInfo(
    long id,
    String name,
    String version,
    String connectionType,
    String serialNumber,
    String manufacturer,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {
    public static final long UNSAVED_ID = -1;

    /**
     * Creates a camera that has not been stored yet.
     */
    public static CameraInfo of(String name, String version, String connectionType,
                                String serialNumber, String manufacturer) {
        return new CameraInfo(UNSAVED_ID, name, version, connectionType, serialNumber, manufacturer, null, null);
    }

    public CameraInfo withId(long newId) {
        return new CameraInfo(newId, name, version, connectionType, serialNumber, manufacturer, createdAt, updatedAt);
    }

    public CameraInfo withName(String newName) {
        return new CameraInfo(id, newName, version, connectionType, serialNumber, manufacturer, createdAt, updatedAt);
    }

    public CameraInfo withManufacturer(String newManufacturer) {
        return new CameraInfo(id, name, version, connectionType, serialNumber, newManufacturer, createdAt, updatedAt);
    }

    public CameraInfo withSerialNumber(String newSerialNumber) {
        return new CameraInfo(id, name, version, connectionType, newSerialNumber, manufacturer, createdAt, updatedAt);
    }

    public boolean isSaved() {
        return id > 0;
    }

    /**
     * A camera is storable when it has a name and a serial number.
     */
    public boolean isValid() {
        return name != null && !name.isBlank() && serialNumber != null && !serialNumber.isBlank();
    }
}
