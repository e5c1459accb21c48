package dev.mars.devicedb.device;

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
import dev.mars.devicedb.api.PageParams;
import dev.mars.devicedb.api.PageResult;
import dev.mars.devicedb.api.database.DatabaseType;
import dev.mars.devicedb.db.config.DatabaseConfig;
import dev.mars.devicedb.db.manager.BaseDatabaseManager;
import dev.mars.devicedb.device.camera.CameraEventListener;
import dev.mars.devicedb.device.camera.CameraInfo;
import dev.mars.devicedb.device.camera.CameraInfoTable;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Database manager for the device database, which holds the camera inventory.
 *
 * All camera operations require the manager to be initialized and return an error
 * result otherwise. Successful additions, updates and removals are reported to the
 * registered {@link CameraEventListener}s.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class DeviceDatabaseManager extends BaseDatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DeviceDatabaseManager.class);

    private static final String TABLE_NOT_READY = "Camera info table is not initialized";

    private final List<CameraEventListener> cameraListeners = new CopyOnWriteArrayList<>();
    private volatile CameraInfoTable cameraInfoTable;

    public DeviceDatabaseManager(DatabaseConfig config) {
        super(config);
    }

    public DeviceDatabaseManager(DatabaseConfig config, MeterRegistry meterRegistry) {
        super(config, meterRegistry);
    }

    public DatabaseType databaseType() {
        return DatabaseType.DEVICE_DB;
    }

    @Override
    protected void registerTables() {
        CameraInfoTable table = new CameraInfoTable(this);
        registerTable(table);
        cameraInfoTable = table;
        logger.debug("Registered device tables for '{}'", getName());
    }

    /**
     * The camera table, present once the manager is initialized.
     */
    public Optional<CameraInfoTable> cameras() {
        return isInitialized() ? Optional.ofNullable(cameraInfoTable) : Optional.empty();
    }

    public void addCameraListener(CameraEventListener listener) {
        cameraListeners.add(listener);
    }

    public void removeCameraListener(CameraEventListener listener) {
        cameraListeners.remove(listener);
    }

    public DbResult<CameraInfo> addCamera(CameraInfo camera) {
        DbResult<CameraInfo> result = cameras().map(table -> table.insert(camera))
            .orElseGet(DeviceDatabaseManager::notReady);
        if (result.isSuccess()) {
            notifyCameraListeners(l -> l.onCameraAdded(result.data().id()));
        }
        return result;
    }

    public DbResult<Boolean> updateCamera(CameraInfo camera) {
        DbResult<Boolean> result = cameras().map(table -> table.update(camera))
            .orElseGet(DeviceDatabaseManager::notReady);
        if (result.isSuccess()) {
            notifyCameraListeners(l -> l.onCameraUpdated(camera.id()));
        }
        return result;
    }

    public DbResult<Boolean> removeCamera(long id) {
        DbResult<Boolean> result = cameras().map(table -> table.deleteById(id))
            .orElseGet(DeviceDatabaseManager::notReady);
        if (result.isSuccess()) {
            notifyCameraListeners(l -> l.onCameraRemoved(id));
        }
        return result;
    }

    public DbResult<Optional<CameraInfo>> getCamera(long id) {
        return cameras().map(table -> table.selectById(id)).orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<List<CameraInfo>> getAllCameras() {
        return cameras().map(CameraInfoTable::selectAll).orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<PageResult<CameraInfo>> getCameras(PageParams params) {
        return cameras().map(table -> table.selectByPage(params)).orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<Optional<CameraInfo>> getCameraBySerialNumber(String serialNumber) {
        return cameras().map(table -> table.selectBySerialNumber(serialNumber))
            .orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<List<CameraInfo>> searchCameras(String keyword) {
        return cameras().map(table -> table.search(keyword)).orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<List<CameraInfo>> getCamerasByManufacturer(String manufacturer) {
        return cameras().map(table -> table.selectByManufacturer(manufacturer))
            .orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<List<CameraInfo>> getCamerasByConnectionType(String connectionType) {
        return cameras().map(table -> table.selectByConnectionType(connectionType))
            .orElseGet(DeviceDatabaseManager::notReady);
    }

    public DbResult<List<String>> getAllManufacturers() {
        return cameras().map(CameraInfoTable::getAllManufacturers).orElseGet(DeviceDatabaseManager::notReady);
    }

    /**
     * Imports cameras atomically: either all are stored or none.
     */
    public DbResult<Integer> importCameras(List<CameraInfo> cameras) {
        DbResult<List<CameraInfo>> result = cameras().map(table -> table.batchInsertCameras(cameras))
            .orElseGet(DeviceDatabaseManager::notReady);
        if (result.isSuccess()) {
            result.data().forEach(stored -> notifyCameraListeners(l -> l.onCameraAdded(stored.id())));
        }
        return result.map(List::size);
    }

    /**
     * Camera counts per manufacturer.
     */
    public DbResult<Map<String, Long>> getCameraStatistics() {
        return cameras().map(CameraInfoTable::countByManufacturer).orElseGet(DeviceDatabaseManager::notReady);
    }

    private void notifyCameraListeners(Consumer<CameraEventListener> event) {
        for (CameraEventListener listener : cameraListeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Camera event listener {} failed on '{}': {}",
                    listener.getClass().getSimpleName(), getName(), e.getMessage(), e);
            }
        }
    }

    private static <T> DbResult<T> notReady() {
        return DbResult.error(TABLE_NOT_READY);
    }
}
