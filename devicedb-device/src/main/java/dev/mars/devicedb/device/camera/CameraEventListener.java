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


/**
 * Receives changes to the camera inventory made through a
 * {@link dev.mars.devicedb.device.DeviceDatabaseManager}.
 *
 * <p>Called on the thread that made the change, after the change succeeded. An import
 * reports each stored camera once the whole batch has been stored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface CameraEventListener {

    default void onCameraAdded(long cameraId) {
    }

    default void onCameraUpdated(long cameraId) {
    }

    default void onCameraRemoved(long cameraId) {
    }
}
