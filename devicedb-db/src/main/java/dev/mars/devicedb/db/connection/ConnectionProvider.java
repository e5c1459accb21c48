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


/**
 * Source of scoped connections for table handlers.
 *
 * Callers must check {@link ScopedConnection#isValid()} before use and close the
 * handle with try-with-resources.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface ConnectionProvider {

    /**
     * Acquires a connection for the calling thread. Inside a transaction started on
     * this thread, the pinned transaction connection is returned.
     *
     * @return a scoped handle, invalid when no connection is available
     */
    ScopedConnection acquireConnection();
}
