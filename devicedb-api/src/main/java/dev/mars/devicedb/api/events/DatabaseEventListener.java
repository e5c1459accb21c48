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
package dev.mars.devicedb.api.events;

/**
 * Receives lifecycle notifications from a database manager.
 *
 * <p>Notifications are delivered synchronously on the thread that caused them and
 * cannot influence the outcome of the operation. All methods default to no-ops so
 * that listeners only override what they need.
 */
public interface DatabaseEventListener {

    /**
     * Called once per {@code initialize()} call with its outcome.
     */
    default void onInitialized(String databaseName, boolean success) {
    }

    default void onError(String databaseName, String message) {
    }

    default void onTransactionBegin(String databaseName) {
    }

    default void onTransactionCommitted(String databaseName) {
    }

    default void onTransactionRolledBack(String databaseName) {
    }

    /**
     * Called after every health check, scheduled or explicit.
     */
    default void onHealthCheckCompleted(String databaseName, boolean healthy) {
    }
}
