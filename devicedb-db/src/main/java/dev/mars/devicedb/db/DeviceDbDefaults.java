package dev.mars.devicedb.db;

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


import java.time.Duration;

/**
 * Shared default values for DeviceDB database configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class DeviceDbDefaults {

    public static final int DEFAULT_MAX_CONNECTIONS = 10;

    /** Upper bound accepted by configuration validation. */
    public static final int MAX_POOL_SIZE = 100;

    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5000;

    public static final long MIN_BUSY_TIMEOUT_MS = 1000;

    public static final long DEFAULT_SLOW_QUERY_THRESHOLD_MS = 1000;

    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofMinutes(5);

    public static final Duration DEFAULT_HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(10);

    /** Page cache size in pages, applied to every connection. */
    public static final int CACHE_SIZE_PAGES = 10000;

    /** Free space below which the disk-space health check reports degraded. */
    public static final long MIN_FREE_DISK_BYTES = 100L * 1024 * 1024;

    public static final String ENV_PREFIX = "DEVICEDB_";

    public static final String PROPERTY_PREFIX = "devicedb.";

    private DeviceDbDefaults() {
        // Prevent instantiation
    }
}
