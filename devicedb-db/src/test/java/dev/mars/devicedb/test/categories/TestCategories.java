package dev.mars.devicedb.test.categories;

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
 * Test category constants for the devicedb-db module, used with JUnit 5 {@code @Tag}.
 *
 * <ul>
 *   <li><strong>CORE</strong> - fast unit tests without a database file</li>
 *   <li><strong>INTEGRATION</strong> - tests against a real SQLite file in a temporary directory</li>
 *   <li><strong>PERFORMANCE</strong> - concurrency and load tests</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class TestCategories {

    /**
     * CORE - fast unit tests, no I/O beyond temporary files.
     */
    public static final String CORE = "core";

    /**
     * INTEGRATION - tests that open SQLite databases.
     */
    public static final String INTEGRATION = "integration";

    /**
     * PERFORMANCE - multi-threaded load tests.
     */
    public static final String PERFORMANCE = "performance";

    private TestCategories() {
        // Utility class - no instantiation
    }
}
