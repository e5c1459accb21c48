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
package dev.mars.devicedb.api;

import dev.mars.devicedb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DbResultTest {

    @Test
    void testSuccessCarriesData() {
        DbResult<String> result = DbResult.success("camera");

        assertTrue(result.isSuccess());
        assertFalse(result.isError());
        assertEquals("camera", result.data());
        assertNull(result.errorMessage());
        assertEquals(Optional.of("camera"), result.toOptional());
    }

    @Test
    void testSuccessWithNullData() {
        DbResult<String> result = DbResult.success(null);

        assertTrue(result.isSuccess());
        assertEquals(Optional.empty(), result.toOptional());
        assertEquals("fallback", result.orElse("fallback"));
    }

    @Test
    void testErrorCarriesMessage() {
        DbResult<Integer> result = DbResult.error("Serial number already exists: SN-1");

        assertTrue(result.isError());
        assertEquals("Serial number already exists: SN-1", result.errorMessage());
        assertNull(result.data());
        assertEquals(Optional.empty(), result.toOptional());
        assertEquals(7, result.orElse(7));
    }

    @Test
    void testErrorRequiresMessage() {
        assertThrows(NullPointerException.class, () -> DbResult.error(null));
    }

    @Test
    void testMapTransformsSuccess() {
        DbResult<Integer> length = DbResult.success("device").map(String::length);

        assertTrue(length.isSuccess());
        assertEquals(6, length.data());
    }

    @Test
    void testMapPassesErrorThrough() {
        DbResult<String> failed = DbResult.error("no connection");

        DbResult<Integer> mapped = failed.map(s -> {
            fail("Mapper must not run on an error result");
            return 0;
        });

        assertTrue(mapped.isError());
        assertEquals("no connection", mapped.errorMessage());
    }
}
