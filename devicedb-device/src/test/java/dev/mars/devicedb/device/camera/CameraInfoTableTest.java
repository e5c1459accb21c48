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


import dev.mars.devicedb.api.DbResult;
import dev.mars.devicedb.api.PageParams;
import dev.mars.devicedb.api.PageResult;
import dev.mars.devicedb.db.config.DatabaseConfig;
import dev.mars.devicedb.device.DeviceDatabaseManager;
import dev.mars.devicedb.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
class CameraInfoTableTest {

    @TempDir
    Path tempDir;

    private DeviceDatabaseManager manager;
    private CameraInfoTable table;

    @BeforeEach
    void setUp() {
        manager = new DeviceDatabaseManager(DatabaseConfig.builder()
            .name("DeviceDB")
            .filePath(tempDir.resolve("devicedb.db"))
            .build());
        assertTrue(manager.initialize());
        table = manager.cameras().orElseThrow();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private CameraInfo store(String name, String serial, String manufacturer) {
        DbResult<CameraInfo> result = table.insert(CameraInfo.of(name, "1.0", "USB3", serial, manufacturer));
        assertTrue(result.isSuccess(), result.errorMessage());
        return result.data();
    }

    @Test
    void testInsertAssignsIdAndTimestamps() {
        CameraInfo stored = store("Main camera", "SN-001", "Basler");

        assertTrue(stored.isSaved());
        CameraInfo loaded = table.selectById(stored.id()).data().orElseThrow();
        assertEquals("Main camera", loaded.name());
        assertEquals("USB3", loaded.connectionType());
        assertNotNull(loaded.createdAt());
        assertNotNull(loaded.updatedAt());
    }

    @Test
    void testInsertRejectsInvalidAndDuplicateCameras() {
        store("Main camera", "SN-001", "Basler");

        DbResult<CameraInfo> duplicate = table.insert(CameraInfo.of("Other", "2.0", "GigE", "SN-001", "FLIR"));
        DbResult<CameraInfo> noSerial = table.insert(CameraInfo.of("Nameless", "1.0", "USB3", " ", "FLIR"));

        assertEquals("Serial number already exists: SN-001", duplicate.errorMessage());
        assertEquals("Invalid camera info: name and serial number are required", noSerial.errorMessage());
        assertEquals(1L, table.getTotalCount().data());
    }

    @Test
    void testUpdate() {
        CameraInfo stored = store("Main camera", "SN-001", "Basler");
        CameraInfo other = store("Side camera", "SN-002", "Basler");

        assertTrue(table.update(stored.withName("Renamed").withManufacturer("FLIR")).isSuccess());
        CameraInfo loaded = table.selectById(stored.id()).data().orElseThrow();
        assertEquals("Renamed", loaded.name());
        assertEquals("FLIR", loaded.manufacturer());

        assertEquals("Serial number already exists: SN-002",
            table.update(stored.withSerialNumber(other.serialNumber())).errorMessage());
        assertEquals("Camera has not been stored yet",
            table.update(CameraInfo.of("New", "1", "USB3", "SN-9", "X")).errorMessage());
        assertEquals("Camera not found: 999", table.update(stored.withId(999).withSerialNumber("SN-999")).errorMessage());
    }

    @Test
    void testDeleteAndLookup() {
        CameraInfo stored = store("Main camera", "SN-001", "Basler");

        assertEquals(Optional.of(stored.id()),
            table.selectBySerialNumber("SN-001").data().map(CameraInfo::id));
        assertTrue(table.deleteById(stored.id()).isSuccess());
        assertTrue(table.selectById(stored.id()).data().isEmpty());
        assertEquals("Camera not found: " + stored.id(), table.deleteById(stored.id()).errorMessage());
    }

    @Test
    void testSelectAllIsOrderedByName() {
        store("Charlie", "SN-3", "Basler");
        store("Alpha", "SN-1", "FLIR");
        store("Bravo", "SN-2", "Basler");

        List<String> names = table.selectAll().data().stream().map(CameraInfo::name).toList();

        assertEquals(List.of("Alpha", "Bravo", "Charlie"), names);
    }

    @Test
    void testPaging() {
        for (int i = 1; i <= 5; i++) {
            store("Camera " + i, "SN-" + i, "Basler");
        }

        PageResult<CameraInfo> last = table.selectByPage(PageParams.of(3, 2)).data();
        assertEquals(5, last.totalCount());
        assertEquals(3, last.totalPages());
        assertEquals(1, last.data().size());
        assertEquals("Camera 5", last.data().get(0).name());
        assertFalse(last.hasNext());

        PageResult<CameraInfo> bySerialDesc = table.selectByPage(
            PageParams.of(1, 2).orderedBy("serial_number", false)).data();
        assertEquals(List.of("SN-5", "SN-4"), bySerialDesc.data().stream().map(CameraInfo::serialNumber).toList());

        DbResult<PageResult<CameraInfo>> unknown = table.selectByPage(PageParams.of(1, 2).orderedBy("password", true));
        assertEquals("Cannot order cameras by unknown column: password", unknown.errorMessage());
    }

    @Test
    void testSearchTreatsWildcardsLiterally() {
        store("Cam_1", "SN-A", "Basler");
        store("Cam21", "SN-B", "FLIR");
        store("Microscope 100%", "SN-C", "Zeiss");

        assertEquals(List.of("Cam_1"), table.search("_").data().stream().map(CameraInfo::name).toList());
        assertEquals(List.of("Microscope 100%"), table.search("%").data().stream().map(CameraInfo::name).toList());
        assertEquals(1, table.search("flir").data().size(), "LIKE is case-insensitive for ASCII");
        assertEquals(3, table.search("  ").data().size());
    }

    @Test
    void testBatchInsertIsAtomic() {
        store("Existing", "SN-2", "Basler");

        DbResult<Integer> result = table.batchInsert(List.of(
            CameraInfo.of("First", "1", "USB3", "SN-1", "Basler"),
            CameraInfo.of("Clash", "1", "USB3", "SN-2", "Basler"),
            CameraInfo.of("Third", "1", "USB3", "SN-3", "Basler")));

        assertTrue(result.isError());
        assertEquals("Failed to insert camera SN-2: Serial number already exists: SN-2", result.errorMessage());
        assertEquals(1L, table.getTotalCount().data());
        assertFalse(manager.isInTransaction());

        DbResult<Integer> ok = table.batchInsert(List.of(
            CameraInfo.of("First", "1", "USB3", "SN-1", "Basler"),
            CameraInfo.of("Third", "1", "USB3", "SN-3", "Basler")));
        assertEquals(2, ok.data());
        assertEquals(3L, table.getTotalCount().data());
        assertEquals(0, table.batchInsert(List.of()).data());
    }

    @Test
    void testBatchRejectsDuplicatesWithinBatch() {
        DbResult<Integer> result = table.batchInsert(List.of(
            CameraInfo.of("First", "1", "USB3", "SN-1", "Basler"),
            CameraInfo.of("Again", "1", "USB3", "SN-1", "Basler")));

        assertTrue(result.isError());
        assertEquals(0L, table.getTotalCount().data());
    }

    @Test
    void testCountByManufacturer() {
        store("A", "SN-1", "Basler");
        store("B", "SN-2", "Basler");
        store("C", "SN-3", "FLIR");
        store("D", "SN-4", " ");
        store("E", "SN-5", null);

        Map<String, Long> counts = table.countByManufacturer().data();

        assertEquals(Map.of("Basler", 2L, "FLIR", 1L, "Unknown", 2L), counts);
        assertEquals(List.of("Basler", "FLIR", "Unknown"), List.copyOf(counts.keySet()));
    }

    @Test
    void testSelectByManufacturer() {
        store("Right", "SN-1", "Basler");
        store("Left", "SN-2", "Basler");
        store("Top", "SN-3", "FLIR");

        List<String> basler = table.selectByManufacturer("Basler").data().stream().map(CameraInfo::name).toList();

        assertEquals(List.of("Left", "Right"), basler);
        assertTrue(table.selectByManufacturer("Sony").data().isEmpty());
    }

    @Test
    void testSelectByConnectionType() {
        assertTrue(table.insert(CameraInfo.of("Gate", "1.0", "GigE", "SN-1", "FLIR")).isSuccess());
        assertTrue(table.insert(CameraInfo.of("Dock", "1.0", "GigE", "SN-2", "Basler")).isSuccess());
        store("Desk", "SN-3", "Basler");

        List<String> gige = table.selectByConnectionType("GigE").data().stream().map(CameraInfo::name).toList();

        assertEquals(List.of("Dock", "Gate"), gige);
        assertEquals(1, table.selectByConnectionType("USB3").data().size());
        assertTrue(table.selectByConnectionType("CoaXPress").data().isEmpty());
    }

    @Test
    void testGetAllManufacturersSkipsBlanks() {
        store("A", "SN-1", "FLIR");
        store("B", "SN-2", "Basler");
        store("C", "SN-3", "Basler");
        store("D", "SN-4", " ");
        store("E", "SN-5", null);

        assertEquals(List.of("Basler", "FLIR"), table.getAllManufacturers().data());
    }

    @Test
    void testBatchInsertCamerasReturnsIds() {
        List<CameraInfo> stored = table.batchInsertCameras(List.of(
            CameraInfo.of("A", "1", "USB3", "SN-1", "Basler"),
            CameraInfo.of("B", "1", "USB3", "SN-2", "Basler"))).data();

        assertEquals(2, stored.size());
        assertTrue(stored.stream().allMatch(CameraInfo::isSaved));
        assertEquals("SN-2", table.selectById(stored.get(1).id()).data().orElseThrow().serialNumber());
    }

    @Test
    void testSerialNumberExistsExcludesOwnRow() {
        CameraInfo stored = store("A", "SN-1", "Basler");

        assertTrue(table.serialNumberExists("SN-1", CameraInfo.UNSAVED_ID).data());
        assertFalse(table.serialNumberExists("SN-1", stored.id()).data());
        assertFalse(table.serialNumberExists("SN-404", CameraInfo.UNSAVED_ID).data());
    }

    @Test
    void testSchemaObjects() {
        assertTrue(table.tableExists());
        assertEquals("camera_info", table.tableName());
        assertTrue(table.truncateTable());
        assertTrue(table.dropTable());
        assertFalse(table.tableExists());
        assertTrue(table.createTable());
        assertTrue(table.createTable(), "creation is idempotent");
    }
}
