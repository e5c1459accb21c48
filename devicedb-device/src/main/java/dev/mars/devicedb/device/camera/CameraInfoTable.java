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
import dev.mars.devicedb.api.table.TableType;
import dev.mars.devicedb.db.manager.BaseDatabaseManager;
import dev.mars.devicedb.db.table.BaseTableOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Table handler for {@code camera_info}: the inventory of cameras attached to the device.
 *
 * Serial numbers are unique. {@code updated_at} is maintained by a trigger.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class CameraInfoTable extends BaseTableOperations {
    private static final Logger logger = LoggerFactory.getLogger(CameraInfoTable.class);

    public static final String TABLE_NAME = "camera_info";

    private static final DateTimeFormatter SQLITE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Set<String> SORTABLE_COLUMNS = Set.of(
        "id", "name", "version", "connection_type", "serial_number", "manufacturer", "created_at", "updated_at");

    private static final String COLUMNS =
        "id, name, version, connection_type, serial_number, manufacturer, created_at, updated_at";

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS camera_info (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL,
            version TEXT,
            connection_type TEXT,
            serial_number TEXT UNIQUE NOT NULL,
            manufacturer TEXT,
            created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
            updated_at DATETIME DEFAULT CURRENT_TIMESTAMP,
            CHECK (length(name) > 0),
            CHECK (length(serial_number) > 0)
        )""";

    private static final String CREATE_UPDATED_AT_TRIGGER = """
        CREATE TRIGGER IF NOT EXISTS trg_camera_info_updated_at
        AFTER UPDATE ON camera_info
        FOR EACH ROW WHEN NEW.updated_at = OLD.updated_at
        BEGIN
            UPDATE camera_info SET updated_at = CURRENT_TIMESTAMP WHERE id = NEW.id;
        END""";

    private static final String SQL_INSERT =
        "INSERT INTO camera_info (name, version, connection_type, serial_number, manufacturer) VALUES (?, ?, ?, ?, ?)";
    private static final String SQL_UPDATE =
        "UPDATE camera_info SET name = ?, version = ?, connection_type = ?, serial_number = ?, manufacturer = ? WHERE id = ?";
    private static final String SQL_DELETE = "DELETE FROM camera_info WHERE id = ?";
    private static final String SQL_SELECT_BY_ID = "SELECT " + COLUMNS + " FROM camera_info WHERE id = ?";
    private static final String SQL_SELECT_ALL = "SELECT " + COLUMNS + " FROM camera_info ORDER BY name";
    private static final String SQL_SELECT_BY_SERIAL = "SELECT " + COLUMNS + " FROM camera_info WHERE serial_number = ?";
    private static final String SQL_SEARCH = "SELECT " + COLUMNS + " FROM camera_info"
        + " WHERE name LIKE ? ESCAPE '\\' OR manufacturer LIKE ? ESCAPE '\\' OR serial_number LIKE ? ESCAPE '\\'"
        + " ORDER BY name";
    private static final String SQL_SELECT_BY_MANUFACTURER =
        "SELECT " + COLUMNS + " FROM camera_info WHERE manufacturer = ? ORDER BY name";
    private static final String SQL_SELECT_BY_CONNECTION_TYPE =
        "SELECT " + COLUMNS + " FROM camera_info WHERE connection_type = ? ORDER BY name";
    private static final String SQL_SELECT_MANUFACTURERS =
        "SELECT DISTINCT manufacturer FROM camera_info WHERE manufacturer IS NOT NULL AND TRIM(manufacturer) != ''"
        + " ORDER BY manufacturer";
    private static final String SQL_SERIAL_EXISTS =
        "SELECT COUNT(*) FROM camera_info WHERE serial_number = ? AND id != ?";
    private static final String SQL_COUNT_BY_MANUFACTURER =
        "SELECT COALESCE(NULLIF(TRIM(manufacturer), ''), 'Unknown') AS mfr, COUNT(*) FROM camera_info"
        + " GROUP BY mfr ORDER BY mfr";

    public CameraInfoTable(BaseDatabaseManager database) {
        super(database, TableType.CAMERA_INFO, TABLE_NAME);
    }

    @Override
    protected List<String> schemaStatements() {
        return List.of(
            CREATE_TABLE,
            "CREATE INDEX IF NOT EXISTS idx_camera_info_mfr ON camera_info(manufacturer)",
            "CREATE INDEX IF NOT EXISTS idx_camera_info_conn ON camera_info(connection_type)",
            CREATE_UPDATED_AT_TRIGGER
        );
    }

    /**
     * Stores a new camera.
     *
     * @return the stored camera with its id
     */
    public DbResult<CameraInfo> insert(CameraInfo camera) {
        if (camera == null || !camera.isValid()) {
            return DbResult.error("Invalid camera info: name and serial number are required");
        }
        DbResult<Boolean> exists = serialNumberExists(camera.serialNumber(), CameraInfo.UNSAVED_ID);
        if (exists.isError()) {
            return DbResult.error(exists.errorMessage());
        }
        if (exists.data()) {
            return DbResult.error("Serial number already exists: " + camera.serialNumber());
        }

        DbResult<Long> id = executeInsert(SQL_INSERT, camera.name(), camera.version(), camera.connectionType(),
            camera.serialNumber(), camera.manufacturer());
        if (id.isError()) {
            return DbResult.error(id.errorMessage());
        }
        logger.debug("Inserted camera {} with id {}", camera.serialNumber(), id.data());
        return DbResult.success(camera.withId(id.data()));
    }

    public DbResult<Boolean> update(CameraInfo camera) {
        if (camera == null || !camera.isValid()) {
            return DbResult.error("Invalid camera info: name and serial number are required");
        }
        if (!camera.isSaved()) {
            return DbResult.error("Camera has not been stored yet");
        }
        DbResult<Boolean> exists = serialNumberExists(camera.serialNumber(), camera.id());
        if (exists.isError()) {
            return DbResult.error(exists.errorMessage());
        }
        if (exists.data()) {
            return DbResult.error("Serial number already exists: " + camera.serialNumber());
        }

        DbResult<Integer> updated = executeUpdate(SQL_UPDATE, camera.name(), camera.version(),
            camera.connectionType(), camera.serialNumber(), camera.manufacturer(), camera.id());
        if (updated.isError()) {
            return DbResult.error(updated.errorMessage());
        }
        if (updated.data() == 0) {
            return DbResult.error("Camera not found: " + camera.id());
        }
        return DbResult.success(true);
    }

    public DbResult<Boolean> deleteById(long id) {
        DbResult<Integer> deleted = executeUpdate(SQL_DELETE, id);
        if (deleted.isError()) {
            return DbResult.error(deleted.errorMessage());
        }
        if (deleted.data() == 0) {
            return DbResult.error("Camera not found: " + id);
        }
        return DbResult.success(true);
    }

    public DbResult<Optional<CameraInfo>> selectById(long id) {
        return queryForObject(SQL_SELECT_BY_ID, CameraInfoTable::mapRow, id);
    }

    public DbResult<Optional<CameraInfo>> selectBySerialNumber(String serialNumber) {
        return queryForObject(SQL_SELECT_BY_SERIAL, CameraInfoTable::mapRow, serialNumber);
    }

    /**
     * All cameras ordered by name.
     */
    public DbResult<List<CameraInfo>> selectAll() {
        return queryForList(SQL_SELECT_ALL, CameraInfoTable::mapRow);
    }

    /**
     * One page of cameras, ordered by the requested column or by name.
     */
    public DbResult<PageResult<CameraInfo>> selectByPage(PageParams params) {
        String orderBy = params.orderBy();
        if (orderBy != null && !orderBy.isEmpty() && !SORTABLE_COLUMNS.contains(orderBy)) {
            return DbResult.error("Cannot order cameras by unknown column: " + orderBy);
        }
        String orderClause = params.orderByClause().isEmpty() ? " ORDER BY name" : params.orderByClause();

        DbResult<Long> total = getTotalCount();
        if (total.isError()) {
            return DbResult.error(total.errorMessage());
        }
        String sql = "SELECT " + COLUMNS + " FROM camera_info" + orderClause + " LIMIT ? OFFSET ?";
        return queryForList(sql, CameraInfoTable::mapRow, params.pageSize(), params.offset())
            .map(rows -> PageResult.of(rows, total.data(), params));
    }

    /**
     * Cameras whose name, manufacturer or serial number contains {@code keyword}.
     * A blank keyword matches every camera.
     */
    public DbResult<List<CameraInfo>> search(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return selectAll();
        }
        String pattern = "%" + escapeLike(keyword.trim()) + "%";
        return queryForList(SQL_SEARCH, CameraInfoTable::mapRow, pattern, pattern, pattern);
    }

    /**
     * Cameras made by {@code manufacturer}, ordered by name.
     */
    public DbResult<List<CameraInfo>> selectByManufacturer(String manufacturer) {
        return queryForList(SQL_SELECT_BY_MANUFACTURER, CameraInfoTable::mapRow, manufacturer);
    }

    /**
     * Cameras attached through {@code connectionType} (e.g. {@code USB3}, {@code GigE}), ordered by name.
     */
    public DbResult<List<CameraInfo>> selectByConnectionType(String connectionType) {
        return queryForList(SQL_SELECT_BY_CONNECTION_TYPE, CameraInfoTable::mapRow, connectionType);
    }

    /**
     * Distinct non-empty manufacturers, sorted.
     */
    public DbResult<List<String>> getAllManufacturers() {
        return queryForList(SQL_SELECT_MANUFACTURERS, rs -> rs.getString(1));
    }

    /**
     * Inserts all cameras in one transaction. Any failure rolls back the whole batch.
     *
     * @return the number of cameras inserted
     */
    public DbResult<Integer> batchInsert(List<CameraInfo> cameras) {
        return batchInsertCameras(cameras).map(List::size);
    }

    /**
     * Same as {@link #batchInsert(List)}, returning the stored cameras with their ids.
     */
    public DbResult<List<CameraInfo>> batchInsertCameras(List<CameraInfo> cameras) {
        if (cameras == null || cameras.isEmpty()) {
            return DbResult.success(List.of());
        }
        DbResult<List<CameraInfo>> result = database.executeInTransactionResult(() -> {
            List<CameraInfo> inserted = new ArrayList<>(cameras.size());
            for (CameraInfo camera : cameras) {
                DbResult<CameraInfo> stored = insert(camera);
                if (stored.isError()) {
                    return DbResult.<List<CameraInfo>>error("Failed to insert camera "
                        + (camera != null ? camera.serialNumber() : null) + ": " + stored.errorMessage());
                }
                inserted.add(stored.data());
            }
            return DbResult.success(List.copyOf(inserted));
        });
        if (result.isSuccess()) {
            logger.info("Batch inserted {} cameras", result.data().size());
        } else {
            logger.warn("Batch insert of {} cameras rolled back: {}", cameras.size(), result.errorMessage());
        }
        return result;
    }

    /**
     * Whether another camera already uses {@code serialNumber}.
     *
     * @param excludeId id of the camera being updated, or {@link CameraInfo#UNSAVED_ID}
     */
    public DbResult<Boolean> serialNumberExists(String serialNumber, long excludeId) {
        return queryForObject(SQL_SERIAL_EXISTS, rs -> rs.getLong(1) > 0, serialNumber, excludeId)
            .map(found -> found.orElse(false));
    }

    /**
     * Number of cameras per manufacturer; cameras without one are counted as {@code Unknown}.
     */
    public DbResult<Map<String, Long>> countByManufacturer() {
        return queryForList(SQL_COUNT_BY_MANUFACTURER, rs -> Map.entry(rs.getString(1), rs.getLong(2)))
            .map(entries -> {
                Map<String, Long> counts = new LinkedHashMap<>();
                entries.forEach(entry -> counts.put(entry.getKey(), entry.getValue()));
                return counts;
            });
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static CameraInfo mapRow(ResultSet rs) throws SQLException {
        return new CameraInfo(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("version"),
            rs.getString("connection_type"),
            rs.getString("serial_number"),
            rs.getString("manufacturer"),
            parseTimestamp(rs.getString("created_at")),
            parseTimestamp(rs.getString("updated_at"))
        );
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, SQLITE_TIMESTAMP);
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable timestamp '{}' in camera_info", value);
            return null;
        }
    }
}
