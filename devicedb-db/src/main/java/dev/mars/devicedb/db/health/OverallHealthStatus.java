package dev.mars.devicedb.db.health;

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


import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated health of one database: {@code UP} only when every component is healthy.
 * A database whose checks have not run yet reports {@code UNKNOWN}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class OverallHealthStatus {
    public static final String UP = "UP";
    public static final String DOWN = "DOWN";
    public static final String UNKNOWN = "UNKNOWN";

    private final String databaseName;
    private final String status;
    private final Map<String, HealthStatus> components;
    private final Instant timestamp;

    public OverallHealthStatus(String databaseName, Map<String, HealthStatus> components, Instant timestamp) {
        this.databaseName = Objects.requireNonNull(databaseName, "Database name cannot be null");
        this.components = Map.copyOf(Objects.requireNonNull(components, "Components cannot be null"));
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (this.components.isEmpty()) {
            this.status = UNKNOWN;
        } else {
            this.status = this.components.values().stream().allMatch(HealthStatus::isHealthy) ? UP : DOWN;
        }
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getStatus() {
        return status;
    }

    public Map<String, HealthStatus> getComponents() {
        return components;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isHealthy() {
        return UP.equals(status);
    }

    public long getHealthyCount() {
        return components.values().stream().filter(HealthStatus::isHealthy).count();
    }

    public long getDegradedCount() {
        return components.values().stream().filter(HealthStatus::isDegraded).count();
    }

    public long getUnhealthyCount() {
        return components.values().stream().filter(HealthStatus::isUnhealthy).count();
    }

    @Override
    public String toString() {
        return "OverallHealthStatus{" +
                "database='" + databaseName + '\'' +
                ", status='" + status + '\'' +
                ", healthy=" + getHealthyCount() +
                ", degraded=" + getDegradedCount() +
                ", unhealthy=" + getUnhealthyCount() +
                ", timestamp=" + timestamp +
                '}';
    }
}
