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
 * Result of one health check for a database component.
 *
 * @param component the checked component, e.g. {@code database} or {@code disk-space}
 * @param status    the outcome
 * @param message   why the component is not healthy, {@code null} when healthy
 * @param details   check measurements, never {@code null}
 * @param timestamp when the check finished
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public record HealthStatus(
    String component,
    Status status,
    String message,
    Map<String, Object> details,
    Instant timestamp
) {
    public enum Status {
        HEALTHY, DEGRADED, UNHEALTHY
    }

    public HealthStatus {
        Objects.requireNonNull(component, "Component cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        details = details != null ? Map.copyOf(details) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static HealthStatus healthy(String component) {
        return new HealthStatus(component, Status.HEALTHY, null, null, null);
    }

    public static HealthStatus healthy(String component, Map<String, Object> details) {
        return new HealthStatus(component, Status.HEALTHY, null, details, null);
    }

    public static HealthStatus degraded(String component, String message, Map<String, Object> details) {
        return new HealthStatus(component, Status.DEGRADED, message, details, null);
    }

    public static HealthStatus unhealthy(String component, String message) {
        return new HealthStatus(component, Status.UNHEALTHY, message, null, null);
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isUnhealthy() {
        return status == Status.UNHEALTHY;
    }
}
