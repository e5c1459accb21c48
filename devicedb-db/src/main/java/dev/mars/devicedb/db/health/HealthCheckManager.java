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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs registered health checks for one database on a fixed schedule.
 *
 * The first run happens one interval after {@link #start()}; {@link #runHealthChecks()}
 * runs all checks immediately on the calling thread. Each check is bounded by a timeout
 * and its latest result is kept for {@link #getOverallHealth()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class HealthCheckManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckManager.class);

    private final String databaseName;
    private final Duration checkInterval;
    private final Duration timeout;
    private final Map<String, HealthCheck> healthChecks = new ConcurrentHashMap<>();
    private final Map<String, HealthStatus> lastResults = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;
    private ExecutorService checkExecutor;
    private volatile boolean running = false;

    public HealthCheckManager(String databaseName, Duration checkInterval, Duration timeout) {
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName");
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public void registerHealthCheck(String name, HealthCheck healthCheck) {
        healthChecks.put(name, healthCheck);
        logger.debug("Registered health check '{}' for '{}'", name, databaseName);
    }

    public synchronized void start() {
        if (running) {
            logger.warn("Health check manager for '{}' is already running", databaseName);
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "devicedb-health-" + databaseName);
            t.setDaemon(true);
            return t;
        });
        checkExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "devicedb-health-check-" + databaseName);
            t.setDaemon(true);
            return t;
        });
        running = true;
        scheduler.scheduleAtFixedRate(this::performScheduledChecks,
            checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);

        logger.info("Health check manager started for '{}', interval: {}", databaseName, checkInterval);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        scheduler.shutdown();
        checkExecutor.shutdown();

        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!checkExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                checkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            checkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Health check manager stopped for '{}'", databaseName);
    }

    @Override
    public void close() {
        stop();
    }

    private void performScheduledChecks() {
        try {
            runHealthChecks();
        } catch (RuntimeException e) {
            // Keep the schedule alive; an escaping exception would cancel it
            logger.error("Scheduled health checks failed for '{}'", databaseName, e);
        }
    }

    /**
     * Runs every registered check now on the calling thread.
     */
    public OverallHealthStatus runHealthChecks() {
        logger.debug("Performing health checks for '{}'", databaseName);

        for (Map.Entry<String, HealthCheck> entry : healthChecks.entrySet()) {
            String name = entry.getKey();
            HealthStatus status = runCheck(name, entry.getValue());
            lastResults.put(name, status);

            if (status.isUnhealthy()) {
                logger.warn("Health check failed: {} - {}", name, status.message());
            } else if (status.isDegraded()) {
                logger.info("Health check degraded: {} - {}", name, status.message());
            }
        }
        return getOverallHealth();
    }

    private HealthStatus runCheck(String name, HealthCheck check) {
        ExecutorService executor = checkExecutor;
        if (executor == null || executor.isShutdown()) {
            return invoke(name, check);
        }

        Future<HealthStatus> future;
        try {
            future = executor.submit(() -> invoke(name, check));
        } catch (RejectedExecutionException e) {
            return invoke(name, check);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Health check timed out: {}", name);
            return HealthStatus.unhealthy(name, "Health check timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.unhealthy(name, "Health check interrupted");
        } catch (ExecutionException e) {
            return HealthStatus.unhealthy(name, "Health check error: " + e.getCause().getMessage());
        }
    }

    private HealthStatus invoke(String name, HealthCheck check) {
        try {
            HealthStatus status = check.check(name);
            return status != null ? status : HealthStatus.unhealthy(name, "Health check returned no status");
        } catch (Exception e) {
            logger.warn("Health check failed: {} - {}", name, e.getMessage(), e);
            return HealthStatus.unhealthy(name, "Health check threw exception: " + e.getMessage());
        }
    }

    public OverallHealthStatus getOverallHealth() {
        return new OverallHealthStatus(databaseName, new HashMap<>(lastResults), Instant.now());
    }

    public Optional<HealthStatus> getHealthStatus(String checkName) {
        return Optional.ofNullable(lastResults.get(checkName));
    }

    public Set<String> getRegisteredChecks() {
        return Collections.unmodifiableSet(healthChecks.keySet());
    }

    public boolean isRunning() {
        return running;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }
}
