package dev.mars.devicedb.db.health;

/**
 * A single named check run by {@link HealthCheckManager}.
 *
 * Implementations should report problems through the returned status; a thrown
 * exception is recorded as {@link HealthStatus.Status#UNHEALTHY}.
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Checks the component.
     *
     * @param component the name the check was registered under
     */
    HealthStatus check(String component) throws Exception;
}
