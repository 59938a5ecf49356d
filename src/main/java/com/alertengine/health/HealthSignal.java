package com.alertengine.health;

/**
 * Source of health readings for the monitored service.
 */
public interface HealthSignal {

    /**
     * Performs one health check.
     *
     * @throws RuntimeException if the service is unreachable or reports failure
     */
    HealthCheckResult check();
}
