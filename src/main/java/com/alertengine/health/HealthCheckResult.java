package com.alertengine.health;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one successful health check.
 */
@Getter
@Builder
@ToString
public class HealthCheckResult {

    private final Duration latency;
    private final boolean databaseHealthy;

    /** Success rate of the AI service in percent, or null when the endpoint does not report it. */
    private final Double aiSuccessRate;
}
