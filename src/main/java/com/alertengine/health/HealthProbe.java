package com.alertengine.health;

import com.alertengine.engine.AlertEngineConfig;
import com.alertengine.engine.MetricRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically checks the monitored service and feeds the readings back as metrics.
 *
 * <p>On success records {@code api_response_time} (ms) and {@code database_health} (1/0),
 * plus {@code ai_success_rate} when reported. On any failure records the timeout sentinel
 * as {@code api_response_time} and 0 as {@code database_health}, so the default rules fire
 * on an unreachable service just as they would on a slow one.
 */
@Component
public class HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    static final String API_RESPONSE_TIME = "api_response_time";
    static final String DATABASE_HEALTH = "database_health";
    static final String AI_SUCCESS_RATE = "ai_success_rate";

    private final HealthSignal healthSignal;
    private final MetricRecorder metricRecorder;
    private final AlertEngineConfig alertEngineConfig;

    public HealthProbe(HealthSignal healthSignal, MetricRecorder metricRecorder, AlertEngineConfig alertEngineConfig) {
        this.healthSignal = healthSignal;
        this.metricRecorder = metricRecorder;
        this.alertEngineConfig = alertEngineConfig;
    }

    @Scheduled(
            fixedRateString = "${alert-engine.health-probe.interval-ms:60000}",
            initialDelayString = "${alert-engine.health-probe.interval-ms:60000}")
    public void scheduledProbe() {
        if (!alertEngineConfig.isEnabled() || !alertEngineConfig.getHealthProbe().isEnabled()) {
            return;
        }
        probe();
    }

    /**
     * Runs one health check and records the resulting samples. Never throws.
     */
    public void probe() {
        try {
            HealthCheckResult result = healthSignal.check();
            metricRecorder.recordMetric(API_RESPONSE_TIME, result.getLatency().toMillis());
            metricRecorder.recordMetric(DATABASE_HEALTH, result.isDatabaseHealthy() ? 1 : 0);
            if (result.getAiSuccessRate() != null) {
                metricRecorder.recordMetric(AI_SUCCESS_RATE, result.getAiSuccessRate());
            }
            log.debug("Health probe ok: {}", result);
        } catch (Exception e) {
            log.error("Health probe against {} failed: {}", alertEngineConfig.getHealthProbe().getUrl(), e.getMessage());
            metricRecorder.recordMetric(API_RESPONSE_TIME, alertEngineConfig.getHealthProbe().getTimeoutSentinelMs());
            metricRecorder.recordMetric(DATABASE_HEALTH, 0);
        }
    }
}
