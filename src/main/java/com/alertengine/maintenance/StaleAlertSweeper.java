package com.alertengine.maintenance;

import com.alertengine.alert.AlertStore;
import com.alertengine.domain.model.Alert;
import com.alertengine.engine.AlertEngineConfig;
import com.alertengine.engine.AlertService;
import com.alertengine.incident.IncidentCorrelator;
import com.alertengine.metric.MetricStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping.
 *
 * <p>Each tick auto-resolves unresolved alerts older than the stale threshold (through
 * {@link AlertService#resolveAlert} so pending escalations are cancelled), resolves stale
 * incidents, and applies the retention bounds to resolved alerts, metric samples and
 * incidents. Each step is isolated so one failure does not skip the rest.
 */
@Component
public class StaleAlertSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleAlertSweeper.class);

    private final AlertService alertService;
    private final AlertStore alertStore;
    private final MetricStore metricStore;
    private final IncidentCorrelator incidentCorrelator;
    private final AlertEngineConfig alertEngineConfig;
    private final Clock clock;

    public StaleAlertSweeper(
            AlertService alertService,
            AlertStore alertStore,
            MetricStore metricStore,
            IncidentCorrelator incidentCorrelator,
            AlertEngineConfig alertEngineConfig,
            Clock clock) {
        this.alertService = alertService;
        this.alertStore = alertStore;
        this.metricStore = metricStore;
        this.incidentCorrelator = incidentCorrelator;
        this.alertEngineConfig = alertEngineConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "${alert-engine.stale-sweep-interval-ms:300000}",
            initialDelayString = "${alert-engine.stale-sweep-interval-ms:300000}")
    public void scheduledSweep() {
        if (!alertEngineConfig.isEnabled()) {
            return;
        }
        sweep();
    }

    /**
     * Runs one housekeeping pass.
     *
     * @return number of alerts auto-resolved
     */
    public int sweep() {
        Instant now = clock.instant();
        int resolved = 0;

        try {
            List<Alert> stale = alertStore.findUnresolvedBefore(now.minus(alertEngineConfig.getStaleAlertThreshold()));
            for (Alert alert : stale) {
                if (alertService.resolveAlert(alert.getId(), AlertService.SYSTEM_AUTO_RESOLVE)) {
                    resolved++;
                }
            }
            if (resolved > 0) {
                log.info("Auto-resolved {} stale alerts", resolved);
            }
        } catch (Exception e) {
            log.error("Stale alert sweep failed: {}", e.getMessage(), e);
        }

        try {
            incidentCorrelator.autoResolveStaleIncidents(alertEngineConfig.getStaleIncidentThreshold());
            incidentCorrelator.cleanupOldIncidents(
                    alertEngineConfig.getIncidentRetention(), alertEngineConfig.getMaxIncidentsInMemory());
        } catch (Exception e) {
            log.error("Incident housekeeping failed: {}", e.getMessage(), e);
        }

        try {
            alertStore.purgeResolvedBefore(now.minus(alertEngineConfig.getAlertRetention()));
            metricStore.purgeOlderThan(now.minus(alertEngineConfig.getMetricRetention()));
        } catch (Exception e) {
            log.error("Retention purge failed: {}", e.getMessage(), e);
        }

        return resolved;
    }
}
