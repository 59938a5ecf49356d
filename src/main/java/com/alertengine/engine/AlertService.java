package com.alertengine.engine;

import com.alertengine.alert.AlertStore;
import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.AlertStatistics;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.MetricSample;
import com.alertengine.escalation.EscalationScheduler;
import com.alertengine.event.AlertResolvedEvent;
import com.alertengine.exception.BusinessException;
import com.alertengine.exception.ResourceNotFoundException;
import com.alertengine.incident.IncidentCorrelator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point of the alert engine.
 *
 * <p>Accepts metric samples, resolves alerts and answers queries over alerts and incidents.
 * Rule evaluation is delegated to {@link AlertRuleEngine}; this class owns the process-wide
 * {@code enabled} switch, input sanitation, the resolve path (which also cancels a pending
 * escalation) and the operator actions on single alerts.
 */
@Service
@EnableConfigurationProperties(AlertEngineConfig.class)
public class AlertService implements MetricRecorder {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final String SYSTEM_AUTO_RESOLVE = "system_auto_resolve";
    static final String DEFAULT_RESOLVER = "system";
    static final String MANUAL_CATEGORY = "system_health";
    static final String MANUAL_SOURCE = "Manual";

    private final AlertEngineConfig alertEngineConfig;
    private final AlertRuleEngine alertRuleEngine;
    private final AlertStore alertStore;
    private final IncidentCorrelator incidentCorrelator;
    private final EscalationScheduler escalationScheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public AlertService(
            AlertEngineConfig alertEngineConfig,
            AlertRuleEngine alertRuleEngine,
            AlertStore alertStore,
            IncidentCorrelator incidentCorrelator,
            EscalationScheduler escalationScheduler,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.alertEngineConfig = alertEngineConfig;
        this.alertRuleEngine = alertRuleEngine;
        this.alertStore = alertStore;
        this.incidentCorrelator = incidentCorrelator;
        this.escalationScheduler = escalationScheduler;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Records a sample stamped with the current time and evaluates the rules of its metric.
     * Never throws.
     */
    @Override
    public void recordMetric(String name, double value) {
        if (!alertEngineConfig.isEnabled()) {
            return;
        }
        if (name == null || name.isBlank()) {
            log.warn("Dropping metric sample with blank name (value {})", value);
            return;
        }
        if (!Double.isFinite(value)) {
            log.warn("Dropping non-finite value {} for metric {}", value, name);
            return;
        }

        try {
            alertRuleEngine.process(MetricSample.builder()
                    .metric(name)
                    .value(value)
                    .timestamp(clock.instant())
                    .build());
        } catch (Exception e) {
            log.error("Failed to process metric {}: {}", name, e.getMessage(), e);
        }
    }

    /**
     * Resolves an alert and cancels its pending escalation.
     *
     * @param resolvedBy who resolved it; null or blank means {@code "system"}
     * @return false if the alert does not exist or was already resolved
     */
    public boolean resolveAlert(String alertId, String resolvedBy) {
        String by = resolvedBy == null || resolvedBy.isBlank() ? DEFAULT_RESOLVER : resolvedBy;
        if (!alertStore.resolve(alertId, by, clock.instant())) {
            return false;
        }
        escalationScheduler.cancel(alertId);

        Alert alert = alertStore.find(alertId).orElseThrow();
        log.info("Alert resolved: {} ({}) by {}", alert.getTitle(), alertId, by);
        eventPublisher.publishEvent(new AlertResolvedEvent(this, alert));
        return true;
    }

    /**
     * Hides an unresolved alert from the active view for {@code duration}.
     *
     * @return false if the alert does not exist or is already resolved
     * @throws BusinessException if the duration is not positive
     */
    public boolean suppressAlert(String alertId, Duration duration, String reason) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new BusinessException("Suppression duration must be positive");
        }
        Alert alert = alertStore.find(alertId).orElse(null);
        if (alert == null) {
            return false;
        }
        Instant until = clock.instant().plus(duration);
        if (!alert.suppress(until, reason)) {
            return false;
        }
        log.info("Alert suppressed: {} until {} ({})", alertId, until, reason != null ? reason : "no reason given");
        return true;
    }

    /**
     * Escalates an alert now instead of waiting for its timer.
     *
     * @return false if the alert does not exist, is resolved or was already escalated
     */
    public boolean escalateAlert(String alertId) {
        return escalationScheduler.escalateNow(alertId);
    }

    /**
     * Raises an alert that no rule produced, e.g. from an operator or another service.
     * It is routed to the default channels and correlated when its severity is ERROR or above.
     */
    public Alert sendManualAlert(String type, String message, AlertSeverity severity, Map<String, Object> metadata) {
        if (type == null || type.isBlank()) {
            throw new BusinessException("Manual alert type must not be blank");
        }
        if (severity == null) {
            throw new BusinessException("Manual alert severity must not be null");
        }

        Instant now = clock.instant();
        Alert alert = Alert.builder()
                .id("manual_" + now.toEpochMilli() + "_"
                        + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36))
                .title(type.replace('_', ' ').toUpperCase(Locale.ROOT))
                .description(message)
                .severity(severity)
                .category(MANUAL_CATEGORY)
                .source(MANUAL_SOURCE)
                .timestamp(now)
                .metadata(metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of())
                .build();

        alertStore.save(alert);
        alertRuleEngine.processTriggeredAlert(
                alert, alertEngineConfig.getNotification().getDefaultChannels(), Duration.ZERO);
        return alert;
    }

    /** Unresolved alerts that are not currently suppressed, oldest first. */
    public List<Alert> getActiveAlerts() {
        Instant now = clock.instant();
        return alertStore.getActiveAlerts().stream()
                .filter(alert -> !alert.isSuppressedAt(now))
                .toList();
    }

    /**
     * Alerts raised within {@code [from, to]}, newest first. A null bound leaves that side open.
     */
    public List<Alert> getAlertHistory(Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new BusinessException("History range start must not be after its end");
        }
        return alertStore.getAllAlerts().stream()
                .filter(alert -> from == null || !alert.getTimestamp().isBefore(from))
                .filter(alert -> to == null || !alert.getTimestamp().isAfter(to))
                .sorted(Comparator.comparing(Alert::getTimestamp).reversed())
                .toList();
    }

    public List<Alert> getAllAlerts() {
        return alertStore.getAllAlerts();
    }

    /**
     * @throws ResourceNotFoundException if no alert has the id
     */
    public Alert getAlert(String alertId) {
        return alertStore.find(alertId).orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }

    public List<Incident> getOpenIncidents() {
        return incidentCorrelator.getOpenIncidents();
    }

    public AlertStatistics getStatistics() {
        List<Alert> alerts = alertStore.getAllAlerts();
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        Instant now = clock.instant();
        int active = 0;
        int resolved = 0;
        int critical = 0;
        int escalated = 0;
        int suppressed = 0;

        for (Alert alert : alerts) {
            byCategory.merge(alert.getCategory(), 1, Integer::sum);
            bySeverity.merge(alert.getSeverity(), 1, Integer::sum);
            if (alert.isResolved()) {
                resolved++;
            } else {
                if (alert.isSuppressedAt(now)) {
                    suppressed++;
                } else {
                    active++;
                }
                if (alert.getSeverity() == AlertSeverity.CRITICAL) {
                    critical++;
                }
            }
            if (alert.isEscalated()) {
                escalated++;
            }
        }

        return AlertStatistics.builder()
                .totalAlerts(alerts.size())
                .activeAlerts(active)
                .resolvedAlerts(resolved)
                .criticalAlerts(critical)
                .escalatedAlerts(escalated)
                .suppressedAlerts(suppressed)
                .openIncidents(incidentCorrelator.getOpenIncidents().size())
                .alertsByCategory(byCategory)
                .alertsBySeverity(bySeverity)
                .build();
    }
}
