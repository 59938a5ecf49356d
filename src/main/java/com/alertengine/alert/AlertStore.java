package com.alertengine.alert;

import com.alertengine.domain.model.Alert;
import com.alertengine.engine.AlertEngineConfig;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory store of fired alerts keyed by id.
 *
 * <p>State transitions are delegated to the alert itself, which synchronizes resolve and
 * escalate so they cannot interleave. The store is bounded by {@code maxAlertsInMemory}:
 * when a save pushes it over, the oldest resolved alerts are evicted first, then the oldest
 * unresolved ones.
 */
@Component
public class AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertStore.class);

    private static final Comparator<Alert> OLDEST_FIRST = Comparator.comparing(Alert::getTimestamp);

    private final int maxAlerts;
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    public AlertStore(AlertEngineConfig alertEngineConfig) {
        this.maxAlerts = alertEngineConfig.getMaxAlertsInMemory();
    }

    /**
     * Stores a new alert.
     *
     * @return false if an alert with the same id is already stored (the new one is dropped)
     */
    public boolean save(Alert alert) {
        boolean added = alerts.putIfAbsent(alert.getId(), alert) == null;
        if (added && alerts.size() > maxAlerts) {
            evictOverflow();
        }
        return added;
    }

    public Optional<Alert> find(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    public boolean contains(String alertId) {
        return alerts.containsKey(alertId);
    }

    /** Unresolved alerts, oldest first. */
    public List<Alert> getActiveAlerts() {
        return alerts.values().stream()
                .filter(alert -> !alert.isResolved())
                .sorted(OLDEST_FIRST)
                .toList();
    }

    /** All stored alerts, oldest first. */
    public List<Alert> getAllAlerts() {
        return alerts.values().stream().sorted(OLDEST_FIRST).toList();
    }

    /** Unresolved alerts raised before {@code cutoff}. */
    public List<Alert> findUnresolvedBefore(Instant cutoff) {
        return alerts.values().stream()
                .filter(alert -> !alert.isResolved() && alert.getTimestamp().isBefore(cutoff))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    /**
     * Resolves the alert. Returns false if it is missing or already resolved.
     */
    public boolean resolve(String alertId, String resolvedBy, Instant at) {
        Alert alert = alerts.get(alertId);
        return alert != null && alert.resolve(resolvedBy, at);
    }

    /**
     * Marks the alert escalated. Returns false if it is missing, resolved or already escalated.
     */
    public boolean markEscalated(String alertId, Instant at) {
        Alert alert = alerts.get(alertId);
        return alert != null && alert.markEscalated(at);
    }

    /**
     * Removes resolved alerts whose resolution is older than {@code cutoff}.
     *
     * @return number of alerts removed
     */
    public int purgeResolvedBefore(Instant cutoff) {
        int before = alerts.size();
        alerts.values()
                .removeIf(alert -> alert.isResolved()
                        && alert.getResolvedAt() != null
                        && alert.getResolvedAt().isBefore(cutoff));
        int removed = before - alerts.size();
        if (removed > 0) {
            log.info("Cleaned up {} old resolved alerts", removed);
        }
        return removed;
    }

    public int size() {
        return alerts.size();
    }

    private synchronized void evictOverflow() {
        int overflow = alerts.size() - maxAlerts;
        if (overflow <= 0) {
            return;
        }
        List<Alert> victims = alerts.values().stream()
                .sorted(Comparator.comparing((Alert alert) -> !alert.isResolved()).thenComparing(OLDEST_FIRST))
                .limit(overflow)
                .toList();
        victims.forEach(alert -> alerts.remove(alert.getId()));
        log.warn("Alert store over capacity ({}), evicted {} alerts", maxAlerts, victims.size());
    }
}
