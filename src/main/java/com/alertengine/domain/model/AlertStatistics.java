package com.alertengine.domain.model;

import com.alertengine.domain.enums.AlertSeverity;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Point-in-time counters for the read-only query surface.
 * {@code activeAlerts} excludes suppressed alerts, which are counted in {@code suppressedAlerts}.
 * {@code criticalAlerts} counts unresolved CRITICAL alerts only.
 */
@Getter
@Builder
public class AlertStatistics {

    private final int totalAlerts;
    private final int activeAlerts;
    private final int resolvedAlerts;
    private final int criticalAlerts;
    private final int escalatedAlerts;
    private final int suppressedAlerts;
    private final int openIncidents;
    private final Map<String, Integer> alertsByCategory;
    private final Map<AlertSeverity, Integer> alertsBySeverity;
}
