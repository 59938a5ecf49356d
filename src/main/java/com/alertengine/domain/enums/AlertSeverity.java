package com.alertengine.domain.enums;

/**
 * Severity level of an alert, rule or incident.
 *
 * <p>The rank defines the total order used for incident severity escalation:
 * INFO(1) &lt; WARNING(2) &lt; ERROR(3) &lt; CRITICAL(4). Only ERROR and CRITICAL
 * alerts are correlated into incidents.
 */
public enum AlertSeverity {

    /** Informational, no action required. */
    INFO(1),

    /** Degradation worth a look but not yet user-facing. */
    WARNING(2),

    /** Failure that needs operator attention. Opens or joins an incident. */
    ERROR(3),

    /** Outage-level failure. Opens or joins an incident. */
    CRITICAL(4);

    private final int rank;

    AlertSeverity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isHigherThan(AlertSeverity other) {
        return rank > other.rank;
    }

    public boolean isIncidentWorthy() {
        return rank >= ERROR.rank;
    }
}
