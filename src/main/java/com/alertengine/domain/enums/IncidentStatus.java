package com.alertengine.domain.enums;

/**
 * Lifecycle states of an incident.
 *
 * <p>Only OPEN incidents receive newly correlated alerts. INVESTIGATING incidents are
 * still reported as open by the query surface but no longer absorb new alerts.
 */
public enum IncidentStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    CLOSED;

    public boolean isActive() {
        return this == OPEN || this == INVESTIGATING;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }
}
