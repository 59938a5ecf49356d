package com.alertengine.domain.enums;

/**
 * Actions recorded on an incident timeline.
 */
public enum TimelineAction {
    INCIDENT_CREATED,
    ALERT_ADDED,
    SEVERITY_ESCALATED,
    STATUS_CHANGED,
    ASSIGNED,
    NOTE_ADDED
}
