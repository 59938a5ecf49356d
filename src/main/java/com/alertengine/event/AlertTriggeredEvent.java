package com.alertengine.event;

import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.Incident;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a rule (or a manual request) raises an alert and the alert has been
 * correlated and handed to the notification dispatcher.
 *
 * <p>Consumed by:
 * <ul>
 *   <li>{@code AlertMetrics} -- increments the triggered counter per severity</li>
 * </ul>
 *
 * <p>Note: notification delivery is started inline by the engine before this event is
 * published. The event is for metrics and logging only.
 */
public class AlertTriggeredEvent extends ApplicationEvent {

    private final Alert alert;
    private final Incident incident;

    public AlertTriggeredEvent(Object source, Alert alert, Incident incident) {
        super(source);
        this.alert = alert;
        this.incident = incident;
    }

    public Alert getAlert() {
        return alert;
    }

    /** The incident the alert was correlated into, or null for warning and info alerts. */
    public Incident getIncident() {
        return incident;
    }
}
