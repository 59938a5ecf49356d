package com.alertengine.event;

import com.alertengine.domain.model.Alert;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an escalation timer fires on an alert that is still unresolved.
 */
public class AlertEscalatedEvent extends ApplicationEvent {

    private final Alert alert;

    public AlertEscalatedEvent(Object source, Alert alert) {
        super(source);
        this.alert = alert;
    }

    public Alert getAlert() {
        return alert;
    }
}
