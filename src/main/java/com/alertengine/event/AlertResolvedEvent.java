package com.alertengine.event;

import com.alertengine.domain.model.Alert;
import com.alertengine.engine.AlertService;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an alert is resolved, either by a user or by the stale sweeper.
 */
public class AlertResolvedEvent extends ApplicationEvent {

    private final Alert alert;

    public AlertResolvedEvent(Object source, Alert alert) {
        super(source);
        this.alert = alert;
    }

    public Alert getAlert() {
        return alert;
    }

    public boolean isAutoResolved() {
        return AlertService.SYSTEM_AUTO_RESOLVE.equals(alert.getResolvedBy());
    }
}
