package com.alertengine.observability;

import com.alertengine.alert.AlertStore;
import com.alertengine.event.AlertEscalatedEvent;
import com.alertengine.event.AlertResolvedEvent;
import com.alertengine.event.AlertTriggeredEvent;
import com.alertengine.incident.IncidentCorrelator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the alert engine's Micrometer metrics.
 *
 * <ul>
 *   <li><b>alerts.triggered</b> (counter, tag {@code severity}): incremented on every AlertTriggeredEvent</li>
 *   <li><b>alerts.escalated</b> (counter): incremented on every AlertEscalatedEvent</li>
 *   <li><b>alerts.resolved</b> (counter, tag {@code auto}): incremented on every AlertResolvedEvent</li>
 *   <li><b>alerts.active</b> (gauge): unresolved alerts in the alert store</li>
 *   <li><b>incidents.open</b> (gauge): open and investigating incidents</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer when scraped.
 */
@Service
public class AlertMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter escalatedCounter;

    public AlertMetrics(MeterRegistry meterRegistry, AlertStore alertStore, IncidentCorrelator incidentCorrelator) {
        this.meterRegistry = meterRegistry;

        this.escalatedCounter = Counter.builder("alerts.escalated")
                .description("Alerts escalated after staying unresolved past their escalation delay")
                .register(meterRegistry);

        meterRegistry.gauge("alerts.active", alertStore, store -> store.getActiveAlerts().size());
        meterRegistry.gauge("incidents.open", incidentCorrelator, correlator -> correlator.getOpenIncidents().size());
    }

    @EventListener
    @Order(20)
    public void onAlertTriggered(AlertTriggeredEvent event) {
        Counter.builder("alerts.triggered")
                .description("Alerts raised by rules or manual requests")
                .tag("severity", event.getAlert().getSeverity().name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onAlertEscalated(AlertEscalatedEvent event) {
        escalatedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onAlertResolved(AlertResolvedEvent event) {
        Counter.builder("alerts.resolved")
                .description("Alerts resolved by users or by the stale sweeper")
                .tag("auto", Boolean.toString(event.isAutoResolved()))
                .register(meterRegistry)
                .increment();
    }
}
