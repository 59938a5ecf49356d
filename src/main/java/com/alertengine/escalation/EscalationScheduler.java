package com.alertengine.escalation;

import com.alertengine.alert.AlertStore;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.engine.AlertEngineConfig;
import com.alertengine.event.AlertEscalatedEvent;
import com.alertengine.notification.NotificationDispatcher;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * One-shot escalation timers, one per alert.
 *
 * <p>{@link #arm} schedules a check after the rule's escalation delay and keeps the handle
 * so {@link #cancel} can drop it when the alert is resolved first. When the timer fires the
 * alert is looked up again: a missing, resolved or already escalated alert is left alone.
 * The escalate transition is atomic on the alert, so a resolve racing the timer produces
 * either a resolved alert or an escalated one, never a notification for a resolved alert.
 */
@Component
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private final TaskScheduler taskScheduler;
    private final AlertStore alertStore;
    private final NotificationDispatcher notificationDispatcher;
    private final AlertEngineConfig alertEngineConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public EscalationScheduler(
            TaskScheduler taskScheduler,
            AlertStore alertStore,
            NotificationDispatcher notificationDispatcher,
            AlertEngineConfig alertEngineConfig,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.alertStore = alertStore;
        this.notificationDispatcher = notificationDispatcher;
        this.alertEngineConfig = alertEngineConfig;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Schedules the escalation check for an alert. A second arm for the same alert is ignored.
     */
    public void arm(String alertId, Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        pending.computeIfAbsent(alertId, id -> {
            Instant fireAt = clock.instant().plus(delay);
            log.debug("Escalation for alert {} armed at {}", id, fireAt);
            return taskScheduler.schedule(() -> fire(id), fireAt);
        });
    }

    /**
     * Cancels the pending check for an alert, if any.
     *
     * @return true if a pending check was cancelled
     */
    public boolean cancel(String alertId) {
        ScheduledFuture<?> handle = pending.remove(alertId);
        if (handle == null) {
            return false;
        }
        boolean cancelled = handle.cancel(false);
        if (cancelled) {
            log.debug("Escalation for alert {} cancelled", alertId);
        }
        return cancelled;
    }

    /**
     * Runs the escalation check. Invoked by the timer.
     *
     * @return true if the alert was escalated by this call
     */
    public boolean fire(String alertId) {
        pending.remove(alertId);
        return escalate(alertId);
    }

    /**
     * Escalates an alert on request, ahead of (or without) its timer. The pending timer is
     * dropped and the same guard as a timer fire applies.
     *
     * @return true if the alert was escalated by this call
     */
    public boolean escalateNow(String alertId) {
        cancel(alertId);
        return escalate(alertId);
    }

    private boolean escalate(String alertId) {
        try {
            Optional<Alert> found = alertStore.find(alertId);
            if (found.isEmpty()) {
                log.debug("Escalation skipped, alert {} no longer exists", alertId);
                return false;
            }
            Alert alert = found.get();
            if (!alertStore.markEscalated(alertId, clock.instant())) {
                log.debug("Escalation skipped, alert {} already resolved or escalated", alertId);
                return false;
            }

            log.warn("Alert escalated: {} ({})", alert.getTitle(), alertId);
            NotificationChannel channel = alertEngineConfig.getEscalation().getChannel();
            if (channel != null) {
                notificationDispatcher.dispatch(alert, List.of(channel), null);
            } else {
                log.debug("No escalation channel configured, escalation of {} only recorded", alertId);
            }
            eventPublisher.publishEvent(new AlertEscalatedEvent(this, alert));
            return true;
        } catch (Exception e) {
            log.error("Escalation check failed for alert {}: {}", alertId, e.getMessage(), e);
            return false;
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    public void cancelAll() {
        pending.values().forEach(handle -> handle.cancel(false));
        pending.clear();
    }
}
