package com.alertengine.engine;

import com.alertengine.alert.AlertStore;
import com.alertengine.condition.ConditionEvaluator;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.AlertRule;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.MetricSample;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.escalation.EscalationScheduler;
import com.alertengine.event.AlertTriggeredEvent;
import com.alertengine.incident.IncidentCorrelator;
import com.alertengine.metric.MetricStore;
import com.alertengine.notification.NotificationDispatcher;
import com.alertengine.rule.CooldownTracker;
import com.alertengine.rule.RuleRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Core rule evaluation engine. Every recorded sample is checked against the enabled rules
 * that watch its metric.
 *
 * <p>Evaluation flow for one sample:
 * <ol>
 *   <li>Under the metric's lock: append the sample to the history, then for each rule check
 *       its cooldown, evaluate its condition and, on a pass, store a new alert and restart
 *       the cooldown at the sample timestamp.</li>
 *   <li>After the lock is released, for each fired alert: correlate it into an incident
 *       (ERROR and CRITICAL only), hand it to the notification dispatcher, arm its
 *       escalation timer and publish an {@link AlertTriggeredEvent}.</li>
 * </ol>
 *
 * <p>Holding the metric lock across record, evaluate and cooldown update means two samples
 * of the same metric can never both see a rule as off cooldown. Notification I/O happens
 * outside the lock and is never awaited. A rule whose evaluation throws is logged and
 * skipped; the remaining rules still run.
 */
@Service
public class AlertRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleEngine.class);

    static final String SOURCE = "AlertRuleEngine";

    private final MetricStore metricStore;
    private final RuleRegistry ruleRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final CooldownTracker cooldownTracker;
    private final AlertStore alertStore;
    private final IncidentCorrelator incidentCorrelator;
    private final NotificationDispatcher notificationDispatcher;
    private final EscalationScheduler escalationScheduler;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, Object> metricLocks = new ConcurrentHashMap<>();

    public AlertRuleEngine(
            MetricStore metricStore,
            RuleRegistry ruleRegistry,
            ConditionEvaluator conditionEvaluator,
            CooldownTracker cooldownTracker,
            AlertStore alertStore,
            IncidentCorrelator incidentCorrelator,
            NotificationDispatcher notificationDispatcher,
            EscalationScheduler escalationScheduler,
            ApplicationEventPublisher eventPublisher) {
        this.metricStore = metricStore;
        this.ruleRegistry = ruleRegistry;
        this.conditionEvaluator = conditionEvaluator;
        this.cooldownTracker = cooldownTracker;
        this.alertStore = alertStore;
        this.incidentCorrelator = incidentCorrelator;
        this.notificationDispatcher = notificationDispatcher;
        this.escalationScheduler = escalationScheduler;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Records the sample and evaluates the rules of its metric.
     *
     * @return the alerts fired by this sample, possibly empty
     */
    public List<Alert> process(MetricSample sample) {
        List<FiredAlert> fired = recordAndEvaluate(sample);
        for (FiredAlert firedAlert : fired) {
            try {
                processTriggeredAlert(
                        firedAlert.alert(), firedAlert.rule().getChannels(), firedAlert.rule().getEscalationDelay());
            } catch (Exception e) {
                log.error("Post-fire processing failed for alert {}: {}", firedAlert.alert().getId(), e.getMessage(), e);
            }
        }
        return fired.stream().map(FiredAlert::alert).toList();
    }

    /**
     * Runs the post-fire steps for an alert already in the alert store.
     *
     * @return the incident the alert was correlated into, or null
     */
    public Incident processTriggeredAlert(Alert alert, List<NotificationChannel> channels, Duration escalationDelay) {
        log.warn("Alert triggered: {} ({}, severity {})", alert.getTitle(), alert.getId(), alert.getSeverity());

        Incident incident = null;
        if (alert.getSeverity().isIncidentWorthy()) {
            try {
                incident = incidentCorrelator.correlate(alert);
            } catch (Exception e) {
                log.error("Incident correlation failed for alert {}: {}", alert.getId(), e.getMessage(), e);
            }
        }

        notificationDispatcher.dispatch(alert, channels, incident);

        if (escalationDelay != null && !escalationDelay.isZero() && !escalationDelay.isNegative()) {
            escalationScheduler.arm(alert.getId(), escalationDelay);
        }

        eventPublisher.publishEvent(new AlertTriggeredEvent(this, alert, incident));
        return incident;
    }

    private List<FiredAlert> recordAndEvaluate(MetricSample sample) {
        Object lock = metricLocks.computeIfAbsent(sample.getMetric(), k -> new Object());
        synchronized (lock) {
            metricStore.record(sample);

            List<AlertRule> rules = ruleRegistry.getRulesForMetric(sample.getMetric());
            if (rules.isEmpty()) {
                return List.of();
            }

            List<FiredAlert> fired = new ArrayList<>();
            for (AlertRule rule : rules) {
                try {
                    if (cooldownTracker.isCoolingDown(rule.getId(), rule.getCooldownPeriod(), sample.getTimestamp())) {
                        log.debug("Rule {} in cooldown, skipping sample {}", rule.getId(), sample);
                        continue;
                    }
                    if (!conditionEvaluator.evaluate(rule.getCondition(), sample.getValue(), sample.getTimestamp())) {
                        continue;
                    }

                    Alert alert = createAlert(rule, sample);
                    cooldownTracker.recordFire(rule.getId(), sample.getTimestamp());
                    fired.add(new FiredAlert(alert, rule));
                } catch (Exception e) {
                    log.error("Error evaluating rule {} for metric {}: {}",
                            rule.getId(), sample.getMetric(), e.getMessage(), e);
                }
            }
            return fired;
        }
    }

    private Alert createAlert(AlertRule rule, MetricSample sample) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ruleId", rule.getId());
        metadata.put("metric", sample.getMetric());
        metadata.put("value", sample.getValue());
        metadata.put("threshold", rule.getCondition().getThreshold());
        metadata.put("operator", rule.getCondition().getOperator().name().toLowerCase());

        String baseId = rule.getId() + "_" + sample.getTimestamp().toEpochMilli();
        String alertId = baseId;
        int suffix = 1;
        while (true) {
            Alert alert = Alert.builder()
                    .id(alertId)
                    .title(rule.getName())
                    .description(Objects.requireNonNullElse(rule.getDescription(), rule.getName()) + ". Current value: " + sample.getValue()
                            + ", Threshold: " + rule.getCondition().getThreshold())
                    .severity(rule.getSeverity())
                    .category(rule.getCategory())
                    .source(SOURCE)
                    .timestamp(sample.getTimestamp())
                    .metadata(Map.copyOf(metadata))
                    .build();
            if (alertStore.save(alert)) {
                return alert;
            }
            alertId = baseId + "_" + suffix++;
        }
    }

    private record FiredAlert(Alert alert, AlertRule rule) {}
}
