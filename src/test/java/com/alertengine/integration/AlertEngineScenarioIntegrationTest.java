package com.alertengine.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.alertengine.alert.AlertStore;
import com.alertengine.condition.ConditionEvaluator;
import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.ConditionOperator;
import com.alertengine.domain.enums.IncidentStatus;
import com.alertengine.domain.enums.NotificationChannelType;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.engine.AlertEngineConfig;
import com.alertengine.engine.AlertRuleEngine;
import com.alertengine.engine.AlertService;
import com.alertengine.escalation.EscalationScheduler;
import com.alertengine.event.AlertEscalatedEvent;
import com.alertengine.event.AlertResolvedEvent;
import com.alertengine.event.AlertTriggeredEvent;
import com.alertengine.incident.IncidentCorrelator;
import com.alertengine.maintenance.StaleAlertSweeper;
import com.alertengine.metric.MetricStore;
import com.alertengine.notification.ChannelPayloadBuilder;
import com.alertengine.notification.NotificationDispatcher;
import com.alertengine.notification.NotificationTransport;
import com.alertengine.notification.OutboundNotification;
import com.alertengine.observability.AlertMetrics;
import com.alertengine.rule.CooldownTracker;
import com.alertengine.rule.RuleRegistry;
import com.alertengine.rule.RuleValidator;
import com.alertengine.support.MutableClock;
import com.alertengine.support.TestRules;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

/**
 * Cross-component test of the alert pipeline.
 * Wires the real store, registry, evaluator, engine, correlator, dispatcher, escalation
 * scheduler and sweeper together with only the HTTP transport and the task scheduler
 * mocked, and drives them with a manual clock:
 * record -> evaluate -> fire -> correlate -> notify -> escalate / resolve -> sweep.
 */
class AlertEngineScenarioIntegrationTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final NotificationChannel slack = NotificationChannel.builder()
            .type(NotificationChannelType.SLACK)
            .config(Map.of("webhookUrl", "https://hooks.example/slack"))
            .build();

    private MutableClock clock;
    private AlertEngineConfig alertEngineConfig;
    private RuleRegistry ruleRegistry;
    private AlertStore alertStore;
    private IncidentCorrelator incidentCorrelator;
    private NotificationTransport notificationTransport;
    private TaskScheduler taskScheduler;
    private EscalationScheduler escalationScheduler;
    private AlertService alertService;
    private StaleAlertSweeper staleAlertSweeper;
    private SimpleMeterRegistry meterRegistry;
    private final List<Object> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        alertEngineConfig = new AlertEngineConfig();
        meterRegistry = new SimpleMeterRegistry();

        MetricStore metricStore = new MetricStore(alertEngineConfig);
        ruleRegistry = new RuleRegistry(new RuleValidator(), alertEngineConfig);
        alertStore = new AlertStore(alertEngineConfig);
        incidentCorrelator = new IncidentCorrelator(clock);
        AlertMetrics alertMetrics = new AlertMetrics(meterRegistry, alertStore, incidentCorrelator);

        ApplicationEventPublisher eventPublisher = event -> {
            events.add(event);
            if (event instanceof AlertTriggeredEvent triggered) {
                alertMetrics.onAlertTriggered(triggered);
            } else if (event instanceof AlertEscalatedEvent escalated) {
                alertMetrics.onAlertEscalated(escalated);
            } else if (event instanceof AlertResolvedEvent resolved) {
                alertMetrics.onAlertResolved(resolved);
            }
        };

        notificationTransport = mock(NotificationTransport.class);
        NotificationDispatcher dispatcher = new NotificationDispatcher(
                new ChannelPayloadBuilder(alertEngineConfig, clock),
                notificationTransport,
                Runnable::run,
                alertEngineConfig,
                clock);

        taskScheduler = mock(TaskScheduler.class);
        doReturn(mock(ScheduledFuture.class)).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        escalationScheduler = new EscalationScheduler(
                taskScheduler, alertStore, dispatcher, alertEngineConfig, eventPublisher, clock);

        AlertRuleEngine engine = new AlertRuleEngine(
                metricStore,
                ruleRegistry,
                new ConditionEvaluator(metricStore),
                new CooldownTracker(),
                alertStore,
                incidentCorrelator,
                dispatcher,
                escalationScheduler,
                eventPublisher);
        alertService = new AlertService(
                alertEngineConfig, engine, alertStore, incidentCorrelator, escalationScheduler, eventPublisher, clock);
        staleAlertSweeper = new StaleAlertSweeper(
                alertService, alertStore, metricStore, incidentCorrelator, alertEngineConfig, clock);
    }

    private void recordAt(Duration offset, String metric, double value) {
        clock.set(T0.plus(offset));
        alertService.recordMetric(metric, value);
    }

    private void registerErrorRateRule() {
        ruleRegistry.register(TestRules.rule("high_error_rate", "error_rate", ConditionOperator.GT, "5")
                .name("High Error Rate")
                .category("error_rate")
                .severity(AlertSeverity.ERROR)
                .condition(TestRules.condition("error_rate", ConditionOperator.GT, "5", Duration.ofMinutes(5), 2))
                .cooldownPeriod(Duration.ofMinutes(10))
                .escalationDelay(Duration.ofMinutes(15))
                .channels(List.of(slack))
                .build());
    }

    @Test
    @DisplayName("Sustained breach fires, cooldown suppresses, and a later breach joins the open incident")
    void sustainedBreachCooldownAndCorrelation() {
        registerErrorRateRule();

        recordAt(Duration.ZERO, "error_rate", 6);
        assertThat(alertService.getActiveAlerts()).isEmpty();

        recordAt(Duration.ofSeconds(30), "error_rate", 7);
        assertThat(alertService.getActiveAlerts()).hasSize(1);
        Alert first = alertService.getActiveAlerts().get(0);
        assertThat(first.getId()).isEqualTo("high_error_rate_" + T0.plusSeconds(30).toEpochMilli());

        List<Incident> open = alertService.getOpenIncidents();
        assertThat(open).hasSize(1);
        Incident incident = open.get(0);
        assertThat(incident.getSeverity()).isEqualTo(AlertSeverity.ERROR);

        ArgumentCaptor<OutboundNotification> sent = ArgumentCaptor.forClass(OutboundNotification.class);
        verify(notificationTransport).send(sent.capture());
        assertThat(sent.getValue().getPayload()).containsEntry("alertId", first.getId());
        assertThat(sent.getValue().getPayload()).containsEntry("incident", incident.getId() + " (open)");
        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        recordAt(Duration.ofSeconds(60), "error_rate", 8);
        assertThat(alertStore.size()).isEqualTo(1);

        // past cooldown, but only one sample left in the 5m window
        recordAt(Duration.ofMinutes(10).plusSeconds(45), "error_rate", 8);
        assertThat(alertStore.size()).isEqualTo(1);

        recordAt(Duration.ofMinutes(11), "error_rate", 8);
        assertThat(alertStore.size()).isEqualTo(2);
        assertThat(incident.getAlertCount()).isEqualTo(2);
        assertThat(alertService.getOpenIncidents()).hasSize(1);
        verify(notificationTransport, times(2)).send(any());

        assertThat(meterRegistry.get("alerts.triggered").tag("severity", "error").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("incidents.open").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A breach after the incident is resolved opens a new incident")
    void resolvedIncidentNotReused() {
        registerErrorRateRule();
        recordAt(Duration.ZERO, "error_rate", 6);
        recordAt(Duration.ofSeconds(30), "error_rate", 7);
        Incident firstIncident = alertService.getOpenIncidents().get(0);

        incidentCorrelator.updateStatus(firstIncident.getId(), IncidentStatus.RESOLVED, "alice", "fixed");

        recordAt(Duration.ofMinutes(10).plusSeconds(45), "error_rate", 9);
        recordAt(Duration.ofMinutes(11), "error_rate", 9);

        List<Incident> open = alertService.getOpenIncidents();
        assertThat(open).hasSize(1);
        assertThat(open.get(0).getId()).isNotEqualTo(firstIncident.getId());
        assertThat(incidentCorrelator.getAllIncidents()).hasSize(2);
    }

    @Test
    @DisplayName("Resolving before the escalation delay prevents escalation")
    void resolveCancelsEscalation() {
        registerErrorRateRule();
        recordAt(Duration.ZERO, "error_rate", 6);
        recordAt(Duration.ofSeconds(30), "error_rate", 7);
        String alertId = alertService.getActiveAlerts().get(0).getId();
        assertThat(escalationScheduler.pendingCount()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(5));
        assertThat(alertService.resolveAlert(alertId, "alice")).isTrue();
        assertThat(escalationScheduler.pendingCount()).isZero();

        clock.advance(Duration.ofMinutes(15));
        assertThat(escalationScheduler.fire(alertId)).isFalse();
        assertThat(alertService.getAlert(alertId).isEscalated()).isFalse();
        assertThat(events).noneMatch(AlertEscalatedEvent.class::isInstance);
    }

    @Test
    @DisplayName("An unresolved alert escalates once to the escalation channel")
    void unresolvedAlertEscalates() {
        NotificationChannel pagerDuty = NotificationChannel.builder()
                .type(NotificationChannelType.PAGERDUTY)
                .config(Map.of("routingKey", "rk-1"))
                .build();
        alertEngineConfig.getEscalation().setChannel(pagerDuty);
        registerErrorRateRule();
        recordAt(Duration.ZERO, "error_rate", 6);
        recordAt(Duration.ofSeconds(30), "error_rate", 7);
        String alertId = alertService.getActiveAlerts().get(0).getId();

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Instant.class));
        clock.advance(Duration.ofMinutes(15));
        task.getValue().run();

        assertThat(alertService.getAlert(alertId).isEscalated()).isTrue();
        ArgumentCaptor<OutboundNotification> sent = ArgumentCaptor.forClass(OutboundNotification.class);
        verify(notificationTransport, times(2)).send(sent.capture());
        assertThat(sent.getAllValues().get(1).getChannelType()).isEqualTo(NotificationChannelType.PAGERDUTY);
        assertThat(alertService.getStatistics().getEscalatedAlerts()).isEqualTo(1);
        assertThat(meterRegistry.get("alerts.escalated").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("The sweeper auto-resolves alerts older than the stale threshold")
    void sweeperAutoResolves() {
        ruleRegistry.register(TestRules.rule("db_down", "database_health", ConditionOperator.LT, "1")
                .severity(AlertSeverity.CRITICAL)
                .category("database")
                .build());
        recordAt(Duration.ZERO, "database_health", 0);
        String alertId = alertService.getActiveAlerts().get(0).getId();

        clock.set(T0.plus(Duration.ofHours(25)));
        assertThat(staleAlertSweeper.sweep()).isEqualTo(1);

        Alert alert = alertService.getAlert(alertId);
        assertThat(alert.isResolved()).isTrue();
        assertThat(alert.getResolvedBy()).isEqualTo(AlertService.SYSTEM_AUTO_RESOLVE);
        assertThat(incidentCorrelator.getOpenIncidents()).isEmpty();
        assertThat(meterRegistry.get("alerts.resolved").tag("auto", "true").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A failing channel does not block the others or the pipeline")
    void channelFailureIsolated() {
        NotificationChannel email = NotificationChannel.builder()
                .type(NotificationChannelType.EMAIL)
                .config(Map.of("endpoint", "https://mail.example/send", "recipients", "oncall@example.com"))
                .build();
        ruleRegistry.register(TestRules.rule("slow_api", "api_response_time", ConditionOperator.GT, "5000")
                .severity(AlertSeverity.CRITICAL)
                .channels(List.of(slack, email))
                .build());
        doAnswer(invocation -> {
                    OutboundNotification notification = invocation.getArgument(0);
                    if (notification.getChannelType() == NotificationChannelType.SLACK) {
                        throw new IllegalStateException("connection reset");
                    }
                    return null;
                })
                .when(notificationTransport)
                .send(any());

        recordAt(Duration.ZERO, "api_response_time", 30_000);

        assertThat(alertService.getActiveAlerts()).hasSize(1);
        verify(notificationTransport, times(2)).send(any());
        assertThat(events).filteredOn(AlertTriggeredEvent.class::isInstance).hasSize(1);
    }
}
