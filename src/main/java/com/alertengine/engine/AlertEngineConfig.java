package com.alertengine.engine;

import com.alertengine.domain.model.AlertRule;
import com.alertengine.domain.model.NotificationChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the alert engine under the {@code alert-engine} prefix.
 *
 * <p>Controls global behavior:
 * <ul>
 *   <li>{@code enabled} -- master toggle; when off, metrics are dropped and periodic tasks skip</li>
 *   <li>{@code metricHistoryCapacity} -- per-metric sample cap (FIFO eviction)</li>
 *   <li>{@code staleAlertThreshold} -- unresolved alerts older than this are auto-resolved</li>
 *   <li>{@code maxAlertsInMemory}, {@code alertRetention} -- bounds on the in-memory alert store</li>
 *   <li>{@code maxIncidentsInMemory}, {@code incidentRetention} -- bounds on stored incidents</li>
 *   <li>{@code rules} -- the static rule list registered at startup</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert-engine")
public class AlertEngineConfig {

    private boolean enabled = true;
    private String serviceName = "alert-engine";
    private String environment = "development";

    private int metricHistoryCapacity = 1000;
    private Duration metricRetention = Duration.ofHours(24);

    private int maxAlertsInMemory = 10_000;
    private Duration alertRetention = Duration.ofDays(7);
    private Duration staleAlertThreshold = Duration.ofHours(24);
    private long staleSweepIntervalMs = 300_000;

    private int maxIncidentsInMemory = 1000;
    private Duration incidentRetention = Duration.ofDays(30);
    private Duration staleIncidentThreshold = Duration.ofHours(24);

    private Notification notification = new Notification();
    private Escalation escalation = new Escalation();
    private HealthProbe healthProbe = new HealthProbe();

    private List<AlertRule> rules = new ArrayList<>();

    @Getter
    @Setter
    public static class Notification {

        /** Upper bound for a single channel delivery, including connection setup. */
        private Duration timeout = Duration.ofSeconds(10);

        private String pagerdutyEventsUrl = "https://events.pagerduty.com/v2/enqueue";

        /** Channels used for manually raised alerts, which have no rule of their own. */
        private List<NotificationChannel> defaultChannels = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Escalation {

        /** Channel receiving escalation notifications. Null means escalations are only recorded. */
        private NotificationChannel channel;
    }

    @Getter
    @Setter
    public static class HealthProbe {

        private boolean enabled = true;
        private String url = "http://localhost:8080/api/health";
        private long intervalMs = 60_000;
        private Duration timeout = Duration.ofSeconds(10);

        /** Value recorded for api_response_time when the probe fails or times out. */
        private double timeoutSentinelMs = 30_000;
    }
}
