package com.alertengine.notification;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.NotificationChannelType;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.engine.AlertEngineConfig;
import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the channel-specific request for an alert.
 *
 * <p>Returns empty when the channel lacks the configuration it needs (no webhook URL, no
 * recipients, no routing key); the dispatcher reports such channels as skipped.
 */
@Component
public class ChannelPayloadBuilder {

    private static final Logger log = LoggerFactory.getLogger(ChannelPayloadBuilder.class);

    static final String HEADER_PREFIX = "header.";
    private static final String DEFAULT_SLACK_CHANNEL = "#alerts";

    private final AlertEngineConfig alertEngineConfig;
    private final Clock clock;

    public ChannelPayloadBuilder(AlertEngineConfig alertEngineConfig, Clock clock) {
        this.alertEngineConfig = alertEngineConfig;
        this.clock = clock;
    }

    public Optional<OutboundNotification> build(NotificationChannel channel, Alert alert, Incident incident) {
        return switch (channel.getType()) {
            case SLACK -> slack(channel, alert, incident);
            case EMAIL -> email(channel, alert, incident);
            case WEBHOOK -> webhook(channel, alert, incident);
            case PAGERDUTY -> pagerDuty(channel, alert, incident);
        };
    }

    private Optional<OutboundNotification> slack(NotificationChannel channel, Alert alert, Incident incident) {
        String webhookUrl = channel.configValue("webhookUrl");
        if (webhookUrl == null) {
            return skip(channel, alert, "Slack webhook URL not configured");
        }
        String slackChannel = Optional.ofNullable(channel.configValue("channel")).orElse(DEFAULT_SLACK_CHANNEL);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", slackChannel);
        payload.put("title", "[" + severityLabel(alert) + "] " + alert.getTitle());
        payload.put("severity", severityCode(alert.getSeverity()));
        payload.put("color", severityColor(alert.getSeverity()));
        payload.put("category", alert.getCategory());
        payload.put("description", alert.getDescription());
        payload.put("timestamp", alert.getTimestamp().toString());
        payload.put("alertId", alert.getId());
        payload.put("source", alert.getSource());
        payload.put("service", alertEngineConfig.getServiceName());
        payload.put("environment", alertEngineConfig.getEnvironment());
        if (incident != null) {
            payload.put("incident", incident.getId() + " (" + incident.getStatus().name().toLowerCase() + ")");
        }
        return Optional.of(outbound(NotificationChannelType.SLACK, webhookUrl, payload, Map.of()));
    }

    private Optional<OutboundNotification> email(NotificationChannel channel, Alert alert, Incident incident) {
        String endpoint = channel.configValue("endpoint");
        if (endpoint == null) {
            return skip(channel, alert, "Email notification endpoint not configured");
        }
        List<String> recipients = parseRecipients(channel.configValue("recipients"));
        if (recipients.isEmpty()) {
            return skip(channel, alert, "No email recipients configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("to", recipients);
        payload.put("subject", "[" + severityLabel(alert) + "] " + alert.getTitle() + " - " + alertEngineConfig.getServiceName());
        payload.put("body", emailBody(alert, incident));
        return Optional.of(outbound(NotificationChannelType.EMAIL, endpoint, payload, Map.of()));
    }

    private Optional<OutboundNotification> webhook(NotificationChannel channel, Alert alert, Incident incident) {
        String url = channel.configValue("url");
        if (url == null) {
            return skip(channel, alert, "Webhook URL not configured");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        channel.getConfig().forEach((key, value) -> {
            if (key.startsWith(HEADER_PREFIX) && key.length() > HEADER_PREFIX.length() && value != null) {
                headers.put(key.substring(HEADER_PREFIX.length()), value);
            }
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "alert");
        payload.put("alert", alertBody(alert));
        if (incident != null) {
            payload.put("incident", incidentBody(incident));
        }
        payload.put("serviceName", alertEngineConfig.getServiceName());
        payload.put("environment", alertEngineConfig.getEnvironment());
        payload.put("timestamp", clock.instant().toString());
        return Optional.of(outbound(NotificationChannelType.WEBHOOK, url, payload, headers));
    }

    private Optional<OutboundNotification> pagerDuty(NotificationChannel channel, Alert alert, Incident incident) {
        String routingKey = channel.configValue("routingKey");
        if (routingKey == null) {
            return skip(channel, alert, "PagerDuty routing key not configured");
        }

        Map<String, Object> customDetails = new LinkedHashMap<>(alert.getMetadata());
        customDetails.put("alert_id", alert.getId());
        customDetails.put("environment", alertEngineConfig.getEnvironment());
        if (incident != null) {
            customDetails.put("incident_id", incident.getId());
        }
        customDetails.put("timestamp", alert.getTimestamp().toString());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("summary", alert.getTitle() + ": " + alert.getDescription());
        event.put("severity", severityCode(alert.getSeverity()));
        event.put("source", alertEngineConfig.getServiceName());
        event.put("component", alert.getSource());
        event.put("group", alert.getCategory());
        event.put("class", severityCode(alert.getSeverity()));
        event.put("custom_details", customDetails);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("routing_key", routingKey);
        payload.put("event_action", "trigger");
        payload.put("dedup_key", alert.getId());
        payload.put("payload", event);
        return Optional.of(outbound(NotificationChannelType.PAGERDUTY,
                alertEngineConfig.getNotification().getPagerdutyEventsUrl(), payload, Map.of()));
    }

    private Optional<OutboundNotification> skip(NotificationChannel channel, Alert alert, String reason) {
        log.warn("{} for alert {}, skipping {} channel", reason, alert.getId(), channel.getType());
        return Optional.empty();
    }

    private String emailBody(Alert alert, Incident incident) {
        StringBuilder body = new StringBuilder()
                .append("Alert: ").append(alert.getTitle()).append('\n')
                .append("Severity: ").append(severityLabel(alert)).append('\n')
                .append('\n')
                .append("Description:").append('\n')
                .append(alert.getDescription()).append('\n')
                .append('\n')
                .append("Details:").append('\n')
                .append("- Service: ").append(alertEngineConfig.getServiceName()).append('\n')
                .append("- Environment: ").append(alertEngineConfig.getEnvironment()).append('\n')
                .append("- Category: ").append(alert.getCategory()).append('\n')
                .append("- Source: ").append(alert.getSource()).append('\n')
                .append("- Time: ").append(alert.getTimestamp()).append('\n')
                .append("- Alert ID: ").append(alert.getId()).append('\n');
        if (incident != null) {
            body.append('\n')
                    .append("Incident: ").append(incident.getId()).append('\n')
                    .append("Incident Status: ").append(incident.getStatus().name().toLowerCase()).append('\n');
        }
        return body.toString();
    }

    private static Map<String, Object> alertBody(Alert alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", alert.getId());
        body.put("title", alert.getTitle());
        body.put("description", alert.getDescription());
        body.put("severity", severityCode(alert.getSeverity()));
        body.put("category", alert.getCategory());
        body.put("source", alert.getSource());
        body.put("timestamp", alert.getTimestamp().toString());
        body.put("metadata", alert.getMetadata());
        return body;
    }

    private static Map<String, Object> incidentBody(Incident incident) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", incident.getId());
        body.put("title", incident.getTitle());
        body.put("severity", severityCode(incident.getSeverity()));
        body.put("status", incident.getStatus().name().toLowerCase());
        body.put("alertCount", incident.getAlertCount());
        body.put("createdAt", incident.getCreatedAt().toString());
        return body;
    }

    private static OutboundNotification outbound(
            NotificationChannelType type, String url, Map<String, Object> payload, Map<String, String> headers) {
        return OutboundNotification.builder()
                .channelType(type)
                .url(url)
                .payload(payload)
                .headers(headers)
                .build();
    }

    static List<String> parseRecipients(String recipients) {
        if (recipients == null) {
            return List.of();
        }
        return Arrays.stream(recipients.split(","))
                .map(String::trim)
                .filter(r -> !r.isEmpty())
                .toList();
    }

    private static String severityLabel(Alert alert) {
        return alert.getSeverity().name();
    }

    private static String severityCode(AlertSeverity severity) {
        return severity.name().toLowerCase();
    }

    private static String severityColor(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> "#FF0000";
            case ERROR -> "#FF6600";
            case WARNING -> "#FFCC00";
            case INFO -> "#0066FF";
        };
    }
}
