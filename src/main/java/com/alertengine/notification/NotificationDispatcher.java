package com.alertengine.notification;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.DeliveryStatus;
import com.alertengine.domain.model.Alert;
import com.alertengine.domain.model.ChannelDeliveryResult;
import com.alertengine.domain.model.Incident;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.engine.AlertEngineConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fans an alert out to its notification channels.
 *
 * <p>Every enabled channel is attempted concurrently on the notification executor and each
 * attempt is bounded by {@code alert-engine.notification.timeout}. A failing or slow channel
 * never affects the others: its outcome is settled into a {@link ChannelDeliveryResult} and
 * logged. The future returned by {@link #dispatch} therefore never completes exceptionally.
 * There is no automatic retry.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ChannelPayloadBuilder channelPayloadBuilder;
    private final NotificationTransport notificationTransport;
    private final Executor notificationExecutor;
    private final AlertEngineConfig alertEngineConfig;
    private final Clock clock;

    public NotificationDispatcher(
            ChannelPayloadBuilder channelPayloadBuilder,
            NotificationTransport notificationTransport,
            @Qualifier("notificationExecutor") Executor notificationExecutor,
            AlertEngineConfig alertEngineConfig,
            Clock clock) {
        this.channelPayloadBuilder = channelPayloadBuilder;
        this.notificationTransport = notificationTransport;
        this.notificationExecutor = notificationExecutor;
        this.alertEngineConfig = alertEngineConfig;
        this.clock = clock;
    }

    /**
     * Delivers the alert to every enabled channel.
     *
     * @param incident incident the alert belongs to, or null
     * @return one settled result per enabled channel, in channel order
     */
    public CompletableFuture<List<ChannelDeliveryResult>> dispatch(
            Alert alert, List<NotificationChannel> channels, Incident incident) {
        if (channels == null || channels.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        long timeoutMs = alertEngineConfig.getNotification().getTimeout().toMillis();
        List<CompletableFuture<ChannelDeliveryResult>> attempts = channels.stream()
                .filter(NotificationChannel::isEnabled)
                .map(channel -> attempt(channel, alert, incident, timeoutMs))
                .toList();

        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> attempts.stream().map(CompletableFuture::join).toList())
                .whenComplete((results, ex) -> logSummary(alert, results));
    }

    /**
     * Sends a test notification through a single channel, synchronously.
     *
     * @return true if the channel accepted the notification
     */
    public boolean testChannel(NotificationChannel channel) {
        Instant now = clock.instant();
        Alert testAlert = Alert.builder()
                .id("test_" + now.toEpochMilli())
                .title("Test Alert")
                .description("This is a test notification from " + alertEngineConfig.getServiceName())
                .severity(AlertSeverity.INFO)
                .category("system_health")
                .source("NotificationDispatcher")
                .timestamp(now)
                .metadata(Map.of("test", true))
                .build();

        ChannelDeliveryResult result = deliver(channel, testAlert, null);
        if (result.isDelivered()) {
            log.info("Channel test successful: {}", channel.getType());
        } else {
            log.error("Channel test failed: {} ({})", channel.getType(), result.getError());
        }
        return result.isDelivered();
    }

    private CompletableFuture<ChannelDeliveryResult> attempt(
            NotificationChannel channel, Alert alert, Incident incident, long timeoutMs) {
        Instant start = clock.instant();
        return CompletableFuture.supplyAsync(() -> deliver(channel, alert, incident), notificationExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    String error = cause instanceof TimeoutException
                            ? "timed out after " + timeoutMs + "ms"
                            : cause.getMessage();
                    log.error("Failed to send {} notification for alert {}: {}", channel.getType(), alert.getId(), error);
                    return result(channel, alert, DeliveryStatus.FAILED, error, start);
                });
    }

    private ChannelDeliveryResult deliver(NotificationChannel channel, Alert alert, Incident incident) {
        Instant start = clock.instant();
        try {
            Optional<OutboundNotification> notification = channelPayloadBuilder.build(channel, alert, incident);
            if (notification.isEmpty()) {
                return result(channel, alert, DeliveryStatus.SKIPPED, "channel not configured", start);
            }
            notificationTransport.send(notification.get());
            log.debug("{} notification sent for alert {}", channel.getType(), alert.getId());
            return result(channel, alert, DeliveryStatus.DELIVERED, null, start);
        } catch (Exception e) {
            log.error("Failed to send {} notification for alert {}: {}", channel.getType(), alert.getId(), e.getMessage());
            return result(channel, alert, DeliveryStatus.FAILED, e.getMessage(), start);
        }
    }

    private ChannelDeliveryResult result(
            NotificationChannel channel, Alert alert, DeliveryStatus status, String error, Instant start) {
        return ChannelDeliveryResult.builder()
                .channelType(channel.getType())
                .alertId(alert.getId())
                .status(status)
                .error(error)
                .elapsed(Duration.between(start, clock.instant()))
                .build();
    }

    private void logSummary(Alert alert, List<ChannelDeliveryResult> results) {
        if (results == null || results.isEmpty()) {
            return;
        }
        long delivered = results.stream().filter(ChannelDeliveryResult::isDelivered).count();
        log.info("Notifications for alert {}: {}/{} channels delivered", alert.getId(), delivered, results.size());
    }
}
