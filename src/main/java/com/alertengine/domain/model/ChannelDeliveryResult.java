package com.alertengine.domain.model;

import com.alertengine.domain.enums.DeliveryStatus;
import com.alertengine.domain.enums.NotificationChannelType;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Settled outcome of one channel delivery attempt for one alert.
 */
@Getter
@Builder
@ToString
public class ChannelDeliveryResult {

    private final NotificationChannelType channelType;
    private final String alertId;
    private final DeliveryStatus status;
    private final String error;
    private final Duration elapsed;

    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }
}
