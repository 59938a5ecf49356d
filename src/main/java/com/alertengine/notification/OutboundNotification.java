package com.alertengine.notification;

import com.alertengine.domain.enums.NotificationChannelType;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A channel-specific request ready to be handed to a {@link NotificationTransport}.
 */
@Getter
@Builder
@ToString(exclude = "payload")
public class OutboundNotification {

    private final NotificationChannelType channelType;
    private final String url;
    private final Map<String, Object> payload;

    @Builder.Default
    private final Map<String, String> headers = Map.of();
}
