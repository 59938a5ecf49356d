package com.alertengine.exception;

import com.alertengine.domain.enums.NotificationChannelType;
import java.util.Map;

/**
 * Raised by a notification transport when a channel endpoint rejects or fails a delivery.
 */
public class NotificationDeliveryException extends BaseException {

    public NotificationDeliveryException(NotificationChannelType channelType, String message) {
        super(ErrorCode.DELIVERY_ERROR, message, Map.of("channel", String.valueOf(channelType)));
    }

    public NotificationDeliveryException(NotificationChannelType channelType, String message, Throwable cause) {
        super(ErrorCode.DELIVERY_ERROR, message, Map.of("channel", String.valueOf(channelType)), cause);
    }
}
