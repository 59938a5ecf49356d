package com.alertengine.notification;

import com.alertengine.exception.NotificationDeliveryException;

/**
 * Delivers a built notification to its endpoint.
 */
public interface NotificationTransport {

    /**
     * Sends the notification, blocking until the endpoint answers.
     *
     * @throws NotificationDeliveryException if the endpoint is unreachable or answers with an error
     */
    void send(OutboundNotification notification);
}
