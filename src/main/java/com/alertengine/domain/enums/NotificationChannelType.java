package com.alertengine.domain.enums;

/**
 * Delivery channels for alert notifications.
 * SLACK and EMAIL are chat-style, PAGERDUTY is the paging channel, WEBHOOK is a generic
 * JSON POST to an arbitrary endpoint.
 */
public enum NotificationChannelType {
    SLACK,
    EMAIL,
    WEBHOOK,
    PAGERDUTY
}
