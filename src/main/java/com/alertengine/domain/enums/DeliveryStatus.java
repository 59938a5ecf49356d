package com.alertengine.domain.enums;

/**
 * Outcome of a single channel delivery attempt.
 */
public enum DeliveryStatus {
    DELIVERED,
    FAILED,
    /** Channel lacked the configuration needed to deliver (URL, recipients, routing key). */
    SKIPPED
}
