package com.alertengine.domain.enums;

/**
 * How a condition operator interprets its threshold.
 *
 * <p>NUMERIC operators parse the threshold as a number and compare it with the sample value.
 * CATEGORICAL operators compare the text rendering of the sample value against the threshold
 * text, which lets status-like signals ride on the numeric metric channel.
 */
public enum ComparisonKind {
    NUMERIC,
    CATEGORICAL
}
