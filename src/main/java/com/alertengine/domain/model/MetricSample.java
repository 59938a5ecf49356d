package com.alertengine.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A single observation of a named metric. Immutable once recorded.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class MetricSample {

    private final String metric;
    private final double value;
    private final Instant timestamp;
}
