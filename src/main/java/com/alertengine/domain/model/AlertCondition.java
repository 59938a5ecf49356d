package com.alertengine.domain.model;

import com.alertengine.domain.enums.ConditionOperator;
import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The threshold test attached to an {@link AlertRule}.
 *
 * <p>The threshold is kept as configured text. Numeric operators parse it as a number at
 * evaluation time (registration rejects thresholds that do not parse); categorical
 * operators use it verbatim.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertCondition {

    private String metric;
    private ConditionOperator operator;
    private String threshold;

    /** Trailing window considered when looking at recent samples. */
    private Duration timeWindow;

    /** Number of most recent samples in the window that must all pass (null or 1 = latest only). */
    private Integer consecutiveFailures;

    public boolean requiresSustainedBreach() {
        return consecutiveFailures != null && consecutiveFailures > 1;
    }
}
