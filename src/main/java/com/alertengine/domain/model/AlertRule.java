package com.alertengine.domain.model;

import com.alertengine.domain.enums.AlertSeverity;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Domain model for a threshold rule evaluated against incoming metric samples.
 *
 * <p>A rule reads: IF the condition holds on the named metric THEN raise an alert of the
 * given severity and category, notify the listed channels, and escalate if the alert is
 * still unresolved after {@code escalationDelay}.
 *
 * <p>Rules are supplied once at startup and registered in the RuleRegistry. After
 * registration the only field that changes is {@code enabled}, which is volatile so
 * toggles are visible to evaluating threads without locking.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRule {

    private String id;
    private String name;
    private String description;
    private String category;
    private AlertSeverity severity;
    private AlertCondition condition;

    @Builder.Default
    private volatile boolean enabled = true;

    /** Minimum time between two firings of this rule, measured from the last fire. */
    @Builder.Default
    private Duration cooldownPeriod = Duration.ZERO;

    /** Delay after which an unresolved alert is escalated. Zero disables escalation. */
    @Builder.Default
    private Duration escalationDelay = Duration.ZERO;

    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();

    public boolean hasEscalation() {
        return escalationDelay != null && !escalationDelay.isZero() && !escalationDelay.isNegative();
    }
}
