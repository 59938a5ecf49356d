package com.alertengine.api.dto.response;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.ConditionOperator;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for an alert rule. Channel configuration is not exposed since it
 * carries webhook URLs and routing keys.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleResponse {

    private String id;
    private String name;
    private String description;
    private String category;
    private AlertSeverity severity;
    private String metric;
    private ConditionOperator operator;
    private String threshold;
    private Duration timeWindow;
    private Integer consecutiveFailures;
    private boolean enabled;
    private Duration cooldownPeriod;
    private Duration escalationDelay;
    private int channelCount;
    private Instant lastFiredAt;
}
