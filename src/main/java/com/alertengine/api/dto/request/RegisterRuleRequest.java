package com.alertengine.api.dto.request;

import com.alertengine.domain.enums.AlertSeverity;
import com.alertengine.domain.enums.ConditionOperator;
import com.alertengine.domain.model.NotificationChannel;
import java.time.Duration;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering or replacing a rule at runtime.
 *
 * <p>Shape checks are the same as for configured rules and happen at registration; a
 * rejected rule is answered with {@code INVALID_RULE} and the offending rule id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRuleRequest {

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

    private Boolean enabled;
    private Duration cooldownPeriod;
    private Duration escalationDelay;
    private List<NotificationChannel> channels;
}
