package com.alertengine.rule;

import com.alertengine.domain.model.AlertCondition;
import com.alertengine.domain.model.AlertRule;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.exception.InvalidRuleException;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Shape checks applied to every rule before it enters the registry.
 *
 * <p>Anything that would otherwise surface as an evaluation failure on the first matching
 * sample (a numeric operator with a non-numeric threshold, a missing window) is rejected
 * here instead.
 */
@Component
public class RuleValidator {

    public void validate(AlertRule rule) {
        if (rule == null) {
            throw new InvalidRuleException(null, "rule is null");
        }
        String id = rule.getId();
        requireText(id, id, "id is required");
        requireText(id, rule.getName(), "name is required");
        requireText(id, rule.getCategory(), "category is required");
        if (rule.getSeverity() == null) {
            throw new InvalidRuleException(id, "severity is required");
        }
        requireNonNegative(id, rule.getCooldownPeriod(), "cooldownPeriod");
        requireNonNegative(id, rule.getEscalationDelay(), "escalationDelay");

        validateCondition(id, rule.getCondition());

        if (rule.getChannels() != null) {
            for (NotificationChannel channel : rule.getChannels()) {
                if (channel == null || channel.getType() == null) {
                    throw new InvalidRuleException(id, "every notification channel needs a type");
                }
            }
        }
    }

    private void validateCondition(String id, AlertCondition condition) {
        if (condition == null) {
            throw new InvalidRuleException(id, "condition is required");
        }
        requireText(id, condition.getMetric(), "condition.metric is required");
        if (condition.getOperator() == null) {
            throw new InvalidRuleException(id, "condition.operator is required");
        }
        if (condition.getThreshold() == null) {
            throw new InvalidRuleException(id, "condition.threshold is required");
        }
        if (!condition.getOperator().isCategorical()) {
            try {
                Double.parseDouble(condition.getThreshold().trim());
            } catch (NumberFormatException e) {
                throw new InvalidRuleException(
                        id,
                        "operator " + condition.getOperator() + " needs a numeric threshold, got '"
                                + condition.getThreshold() + "'");
            }
        }
        if (condition.getTimeWindow() == null
                || condition.getTimeWindow().isNegative()
                || condition.getTimeWindow().isZero()) {
            throw new InvalidRuleException(id, "condition.timeWindow must be positive");
        }
        if (condition.getConsecutiveFailures() != null && condition.getConsecutiveFailures() < 1) {
            throw new InvalidRuleException(id, "condition.consecutiveFailures must be at least 1");
        }
    }

    private void requireText(String id, String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidRuleException(id, message);
        }
    }

    private void requireNonNegative(String id, Duration duration, String field) {
        if (duration != null && duration.isNegative()) {
            throw new InvalidRuleException(id, field + " must not be negative");
        }
    }
}
