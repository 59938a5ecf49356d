package com.alertengine.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Raised when a rule definition is rejected at registration time.
 * During startup rule loading this prevents the engine from starting; through the REST
 * surface it is answered with 422 and the rule id.
 */
@Getter
public class InvalidRuleException extends BaseException {

    private final String ruleId;
    private final String reason;

    public InvalidRuleException(String ruleId, String reason) {
        super(
                ErrorCode.INVALID_RULE,
                String.format("Invalid alert rule '%s': %s", ruleId, reason),
                Map.of("ruleId", String.valueOf(ruleId), "reason", reason));
        this.ruleId = ruleId;
        this.reason = reason;
    }
}
