package com.alertengine.exception;

import java.util.Map;

/**
 * Raised when a rule condition cannot be evaluated against a sample.
 * The rule engine catches this per rule; it never reaches a metric producer.
 */
public class ConditionEvaluationException extends BaseException {

    public ConditionEvaluationException(String metric, String message, Throwable cause) {
        super(ErrorCode.EVALUATION_ERROR, message, Map.of("metric", String.valueOf(metric)), cause);
    }
}
