package com.alertengine.condition;

import com.alertengine.domain.enums.ConditionOperator;

/**
 * Numeric operators: the sample value against a parsed numeric threshold.
 */
final class NumericComparison {

    private NumericComparison() {}

    static boolean test(ConditionOperator operator, double value, double threshold) {
        return switch (operator) {
            case GT -> value > threshold;
            case LT -> value < threshold;
            case GTE -> value >= threshold;
            case LTE -> value <= threshold;
            case EQ -> value == threshold;
            default -> throw new IllegalArgumentException(operator + " is not a numeric operator");
        };
    }

    static double parseThreshold(String threshold) {
        return Double.parseDouble(threshold.trim());
    }
}
