package com.alertengine.condition;

import com.alertengine.domain.enums.ConditionOperator;
import java.math.BigDecimal;

/**
 * Categorical operators: the text form of the sample value against the threshold text.
 *
 * <p>Status signals are published on the numeric metric channel, so a rule such as
 * {@code database_health contains "unhealthy"} compares the rendered number with the
 * configured text. Integral values render without a fractional part (6.0 becomes "6").
 */
final class CategoricalMatch {

    private CategoricalMatch() {}

    static boolean test(ConditionOperator operator, double value, String threshold) {
        String rendered = render(value);
        return switch (operator) {
            case CONTAINS -> rendered.contains(threshold);
            case NOT_CONTAINS -> !rendered.contains(threshold);
            default -> throw new IllegalArgumentException(operator + " is not a categorical operator");
        };
    }

    static String render(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
