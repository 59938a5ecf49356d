package com.alertengine.domain.enums;

/**
 * Comparison operators for alert rule conditions.
 *
 * <p>GT/LT/GTE/LTE/EQ are numeric comparisons of the latest sample value against the
 * threshold. CONTAINS/NOT_CONTAINS are categorical: they test whether the string form of
 * the value contains the threshold text.
 */
public enum ConditionOperator {
    /** value > threshold. */
    GT(ComparisonKind.NUMERIC),
    /** value < threshold. */
    LT(ComparisonKind.NUMERIC),
    /** value >= threshold. */
    GTE(ComparisonKind.NUMERIC),
    /** value <= threshold. */
    LTE(ComparisonKind.NUMERIC),
    /** value == threshold. */
    EQ(ComparisonKind.NUMERIC),
    /** String form of value contains the threshold text. */
    CONTAINS(ComparisonKind.CATEGORICAL),
    /** String form of value does not contain the threshold text. */
    NOT_CONTAINS(ComparisonKind.CATEGORICAL);

    private final ComparisonKind kind;

    ConditionOperator(ComparisonKind kind) {
        this.kind = kind;
    }

    public ComparisonKind getKind() {
        return kind;
    }

    public boolean isCategorical() {
        return kind == ComparisonKind.CATEGORICAL;
    }
}
