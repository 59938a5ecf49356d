package com.alertengine.condition;

import com.alertengine.domain.model.AlertCondition;
import com.alertengine.domain.model.MetricSample;
import com.alertengine.exception.ConditionEvaluationException;
import com.alertengine.metric.MetricStore;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides whether a rule condition holds for the latest sample of its metric.
 *
 * <p>Evaluation is two-tier:
 * <ol>
 *   <li>The latest value must pass the operator/threshold test, and the metric must have at
 *       least one sample inside the trailing {@code timeWindow}.</li>
 *   <li>When {@code consecutiveFailures} is greater than one, the last N samples of the window
 *       (by insertion order) must each pass the same test. Fewer than N samples in the window
 *       never fires.</li>
 * </ol>
 * The second tier keeps a single noisy sample from firing a sustained-breach rule.
 */
@Component
public class ConditionEvaluator {

    private final MetricStore metricStore;

    public ConditionEvaluator(MetricStore metricStore) {
        this.metricStore = metricStore;
    }

    public boolean evaluate(AlertCondition condition, double latestValue, Instant latestTimestamp) {
        Instant windowStart = latestTimestamp.minus(condition.getTimeWindow());
        List<MetricSample> windowSamples = metricStore.samplesInWindow(condition.getMetric(), windowStart);

        if (windowSamples.isEmpty()) {
            return false;
        }

        if (!matches(condition, latestValue)) {
            return false;
        }

        if (!condition.requiresSustainedBreach()) {
            return true;
        }

        int required = condition.getConsecutiveFailures();
        if (windowSamples.size() < required) {
            return false;
        }

        List<MetricSample> recent = windowSamples.subList(windowSamples.size() - required, windowSamples.size());
        return recent.stream().allMatch(sample -> matches(condition, sample.getValue()));
    }

    /**
     * Applies the condition's operator to a single value.
     *
     * @throws ConditionEvaluationException if the threshold cannot be interpreted for the operator
     */
    public boolean matches(AlertCondition condition, double value) {
        try {
            return switch (condition.getOperator().getKind()) {
                case NUMERIC -> NumericComparison.test(
                        condition.getOperator(), value, NumericComparison.parseThreshold(condition.getThreshold()));
                case CATEGORICAL -> CategoricalMatch.test(condition.getOperator(), value, condition.getThreshold());
            };
        } catch (RuntimeException e) {
            throw new ConditionEvaluationException(
                    condition.getMetric(),
                    "Cannot evaluate " + condition.getOperator() + " against threshold '" + condition.getThreshold()
                            + "'",
                    e);
        }
    }
}
