package com.intervista.core.adaptation;

import java.util.List;
import java.util.Map;

/**
 * Fires when a metric statistic has been on the wrong side of a threshold for the last
 * {@code consecutiveWindows} cycles. A cycle without samples for the metric breaks the streak.
 */
public record ThresholdCondition(
    String metric,
    Statistic statistic,
    Comparison comparison,
    double threshold,
    int consecutiveWindows
) implements RuleCondition {

    public enum Statistic { MEAN, P95 }

    public enum Comparison { ABOVE, BELOW }

    public ThresholdCondition {
        if (consecutiveWindows < 1) {
            throw new IllegalArgumentException("consecutiveWindows must be >= 1");
        }
    }

    @Override
    public boolean matches(List<Map<String, WindowStats>> history) {
        if (history.size() < consecutiveWindows) {
            return false;
        }
        for (int i = history.size() - consecutiveWindows; i < history.size(); i++) {
            WindowStats stats = history.get(i).get(metric);
            if (stats == null || stats.count() == 0) {
                return false;
            }
            double value = statistic == Statistic.MEAN ? stats.mean() : stats.p95();
            boolean hit = comparison == Comparison.ABOVE ? value > threshold : value < threshold;
            if (!hit) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String describe() {
        return statistic.name().toLowerCase() + "(" + metric + ") " + comparison.name().toLowerCase() + " "
                + threshold + (consecutiveWindows > 1 ? " for " + consecutiveWindows + " windows" : "");
    }
}
