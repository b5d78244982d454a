package com.intervista.core.adaptation;

import java.util.Comparator;

/**
 * Moves one parameter by {@code delta} when its condition holds.
 *
 * @param name      unique rule name
 * @param priority  higher is evaluated first
 * @param order     declaration order, breaks priority ties
 * @param condition trigger
 * @param parameter adjusted parameter
 * @param delta     requested change before clamping
 */
public record AdaptationRule(
    String name,
    int priority,
    int order,
    RuleCondition condition,
    String parameter,
    double delta
) {

    public static final Comparator<AdaptationRule> EVALUATION_ORDER =
            Comparator.comparingInt(AdaptationRule::priority).reversed()
                    .thenComparingInt(AdaptationRule::order);

    public static AdaptationRule from(AdaptationProperties.RuleSpec spec, int order) {
        var condition = new ThresholdCondition(spec.getMetric(), spec.getStatistic(), spec.getComparison(),
                spec.getThreshold(), spec.getConsecutiveWindows());
        return new AdaptationRule(spec.getName(), spec.getPriority(), order, condition,
                spec.getParameter(), spec.getDelta());
    }
}
