package com.intervista.core.adaptation;

import com.intervista.core.config.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Binds {@code intervista.adaptation.*}: the tunable analyzer parameters with their bounds, and the
 * rules that move them.
 *
 * <pre>
 * intervista:
 *   adaptation:
 *     enabled: true
 *     cycle-seconds: 300
 *     sessions-per-cycle: 10
 *     parameters:
 *       speech.threshold: { min: 0.5, max: 0.9, initial: 0.7 }
 *     rules:
 *       - name: lower-speech-threshold
 *         metric: speech.confidence
 *         statistic: MEAN
 *         comparison: BELOW
 *         threshold: 0.5
 *         consecutive-windows: 2
 *         parameter: speech.threshold
 *         delta: -0.05
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "intervista.adaptation")
public class AdaptationProperties {

    private static final Pattern METRIC = Pattern.compile(
            "(speech|visual|content)\\.(latency_ms|confidence|score)|overall_score|degraded_ratio");

    private boolean enabled = true;
    private int cycleSeconds = 300;
    private int sessionsPerCycle = 10;
    private int windowSize = 100;
    private int statsHistory = 10;
    private int maxEvents = 1000;
    private Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
    private List<RuleSpec> rules = new ArrayList<>();

    @PostConstruct
    void validate() {
        if (windowSize < 1 || statsHistory < 1 || maxEvents < 1 || sessionsPerCycle < 1 || cycleSeconds < 0) {
            throw new InvalidConfigurationException("intervista.adaptation sizes must be positive (window-size="
                    + windowSize + ", stats-history=" + statsHistory + ", max-events=" + maxEvents
                    + ", sessions-per-cycle=" + sessionsPerCycle + ", cycle-seconds=" + cycleSeconds + ")");
        }
        parameters.forEach((name, spec) -> {
            if (spec.getMin() > spec.getMax()) {
                throw new InvalidConfigurationException("Parameter " + name + " has min " + spec.getMin()
                        + " above max " + spec.getMax());
            }
            if (spec.getInitial() < spec.getMin() || spec.getInitial() > spec.getMax()) {
                throw new InvalidConfigurationException("Parameter " + name + " starts at " + spec.getInitial()
                        + ", outside [" + spec.getMin() + ", " + spec.getMax() + "]");
            }
        });
        for (RuleSpec rule : rules) {
            if (rule.getName() == null || rule.getName().isBlank()) {
                throw new InvalidConfigurationException("Adaptation rule without a name");
            }
            if (!parameters.containsKey(rule.getParameter())) {
                throw new InvalidConfigurationException("Rule " + rule.getName() + " adjusts unknown parameter "
                        + rule.getParameter());
            }
            if (rule.getMetric() == null || !METRIC.matcher(rule.getMetric()).matches()) {
                throw new InvalidConfigurationException("Rule " + rule.getName() + " watches unknown metric "
                        + rule.getMetric());
            }
            if (rule.getConsecutiveWindows() < 1) {
                throw new InvalidConfigurationException("Rule " + rule.getName()
                        + " needs consecutive-windows >= 1");
            }
        }
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getCycleSeconds() { return cycleSeconds; }
    public void setCycleSeconds(int cycleSeconds) { this.cycleSeconds = cycleSeconds; }
    public int getSessionsPerCycle() { return sessionsPerCycle; }
    public void setSessionsPerCycle(int sessionsPerCycle) { this.sessionsPerCycle = sessionsPerCycle; }
    public int getWindowSize() { return windowSize; }
    public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
    public int getStatsHistory() { return statsHistory; }
    public void setStatsHistory(int statsHistory) { this.statsHistory = statsHistory; }
    public int getMaxEvents() { return maxEvents; }
    public void setMaxEvents(int maxEvents) { this.maxEvents = maxEvents; }
    public Map<String, ParameterSpec> getParameters() { return parameters; }
    public void setParameters(Map<String, ParameterSpec> parameters) { this.parameters = parameters; }
    public List<RuleSpec> getRules() { return rules; }
    public void setRules(List<RuleSpec> rules) { this.rules = rules; }

    public static class ParameterSpec {
        private double min;
        private double max;
        private double initial;

        public ParameterSpec() {}

        public ParameterSpec(double min, double max, double initial) {
            this.min = min;
            this.max = max;
            this.initial = initial;
        }

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }
        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }
        public double getInitial() { return initial; }
        public void setInitial(double initial) { this.initial = initial; }
    }

    public static class RuleSpec {
        private String name;
        private int priority = 0;
        private String metric;
        private ThresholdCondition.Statistic statistic = ThresholdCondition.Statistic.MEAN;
        private ThresholdCondition.Comparison comparison = ThresholdCondition.Comparison.ABOVE;
        private double threshold;
        private int consecutiveWindows = 1;
        private String parameter;
        private double delta;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public String getMetric() { return metric; }
        public void setMetric(String metric) { this.metric = metric; }
        public ThresholdCondition.Statistic getStatistic() { return statistic; }
        public void setStatistic(ThresholdCondition.Statistic statistic) { this.statistic = statistic; }
        public ThresholdCondition.Comparison getComparison() { return comparison; }
        public void setComparison(ThresholdCondition.Comparison comparison) { this.comparison = comparison; }
        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public int getConsecutiveWindows() { return consecutiveWindows; }
        public void setConsecutiveWindows(int consecutiveWindows) { this.consecutiveWindows = consecutiveWindows; }
        public String getParameter() { return parameter; }
        public void setParameter(String parameter) { this.parameter = parameter; }
        public double getDelta() { return delta; }
        public void setDelta(double delta) { this.delta = delta; }
    }
}
