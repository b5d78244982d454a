package com.intervista.core.adaptation;

import com.intervista.core.metrics.IntervistaMetrics;
import com.intervista.core.model.AdaptationEvent;
import com.intervista.core.state.GraphState;
import com.intervista.core.state.SessionNotFoundException;
import com.intervista.core.state.StaleRevisionException;
import com.intervista.core.state.StateManager;
import com.intervista.core.state.StateMutation.AdjustParams;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rule-based feedback loop over the global analyzer parameters.
 * <p>
 * The live parameters are the state of the {@link StateManager#GLOBAL_SESSION_ID} pseudo-session, so
 * every adjustment is a revision that can be rolled back. A cycle runs every {@code cycle-seconds}
 * and after every {@code sessions-per-cycle} completed sessions:
 * <ol>
 *   <li>the monitor's window statistics are appended to a short history, provided new samples arrived
 *   since the previous cycle (an idle cycle does nothing);</li>
 *   <li>rules are evaluated by descending priority, declaration order breaking ties;</li>
 *   <li>the first rule that fires for a parameter claims it, later rules for it are not evaluated;</li>
 *   <li>the delta is clamped to the parameter bounds, recorded as an {@link AdaptationEvent} and applied.</li>
 * </ol>
 * Sessions already running keep the parameters they were planned with. Besides the rules configured
 * under {@code intervista.adaptation.rules}, any {@link AdaptationRule} bean is evaluated too; those
 * follow the configured rules in declaration order.
 */
@Service
public class AdaptationEngine {

    private static final Logger log = LoggerFactory.getLogger(AdaptationEngine.class);

    private final StateManager stateManager;
    private final PerformanceMonitor monitor;
    private final AdaptationProperties properties;
    private final IntervistaMetrics metrics;
    private final Clock clock;

    private final Map<String, ParameterBounds> bounds = new LinkedHashMap<>();
    private final List<AdaptationRule> rules = new ArrayList<>();
    private final Deque<Map<String, WindowStats>> statsHistory = new ArrayDeque<>();
    private final Deque<Long> adjustmentBaselines = new ArrayDeque<>();
    private final AdaptationEventLog eventLog;
    private final AtomicLong completedSessions = new AtomicLong();
    private final List<AdaptationRule> additionalRules;
    private long samplesAtLastCycle;

    private final ScheduledExecutorService cycleScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "adaptation-cycle");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public AdaptationEngine(StateManager stateManager, PerformanceMonitor monitor, AdaptationProperties properties,
                            IntervistaMetrics metrics, Clock clock, ObjectProvider<AdaptationRule> ruleBeans) {
        this(stateManager, monitor, properties, metrics, clock, ruleBeans.orderedStream().toList());
    }

    public AdaptationEngine(StateManager stateManager, PerformanceMonitor monitor, AdaptationProperties properties,
                            IntervistaMetrics metrics, Clock clock) {
        this(stateManager, monitor, properties, metrics, clock, List.of());
    }

    public AdaptationEngine(StateManager stateManager, PerformanceMonitor monitor, AdaptationProperties properties,
                            IntervistaMetrics metrics, Clock clock, List<AdaptationRule> additionalRules) {
        this.additionalRules = List.copyOf(additionalRules);
        this.stateManager = stateManager;
        this.monitor = monitor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.eventLog = new AdaptationEventLog(properties.getMaxEvents());
    }

    @PostConstruct
    void start() {
        initialize();
        if (properties.isEnabled() && properties.getCycleSeconds() > 0) {
            cycleScheduler.scheduleAtFixedRate(this::scheduledCycle,
                    properties.getCycleSeconds(), properties.getCycleSeconds(), TimeUnit.SECONDS);
            log.info("Adaptation cycle scheduled every {}s or {} sessions",
                    properties.getCycleSeconds(), properties.getSessionsPerCycle());
        } else {
            log.info("Adaptation disabled; parameters stay at their configured values");
        }
    }

    @PreDestroy
    void stop() {
        cycleScheduler.shutdownNow();
    }

    /**
     * Compiles bounds and rules and brings up the global parameters: restored from the latest snapshot
     * when one exists, otherwise created from the configured initial values.
     */
    public synchronized void initialize() {
        bounds.clear();
        rules.clear();
        properties.getParameters().forEach((name, spec) -> bounds.put(name, new ParameterBounds(spec.getMin(), spec.getMax())));
        var specs = properties.getRules();
        for (int i = 0; i < specs.size(); i++) {
            rules.add(AdaptationRule.from(specs.get(i), i));
        }
        for (int i = 0; i < additionalRules.size(); i++) {
            var rule = additionalRules.get(i);
            rules.add(new AdaptationRule(rule.name(), rule.priority(), specs.size() + i, rule.condition(),
                    rule.parameter(), rule.delta()));
        }
        rules.sort(AdaptationRule.EVALUATION_ORDER);

        if (stateManager.isLive(StateManager.GLOBAL_SESSION_ID)) {
            return;
        }
        try {
            var restored = stateManager.resume(StateManager.GLOBAL_SESSION_ID);
            log.info("Restored global parameters at revision {}", restored.revision());
        } catch (SessionNotFoundException e) {
            var initial = new HashMap<String, Double>();
            properties.getParameters().forEach((name, spec) -> initial.put(name, spec.getInitial()));
            stateManager.create(StateManager.GLOBAL_SESSION_ID, null, initial);
            log.info("Initialized {} global parameters and {} adaptation rules", initial.size(), rules.size());
        }
    }

    /** Parameters in effect for sessions planned from now on. */
    public Map<String, Double> currentParameters() {
        return stateManager.get(StateManager.GLOBAL_SESSION_ID).parameters();
    }

    public Map<String, ParameterBounds> bounds() {
        return Map.copyOf(bounds);
    }

    public AdaptationEventLog eventLog() {
        return eventLog;
    }

    /**
     * Feeds a finished session into the monitor and triggers a cycle every {@code sessions-per-cycle}
     * sessions. The cycle runs on the adaptation thread, not the caller's.
     */
    public void onSessionCompleted(GraphState finalState) {
        monitor.recordSession(finalState);
        long count = completedSessions.incrementAndGet();
        if (properties.isEnabled() && count % properties.getSessionsPerCycle() == 0) {
            cycleScheduler.execute(this::scheduledCycle);
        }
    }

    /**
     * Runs one adaptation cycle.
     *
     * @return the events recorded in this cycle, in evaluation order
     */
    public synchronized List<AdaptationEvent> runCycle() {
        long samples = monitor.sampleCount();
        if (samples == samplesAtLastCycle) {
            log.debug("Adaptation cycle skipped: no new samples since the last cycle");
            return List.of();
        }
        var stats = monitor.snapshot();
        if (stats.isEmpty()) {
            log.debug("Adaptation cycle skipped: no samples yet");
            return List.of();
        }
        samplesAtLastCycle = samples;
        statsHistory.addLast(stats);
        while (statsHistory.size() > properties.getStatsHistory()) {
            statsHistory.removeFirst();
        }
        var history = List.copyOf(statsHistory);

        Set<String> claimed = new HashSet<>();
        var fired = new ArrayList<AdaptationEvent>();
        for (AdaptationRule rule : rules) {
            if (claimed.contains(rule.parameter())) continue;
            boolean matches;
            try {
                matches = rule.condition().matches(history);
            } catch (RuntimeException e) {
                log.warn("Adaptation rule {} failed to evaluate: {}", rule.name(), e.getMessage(), e);
                metrics.recordRuleError(rule.name());
                continue;
            }
            if (!matches) continue;
            claimed.add(rule.parameter());
            adjust(rule).ifPresent(fired::add);
        }
        if (!fired.isEmpty()) {
            stateManager.flush(StateManager.GLOBAL_SESSION_ID);
            log.info("Adaptation cycle applied {} adjustment(s): {}", fired.size(),
                    fired.stream().map(AdaptationEvent::ruleName).toList());
        }
        return fired;
    }

    /**
     * Undoes the most recent adjustment by rolling the global parameters back to the revision before it.
     *
     * @return the restored global state, or empty when there is nothing to undo
     */
    public synchronized Optional<GraphState> rollbackLastAdjustment() {
        Long baseline = adjustmentBaselines.pollLast();
        if (baseline == null) {
            return Optional.empty();
        }
        var before = stateManager.get(StateManager.GLOBAL_SESSION_ID).parameters();
        var restored = stateManager.rollback(StateManager.GLOBAL_SESSION_ID, baseline);
        var deltas = new HashMap<String, Double>();
        restored.parameters().forEach((name, value) -> {
            double delta = value - before.getOrDefault(name, value);
            if (delta != 0.0) deltas.put(name, delta);
        });
        eventLog.append(new AdaptationEvent(UUID.randomUUID().toString(), clock.instant(), "rollback",
                "manual rollback to revision " + baseline, deltas, StateManager.GLOBAL_SESSION_ID));
        log.info("Rolled back last adaptation: {}", deltas);
        return Optional.of(restored);
    }

    private Optional<AdaptationEvent> adjust(AdaptationRule rule) {
        var global = stateManager.get(StateManager.GLOBAL_SESSION_ID);
        var parameterBounds = bounds.get(rule.parameter());
        double current = global.parameter(rule.parameter(), 0.0);
        double target = parameterBounds != null ? parameterBounds.clamp(current + rule.delta()) : current + rule.delta();
        double applied = target - current;
        if (applied == 0.0) {
            log.debug("Rule {} fired but {} is already at its bound ({})", rule.name(), rule.parameter(), current);
            return Optional.empty();
        }
        try {
            stateManager.apply(StateManager.GLOBAL_SESSION_ID,
                    new AdjustParams(Map.of(rule.parameter(), applied)), global.revision());
        } catch (StaleRevisionException e) {
            log.warn("Rule {} not applied, global parameters changed concurrently", rule.name());
            return Optional.empty();
        }
        adjustmentBaselines.addLast(global.revision());
        while (adjustmentBaselines.size() > properties.getMaxEvents()) {
            adjustmentBaselines.removeFirst();
        }
        var event = new AdaptationEvent(UUID.randomUUID().toString(), clock.instant(), rule.name(),
                rule.condition().describe(), Map.of(rule.parameter(), applied), StateManager.GLOBAL_SESSION_ID);
        eventLog.append(event);
        metrics.recordAdaptationEvent(rule.name());
        log.info("Rule {} moved {} from {} to {}", rule.name(), rule.parameter(), current, target);
        return Optional.of(event);
    }

    private void scheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Adaptation cycle failed", e);
        }
    }
}
