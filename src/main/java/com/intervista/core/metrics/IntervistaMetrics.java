package com.intervista.core.metrics;

import com.intervista.core.model.SessionStatus;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session execution, persistence and adaptation.
 */
@Service
public class IntervistaMetrics {

    private final MeterRegistry registry;

    public IntervistaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskDuration(TaskType type, long ms) {
        Timer.builder("intervista.task.duration")
                .tag("type", type.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts how task attempts ended. A retried failure counts once per attempt.
     */
    public void recordTaskOutcome(TaskType type, TaskStatus status) {
        Counter.builder("intervista.task.outcomes")
                .tag("type", type.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordRetry(TaskType type) {
        Counter.builder("intervista.task.retries")
                .description("Failed attempts re-queued with backoff")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordTimeout(TaskType type) {
        Counter.builder("intervista.task.timeouts")
                .description("Attempts forcibly cancelled at their deadline")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordSessionResult(SessionStatus status, long ms) {
        Counter.builder("intervista.sessions.total")
                .tag("status", status.name())
                .register(registry)
                .increment();
        Timer.builder("intervista.session.duration")
                .tag("status", status.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    // --- Adaptation ---

    public void recordAdaptationEvent(String ruleName) {
        Counter.builder("intervista.adaptation.events")
                .description("Parameter adjustments applied by adaptation rules")
                .tag("rule", ruleName)
                .register(registry)
                .increment();
    }

    public void recordRuleError(String ruleName) {
        Counter.builder("intervista.adaptation.rule_errors")
                .description("Rule evaluations skipped because of an error")
                .tag("rule", ruleName)
                .register(registry)
                .increment();
    }

    // --- Persistence ---

    public void recordSnapshotWritten(boolean success) {
        Counter.builder("intervista.snapshots.written")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
