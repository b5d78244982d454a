package com.intervista.core.adaptation;

import com.intervista.core.model.Modality;
import com.intervista.core.model.ModalityStatus;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.state.GraphState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rolling window of per-session performance samples.
 * <p>
 * Metrics: {@code <modality>.latency_ms}, {@code <modality>.confidence}, {@code <modality>.score},
 * {@code overall_score} and {@code degraded_ratio} (share of planned modalities that ended DEGRADED).
 */
@Component
public class PerformanceMonitor {

    public static final String OVERALL_SCORE = "overall_score";
    public static final String DEGRADED_RATIO = "degraded_ratio";

    private final int windowSize;
    private final Map<String, Deque<Double>> windows = new HashMap<>();
    private long samplesRecorded;

    public PerformanceMonitor(AdaptationProperties properties) {
        this.windowSize = properties.getWindowSize();
    }

    public static String metric(Modality modality, String name) {
        return modality.key() + "." + name;
    }

    /** Records the samples of a finished session. */
    public void recordSession(GraphState state) {
        for (Task task : state.taskState().ordered()) {
            Modality modality = task.modality();
            if (modality == null) continue;
            if (task.startedAt() != null && task.finishedAt() != null) {
                record(metric(modality, "latency_ms"),
                        Duration.between(task.startedAt(), task.finishedAt()).toMillis());
            }
            if (task.status() == TaskStatus.SUCCEEDED) {
                state.analysisState().result(modality).ifPresent(result -> {
                    record(metric(modality, "confidence"), result.confidence());
                    record(metric(modality, "score"), result.overallScore());
                });
            }
        }
        var feedback = state.feedback();
        if (feedback.overallScore() != null) {
            record(OVERALL_SCORE, feedback.overallScore());
        }
        if (!feedback.modalityStatus().isEmpty()) {
            long degraded = feedback.modalityStatus().values().stream()
                    .filter(s -> s == ModalityStatus.DEGRADED).count();
            record(DEGRADED_RATIO, (double) degraded / feedback.modalityStatus().size());
        }
    }

    public synchronized void record(String metric, double value) {
        var window = windows.computeIfAbsent(metric, k -> new ArrayDeque<>());
        window.addLast(value);
        samplesRecorded++;
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    /** Statistics of every metric with at least one sample. */
    public synchronized Map<String, WindowStats> snapshot() {
        var stats = new TreeMap<String, WindowStats>();
        windows.forEach((metric, window) -> {
            if (!window.isEmpty()) stats.put(metric, WindowStats.of(window));
        });
        return stats;
    }

    /** Samples recorded since start; grows by one per {@link #record} call. */
    public synchronized long sampleCount() {
        return samplesRecorded;
    }

    public synchronized void reset() {
        windows.clear();
    }
}
