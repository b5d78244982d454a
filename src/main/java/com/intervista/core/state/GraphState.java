package com.intervista.core.state;

import com.intervista.core.model.Modality;
import com.intervista.core.model.SessionStatus;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.UserContext;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Session-scoped aggregate: the single unit of mutation, persistence and rollback.
 * <p>
 * Instances are immutable; the {@link StateManager} installs a new one per applied mutation.
 * Feedback is derived on demand via {@link #feedback()} and is not part of the persisted form.
 *
 * @param sessionId     the session
 * @param userContext   read-only caller context (null for the global parameters pseudo-session)
 * @param taskState     tasks and dependencies
 * @param analysisState collected results
 * @param parameters    parameters in effect: frozen global values for a session, the live values
 *                      for the global pseudo-session
 * @param revision      number of mutations applied since creation
 * @param createdAt     session creation time
 * @param updatedAt     time of the latest mutation
 */
public record GraphState(
    String sessionId,
    UserContext userContext,
    TaskState taskState,
    AnalysisState analysisState,
    Map<String, Double> parameters,
    long revision,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public GraphState {
        Objects.requireNonNull(sessionId, "sessionId");
        taskState = taskState == null ? TaskState.empty() : taskState;
        analysisState = analysisState == null ? AnalysisState.empty() : analysisState;
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static GraphState initial(String sessionId, UserContext userContext,
                                     Map<String, Double> parameters, Instant now) {
        return new GraphState(sessionId, userContext, TaskState.empty(), AnalysisState.empty(),
                parameters, 0L, now, now);
    }

    public GraphState withTaskState(TaskState newTaskState) {
        return new GraphState(sessionId, userContext, newTaskState, analysisState, parameters,
                revision, createdAt, updatedAt);
    }

    public GraphState withAnalysisState(AnalysisState newAnalysisState) {
        return new GraphState(sessionId, userContext, taskState, newAnalysisState, parameters,
                revision, createdAt, updatedAt);
    }

    public GraphState withParameters(Map<String, Double> newParameters) {
        return new GraphState(sessionId, userContext, taskState, analysisState, newParameters,
                revision, createdAt, updatedAt);
    }

    GraphState withRevision(long newRevision, Instant now) {
        return new GraphState(sessionId, userContext, taskState, analysisState, parameters,
                newRevision, createdAt, now);
    }

    /** Adds each delta to the current value (missing parameters start from zero). */
    public GraphState plusParameterDeltas(Map<String, Double> deltas) {
        var updated = new HashMap<>(parameters);
        deltas.forEach((name, delta) -> updated.merge(name, delta, Double::sum));
        return withParameters(updated);
    }

    public FeedbackState feedback() {
        return FeedbackState.derive(this);
    }

    /**
     * CANCELLED if anything was cancelled, RUNNING while any task can still run, FAILED when no
     * modality succeeded or INTEGRATION/FEEDBACK did not succeed, PARTIAL when some modality is
     * degraded, COMPLETED otherwise.
     */
    public SessionStatus sessionStatus() {
        List<Task> tasks = taskState.ordered();
        if (tasks.stream().anyMatch(t -> t.status() == TaskStatus.CANCELLED)) {
            return SessionStatus.CANCELLED;
        }
        if (tasks.isEmpty() || taskState.hasUnfinishedTasks()) {
            return SessionStatus.RUNNING;
        }
        var modalityTasks = tasks.stream().filter(t -> t.type().isModality()).toList();
        boolean anyModalitySucceeded = modalityTasks.stream().anyMatch(t -> t.status() == TaskStatus.SUCCEEDED);
        boolean structuralFailure = tasks.stream()
                .filter(t -> !t.type().isModality())
                .anyMatch(t -> t.status() != TaskStatus.SUCCEEDED);
        if (!anyModalitySucceeded || structuralFailure) {
            return SessionStatus.FAILED;
        }
        boolean degraded = modalityTasks.stream().anyMatch(t -> t.status() != TaskStatus.SUCCEEDED);
        return degraded ? SessionStatus.PARTIAL : SessionStatus.COMPLETED;
    }

    public double parameter(String name, double fallback) {
        return parameters.getOrDefault(name, fallback);
    }

    public boolean hasModality(Modality modality) {
        return taskState.tasks().values().stream().anyMatch(t -> t.modality() == modality);
    }
}
