package com.intervista.core.state;

import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A change to a session's {@link GraphState}. Mutations are pure: they compute a new state from the
 * previous one and never touch anything else. The {@link StateManager} assigns the revision.
 */
public interface StateMutation {

    GraphState applyTo(GraphState state, Instant now);

    /** Short name for logs. */
    default String describe() {
        return getClass().getSimpleName();
    }

    /** Inserts tasks with their dependencies, all or nothing. */
    record AddTask(List<TaskNode> nodes) implements StateMutation {

        public AddTask {
            nodes = List.copyOf(nodes);
        }

        public static AddTask of(Task task, String... dependsOn) {
            return new AddTask(List.of(TaskNode.of(task, dependsOn)));
        }

        @Override
        public GraphState applyTo(GraphState state, Instant now) {
            return state.withTaskState(state.taskState().addAll(nodes));
        }

        @Override
        public String describe() {
            return "AddTask" + nodes.stream().map(n -> n.task().id()).toList();
        }
    }

    /**
     * Moves a task from {@code expected} to {@code target}. Acts as a compare-and-set: if the task is
     * no longer in {@code expected} the mutation is rejected with {@link StaleRevisionException}.
     */
    record TransitionTask(
        String taskId,
        TaskStatus expected,
        TaskStatus target,
        String error,
        Instant retryAt,
        boolean exhaustRetries
    ) implements StateMutation {

        public TransitionTask {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(expected, "expected");
            Objects.requireNonNull(target, "target");
        }

        public static TransitionTask start(String taskId) {
            return new TransitionTask(taskId, TaskStatus.PENDING, TaskStatus.RUNNING, null, null, false);
        }

        public static TransitionTask succeed(String taskId) {
            return new TransitionTask(taskId, TaskStatus.RUNNING, TaskStatus.SUCCEEDED, null, null, false);
        }

        public static TransitionTask fail(String taskId, String error) {
            return new TransitionTask(taskId, TaskStatus.RUNNING, TaskStatus.FAILED, error, null, false);
        }

        public static TransitionTask failPermanently(String taskId, String error) {
            return new TransitionTask(taskId, TaskStatus.RUNNING, TaskStatus.FAILED, error, null, true);
        }

        public static TransitionTask requeue(String taskId, Instant retryAt) {
            return new TransitionTask(taskId, TaskStatus.FAILED, TaskStatus.PENDING, null, retryAt, false);
        }

        public static TransitionTask skip(String taskId, TaskStatus expected, String reason) {
            return new TransitionTask(taskId, expected, TaskStatus.SKIPPED, reason, null, false);
        }

        public static TransitionTask cancel(String taskId, TaskStatus expected) {
            return new TransitionTask(taskId, expected, TaskStatus.CANCELLED, "session cancelled", null, false);
        }

        @Override
        public GraphState applyTo(GraphState state, Instant now) {
            Task current = state.taskState().require(taskId);
            if (current.status() != expected) {
                throw new StaleRevisionException(state.sessionId(),
                        "Task " + taskId + " is " + current.status() + ", expected " + expected);
            }
            Task updated = current.transitionTo(target, now, error, retryAt, exhaustRetries);
            return state.withTaskState(state.taskState().withTask(updated));
        }

        @Override
        public String describe() {
            return "TransitionTask[" + taskId + " " + expected + "->" + target + "]";
        }
    }

    /** Stores a result for its modality. Only the RUNNING task that produced it may record it. */
    record RecordResult(AnalysisResult result) implements StateMutation {

        public RecordResult {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public GraphState applyTo(GraphState state, Instant now) {
            Task producer = state.taskState().require(result.taskId());
            if (producer.status() != TaskStatus.RUNNING) {
                throw new StaleRevisionException(state.sessionId(),
                        "Result for task " + producer.id() + " arrived while task is " + producer.status());
            }
            return state.withAnalysisState(state.analysisState().with(result));
        }

        @Override
        public String describe() {
            return "RecordResult[" + result.taskId() + "]";
        }
    }

    /** Stores the integrated score computed by the RUNNING integration task {@code taskId}. */
    record RecordIntegration(String taskId, IntegratedScore score) implements StateMutation {

        public RecordIntegration {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(score, "score");
        }

        @Override
        public GraphState applyTo(GraphState state, Instant now) {
            Task producer = state.taskState().require(taskId);
            if (producer.type() != TaskType.INTEGRATION || producer.status() != TaskStatus.RUNNING) {
                throw new StaleRevisionException(state.sessionId(),
                        "Integrated score from " + producer.type() + " task " + taskId + " while it is " + producer.status());
            }
            return state.withAnalysisState(state.analysisState().withIntegration(score));
        }

        @Override
        public String describe() {
            return "RecordIntegration[" + taskId + "]";
        }
    }

    /** Adds deltas to the state's parameters. Bounds are the caller's concern. */
    record AdjustParams(Map<String, Double> deltas) implements StateMutation {

        public AdjustParams {
            deltas = Map.copyOf(deltas);
        }

        @Override
        public GraphState applyTo(GraphState state, Instant now) {
            return state.plusParameterDeltas(deltas);
        }

        @Override
        public String describe() {
            return "AdjustParams" + deltas;
        }
    }
}
