package com.intervista.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single unit of analysis work within a session.
 *
 * @param id           unique identifier within the session (e.g. "IVST-2026-1a2b3c4d-SPEECH_ANALYSIS")
 * @param type         what the task does
 * @param priority     dispatch priority
 * @param status       current execution status
 * @param inputRef     key of the submission the task reads from
 * @param inputParams  analyzer parameters, frozen when the task is created
 * @param bestEffort   when true the task becomes ready once its dependencies are terminal,
 *                     whether or not they succeeded
 * @param sequence     creation order within the session, assigned by {@code TaskState}
 * @param createdAt    creation time
 * @param startedAt    start of the latest attempt
 * @param finishedAt   end of the latest attempt
 * @param retryAt      earliest time a retried task may be dispatched again (nullable)
 * @param attemptCount number of failed attempts so far
 * @param maxAttempts  attempts allowed before a failure becomes permanent
 * @param lastError    message of the most recent failure (nullable)
 */
public record Task(
    String id,
    TaskType type,
    TaskPriority priority,
    TaskStatus status,
    String inputRef,
    Map<String, Double> inputParams,
    boolean bestEffort,
    long sequence,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    Instant retryAt,
    int attemptCount,
    int maxAttempts,
    String lastError
) implements Serializable {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(status, "status");
        inputParams = inputParams == null ? Map.of() : Map.copyOf(inputParams);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 for task " + id);
        }
    }

    /**
     * Creates a new PENDING task. The sequence is assigned when the task is added to a {@code TaskState}.
     */
    public static Task pending(String id, TaskType type, TaskPriority priority, String inputRef,
                               Map<String, Double> inputParams, boolean bestEffort,
                               int maxAttempts, Instant createdAt) {
        return new Task(id, type, priority, TaskStatus.PENDING, inputRef, inputParams, bestEffort,
                0L, createdAt, null, null, null, 0, maxAttempts, null);
    }

    /** Modality analyzed by this task, or {@code null} for INTEGRATION and FEEDBACK. */
    public Modality modality() {
        return type.modality();
    }

    /**
     * True once the task will never run again: SUCCEEDED, SKIPPED, CANCELLED, or FAILED with
     * its attempts exhausted.
     */
    @JsonIgnore
    public boolean isTerminal() {
        return switch (status) {
            case SUCCEEDED, SKIPPED, CANCELLED -> true;
            case FAILED -> attemptCount >= maxAttempts;
            case PENDING, RUNNING -> false;
        };
    }

    @JsonIgnore
    public boolean isRetryable() {
        return status == TaskStatus.FAILED && attemptCount < maxAttempts;
    }

    public Task withSequence(long newSequence) {
        return new Task(id, type, priority, status, inputRef, inputParams, bestEffort, newSequence,
                createdAt, startedAt, finishedAt, retryAt, attemptCount, maxAttempts, lastError);
    }

    /**
     * Returns a copy of this task moved to {@code target}, recording timestamps, attempts and errors.
     *
     * @param target        the new status
     * @param now           transition time
     * @param error         failure message (used for FAILED and SKIPPED)
     * @param retryAt       backoff eligibility time (used for FAILED -> PENDING)
     * @param exhaustRetries when moving to FAILED, marks the failure permanent regardless of attempts left
     * @throws IllegalTaskTransitionException if the transition is not legal
     */
    public Task transitionTo(TaskStatus target, Instant now, String error, Instant retryAt, boolean exhaustRetries) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalTaskTransitionException(id, status, target, null);
        }
        if (status == TaskStatus.FAILED && !isRetryable()) {
            throw new IllegalTaskTransitionException(id, status, target,
                    "attempts exhausted (" + attemptCount + "/" + maxAttempts + ")");
        }
        return switch (target) {
            case RUNNING -> new Task(id, type, priority, target, inputRef, inputParams, bestEffort, sequence,
                    createdAt, now, null, null, attemptCount, maxAttempts, lastError);
            case SUCCEEDED -> new Task(id, type, priority, target, inputRef, inputParams, bestEffort, sequence,
                    createdAt, startedAt, now, null, attemptCount, maxAttempts, lastError);
            case FAILED -> new Task(id, type, priority, target, inputRef, inputParams, bestEffort, sequence,
                    createdAt, startedAt, now, null,
                    exhaustRetries ? Math.max(attemptCount + 1, maxAttempts) : attemptCount + 1,
                    maxAttempts, error);
            case PENDING -> new Task(id, type, priority, target, inputRef, inputParams, bestEffort, sequence,
                    createdAt, null, null, retryAt, attemptCount, maxAttempts, lastError);
            case SKIPPED, CANCELLED -> new Task(id, type, priority, target, inputRef, inputParams, bestEffort,
                    sequence, createdAt, startedAt, now, null, attemptCount, maxAttempts,
                    error != null ? error : lastError);
        };
    }
}
