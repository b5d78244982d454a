package com.intervista.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an individual task within a session.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,   // input unavailable, or an upstream dependency can never succeed
    CANCELLED;

    /**
     * Statuses reachable from this one. FAILED -> PENDING is further gated on the attempt count,
     * see {@link Task#transitionTo}.
     */
    public Set<TaskStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, SKIPPED, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED, SKIPPED, CANCELLED);
            case FAILED -> EnumSet.of(PENDING);
            case SUCCEEDED, SKIPPED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        return successors().contains(target);
    }
}
