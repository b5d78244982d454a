package com.intervista.core.model;

/**
 * Overall status of a session, derived from its tasks.
 */
public enum SessionStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,    // completed, but at least one planned modality was skipped or failed
    FAILED,
    CANCELLED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
