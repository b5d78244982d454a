package com.intervista.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Progress notification pushed to subscribers of a session: the session was created, one of its
 * tasks changed status, or the session reached a final status.
 *
 * @param kind          what happened
 * @param sessionId     the session
 * @param taskId        the task that changed; null for session events
 * @param status        the task's new status; null for session events
 * @param modality      analyzed modality; null for session events, INTEGRATION and FEEDBACK
 * @param attempt       failed attempts of the task so far; 0 for session events
 * @param error         most recent failure of the task, or null
 * @param sessionStatus session status after the change
 * @param at            when the change was installed
 */
public record ProgressEvent(
    Kind kind,
    String sessionId,
    String taskId,
    TaskStatus status,
    Modality modality,
    int attempt,
    String error,
    SessionStatus sessionStatus,
    Instant at
) implements Serializable {

    public enum Kind { SESSION_CREATED, TASK_CHANGED, SESSION_FINISHED }

    public static ProgressEvent sessionCreated(String sessionId, Instant at) {
        return new ProgressEvent(Kind.SESSION_CREATED, sessionId, null, null, null, 0, null, SessionStatus.RUNNING, at);
    }

    public static ProgressEvent taskChanged(String sessionId, Task task, SessionStatus sessionStatus, Instant at) {
        return new ProgressEvent(Kind.TASK_CHANGED, sessionId, task.id(), task.status(), task.modality(),
                task.attemptCount(), task.lastError(), sessionStatus, at);
    }

    public static ProgressEvent sessionFinished(String sessionId, SessionStatus sessionStatus, Instant at) {
        return new ProgressEvent(Kind.SESSION_FINISHED, sessionId, null, null, null, 0, null, sessionStatus, at);
    }

    public boolean isTaskEvent() {
        return kind == Kind.TASK_CHANGED;
    }
}
