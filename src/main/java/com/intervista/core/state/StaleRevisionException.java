package com.intervista.core.state;

/**
 * Concurrency guard of the {@link StateManager}: the mutation was computed against state that
 * has since changed. Callers re-read the session and retry if the mutation still applies.
 */
public class StaleRevisionException extends RuntimeException {

    private final String sessionId;

    public StaleRevisionException(String sessionId, String message) {
        super("Stale mutation for session " + sessionId + ": " + message);
        this.sessionId = sessionId;
    }

    public StaleRevisionException(String sessionId, long expectedRevision, long actualRevision) {
        this(sessionId, "expected revision " + expectedRevision + " but session is at " + actualRevision);
    }

    public String getSessionId() {
        return sessionId;
    }
}
