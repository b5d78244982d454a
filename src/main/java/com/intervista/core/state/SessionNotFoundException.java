package com.intervista.core.state;

/**
 * Thrown when a session (or a requested revision of it) is neither in memory nor in the snapshot store.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }

    public SessionNotFoundException(String sessionId, long revision) {
        super("Revision " + revision + " of session " + sessionId + " not found");
    }
}
