package com.intervista.core.persistence;

/**
 * Raised when a session snapshot cannot be written to, or read from, the checkpoint store.
 */
public class SnapshotPersistenceException extends RuntimeException {
    public SnapshotPersistenceException(String message) {
        super(message);
    }

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
