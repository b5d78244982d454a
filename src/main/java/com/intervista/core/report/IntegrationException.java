package com.intervista.core.report;

/**
 * Results cannot be integrated, typically because no modality produced a result. Not retryable.
 */
public class IntegrationException extends RuntimeException {
    public IntegrationException(String message) {
        super(message);
    }
}
