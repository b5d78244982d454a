package com.intervista.core.analyzer;

/**
 * Failure reported by an {@link AnalyzerCapability}. The subclass tells the executor what to do
 * with the task: retry it, skip it, or fail it for good.
 */
public class AnalyzerException extends RuntimeException {

    private final boolean retryable;

    public AnalyzerException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public AnalyzerException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
