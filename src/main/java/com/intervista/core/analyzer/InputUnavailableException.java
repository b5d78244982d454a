package com.intervista.core.analyzer;

/**
 * The submission lacks what the analyzer needs. The task is skipped, not retried.
 */
public class InputUnavailableException extends AnalyzerException {
    public InputUnavailableException(String message) {
        super(message, false);
    }
}
