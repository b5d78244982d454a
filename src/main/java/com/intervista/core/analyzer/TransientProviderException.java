package com.intervista.core.analyzer;

/**
 * A provider failure that may go away on its own (timeouts, throttling, connection resets).
 */
public class TransientProviderException extends AnalyzerException {
    public TransientProviderException(String message) {
        super(message, true);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
