package com.intervista.core.analyzer;

/**
 * The attempt ran past its deadline. Treated like any other transient failure.
 */
public class DeadlineExceededException extends TransientProviderException {
    public DeadlineExceededException(String message) {
        super(message);
    }
}
