package com.intervista.core.analyzer;

/**
 * The analyzer was handed parameters it cannot work with. Retrying cannot help, so the task fails
 * permanently.
 */
public class InvalidParamsException extends AnalyzerException {
    public InvalidParamsException(String message) {
        super(message, false);
    }
}
