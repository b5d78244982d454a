package com.intervista.core.config;

/**
 * Thrown when configuration loaded at startup is unusable: unknown parameters in rules,
 * inverted bounds, missing analyzer capabilities, non-positive pool sizes.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
