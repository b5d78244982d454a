package com.intervista.core.adaptation;

/**
 * Closed interval a tunable parameter must stay in.
 */
public record ParameterBounds(double min, double max) {

    public ParameterBounds {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
