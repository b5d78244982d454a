package com.intervista.core.analyzer;

import java.util.Collection;
import java.util.Map;

final class Scores {

    private Scores() {}

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** 1 inside [low, high], falling linearly to 0 at {@code low - slack} and {@code high + slack}. */
    static double band(double value, double low, double high, double slack) {
        if (value < low) return clamp(1.0 - (low - value) / slack);
        if (value > high) return clamp(1.0 - (value - high) / slack);
        return 1.0;
    }

    static double mean(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double param(Map<String, Double> params, String key, double fallback) {
        Double value = params.get(key);
        return value != null ? value : fallback;
    }

    static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
