package com.intervista.core.adaptation;

import java.util.Collection;

/**
 * Summary of one metric over the current rolling window.
 */
public record WindowStats(double mean, double p95, int count) {

    public static WindowStats of(Collection<Double> samples) {
        if (samples.isEmpty()) {
            return new WindowStats(0.0, 0.0, 0);
        }
        double[] sorted = samples.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double mean = 0.0;
        for (double v : sorted) mean += v;
        mean /= sorted.length;
        // nearest rank
        int rank = (int) Math.ceil(0.95 * sorted.length);
        return new WindowStats(mean, sorted[Math.max(0, rank - 1)], sorted.length);
    }
}
