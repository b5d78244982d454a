package com.intervista.core.state;

import com.intervista.core.model.Modality;

import java.util.Map;

/**
 * Names and fallback values of the tunable parameters read by the planner, the analyzers and
 * the report. Actual values come from the global parameters pseudo-session.
 */
public final class AnalysisParameters {

    public static final String THRESHOLD = "threshold";
    public static final String WEIGHT_PREFIX = "integration.weight.";
    public static final double STRENGTH_MARK = 0.8;

    private static final Map<Modality, Double> DEFAULT_THRESHOLDS = Map.of(
            Modality.SPEECH, 0.7,
            Modality.VISUAL, 0.6,
            Modality.CONTENT, 0.8);

    private static final Map<Modality, Double> DEFAULT_WEIGHTS = Map.of(
            Modality.SPEECH, 0.3,
            Modality.VISUAL, 0.3,
            Modality.CONTENT, 0.4);

    private AnalysisParameters() {}

    /** {@code <modality>.<name>}, e.g. {@code speech.detail_level}. */
    public static String key(Modality modality, String name) {
        return modality.key() + "." + name;
    }

    public static double threshold(Map<String, Double> parameters, Modality modality) {
        return parameters.getOrDefault(key(modality, THRESHOLD), DEFAULT_THRESHOLDS.get(modality));
    }

    public static double weight(Map<String, Double> parameters, Modality modality) {
        return parameters.getOrDefault(WEIGHT_PREFIX + modality.key(), DEFAULT_WEIGHTS.get(modality));
    }

    /** Reads a modality parameter from a task's frozen params. */
    public static double get(Map<String, Double> parameters, Modality modality, String name, double fallback) {
        return parameters.getOrDefault(key(modality, name), fallback);
    }
}
