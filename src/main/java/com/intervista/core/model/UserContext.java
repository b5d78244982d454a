package com.intervista.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Read-only description of who is being analyzed and how.
 *
 * @param sessionId    requested session id; the engine generates one when null
 * @param jobPosition  target position, used for content relevance
 * @param mode         QUICK or FULL
 * @param focusWeights per-modality emphasis keyed by modality key ("speech", "visual", "content")
 */
public record UserContext(
    String sessionId,
    String jobPosition,
    AnalysisMode mode,
    Map<String, Double> focusWeights
) implements Serializable {

    public UserContext {
        mode = mode == null ? AnalysisMode.QUICK : mode;
        focusWeights = focusWeights == null ? Map.of() : Map.copyOf(focusWeights);
    }

    public UserContext withSessionId(String newSessionId) {
        return new UserContext(newSessionId, jobPosition, mode, focusWeights);
    }

    public double focusWeight(Modality modality) {
        return focusWeights.getOrDefault(modality.key(), 1.0);
    }
}
