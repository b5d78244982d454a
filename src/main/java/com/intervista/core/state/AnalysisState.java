package com.intervista.core.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Modality;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Results collected for a session, one slot per modality, and the integrated score once the
 * INTEGRATION task has run. A retried task overwrites its slot.
 *
 * @param results     latest result per modality
 * @param integration integrated score, or null before integration
 */
public record AnalysisState(Map<Modality, AnalysisResult> results, IntegratedScore integration) implements Serializable {

    @JsonCreator
    public AnalysisState {
        results = results == null ? Map.of() : Map.copyOf(results);
    }

    public AnalysisState(Map<Modality, AnalysisResult> results) {
        this(results, null);
    }

    public static AnalysisState empty() {
        return new AnalysisState(Map.of());
    }

    public AnalysisState with(AnalysisResult result) {
        var updated = new EnumMap<Modality, AnalysisResult>(Modality.class);
        updated.putAll(results);
        updated.put(result.modality(), result);
        return new AnalysisState(updated, integration);
    }

    public AnalysisState withIntegration(IntegratedScore score) {
        return new AnalysisState(results, score);
    }

    public Optional<AnalysisResult> result(Modality modality) {
        return Optional.ofNullable(results.get(modality));
    }

    @JsonIgnore
    public Optional<IntegratedScore> integrated() {
        return Optional.ofNullable(integration);
    }
}
