package com.intervista.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a session's INTEGRATION task, kept on the session state once recorded.
 *
 * @param overallScore   weighted score over the modalities that produced a result
 * @param modalityScores overall score per contributing modality
 * @param missing        planned modalities without a result
 */
public record IntegratedScore(
    double overallScore,
    Map<Modality, Double> modalityScores,
    List<Modality> missing
) implements Serializable {

    public IntegratedScore {
        modalityScores = modalityScores == null ? Map.of() : Map.copyOf(modalityScores);
        missing = missing == null ? List.of() : List.copyOf(missing);
    }
}
