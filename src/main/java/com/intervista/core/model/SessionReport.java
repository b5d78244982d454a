package com.intervista.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Final scored report of a session, built from its completed results.
 *
 * @param sessionId          the session
 * @param status             derived session status
 * @param partial            true when a planned modality is degraded
 * @param overallScore       weighted score over the modalities that succeeded, null when none did
 * @param modalityScores     overall score per succeeded modality
 * @param modalityStatus     OK or DEGRADED per planned modality
 * @param strengths          sub-scores at or above the strength mark, as "modality.score"
 * @param weaknesses         sub-scores below the modality threshold
 * @param suggestions        improvement suggestions, limited to succeeded modalities
 * @param taskErrors         last error per task that did not succeed
 */
public record SessionReport(
    String sessionId,
    SessionStatus status,
    boolean partial,
    Double overallScore,
    Map<Modality, Double> modalityScores,
    Map<Modality, ModalityStatus> modalityStatus,
    List<String> strengths,
    List<String> weaknesses,
    List<String> suggestions,
    Map<String, String> taskErrors
) implements Serializable {

    public List<Modality> degradedModalities() {
        return modalityStatus.entrySet().stream()
                .filter(e -> e.getValue() == ModalityStatus.DEGRADED)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
