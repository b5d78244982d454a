package com.intervista.core.state;

import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Modality;
import com.intervista.core.model.ModalityStatus;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Feedback view over a session's results. Always derived from {@link GraphState}, never stored.
 *
 * @param modalityStatus OK or DEGRADED for every planned modality whose task has finished
 * @param modalityScores overall score of each succeeded modality
 * @param overallScore   the integrated score once recorded, until then the weighted score over succeeded
 *                       modalities; null when none succeeded
 * @param strengths      "modality.score" entries at or above {@link AnalysisParameters#STRENGTH_MARK}
 * @param weaknesses     "modality.score" entries below the modality threshold
 * @param suggestions    advice for the weaknesses, so only for modalities that succeeded
 * @param partial        true when any planned modality is degraded
 */
public record FeedbackState(
    Map<Modality, ModalityStatus> modalityStatus,
    Map<Modality, Double> modalityScores,
    Double overallScore,
    List<String> strengths,
    List<String> weaknesses,
    List<String> suggestions,
    boolean partial
) {

    private static final Map<String, String> SUGGESTIONS = Map.ofEntries(
            Map.entry("speech.clarity", "Articulate key terms more slowly and keep a steady volume."),
            Map.entry("speech.pace", "Aim for 120-160 words per minute; pause after each main point."),
            Map.entry("speech.fluency", "Replace filler words with a short silent pause."),
            Map.entry("speech.emotion", "Vary your intonation to show engagement with the topic."),
            Map.entry("visual.eye_contact", "Look at the camera when making your main points."),
            Map.entry("visual.expression", "Keep a relaxed, friendly expression while listening and answering."),
            Map.entry("visual.posture", "Sit upright and keep your shoulders steady."),
            Map.entry("content.relevance", "Tie each answer back to the requirements of the position."),
            Map.entry("content.structure", "Structure answers as Situation, Task, Action, Result."),
            Map.entry("content.key_points", "Lead with concrete outcomes and name the technologies you used."));

    public static FeedbackState derive(GraphState state) {
        var status = new EnumMap<Modality, ModalityStatus>(Modality.class);
        var scores = new EnumMap<Modality, Double>(Modality.class);
        var results = new EnumMap<Modality, AnalysisResult>(Modality.class);

        for (Task task : state.taskState().ordered()) {
            Modality modality = task.modality();
            if (modality == null || !task.isTerminal()) continue;
            var result = state.analysisState().result(modality);
            if (task.status() == TaskStatus.SUCCEEDED && result.isPresent()) {
                status.put(modality, ModalityStatus.OK);
                scores.put(modality, result.get().overallScore());
                results.put(modality, result.get());
            } else {
                status.put(modality, ModalityStatus.DEGRADED);
            }
        }

        var strengths = new ArrayList<String>();
        var weaknesses = new ArrayList<String>();
        var suggestions = new ArrayList<String>();
        for (var entry : results.entrySet()) {
            Modality modality = entry.getKey();
            double threshold = AnalysisParameters.threshold(state.parameters(), modality);
            for (var score : new TreeMap<>(entry.getValue().scores()).entrySet()) {
                if (AnalysisResult.OVERALL.equals(score.getKey())) continue;
                String name = modality.key() + "." + score.getKey();
                if (score.getValue() >= AnalysisParameters.STRENGTH_MARK) {
                    strengths.add(name);
                } else if (score.getValue() < threshold) {
                    weaknesses.add(name);
                    suggestions.add(SUGGESTIONS.getOrDefault(name,
                            "Work on " + score.getKey().replace('_', ' ') + " in your " + modality.key() + "."));
                }
            }
        }

        return new FeedbackState(
                Map.copyOf(status),
                Map.copyOf(scores),
                state.analysisState().integrated()
                        .map(IntegratedScore::overallScore)
                        .orElseGet(() -> weightedOverall(scores, state.parameters())),
                List.copyOf(strengths),
                List.copyOf(weaknesses),
                List.copyOf(suggestions),
                status.containsValue(ModalityStatus.DEGRADED));
    }

    /**
     * Weighted mean of the given modality scores. Weights are renormalised over the modalities
     * present, so a missing modality neither counts as zero nor shifts the scale.
     */
    public static Double weightedOverall(Map<Modality, Double> scores, Map<String, Double> parameters) {
        if (scores.isEmpty()) return null;
        double totalWeight = 0.0;
        double weighted = 0.0;
        for (var entry : scores.entrySet()) {
            double weight = Math.max(0.0, AnalysisParameters.weight(parameters, entry.getKey()));
            totalWeight += weight;
            weighted += weight * entry.getValue();
        }
        if (totalWeight <= 0.0) {
            return scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        return weighted / totalWeight;
    }
}
