package com.intervista.core.analyzer;

import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.Modality;
import com.intervista.core.state.AnalysisParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule-based speech scoring over precomputed audio features.
 * <p>
 * Reads {@code speech_rate_wpm} (required), {@code pause_ratio}, {@code filler_ratio},
 * {@code volume_stability} and {@code pitch_variation}. Produces {@code clarity}, {@code pace},
 * {@code fluency} and, from detail level 2 up, {@code emotion}.
 */
@Component
public class FeatureSpeechAnalyzer implements SpeechCapability {

    private static final Logger log = LoggerFactory.getLogger(FeatureSpeechAnalyzer.class);

    static final String DETAIL_LEVEL = "detail_level";
    private static final String[] OPTIONAL_FEATURES =
            {"pause_ratio", "filler_ratio", "volume_stability", "pitch_variation"};

    private final Clock clock;

    public FeatureSpeechAnalyzer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AnalysisResult analyze(AnalysisInput input, Map<String, Double> params, Deadline deadline) {
        var audio = input.inputs().audioFeatures();
        Double wpm = audio.get("speech_rate_wpm");
        if (wpm == null) {
            throw new InputUnavailableException("Audio features lack speech_rate_wpm");
        }
        double detail = Scores.param(params, AnalysisParameters.key(Modality.SPEECH, DETAIL_LEVEL), 3.0);
        if (detail < 1 || detail > 3) {
            throw new InvalidParamsException("speech.detail_level must be within [1, 3], got " + detail);
        }
        deadline.check("speech feature scoring");

        double pauseRatio = audio.getOrDefault("pause_ratio", 0.15);
        double fillerRatio = audio.getOrDefault("filler_ratio", 0.05);
        double volumeStability = audio.getOrDefault("volume_stability", 0.7);
        double pitchVariation = audio.getOrDefault("pitch_variation", 0.5);

        var scores = new LinkedHashMap<String, Double>();
        scores.put("pace", Scores.round(Scores.band(wpm, 120, 160, 60)));
        scores.put("clarity", Scores.round(Scores.clamp(0.5 * volumeStability + 0.5 * (1.0 - 2.0 * fillerRatio))));
        scores.put("fluency", Scores.round(Scores.clamp(
                0.6 * (1.0 - 4.0 * fillerRatio) + 0.4 * Scores.band(pauseRatio, 0.05, 0.25, 0.4))));
        if (detail >= 2) {
            scores.put("emotion", Scores.round(Scores.clamp(1.0 - 2.0 * Math.abs(pitchVariation - 0.5))));
        }
        scores.put(AnalysisResult.OVERALL, Scores.round(Scores.mean(scores.values())));

        int present = 1;
        for (String feature : OPTIONAL_FEATURES) {
            if (audio.containsKey(feature)) present++;
        }
        double confidence = Scores.round(0.5 + 0.5 * present / (OPTIONAL_FEATURES.length + 1));

        deadline.check("speech result assembly");
        log.debug("Speech scores for task {}: {}", input.taskId(), scores);
        return new AnalysisResult(input.taskId(), Modality.SPEECH, scores,
                Map.of("speech_rate_wpm", wpm, "detail_level", detail), confidence, clock.instant());
    }
}
