package com.intervista.core.analyzer;

import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.Modality;
import com.intervista.core.state.AnalysisParameters;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule-based visual scoring over precomputed video features: {@code eye_contact_ratio} (required),
 * {@code smile_ratio}, {@code posture_stability} and {@code head_movement}.
 * The sampled frame rate only affects confidence.
 */
@Component
public class FeatureVisualAnalyzer implements VisualCapability {

    static final String FRAME_RATE = "frame_rate";

    private final Clock clock;

    public FeatureVisualAnalyzer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AnalysisResult analyze(AnalysisInput input, Map<String, Double> params, Deadline deadline) {
        var video = input.inputs().visualFeatures();
        Double eyeContact = video.get("eye_contact_ratio");
        if (eyeContact == null) {
            throw new InputUnavailableException("Video features lack eye_contact_ratio");
        }
        double frameRate = Scores.param(params, AnalysisParameters.key(Modality.VISUAL, FRAME_RATE), 5.0);
        if (frameRate <= 0) {
            throw new InvalidParamsException("visual.frame_rate must be positive, got " + frameRate);
        }
        deadline.check("visual feature scoring");

        double smile = video.getOrDefault("smile_ratio", 0.3);
        double postureStability = video.getOrDefault("posture_stability", 0.7);
        double headMovement = video.getOrDefault("head_movement", 0.3);

        var scores = new LinkedHashMap<String, Double>();
        scores.put("eye_contact", Scores.round(Scores.clamp(eyeContact / 0.7)));
        scores.put("expression", Scores.round(Scores.clamp(1.0 - 2.0 * Math.abs(smile - 0.3))));
        scores.put("posture", Scores.round(Scores.clamp(0.7 * postureStability + 0.3 * (1.0 - headMovement))));
        scores.put(AnalysisResult.OVERALL, Scores.round(Scores.mean(scores.values())));

        double confidence = Scores.round(Math.min(1.0, 0.5 + frameRate / 20.0));
        deadline.check("visual result assembly");
        return new AnalysisResult(input.taskId(), Modality.VISUAL, scores,
                Map.of("eye_contact_ratio", eyeContact, "frame_rate", frameRate), confidence, clock.instant());
    }
}
