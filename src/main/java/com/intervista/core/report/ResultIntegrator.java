package com.intervista.core.report;

import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Modality;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.state.FeedbackState;
import com.intervista.core.state.GraphState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;

/**
 * Combines per-modality results into one weighted score. Runs as the session's INTEGRATION task,
 * after every modality task has finished one way or another.
 */
@Service
public class ResultIntegrator {

    private static final Logger log = LoggerFactory.getLogger(ResultIntegrator.class);

    /**
     * @throws IntegrationException if no modality task succeeded
     */
    public IntegratedScore integrate(GraphState state) {
        var scores = new EnumMap<Modality, Double>(Modality.class);
        var missing = new ArrayList<Modality>();
        for (Task task : state.taskState().ordered()) {
            Modality modality = task.modality();
            if (modality == null) continue;
            var result = state.analysisState().result(modality);
            if (task.status() == TaskStatus.SUCCEEDED && result.isPresent()) {
                scores.put(modality, result.get().overallScore());
            } else {
                missing.add(modality);
            }
        }
        if (scores.isEmpty()) {
            throw new IntegrationException("No modality produced a result for session " + state.sessionId());
        }
        double overall = FeedbackState.weightedOverall(scores, state.parameters());
        if (!missing.isEmpty()) {
            log.info("Integrating session {} without {}", state.sessionId(), missing);
        }
        log.debug("Integrated score for session {}: {} from {}", state.sessionId(), overall, scores);
        return new IntegratedScore(overall, scores, missing);
    }
}
