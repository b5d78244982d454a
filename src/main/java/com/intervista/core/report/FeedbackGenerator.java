package com.intervista.core.report;

import com.intervista.core.model.SessionReport;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.state.GraphState;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;

/**
 * Builds the {@link SessionReport} from a session's state. The report reflects whatever has finished;
 * modalities that did not succeed are marked DEGRADED and get no suggestions.
 */
@Service
public class FeedbackGenerator {

    public SessionReport generate(GraphState state) {
        var feedback = state.feedback();
        var taskErrors = new LinkedHashMap<String, String>();
        for (Task task : state.taskState().ordered()) {
            if (task.status() != TaskStatus.SUCCEEDED && task.lastError() != null) {
                taskErrors.put(task.id(), task.lastError());
            }
        }
        return new SessionReport(
                state.sessionId(),
                state.sessionStatus(),
                feedback.partial(),
                feedback.overallScore(),
                feedback.modalityScores(),
                feedback.modalityStatus(),
                feedback.strengths(),
                feedback.weaknesses(),
                feedback.suggestions(),
                taskErrors);
    }
}
