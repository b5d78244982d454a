package com.intervista.core.planner;

import com.intervista.core.model.Modality;
import com.intervista.core.state.TaskNode;

import java.util.List;
import java.util.Map;

/**
 * Tasks to create for a session, in creation order, with their dependencies.
 *
 * @param sessionId  the session
 * @param tasks      planned tasks; modality tasks first, then INTEGRATION and FEEDBACK
 * @param modalities modalities that got a task
 * @param omitted    modalities the mode asked for but the submission cannot serve, with the reason
 */
public record ExecutionPlan(
    String sessionId,
    List<TaskNode> tasks,
    List<Modality> modalities,
    Map<Modality, String> omitted
) {

    public ExecutionPlan {
        tasks = List.copyOf(tasks);
        modalities = List.copyOf(modalities);
        omitted = Map.copyOf(omitted);
    }

    public boolean hasModalityTasks() {
        return !modalities.isEmpty();
    }
}
