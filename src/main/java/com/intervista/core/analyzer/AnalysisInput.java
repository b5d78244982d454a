package com.intervista.core.analyzer;

import com.intervista.core.model.AvailableInputs;
import com.intervista.core.model.UserContext;

/**
 * What an analyzer gets to look at for one task.
 *
 * @param sessionId   the session
 * @param taskId      the task being executed; the produced result must carry it
 * @param userContext caller context (job position, mode)
 * @param inputs      the submission
 */
public record AnalysisInput(
    String sessionId,
    String taskId,
    UserContext userContext,
    AvailableInputs inputs
) {}
