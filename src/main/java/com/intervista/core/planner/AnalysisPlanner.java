package com.intervista.core.planner;

import com.intervista.core.executor.ExecutorProperties;
import com.intervista.core.model.AnalysisMode;
import com.intervista.core.model.AvailableInputs;
import com.intervista.core.model.Modality;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskPriority;
import com.intervista.core.model.TaskType;
import com.intervista.core.model.UserContext;
import com.intervista.core.state.AnalysisParameters;
import com.intervista.core.state.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which tasks a session needs.
 * <p>
 * QUICK mode analyzes content and speech, FULL mode adds visual. A modality is planned only when
 * the submission can feed it: speech needs audio, visual needs video, content needs a transcript or
 * audio. INTEGRATION waits (best effort) for all planned modality tasks and FEEDBACK waits for
 * INTEGRATION. Each task gets a frozen copy of the parameters that concern it.
 */
@Service
public class AnalysisPlanner {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPlanner.class);

    static final String FOCUS_WEIGHT = "focus_weight";

    private static final List<Modality> QUICK = List.of(Modality.CONTENT, Modality.SPEECH);
    private static final List<Modality> FULL = List.of(Modality.CONTENT, Modality.SPEECH, Modality.VISUAL);

    private final ExecutorProperties executorProperties;
    private final Clock clock;

    public AnalysisPlanner(ExecutorProperties executorProperties, Clock clock) {
        this.executorProperties = executorProperties;
        this.clock = clock;
    }

    public ExecutionPlan plan(UserContext context, AvailableInputs inputs, Map<String, Double> parameters) {
        Objects.requireNonNull(context.sessionId(), "context.sessionId");
        String sessionId = context.sessionId();
        Instant now = clock.instant();
        int maxAttempts = executorProperties.getMaxAttempts();

        var modalities = new ArrayList<Modality>();
        var omitted = new EnumMap<Modality, String>(Modality.class);
        for (Modality modality : context.mode() == AnalysisMode.FULL ? FULL : QUICK) {
            String missing = missingInput(modality, inputs);
            if (missing == null) {
                modalities.add(modality);
            } else {
                omitted.put(modality, missing);
            }
        }
        Modality focus = focusModality(context, modalities);

        var nodes = new ArrayList<TaskNode>();
        var modalityTaskIds = new ArrayList<String>();
        for (Modality modality : modalities) {
            var params = new HashMap<String, Double>(scoped(parameters, modality.key() + "."));
            params.put(FOCUS_WEIGHT, context.focusWeight(modality));
            var task = Task.pending(taskId(sessionId, modality.taskType()), modality.taskType(),
                    modality == focus ? TaskPriority.HIGH : TaskPriority.NORMAL,
                    sessionId, params, false, maxAttempts, now);
            nodes.add(new TaskNode(task, Set.of()));
            modalityTaskIds.add(task.id());
        }

        var integration = Task.pending(taskId(sessionId, TaskType.INTEGRATION), TaskType.INTEGRATION,
                TaskPriority.HIGH, sessionId, scoped(parameters, AnalysisParameters.WEIGHT_PREFIX),
                true, maxAttempts, now);
        nodes.add(new TaskNode(integration, Set.copyOf(modalityTaskIds)));

        var feedbackParams = new LinkedHashMap<String, Double>();
        for (Modality modality : modalities) {
            feedbackParams.put(AnalysisParameters.key(modality, AnalysisParameters.THRESHOLD),
                    AnalysisParameters.threshold(parameters, modality));
        }
        var feedback = Task.pending(taskId(sessionId, TaskType.FEEDBACK), TaskType.FEEDBACK,
                TaskPriority.NORMAL, sessionId, feedbackParams, false, maxAttempts, now);
        nodes.add(new TaskNode(feedback, Set.of(integration.id())));

        if (!omitted.isEmpty()) {
            log.info("Session {}: not analyzing {}", sessionId, omitted);
        }
        log.info("Planned session {} ({} mode): {}", sessionId, context.mode(), modalities);
        return new ExecutionPlan(sessionId, nodes, modalities, omitted);
    }

    public static String taskId(String sessionId, TaskType type) {
        return sessionId + "-" + type.name();
    }

    private static String missingInput(Modality modality, AvailableInputs inputs) {
        return switch (modality) {
            case SPEECH -> inputs.hasAudio() ? null : "no audio";
            case VISUAL -> inputs.hasVideo() ? null : "no video";
            case CONTENT -> inputs.answerText().isPresent() ? null : "no transcript or transcribed audio";
        };
    }

    /** The single modality with the strictly greatest focus weight, or null on a tie. */
    private static Modality focusModality(UserContext context, List<Modality> modalities) {
        Modality best = null;
        double bestWeight = Double.NEGATIVE_INFINITY;
        boolean tie = false;
        for (Modality modality : modalities) {
            double weight = context.focusWeight(modality);
            if (weight > bestWeight) {
                best = modality;
                bestWeight = weight;
                tie = false;
            } else if (weight == bestWeight) {
                tie = true;
            }
        }
        return tie ? null : best;
    }

    private static Map<String, Double> scoped(Map<String, Double> parameters, String prefix) {
        var scoped = new HashMap<String, Double>();
        parameters.forEach((name, value) -> {
            if (name.startsWith(prefix)) scoped.put(name, value);
        });
        return scoped;
    }
}
