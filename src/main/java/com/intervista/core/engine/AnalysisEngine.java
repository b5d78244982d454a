package com.intervista.core.engine;

import com.intervista.core.adaptation.AdaptationEngine;
import com.intervista.core.analyzer.AnalyzerRegistry;
import com.intervista.core.analyzer.SubmissionStore;
import com.intervista.core.events.EventBus;
import com.intervista.core.executor.ParallelExecutor;
import com.intervista.core.logging.MdcContext;
import com.intervista.core.model.AvailableInputs;
import com.intervista.core.model.Modality;
import com.intervista.core.model.ProgressEvent;
import com.intervista.core.model.SessionReport;
import com.intervista.core.model.SessionStatus;
import com.intervista.core.model.UserContext;
import com.intervista.core.planner.AnalysisPlanner;
import com.intervista.core.report.FeedbackGenerator;
import com.intervista.core.state.GraphState;
import com.intervista.core.state.SessionNotFoundException;
import com.intervista.core.state.StateManager;
import com.intervista.core.state.StateMutation.AddTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Entry point for running interview analyses.
 * <p>
 * Plans a session from the caller's context and submission, registers it with the
 * {@link StateManager} under a frozen copy of the current global parameters, and hands it to the
 * {@link ParallelExecutor}. Finished sessions feed the {@link AdaptationEngine}.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalysisPlanner planner;
    private final StateManager stateManager;
    private final ParallelExecutor executor;
    private final AnalyzerRegistry registry;
    private final SubmissionStore submissions;
    private final AdaptationEngine adaptation;
    private final FeedbackGenerator feedbackGenerator;
    private final EventBus eventBus;
    private final Clock clock;

    public AnalysisEngine(AnalysisPlanner planner, StateManager stateManager, ParallelExecutor executor,
                          AnalyzerRegistry registry, SubmissionStore submissions, AdaptationEngine adaptation,
                          FeedbackGenerator feedbackGenerator, EventBus eventBus, Clock clock) {
        this.planner = planner;
        this.stateManager = stateManager;
        this.executor = executor;
        this.registry = registry;
        this.submissions = submissions;
        this.adaptation = adaptation;
        this.feedbackGenerator = feedbackGenerator;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Plans and starts a session. Returns as soon as the tasks are registered; progress is reported
     * through {@link #subscribeProgress} and the result through {@link #awaitCompletion}.
     *
     * @param context caller context; a session id is generated when it carries none
     * @param inputs  the submission
     * @return the session id
     * @throws IllegalArgumentException if the submission offers nothing the mode can analyze
     */
    public String startSession(UserContext context, AvailableInputs inputs) {
        String sessionId = context.sessionId() != null ? context.sessionId() : generateSessionId();
        UserContext sessionContext = context.withSessionId(sessionId);
        MdcContext.setSession(sessionId);
        try {
            Map<String, Double> parameters = adaptation.currentParameters();
            var plan = planner.plan(sessionContext, inputs, parameters);
            if (!plan.hasModalityTasks()) {
                throw new IllegalArgumentException("Nothing to analyze in session " + sessionId + ": " + plan.omitted());
            }
            for (Modality modality : plan.modalities()) {
                registry.require(modality);
            }

            // create() rejects a live id before anything of the running session is touched
            stateManager.create(sessionId, sessionContext, parameters);
            submissions.put(sessionId, inputs);
            stateManager.apply(sessionId, new AddTask(plan.tasks()));
            eventBus.publish(ProgressEvent.sessionCreated(sessionId, clock.instant()));
            log.info("Starting session {} ({} mode, {} tasks)", sessionId, sessionContext.mode(), plan.tasks().size());

            launch(sessionId);
            return sessionId;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Current state of a session: live, or the latest stored snapshot.
     *
     * @throws SessionNotFoundException if the session is unknown
     */
    public GraphState getSessionState(String sessionId) {
        return stateManager.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public GraphState getSessionState(String sessionId, long revision) {
        return stateManager.get(sessionId, revision);
    }

    /**
     * Cancels a session. Repeated calls, and calls on finished sessions, have no further effect.
     */
    public void cancelSession(String sessionId) {
        if (!stateManager.isLive(sessionId)) {
            getSessionState(sessionId);
            return;
        }
        log.info("Cancelling session {}", sessionId);
        executor.cancel(sessionId);
    }

    /** Task status changes of one session, until it finishes. */
    public EventBus.Subscription subscribeProgress(String sessionId, Consumer<ProgressEvent> consumer) {
        return eventBus.subscribe(sessionId, event -> {
            if (event.isTaskEvent()) {
                consumer.accept(event);
            }
        });
    }

    /**
     * Waits for a running session to finish. Returns immediately for sessions that are not running.
     *
     * @throws TimeoutException if the session is still running after {@code timeout}
     */
    public GraphState awaitCompletion(String sessionId, Duration timeout)
            throws InterruptedException, TimeoutException {
        var running = executor.completion(sessionId);
        if (running.isEmpty()) {
            return getSessionState(sessionId);
        }
        try {
            return running.get().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session " + sessionId + " failed to run", e.getCause());
        }
    }

    public SessionReport getReport(String sessionId) {
        return feedbackGenerator.generate(getSessionState(sessionId));
    }

    /**
     * Reloads a session from its latest snapshot and continues it. Interrupted tasks run again;
     * succeeded work is kept.
     */
    public GraphState resumeSession(String sessionId) {
        return resumeSession(sessionId, null);
    }

    /**
     * @param inputs the submission, when it has to be supplied again after a restart; null to use the
     *               one still registered
     */
    public GraphState resumeSession(String sessionId, AvailableInputs inputs) {
        GraphState state = stateManager.resume(sessionId);
        if (inputs != null) {
            submissions.put(sessionId, inputs);
        }
        if (state.taskState().hasUnfinishedTasks() && !executor.isRunning(sessionId)) {
            log.info("Resuming session {} at revision {}", sessionId, state.revision());
            launch(sessionId);
        }
        return state;
    }

    /** Drops a finished session from memory after writing its final snapshot. */
    public void archiveSession(String sessionId) {
        if (executor.isRunning(sessionId)) {
            throw new IllegalStateException("Session " + sessionId + " is still running");
        }
        stateManager.archive(sessionId);
        submissions.remove(sessionId);
    }

    /**
     * Generates a session id in the format IVST-YYYY-xxxxxxxx.
     */
    public String generateSessionId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("IVST-%d-%s", year, UUID.randomUUID().toString().substring(0, 8));
    }

    private void launch(String sessionId) {
        CompletableFuture<GraphState> run = executor.run(sessionId);
        run.whenComplete((finalState, error) -> {
            submissions.remove(sessionId);
            if (error != null) {
                log.error("Session {} aborted", sessionId, error);
            } else if (finalState.sessionStatus() != SessionStatus.CANCELLED) {
                adaptation.onSessionCompleted(finalState);
            }
        });
    }
}
