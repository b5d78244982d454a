package com.intervista.core.engine;

import com.intervista.core.adaptation.AdaptationEngine;
import com.intervista.core.adaptation.AdaptationProperties;
import com.intervista.core.adaptation.PerformanceMonitor;
import com.intervista.core.analyzer.AnalyzerRegistry;
import com.intervista.core.analyzer.FeatureSpeechAnalyzer;
import com.intervista.core.analyzer.FeatureVisualAnalyzer;
import com.intervista.core.analyzer.InMemorySubmissionStore;
import com.intervista.core.analyzer.KeywordContentAnalyzer;
import com.intervista.core.events.EventBus;
import com.intervista.core.events.ProgressPublisher;
import com.intervista.core.executor.ExecutorProperties;
import com.intervista.core.executor.ParallelExecutor;
import com.intervista.core.metrics.IntervistaMetrics;
import com.intervista.core.model.AnalysisMode;
import com.intervista.core.model.AvailableInputs;
import com.intervista.core.model.Modality;
import com.intervista.core.model.ProgressEvent;
import com.intervista.core.model.SessionStatus;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;
import com.intervista.core.model.UserContext;
import com.intervista.core.persistence.SnapshotStore;
import com.intervista.core.planner.AnalysisPlanner;
import com.intervista.core.report.FeedbackGenerator;
import com.intervista.core.report.ResultIntegrator;
import com.intervista.core.state.SessionNotFoundException;
import com.intervista.core.state.StateManager;
import com.intervista.core.state.StateMutation;
import com.intervista.core.state.StateMutation.TransitionTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.intervista.core.TestSupport.context;
import static com.intervista.core.TestSupport.fullSubmission;
import static com.intervista.core.TestSupport.memoryStore;
import static com.intervista.core.TestSupport.stateProperties;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the AnalysisEngine service.
 * Uses the real planner, executor and built-in analyzers over an in-memory snapshot store.
 */
class AnalysisEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(20);

    /** One application's worth of wiring over a shared snapshot store. */
    private record Stack(AnalysisEngine engine, StateManager stateManager, AnalysisPlanner planner,
                         InMemorySubmissionStore submissions) {}

    private static Stack stack(SnapshotStore store) {
        Clock clock = Clock.systemUTC();
        var stateManager = new StateManager(store, stateProperties(50, 5), clock);
        var meterRegistry = new SimpleMeterRegistry();
        var metrics = new IntervistaMetrics(meterRegistry);
        var executorProperties = new ExecutorProperties();
        executorProperties.setBackoffBaseMs(1);
        executorProperties.setBackoffMaxMs(10);
        executorProperties.setTaskTimeoutMs(5_000);

        var adaptationProperties = new AdaptationProperties();
        adaptationProperties.setEnabled(false);
        adaptationProperties.getParameters().put("speech.threshold",
                new AdaptationProperties.ParameterSpec(0.5, 0.9, 0.7));
        var adaptation = new AdaptationEngine(stateManager, new PerformanceMonitor(adaptationProperties),
                adaptationProperties, metrics, clock);
        adaptation.initialize();

        var registry = new AnalyzerRegistry(List.of(new FeatureSpeechAnalyzer(clock),
                new FeatureVisualAnalyzer(clock), new KeywordContentAnalyzer(clock)));
        var submissions = new InMemorySubmissionStore();
        var feedbackGenerator = new FeedbackGenerator();
        var executor = new ParallelExecutor(stateManager, registry, submissions, new ResultIntegrator(),
                feedbackGenerator, executorProperties, metrics, clock);
        var eventBus = new EventBus();
        stateManager.addListener(new ProgressPublisher(stateManager, eventBus));

        var planner = new AnalysisPlanner(executorProperties, clock);
        var engine = new AnalysisEngine(planner, stateManager, executor, registry, submissions, adaptation,
                feedbackGenerator, eventBus, clock);
        return new Stack(engine, stateManager, planner, submissions);
    }

    private SnapshotStore store;
    private AnalysisEngine engine;

    @BeforeEach
    void setUp() {
        store = memoryStore();
        engine = stack(store).engine();
    }

    /** The coordinator lets go of a session just after completing its future. */
    private void archiveWhenIdle(String id) throws InterruptedException {
        for (int i = 0; i < 100; i++) {
            try {
                engine.archiveSession(id);
                return;
            } catch (IllegalStateException e) {
                Thread.sleep(20);
            }
        }
        fail("Session " + id + " never went idle");
    }

    @Nested
    @DisplayName("startSession")
    class StartSession {

        @Test
        @DisplayName("QUICK mode runs content and speech to a completed report")
        void quickModeEndToEnd() throws Exception {
            var progress = new CopyOnWriteArrayList<ProgressEvent>();
            engine.subscribeProgress("IVST-TEST-1", progress::add);

            String id = engine.startSession(context("IVST-TEST-1", AnalysisMode.QUICK), fullSubmission());
            var state = engine.awaitCompletion(id, WAIT);

            assertEquals("IVST-TEST-1", id);
            assertEquals(SessionStatus.COMPLETED, state.sessionStatus());
            assertEquals(4, state.taskState().tasks().size());
            state.taskState().ordered().forEach(t -> assertEquals(TaskStatus.SUCCEEDED, t.status(), t.id()));
            assertFalse(state.hasModality(Modality.VISUAL));
            assertEquals(0.7, state.parameters().get("speech.threshold"), 1e-9);

            var report = engine.getReport(id);
            assertNotNull(report.overallScore());
            assertFalse(report.partial());
            assertEquals(2, report.modalityScores().size());

            assertTrue(progress.stream().anyMatch(e -> e.status() == TaskStatus.SUCCEEDED
                    && e.modality() == Modality.CONTENT));
            assertTrue(progress.stream().anyMatch(e -> e.status() == TaskStatus.RUNNING
                    && e.taskId().endsWith("FEEDBACK")));
        }

        @Test
        @DisplayName("FULL mode without video plans no visual task")
        void fullModeWithoutVideo() throws Exception {
            var inputs = new AvailableInputs(fullSubmission().transcript(), fullSubmission().audioFeatures(), Map.of());
            String id = engine.startSession(new UserContext(null, "Data Engineer", AnalysisMode.FULL, Map.of()), inputs);

            var state = engine.awaitCompletion(id, WAIT);

            assertTrue(id.matches("IVST-\\d{4}-[0-9a-f]{8}"), id);
            assertEquals(SessionStatus.COMPLETED, state.sessionStatus());
            assertFalse(state.hasModality(Modality.VISUAL));
        }

        @Test
        @DisplayName("a submission with nothing to analyze is rejected")
        void nothingToAnalyze() {
            assertThrows(IllegalArgumentException.class, () ->
                    engine.startSession(context("IVST-EMPTY", AnalysisMode.FULL), new AvailableInputs(null, null, null)));
            assertThrows(SessionNotFoundException.class, () -> engine.getSessionState("IVST-EMPTY"));
        }

        @Test
        @DisplayName("QUICK mode on audio alone analyzes content from the transcribed audio track")
        void quickModeAudioOnly() throws Exception {
            var inputs = new AvailableInputs(null, fullSubmission().audioFeatures(), Map.of(),
                    fullSubmission().transcript());

            String id = engine.startSession(context("IVST-AUDIO", AnalysisMode.QUICK), inputs);
            var state = engine.awaitCompletion(id, WAIT);

            assertEquals(SessionStatus.COMPLETED, state.sessionStatus());
            assertEquals(4, state.taskState().tasks().size());
            state.taskState().ordered().forEach(t -> assertEquals(TaskStatus.SUCCEEDED, t.status(), t.id()));
            assertTrue(state.hasModality(Modality.CONTENT));
            assertTrue(state.hasModality(Modality.SPEECH));
            assertFalse(engine.getReport(id).partial());
        }

        @Test
        @DisplayName("a rejected duplicate start leaves the live session's submission alone")
        void duplicateStartKeepsSubmission() {
            var live = stack(store);
            var original = fullSubmission();
            live.stateManager().create("IVST-LIVE", context("IVST-LIVE", AnalysisMode.QUICK), Map.of());
            live.submissions().put("IVST-LIVE", original);

            var other = new AvailableInputs("Someone else's answer.", Map.of("speech_rate_wpm", 90.0), Map.of());
            assertThrows(IllegalArgumentException.class, () ->
                    live.engine().startSession(context("IVST-LIVE", AnalysisMode.QUICK), other));

            assertEquals(original, live.submissions().get("IVST-LIVE").orElseThrow());
            assertTrue(live.stateManager().get("IVST-LIVE").taskState().tasks().isEmpty());
        }

        @Test
        @DisplayName("a session id cannot be reused while live")
        void duplicateSession() throws Exception {
            engine.startSession(context("IVST-DUP", AnalysisMode.QUICK), fullSubmission());
            engine.awaitCompletion("IVST-DUP", WAIT);

            assertThrows(IllegalArgumentException.class, () ->
                    engine.startSession(context("IVST-DUP", AnalysisMode.QUICK), fullSubmission()));
        }
    }

    @Nested
    @DisplayName("session lookup and control")
    class Control {

        @Test
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> engine.getSessionState("nope"));
            assertThrows(SessionNotFoundException.class, () -> engine.cancelSession("nope"));
        }

        @Test
        void cancellingAFinishedSessionChangesNothing() throws Exception {
            String id = engine.startSession(context("IVST-DONE", AnalysisMode.QUICK), fullSubmission());
            var finished = engine.awaitCompletion(id, WAIT);

            engine.cancelSession(id);
            engine.cancelSession(id);

            assertEquals(finished.revision(), engine.getSessionState(id).revision());
            assertEquals(SessionStatus.COMPLETED, engine.getSessionState(id).sessionStatus());
        }

        @Test
        void archivedSessionsAreReadFromSnapshots() throws Exception {
            String id = engine.startSession(context("IVST-ARCH", AnalysisMode.QUICK), fullSubmission());
            var finished = engine.awaitCompletion(id, WAIT);

            archiveWhenIdle(id);

            var stored = engine.getSessionState(id);
            assertEquals(finished.revision(), stored.revision());
            assertEquals(SessionStatus.COMPLETED, stored.sessionStatus());
            assertEquals(0L, engine.getSessionState(id, 0L).revision());
        }
    }

    @Test
    @DisplayName("a session interrupted by a restart resumes and keeps finished work")
    void resumeAfterRestart() throws Exception {
        var before = stack(store);
        var ctx = context("IVST-RESUME", AnalysisMode.QUICK);
        var plan = before.planner().plan(ctx, fullSubmission(), Map.of());
        before.stateManager().create("IVST-RESUME", ctx, Map.of());
        before.stateManager().apply("IVST-RESUME", new StateMutation.AddTask(plan.tasks()));
        String speechId = AnalysisPlanner.taskId("IVST-RESUME", TaskType.SPEECH_ANALYSIS);
        before.stateManager().apply("IVST-RESUME", TransitionTask.start(speechId));
        before.stateManager().flush("IVST-RESUME");

        var after = stack(store);
        var resumed = after.engine().resumeSession("IVST-RESUME", fullSubmission());

        assertEquals(TaskStatus.PENDING, resumed.taskState().require(speechId).status());
        var state = after.engine().awaitCompletion("IVST-RESUME", WAIT);
        assertEquals(SessionStatus.COMPLETED, state.sessionStatus());
        assertTrue(state.revision() > resumed.revision());
    }
}
