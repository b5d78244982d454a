package com.intervista.core.state;

import com.intervista.core.TestSupport;
import com.intervista.core.model.AnalysisMode;
import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Modality;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;
import com.intervista.core.persistence.SnapshotPersistenceException;
import com.intervista.core.persistence.SnapshotStore;
import com.intervista.core.state.StateMutation.AddTask;
import com.intervista.core.state.StateMutation.AdjustParams;
import com.intervista.core.state.StateMutation.RecordResult;
import com.intervista.core.state.StateMutation.TransitionTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.intervista.core.TestSupport.context;
import static com.intervista.core.TestSupport.result;
import static com.intervista.core.TestSupport.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StateManagerTest {

    private SnapshotStore store;
    private StateManager manager;

    @BeforeEach
    void setUp() {
        store = TestSupport.memoryStore();
        manager = new StateManager(store, TestSupport.stateProperties(50, 10), Clock.systemUTC());
        manager.create("S-1", context("S-1", AnalysisMode.QUICK), Map.of("speech.threshold", 0.7));
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("every mutation bumps the revision by exactly one")
        void revisionsAreMonotonic() {
            assertEquals(1, manager.apply("S-1", AddTask.of(task("A", TaskType.SPEECH_ANALYSIS))));
            assertEquals(2, manager.apply("S-1", TransitionTask.start("A")));
            assertEquals(3, manager.apply("S-1", new RecordResult(result("A", Modality.SPEECH, 0.8))));
            assertEquals(4, manager.apply("S-1", TransitionTask.succeed("A")));
            assertEquals(4, manager.get("S-1").revision());
        }

        @Test
        @DisplayName("concurrent writers never share a revision")
        void concurrentWriters() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var revisions = Collections.synchronizedList(new ArrayList<Long>());
            var start = new CountDownLatch(1);
            for (int i = 0; i < 200; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        revisions.add(manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", 0.0))));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(200, revisions.stream().distinct().count());
            assertEquals(200, manager.get("S-1").revision());
        }

        @Test
        @DisplayName("expected revision guards against lost updates")
        void staleRevision() {
            long rev = manager.get("S-1").revision();
            manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", -0.05)));

            assertThrows(StaleRevisionException.class,
                    () -> manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", -0.05)), rev));
            assertEquals(0.65, manager.get("S-1").parameter("speech.threshold", 0), 1e-9);
        }

        @Test
        @DisplayName("a rejected mutation leaves the revision unchanged")
        void rejectedMutation() {
            manager.apply("S-1", AddTask.of(task("A", TaskType.SPEECH_ANALYSIS)));
            long before = manager.get("S-1").revision();

            assertThrows(StaleRevisionException.class, () -> manager.apply("S-1", TransitionTask.succeed("A")));
            assertThrows(CyclicDependencyException.class,
                    () -> manager.apply("S-1", AddTask.of(task("B", TaskType.FEEDBACK), "B")));

            assertEquals(before, manager.get("S-1").revision());
        }

        @Test
        @DisplayName("a result from a task that is not RUNNING is rejected")
        void resultRequiresRunningTask() {
            manager.apply("S-1", AddTask.of(task("A", TaskType.SPEECH_ANALYSIS)));
            assertThrows(StaleRevisionException.class,
                    () -> manager.apply("S-1", new RecordResult(result("A", Modality.SPEECH, 0.8))));
        }

        @Test
        @DisplayName("an integrated score is accepted only from the running integration task")
        void integrationRequiresRunningIntegrationTask() {
            var score = new IntegratedScore(0.8, Map.of(Modality.SPEECH, 0.8), List.of());
            manager.apply("S-1", AddTask.of(task("A", TaskType.SPEECH_ANALYSIS)));
            manager.apply("S-1", AddTask.of(task("I", TaskType.INTEGRATION), "A"));
            manager.apply("S-1", TransitionTask.start("A"));

            assertThrows(StaleRevisionException.class,
                    () -> manager.apply("S-1", new StateMutation.RecordIntegration("A", score)));
            assertThrows(StaleRevisionException.class,
                    () -> manager.apply("S-1", new StateMutation.RecordIntegration("I", score)));
            assertTrue(manager.get("S-1").analysisState().integrated().isEmpty());
        }

        @Test
        @DisplayName("listeners see previous and next state; a failing listener is isolated")
        void listeners() {
            var seen = new ArrayList<Long>();
            manager.addListener((previous, next, mutation) -> {
                throw new IllegalStateException("broken listener");
            });
            manager.addListener((previous, next, mutation) -> seen.add(next.revision() - previous.revision()));

            manager.apply("S-1", AddTask.of(task("A", TaskType.SPEECH_ANALYSIS)));

            assertEquals(List.of(1L), seen);
        }

        @Test
        @DisplayName("unknown session is reported")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> manager.get("nope"));
            assertThrows(SessionNotFoundException.class,
                    () -> manager.apply("nope", new AdjustParams(Map.of())));
        }
    }

    @Nested
    @DisplayName("history and rollback")
    class Rollback {

        @Test
        @DisplayName("rollback restores a state deep-equal to the one installed at that revision")
        void roundTrip() {
            manager.apply("S-1", AddTask.of(task("A", TaskType.SPEECH_ANALYSIS)));
            GraphState atOne = manager.get("S-1");
            manager.apply("S-1", TransitionTask.start("A"));
            manager.apply("S-1", new RecordResult(result("A", Modality.SPEECH, 0.8)));

            GraphState restored = manager.rollback("S-1", 1);

            assertEquals(atOne, restored);
            assertEquals(atOne, manager.get("S-1"));
            assertEquals(atOne, manager.get("S-1", 1));
        }

        @Test
        @DisplayName("after a rollback the next mutation continues from the restored revision")
        void continuesAfterRollback() {
            manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", 0.1)));
            manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", 0.1)));
            manager.rollback("S-1", 0);

            assertEquals(1, manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", -0.1))));
            assertEquals(0.6, manager.get("S-1").parameter("speech.threshold", 0), 1e-9);
        }

        @Test
        @DisplayName("history is bounded by the configured depth")
        void boundedHistory() {
            var small = new StateManager(TestSupport.memoryStore(), TestSupport.stateProperties(3, 100), Clock.systemUTC());
            small.create("S-2", null, Map.of());
            for (int i = 0; i < 5; i++) {
                small.apply("S-2", new AdjustParams(Map.of("x", 1.0)));
            }

            assertEquals(List.of(3L, 4L, 5L), small.history("S-2").stream().map(GraphState::revision).toList());
            assertThrows(SessionNotFoundException.class, () -> small.rollback("S-2", 1));
        }

        @Test
        @DisplayName("a revision that left the ring is served from the snapshot store")
        void readsOldRevisionFromStore() {
            var small = new StateManager(TestSupport.memoryStore(), TestSupport.stateProperties(2, 1), Clock.systemUTC());
            small.create("S-2", null, Map.of());
            for (int i = 0; i < 4; i++) {
                small.apply("S-2", new AdjustParams(Map.of("x", 1.0)));
            }

            assertEquals(1.0, small.get("S-2", 1).parameter("x", 0), 1e-9);
        }
    }

    @Nested
    @DisplayName("persistence")
    class Persistence {

        @Test
        @DisplayName("a snapshot is written every K revisions")
        void snapshotCadence() {
            for (int i = 0; i < 10; i++) {
                manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", 0.0)));
            }
            assertEquals(List.of(0L, 10L), store.revisions("S-1"));
        }

        @Test
        @DisplayName("resume brings back interrupted work as PENDING and keeps succeeded work")
        void resumeRequeuesInterrupted() {
            manager.apply("S-1", new AddTask(List.of(
                    TaskNode.of(task("A", TaskType.SPEECH_ANALYSIS)),
                    TaskNode.of(task("B", TaskType.CONTENT_ANALYSIS)))));
            manager.apply("S-1", TransitionTask.start("A"));
            manager.apply("S-1", new RecordResult(result("A", Modality.SPEECH, 0.8)));
            manager.apply("S-1", TransitionTask.succeed("A"));
            manager.apply("S-1", TransitionTask.start("B"));
            manager.flush("S-1");
            long persisted = manager.get("S-1").revision();

            // simulated restart: a fresh manager over the same store
            var restarted = new StateManager(store, TestSupport.stateProperties(50, 10), Clock.systemUTC());
            GraphState resumed = restarted.resume("S-1");

            assertEquals(TaskStatus.SUCCEEDED, resumed.taskState().require("A").status());
            assertEquals(TaskStatus.PENDING, resumed.taskState().require("B").status());
            assertTrue(resumed.analysisState().result(Modality.SPEECH).isPresent());
            assertEquals(persisted + 1, resumed.revision());
        }

        @Test
        @DisplayName("a restart right after a success keeps the result without any flush")
        void resumeRightAfterSuccess() {
            manager.apply("S-1", new AddTask(List.of(
                    TaskNode.of(task("A", TaskType.SPEECH_ANALYSIS)),
                    TaskNode.of(task("B", TaskType.CONTENT_ANALYSIS)))));
            manager.apply("S-1", TransitionTask.start("A"));
            manager.apply("S-1", new RecordResult(result("A", Modality.SPEECH, 0.8)));
            manager.apply("S-1", TransitionTask.succeed("A"));

            // no flush: the process dies here
            var restarted = new StateManager(store, TestSupport.stateProperties(50, 10), Clock.systemUTC());
            GraphState resumed = restarted.resume("S-1");

            assertEquals(List.of(0L, 1L, 3L, 4L), store.revisions("S-1"));
            assertEquals(4, resumed.revision());
            assertEquals(TaskStatus.SUCCEEDED, resumed.taskState().require("A").status());
            assertEquals(TaskStatus.PENDING, resumed.taskState().require("B").status());
            assertEquals(0.8, resumed.analysisState().result(Modality.SPEECH).orElseThrow().scores().get(AnalysisResult.OVERALL), 1e-9);
        }

        @Test
        @DisplayName("a snapshot older than the one already written is dropped")
        void staleWriteIsDropped() throws Exception {
            manager.apply("S-1", new AddTask(List.of(
                    TaskNode.of(task("A", TaskType.SPEECH_ANALYSIS)),
                    TaskNode.of(task("B", TaskType.CONTENT_ANALYSIS)))));
            manager.apply("S-1", TransitionTask.start("A"));
            manager.apply("S-1", TransitionTask.start("B"));

            var firstInstalled = new CountDownLatch(1);
            var secondWritten = new CountDownLatch(1);
            manager.addListener((previous, next, mutation) -> {
                if (next.revision() == 4) {
                    firstInstalled.countDown();
                    try {
                        secondWritten.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                var first = pool.submit(() -> manager.apply("S-1", new RecordResult(result("A", Modality.SPEECH, 0.8))));
                assertTrue(firstInstalled.await(5, TimeUnit.SECONDS));
                assertEquals(5, manager.apply("S-1", new RecordResult(result("B", Modality.CONTENT, 0.6))));
                secondWritten.countDown();
                assertEquals(4L, first.get(5, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }

            assertEquals(List.of(0L, 1L, 5L), store.revisions("S-1"));
            assertEquals(5, store.latest("S-1").orElseThrow().revision());
            manager.flush("S-1");
            assertEquals(List.of(0L, 1L, 5L), store.revisions("S-1"));
        }

        @Test
        @DisplayName("a revision in the history ring equals its stored snapshot")
        void ringMatchesStore() {
            manager.apply("S-1", AddTask.of(task("C", TaskType.CONTENT_ANALYSIS)));
            manager.apply("S-1", TransitionTask.start("C"));
            long recorded = manager.apply("S-1", new RecordResult(new AnalysisResult("C", Modality.CONTENT,
                    Map.of(AnalysisResult.OVERALL, 0.6),
                    Map.of("word_count", 12, "sentence_count", 2L, "star_parts", List.of("action")),
                    0.7, TestSupport.T0)));

            assertEquals(manager.get("S-1", recorded), store.load("S-1", recorded).orElseThrow());
        }

        @Test
        @DisplayName("resume of an unknown session fails")
        void resumeUnknown() {
            assertThrows(SessionNotFoundException.class, () -> manager.resume("missing"));
        }

        @Test
        @DisplayName("archived sessions are still readable from the store")
        void archive() {
            manager.apply("S-1", new AdjustParams(Map.of("speech.threshold", 0.1)));
            manager.archive("S-1");

            assertFalse(manager.isLive("S-1"));
            assertEquals(0.8, manager.find("S-1").orElseThrow().parameter("speech.threshold", 0), 1e-9);
        }

        @Test
        @DisplayName("a failing snapshot write does not fail the mutation")
        void persistenceFailureIsAbsorbed() {
            var failing = mock(SnapshotStore.class);
            doThrow(new SnapshotPersistenceException("disk full")).when(failing).save(any());
            var fragile = new StateManager(failing, TestSupport.stateProperties(50, 1), Clock.systemUTC());
            fragile.create("S-3", null, Map.of());

            assertEquals(1, fragile.apply("S-3", new AdjustParams(Map.of("x", 1.0))));
            verify(failing, times(2)).save(any());
        }
    }
}
