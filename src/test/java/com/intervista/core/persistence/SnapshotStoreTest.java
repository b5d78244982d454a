package com.intervista.core.persistence;

import com.intervista.core.metrics.IntervistaMetrics;
import com.intervista.core.model.AnalysisMode;
import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.IntegratedScore;
import com.intervista.core.model.Modality;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;
import com.intervista.core.state.AnalysisState;
import com.intervista.core.state.GraphState;
import com.intervista.core.state.TaskNode;
import com.intervista.core.state.TaskState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.intervista.core.TestSupport.T0;
import static com.intervista.core.TestSupport.context;
import static com.intervista.core.TestSupport.result;
import static com.intervista.core.TestSupport.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link SnapshotStore} over a LangGraph4j {@link MemorySaver}, so no database is needed.
 */
class SnapshotStoreTest {

    private SimpleMeterRegistry registry;
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new SnapshotStore(new MemorySaver(), new IntervistaMetrics(registry), Clock.systemUTC());
    }

    private GraphState sessionAt(long revision, double threshold) {
        var tasks = TaskState.empty().addAll(List.of(
                TaskNode.of(task("S-1-SPEECH_ANALYSIS", TaskType.SPEECH_ANALYSIS)),
                TaskNode.of(task("S-1-FEEDBACK", TaskType.FEEDBACK), "S-1-SPEECH_ANALYSIS")));
        var running = tasks.require("S-1-SPEECH_ANALYSIS").transitionTo(TaskStatus.RUNNING, T0, null, null, false);
        return new GraphState("S-1", context("S-1", AnalysisMode.QUICK), tasks.withTask(running),
                AnalysisState.empty().with(result("S-1-SPEECH_ANALYSIS", Modality.SPEECH,
                        Map.of("overall", 0.75, "pace", 0.9), 0.8)),
                Map.of("speech.threshold", threshold), revision, T0, T0.plusSeconds(revision));
    }

    @Nested
    @DisplayName("save and load")
    class SaveAndLoad {

        @Test
        @DisplayName("a saved snapshot comes back equal")
        void roundTrip() {
            var state = sessionAt(3, 0.7);
            store.save(state);

            assertEquals(state, store.latest("S-1").orElseThrow());
            assertEquals(state, store.load("S-1", 3).orElseThrow());
        }

        @Test
        @DisplayName("raw features and the integrated score come back equal")
        void featuresAndIntegration() {
            var content = new AnalysisResult("S-1-CONTENT_ANALYSIS", Modality.CONTENT, Map.of("overall", 0.6),
                    Map.of("word_count", 42, "tech_terms", 3L, "star_parts", List.of("situation", "result"),
                            "detail", Map.of("ratio", 0.5f)),
                    0.7, T0);
            var base = sessionAt(4, 0.7);
            var state = base.withAnalysisState(base.analysisState().with(content).withIntegration(
                    new IntegratedScore(0.68, Map.of(Modality.SPEECH, 0.75, Modality.CONTENT, 0.6), List.of())));
            store.save(state);

            var loaded = store.latest("S-1").orElseThrow();
            assertEquals(state, loaded);
            assertEquals(3.0, loaded.analysisState().result(Modality.CONTENT).orElseThrow().rawFeatures().get("tech_terms"));
            assertEquals(0.68, loaded.analysisState().integrated().orElseThrow().overallScore(), 1e-12);
        }

        @Test
        @DisplayName("latest is the most recent write, not the highest revision")
        void latestIsNewestWrite() {
            store.save(sessionAt(5, 0.7));
            store.save(sessionAt(2, 0.6)); // written after a rollback

            assertEquals(2, store.latest("S-1").orElseThrow().revision());
            assertEquals(List.of(2L, 5L), store.revisions("S-1"));
        }

        @Test
        @DisplayName("re-saving a revision keeps the newest copy")
        void resaveSameRevision() {
            store.save(sessionAt(2, 0.7));
            store.save(sessionAt(2, 0.65));

            assertEquals(0.65, store.load("S-1", 2).orElseThrow().parameter("speech.threshold", 0), 1e-9);
        }

        @Test
        @DisplayName("unknown sessions and revisions are empty")
        void unknown() {
            assertTrue(store.latest("nope").isEmpty());
            store.save(sessionAt(1, 0.7));
            assertTrue(store.load("S-1", 9).isEmpty());
        }

        @Test
        @DisplayName("session ids written by this process are listed")
        void sessionIds() {
            store.save(sessionAt(1, 0.7));
            assertEquals(List.of("S-1"), store.sessionIds());
        }

        @Test
        @DisplayName("successful writes are counted")
        void countsWrites() {
            store.save(sessionAt(1, 0.7));
            var counter = registry.find("intervista.snapshots.written").tag("success", "true").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }
    }

    @Test
    @DisplayName("over the JDBC saver reads are single indexed lookups")
    void jdbcReads() {
        var jdbc = mock(JdbcSnapshotSaver.class);
        var indexed = new SnapshotStore(jdbc, new IntervistaMetrics(registry), Clock.systemUTC());
        var state = sessionAt(3, 0.7);
        String json = new SnapshotCodec().encode(state);
        when(jdbc.latestState("S-1")).thenReturn(Optional.of(json));
        when(jdbc.stateAt("S-1", 3)).thenReturn(Optional.of(json));
        when(jdbc.revisions("S-1")).thenReturn(List.of(0L, 3L));
        when(jdbc.sessionIds()).thenReturn(List.of("S-1", "S-2"));

        assertEquals(state, indexed.latest("S-1").orElseThrow());
        assertEquals(state, indexed.load("S-1", 3).orElseThrow());
        assertEquals(List.of(0L, 3L), indexed.revisions("S-1"));
        assertEquals(List.of("S-1", "S-2"), indexed.sessionIds());
        verify(jdbc, never()).list(any());
    }

    @Test
    @DisplayName("checkpoints with foreign ids are ignored")
    void ignoresForeignCheckpoints() throws Exception {
        var saver = new MemorySaver();
        var config = RunnableConfig.builder().threadId("S-1").build();
        saver.put(config, Checkpoint.builder().id("classify_request").nodeId("x").nextNodeId("y")
                .state(Map.of("status", "RUNNING")).build());
        var mixed = new SnapshotStore(saver, new IntervistaMetrics(registry), Clock.systemUTC());

        assertTrue(mixed.latest("S-1").isEmpty());
    }

    @Test
    @DisplayName("a rejected write surfaces as SnapshotPersistenceException and is counted")
    void failedWrite() throws Exception {
        var saver = mock(BaseCheckpointSaver.class);
        when(saver.put(any(), any())).thenThrow(new IllegalStateException("connection refused"));
        var failing = new SnapshotStore(saver, new IntervistaMetrics(registry), Clock.systemUTC());

        assertThrows(SnapshotPersistenceException.class, () -> failing.save(sessionAt(1, 0.7)));
        var counter = registry.find("intervista.snapshots.written").tag("success", "false").counter();
        assertEquals(1.0, counter.count());
    }
}
