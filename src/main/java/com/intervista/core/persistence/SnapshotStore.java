package com.intervista.core.persistence;

import com.intervista.core.metrics.IntervistaMetrics;
import com.intervista.core.state.GraphState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists {@link GraphState} snapshots through a LangGraph4j {@link BaseCheckpointSaver}.
 * <p>
 * The session id is the checkpoint thread. Checkpoint ids have the form {@code <revision>-<writeSeq>}
 * where {@code writeSeq} grows with every write, so after a rollback the same revision can be
 * stored again and the newest write still wins.
 * <p>
 * Over a {@link JdbcSnapshotSaver} reads are indexed queries that decode one document. Other savers
 * are listed and only the chosen checkpoint is decoded.
 */
@Service
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    static final String STATE_KEY = "graphState";

    private final BaseCheckpointSaver saver;
    private final JdbcSnapshotSaver jdbc;
    private final SnapshotCodec codec;
    private final IntervistaMetrics metrics;
    private final Clock clock;
    private final AtomicLong lastWriteSeq = new AtomicLong();
    private final Set<String> writtenSessions = ConcurrentHashMap.newKeySet();

    public SnapshotStore(BaseCheckpointSaver saver, IntervistaMetrics metrics, Clock clock) {
        this.saver = saver;
        this.jdbc = saver instanceof JdbcSnapshotSaver indexed ? indexed : null;
        this.codec = new SnapshotCodec();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Writes one snapshot.
     *
     * @throws SnapshotPersistenceException if the saver rejects the write
     */
    public void save(GraphState state) {
        String checkpointId = new SnapshotKey(state.revision(), nextWriteSeq()).checkpointId();
        var config = RunnableConfig.builder().threadId(state.sessionId()).build();
        var checkpoint = Checkpoint.builder()
                .id(checkpointId)
                .state(Map.of(STATE_KEY, codec.encode(state)))
                .nodeId("revision-" + state.revision())
                .nextNodeId(state.sessionStatus().name())
                .build();
        try {
            saver.put(config, checkpoint);
        } catch (Exception e) {
            metrics.recordSnapshotWritten(false);
            throw new SnapshotPersistenceException(
                    "Failed to save snapshot " + checkpointId + " of session " + state.sessionId(), e);
        }
        writtenSessions.add(state.sessionId());
        metrics.recordSnapshotWritten(true);
        log.debug("Saved snapshot {} of session {}", checkpointId, state.sessionId());
    }

    /** Most recently written snapshot of the session. */
    public Optional<GraphState> latest(String sessionId) {
        if (jdbc != null) {
            return jdbc.latestState(sessionId).map(codec::decode);
        }
        return refs(sessionId).stream()
                .max(Comparator.comparingLong(SnapshotRef::writeSeq))
                .map(this::decode);
    }

    /** Most recently written snapshot of the given revision. */
    public Optional<GraphState> load(String sessionId, long revision) {
        if (jdbc != null) {
            return jdbc.stateAt(sessionId, revision).map(codec::decode);
        }
        return refs(sessionId).stream()
                .filter(ref -> ref.revision() == revision)
                .max(Comparator.comparingLong(SnapshotRef::writeSeq))
                .map(this::decode);
    }

    /** Distinct stored revisions, ascending. */
    public List<Long> revisions(String sessionId) {
        if (jdbc != null) {
            return jdbc.revisions(sessionId);
        }
        return refs(sessionId).stream()
                .map(SnapshotRef::revision)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Every session with stored snapshots. An in-memory saver only knows what this process wrote.
     */
    public List<String> sessionIds() {
        if (jdbc != null) {
            return jdbc.sessionIds();
        }
        return writtenSessions.stream().sorted().toList();
    }

    private List<SnapshotRef> refs(String sessionId) {
        var config = RunnableConfig.builder().threadId(sessionId).build();
        return saver.list(config).stream()
                .map(SnapshotRef::of)
                .flatMap(Optional::stream)
                .toList();
    }

    private GraphState decode(SnapshotRef ref) {
        Object json = ref.checkpoint().getState().get(STATE_KEY);
        if (!(json instanceof String s)) {
            throw new SnapshotPersistenceException("Snapshot " + ref.checkpoint().getId() + " carries no session state");
        }
        return codec.decode(s);
    }

    private long nextWriteSeq() {
        long now = clock.millis();
        return lastWriteSeq.updateAndGet(last -> Math.max(last + 1, now));
    }

    private record SnapshotRef(Checkpoint checkpoint, long revision, long writeSeq) {

        static Optional<SnapshotRef> of(Checkpoint checkpoint) {
            var key = SnapshotKey.parse(checkpoint.getId());
            if (key.isEmpty()) {
                log.debug("Ignoring checkpoint with foreign id '{}'", checkpoint.getId());
            }
            return key.map(k -> new SnapshotRef(checkpoint, k.revision(), k.writeSeq()));
        }
    }
}
