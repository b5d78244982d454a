package com.intervista.core.state;

import com.intervista.core.model.Task;
import com.intervista.core.model.UserContext;
import com.intervista.core.persistence.SnapshotPersistenceException;
import com.intervista.core.persistence.SnapshotStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the canonical {@link GraphState} of every live session.
 * <p>
 * All changes go through {@link #apply}. Each session has its own lock, held only while the new
 * immutable state is computed and installed; listeners and persistence run after it is released.
 * Every applied mutation bumps the revision by one and pushes the new state into a bounded history
 * ring used by {@link #get(String, long)} and {@link #rollback}.
 * <p>
 * Snapshots are written right away for every change that records finished work: the plan
 * ({@code AddTask}), a result, and a task reaching a terminal status. Other changes are written every
 * {@code snapshot-every-revisions} revisions, every {@code snapshot-every-seconds} seconds for sessions
 * with unsaved changes, when a session finishes, on rollback and on {@link #flush}. Writes of one
 * session are serialized and never go backwards: a snapshot older than the last one written is
 * dropped. A failed write is logged and retried at the next opportunity.
 */
@Service
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    /** Pseudo-session holding the live global analyzer parameters. */
    public static final String GLOBAL_SESSION_ID = "__global__";

    private final SnapshotStore store;
    private final StateProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, SessionSlot> sessions = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<StateListener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService flusher = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "state-flusher");
        t.setDaemon(true);
        return t;
    });

    public StateManager(SnapshotStore store, StateProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void startFlusher() {
        if (properties.getSnapshotEverySeconds() > 0) {
            flusher.scheduleAtFixedRate(this::flushDue, 1, 1, TimeUnit.SECONDS);
        }
        log.info("State manager started (history={}, snapshot every {} revisions / {}s)",
                properties.getHistoryDepth(), properties.getSnapshotEveryRevisions(),
                properties.getSnapshotEverySeconds());
    }

    @PreDestroy
    void stopFlusher() {
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        sessions.keySet().forEach(this::flush);
        log.info("State manager stopped");
    }

    public void addListener(StateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a new session at revision 0 and writes its first snapshot.
     *
     * @throws IllegalArgumentException if the session is already live
     */
    public GraphState create(String sessionId, UserContext userContext, Map<String, Double> parameters) {
        Instant now = clock.instant();
        var initial = GraphState.initial(sessionId, userContext, parameters, now);
        var slot = new SessionSlot(initial, now);
        if (sessions.putIfAbsent(sessionId, slot) != null) {
            throw new IllegalArgumentException("Session " + sessionId + " already exists");
        }
        log.info("Created session {}", sessionId);
        persist(slot, initial, 0L);
        return initial;
    }

    public long apply(String sessionId, StateMutation mutation) {
        return install(sessionId, mutation, null);
    }

    /**
     * Applies {@code mutation} only if the session is still at {@code expectedRevision}.
     *
     * @throws StaleRevisionException if another mutation got there first
     */
    public long apply(String sessionId, StateMutation mutation, long expectedRevision) {
        return install(sessionId, mutation, expectedRevision);
    }

    /**
     * Current state of a live session.
     *
     * @throws SessionNotFoundException if the session is not in memory
     */
    public GraphState get(String sessionId) {
        return requireSlot(sessionId).current;
    }

    /** Live state, or the latest stored snapshot of a session no longer in memory. */
    public Optional<GraphState> find(String sessionId) {
        var slot = sessions.get(sessionId);
        if (slot != null) {
            return Optional.of(slot.current);
        }
        return store.latest(sessionId);
    }

    /**
     * A past revision, from the history ring or else from the snapshot store.
     *
     * @throws SessionNotFoundException if neither has it
     */
    public GraphState get(String sessionId, long revision) {
        var slot = sessions.get(sessionId);
        if (slot != null) {
            slot.lock.lock();
            try {
                for (GraphState state : slot.history) {
                    if (state.revision() == revision) return state;
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return store.load(sessionId, revision)
                .orElseThrow(() -> new SessionNotFoundException(sessionId, revision));
    }

    /** Revisions still held in memory, oldest first. */
    public List<GraphState> history(String sessionId) {
        var slot = requireSlot(sessionId);
        slot.lock.lock();
        try {
            return List.copyOf(slot.history);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Restores the session to a revision still in the history ring. Newer entries are discarded and
     * the restored state is written to the store immediately.
     *
     * @return the restored state, equal to the one originally installed at {@code toRevision}
     * @throws SessionNotFoundException if the revision has left the ring
     */
    public GraphState rollback(String sessionId, long toRevision) {
        var slot = requireSlot(sessionId);
        GraphState restored;
        long generation;
        slot.lock.lock();
        try {
            if (slot.history.stream().noneMatch(s -> s.revision() == toRevision)) {
                throw new SessionNotFoundException(sessionId, toRevision);
            }
            while (slot.history.peekLast().revision() != toRevision) {
                slot.history.removeLast();
            }
            restored = slot.history.peekLast();
            slot.current = restored;
            generation = ++slot.generation;
        } finally {
            slot.lock.unlock();
        }
        log.info("Rolled session {} back to revision {}", sessionId, toRevision);
        persist(slot, restored, generation);
        return restored;
    }

    /**
     * Brings a session back after a restart from its latest snapshot. Tasks that were RUNNING when the
     * snapshot was taken are PENDING again; everything that already succeeded is kept. A session that is
     * still live is returned as is.
     *
     * @throws SessionNotFoundException if no snapshot exists
     */
    public GraphState resume(String sessionId) {
        var live = sessions.get(sessionId);
        if (live != null) {
            return live.current;
        }
        GraphState latest = store.latest(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        Instant now = clock.instant();
        TaskState requeued = latest.taskState().requeueInterrupted();
        GraphState restored = requeued.equals(latest.taskState())
                ? latest
                : latest.withTaskState(requeued).withRevision(latest.revision() + 1, now);
        var slot = new SessionSlot(restored, now);
        var existing = sessions.putIfAbsent(sessionId, slot);
        if (existing != null) {
            return existing.current;
        }
        log.info("Resumed session {} at revision {}", sessionId, restored.revision());
        persist(slot, restored, 0L);
        return restored;
    }

    /** Writes the current state of a live session if it has unsaved revisions. */
    public void flush(String sessionId) {
        var slot = sessions.get(sessionId);
        if (slot == null) return;
        var head = slot.head();
        if (head.generation() > slot.persistedGeneration) {
            persist(slot, head.state(), head.generation());
        }
    }

    /** Writes every session whose unsaved changes are older than the time cadence. */
    public void flushDue() {
        Instant now = clock.instant();
        Duration interval = Duration.ofSeconds(properties.getSnapshotEverySeconds());
        for (var slot : sessions.values()) {
            var head = slot.head();
            if (head.generation() > slot.persistedGeneration
                    && !slot.lastPersistedAt.plus(interval).isAfter(now)) {
                persist(slot, head.state(), head.generation());
            }
        }
    }

    /** Flushes a session and drops it from memory. Later reads fall back to the snapshot store. */
    public void archive(String sessionId) {
        flush(sessionId);
        if (sessions.remove(sessionId) != null) {
            log.debug("Archived session {}", sessionId);
        }
    }

    public boolean isLive(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /** Ids of the sessions held in memory. */
    public List<String> sessionIds() {
        return sessions.keySet().stream().sorted().toList();
    }

    private long install(String sessionId, StateMutation mutation, Long expectedRevision) {
        var slot = requireSlot(sessionId);
        GraphState previous;
        GraphState next;
        long generation;
        slot.lock.lock();
        try {
            previous = slot.current;
            if (expectedRevision != null && previous.revision() != expectedRevision) {
                throw new StaleRevisionException(sessionId, expectedRevision, previous.revision());
            }
            Instant now = clock.instant();
            next = mutation.applyTo(previous, now).withRevision(previous.revision() + 1, now);
            slot.current = next;
            generation = ++slot.generation;
            slot.history.addLast(next);
            while (slot.history.size() > properties.getHistoryDepth()) {
                slot.history.removeFirst();
            }
        } finally {
            slot.lock.unlock();
        }
        log.debug("Session {} revision {}: {}", sessionId, next.revision(), mutation.describe());

        notifyListeners(previous, next, mutation);

        boolean finished = next.sessionStatus().isFinished() && !previous.sessionStatus().isFinished();
        if (finished || recordsFinishedWork(mutation, next)
                || next.revision() - slot.persistedRevision >= properties.getSnapshotEveryRevisions()) {
            persist(slot, next, generation);
        }
        return next.revision();
    }

    /** Changes that must reach the store before anything else happens to the session. */
    private static boolean recordsFinishedWork(StateMutation mutation, GraphState next) {
        if (mutation instanceof StateMutation.AddTask || mutation instanceof StateMutation.RecordResult
                || mutation instanceof StateMutation.RecordIntegration) {
            return true;
        }
        if (mutation instanceof StateMutation.TransitionTask transition) {
            return next.taskState().task(transition.taskId()).map(Task::isTerminal).orElse(false);
        }
        return false;
    }

    private void notifyListeners(GraphState previous, GraphState next, StateMutation mutation) {
        for (StateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next, mutation);
            } catch (Exception e) {
                log.warn("State listener threw exception for session {}: {}", next.sessionId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Writes {@code state}, installed as the slot's {@code generation}-th change, unless a later change
     * has already been written.
     */
    private void persist(SessionSlot slot, GraphState state, long generation) {
        synchronized (slot.persistLock) {
            if (generation <= slot.persistedGeneration) {
                log.debug("Snapshot of session {} at revision {} superseded, not written",
                        state.sessionId(), state.revision());
                return;
            }
            try {
                store.save(state);
                slot.persistedGeneration = generation;
                slot.persistedRevision = state.revision();
                slot.lastPersistedAt = clock.instant();
            } catch (SnapshotPersistenceException e) {
                log.warn("Snapshot of session {} at revision {} not written: {}",
                        state.sessionId(), state.revision(), e.getMessage(), e);
            }
        }
    }

    private SessionSlot requireSlot(String sessionId) {
        var slot = sessions.get(sessionId);
        if (slot == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return slot;
    }

    private static final class SessionSlot {
        final ReentrantLock lock = new ReentrantLock();
        final Object persistLock = new Object();
        final Deque<GraphState> history = new ArrayDeque<>();
        volatile GraphState current;
        /** Count of changes installed in this process; guarded by {@code lock}. */
        long generation;
        volatile long persistedGeneration = -1;
        volatile long persistedRevision = -1;
        volatile Instant lastPersistedAt;

        SessionSlot(GraphState initial, Instant now) {
            this.current = initial;
            this.history.addLast(initial);
            this.lastPersistedAt = now;
        }

        /** Current state and its generation, read together. */
        Head head() {
            lock.lock();
            try {
                return new Head(current, generation);
            } finally {
                lock.unlock();
            }
        }
    }

    private record Head(GraphState state, long generation) {}
}
