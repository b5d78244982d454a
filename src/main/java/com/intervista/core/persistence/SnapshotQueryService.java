package com.intervista.core.persistence;

import com.intervista.core.model.SessionStatus;
import com.intervista.core.state.GraphState;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over stored snapshots for the CLI: which sessions exist, how they ended, and
 * what a session looked like at each stored revision.
 */
@Service
public class SnapshotQueryService {

    private final SnapshotStore store;

    public SnapshotQueryService(SnapshotStore store) {
        this.store = store;
    }

    public List<SessionSummary> listSessions() {
        var summaries = new ArrayList<SessionSummary>();
        for (String sessionId : store.sessionIds()) {
            store.latest(sessionId).ifPresent(state -> summaries.add(SessionSummary.of(state)));
        }
        return summaries;
    }

    public Optional<GraphState> latest(String sessionId) {
        return store.latest(sessionId);
    }

    public Optional<GraphState> atRevision(String sessionId, long revision) {
        return store.load(sessionId, revision);
    }

    /** Stored revisions of a session, oldest first. */
    public List<GraphState> timeline(String sessionId) {
        return store.revisions(sessionId).stream()
                .map(revision -> store.load(sessionId, revision))
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * One line of session history.
     */
    public record SessionSummary(
        String sessionId,
        long revision,
        SessionStatus status,
        int taskCount,
        Double overallScore,
        Instant updatedAt
    ) {
        static SessionSummary of(GraphState state) {
            return new SessionSummary(state.sessionId(), state.revision(), state.sessionStatus(),
                    state.taskState().tasks().size(), state.feedback().overallScore(), state.updatedAt());
        }
    }
}
