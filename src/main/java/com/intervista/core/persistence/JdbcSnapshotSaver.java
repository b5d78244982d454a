package com.intervista.core.persistence;

import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BaseCheckpointSaver} that keeps session snapshots in PostgreSQL, one row per write.
 * <p>
 * The checkpoint id {@code <revision>-<writeSeq>} is split into indexed columns, so the store's reads
 * ({@link #latestState}, {@link #stateAt}, {@link #revisions}) are single queries that return at most
 * one document. The {@code state} column holds the JSON session document itself.
 * <p>
 * Every database error surfaces as a {@link SnapshotPersistenceException}.
 */
public class JdbcSnapshotSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotSaver.class);

    static final String TABLE_NAME = "intervista_snapshots";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id VARCHAR(255) NOT NULL,
                revision   BIGINT       NOT NULL,
                write_seq  BIGINT       NOT NULL,
                status     VARCHAR(32),
                state      TEXT         NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (session_id, write_seq)
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %1$s_revision_idx ON %1$s (session_id, revision, write_seq DESC)
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (session_id, revision, write_seq, status, state)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (session_id, write_seq)
            DO UPDATE SET revision = EXCLUDED.revision,
                          status = EXCLUDED.status,
                          state = EXCLUDED.state,
                          created_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT revision, write_seq, status, state FROM %s
            WHERE session_id = ?
            ORDER BY write_seq DESC
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_WRITE_SQL = """
            SELECT revision, write_seq, status, state FROM %s
            WHERE session_id = ? AND revision = ? AND write_seq = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT revision, write_seq, status, state FROM %s
            WHERE session_id = ?
            ORDER BY write_seq DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_REVISION_SQL = """
            SELECT revision, write_seq, status, state FROM %s
            WHERE session_id = ? AND revision = ?
            ORDER BY write_seq DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_REVISIONS_SQL = """
            SELECT DISTINCT revision FROM %s WHERE session_id = ? ORDER BY revision
            """.formatted(TABLE_NAME);

    private static final String SELECT_SESSIONS_SQL = """
            SELECT DISTINCT session_id FROM %s ORDER BY session_id
            """.formatted(TABLE_NAME);

    private static final String DELETE_SESSION_SQL = """
            DELETE FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<Checkpoint> checkpointMapper = (rs, rowNum) -> Checkpoint.builder()
            .id(new SnapshotKey(rs.getLong("revision"), rs.getLong("write_seq")).checkpointId())
            .state(Map.of(SnapshotStore.STATE_KEY, rs.getString("state")))
            .nodeId("revision-" + rs.getLong("revision"))
            .nextNodeId(Objects.requireNonNullElse(rs.getString("status"), ""))
            .build();

    public JdbcSnapshotSaver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "JdbcTemplate must not be null");
    }

    /**
     * Creates the snapshot table and its revision index if they do not already exist. Called once at startup.
     */
    public void createTables() {
        try {
            jdbcTemplate.execute(CREATE_TABLE_SQL);
            jdbcTemplate.execute(CREATE_INDEX_SQL);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to create snapshot table " + TABLE_NAME, e);
        }
        log.info("Snapshot table '{}' ensured", TABLE_NAME);
    }

    /** Newest write first. */
    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String sessionId = resolveSessionId(config);
        try {
            return jdbcTemplate.query(SELECT_ALL_SQL, checkpointMapper, sessionId);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to list snapshots of session " + sessionId, e);
        }
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String sessionId = resolveSessionId(config);
        Optional<String> checkpointId = config.checkPointId();
        if (checkpointId.isEmpty()) {
            return first(SELECT_LATEST_SQL, "latest", sessionId);
        }
        var key = SnapshotKey.parse(checkpointId.get());
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return first(SELECT_BY_WRITE_SQL, checkpointId.get(), sessionId, key.get().revision(), key.get().writeSeq());
    }

    /**
     * @throws SnapshotPersistenceException if the checkpoint id is not {@code <revision>-<writeSeq>}
     *                                      or carries no session document
     */
    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String sessionId = resolveSessionId(config);
        var key = SnapshotKey.parse(checkpoint.getId()).orElseThrow(() -> new SnapshotPersistenceException(
                "Checkpoint id '" + checkpoint.getId() + "' is not <revision>-<writeSeq>"));
        if (!(checkpoint.getState().get(SnapshotStore.STATE_KEY) instanceof String json)) {
            throw new SnapshotPersistenceException("Checkpoint " + checkpoint.getId() + " carries no session state");
        }
        jdbcTemplate.update(UPSERT_SQL, sessionId, key.revision(), key.writeSeq(), checkpoint.getNextNodeId(), json);
        log.debug("Saved snapshot '{}' for session '{}'", checkpoint.getId(), sessionId);

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String sessionId = resolveSessionId(config);
        Collection<Checkpoint> released = list(config);
        int deleted = jdbcTemplate.update(DELETE_SESSION_SQL, sessionId);
        log.debug("Released {} snapshots of session '{}'", deleted, sessionId);
        return new Tag(sessionId, released);
    }

    /** Session document of the newest write. */
    public Optional<String> latestState(String sessionId) {
        return first(SELECT_LATEST_SQL, "latest", sessionId).map(JdbcSnapshotSaver::document);
    }

    /** Session document of the newest write of {@code revision}. */
    public Optional<String> stateAt(String sessionId, long revision) {
        return first(SELECT_REVISION_SQL, "revision " + revision, sessionId, revision).map(JdbcSnapshotSaver::document);
    }

    /** Distinct stored revisions, ascending. */
    public List<Long> revisions(String sessionId) {
        try {
            return jdbcTemplate.queryForList(SELECT_REVISIONS_SQL, Long.class, sessionId);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to list revisions of session " + sessionId, e);
        }
    }

    /** Every session with at least one stored snapshot. */
    public List<String> sessionIds() {
        try {
            return jdbcTemplate.queryForList(SELECT_SESSIONS_SQL, String.class);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to list stored sessions", e);
        }
    }

    private Optional<Checkpoint> first(String sql, String what, String sessionId, Object... more) {
        var args = new Object[more.length + 1];
        args[0] = sessionId;
        System.arraycopy(more, 0, args, 1, more.length);
        try {
            return jdbcTemplate.query(sql, checkpointMapper, args).stream().findFirst();
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to read snapshot '" + what + "' of session " + sessionId, e);
        }
    }

    private static String document(Checkpoint checkpoint) {
        return (String) checkpoint.getState().get(SnapshotStore.STATE_KEY);
    }

    private String resolveSessionId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }
}
