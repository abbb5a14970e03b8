package io.agentkeep.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentkeep.db.Ids;
import io.agentkeep.db.ProjectSchema;
import io.agentkeep.db.SqlDatabase;
import io.agentkeep.db.StoreException;
import io.agentkeep.db.Timestamps;
import io.agentkeep.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Saves, loads, lists and prunes checkpoints of one project.
 *
 * <p>Every {@link #save} is followed by a retention pass that keeps the newest
 * {@code maxCheckpoints} checkpoints of the session, ordered by
 * {@code (step_number, created_at)}. The insert and the retention pass share one
 * transaction, so a checkpoint that was just written is never pruned by a concurrent save.</p>
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    public static final int DEFAULT_MAX_CHECKPOINTS = 10;

    private static final String COLUMNS =
            "id, session_id, step_number, created_at, state_json, description, trigger_type, duration_ms, token_usage";

    private final SqlDatabase db;
    private final String projectId;
    private final String table;
    private final ObjectMapper objectMapper;
    private final int maxCheckpoints;

    public CheckpointStore(SqlDatabase db, String projectId, ObjectMapper objectMapper) {
        this(db, projectId, objectMapper, DEFAULT_MAX_CHECKPOINTS);
    }

    public CheckpointStore(SqlDatabase db, String projectId, ObjectMapper objectMapper, int maxCheckpoints) {
        if (maxCheckpoints < 1) {
            throw new IllegalArgumentException("maxCheckpoints must be at least 1");
        }
        this.db = db;
        this.projectId = projectId;
        this.table = ProjectSchema.checkpointsTable(projectId);
        this.objectMapper = objectMapper;
        this.maxCheckpoints = maxCheckpoints;
    }

    public String projectId() {
        return projectId;
    }

    public int maxCheckpoints() {
        return maxCheckpoints;
    }

    /**
     * Writes a checkpoint of the given state and prunes the session down to
     * {@code maxCheckpoints}. The returned checkpoint holds a detached copy of the state.
     */
    public Checkpoint save(String sessionId, AgentState state, SaveOptions options) {
        SaveOptions opts = options != null ? options : SaveOptions.defaults();
        String stateJson = writeState(state);

        Checkpoint checkpoint = new Checkpoint(
                Ids.generate("ckpt"),
                sessionId,
                projectId,
                state.getCurrentStepIndex(),
                Timestamps.now(),
                readState(stateJson),
                new CheckpointMetadata(opts.description(), opts.resolvedTriggerType(),
                        opts.durationMs(), opts.tokenUsage())
        );

        int pruned = db.inTransaction(() -> {
            db.execute("INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    checkpoint.id(),
                    checkpoint.sessionId(),
                    checkpoint.stepNumber(),
                    checkpoint.createdAt(),
                    stateJson,
                    checkpoint.metadata().description(),
                    checkpoint.metadata().triggerType().value(),
                    checkpoint.metadata().durationMs(),
                    checkpoint.metadata().tokenUsage());
            return pruneOldCheckpoints(sessionId);
        });

        log.debug("Saved checkpoint {} for session '{}' at step {} ({})", checkpoint.id(), sessionId,
                checkpoint.stepNumber(), checkpoint.metadata().triggerType().value());
        if (pruned > 0) {
            log.debug("Pruned {} old checkpoints for session '{}'", pruned, sessionId);
        }
        return checkpoint;
    }

    public Checkpoint save(String sessionId, AgentState state) {
        return save(sessionId, state, SaveOptions.defaults());
    }

    /**
     * Latest checkpoint of a session by {@code (step_number, created_at)}.
     */
    public Optional<Checkpoint> loadLatest(String sessionId) {
        return db.fetchOne("""
                        SELECT %s FROM %s
                        WHERE session_id = ?
                        ORDER BY step_number DESC, created_at DESC, rowid DESC
                        LIMIT 1
                        """.formatted(COLUMNS, table),
                this::toCheckpoint, sessionId);
    }

    public Optional<Checkpoint> load(String checkpointId) {
        return db.fetchOne("SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?",
                this::toCheckpoint, checkpointId);
    }

    /**
     * Checkpoint saved at a step of a session; the most recent one wins when several exist.
     */
    public Optional<Checkpoint> loadAtStep(String sessionId, int stepNumber) {
        return db.fetchOne("""
                        SELECT %s FROM %s
                        WHERE session_id = ? AND step_number = ?
                        ORDER BY created_at DESC, rowid DESC
                        LIMIT 1
                        """.formatted(COLUMNS, table),
                this::toCheckpoint, sessionId, stepNumber);
    }

    /**
     * Lists checkpoint summaries of a session, highest step first.
     */
    public List<CheckpointSummary> list(String sessionId) {
        return db.fetchMany("""
                        SELECT id, step_number, created_at, description, trigger_type, duration_ms
                        FROM %s
                        WHERE session_id = ?
                        ORDER BY step_number DESC, created_at DESC, rowid DESC
                        """.formatted(table),
                rs -> new CheckpointSummary(
                        rs.getString("id"),
                        rs.getInt("step_number"),
                        Timestamps.parse(rs.getString("created_at")),
                        rs.getString("description"),
                        TriggerType.fromString(rs.getString("trigger_type")),
                        rs.getLong("duration_ms")
                ),
                sessionId);
    }

    /**
     * Distinct session ids that currently hold checkpoints.
     */
    public List<String> listSessions() {
        return db.fetchMany("SELECT DISTINCT session_id FROM " + table + " ORDER BY session_id",
                rs -> rs.getString(1));
    }

    public boolean delete(String checkpointId) {
        return db.execute("DELETE FROM " + table + " WHERE id = ?", checkpointId) > 0;
    }

    public int clearSession(String sessionId) {
        int deleted = db.execute("DELETE FROM " + table + " WHERE session_id = ?", sessionId);
        log.info("Cleared {} checkpoints for session '{}'", deleted, sessionId);
        return deleted;
    }

    public int count(String sessionId) {
        return db.fetchOne("SELECT COUNT(*) FROM " + table + " WHERE session_id = ?",
                rs -> rs.getInt(1), sessionId).orElse(0);
    }

    /**
     * Deletes checkpoints older than the given number of days, across all sessions.
     */
    public int pruneByAge(int days) {
        Instant cutoff = Timestamps.now().minus(Duration.ofDays(days));
        int deleted = db.execute("DELETE FROM " + table + " WHERE created_at < ?", cutoff);
        if (deleted > 0) {
            log.info("Pruned {} checkpoints older than {} days in project '{}'", deleted, days, projectId);
        }
        return deleted;
    }

    private int pruneOldCheckpoints(String sessionId) {
        return db.execute("""
                        DELETE FROM %1$s
                        WHERE session_id = ?
                          AND id NOT IN (
                              SELECT id FROM %1$s
                              WHERE session_id = ?
                              ORDER BY step_number DESC, created_at DESC, rowid DESC
                              LIMIT ?
                          )
                        """.formatted(table),
                sessionId, sessionId, maxCheckpoints);
    }

    private Checkpoint toCheckpoint(ResultSet rs) throws SQLException {
        Object tokenUsage = rs.getObject("token_usage");
        return new Checkpoint(
                rs.getString("id"),
                rs.getString("session_id"),
                projectId,
                rs.getInt("step_number"),
                Timestamps.parse(rs.getString("created_at")),
                readState(rs.getString("state_json")),
                new CheckpointMetadata(
                        rs.getString("description"),
                        TriggerType.fromString(rs.getString("trigger_type")),
                        rs.getLong("duration_ms"),
                        tokenUsage != null ? ((Number) tokenUsage).intValue() : null
                )
        );
    }

    private String writeState(AgentState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize agent state", e);
        }
    }

    private AgentState readState(String json) {
        try {
            return objectMapper.readValue(json, AgentState.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize agent state", e);
        }
    }
}
