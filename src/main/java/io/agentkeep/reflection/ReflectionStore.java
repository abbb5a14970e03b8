package io.agentkeep.reflection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentkeep.db.Ids;
import io.agentkeep.db.ProjectSchema;
import io.agentkeep.db.SqlDatabase;
import io.agentkeep.db.StoreException;
import io.agentkeep.db.Timestamps;
import io.agentkeep.memory.EmbeddingProvider;
import io.agentkeep.memory.Relevance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Lessons an agent records after each attempt at a task, kept per project and session so that
 * later attempts can look up what worked and what did not.
 *
 * <p>Search ranks by embedding similarity when an {@link EmbeddingProvider} is configured and a
 * task description is given; otherwise the description is matched as a substring. Every store
 * trims the session and the project to the limits of {@link ReflectionConfig}, oldest first.</p>
 */
public class ReflectionStore {

    private static final Logger log = LoggerFactory.getLogger(ReflectionStore.class);

    static final int PATTERN_SAMPLE_SIZE = 20;
    static final int TOP_PATTERNS = 5;
    static final int RECENT_LESSONS = 5;

    private static final String COLUMNS = "id, session_id, created_at, task_description, attempt_number, outcome, "
            + "what_worked_json, what_did_not_work_json, next_strategy, tags_json, related_entity_ids_json, "
            + "embedding_json";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final SqlDatabase db;
    private final String projectId;
    private final String table;
    private final ObjectMapper objectMapper;
    private final EmbeddingProvider embeddingProvider;
    private final ReflectionConfig config;

    public ReflectionStore(SqlDatabase db, String projectId, ObjectMapper objectMapper) {
        this(db, projectId, objectMapper, null, ReflectionConfig.defaults());
    }

    public ReflectionStore(SqlDatabase db, String projectId, ObjectMapper objectMapper,
                           EmbeddingProvider embeddingProvider, ReflectionConfig config) {
        this.db = db;
        this.projectId = projectId;
        this.table = ProjectSchema.reflectionsTable(projectId);
        this.objectMapper = objectMapper;
        this.embeddingProvider = embeddingProvider;
        this.config = config != null ? config : ReflectionConfig.defaults();
    }

    public ReflectionConfig config() {
        return config;
    }

    /**
     * Stores a reflection and prunes the oldest ones past the session and project limits.
     * An embedding failure propagates and nothing is written.
     */
    public Reflection store(ReflectionInput input) {
        Reflection reflection = new Reflection(
                Ids.generate("refl"),
                input.sessionId(),
                projectId,
                Timestamps.now(),
                input.taskDescription(),
                input.attemptNumber(),
                input.outcome(),
                input.whatWorked(),
                input.whatDidNotWork(),
                input.nextStrategy(),
                input.tags(),
                input.relatedEntityIds()
        );
        float[] embedding = embeddingProvider != null ? embeddingProvider.embed(reflection.embeddingText()) : null;

        int pruned = db.inTransaction(() -> {
            db.execute("INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    reflection.id(),
                    reflection.sessionId(),
                    reflection.createdAt(),
                    reflection.taskDescription(),
                    reflection.attemptNumber(),
                    reflection.outcome().value(),
                    toJson(reflection.whatWorked()),
                    toJson(reflection.whatDidNotWork()),
                    reflection.nextStrategy(),
                    toJson(reflection.tags()),
                    toJson(reflection.relatedEntityIds()),
                    embedding != null ? toJson(embedding) : null);
            return pruneSession(reflection.sessionId()) + pruneProject();
        });

        log.debug("Stored {} reflection {} for session '{}' (attempt {})", reflection.outcome().value(),
                reflection.id(), reflection.sessionId(), reflection.attemptNumber());
        if (pruned > 0) {
            log.info("Pruned {} old reflections in project '{}'", pruned, projectId);
        }
        return reflection;
    }

    public Optional<Reflection> get(String reflectionId) {
        return db.fetchOne("SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?", this::toReflection, reflectionId);
    }

    /**
     * Newest reflections of a session.
     */
    public List<Reflection> getRecent(String sessionId, int limit) {
        return db.fetchMany("SELECT " + COLUMNS + " FROM " + table
                        + " WHERE session_id = ? ORDER BY created_at DESC, rowid DESC LIMIT ?",
                this::toReflection, sessionId, limit > 0 ? limit : ReflectionQuery.DEFAULT_LIMIT);
    }

    public List<Reflection> getRecent(String sessionId) {
        return getRecent(sessionId, ReflectionQuery.DEFAULT_LIMIT);
    }

    /**
     * Every reflection of a session, newest first.
     */
    public List<Reflection> getBySession(String sessionId) {
        return db.fetchMany("SELECT " + COLUMNS + " FROM " + table
                        + " WHERE session_id = ? ORDER BY created_at DESC, rowid DESC",
                this::toReflection, sessionId);
    }

    /**
     * Finds reflections matching the query filters. With a task description and an embedding
     * provider, matches are ranked by similarity to the description, falling back to keyword
     * overlap for reflections stored without an embedding. Otherwise the description must occur
     * in the stored task description and matches come newest first.
     */
    public List<Reflection> search(ReflectionQuery query) {
        ReflectionQuery q = query != null ? query : ReflectionQuery.all();
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (q.sessionId() != null) {
            conditions.add("session_id = ?");
            params.add(q.sessionId());
        }
        if (!q.outcomes().isEmpty()) {
            StringJoiner placeholders = new StringJoiner(",");
            for (ReflectionOutcome outcome : q.outcomes()) {
                placeholders.add("?");
                params.add(outcome.value());
            }
            conditions.add("outcome IN (" + placeholders + ")");
        }
        if (!q.tags().isEmpty()) {
            StringJoiner anyTag = new StringJoiner(" OR ", "(", ")");
            for (String tag : q.tags()) {
                anyTag.add("tags_json LIKE ? ESCAPE '\\'");
                params.add("%" + escapeLike(toJson(tag)) + "%");
            }
            conditions.add(anyTag.toString());
        }

        String task = q.taskDescription();
        boolean hasTask = task != null && !task.isBlank();

        float[] queryEmbedding = hasTask && embeddingProvider != null ? embedQuery(task) : null;
        if (queryEmbedding != null) {
            List<StoredReflection> candidates = db.fetchMany("SELECT " + COLUMNS + " FROM " + table
                            + where(conditions) + " ORDER BY created_at DESC, rowid DESC",
                    this::toStored, params.toArray());

            Map<String, Double> scores = new LinkedHashMap<>();
            for (StoredReflection candidate : candidates) {
                Reflection r = candidate.reflection();
                scores.put(r.id(), candidate.embedding() != null
                        ? Relevance.cosineSimilarity(queryEmbedding, candidate.embedding())
                        : Relevance.keywordRelevance(task, r.taskDescription()));
            }
            return candidates.stream()
                    .map(StoredReflection::reflection)
                    .sorted(Comparator.comparingDouble((Reflection r) -> scores.get(r.id())).reversed())
                    .limit(q.limit())
                    .toList();
        }

        if (hasTask) {
            conditions.add("task_description LIKE ? ESCAPE '\\'");
            params.add("%" + escapeLike(task) + "%");
        }
        params.add(q.limit());
        return db.fetchMany("SELECT " + COLUMNS + " FROM " + table + where(conditions)
                        + " ORDER BY created_at DESC, rowid DESC LIMIT ?",
                this::toReflection, params.toArray());
    }

    /**
     * Outcome statistics, recurring failure and success patterns and the newest lessons of a
     * session, or of the whole project when {@code sessionId} is null.
     */
    public ReflectionSummary getSummary(String sessionId) {
        String scope = sessionId != null ? " WHERE session_id = ?" : "";
        Object[] scopeParams = sessionId != null ? new Object[]{sessionId} : new Object[0];

        Map<ReflectionOutcome, Integer> counts = new LinkedHashMap<>();
        db.fetchMany("SELECT outcome, COUNT(*) AS n FROM " + table + scope + " GROUP BY outcome",
                rs -> {
                    counts.merge(ReflectionOutcome.fromString(rs.getString("outcome")), rs.getInt("n"), Integer::sum);
                    return null;
                },
                scopeParams);
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        int successes = counts.getOrDefault(ReflectionOutcome.SUCCESS, 0);

        List<String> failures = recentLessonEntries("what_did_not_work_json", ReflectionOutcome.FAILURE, sessionId);
        List<String> strategies = recentLessonEntries("what_worked_json", ReflectionOutcome.SUCCESS, sessionId);
        List<Reflection> recent = db.fetchMany("SELECT " + COLUMNS + " FROM " + table + scope
                        + " ORDER BY created_at DESC, rowid DESC LIMIT " + RECENT_LESSONS,
                this::toReflection, scopeParams);

        return new ReflectionSummary(
                total,
                total > 0 ? (double) successes / total : 0,
                commonPatterns(failures),
                commonPatterns(strategies),
                recent);
    }

    public ReflectionSummary getSummary() {
        return getSummary(null);
    }

    public boolean delete(String reflectionId) {
        return db.execute("DELETE FROM " + table + " WHERE id = ?", reflectionId) > 0;
    }

    public int clearSession(String sessionId) {
        int deleted = db.execute("DELETE FROM " + table + " WHERE session_id = ?", sessionId);
        log.info("Cleared {} reflections for session '{}'", deleted, sessionId);
        return deleted;
    }

    /**
     * Reflections of a session, or of the whole project when {@code sessionId} is null.
     */
    public int count(String sessionId) {
        if (sessionId == null) {
            return db.fetchOne("SELECT COUNT(*) FROM " + table, rs -> rs.getInt(1)).orElse(0);
        }
        return db.fetchOne("SELECT COUNT(*) FROM " + table + " WHERE session_id = ?", rs -> rs.getInt(1), sessionId)
                .orElse(0);
    }

    /**
     * Renders reflections as a markdown section to prepend to an agent prompt; empty for no reflections.
     */
    public static String formatForPrompt(List<Reflection> reflections) {
        if (reflections == null || reflections.isEmpty()) {
            return "";
        }
        StringJoiner out = new StringJoiner("\n");
        out.add("## Previous Lessons Learned\n");
        for (Reflection r : reflections) {
            out.add("### Attempt " + r.attemptNumber() + " (" + r.outcome().value() + ")");
            out.add("Task: " + r.taskDescription());
            if (!r.whatWorked().isEmpty()) {
                out.add("What worked:");
                r.whatWorked().forEach(item -> out.add("  - " + item));
            }
            if (!r.whatDidNotWork().isEmpty()) {
                out.add("What did not work:");
                r.whatDidNotWork().forEach(item -> out.add("  - " + item));
            }
            out.add("Next strategy: " + r.nextStrategy());
            out.add("");
        }
        return out.toString();
    }

    /**
     * The most frequent entries, compared case-insensitively after trimming. Ties keep the
     * order in which entries were first seen.
     */
    static List<String> commonPatterns(List<String> entries) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            counts.merge(entry.toLowerCase().trim(), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_PATTERNS)
                .map(Map.Entry::getKey)
                .toList();
    }

    private List<String> recentLessonEntries(String column, ReflectionOutcome outcome, String sessionId) {
        String sql = "SELECT " + column + " FROM " + table
                + (sessionId != null ? " WHERE session_id = ? AND outcome = ?" : " WHERE outcome = ?")
                + " ORDER BY created_at DESC, rowid DESC LIMIT " + PATTERN_SAMPLE_SIZE;
        Object[] params = sessionId != null
                ? new Object[]{sessionId, outcome.value()}
                : new Object[]{outcome.value()};

        List<String> entries = new ArrayList<>();
        db.fetchMany(sql, rs -> readList(rs.getString(1)), params).forEach(entries::addAll);
        return entries;
    }

    private int pruneSession(String sessionId) {
        return db.execute("""
                        DELETE FROM %1$s
                        WHERE session_id = ? AND id NOT IN (
                            SELECT id FROM %1$s WHERE session_id = ?
                            ORDER BY created_at DESC, rowid DESC LIMIT ?)
                        """.formatted(table),
                sessionId, sessionId, config.maxPerSession());
    }

    private int pruneProject() {
        return db.execute("""
                        DELETE FROM %1$s
                        WHERE id NOT IN (
                            SELECT id FROM %1$s ORDER BY created_at DESC, rowid DESC LIMIT ?)
                        """.formatted(table),
                config.maxPerProject());
    }

    private float[] embedQuery(String text) {
        try {
            return embeddingProvider.embed(text);
        } catch (RuntimeException e) {
            log.warn("Query embedding failed, falling back to keyword search: {}", e.getMessage());
            return null;
        }
    }

    private static String where(List<String> conditions) {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private StoredReflection toStored(ResultSet rs) throws SQLException {
        String embeddingJson = rs.getString("embedding_json");
        return new StoredReflection(toReflection(rs),
                embeddingJson != null ? fromJson(embeddingJson, new TypeReference<float[]>() {}) : null);
    }

    private Reflection toReflection(ResultSet rs) throws SQLException {
        return new Reflection(
                rs.getString("id"),
                rs.getString("session_id"),
                projectId,
                Timestamps.parse(rs.getString("created_at")),
                rs.getString("task_description"),
                rs.getInt("attempt_number"),
                ReflectionOutcome.fromString(rs.getString("outcome")),
                readList(rs.getString("what_worked_json")),
                readList(rs.getString("what_did_not_work_json")),
                rs.getString("next_strategy"),
                readList(rs.getString("tags_json")),
                readList(rs.getString("related_entity_ids_json"))
        );
    }

    private List<String> readList(String json) {
        return json != null ? fromJson(json, STRING_LIST) : List.of();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize reflection field", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize reflection field", e);
        }
    }

    private record StoredReflection(Reflection reflection, float[] embedding) {
    }
}
