package io.agentkeep.db;

import java.util.List;

/**
 * Per-project table layout. Every project gets its own {@code p_<id>_*} tables so that
 * checkpoints and memory items of different projects never share rows.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code projects}: registry of every project that has tables</li>
 *   <li>{@code <prefix>_checkpoints}: immutable agent state snapshots per session</li>
 *   <li>{@code <prefix>_memory_items}: tiered memory items per session</li>
 *   <li>{@code <prefix>_reflections}: lessons recorded after each attempt at a task</li>
 * </ul>
 */
public final class ProjectSchema {

    private static final String PROJECTS_TABLE = """
            CREATE TABLE IF NOT EXISTS projects (
                id TEXT PRIMARY KEY,
                table_prefix TEXT NOT NULL,
                created_at TEXT NOT NULL
            )
            """;

    private ProjectSchema() {
    }

    /**
     * Derives the table prefix for a project id. Non-alphanumeric characters become
     * underscores and a {@code p_} prefix keeps identifiers from starting with a digit.
     */
    public static String sanitize(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Project id must not be blank");
        }
        return "p_" + projectId.replaceAll("[^a-zA-Z0-9]", "_");
    }

    public static String checkpointsTable(String projectId) {
        return sanitize(projectId) + "_checkpoints";
    }

    public static String memoryItemsTable(String projectId) {
        return sanitize(projectId) + "_memory_items";
    }

    public static String reflectionsTable(String projectId) {
        return sanitize(projectId) + "_reflections";
    }

    /**
     * Creates the project's tables and indexes if they do not exist yet.
     */
    public static void ensureTables(SqlDatabase db, String projectId) {
        String prefix = sanitize(projectId);
        db.executeScript(
                PROJECTS_TABLE,
                """
                CREATE TABLE IF NOT EXISTS %1$s_checkpoints (
                    id TEXT PRIMARY KEY,
                    session_id TEXT NOT NULL,
                    step_number INTEGER NOT NULL,
                    created_at TEXT NOT NULL,
                    state_json TEXT NOT NULL,
                    description TEXT,
                    trigger_type TEXT NOT NULL DEFAULT 'auto',
                    duration_ms INTEGER,
                    token_usage INTEGER
                )
                """.formatted(prefix),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_checkpoints_session ON %1$s_checkpoints(session_id, step_number)"
                        .formatted(prefix),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_checkpoints_created ON %1$s_checkpoints(created_at)"
                        .formatted(prefix),
                """
                CREATE TABLE IF NOT EXISTS %1$s_memory_items (
                    id TEXT PRIMARY KEY,
                    session_id TEXT NOT NULL,
                    content TEXT NOT NULL,
                    type TEXT NOT NULL,
                    tier TEXT NOT NULL DEFAULT 'hot',
                    access_count INTEGER NOT NULL DEFAULT 0,
                    last_accessed_at TEXT NOT NULL,
                    created_at TEXT NOT NULL,
                    relevance_score REAL NOT NULL DEFAULT 1.0,
                    token_count INTEGER NOT NULL DEFAULT 0,
                    metadata_json TEXT,
                    embedding_json TEXT
                )
                """.formatted(prefix),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_memory_session_tier ON %1$s_memory_items(session_id, tier)"
                        .formatted(prefix),
                """
                CREATE TABLE IF NOT EXISTS %1$s_reflections (
                    id TEXT PRIMARY KEY,
                    session_id TEXT NOT NULL,
                    created_at TEXT NOT NULL,
                    task_description TEXT NOT NULL,
                    attempt_number INTEGER NOT NULL DEFAULT 1,
                    outcome TEXT NOT NULL,
                    what_worked_json TEXT,
                    what_did_not_work_json TEXT,
                    next_strategy TEXT NOT NULL DEFAULT '',
                    tags_json TEXT,
                    related_entity_ids_json TEXT,
                    embedding_json TEXT
                )
                """.formatted(prefix),
                "CREATE INDEX IF NOT EXISTS idx_%1$s_reflections_session ON %1$s_reflections(session_id, created_at)"
                        .formatted(prefix)
        );
        db.execute("INSERT OR IGNORE INTO projects (id, table_prefix, created_at) VALUES (?, ?, ?)",
                projectId, prefix, Timestamps.now());
    }

    /**
     * Ids of every project registered through {@link #ensureTables}.
     */
    public static List<String> listProjects(SqlDatabase db) {
        db.executeScript(PROJECTS_TABLE);
        return db.fetchMany("SELECT id FROM projects ORDER BY id", rs -> rs.getString(1));
    }

    /**
     * Drops the project's tables and removes it from the registry.
     */
    public static void dropProject(SqlDatabase db, String projectId) {
        String prefix = sanitize(projectId);
        db.inTransaction(() -> {
            db.executeScript(
                    "DROP TABLE IF EXISTS " + prefix + "_checkpoints",
                    "DROP TABLE IF EXISTS " + prefix + "_memory_items",
                    "DROP TABLE IF EXISTS " + prefix + "_reflections");
            db.execute("DELETE FROM projects WHERE id = ?", projectId);
        });
    }
}
