package io.agentkeep.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectSchemaTest {

    @TempDir
    Path tempDir;

    private SQLiteDatabase db;

    @BeforeEach
    void setUp() {
        db = new SQLiteDatabase(tempDir.resolve("schema.db").toString());
        db.init();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldSanitizeProjectIds() {
        assertEquals("p_my_project_v2", ProjectSchema.sanitize("my-project.v2"));
        assertEquals("p_123", ProjectSchema.sanitize("123"));
        assertEquals("p_a_b_c", ProjectSchema.sanitize("a b/c"));
        assertEquals("p_acme_checkpoints", ProjectSchema.checkpointsTable("acme"));
        assertEquals("p_acme_memory_items", ProjectSchema.memoryItemsTable("acme"));
        assertEquals("p_acme_reflections", ProjectSchema.reflectionsTable("acme"));
    }

    @Test
    void shouldRejectBlankProjectId() {
        assertThrows(IllegalArgumentException.class, () -> ProjectSchema.sanitize(""));
        assertThrows(IllegalArgumentException.class, () -> ProjectSchema.sanitize(null));
    }

    @Test
    void shouldCreateTablesIdempotently() {
        ProjectSchema.ensureTables(db, "acme");
        ProjectSchema.ensureTables(db, "acme");

        assertTrue(tableExists("p_acme_checkpoints"));
        assertTrue(tableExists("p_acme_memory_items"));
        assertTrue(tableExists("p_acme_reflections"));
        assertEquals(List.of("acme"), ProjectSchema.listProjects(db));
    }

    @Test
    void shouldListProjectsWhenRegistryIsEmpty() {
        assertEquals(List.of(), ProjectSchema.listProjects(db));
    }

    @Test
    void shouldDropProjectTables() {
        ProjectSchema.ensureTables(db, "acme");
        ProjectSchema.ensureTables(db, "other");

        ProjectSchema.dropProject(db, "acme");

        assertFalse(tableExists("p_acme_checkpoints"));
        assertFalse(tableExists("p_acme_memory_items"));
        assertFalse(tableExists("p_acme_reflections"));
        assertTrue(tableExists("p_other_checkpoints"));
        assertEquals(List.of("other"), ProjectSchema.listProjects(db));
    }

    private boolean tableExists(String name) {
        return db.fetchOne("SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?",
                rs -> rs.getString(1), name).isPresent();
    }
}
