package io.agentkeep.api;

import io.agentkeep.checkpoint.Checkpoint;
import io.agentkeep.checkpoint.CheckpointMetadata;
import io.agentkeep.checkpoint.CheckpointNotFoundException;
import io.agentkeep.checkpoint.SaveOptions;
import io.agentkeep.checkpoint.TriggerType;
import io.agentkeep.memory.AddMemoryOptions;
import io.agentkeep.memory.MemoryItem;
import io.agentkeep.memory.MemoryItemType;
import io.agentkeep.memory.MemoryStatus;
import io.agentkeep.memory.MemoryTier;
import io.agentkeep.memory.RecallOptions;
import io.agentkeep.memory.RecallResult;
import io.agentkeep.memory.TierStats;
import io.agentkeep.reflection.Reflection;
import io.agentkeep.reflection.ReflectionInput;
import io.agentkeep.reflection.ReflectionNotFoundException;
import io.agentkeep.reflection.ReflectionOutcome;
import io.agentkeep.reflection.ReflectionQuery;
import io.agentkeep.reflection.ReflectionSummary;
import io.agentkeep.service.AgentMemoryService;
import io.agentkeep.state.AgentState;
import io.agentkeep.state.PlanStep;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentStateController.class)
class AgentStateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AgentMemoryService memoryService;

    @Test
    void shouldSaveCheckpointAsManualByDefault() throws Exception {
        AgentState state = AgentState.fresh("deploy", List.of(new PlanStep("a", "Build", "build", Map.of())));
        var checkpoint = new Checkpoint("ckpt_1", "s1", "acme", 0, Instant.parse("2024-06-01T12:00:00Z"), state,
                new CheckpointMetadata("snapshot", TriggerType.MANUAL, 0, null));
        when(memoryService.saveCheckpoint(eq("acme"), eq("s1"), any(AgentState.class), any(SaveOptions.class)))
                .thenReturn(checkpoint);

        mockMvc.perform(post("/api/projects/acme/sessions/s1/checkpoints")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"state": {"query": "deploy", "plan": [{"id": "a", "action": "build"}]},
                                 "description": "snapshot"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("ckpt_1"))
                .andExpect(jsonPath("$.createdAt").value("2024-06-01T12:00:00Z"))
                .andExpect(jsonPath("$.metadata.triggerType").value("manual"))
                .andExpect(jsonPath("$.state.plan[0].status").value("pending"));

        ArgumentCaptor<SaveOptions> options = ArgumentCaptor.forClass(SaveOptions.class);
        verify(memoryService).saveCheckpoint(eq("acme"), eq("s1"), any(AgentState.class), options.capture());
        assertEquals(TriggerType.MANUAL, options.getValue().triggerType());
        assertEquals("snapshot", options.getValue().description());
    }

    @Test
    void shouldRejectCheckpointWithoutState() throws Exception {
        mockMvc.perform(post("/api/projects/acme/sessions/s1/checkpoints")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"empty\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturn404WhenSessionHasNoCheckpoint() throws Exception {
        when(memoryService.loadLatestCheckpoint("acme", "s1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/projects/acme/sessions/s1/checkpoints/latest"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReturn404ForMissingCheckpoint() throws Exception {
        when(memoryService.loadCheckpoint("acme", "ckpt_missing"))
                .thenThrow(new CheckpointNotFoundException("ckpt_missing"));

        mockMvc.perform(get("/api/projects/acme/checkpoints/ckpt_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Checkpoint not found: ckpt_missing"));
    }

    @Test
    void shouldReturn404WhenDeletingMissingCheckpoint() throws Exception {
        when(memoryService.deleteCheckpoint("acme", "ckpt_missing")).thenReturn(false);

        mockMvc.perform(delete("/api/projects/acme/checkpoints/ckpt_missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldAddMemoryItem() throws Exception {
        var item = new MemoryItem("mem_1", "s1", "User prefers dark mode", MemoryItemType.FACT, MemoryTier.HOT, 0,
                Instant.parse("2024-06-01T12:00:00Z"), Instant.parse("2024-06-01T12:00:00Z"), 1.0, 6, Map.of(),
                new float[]{0.1f, 0.2f});
        when(memoryService.addMemory(eq("acme"), eq("s1"), eq("User prefers dark mode"), eq(MemoryItemType.FACT),
                any(AddMemoryOptions.class))).thenReturn(item);

        mockMvc.perform(post("/api/projects/acme/sessions/s1/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"User prefers dark mode\", \"type\": \"fact\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("mem_1"))
                .andExpect(jsonPath("$.tier").value("hot"))
                .andExpect(jsonPath("$.type").value("fact"))
                .andExpect(jsonPath("$.embedding").doesNotExist());
    }

    @Test
    void shouldRejectBlankMemoryContent() throws Exception {
        mockMvc.perform(post("/api/projects/acme/sessions/s1/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRecallWithRequestedOptions() throws Exception {
        when(memoryService.recallMemory(eq("acme"), eq("s1"), eq("dark mode"), any(RecallOptions.class)))
                .thenReturn(new RecallResult(List.of(), List.of(), Map.of()));

        mockMvc.perform(post("/api/projects/acme/sessions/s1/memory/recall")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"dark mode\", \"limit\": 5, \"autoPromote\": false, \"types\": [\"fact\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isArray());

        ArgumentCaptor<RecallOptions> options = ArgumentCaptor.forClass(RecallOptions.class);
        verify(memoryService).recallMemory(eq("acme"), eq("s1"), eq("dark mode"), options.capture());
        assertEquals(5, options.getValue().limit());
        assertEquals(Boolean.FALSE, options.getValue().autoPromote());
        assertEquals(List.of(MemoryItemType.FACT), options.getValue().types());
    }

    @Test
    void shouldReturnSessionMemoryStatus() throws Exception {
        var status = new MemoryStatus("s1", new TierStats(2, 3700), 4000, 92.5, TierStats.EMPTY, TierStats.EMPTY,
                List.of());
        when(memoryService.memoryStatus("acme", "s1")).thenReturn(status);

        mockMvc.perform(get("/api/projects/acme/sessions/s1/memory/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hot.tokens").value(3700))
                .andExpect(jsonPath("$.utilizationPercent").value(92.5));
    }

    @Test
    void shouldReturn404WhenDemotingMissingItem() throws Exception {
        when(memoryService.demoteMemory("acme", "mem_missing", MemoryTier.COLD)).thenReturn(false);

        mockMvc.perform(post("/api/projects/acme/memory/mem_missing/demote").param("tier", "cold"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() throws Exception {
        when(memoryService.listSessions("bad")).thenThrow(new IllegalArgumentException("Project id rejected"));

        mockMvc.perform(get("/api/projects/bad/sessions"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Project id rejected"));
    }

    @Test
    void shouldStoreReflectionForSession() throws Exception {
        when(memoryService.storeReflection(eq("acme"), any(ReflectionInput.class))).thenReturn(sampleReflection());

        mockMvc.perform(post("/api/projects/acme/sessions/s1/reflections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"taskDescription": "Deploy billing", "outcome": "failure",
                                 "whatDidNotWork": ["Skipped migrations"], "tags": ["deploy"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("refl_1"))
                .andExpect(jsonPath("$.outcome").value("failure"));

        ArgumentCaptor<ReflectionInput> input = ArgumentCaptor.forClass(ReflectionInput.class);
        verify(memoryService).storeReflection(eq("acme"), input.capture());
        assertEquals("s1", input.getValue().sessionId());
        assertEquals(1, input.getValue().attemptNumber());
        assertEquals(ReflectionOutcome.FAILURE, input.getValue().outcome());
        assertEquals(List.of("Skipped migrations"), input.getValue().whatDidNotWork());
    }

    @Test
    void shouldRejectReflectionWithoutTaskDescription() throws Exception {
        mockMvc.perform(post("/api/projects/acme/sessions/s1/reflections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\": \"success\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRenderRecentReflectionsAsPrompt() throws Exception {
        when(memoryService.recentReflections("acme", "s1", 5)).thenReturn(List.of(sampleReflection()));

        mockMvc.perform(get("/api/projects/acme/sessions/s1/reflections/prompt"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("### Attempt 2 (failure)")));
    }

    @Test
    void shouldSearchReflectionsWithFilters() throws Exception {
        when(memoryService.searchReflections(eq("acme"), any(ReflectionQuery.class)))
                .thenReturn(List.of(sampleReflection()));

        mockMvc.perform(post("/api/projects/acme/reflections/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"taskDescription\": \"deploy\", \"outcomes\": [\"failure\"], \"limit\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].taskDescription").value("Deploy billing"));

        ArgumentCaptor<ReflectionQuery> query = ArgumentCaptor.forClass(ReflectionQuery.class);
        verify(memoryService).searchReflections(eq("acme"), query.capture());
        assertEquals(List.of(ReflectionOutcome.FAILURE), query.getValue().outcomes());
        assertEquals(3, query.getValue().limit());
        assertNull(query.getValue().sessionId());
    }

    @Test
    void shouldReturnProjectReflectionSummary() throws Exception {
        when(memoryService.reflectionSummary("acme", null))
                .thenReturn(new ReflectionSummary(4, 0.5, List.of("skipped migrations"), List.of(), List.of()));

        mockMvc.perform(get("/api/projects/acme/reflections/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalReflections").value(4))
                .andExpect(jsonPath("$.successRate").value(0.5))
                .andExpect(jsonPath("$.commonFailures[0]").value("skipped migrations"));
    }

    @Test
    void shouldReturn404ForMissingReflection() throws Exception {
        when(memoryService.getReflection("acme", "refl_missing"))
                .thenThrow(new ReflectionNotFoundException("refl_missing"));
        when(memoryService.deleteReflection("acme", "refl_missing")).thenReturn(false);

        mockMvc.perform(get("/api/projects/acme/reflections/refl_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Reflection not found: refl_missing"));
        mockMvc.perform(delete("/api/projects/acme/reflections/refl_missing"))
                .andExpect(status().isNotFound());
    }

    private static Reflection sampleReflection() {
        return new Reflection("refl_1", "s1", "acme", Instant.parse("2024-06-01T12:00:00Z"), "Deploy billing", 2,
                ReflectionOutcome.FAILURE, List.of(), List.of("Skipped migrations"), "Run migrations first",
                List.of("deploy"), List.of());
    }
}
