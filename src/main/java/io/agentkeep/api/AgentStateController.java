package io.agentkeep.api;

import io.agentkeep.checkpoint.Checkpoint;
import io.agentkeep.checkpoint.CheckpointNotFoundException;
import io.agentkeep.checkpoint.CheckpointSummary;
import io.agentkeep.checkpoint.SaveOptions;
import io.agentkeep.checkpoint.TriggerType;
import io.agentkeep.memory.AddMemoryOptions;
import io.agentkeep.memory.MemoryItem;
import io.agentkeep.memory.MemoryItemType;
import io.agentkeep.memory.MemoryStatus;
import io.agentkeep.memory.MemoryTier;
import io.agentkeep.memory.RecallOptions;
import io.agentkeep.memory.RecallResult;
import io.agentkeep.memory.SpillOptions;
import io.agentkeep.memory.SpillResult;
import io.agentkeep.reflection.Reflection;
import io.agentkeep.reflection.ReflectionInput;
import io.agentkeep.reflection.ReflectionNotFoundException;
import io.agentkeep.reflection.ReflectionOutcome;
import io.agentkeep.reflection.ReflectionQuery;
import io.agentkeep.reflection.ReflectionStore;
import io.agentkeep.reflection.ReflectionSummary;
import io.agentkeep.service.AgentMemoryService;
import io.agentkeep.state.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API over project checkpoints, tiered memory and reflections.
 * All routes are scoped by {@code projectId}; tables are created on first use.
 */
@RestController
@RequestMapping("/api/projects")
public class AgentStateController {

    private static final Logger log = LoggerFactory.getLogger(AgentStateController.class);

    private final AgentMemoryService memoryService;

    public AgentStateController(AgentMemoryService memoryService) {
        this.memoryService = memoryService;
    }

    @GetMapping
    public ResponseEntity<List<String>> listProjects() {
        return ResponseEntity.ok(memoryService.listProjects());
    }

    @DeleteMapping("/{projectId}")
    public ResponseEntity<Map<String, String>> deleteProject(@PathVariable String projectId) {
        memoryService.deleteProject(projectId);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", projectId));
    }

    @GetMapping("/{projectId}/sessions")
    public ResponseEntity<List<String>> listSessions(@PathVariable String projectId) {
        return ResponseEntity.ok(memoryService.listSessions(projectId));
    }

    // Checkpoints

    /**
     * Saves a checkpoint of the posted state. The trigger type defaults to {@code manual}.
     */
    @PostMapping("/{projectId}/sessions/{sessionId}/checkpoints")
    public ResponseEntity<Checkpoint> saveCheckpoint(@PathVariable String projectId,
                                                     @PathVariable String sessionId,
                                                     @RequestBody SaveCheckpointRequest request) {
        if (request.state() == null) {
            return ResponseEntity.badRequest().build();
        }
        var options = new SaveOptions(
                request.description(),
                request.triggerType() != null ? request.triggerType() : TriggerType.MANUAL,
                request.durationMs() != null ? request.durationMs() : 0,
                request.tokenUsage());
        return ResponseEntity.ok(memoryService.saveCheckpoint(projectId, sessionId, request.state(), options));
    }

    @GetMapping("/{projectId}/sessions/{sessionId}/checkpoints")
    public ResponseEntity<List<CheckpointSummary>> listCheckpoints(@PathVariable String projectId,
                                                                   @PathVariable String sessionId) {
        return ResponseEntity.ok(memoryService.listCheckpoints(projectId, sessionId));
    }

    @GetMapping("/{projectId}/sessions/{sessionId}/checkpoints/latest")
    public ResponseEntity<Checkpoint> latestCheckpoint(@PathVariable String projectId,
                                                       @PathVariable String sessionId) {
        return memoryService.loadLatestCheckpoint(projectId, sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{projectId}/sessions/{sessionId}/checkpoints")
    public ResponseEntity<Map<String, Object>> clearCheckpoints(@PathVariable String projectId,
                                                                @PathVariable String sessionId) {
        int deleted = memoryService.clearCheckpoints(projectId, sessionId);
        return ResponseEntity.ok(Map.of("status", "cleared", "deleted", deleted));
    }

    @GetMapping("/{projectId}/checkpoints/{checkpointId}")
    public ResponseEntity<Checkpoint> getCheckpoint(@PathVariable String projectId,
                                                    @PathVariable String checkpointId) {
        return ResponseEntity.ok(memoryService.loadCheckpoint(projectId, checkpointId));
    }

    @DeleteMapping("/{projectId}/checkpoints/{checkpointId}")
    public ResponseEntity<Map<String, String>> deleteCheckpoint(@PathVariable String projectId,
                                                                @PathVariable String checkpointId) {
        if (!memoryService.deleteCheckpoint(projectId, checkpointId)) {
            throw new CheckpointNotFoundException(checkpointId);
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", checkpointId));
    }

    // Memory

    @PostMapping("/{projectId}/sessions/{sessionId}/memory")
    public ResponseEntity<MemoryItem> addMemory(@PathVariable String projectId,
                                                @PathVariable String sessionId,
                                                @RequestBody AddMemoryRequest request) {
        if (request.content() == null || request.content().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        var options = new AddMemoryOptions(request.relevanceScore(), request.metadata());
        return ResponseEntity.ok(memoryService.addMemory(projectId, sessionId, request.content(),
                request.type(), options));
    }

    /**
     * Items of one tier, hot by default.
     */
    @GetMapping("/{projectId}/sessions/{sessionId}/memory")
    public ResponseEntity<List<MemoryItem>> listMemory(@PathVariable String projectId,
                                                       @PathVariable String sessionId,
                                                       @RequestParam(defaultValue = "hot") String tier) {
        return ResponseEntity.ok(memoryService.memoryTier(projectId, sessionId, MemoryTier.fromString(tier)));
    }

    @PostMapping("/{projectId}/sessions/{sessionId}/memory/spill")
    public ResponseEntity<SpillResult> spill(@PathVariable String projectId,
                                             @PathVariable String sessionId,
                                             @RequestBody(required = false) SpillRequest request) {
        SpillOptions options = request != null
                ? new SpillOptions(request.itemIds(), request.count())
                : SpillOptions.defaults();
        return ResponseEntity.ok(memoryService.spillMemory(projectId, sessionId, options));
    }

    @PostMapping("/{projectId}/sessions/{sessionId}/memory/recall")
    public ResponseEntity<RecallResult> recall(@PathVariable String projectId,
                                               @PathVariable String sessionId,
                                               @RequestBody RecallRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        var options = new RecallOptions(
                request.limit() != null ? request.limit() : RecallOptions.DEFAULT_LIMIT,
                request.autoPromote(),
                request.types(),
                request.minRelevance() != null ? request.minRelevance() : 0);
        return ResponseEntity.ok(memoryService.recallMemory(projectId, sessionId, request.query(), options));
    }

    @GetMapping("/{projectId}/sessions/{sessionId}/memory/status")
    public ResponseEntity<MemoryStatus> sessionStatus(@PathVariable String projectId,
                                                      @PathVariable String sessionId) {
        return ResponseEntity.ok(memoryService.memoryStatus(projectId, sessionId));
    }

    @GetMapping("/{projectId}/memory/status")
    public ResponseEntity<MemoryStatus> projectStatus(@PathVariable String projectId) {
        return ResponseEntity.ok(memoryService.memoryStatus(projectId, null));
    }

    @PostMapping("/{projectId}/sessions/{sessionId}/memory/prune")
    public ResponseEntity<Map<String, Object>> pruneCold(@PathVariable String projectId,
                                                         @PathVariable String sessionId) {
        int deleted = memoryService.pruneColdMemory(projectId, sessionId);
        return ResponseEntity.ok(Map.of("status", "pruned", "deleted", deleted));
    }

    @DeleteMapping("/{projectId}/sessions/{sessionId}/memory")
    public ResponseEntity<Map<String, Object>> clearMemory(@PathVariable String projectId,
                                                           @PathVariable String sessionId) {
        int deleted = memoryService.clearMemory(projectId, sessionId);
        return ResponseEntity.ok(Map.of("status", "cleared", "deleted", deleted));
    }

    @PostMapping("/{projectId}/memory/{itemId}/promote")
    public ResponseEntity<Map<String, Object>> promote(@PathVariable String projectId,
                                                       @PathVariable String itemId) {
        boolean promoted = memoryService.promoteMemory(projectId, itemId);
        return ResponseEntity.ok(Map.of("id", itemId, "promoted", promoted));
    }

    @PostMapping("/{projectId}/memory/{itemId}/demote")
    public ResponseEntity<Map<String, Object>> demote(@PathVariable String projectId,
                                                      @PathVariable String itemId,
                                                      @RequestParam(defaultValue = "warm") String tier) {
        MemoryTier target = MemoryTier.fromString(tier);
        if (!memoryService.demoteMemory(projectId, itemId, target)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("id", itemId, "tier", target.value()));
    }

    @DeleteMapping("/{projectId}/memory/{itemId}")
    public ResponseEntity<Map<String, String>> deleteMemory(@PathVariable String projectId,
                                                            @PathVariable String itemId) {
        if (!memoryService.deleteMemory(projectId, itemId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", itemId));
    }

    // Reflections

    @PostMapping("/{projectId}/sessions/{sessionId}/reflections")
    public ResponseEntity<Reflection> storeReflection(@PathVariable String projectId,
                                                      @PathVariable String sessionId,
                                                      @RequestBody ReflectionRequest request) {
        if (request.taskDescription() == null || request.taskDescription().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        var input = new ReflectionInput(
                sessionId,
                request.taskDescription(),
                request.attemptNumber() != null ? request.attemptNumber() : 1,
                request.outcome(),
                request.whatWorked(),
                request.whatDidNotWork(),
                request.nextStrategy(),
                request.tags(),
                request.relatedEntityIds());
        return ResponseEntity.ok(memoryService.storeReflection(projectId, input));
    }

    @GetMapping("/{projectId}/sessions/{sessionId}/reflections")
    public ResponseEntity<List<Reflection>> recentReflections(@PathVariable String projectId,
                                                              @PathVariable String sessionId,
                                                              @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(memoryService.recentReflections(projectId, sessionId, limit));
    }

    /**
     * Recent reflections rendered as a markdown prompt section.
     */
    @GetMapping(value = "/{projectId}/sessions/{sessionId}/reflections/prompt", produces = "text/plain")
    public ResponseEntity<String> reflectionPrompt(@PathVariable String projectId,
                                                   @PathVariable String sessionId,
                                                   @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(ReflectionStore.formatForPrompt(
                memoryService.recentReflections(projectId, sessionId, limit)));
    }

    @DeleteMapping("/{projectId}/sessions/{sessionId}/reflections")
    public ResponseEntity<Map<String, Object>> clearReflections(@PathVariable String projectId,
                                                                @PathVariable String sessionId) {
        int deleted = memoryService.clearReflections(projectId, sessionId);
        return ResponseEntity.ok(Map.of("status", "cleared", "deleted", deleted));
    }

    @PostMapping("/{projectId}/reflections/search")
    public ResponseEntity<List<Reflection>> searchReflections(@PathVariable String projectId,
                                                              @RequestBody ReflectionSearchRequest request) {
        var query = new ReflectionQuery(
                request.sessionId(),
                request.taskDescription(),
                request.tags(),
                request.outcomes(),
                request.limit() != null ? request.limit() : ReflectionQuery.DEFAULT_LIMIT);
        return ResponseEntity.ok(memoryService.searchReflections(projectId, query));
    }

    /**
     * Outcome statistics for one session, or the whole project without {@code sessionId}.
     */
    @GetMapping("/{projectId}/reflections/summary")
    public ResponseEntity<ReflectionSummary> reflectionSummary(@PathVariable String projectId,
                                                               @RequestParam(required = false) String sessionId) {
        return ResponseEntity.ok(memoryService.reflectionSummary(projectId, sessionId));
    }

    @GetMapping("/{projectId}/reflections/{reflectionId}")
    public ResponseEntity<Reflection> getReflection(@PathVariable String projectId,
                                                    @PathVariable String reflectionId) {
        return ResponseEntity.ok(memoryService.getReflection(projectId, reflectionId));
    }

    @DeleteMapping("/{projectId}/reflections/{reflectionId}")
    public ResponseEntity<Map<String, String>> deleteReflection(@PathVariable String projectId,
                                                                @PathVariable String reflectionId) {
        if (!memoryService.deleteReflection(projectId, reflectionId)) {
            throw new ReflectionNotFoundException(reflectionId);
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", reflectionId));
    }

    @ExceptionHandler(CheckpointNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleCheckpointNotFound(CheckpointNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ReflectionNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleReflectionNotFound(ReflectionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    public record SaveCheckpointRequest(
            AgentState state,
            String description,
            TriggerType triggerType,
            Long durationMs,
            Integer tokenUsage
    ) {}

    public record AddMemoryRequest(
            String content,
            MemoryItemType type,
            Double relevanceScore,
            Map<String, Object> metadata
    ) {}

    public record SpillRequest(List<String> itemIds, Integer count) {}

    public record RecallRequest(
            String query,
            Integer limit,
            Boolean autoPromote,
            List<MemoryItemType> types,
            Double minRelevance
    ) {}

    public record ReflectionRequest(
            String taskDescription,
            Integer attemptNumber,
            ReflectionOutcome outcome,
            List<String> whatWorked,
            List<String> whatDidNotWork,
            String nextStrategy,
            List<String> tags,
            List<String> relatedEntityIds
    ) {}

    public record ReflectionSearchRequest(
            String sessionId,
            String taskDescription,
            List<String> tags,
            List<ReflectionOutcome> outcomes,
            Integer limit
    ) {}
}
