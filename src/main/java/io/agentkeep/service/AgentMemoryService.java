package io.agentkeep.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentkeep.checkpoint.Checkpoint;
import io.agentkeep.checkpoint.CheckpointNotFoundException;
import io.agentkeep.checkpoint.CheckpointStore;
import io.agentkeep.checkpoint.CheckpointSummary;
import io.agentkeep.checkpoint.SaveOptions;
import io.agentkeep.db.ProjectSchema;
import io.agentkeep.db.SqlDatabase;
import io.agentkeep.executor.PlanExecutor;
import io.agentkeep.executor.StepRunner;
import io.agentkeep.memory.AddMemoryOptions;
import io.agentkeep.memory.EmbeddingProvider;
import io.agentkeep.memory.MemoryConfig;
import io.agentkeep.memory.MemoryItem;
import io.agentkeep.memory.MemoryItemType;
import io.agentkeep.memory.MemoryStatus;
import io.agentkeep.memory.MemoryTier;
import io.agentkeep.memory.MemoryTierCache;
import io.agentkeep.memory.RecallOptions;
import io.agentkeep.memory.RecallResult;
import io.agentkeep.memory.SpillOptions;
import io.agentkeep.memory.SpillResult;
import io.agentkeep.reflection.Reflection;
import io.agentkeep.reflection.ReflectionConfig;
import io.agentkeep.reflection.ReflectionInput;
import io.agentkeep.reflection.ReflectionNotFoundException;
import io.agentkeep.reflection.ReflectionQuery;
import io.agentkeep.reflection.ReflectionStore;
import io.agentkeep.reflection.ReflectionSummary;
import io.agentkeep.state.AgentState;
import io.agentkeep.state.StateJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for everything project-scoped: checkpoints, plan execution, tiered memory and
 * reflections.
 *
 * <p>One {@link CheckpointStore}, {@link MemoryTierCache} and {@link ReflectionStore} are created
 * per project on first use, after the project's tables have been ensured, and reused afterwards.</p>
 */
public class AgentMemoryService {

    private static final Logger log = LoggerFactory.getLogger(AgentMemoryService.class);

    private final SqlDatabase db;
    private final ObjectMapper objectMapper;
    private final MemoryConfig memoryConfig;
    private final EmbeddingProvider embeddingProvider;
    private final int maxCheckpoints;
    private final ReflectionConfig reflectionConfig;

    private final Map<String, CheckpointStore> checkpointStores = new ConcurrentHashMap<>();
    private final Map<String, MemoryTierCache> memoryCaches = new ConcurrentHashMap<>();
    private final Map<String, ReflectionStore> reflectionStores = new ConcurrentHashMap<>();

    public AgentMemoryService(SqlDatabase db, ObjectMapper objectMapper, MemoryConfig memoryConfig,
                              EmbeddingProvider embeddingProvider, int maxCheckpoints) {
        this(db, objectMapper, memoryConfig, embeddingProvider, maxCheckpoints, List.of());
    }

    /**
     * @param trustedPackages package prefixes of step output and context types, beyond the JDK and
     *                        {@code io.agentkeep}, that may be restored from checkpoints
     */
    public AgentMemoryService(SqlDatabase db, ObjectMapper objectMapper, MemoryConfig memoryConfig,
                              EmbeddingProvider embeddingProvider, int maxCheckpoints,
                              Collection<String> trustedPackages) {
        this(db, objectMapper, memoryConfig, embeddingProvider, maxCheckpoints, trustedPackages,
                ReflectionConfig.defaults());
    }

    public AgentMemoryService(SqlDatabase db, ObjectMapper objectMapper, MemoryConfig memoryConfig,
                              EmbeddingProvider embeddingProvider, int maxCheckpoints,
                              Collection<String> trustedPackages, ReflectionConfig reflectionConfig) {
        this.db = db;
        this.objectMapper = StateJson.configure(objectMapper, trustedPackages);
        this.memoryConfig = memoryConfig;
        this.embeddingProvider = embeddingProvider;
        this.maxCheckpoints = maxCheckpoints;
        this.reflectionConfig = reflectionConfig != null ? reflectionConfig : ReflectionConfig.defaults();
        log.info("Agent memory service ready (maxCheckpoints={}, hotTokenLimit={}, embeddings={})",
                maxCheckpoints, memoryConfig.hotTokenLimit(), embeddingProvider != null ? "on" : "keyword only");
    }

    public CheckpointStore checkpoints(String projectId) {
        return checkpointStores.computeIfAbsent(projectId, id -> {
            ProjectSchema.ensureTables(db, id);
            return new CheckpointStore(db, id, objectMapper, maxCheckpoints);
        });
    }

    public MemoryTierCache memory(String projectId) {
        return memoryCaches.computeIfAbsent(projectId, id -> {
            ProjectSchema.ensureTables(db, id);
            return new MemoryTierCache(db, id, objectMapper, embeddingProvider, memoryConfig);
        });
    }

    public ReflectionStore reflections(String projectId) {
        return reflectionStores.computeIfAbsent(projectId, id -> {
            ProjectSchema.ensureTables(db, id);
            return new ReflectionStore(db, id, objectMapper, embeddingProvider, reflectionConfig);
        });
    }

    /**
     * Executor for a project's sessions; a null runner fails every step with a no-runner error.
     */
    public PlanExecutor executor(String projectId, StepRunner stepRunner) {
        return new PlanExecutor(checkpoints(projectId), stepRunner);
    }

    public List<String> listProjects() {
        return ProjectSchema.listProjects(db);
    }

    /**
     * Forgets the cached stores of a project; the next call re-creates them.
     */
    public void clearProjectCache(String projectId) {
        checkpointStores.remove(projectId);
        memoryCaches.remove(projectId);
        reflectionStores.remove(projectId);
    }

    public void clearProjectCache() {
        checkpointStores.clear();
        memoryCaches.clear();
        reflectionStores.clear();
    }

    /**
     * Drops every table of a project.
     */
    public void deleteProject(String projectId) {
        clearProjectCache(projectId);
        ProjectSchema.dropProject(db, projectId);
        log.info("Deleted project '{}'", projectId);
    }

    // Checkpoints

    public Checkpoint saveCheckpoint(String projectId, String sessionId, AgentState state, SaveOptions options) {
        return checkpoints(projectId).save(sessionId, state, options);
    }

    public Optional<Checkpoint> loadLatestCheckpoint(String projectId, String sessionId) {
        return checkpoints(projectId).loadLatest(sessionId);
    }

    /**
     * @throws CheckpointNotFoundException if the project has no checkpoint with that id
     */
    public Checkpoint loadCheckpoint(String projectId, String checkpointId) {
        return checkpoints(projectId).load(checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(checkpointId));
    }

    public List<CheckpointSummary> listCheckpoints(String projectId, String sessionId) {
        return checkpoints(projectId).list(sessionId);
    }

    public List<String> listSessions(String projectId) {
        return checkpoints(projectId).listSessions();
    }

    public boolean deleteCheckpoint(String projectId, String checkpointId) {
        return checkpoints(projectId).delete(checkpointId);
    }

    public int clearCheckpoints(String projectId, String sessionId) {
        return checkpoints(projectId).clearSession(sessionId);
    }

    /**
     * Deletes checkpoints older than {@code days} in every registered project.
     *
     * @return total number of deleted checkpoints
     */
    public int pruneCheckpointsByAge(int days) {
        int total = 0;
        for (String projectId : listProjects()) {
            total += checkpoints(projectId).pruneByAge(days);
        }
        return total;
    }

    // Memory

    public MemoryItem addMemory(String projectId, String sessionId, String content, MemoryItemType type,
                                AddMemoryOptions options) {
        return memory(projectId).addToHot(sessionId, content, type, options);
    }

    public SpillResult spillMemory(String projectId, String sessionId, SpillOptions options) {
        return memory(projectId).spillToWarm(sessionId, options);
    }

    public RecallResult recallMemory(String projectId, String sessionId, String query, RecallOptions options) {
        return memory(projectId).recall(sessionId, query, options);
    }

    public List<MemoryItem> memoryTier(String projectId, String sessionId, MemoryTier tier) {
        return memory(projectId).getByTier(sessionId, tier);
    }

    public boolean promoteMemory(String projectId, String itemId) {
        return memory(projectId).promoteToHot(itemId);
    }

    public boolean demoteMemory(String projectId, String itemId, MemoryTier tier) {
        return memory(projectId).demote(itemId, tier);
    }

    public boolean deleteMemory(String projectId, String itemId) {
        return memory(projectId).delete(itemId);
    }

    public MemoryStatus memoryStatus(String projectId, String sessionId) {
        return sessionId != null ? memory(projectId).getStatus(sessionId) : memory(projectId).getStatusAll();
    }

    public int pruneColdMemory(String projectId, String sessionId) {
        return memory(projectId).pruneCold(sessionId);
    }

    public int clearMemory(String projectId, String sessionId) {
        return memory(projectId).clearSession(sessionId);
    }

    // Reflections

    public Reflection storeReflection(String projectId, ReflectionInput input) {
        return reflections(projectId).store(input);
    }

    /**
     * @throws ReflectionNotFoundException if the project has no reflection with that id
     */
    public Reflection getReflection(String projectId, String reflectionId) {
        return reflections(projectId).get(reflectionId)
                .orElseThrow(() -> new ReflectionNotFoundException(reflectionId));
    }

    public List<Reflection> recentReflections(String projectId, String sessionId, int limit) {
        return reflections(projectId).getRecent(sessionId, limit);
    }

    public List<Reflection> searchReflections(String projectId, ReflectionQuery query) {
        return reflections(projectId).search(query);
    }

    /**
     * @param sessionId null summarizes the whole project
     */
    public ReflectionSummary reflectionSummary(String projectId, String sessionId) {
        return reflections(projectId).getSummary(sessionId);
    }

    public boolean deleteReflection(String projectId, String reflectionId) {
        return reflections(projectId).delete(reflectionId);
    }

    public int clearReflections(String projectId, String sessionId) {
        return reflections(projectId).clearSession(sessionId);
    }
}
