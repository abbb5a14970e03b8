package io.agentkeep.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentkeep.db.SQLiteDatabase;
import io.agentkeep.embedding.SpringAiEmbeddingProvider;
import io.agentkeep.memory.EmbeddingProvider;
import io.agentkeep.memory.MemoryConfig;
import io.agentkeep.reflection.ReflectionConfig;
import io.agentkeep.service.AgentMemoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the agent state database, the memory tiering settings and the project facade.
 * Semantic recall is enabled only when a Spring AI {@link EmbeddingModel} bean exists.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public SQLiteDatabase agentDatabase(@Value("${agentkeep.db.path:./data/agentkeep.db}") String dbPath) {
        return new SQLiteDatabase(dbPath);
    }

    @Bean
    public MemoryConfig memoryConfig(
            @Value("${agentkeep.memory.hot-token-limit:4000}") int hotTokenLimit,
            @Value("${agentkeep.memory.warm-access-threshold:3}") int warmAccessThreshold,
            @Value("${agentkeep.memory.promote-threshold:0.85}") double promoteThreshold,
            @Value("${agentkeep.memory.max-cold-items:1000}") int maxColdItems,
            @Value("${agentkeep.memory.auto-spill:true}") boolean autoSpill,
            @Value("${agentkeep.memory.auto-promote:true}") boolean autoPromote
    ) {
        return MemoryConfig.builder()
                .hotTokenLimit(hotTokenLimit)
                .warmAccessThreshold(warmAccessThreshold)
                .promoteThreshold(promoteThreshold)
                .maxColdItems(maxColdItems)
                .autoSpillEnabled(autoSpill)
                .autoPromoteEnabled(autoPromote)
                .build();
    }

    @Bean
    public ReflectionConfig reflectionConfig(
            @Value("${agentkeep.reflections.max-per-session:20}") int maxPerSession,
            @Value("${agentkeep.reflections.max-per-project:100}") int maxPerProject
    ) {
        return new ReflectionConfig(maxPerSession, maxPerProject);
    }

    @Bean
    public AgentMemoryService agentMemoryService(
            SQLiteDatabase agentDatabase,
            ObjectMapper objectMapper,
            MemoryConfig memoryConfig,
            ReflectionConfig reflectionConfig,
            ObjectProvider<EmbeddingModel> embeddingModel,
            @Value("${agentkeep.checkpoints.max:10}") int maxCheckpoints,
            @Value("${agentkeep.state.trusted-packages:}") List<String> trustedPackages
    ) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        EmbeddingProvider embeddingProvider = null;
        if (model != null) {
            embeddingProvider = new SpringAiEmbeddingProvider(model);
            log.info("Semantic recall enabled with embedding model {}", model.getClass().getSimpleName());
        } else {
            log.info("No EmbeddingModel configured, memory recall uses keyword relevance");
        }
        return new AgentMemoryService(agentDatabase, objectMapper, memoryConfig, embeddingProvider, maxCheckpoints,
                trustedPackages, reflectionConfig);
    }
}
