package io.agentkeep.embedding;

import io.agentkeep.memory.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * {@link EmbeddingProvider} backed by a Spring AI {@link EmbeddingModel}, so any embedding
 * starter on the classpath (OpenAI, Ollama, Transformers...) can drive semantic recall.
 */
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = embeddingModel.embed(text);
        log.debug("Embedded {} chars into {} dimensions", text.length(), vector.length);
        return vector;
    }
}
