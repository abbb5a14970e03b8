package io.agentkeep.memory;

/**
 * Turns text into a fixed-length vector for semantic recall. Optional: without a provider
 * the cache scores recall by keyword overlap.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    float[] embed(String text);
}
