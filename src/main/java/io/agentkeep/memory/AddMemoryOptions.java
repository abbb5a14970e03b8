package io.agentkeep.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for {@link MemoryTierCache#addToHot}.
 *
 * @param relevanceScore initial relevance, 1.0 when null
 * @param metadata       metadata stored with the item; values may be null
 */
public record AddMemoryOptions(Double relevanceScore, Map<String, Object> metadata) {

    public AddMemoryOptions {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static AddMemoryOptions defaults() {
        return new AddMemoryOptions(null, Map.of());
    }

    public static AddMemoryOptions withRelevance(double relevanceScore) {
        return new AddMemoryOptions(relevanceScore, Map.of());
    }
}
