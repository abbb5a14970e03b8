package io.agentkeep.memory;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a spill.
 *
 * @param spilledCount number of items moved out of hot
 * @param spilledIds   ids of the moved items, in spill order
 * @param destinations tier each item landed in
 * @param tokensFreed  hot tokens released
 */
public record SpillResult(
        int spilledCount,
        List<String> spilledIds,
        Map<String, MemoryTier> destinations,
        int tokensFreed
) {
    public static SpillResult empty() {
        return new SpillResult(0, List.of(), Map.of(), 0);
    }
}
