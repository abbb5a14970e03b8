package io.agentkeep.memory;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a recall.
 *
 * @param items           recalled items, most relevant first, as stored after the recall
 * @param promoted        ids promoted back to hot
 * @param relevanceScores query relevance of every candidate scanned
 */
public record RecallResult(List<MemoryItem> items, List<String> promoted, Map<String, Double> relevanceScores) {

    public int tokensRecalled() {
        return items.stream().mapToInt(MemoryItem::tokenCount).sum();
    }
}
