package io.agentkeep.memory;

import java.util.List;

/**
 * Tier usage of a session, or of a whole project when {@code sessionId} is null.
 *
 * @param sessionId          the session, null for project-wide status
 * @param hot                hot tier counts
 * @param hotLimit           hot token budget
 * @param utilizationPercent hot tokens as a percentage of the budget
 * @param warm               warm tier counts
 * @param cold               cold tier counts
 * @param suggestions        advisory actions
 */
public record MemoryStatus(
        String sessionId,
        TierStats hot,
        int hotLimit,
        double utilizationPercent,
        TierStats warm,
        TierStats cold,
        List<MemorySuggestion> suggestions
) {
    public boolean suggests(MemorySuggestion.Type type) {
        return suggestions.stream().anyMatch(s -> s.type() == type);
    }
}
