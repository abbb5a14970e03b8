package io.agentkeep.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Memory tiers, from immediately available to archived.
 *
 * <ul>
 *   <li>{@code HOT}: the working set, bounded by a token budget</li>
 *   <li>{@code WARM}: spilled items that were accessed often, recallable</li>
 *   <li>{@code COLD}: spilled items with little use, recallable and prunable</li>
 * </ul>
 */
public enum MemoryTier {
    HOT,
    WARM,
    COLD;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MemoryTier fromString(String s) {
        if (s == null || s.isBlank()) return HOT;
        return switch (s.toLowerCase()) {
            case "warm" -> WARM;
            case "cold" -> COLD;
            default -> HOT;
        };
    }
}
