package io.agentkeep.memory;

/**
 * Item and token counts of one tier.
 */
public record TierStats(int items, int tokens) {

    public static final TierStats EMPTY = new TierStats(0, 0);
}
