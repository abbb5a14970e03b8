package io.agentkeep.memory;

import java.util.List;
import java.util.Objects;

/**
 * Which hot items to spill: the named ones, or else the {@code count} least valuable.
 */
public record SpillOptions(List<String> itemIds, Integer count) {

    public static final int DEFAULT_COUNT = 4;

    public SpillOptions {
        itemIds = itemIds != null ? itemIds.stream().filter(Objects::nonNull).toList() : null;
    }

    public static SpillOptions defaults() {
        return new SpillOptions(null, DEFAULT_COUNT);
    }

    public static SpillOptions count(int count) {
        return new SpillOptions(null, count);
    }

    public static SpillOptions items(List<String> itemIds) {
        return new SpillOptions(itemIds, null);
    }

    public int resolvedCount() {
        return count != null && count > 0 ? count : DEFAULT_COUNT;
    }
}
