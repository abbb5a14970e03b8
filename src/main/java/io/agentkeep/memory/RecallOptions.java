package io.agentkeep.memory;

import java.util.List;
import java.util.Objects;

/**
 * Options for {@link MemoryTierCache#recall}.
 *
 * @param limit        maximum items returned, 3 when not positive
 * @param autoPromote  promote highly relevant items; null falls back to the cache configuration
 * @param types        restrict to these item types; null or empty means all
 * @param minRelevance drop items scoring below this
 */
public record RecallOptions(int limit, Boolean autoPromote, List<MemoryItemType> types, double minRelevance) {

    public static final int DEFAULT_LIMIT = 3;

    public RecallOptions {
        limit = limit > 0 ? limit : DEFAULT_LIMIT;
        types = types != null ? types.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static RecallOptions defaults() {
        return new RecallOptions(DEFAULT_LIMIT, null, List.of(), 0);
    }

    public static RecallOptions limit(int limit) {
        return new RecallOptions(limit, null, List.of(), 0);
    }

    public RecallOptions withAutoPromote(boolean autoPromote) {
        return new RecallOptions(limit, autoPromote, types, minRelevance);
    }

    public RecallOptions withTypes(List<MemoryItemType> types) {
        return new RecallOptions(limit, autoPromote, types, minRelevance);
    }

    public RecallOptions withMinRelevance(double minRelevance) {
        return new RecallOptions(limit, autoPromote, types, minRelevance);
    }
}
