package io.agentkeep.memory;

/**
 * Tiering configuration. Immutable; start from {@link #defaults()} or {@link #builder()}.
 *
 * @param hotTokenLimit       token budget of the hot tier
 * @param warmAccessThreshold access count from which a spilled item goes to warm instead of cold
 * @param promoteThreshold    recall relevance from which an item is promoted back to hot
 * @param maxColdItems        cold items kept per session by {@link MemoryTierCache#pruneCold}
 * @param autoSpillEnabled    spill before inserting or promoting past the hot budget
 * @param autoPromoteEnabled  default for {@link RecallOptions#autoPromote()}
 */
public record MemoryConfig(
        int hotTokenLimit,
        int warmAccessThreshold,
        double promoteThreshold,
        int maxColdItems,
        boolean autoSpillEnabled,
        boolean autoPromoteEnabled
) {
    public static final int DEFAULT_HOT_TOKEN_LIMIT = 4000;
    public static final int DEFAULT_WARM_ACCESS_THRESHOLD = 3;
    public static final double DEFAULT_PROMOTE_THRESHOLD = 0.85;
    public static final int DEFAULT_MAX_COLD_ITEMS = 1000;

    public MemoryConfig {
        if (hotTokenLimit <= 0) {
            throw new IllegalArgumentException("hotTokenLimit must be positive");
        }
        if (maxColdItems < 0) {
            throw new IllegalArgumentException("maxColdItems must not be negative");
        }
    }

    public static MemoryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .hotTokenLimit(hotTokenLimit)
                .warmAccessThreshold(warmAccessThreshold)
                .promoteThreshold(promoteThreshold)
                .maxColdItems(maxColdItems)
                .autoSpillEnabled(autoSpillEnabled)
                .autoPromoteEnabled(autoPromoteEnabled);
    }

    public static class Builder {
        private int hotTokenLimit = DEFAULT_HOT_TOKEN_LIMIT;
        private int warmAccessThreshold = DEFAULT_WARM_ACCESS_THRESHOLD;
        private double promoteThreshold = DEFAULT_PROMOTE_THRESHOLD;
        private int maxColdItems = DEFAULT_MAX_COLD_ITEMS;
        private boolean autoSpillEnabled = true;
        private boolean autoPromoteEnabled = true;

        public Builder hotTokenLimit(int hotTokenLimit) {
            this.hotTokenLimit = hotTokenLimit;
            return this;
        }

        public Builder warmAccessThreshold(int warmAccessThreshold) {
            this.warmAccessThreshold = warmAccessThreshold;
            return this;
        }

        public Builder promoteThreshold(double promoteThreshold) {
            this.promoteThreshold = promoteThreshold;
            return this;
        }

        public Builder maxColdItems(int maxColdItems) {
            this.maxColdItems = maxColdItems;
            return this;
        }

        public Builder autoSpillEnabled(boolean autoSpillEnabled) {
            this.autoSpillEnabled = autoSpillEnabled;
            return this;
        }

        public Builder autoPromoteEnabled(boolean autoPromoteEnabled) {
            this.autoPromoteEnabled = autoPromoteEnabled;
            return this;
        }

        public MemoryConfig build() {
            return new MemoryConfig(hotTokenLimit, warmAccessThreshold, promoteThreshold,
                    maxColdItems, autoSpillEnabled, autoPromoteEnabled);
        }
    }
}
