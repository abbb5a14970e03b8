package io.agentkeep.memory;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Advisory action derived from tier status.
 */
public record MemorySuggestion(Type type, String reason, List<String> itemIds) {

    public enum Type {
        SPILL,
        RECALL,
        PRUNE;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    public MemorySuggestion(Type type, String reason) {
        this(type, reason, List.of());
    }
}
