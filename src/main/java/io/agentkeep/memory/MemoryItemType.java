package io.agentkeep.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of content a memory item holds.
 */
public enum MemoryItemType {
    MESSAGE,
    FACT,
    DECISION,
    ENTITY,
    CONTEXT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MemoryItemType fromString(String s) {
        if (s == null || s.isBlank()) return CONTEXT;
        return switch (s.toLowerCase()) {
            case "message" -> MESSAGE;
            case "fact" -> FACT;
            case "decision" -> DECISION;
            case "entity" -> ENTITY;
            default -> CONTEXT;
        };
    }
}
