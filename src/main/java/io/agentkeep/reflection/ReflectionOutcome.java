package io.agentkeep.reflection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an attempt at a task ended.
 */
public enum ReflectionOutcome {
    SUCCESS,
    PARTIAL,
    FAILURE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReflectionOutcome fromString(String s) {
        if (s == null || s.isBlank()) return PARTIAL;
        return switch (s.toLowerCase()) {
            case "success" -> SUCCESS;
            case "failure" -> FAILURE;
            default -> PARTIAL;
        };
    }
}
