package io.agentkeep.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a plan step: {@code pending -> running -> completed | failed}, or
 * {@code pending -> skipped} when its dependencies were not met on its turn.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static StepStatus fromString(String s) {
        if (s == null || s.isBlank()) return PENDING;
        return switch (s.toLowerCase()) {
            case "running" -> RUNNING;
            case "completed" -> COMPLETED;
            case "failed" -> FAILED;
            case "skipped" -> SKIPPED;
            default -> PENDING;
        };
    }
}
