package io.agentkeep.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a checkpoint was written.
 *
 * <ul>
 *   <li>{@code AUTO}: after a completed step or at the end of a run</li>
 *   <li>{@code MANUAL}: explicitly requested by the caller</li>
 *   <li>{@code ERROR}: recorded when a step failed, pointing at the failure</li>
 * </ul>
 */
public enum TriggerType {
    AUTO,
    MANUAL,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TriggerType fromString(String s) {
        if (s == null || s.isBlank()) return AUTO;
        return switch (s.toLowerCase()) {
            case "manual" -> MANUAL;
            case "error" -> ERROR;
            default -> AUTO;
        };
    }
}
