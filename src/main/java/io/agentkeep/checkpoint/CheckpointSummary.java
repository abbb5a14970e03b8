package io.agentkeep.checkpoint;

import java.time.Instant;

/**
 * Checkpoint listing entry, without the state payload.
 */
public record CheckpointSummary(
        String id,
        int stepNumber,
        Instant createdAt,
        String description,
        TriggerType triggerType,
        long durationMs
) {
}
