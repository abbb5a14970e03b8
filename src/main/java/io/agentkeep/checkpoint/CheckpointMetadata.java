package io.agentkeep.checkpoint;

/**
 * Descriptive fields stored next to a checkpoint's state.
 *
 * @param description optional human-readable note
 * @param triggerType why the checkpoint was written
 * @param durationMs  elapsed run time when the checkpoint was taken
 * @param tokenUsage  optional token usage so far
 */
public record CheckpointMetadata(
        String description,
        TriggerType triggerType,
        long durationMs,
        Integer tokenUsage
) {
}
