package io.agentkeep.checkpoint;

import io.agentkeep.state.AgentState;

import java.time.Instant;

/**
 * Immutable snapshot of an agent's state at a step of a session.
 *
 * @param id         generated identifier ({@code ckpt_...})
 * @param sessionId  owning session
 * @param projectId  owning project
 * @param stepNumber the state's current step index when saved
 * @param createdAt  when the checkpoint was written
 * @param state      full state snapshot
 * @param metadata   trigger, description and timing
 */
public record Checkpoint(
        String id,
        String sessionId,
        String projectId,
        int stepNumber,
        Instant createdAt,
        AgentState state,
        CheckpointMetadata metadata
) {
}
