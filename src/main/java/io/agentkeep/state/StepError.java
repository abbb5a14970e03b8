package io.agentkeep.state;

import java.time.Instant;

/**
 * The last failure recorded on an {@link AgentState}.
 *
 * @param stepIndex index of the failing step in the plan
 * @param message   failure message
 * @param timestamp when the failure was recorded
 */
public record StepError(int stepIndex, String message, Instant timestamp) {
}
