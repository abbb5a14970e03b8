package io.agentkeep.executor;

import io.agentkeep.state.AgentState;

/**
 * Outcome of a plan run. Failures are reported here rather than thrown.
 *
 * @param success               true when every remaining step was completed or skipped
 * @param state                 the state as it stood when the run ended
 * @param error                 failure message, null on success
 * @param failureKind           failure category, null on success
 * @param totalDurationMs       wall-clock duration of the run
 * @param stepsExecuted         steps completed during this run
 * @param resumedFromCheckpoint true when the run started from a stored checkpoint
 */
public record ExecutionResult(
        boolean success,
        AgentState state,
        String error,
        FailureKind failureKind,
        long totalDurationMs,
        int stepsExecuted,
        boolean resumedFromCheckpoint
) {
}
