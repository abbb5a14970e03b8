package io.agentkeep.state;

import java.time.Instant;

/**
 * Output of a successfully completed step. Appended once per completed step.
 *
 * @param stepId      id of the step that produced the output
 * @param output      whatever the step runner returned (JSON-serializable)
 * @param completedAt when the step finished
 * @param durationMs  wall-clock time spent in the step runner
 * @param tokenUsage  optional token usage reported for the step
 */
public record StepResult(
        String stepId,
        Object output,
        Instant completedAt,
        long durationMs,
        Integer tokenUsage
) {
    public StepResult(String stepId, Object output, Instant completedAt, long durationMs) {
        this(stepId, output, completedAt, durationMs, null);
    }
}
