package io.agentkeep.executor;

import io.agentkeep.checkpoint.Checkpoint;
import io.agentkeep.state.PlanStep;
import io.agentkeep.state.StepResult;

/**
 * Observer of a plan run. Callbacks are informational: an exception thrown by a
 * listener is logged and the run carries on.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {
    };

    default void onStepStart(PlanStep step, int index) {
    }

    default void onStepComplete(PlanStep step, StepResult result) {
    }

    default void onStepError(PlanStep step, StepOutcome failure) {
    }

    default void onCheckpoint(Checkpoint checkpoint) {
    }
}
