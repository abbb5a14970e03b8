package io.agentkeep.executor;

import io.agentkeep.state.AgentState;
import io.agentkeep.state.PlanStep;

/**
 * Performs the side effect of a plan step.
 *
 * <p>A runner may report failure through {@link StepOutcome#failed} or by throwing;
 * the executor treats both the same way and stops the run. Timeouts are the runner's
 * concern, the executor waits for every call to return.</p>
 */
@FunctionalInterface
public interface StepRunner {

    StepOutcome run(PlanStep step, AgentState state) throws Exception;
}
