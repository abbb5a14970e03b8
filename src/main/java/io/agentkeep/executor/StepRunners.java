package io.agentkeep.executor;

import java.util.Map;

/**
 * Stock {@link StepRunner} implementations.
 */
public final class StepRunners {

    private StepRunners() {
    }

    /**
     * Runner used when none is configured: every step fails with {@link FailureKind#NO_RUNNER}.
     */
    public static StepRunner unconfigured() {
        return (step, state) -> StepOutcome.failed(FailureKind.NO_RUNNER,
                "No step runner configured. Cannot execute step: " + step.getAction());
    }

    /**
     * Builds a runner from an action name to handler map.
     */
    public static ActionRegistry fromHandlers(Map<String, ActionHandler> handlers) {
        return new ActionRegistry(handlers);
    }
}
