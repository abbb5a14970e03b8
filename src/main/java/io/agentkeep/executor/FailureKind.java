package io.agentkeep.executor;

/**
 * Why a step did not complete.
 */
public enum FailureKind {
    /** The step runner reported a failure or threw. */
    STEP_FAILURE,
    /** The executor was built without a step runner. */
    NO_RUNNER,
    /** No handler is registered for the step's action. */
    UNKNOWN_ACTION
}
