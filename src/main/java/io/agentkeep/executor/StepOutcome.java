package io.agentkeep.executor;

/**
 * What a {@link StepRunner} reports for one step: either an output value or a failure.
 *
 * @param success     true when the step completed
 * @param output      the step's output (completed only, may be null)
 * @param failureKind failure category (failed only)
 * @param message     failure message (failed only)
 * @param cause       exception behind the failure, if any
 */
public record StepOutcome(
        boolean success,
        Object output,
        FailureKind failureKind,
        String message,
        Throwable cause
) {
    public static StepOutcome completed(Object output) {
        return new StepOutcome(true, output, null, null, null);
    }

    public static StepOutcome failed(FailureKind kind, String message) {
        return new StepOutcome(false, null, kind, message, null);
    }

    public static StepOutcome failed(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StepOutcome(false, null, FailureKind.STEP_FAILURE, message, cause);
    }
}
