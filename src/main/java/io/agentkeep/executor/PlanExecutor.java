package io.agentkeep.executor;

import io.agentkeep.checkpoint.Checkpoint;
import io.agentkeep.checkpoint.CheckpointNotFoundException;
import io.agentkeep.checkpoint.CheckpointStore;
import io.agentkeep.checkpoint.SaveOptions;
import io.agentkeep.checkpoint.TriggerType;
import io.agentkeep.db.Timestamps;
import io.agentkeep.state.AgentState;
import io.agentkeep.state.PlanStep;
import io.agentkeep.state.StepError;
import io.agentkeep.state.StepResult;
import io.agentkeep.state.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs an agent plan step by step, checkpointing as it goes so that a run can be resumed
 * after a failure or a restart.
 *
 * <p>Steps run strictly in plan order, one at a time. Each step is visited once per run:</p>
 * <ul>
 *   <li>an already {@code completed} step is passed over, so a resumed run never repeats it</li>
 *   <li>a step whose dependencies have no recorded result yet is marked {@code skipped};
 *       a dependency completed later in the same run does not revisit it</li>
 *   <li>otherwise the step is handed to the {@link StepRunner}</li>
 * </ul>
 *
 * <p>A failed step stops the run after an {@code error} checkpoint is written, so the
 * session's latest checkpoint points at the failure and a later resume retries it.
 * {@code execute} and {@code resume} never throw; failures come back in the
 * {@link ExecutionResult}.</p>
 */
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    static final String COMPLETE_DESCRIPTION = "Execution complete";

    private final CheckpointStore checkpointStore;
    private final StepRunner stepRunner;

    public PlanExecutor(CheckpointStore checkpointStore) {
        this(checkpointStore, null);
    }

    public PlanExecutor(CheckpointStore checkpointStore, StepRunner stepRunner) {
        this.checkpointStore = checkpointStore;
        this.stepRunner = stepRunner != null ? stepRunner : StepRunners.unconfigured();
    }

    /**
     * Executes a plan for a session.
     *
     * <p>With {@link ExecuteOptions#resumeFromCheckpoint()} set, the session's latest
     * checkpoint supplies the state and {@code plan} is ignored: the stored plan is
     * authoritative. If the session has no checkpoint, a fresh run of {@code plan} starts.</p>
     */
    public ExecutionResult execute(String sessionId, List<PlanStep> plan, ExecuteOptions options) {
        ExecuteOptions opts = options != null ? options : ExecuteOptions.defaults();
        long startTime = System.currentTimeMillis();

        AgentState state = null;
        boolean resumed = false;
        try {
            if (opts.resumeFromCheckpoint()) {
                Optional<Checkpoint> latest = checkpointStore.loadLatest(sessionId);
                if (latest.isPresent()) {
                    state = latest.get().state();
                    resumed = true;
                    log.info("Resuming session '{}' from checkpoint {} at step {}", sessionId,
                            latest.get().id(), latest.get().stepNumber());
                } else {
                    log.info("No checkpoint for session '{}', starting a fresh run", sessionId);
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to load latest checkpoint for session '{}'", sessionId, e);
            return new ExecutionResult(false, AgentState.fresh(opts.query(), plan), e.getMessage(),
                    FailureKind.STEP_FAILURE, System.currentTimeMillis() - startTime, 0, false);
        }

        if (state == null) {
            state = AgentState.fresh(opts.query(), plan);
        }
        return run(sessionId, state, opts, startTime, resumed);
    }

    public ExecutionResult execute(String sessionId, List<PlanStep> plan) {
        return execute(sessionId, plan, ExecuteOptions.defaults());
    }

    /**
     * Resumes a session from its latest checkpoint. The checkpoint's own plan is used.
     */
    public ExecutionResult resume(String sessionId, ExecuteOptions options) {
        ExecuteOptions opts = options != null ? options : ExecuteOptions.defaults();
        return execute(sessionId, List.of(), opts.withResume(true));
    }

    public ExecutionResult resume(String sessionId) {
        return resume(sessionId, ExecuteOptions.defaults());
    }

    /**
     * Resumes from a specific checkpoint.
     *
     * @throws CheckpointNotFoundException if no checkpoint has that id
     */
    public ExecutionResult resumeFrom(String checkpointId, String sessionId, ExecuteOptions options) {
        ExecuteOptions opts = options != null ? options : ExecuteOptions.defaults();
        Checkpoint checkpoint = checkpointStore.load(checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(checkpointId));

        log.info("Resuming session '{}' from checkpoint {} at step {}", sessionId, checkpointId,
                checkpoint.stepNumber());
        return run(sessionId, checkpoint.state(), opts, System.currentTimeMillis(), true);
    }

    public ExecutionResult resumeFrom(String checkpointId, String sessionId) {
        return resumeFrom(checkpointId, sessionId, ExecuteOptions.defaults());
    }

    /**
     * Saves the given state as a {@code manual} checkpoint.
     */
    public Checkpoint createManualCheckpoint(String sessionId, AgentState state, String description) {
        return checkpointStore.save(sessionId, state, SaveOptions.of(TriggerType.MANUAL, description, 0));
    }

    private ExecutionResult run(String sessionId, AgentState state, ExecuteOptions opts,
                                long startTime, boolean resumed) {
        ExecutionListener listener = opts.listener();
        int stepsExecuted = 0;

        try {
            while (!state.isFinished()) {
                int index = state.getCurrentStepIndex();
                PlanStep step = state.currentStep();

                if (step.getStatus() == StepStatus.COMPLETED) {
                    state.advance();
                    continue;
                }

                if (!dependenciesMet(step, state)) {
                    log.debug("Skipping step {} ({}): unmet dependencies {}", index, step.getId(),
                            step.getDependencies());
                    step.setStatus(StepStatus.SKIPPED);
                    state.advance();
                    continue;
                }

                step.setStatus(StepStatus.RUNNING);
                long stepStart = System.currentTimeMillis();
                notify(() -> listener.onStepStart(step, index));

                StepOutcome outcome = invoke(step, state);

                if (!outcome.success()) {
                    return fail(sessionId, state, step, index, outcome, listener, startTime, stepsExecuted, resumed);
                }

                step.setStatus(StepStatus.COMPLETED);
                StepResult result = new StepResult(step.getId(), outcome.output(), Timestamps.now(),
                        System.currentTimeMillis() - stepStart);
                state.addResult(result);
                stepsExecuted++;
                notify(() -> listener.onStepComplete(step, result));
                log.debug("Completed step {} ({}) in {}ms", index, step.getId(), result.durationMs());

                state.advance();

                if (opts.autoCheckpoint()) {
                    Checkpoint checkpoint = checkpointStore.save(sessionId, state,
                            SaveOptions.auto(System.currentTimeMillis() - startTime));
                    notify(() -> listener.onCheckpoint(checkpoint));
                }
            }

            if (opts.autoCheckpoint()) {
                Checkpoint checkpoint = checkpointStore.save(sessionId, state,
                        SaveOptions.of(TriggerType.AUTO, COMPLETE_DESCRIPTION, System.currentTimeMillis() - startTime));
                notify(() -> listener.onCheckpoint(checkpoint));
            }
        } catch (RuntimeException e) {
            log.error("Execution of session '{}' aborted", sessionId, e);
            return new ExecutionResult(false, state, e.getMessage(), FailureKind.STEP_FAILURE,
                    System.currentTimeMillis() - startTime, stepsExecuted, resumed);
        }

        long total = System.currentTimeMillis() - startTime;
        log.info("Session '{}' finished: {} steps executed in {}ms", sessionId, stepsExecuted, total);
        return new ExecutionResult(true, state, null, null, total, stepsExecuted, resumed);
    }

    private ExecutionResult fail(String sessionId, AgentState state, PlanStep step, int index,
                                 StepOutcome failure, ExecutionListener listener,
                                 long startTime, int stepsExecuted, boolean resumed) {
        step.setStatus(StepStatus.FAILED);
        state.setLastError(new StepError(index, failure.message(), Timestamps.now()));
        notify(() -> listener.onStepError(step, failure));
        log.warn("Step {} ({}) of session '{}' failed: {}", index, step.getId(), sessionId, failure.message());

        try {
            Checkpoint checkpoint = checkpointStore.save(sessionId, state, SaveOptions.of(TriggerType.ERROR,
                    "Failed at step %d: %s".formatted(index, step.getDescription()),
                    System.currentTimeMillis() - startTime));
            notify(() -> listener.onCheckpoint(checkpoint));
        } catch (RuntimeException e) {
            log.error("Failed to write error checkpoint for session '{}'", sessionId, e);
        }

        return new ExecutionResult(false, state, failure.message(), failure.failureKind(),
                System.currentTimeMillis() - startTime, stepsExecuted, resumed);
    }

    private StepOutcome invoke(PlanStep step, AgentState state) {
        try {
            StepOutcome outcome = stepRunner.run(step, state);
            return outcome != null ? outcome : StepOutcome.completed(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepOutcome.failed(e);
        } catch (Exception e) {
            return StepOutcome.failed(e);
        }
    }

    static boolean dependenciesMet(PlanStep step, AgentState state) {
        if (!step.hasDependencies()) {
            return true;
        }
        Set<String> completed = state.completedStepIds();
        return completed.containsAll(step.getDependencies());
    }

    private static void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Execution listener threw: {}", e.getMessage(), e);
        }
    }
}
