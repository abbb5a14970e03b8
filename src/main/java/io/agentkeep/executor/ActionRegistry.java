package io.agentkeep.executor;

import io.agentkeep.state.AgentState;
import io.agentkeep.state.PlanStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A {@link StepRunner} that dispatches each step to the handler registered for its action.
 * An unregistered action yields an {@link FailureKind#UNKNOWN_ACTION} failure.
 */
public class ActionRegistry implements StepRunner {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionHandler> handlers = new LinkedHashMap<>();

    public ActionRegistry() {
    }

    public ActionRegistry(Map<String, ActionHandler> handlers) {
        handlers.forEach(this::register);
    }

    /**
     * Registers (or replaces) the handler for an action name.
     */
    public ActionRegistry register(String action, ActionHandler handler) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action name must not be blank");
        }
        handlers.put(action, handler);
        log.debug("Registered action handler: {}", action);
        return this;
    }

    public boolean unregister(String action) {
        return handlers.remove(action) != null;
    }

    public Set<String> actions() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public StepOutcome run(PlanStep step, AgentState state) throws Exception {
        ActionHandler handler = handlers.get(step.getAction());
        if (handler == null) {
            log.warn("No handler registered for action '{}' (step {})", step.getAction(), step.getId());
            return StepOutcome.failed(FailureKind.UNKNOWN_ACTION, "Unknown action: " + step.getAction());
        }
        return StepOutcome.completed(handler.handle(step.getParameters(), state));
    }
}
