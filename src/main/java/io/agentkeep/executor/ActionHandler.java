package io.agentkeep.executor;

import io.agentkeep.state.AgentState;

import java.util.Map;

/**
 * Handles one action name of an {@link ActionRegistry}. The returned value becomes the
 * step's output; throwing fails the step.
 */
@FunctionalInterface
public interface ActionHandler {

    Object handle(Map<String, Object> parameters, AgentState state) throws Exception;
}
