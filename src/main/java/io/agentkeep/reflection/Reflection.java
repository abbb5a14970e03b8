package io.agentkeep.reflection;

import java.time.Instant;
import java.util.List;

/**
 * Lessons recorded after one attempt at a task.
 *
 * @param id               generated identifier ({@code refl_...})
 * @param sessionId        session the attempt belonged to
 * @param projectId        owning project
 * @param createdAt        when the reflection was stored
 * @param taskDescription  what the agent was trying to do
 * @param attemptNumber    1 for the first attempt
 * @param outcome          how the attempt ended
 * @param whatWorked       approaches worth repeating
 * @param whatDidNotWork   approaches to avoid
 * @param nextStrategy     plan for the next attempt
 * @param tags             free-form labels used by {@link ReflectionStore#search}
 * @param relatedEntityIds ids of entities the attempt touched
 */
public record Reflection(
        String id,
        String sessionId,
        String projectId,
        Instant createdAt,
        String taskDescription,
        int attemptNumber,
        ReflectionOutcome outcome,
        List<String> whatWorked,
        List<String> whatDidNotWork,
        String nextStrategy,
        List<String> tags,
        List<String> relatedEntityIds
) {
    /** Text embedded for semantic search: the task, both lesson lists and the next strategy. */
    public String embeddingText() {
        StringBuilder text = new StringBuilder(taskDescription);
        whatWorked.forEach(item -> text.append(' ').append(item));
        whatDidNotWork.forEach(item -> text.append(' ').append(item));
        return text.append(' ').append(nextStrategy).toString();
    }
}
