package io.agentkeep.reflection;

import java.util.List;
import java.util.Objects;

/**
 * Filters for {@link ReflectionStore#search}. Every filter is optional; tags match when any
 * of them is present on a reflection.
 *
 * @param sessionId       restrict to one session
 * @param taskDescription text to rank by (semantic) or match as a substring (keyword)
 * @param tags            match reflections carrying any of these tags
 * @param outcomes        restrict to these outcomes
 * @param limit           maximum results, 5 when not positive
 */
public record ReflectionQuery(
        String sessionId,
        String taskDescription,
        List<String> tags,
        List<ReflectionOutcome> outcomes,
        int limit
) {
    public static final int DEFAULT_LIMIT = 5;

    public ReflectionQuery {
        tags = tags != null ? tags.stream().filter(Objects::nonNull).toList() : List.of();
        outcomes = outcomes != null ? outcomes.stream().filter(Objects::nonNull).toList() : List.of();
        limit = limit > 0 ? limit : DEFAULT_LIMIT;
    }

    public static ReflectionQuery forTask(String taskDescription) {
        return new ReflectionQuery(null, taskDescription, List.of(), List.of(), DEFAULT_LIMIT);
    }

    public static ReflectionQuery all() {
        return new ReflectionQuery(null, null, List.of(), List.of(), DEFAULT_LIMIT);
    }

    public ReflectionQuery inSession(String sessionId) {
        return new ReflectionQuery(sessionId, taskDescription, tags, outcomes, limit);
    }

    public ReflectionQuery withTags(String... tags) {
        return new ReflectionQuery(sessionId, taskDescription, List.of(tags), outcomes, limit);
    }

    public ReflectionQuery withOutcomes(ReflectionOutcome... outcomes) {
        return new ReflectionQuery(sessionId, taskDescription, tags, List.of(outcomes), limit);
    }

    public ReflectionQuery withLimit(int limit) {
        return new ReflectionQuery(sessionId, taskDescription, tags, outcomes, limit);
    }
}
