package io.agentkeep.reflection;

import java.util.List;

/**
 * Aggregate view of the reflections of a session or a whole project.
 *
 * @param totalReflections    number of reflections counted
 * @param successRate         share of {@code success} outcomes, 0 when there are none
 * @param commonFailures      most frequent "did not work" entries of recent failures
 * @param effectiveStrategies most frequent "worked" entries of recent successes
 * @param recentLessons       the five newest reflections
 */
public record ReflectionSummary(
        int totalReflections,
        double successRate,
        List<String> commonFailures,
        List<String> effectiveStrategies,
        List<Reflection> recentLessons
) {
}
