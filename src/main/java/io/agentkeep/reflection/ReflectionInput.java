package io.agentkeep.reflection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reflection to store; id and creation time are generated by {@link ReflectionStore#store}.
 * Start from {@link #builder(String, String, ReflectionOutcome)}.
 */
public record ReflectionInput(
        String sessionId,
        String taskDescription,
        int attemptNumber,
        ReflectionOutcome outcome,
        List<String> whatWorked,
        List<String> whatDidNotWork,
        String nextStrategy,
        List<String> tags,
        List<String> relatedEntityIds
) {
    public ReflectionInput {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        if (taskDescription == null || taskDescription.isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        attemptNumber = attemptNumber > 0 ? attemptNumber : 1;
        outcome = outcome != null ? outcome : ReflectionOutcome.PARTIAL;
        whatWorked = copy(whatWorked);
        whatDidNotWork = copy(whatDidNotWork);
        nextStrategy = nextStrategy != null ? nextStrategy : "";
        tags = copy(tags);
        relatedEntityIds = copy(relatedEntityIds);
    }

    public static Builder builder(String sessionId, String taskDescription, ReflectionOutcome outcome) {
        return new Builder(sessionId, taskDescription, outcome);
    }

    private static List<String> copy(List<String> values) {
        return values != null ? values.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static class Builder {
        private final String sessionId;
        private final String taskDescription;
        private final ReflectionOutcome outcome;
        private int attemptNumber = 1;
        private final List<String> whatWorked = new ArrayList<>();
        private final List<String> whatDidNotWork = new ArrayList<>();
        private String nextStrategy = "";
        private final List<String> tags = new ArrayList<>();
        private final List<String> relatedEntityIds = new ArrayList<>();

        private Builder(String sessionId, String taskDescription, ReflectionOutcome outcome) {
            this.sessionId = sessionId;
            this.taskDescription = taskDescription;
            this.outcome = outcome;
        }

        public Builder attemptNumber(int attemptNumber) {
            this.attemptNumber = attemptNumber;
            return this;
        }

        public Builder worked(String... items) {
            whatWorked.addAll(List.of(items));
            return this;
        }

        public Builder didNotWork(String... items) {
            whatDidNotWork.addAll(List.of(items));
            return this;
        }

        public Builder nextStrategy(String nextStrategy) {
            this.nextStrategy = nextStrategy;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public Builder relatedEntityIds(String... ids) {
            relatedEntityIds.addAll(List.of(ids));
            return this;
        }

        public ReflectionInput build() {
            return new ReflectionInput(sessionId, taskDescription, attemptNumber, outcome, whatWorked,
                    whatDidNotWork, nextStrategy, tags, relatedEntityIds);
        }
    }
}
