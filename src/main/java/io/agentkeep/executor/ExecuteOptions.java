package io.agentkeep.executor;

/**
 * Options for {@link PlanExecutor#execute}.
 *
 * @param query                query recorded on a fresh state
 * @param resumeFromCheckpoint continue from the session's latest checkpoint, ignoring the supplied plan
 * @param autoCheckpoint       checkpoint after each completed step and at the end of the run
 * @param listener             observer of the run
 */
public record ExecuteOptions(
        String query,
        boolean resumeFromCheckpoint,
        boolean autoCheckpoint,
        ExecutionListener listener
) {
    public ExecuteOptions {
        query = query != null ? query : "";
        listener = listener != null ? listener : ExecutionListener.NONE;
    }

    public static ExecuteOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecuteOptions withResume(boolean resume) {
        return new ExecuteOptions(query, resume, autoCheckpoint, listener);
    }

    public static class Builder {
        private String query = "";
        private boolean resumeFromCheckpoint;
        private boolean autoCheckpoint = true;
        private ExecutionListener listener = ExecutionListener.NONE;

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder resumeFromCheckpoint(boolean resumeFromCheckpoint) {
            this.resumeFromCheckpoint = resumeFromCheckpoint;
            return this;
        }

        public Builder autoCheckpoint(boolean autoCheckpoint) {
            this.autoCheckpoint = autoCheckpoint;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        public ExecuteOptions build() {
            return new ExecuteOptions(query, resumeFromCheckpoint, autoCheckpoint, listener);
        }
    }
}
