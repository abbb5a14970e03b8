package io.agentkeep.state;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Execution state of an agent plan, the payload of every checkpoint.
 *
 * <p>{@link #getResults()} only ever holds entries for completed steps, and within
 * one run {@link #getCurrentStepIndex()} never decreases.</p>
 */
public class AgentState {

    private String query = "";
    private List<PlanStep> plan = new ArrayList<>();
    private int currentStepIndex;
    private List<StepResult> results = new ArrayList<>();
    private Map<String, Object> context = new LinkedHashMap<>();
    private StepError lastError;

    public AgentState() {
    }

    public AgentState(String query, List<PlanStep> plan) {
        this.query = query != null ? query : "";
        setPlan(plan);
    }

    /**
     * Fresh state for a new run. Steps are copied; a step without a status starts
     * {@code pending}, any other status the caller set is kept.
     */
    public static AgentState fresh(String query, List<PlanStep> plan) {
        List<PlanStep> steps = new ArrayList<>();
        if (plan != null) {
            for (PlanStep step : plan) {
                PlanStep copy = step.copy();
                if (copy.getStatus() == null) {
                    copy.setStatus(StepStatus.PENDING);
                }
                steps.add(copy);
            }
        }
        return new AgentState(query, steps);
    }

    /** Ids of every step that has a recorded result. */
    public Set<String> completedStepIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (StepResult result : results) {
            ids.add(result.stepId());
        }
        return ids;
    }

    @JsonIgnore
    public boolean isFinished() {
        return currentStepIndex >= plan.size();
    }

    @JsonIgnore
    public PlanStep currentStep() {
        return isFinished() ? null : plan.get(currentStepIndex);
    }

    public void advance() {
        currentStepIndex++;
    }

    public void addResult(StepResult result) {
        results.add(result);
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<PlanStep> getPlan() {
        return plan;
    }

    public void setPlan(List<PlanStep> plan) {
        this.plan = plan != null ? new ArrayList<>(plan) : new ArrayList<>();
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public void setCurrentStepIndex(int currentStepIndex) {
        this.currentStepIndex = currentStepIndex;
    }

    public List<StepResult> getResults() {
        return results;
    }

    public void setResults(List<StepResult> results) {
        this.results = results != null ? new ArrayList<>(results) : new ArrayList<>();
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
    }

    public StepError getLastError() {
        return lastError;
    }

    public void setLastError(StepError lastError) {
        this.lastError = lastError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentState other)) return false;
        return currentStepIndex == other.currentStepIndex
                && Objects.equals(query, other.query)
                && Objects.equals(plan, other.plan)
                && Objects.equals(results, other.results)
                && Objects.equals(context, other.context)
                && Objects.equals(lastError, other.lastError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, plan, currentStepIndex, results, context, lastError);
    }
}
