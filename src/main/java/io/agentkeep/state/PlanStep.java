package io.agentkeep.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of an agent plan. The executor is the only writer of {@link #status}
 * during a run.
 */
public class PlanStep {

    private String id;
    private String description;
    private String action;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private StepStatus status = StepStatus.PENDING;
    private List<String> dependencies = new ArrayList<>();

    public PlanStep() {
    }

    public PlanStep(String id, String description, String action, Map<String, Object> parameters) {
        this(id, description, action, parameters, StepStatus.PENDING, List.of());
    }

    public PlanStep(String id, String description, String action, Map<String, Object> parameters,
                    StepStatus status, List<String> dependencies) {
        this.id = id;
        this.description = description;
        this.action = action;
        setParameters(parameters);
        this.status = status != null ? status : StepStatus.PENDING;
        setDependencies(dependencies);
    }

    /**
     * Creates a pending step that must wait for the given step ids.
     */
    public static PlanStep dependingOn(String id, String description, String action, String... dependencies) {
        return new PlanStep(id, description, action, Map.of(), StepStatus.PENDING, List.of(dependencies));
    }

    /** Deep copy, so a run never mutates the caller's plan objects. */
    public PlanStep copy() {
        return new PlanStep(id, description, action, parameters, status, dependencies);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = status;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanStep other)) return false;
        return Objects.equals(id, other.id)
                && Objects.equals(description, other.description)
                && Objects.equals(action, other.action)
                && Objects.equals(parameters, other.parameters)
                && status == other.status
                && Objects.equals(dependencies, other.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, action, parameters, status, dependencies);
    }

    @Override
    public String toString() {
        return "PlanStep[" + id + " " + action + " " + status.value() + "]";
    }
}
