package com.aistudio.orchestrator.workflow;

import java.util.List;

/** Immutable, ordered list of steps; defined once per workflow type. */
public record WorkflowDefinition(
        String             workflowId,
        String             name,
        String             description,
        String             version,
        List<WorkflowStep> steps) {

    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public WorkflowDefinition(String workflowId, String name, String description, List<WorkflowStep> steps) {
        this(workflowId, name, description, "1.0.0", steps);
    }
}
