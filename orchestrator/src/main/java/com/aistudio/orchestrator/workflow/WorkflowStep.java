package com.aistudio.orchestrator.workflow;

import java.util.List;
import java.util.Objects;

/**
 * One step of a workflow: which agent runs, which context keys it reads and
 * which it writes.
 *
 * @param inputs  context keys copied into the agent input; absent keys are omitted
 * @param outputs bindings applied to the agent result, in order
 */
public record WorkflowStep(
        String              stepId,
        String              agentId,
        String              description,
        List<String>        inputs,
        List<OutputBinding> outputs) {

    public WorkflowStep {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(agentId, "agentId");
        inputs  = inputs  == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /** Step whose outputs are all resolved with {@link OutputBinding.Kind#INFERRED}. */
    public static WorkflowStep of(String stepId, String agentId, String description,
                                  List<String> inputs, List<String> outputs) {
        return new WorkflowStep(stepId, agentId, description, inputs,
                outputs.stream().map(OutputBinding::inferred).toList());
    }

    public List<String> outputKeys() {
        return outputs.stream().map(OutputBinding::contextKey).toList();
    }
}
