package com.aistudio.orchestrator.agent;

/**
 * An agent call failed for a reason other than invalid input or cancellation.
 *
 * Carries the agent and, inside a workflow, the step so the failure can be
 * attributed without parsing the message.
 */
public class AgentExecutionException extends RuntimeException {

    private final String agentId;
    private final String stepId;

    public AgentExecutionException(String agentId, String stepId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
        this.stepId  = stepId;
    }

    public String getAgentId() { return agentId; }
    public String getStepId()  { return stepId; }
}
