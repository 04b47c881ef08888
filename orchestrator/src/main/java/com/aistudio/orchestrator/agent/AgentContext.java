package com.aistudio.orchestrator.agent;

/**
 * Runtime context passed to every agent invocation.
 *
 * @param jobId        owning job, or null for a direct synchronous call
 * @param stepId       workflow step being executed, or null outside a workflow
 * @param cancellation observes cancellation of the owning job
 */
public record AgentContext(String jobId, String stepId, CancellationToken cancellation) {

    public AgentContext {
        if (cancellation == null) cancellation = CancellationToken.NONE;
    }

    public static AgentContext standalone() {
        return new AgentContext(null, null, CancellationToken.NONE);
    }

    public AgentContext forStep(String stepId) {
        return new AgentContext(jobId, stepId, cancellation);
    }
}
