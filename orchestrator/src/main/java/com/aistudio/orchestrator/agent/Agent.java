package com.aistudio.orchestrator.agent;

import java.util.Map;

/**
 * A self-contained unit of AI work: one call, one input map, one output map.
 *
 * Agents are stateless across calls and know nothing about workflows or jobs;
 * the {@link com.aistudio.orchestrator.workflow.SequentialWorkflowExecutor}
 * chains them through a shared context. {@code execute} runs on a background
 * worker thread and may block on provider I/O.
 *
 * <p>Every agent declared as a Spring {@code @Component} is picked up by the
 * {@link AgentRegistry} at startup.
 */
public interface Agent {

    /** Identity and informational metadata. */
    AgentConfig config();

    /**
     * Run the agent.
     *
     * @throws InputValidationException if required input fields are missing
     * @throws ExecutionCancelledException if the owning job was cancelled mid-call
     */
    Map<String, Object> execute(Map<String, Object> input, AgentContext ctx);
}
