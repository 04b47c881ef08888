package com.aistudio.orchestrator.agent;

/**
 * Identity and documentation contract for an agent.
 *
 * @param agentId              unique registry key, e.g. "story_planner"
 * @param name                 human-readable name
 * @param description          one sentence shown by {@code GET /api/agents}
 * @param version              semantic version
 * @param estimatedTimeSeconds rough wall-clock cost of one call
 * @param estimatedCost        rough provider cost of one call, in USD
 */
public record AgentConfig(
        String agentId,
        String name,
        String description,
        String version,
        int    estimatedTimeSeconds,
        double estimatedCost) {

    public static AgentConfig of(String agentId, String name, String description) {
        return new AgentConfig(agentId, name, description, "1.0.0", 30, 0.01);
    }
}
