package com.aistudio.orchestrator.agent;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process agent registry.
 *
 * All {@link Agent} beans declared as Spring {@code @Component}s are collected
 * at startup via constructor injection. The map is filled once and only read
 * afterwards.
 *
 * <p>Every call through {@link #execute} is timed and counted:
 * <pre>
 *   aistudio.agent.calls{agent, status="success|invalid_input|cancelled|error"}
 *   aistudio.agent.duration{agent}
 * </pre>
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final MeterRegistry meterRegistry;

    public AgentRegistry(List<Agent> allAgents, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Agent agent : allAgents) {
            String id = agent.config().agentId();
            if (agents.putIfAbsent(id, agent) != null) {
                throw new IllegalStateException("Duplicate agent id: '" + id + "'");
            }
            log.info("Registered agent '{}' v{}", id, agent.config().version());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Agent get(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new AgentNotFoundException(agentId);
        }
        return agent;
    }

    public Optional<Agent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /** Configs of all registered agents, sorted by id. */
    public List<AgentConfig> configs() {
        return agents.values().stream()
                .map(Agent::config)
                .sorted(Comparator.comparing(AgentConfig::agentId))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named agent.
     *
     * Validation and cancellation failures pass through unchanged; anything
     * else is wrapped in an {@link AgentExecutionException} naming the agent
     * and step.
     *
     * @throws AgentNotFoundException if no agent has this id
     */
    public Map<String, Object> execute(String agentId, Map<String, Object> input, AgentContext ctx) {
        Agent agent = get(agentId);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            Map<String, Object> output = agent.execute(input, ctx);
            return output == null ? Map.of() : output;
        } catch (InputValidationException e) {
            status = "invalid_input";
            throw e;
        } catch (ExecutionCancelledException e) {
            status = "cancelled";
            throw e;
        } catch (AgentExecutionException e) {
            status = "error";
            throw e;
        } catch (Exception e) {
            status = "error";
            throw new AgentExecutionException(agentId, ctx.stepId(),
                    "Agent '" + agentId + "' failed: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("aistudio.agent.duration", "agent", agentId));
            meterRegistry.counter("aistudio.agent.calls", "agent", agentId, "status", status).increment();
        }
    }
}
