package com.aistudio.orchestrator.agent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/** Scriptable agent for tests; records every input it receives. */
public class StubAgent implements Agent {

    private final AgentConfig config;
    private final BiFunction<Map<String, Object>, AgentContext, Map<String, Object>> behaviour;
    private final List<Map<String, Object>> calls = new CopyOnWriteArrayList<>();

    public StubAgent(String agentId, BiFunction<Map<String, Object>, AgentContext, Map<String, Object>> behaviour) {
        this.config    = AgentConfig.of(agentId, agentId, "stub " + agentId);
        this.behaviour = behaviour;
    }

    public static StubAgent returning(String agentId, Map<String, Object> output) {
        return new StubAgent(agentId, (input, ctx) -> output);
    }

    public static StubAgent failing(String agentId, RuntimeException error) {
        return new StubAgent(agentId, (input, ctx) -> { throw error; });
    }

    @Override
    public AgentConfig config() {
        return config;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, AgentContext ctx) {
        calls.add(input);
        return behaviour.apply(input, ctx);
    }

    public List<Map<String, Object>> calls() {
        return calls;
    }
}
