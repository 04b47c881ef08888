package com.aistudio.orchestrator.agent;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRegistryTest {

    SimpleMeterRegistry meters = new SimpleMeterRegistry();

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    @Test
    void configs_areSortedById() {
        AgentRegistry registry = new AgentRegistry(List.of(
                StubAgent.returning("story_writer", Map.of()),
                StubAgent.returning("image_generator", Map.of())), meters);

        assertThat(registry.configs()).extracting(AgentConfig::agentId)
                .containsExactly("image_generator", "story_writer");
    }

    @Test
    void duplicateAgentId_failsAtStartup() {
        assertThatThrownBy(() -> new AgentRegistry(List.of(
                StubAgent.returning("dup", Map.of()),
                StubAgent.returning("dup", Map.of())), meters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dup");
    }

    @Test
    void get_unknownAgent_throwsNotFound() {
        AgentRegistry registry = new AgentRegistry(List.of(), meters);

        assertThatThrownBy(() -> registry.get("nope"))
                .isInstanceOf(AgentNotFoundException.class)
                .hasMessageContaining("nope");
        assertThat(registry.find("nope")).isEmpty();
    }

    // ------------------------------------------------------------------
    // execute()
    // ------------------------------------------------------------------

    @Test
    void execute_success_countsCallAndRecordsDuration() {
        AgentRegistry registry = new AgentRegistry(List.of(StubAgent.returning("a", Map.of("x", 1))), meters);

        Map<String, Object> output = registry.execute("a", Map.of(), AgentContext.standalone());

        assertThat(output).containsEntry("x", 1);
        assertThat(meters.counter("aistudio.agent.calls", "agent", "a", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("aistudio.agent.duration", "agent", "a").count()).isEqualTo(1);
    }

    @Test
    void execute_nullOutput_becomesEmptyMap() {
        AgentRegistry registry = new AgentRegistry(List.of(StubAgent.returning("a", null)), meters);

        assertThat(registry.execute("a", Map.of(), AgentContext.standalone())).isEmpty();
    }

    @Test
    void execute_validationFailure_passesThroughUnwrapped() {
        Agent strict = new StubAgent("strict", (input, ctx) -> {
            AbstractAgent.validateInput(input, "character", "theme");
            return Map.of();
        });
        AgentRegistry registry = new AgentRegistry(List.of(strict), meters);

        assertThatThrownBy(() -> registry.execute("strict", Map.of(), AgentContext.standalone()))
                .isInstanceOf(InputValidationException.class);
        assertThat(meters.counter("aistudio.agent.calls", "agent", "strict", "status", "invalid_input").count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedFailure_isWrappedWithAgentAndStep() {
        AgentRegistry registry = new AgentRegistry(
                List.of(StubAgent.failing("boom", new IllegalStateException("provider down"))), meters);

        assertThatThrownBy(() -> registry.execute("boom", Map.of(), new AgentContext("job-1", "plan_story", null)))
                .isInstanceOf(AgentExecutionException.class)
                .hasMessage("Agent 'boom' failed: provider down")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void execute_cancelled_passesThroughAndIsCountedAsCancelled() {
        Agent polite = new StubAgent("polite", (input, ctx) -> {
            ctx.cancellation().throwIfCancellationRequested();
            return Map.of();
        });
        AgentRegistry registry = new AgentRegistry(List.of(polite), meters);

        assertThatThrownBy(() -> registry.execute("polite", Map.of(), new AgentContext("job-1", null, () -> true)))
                .isInstanceOf(ExecutionCancelledException.class);
        assertThat(meters.counter("aistudio.agent.calls", "agent", "polite", "status", "cancelled").count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // validateInput()
    // ------------------------------------------------------------------

    @Test
    void validateInput_listsEveryMissingField() {
        Map<String, Object> input = new HashMap<>();
        input.put("theme", "space");
        input.put("character", null);   // null counts as missing

        assertThatThrownBy(() -> AbstractAgent.validateInput(input, "character", "theme", "age_group"))
                .isInstanceOfSatisfying(InputValidationException.class, e ->
                        assertThat(e.getMissingFields()).containsExactly("character", "age_group"))
                .hasMessage("Missing required fields: character, age_group");
    }

    @Test
    void validateInput_allPresent_passes() {
        AbstractAgent.validateInput(Map.of("character", "Luna", "theme", "space"), "character", "theme");
    }
}
