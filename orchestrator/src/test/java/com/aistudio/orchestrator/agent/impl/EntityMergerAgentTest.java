package com.aistudio.orchestrator.agent.impl;

import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.provider.TextGenerationProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityMergerAgentTest {

    @Mock TextGenerationProvider text;

    static final Map<String, Object> SOURCE = Map.of("id", "c1", "name", "Luna", "tags", List.of("brave"));
    static final Map<String, Object> TARGET = Map.of("id", "c2", "name", "", "hair", "curly", "tags", List.of("kind"));

    private Map<String, Object> input() {
        return Map.of("entity_type", "character", "source_entity", SOURCE, "target_entity", TARGET);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fencedJsonReply_isTheProposal() {
        when(text.complete(isNull(), anyString(), anyInt())).thenReturn("""
                ```json
                {"id": "c1", "name": "Luna", "hair": "curly"}
                ```
                """);

        Map<String, Object> output = new EntityMergerAgent(text, new ObjectMapper()).execute(input(), AgentContext.standalone());

        assertThat((Map<String, Object>) output.get("merged_data"))
                .containsEntry("hair", "curly").containsEntry("id", "c1");
        assertThat((Map<String, Object>) output.get("changes_summary"))
                .containsEntry("fields_from_source", 2)
                .containsEntry("fields_from_target", 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void unparseableReply_fallsBackToFieldMerge() {
        when(text.complete(isNull(), anyString(), anyInt())).thenReturn("I think they are the same person.");

        Map<String, Object> output = new EntityMergerAgent(text, new ObjectMapper()).execute(input(), AgentContext.standalone());

        Map<String, Object> merged = (Map<String, Object>) output.get("merged_data");
        assertThat(merged).containsEntry("id", "c1").containsEntry("name", "Luna").containsEntry("hair", "curly");
        assertThat(merged.get("tags")).isEqualTo(List.of("brave", "kind"));
    }

    @Test
    void simpleMerge_targetFillsBlanksButNeverIds() {
        Map<String, Object> merged = EntityMergerAgent.simpleMerge(
                Map.of("id", "c1", "bio", ""),
                Map.of("id", "c2", "bio", "Loves stars", "owner_id", "u9"));

        assertThat(merged).containsEntry("id", "c1").containsEntry("bio", "Loves stars").doesNotContainKey("owner_id");
    }
}
