package com.aistudio.orchestrator.agent.impl;

import com.aistudio.orchestrator.agent.AbstractAgent;
import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.provider.ResponseParser;
import com.aistudio.orchestrator.provider.TextGenerationProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Proposes a merged version of two duplicate entities.
 *
 * Input:  entity_type, source_entity (kept), target_entity (archived after the merge)
 * Output: {@code {"merged_data": {...}, "changes_summary": {fields_from_source,
 *         fields_from_target, fields_merged}}}
 *
 * When the model's reply is not parseable JSON the proposal falls back to a
 * field-by-field merge that prefers the source's non-empty values.
 */
@Component
public class EntityMergerAgent extends AbstractAgent {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final TextGenerationProvider text;
    private final ObjectMapper           json;

    public EntityMergerAgent(TextGenerationProvider text, ObjectMapper json) {
        super(new AgentConfig("entity_merger", "Entity Merger",
                "Merges two duplicate entities, keeping the unique details of both", "1.0.0", 10, 0.01));
        this.text = text;
        this.json = json;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, AgentContext ctx) {
        validateInput(input, "entity_type", "source_entity", "target_entity");

        String              entityType = input.get("entity_type").toString();
        Map<String, Object> source     = mapField(input, "source_entity");
        Map<String, Object> target     = mapField(input, "target_entity");

        ctx.cancellation().throwIfCancellationRequested();
        String reply = text.complete(null, buildPrompt(entityType, source, target), 2000);

        Map<String, Object> merged = parse(reply).orElseGet(() -> {
            log.warn("Merge reply for {} is not valid JSON, using field-by-field merge", entityType);
            return simpleMerge(source, target);
        });

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("merged_data", merged);
        output.put("changes_summary", changesSummary(merged, source, target));
        return output;
    }

    private Optional<Map<String, Object>> parse(String reply) {
        Optional<String> candidate = ResponseParser.extractJson(reply);
        if (candidate.isEmpty()) return Optional.empty();
        try {
            return Optional.of(json.readValue(candidate.get(), MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable merge reply: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String buildPrompt(String entityType, Map<String, Object> source, Map<String, Object> target) {
        try {
            return """
                    Merge these two %s records that describe the same thing.
                    Keep every unique detail from both; prefer the source where they conflict.
                    Keep the source's id. Reply with the merged record as one JSON object only.

                    Source (kept):
                    %s

                    Target (merged in):
                    %s
                    """.formatted(entityType,
                    json.writerWithDefaultPrettyPrinter().writeValueAsString(source),
                    json.writerWithDefaultPrettyPrinter().writeValueAsString(target));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Entities are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Source wins for non-empty values; the target fills gaps; lists are unioned
     * and nested objects combined. Id and timestamp fields come from the source only.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> simpleMerge(Map<String, Object> source, Map<String, Object> target) {
        Map<String, Object> merged = new LinkedHashMap<>(source);
        target.forEach((key, value) -> {
            if (key.equals("id") || key.endsWith("_id") || key.endsWith("_at")) return;
            Object current = merged.get(key);
            if (isEmpty(current)) {
                merged.put(key, value);
            } else if (current instanceof Collection<?> a && value instanceof Collection<?> b) {
                LinkedHashSet<Object> union = new LinkedHashSet<>(a);
                union.addAll(b);
                merged.put(key, new ArrayList<>(union));
            } else if (current instanceof Map<?, ?> a && value instanceof Map<?, ?> b) {
                Map<String, Object> combined = new LinkedHashMap<>((Map<String, Object>) a);
                combined.putAll((Map<String, Object>) b);
                merged.put(key, combined);
            }
        });
        return merged;
    }

    /** Counts, per merged field, whether it came verbatim from the source, the target, or neither. */
    static Map<String, Object> changesSummary(Map<String, Object> merged,
                                              Map<String, Object> source,
                                              Map<String, Object> target) {
        int fromSource = 0, fromTarget = 0, mergedFields = 0;
        for (Map.Entry<String, Object> field : merged.entrySet()) {
            String key = field.getKey();
            if (source.containsKey(key) && Objects.equals(field.getValue(), source.get(key))) {
                fromSource++;
            } else if (target.containsKey(key) && Objects.equals(field.getValue(), target.get(key))) {
                fromTarget++;
            } else {
                mergedFields++;
            }
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("fields_from_source", fromSource);
        summary.put("fields_from_target", fromTarget);
        summary.put("fields_merged", mergedFields);
        return summary;
    }

    private static boolean isEmpty(Object value) {
        return value == null
                || (value instanceof String s && s.isBlank())
                || (value instanceof Collection<?> c && c.isEmpty())
                || (value instanceof Map<?, ?> m && m.isEmpty());
    }
}
