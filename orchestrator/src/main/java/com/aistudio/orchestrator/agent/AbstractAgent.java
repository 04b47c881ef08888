package com.aistudio.orchestrator.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class for agents: holds the config and offers input validation.
 */
public abstract class AbstractAgent implements Agent {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final AgentConfig config;

    protected AbstractAgent(AgentConfig config) {
        this.config = config;
    }

    @Override
    public AgentConfig config() {
        return config;
    }

    /**
     * Check that every required field is present and non-null.
     *
     * @throws InputValidationException naming all missing fields, in the order given
     */
    public static void validateInput(Map<String, Object> input, String... required) {
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (input == null || input.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new InputValidationException(missing);
        }
    }

    /** String value of an optional field, or the fallback when absent. */
    protected static String stringOr(Map<String, Object> input, String key, String fallback) {
        Object value = input.get(key);
        return value == null ? fallback : value.toString();
    }

    /** Integer value of an optional field, accepting numbers and numeric strings. */
    protected static int intOr(Map<String, Object> input, String key, int fallback) {
        Object value = input.get(key);
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new InputValidationException("Field '" + key + "' must be an integer, got '" + s + "'");
            }
        }
        return fallback;
    }

    /** Nested object field; fails validation when the value is not a JSON object. */
    @SuppressWarnings("unchecked")
    protected static Map<String, Object> mapField(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw new InputValidationException("Field '" + key + "' must be an object");
    }

    /** Nested list field; absent means empty. */
    @SuppressWarnings("unchecked")
    protected static List<Map<String, Object>> listField(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value == null) return List.of();
        if (value instanceof List<?> l) return (List<Map<String, Object>>) l;
        throw new InputValidationException("Field '" + key + "' must be a list");
    }
}
