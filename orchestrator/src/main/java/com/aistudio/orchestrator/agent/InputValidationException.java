package com.aistudio.orchestrator.agent;

import java.util.List;

/**
 * Agent input failed validation.
 *
 * Lists every missing field at once rather than stopping at the first.
 */
public class InputValidationException extends RuntimeException {

    private final List<String> missingFields;

    public InputValidationException(List<String> missingFields) {
        super("Missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public InputValidationException(String message) {
        super(message);
        this.missingFields = List.of();
    }

    public List<String> getMissingFields() { return missingFields; }
}
