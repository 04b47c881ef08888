package com.aistudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The decision a human takes on a job that is awaiting input. */
public enum ResumeAction {
    APPROVE,   // run the effectful step with the proposal as-is
    EDIT,      // run it with a replacement payload
    CANCEL;    // drop the proposal, cancel the job

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ResumeAction fromWireName(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resume action: '" + value
                    + "' (expected approve, edit or cancel)");
        }
    }
}
