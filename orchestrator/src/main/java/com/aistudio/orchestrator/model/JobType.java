package com.aistudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of work a Job tracks.
 *
 * Informational only: the state machine treats every type the same way.
 * {@code COMPREHENSIVE_ANALYZE} is accepted on the wire so clients can filter
 * by it, but no service here creates such jobs yet.
 */
public enum JobType {
    ANALYZE,
    COMPREHENSIVE_ANALYZE,
    GENERATE_IMAGE,
    BATCH_ANALYZE,
    BATCH_GENERATE,
    WORKFLOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobType fromWireName(String value) {
        return value == null ? null : valueOf(value.trim().toUpperCase());
    }
}
