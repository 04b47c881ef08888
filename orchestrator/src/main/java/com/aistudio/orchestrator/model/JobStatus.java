package com.aistudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a background Job.
 *
 * Transitions:
 *   QUEUED         → RUNNING         (startJob)
 *   RUNNING        → RUNNING         (progress updates)
 *   RUNNING        → COMPLETED       (completeJob)
 *   RUNNING        → FAILED          (failJob)
 *   RUNNING        → AWAITING_INPUT  (pauseForInput)
 *   AWAITING_INPUT → RUNNING         (resume with approve / edit)
 *   AWAITING_INPUT → CANCELLED       (resume with cancel)
 *   any non-terminal → CANCELLED     (cancelJob, cancelable jobs only)
 *
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    AWAITING_INPUT,   // paused, waiting for a human decision
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    // Serialized lower-case on the wire ("awaiting_input").
    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobStatus fromWireName(String value) {
        return value == null ? null : valueOf(value.trim().toUpperCase());
    }
}
