package com.aistudio.orchestrator.api.dto;

import com.aistudio.orchestrator.model.ResumeAction;
import com.aistudio.orchestrator.model.ResumeDecision;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Body of the resume endpoints.
 *
 * Example: {@code {"action": "edit", "editedData": {"name": "Luna"}}}
 */
public record ResumeRequest(
        @NotNull ResumeAction action,
        @JsonAlias("edited_data") Map<String, Object> editedData) {

    /** @throws IllegalArgumentException for an edit without data */
    public ResumeDecision toDecision() {
        return new ResumeDecision(action, editedData);
    }
}
