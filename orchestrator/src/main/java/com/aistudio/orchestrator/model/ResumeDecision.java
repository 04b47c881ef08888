package com.aistudio.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resume request for a job in AWAITING_INPUT.
 *
 * @param action     approve, edit or cancel
 * @param editedData replacement payload; required for EDIT, ignored otherwise
 */
public record ResumeDecision(ResumeAction action, Map<String, Object> editedData) {

    public ResumeDecision {
        if (action == null) {
            throw new IllegalArgumentException("Resume action is required");
        }
        if (action == ResumeAction.EDIT && (editedData == null || editedData.isEmpty())) {
            throw new IllegalArgumentException("Action 'edit' requires editedData");
        }
        // null values clear fields, so Map.copyOf would reject valid edits
        editedData = editedData == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(editedData));
    }

    public static ResumeDecision approve()                           { return new ResumeDecision(ResumeAction.APPROVE, null); }
    public static ResumeDecision cancel()                            { return new ResumeDecision(ResumeAction.CANCEL, null); }
    public static ResumeDecision edit(Map<String, Object> editedData) { return new ResumeDecision(ResumeAction.EDIT, editedData); }

    public boolean proceeds() {
        return action != ResumeAction.CANCEL;
    }

    /** Audit form stored on the job as {@code userInput}. */
    public Map<String, Object> toUserInput() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("action", action.wireName());
        if (editedData != null) input.put("editedData", editedData);
        return input;
    }
}
