package com.aistudio.orchestrator.model;

import java.util.Map;

/**
 * Outcome of a successful resumeWithInput call.
 *
 * @param job          the job snapshot after the transition (RUNNING or CANCELLED)
 * @param awaitingData the proposal the job was holding when the decision was taken
 * @param decision     the decision that resumed it
 */
public record Resumption(Job job, Map<String, Object> awaitingData, ResumeDecision decision) {

    /**
     * The payload the continuation should act on: the edited data for EDIT,
     * otherwise the value stored under {@code proposalKey} in the awaiting data.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> effectivePayload(String proposalKey) {
        if (decision.action() == ResumeAction.EDIT) {
            return decision.editedData();
        }
        Object proposal = awaitingData == null ? null : awaitingData.get(proposalKey);
        return proposal instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }
}
