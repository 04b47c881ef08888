package com.aistudio.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * UI-facing description of a decision a paused job is waiting on.
 *
 * The orchestrator never interprets a card; it stores it with the job on
 * pauseForInput and drops it on resume. Clients render the title,
 * description and action buttons.
 */
public record BriefCard(
        String                cardId,
        String                jobId,
        String                title,
        String                description,
        String                category,
        List<BriefCardAction> actions,
        Map<String, Object>   data,
        String                provenance,
        Instant               createdAt
) {
    public BriefCard {
        actions = actions == null ? List.of() : List.copyOf(actions);
        if (category == null || category.isBlank()) category = "work";
    }

    /** The standard approve / edit / cancel card, all three actions posting to one endpoint. */
    public static BriefCard approveEditCancel(String jobId, String title, String description,
                                              String resumeEndpoint, Map<String, Object> data) {
        return new BriefCard(
                UUID.randomUUID().toString(),
                jobId,
                title,
                description,
                "work",
                List.of(BriefCardAction.approve(resumeEndpoint),
                        BriefCardAction.edit(resumeEndpoint),
                        BriefCardAction.cancel(resumeEndpoint)),
                data,
                null,
                Instant.now());
    }
}
