package com.aistudio.orchestrator.model;

/**
 * One button on a {@link BriefCard}.
 *
 * @param actionId e.g. "approve", "edit", "cancel"
 * @param label    text shown to the user
 * @param style    "primary", "secondary" or "danger"
 * @param endpoint API endpoint the UI calls when the button is clicked (may be null)
 */
public record BriefCardAction(String actionId, String label, String style, String endpoint) {

    public static BriefCardAction approve(String endpoint) {
        return new BriefCardAction("approve", "Approve", "primary", endpoint);
    }

    public static BriefCardAction edit(String endpoint) {
        return new BriefCardAction("edit", "Edit Changes", "secondary", endpoint);
    }

    public static BriefCardAction cancel(String endpoint) {
        return new BriefCardAction("cancel", "Cancel", "danger", endpoint);
    }
}
