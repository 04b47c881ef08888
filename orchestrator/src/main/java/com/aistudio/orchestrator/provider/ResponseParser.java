package com.aistudio.orchestrator.provider;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured payloads out of free-form model replies.
 *
 * Models are asked for bare JSON but often wrap it in a markdown fence or
 * add a sentence before it; both are tolerated.
 */
public final class ResponseParser {

    // ```json ... ``` or ``` ... ```
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n?```",
            Pattern.DOTALL
    );

    // "--- Scene 3: The Storm ---"
    private static final Pattern SCENE_MARKER = Pattern.compile(
            "^-{3}\\s*Scene\\s+(\\d+)\\s*:?\\s*(.*?)\\s*-{3}\\s*$",
            Pattern.MULTILINE
    );

    private ResponseParser() {}

    /**
     * Extract the JSON object text from a reply.
     *
     * Prefers a fenced block; otherwise takes the span from the first '{' to
     * the last '}'. Returns empty when neither is present.
     */
    public static Optional<String> extractJson(String response) {
        if (response == null || response.isBlank()) return Optional.empty();

        Matcher m = JSON_FENCE.matcher(response);
        if (m.find()) {
            String fenced = m.group(1).strip();
            if (fenced.startsWith("{")) return Optional.of(fenced);
        }

        int start = response.indexOf('{');
        int end   = response.lastIndexOf('}');
        return (start >= 0 && end > start)
                ? Optional.of(response.substring(start, end + 1))
                : Optional.empty();
    }

    /** Matcher over "--- Scene N: Title ---" lines in a written story. */
    public static Matcher sceneMarkers(String story) {
        return SCENE_MARKER.matcher(story);
    }
}
