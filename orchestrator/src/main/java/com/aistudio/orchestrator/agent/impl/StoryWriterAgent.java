package com.aistudio.orchestrator.agent.impl;

import com.aistudio.orchestrator.agent.AbstractAgent;
import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.provider.ProviderException;
import com.aistudio.orchestrator.provider.ResponseParser;
import com.aistudio.orchestrator.provider.TextGenerationProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Expands an outline into the full story text, one section per scene.
 *
 * Input:  outline (from {@link StoryPlannerAgent}), prose_style ("descriptive"),
 *         perspective ("third_person"), tense ("past")
 * Output: {@code {"written_story": {title, story, scenes: [...], word_count, metadata}}}
 */
@Component
public class StoryWriterAgent extends AbstractAgent {

    private final TextGenerationProvider text;

    public StoryWriterAgent(TextGenerationProvider text) {
        super(new AgentConfig("story_writer", "Story Writer",
                "Expands story outlines into full narrative text", "1.0.0", 30, 0.05));
        this.text = text;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, AgentContext ctx) {
        validateInput(input, "outline");

        Map<String, Object>       outline = mapField(input, "outline");
        List<Map<String, Object>> scenes  = listField(outline, "outline");
        String proseStyle  = stringOr(input, "prose_style", "descriptive");
        String perspective = stringOr(input, "perspective", "third_person");
        String tense       = stringOr(input, "tense", "past");

        ctx.cancellation().throwIfCancellationRequested();
        String reply;
        try {
            reply = text.complete(null, buildPrompt(outline, scenes, proseStyle, perspective, tense), 4000);
        } catch (ProviderException e) {
            throw new IllegalStateException("Story writing failed: " + e.getMessage(), e);
        }

        List<Map<String, Object>> written = splitScenes(reply, scenes);
        List<String> texts = written.stream().map(s -> (String) s.get("text")).toList();

        Map<String, Object> story = new LinkedHashMap<>();
        story.put("title", outline.getOrDefault("title", "Untitled"));
        story.put("story", String.join("\n\n", texts));
        story.put("scenes", written);
        story.put("word_count", reply.isBlank() ? 0 : reply.trim().split("\\s+").length);
        story.put("metadata", Map.of("prose_style", proseStyle, "perspective", perspective, "tense", tense));
        return Map.of("written_story", story);
    }

    /**
     * Split the reply on "--- Scene N: Title ---" markers, attaching each
     * scene's illustration prompt from the outline. A reply without markers
     * becomes a single scene.
     */
    static List<Map<String, Object>> splitScenes(String reply, List<Map<String, Object>> outlineScenes) {
        List<Map<String, Object>> result = new ArrayList<>();
        Matcher m = ResponseParser.sceneMarkers(reply);

        List<int[]> bounds = new ArrayList<>();   // {sceneNumber, textStart, markerStart}
        while (m.find()) {
            bounds.add(new int[] { Integer.parseInt(m.group(1)), m.end(), m.start() });
        }

        if (bounds.isEmpty()) {
            result.add(scene(1, reply.strip(), outlineScenes));
            return result;
        }
        for (int i = 0; i < bounds.size(); i++) {
            int end = i + 1 < bounds.size() ? bounds.get(i + 1)[2] : reply.length();
            result.add(scene(bounds.get(i)[0], reply.substring(bounds.get(i)[1], end).strip(), outlineScenes));
        }
        return result;
    }

    private static Map<String, Object> scene(int number, String text, List<Map<String, Object>> outlineScenes) {
        String prompt = outlineScenes.stream()
                .filter(s -> s.get("scene_number") instanceof Number n && n.intValue() == number)
                .map(s -> String.valueOf(s.getOrDefault("illustration_prompt", "")))
                .findFirst()
                .orElse("");
        Map<String, Object> scene = new LinkedHashMap<>();
        scene.put("scene_number", number);
        scene.put("text", text);
        scene.put("illustration_prompt", prompt);
        return scene;
    }

    private static String buildPrompt(Map<String, Object> outline, List<Map<String, Object>> scenes,
                                      String proseStyle, String perspective, String tense) {
        StringBuilder sb = new StringBuilder();
        sb.append("Title: ").append(outline.getOrDefault("title", "Untitled")).append("\n\nScenes:\n");
        for (Map<String, Object> s : scenes) {
            sb.append("\nScene ").append(s.get("scene_number")).append(": ").append(s.get("title")).append('\n');
            sb.append("- ").append(s.get("description")).append('\n');
            sb.append("- Action: ").append(s.get("action")).append('\n');
            sb.append("- Target length: ~").append(s.getOrDefault("estimated_words", 150)).append(" words\n");
        }

        String style = switch (proseStyle) {
            case "descriptive" -> "Use rich, vivid descriptions with sensory details.";
            case "concise"     -> "Use clear, direct language. Keep descriptions brief.";
            case "poetic"      -> "Use metaphors and lyrical language.";
            case "humorous"    -> "Include wit and playful language.";
            case "simple"      -> "Use simple words and short sentences for young readers.";
            default            -> "Use engaging, appropriate language.";
        };

        return """
                Write a complete story based on this outline.

                %s
                Writing style: %s (%s)
                Perspective: %s
                Tense: %s

                Start every scene with a marker line of the form:
                --- Scene 1: [Title] ---

                Write all %d scenes now.
                """.formatted(sb, proseStyle, style, perspective.replace('_', ' '), tense, scenes.size());
    }
}
