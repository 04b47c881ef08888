package com.aistudio.orchestrator.agent.impl;

import com.aistudio.orchestrator.agent.AbstractAgent;
import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.provider.ProviderException;
import com.aistudio.orchestrator.provider.TextGenerationProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns a character and a theme into a scene-by-scene story outline.
 *
 * Input:  character (object with name / appearance / personality, or a plain name),
 *         theme, target_scenes (5), age_group ("children")
 * Output: {@code {"outline": {title, outline: [scene...], total_estimated_words}}}
 */
@Component
public class StoryPlannerAgent extends AbstractAgent {

    static final String SYSTEM = """
            You are a children's book editor who plans illustrated stories.
            Reply with a single JSON object and nothing else.
            """;

    private final TextGenerationProvider text;

    public StoryPlannerAgent(TextGenerationProvider text) {
        super(new AgentConfig("story_planner", "Story Planner",
                "Creates story outlines with scenes and illustration prompts", "1.0.0", 15, 0.02));
        this.text = text;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, AgentContext ctx) {
        validateInput(input, "character", "theme");

        String theme    = input.get("theme").toString();
        int    scenes   = intOr(input, "target_scenes", 5);
        String ageGroup = stringOr(input, "age_group", "children");

        ctx.cancellation().throwIfCancellationRequested();
        Map<String, Object> outline;
        try {
            outline = text.completeJson(SYSTEM, buildPrompt(input.get("character"), theme, scenes, ageGroup), 3000);
        } catch (ProviderException e) {
            throw new IllegalStateException("Story planning failed: " + e.getMessage(), e);
        }
        if (!(outline.get("outline") instanceof List<?> sceneList)) {
            throw new IllegalStateException("Story planning failed: reply has no 'outline' scene list");
        }
        log.info("Planned '{}' with {} scenes", outline.get("title"), sceneList.size());
        return Map.of("outline", outline);
    }

    static String buildPrompt(Object character, String theme, int scenes, String ageGroup) {
        String name;
        StringBuilder charDesc = new StringBuilder();
        if (character instanceof Map<?, ?> c) {
            name = String.valueOf(c.get("name") != null ? c.get("name") : "the hero");
            charDesc.append("Character: ").append(name);
            if (c.get("appearance") != null)  charDesc.append("\n- Appearance: ").append(c.get("appearance"));
            if (c.get("personality") != null) charDesc.append("\n- Personality: ").append(c.get("personality"));
        } else {
            name = String.valueOf(character);
            charDesc.append("Character: ").append(name);
        }

        String guidance = switch (ageGroup) {
            case "children"    -> "Simple language, clear moral lesson, happy ending. Focus on discovery and friendship.";
            case "young_adult" -> "More complex themes and character growth. Age-appropriate conflicts.";
            case "adult"       -> "Nuanced themes, realistic conflicts, sophisticated language.";
            default            -> "Age-appropriate language and themes.";
        };

        return """
                Create a story outline for a %s story.

                %s

                Requirements:
                - Target audience: %s
                - Number of scenes: %d
                - Style: %s

                Every illustration prompt must mention %s and describe their appearance.

                Reply with JSON of this shape:
                {"title": "...", "total_estimated_words": 900,
                 "outline": [{"scene_number": 1, "title": "...", "description": "...",
                              "action": "...", "illustration_prompt": "...", "estimated_words": 150}]}
                """.formatted(theme, charDesc, ageGroup.replace('_', ' '), scenes, guidance, name);
    }
}
