package com.aistudio.orchestrator.agent.impl;

import com.aistudio.orchestrator.agent.AbstractAgent;
import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.provider.ImageGenerationProvider;
import com.aistudio.orchestrator.provider.ImageGenerationProvider.GeneratedImage;
import com.aistudio.orchestrator.provider.ProviderException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates one illustration per scene, up to {@code max_illustrations}.
 *
 * Input:  written_story (from {@link StoryWriterAgent}), art_style ("digital_art"),
 *         max_illustrations (5), character_appearance (optional)
 * Output: {@code {"illustrated_story": {title, story, illustrations: [...], total_generation_time}}}
 *
 * A scene whose image fails is left unillustrated; the story still completes.
 */
@Component
public class StoryIllustratorAgent extends AbstractAgent {

    private final ImageGenerationProvider images;

    public StoryIllustratorAgent(ImageGenerationProvider images) {
        super(new AgentConfig("story_illustrator", "Story Illustrator",
                "Generates illustrations for story scenes", "1.0.0", 45, 0.20));
        this.images = images;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, AgentContext ctx) {
        validateInput(input, "written_story");

        Map<String, Object>       story      = mapField(input, "written_story");
        List<Map<String, Object>> scenes     = listField(story, "scenes");
        String                    artStyle   = stringOr(input, "art_style", "digital_art");
        String                    appearance = stringOr(input, "character_appearance", "");
        int                       max        = Math.max(0, intOr(input, "max_illustrations", 5));

        List<Map<String, Object>> illustrations = new ArrayList<>();
        String storyText = String.valueOf(story.getOrDefault("story", ""));
        long totalTime = 0;

        for (Map<String, Object> scene : scenes.subList(0, Math.min(max, scenes.size()))) {
            ctx.cancellation().throwIfCancellationRequested();
            int number = scene.get("scene_number") instanceof Number n ? n.intValue() : illustrations.size() + 1;
            String prompt = buildPrompt(String.valueOf(scene.getOrDefault("illustration_prompt", "")), appearance, artStyle);
            try {
                GeneratedImage image = images.generate(prompt, artStyle);
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("scene_number", number);
                entry.put("image_url", image.imageUrl());
                entry.put("prompt_used", image.promptUsed());
                entry.put("generation_time", image.generationTime());
                illustrations.add(entry);
                totalTime += image.generationTime();

                storyText = storyText.replace("{image_%02d}".formatted(number),
                        "![Scene %d](%s)".formatted(number, image.imageUrl()));
            } catch (ProviderException e) {
                log.warn("Illustration for scene {} failed, continuing: {}", number, e.getMessage());
            }
        }

        Map<String, Object> illustrated = new LinkedHashMap<>();
        illustrated.put("title", story.getOrDefault("title", "Untitled"));
        illustrated.put("story", storyText);
        illustrated.put("illustrations", illustrations);
        illustrated.put("total_generation_time", totalTime);
        return Map.of("illustrated_story", illustrated);
    }

    static String buildPrompt(String scenePrompt, String appearance, String artStyle) {
        StringBuilder prompt = new StringBuilder(scenePrompt);
        if (!appearance.isBlank()) {
            prompt.append(". The character is ").append(appearance).append('.');
        }
        String lower = artStyle.toLowerCase();
        if (!lower.contains("realistic") && !lower.equals("none")) {
            prompt.append(" Art style: ").append(artStyle.replace('_', ' ')).append('.');
        }
        return prompt.toString();
    }
}
