package com.aistudio.orchestrator.agent.impl;

import com.aistudio.orchestrator.agent.AbstractAgent;
import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.provider.ImageGenerationProvider;
import com.aistudio.orchestrator.provider.ImageGenerationProvider.GeneratedImage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single image from a prompt. Also the per-item agent for batch variations.
 *
 * Input:  prompt, style (optional)
 * Output: {@code {image_url, prompt_used, generation_time}}
 */
@Component
public class ImageGeneratorAgent extends AbstractAgent {

    private final ImageGenerationProvider images;

    public ImageGeneratorAgent(ImageGenerationProvider images) {
        super(new AgentConfig("image_generator", "Image Generator",
                "Generates a single image from a text prompt", "1.0.0", 20, 0.04));
        this.images = images;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, AgentContext ctx) {
        validateInput(input, "prompt");
        ctx.cancellation().throwIfCancellationRequested();

        GeneratedImage image = images.generate(input.get("prompt").toString(), stringOr(input, "style", null));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("image_url", image.imageUrl());
        output.put("prompt_used", image.promptUsed());
        output.put("generation_time", image.generationTime());
        return output;
    }
}
