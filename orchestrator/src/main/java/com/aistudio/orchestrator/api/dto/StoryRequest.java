package com.aistudio.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request body for POST /api/workflows/story-generation/execute.
 *
 * Required: character (name, appearance, personality)
 * Optional: everything else, defaulted below. Snake-case names are accepted too.
 */
public record StoryRequest(
        @NotNull Map<String, Object> character,
        String theme,
        @JsonAlias("target_scenes")     @Min(1) @Max(10) Integer targetScenes,
        @JsonAlias("age_group")         String ageGroup,
        @JsonAlias("prose_style")       String proseStyle,
        @JsonAlias("art_style")         String artStyle,
        @JsonAlias("max_illustrations") @Min(0) @Max(10) Integer maxIllustrations,
        @JsonAlias("review_outline")    Boolean reviewOutline
) {
    public StoryRequest {
        if (theme == null || theme.isBlank())           theme = "adventure";
        if (targetScenes == null)                        targetScenes = 5;
        if (ageGroup == null || ageGroup.isBlank())     ageGroup = "children";
        if (proseStyle == null || proseStyle.isBlank()) proseStyle = "descriptive";
        if (artStyle == null || artStyle.isBlank())     artStyle = "digital_art";
        if (maxIllustrations == null)                    maxIllustrations = 5;
        if (reviewOutline == null)                       reviewOutline = false;
    }

    /** Workflow input parameters, keyed the way the story agents read them. */
    public Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("character", character);
        params.put("theme", theme);
        params.put("target_scenes", targetScenes);
        params.put("age_group", ageGroup);
        params.put("prose_style", proseStyle);
        params.put("art_style", artStyle);
        params.put("max_illustrations", maxIllustrations);
        Object appearance = character == null ? null : character.get("appearance");
        params.put("character_appearance", appearance == null ? "" : appearance.toString());
        return params;
    }
}
