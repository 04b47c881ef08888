package com.aistudio.orchestrator.workflow;

import java.util.List;

/**
 * Definitions of the illustrated-story workflow.
 *
 * <pre>
 *   plan_story        story_planner      character, theme, target_scenes, age_group → outline
 *   write_story       story_writer       outline, prose_style                       → written_story
 *   illustrate_story  story_illustrator  written_story, art_style, max_illustrations,
 *                                        character_appearance                       → illustrated_story
 * </pre>
 *
 * {@link #PLAN} and {@link #WRITE_AND_ILLUSTRATE} split the same steps around
 * the optional outline review.
 */
public final class StoryWorkflows {

    public static final String WORKFLOW_ID = "story_generation_v1";

    public static final WorkflowStep PLAN_STORY = WorkflowStep.of(
            "plan_story", "story_planner", "Generate story outline",
            List.of("character", "theme", "target_scenes", "age_group"),
            List.of("outline"));

    public static final WorkflowStep WRITE_STORY = WorkflowStep.of(
            "write_story", "story_writer", "Write full story from outline",
            List.of("outline", "prose_style"),
            List.of("written_story"));

    public static final WorkflowStep ILLUSTRATE_STORY = WorkflowStep.of(
            "illustrate_story", "story_illustrator", "Generate illustrations for scenes",
            List.of("written_story", "art_style", "max_illustrations", "character_appearance"),
            List.of("illustrated_story"));

    public static final WorkflowDefinition STORY_GENERATION = new WorkflowDefinition(
            WORKFLOW_ID,
            "Story Generation with Illustrations",
            "Create an illustrated story from character and theme",
            List.of(PLAN_STORY, WRITE_STORY, ILLUSTRATE_STORY));

    public static final WorkflowDefinition PLAN = new WorkflowDefinition(
            WORKFLOW_ID + ":plan",
            "Story Planning",
            "Outline only, paused for review",
            List.of(PLAN_STORY));

    public static final WorkflowDefinition WRITE_AND_ILLUSTRATE = new WorkflowDefinition(
            WORKFLOW_ID + ":write",
            "Story Writing and Illustration",
            "Continue a reviewed outline",
            List.of(WRITE_STORY, ILLUSTRATE_STORY));

    private StoryWorkflows() {}
}
