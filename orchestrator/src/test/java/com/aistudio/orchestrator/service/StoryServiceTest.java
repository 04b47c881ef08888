package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.agent.StubAgent;
import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.model.ResumeDecision;
import com.aistudio.orchestrator.repository.InMemoryJobStore;
import com.aistudio.orchestrator.workflow.SequentialWorkflowExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Story workflow jobs with stub agents standing in for the three story agents.
 */
class StoryServiceTest {

    static final Map<String, Object> OUTLINE = Map.of(
            "title", "Luna and the Lost Star",
            "outline", List.of(Map.of("scene_number", 1, "title", "The Fall")));

    static final Map<String, Object> PARAMS = Map.of(
            "character", Map.of("name", "Luna", "appearance", "curly brown hair"),
            "theme", "mystery",
            "target_scenes", 3,
            "prose_style", "whimsical",
            "character_appearance", "curly brown hair");

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    JobQueueManager     jobs;
    StubAgent           planner;
    StubAgent           writer;
    StubAgent           illustrator;

    @BeforeEach
    void setUp() {
        jobs        = new JobQueueManager(new InMemoryJobStore(), List.of(), meters, null,
                new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        planner     = StubAgent.returning("story_planner", Map.of("outline", OUTLINE));
        writer      = new StubAgent("story_writer", (input, ctx) ->
                Map.of("written_story", Map.of("title", "Luna", "story", "text", "from", input.get("outline"))));
        illustrator = StubAgent.returning("story_illustrator",
                Map.of("illustrated_story", Map.of("title", "Luna", "illustrations", List.of())));
    }

    private StoryService service(StubAgent... agents) {
        AgentRegistry registry = new AgentRegistry(List.of(agents), meters);
        WorkflowJobService workflows = new WorkflowJobService(jobs, new SequentialWorkflowExecutor(), registry);
        return new StoryService(jobs, new BackgroundJobRunner(jobs, Runnable::run), workflows);
    }

    @Test
    void withoutReview_runsAllThreeStepsToCompletion() {
        String id = service(planner, writer, illustrator).submit(PARAMS, false, true);

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.stepsCompleted()).isEqualTo(3);
        assertThat(job.result()).containsOnlyKeys("illustrated_story");
        assertThat(job.metadata()).containsEntry("flow", "story_generation");
        assertThat(planner.calls().get(0)).containsKeys("character", "theme", "target_scenes")
                .doesNotContainKey("prose_style");
        assertThat(illustrator.calls().get(0)).containsEntry("character_appearance", "curly brown hair");
    }

    @Test
    void withReview_pausesAfterPlanningWithOutline() {
        String id = service(planner, writer, illustrator).submit(PARAMS, true, true);

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.AWAITING_INPUT);
        assertThat(job.currentStep()).isEqualTo("plan_story");
        assertThat(job.awaitingData()).containsEntry("outline", OUTLINE).containsKey("context");
        assertThat(job.briefCard().actions().get(0).endpoint())
                .isEqualTo("/api/workflows/story-generation/resume/" + id);
        assertThat(writer.calls()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void resumeWithEditedOutline_writesTheEditedOutline() {
        StoryService service = service(planner, writer, illustrator);
        String id = service.submit(PARAMS, true, true);
        Map<String, Object> edited = Map.of("title", "Luna Saves the Star", "outline", List.of());

        Job resumed = service.resume(id, ResumeDecision.edit(edited));

        assertThat(resumed.status()).isEqualTo(JobStatus.RUNNING);
        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.stepsCompleted()).isEqualTo(3);
        assertThat(writer.calls().get(0).get("outline")).isEqualTo(edited);
        assertThat(writer.calls().get(0)).containsEntry("prose_style", "whimsical");
        assertThat(planner.calls()).hasSize(1);
    }

    @Test
    void approvalAfterLongReview_stillWritesTheStory() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        jobs = new JobQueueManager(new InMemoryJobStore(), List.of(), meters, Duration.ofMinutes(10), clock);
        StoryService service = service(planner, writer, illustrator);
        String id = service.submit(PARAMS, true, true);

        clock.advance(Duration.ofMinutes(30));
        assertThat(jobs.expireOverdueJobs()).isZero();
        service.resume(id, ResumeDecision.approve());

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(writer.calls()).hasSize(1);
    }

    @Test
    void resumeWithCancel_neverWrites() {
        StoryService service = service(planner, writer, illustrator);
        String id = service.submit(PARAMS, true, true);

        Job cancelled = service.resume(id, ResumeDecision.cancel());

        assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(writer.calls()).isEmpty();
    }

    @Test
    void failingStep_failsJobNamingTheStep() {
        StubAgent brokenWriter = StubAgent.failing("story_writer", new IllegalStateException("model overloaded"));

        String id = service(planner, brokenWriter, illustrator).submit(PARAMS, false, true);

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.errorType()).isEqualTo("AgentExecutionException");
        assertThat(job.error()).startsWith("Step 'write_story' failed:").contains("model overloaded");
        assertThat(illustrator.calls()).isEmpty();
    }

    @Test
    void missingAgent_failsJobAsNotFound() {
        String id = service(planner, writer).submit(PARAMS, false, true);

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.errorType()).isEqualTo("AgentNotFoundException");
        assertThat(job.error()).contains("story_illustrator");
    }

    @Test
    void planningFailure_withReview_failsInsteadOfPausing() {
        StubAgent brokenPlanner = StubAgent.failing("story_planner", new IllegalStateException("no outline"));

        String id = service(brokenPlanner, writer, illustrator).submit(PARAMS, true, true);

        assertThat(jobs.getJob(id).status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void resume_onMergeJob_isRejected() {
        String other = jobs.createJob(com.aistudio.orchestrator.model.JobType.ANALYZE, "merge", "d",
                2, true, Map.of("flow", "entity_merge"), null);

        assertThatThrownBy(() -> service(planner).resume(other, ResumeDecision.approve()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
