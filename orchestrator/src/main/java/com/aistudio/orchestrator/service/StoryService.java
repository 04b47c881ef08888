package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.model.BriefCard;
import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobType;
import com.aistudio.orchestrator.model.ResumeDecision;
import com.aistudio.orchestrator.model.Resumption;
import com.aistudio.orchestrator.workflow.StoryWorkflows;
import com.aistudio.orchestrator.workflow.WorkflowExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Illustrated-story generation as a background job.
 *
 * Without review the three steps run back to back. With review the job
 * pauses after planning and holds the outline; approving (or editing) it
 * schedules a continuation that writes and illustrates that outline.
 */
@Service
public class StoryService {

    private static final Logger log = LoggerFactory.getLogger(StoryService.class);

    static final String FLOW        = "story_generation";
    static final String OUTLINE_KEY = "outline";
    static final String CONTEXT_KEY = "context";

    private final JobQueueManager     jobs;
    private final BackgroundJobRunner runner;
    private final WorkflowJobService  workflows;

    public StoryService(JobQueueManager jobs, BackgroundJobRunner runner, WorkflowJobService workflows) {
        this.jobs      = jobs;
        this.runner    = runner;
        this.workflows = workflows;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create the job and schedule it.
     *
     * @param params        workflow input parameters (character, theme, ...)
     * @param reviewOutline pause for approval once the outline exists
     * @param async         false runs the job on the calling thread before returning
     * @return the job id
     */
    public String submit(Map<String, Object> params, boolean reviewOutline, boolean async) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("flow", FLOW);
        metadata.put("workflowId", StoryWorkflows.WORKFLOW_ID);
        metadata.put("reviewOutline", reviewOutline);

        String jobId = jobs.createJob(JobType.WORKFLOW,
                "Story: " + characterName(params),
                "Generate an illustrated " + params.getOrDefault("theme", "adventure") + " story",
                StoryWorkflows.STORY_GENERATION.steps().size(), true, metadata, null);

        BackgroundJobRunner.JobTask task = reviewOutline
                ? id -> planAndPause(id, params)
                : id -> workflows.runToCompletion(id, StoryWorkflows.STORY_GENERATION, params);
        if (async) {
            runner.submit(jobId, task);
        } else {
            runner.runInline(jobId, task);
        }
        return jobId;
    }

    private void planAndPause(String jobId, Map<String, Object> params) {
        WorkflowExecution plan = workflows.run(jobId, StoryWorkflows.PLAN, params, 0);
        if (!plan.isCompleted()) {
            workflows.finish(jobId, plan);
            return;
        }
        Map<String, Object> awaiting = new LinkedHashMap<>();
        awaiting.put(OUTLINE_KEY, plan.getContext().get(OUTLINE_KEY));
        awaiting.put(CONTEXT_KEY, new LinkedHashMap<>(params));

        jobs.pauseForInput(jobId, awaiting, BriefCard.approveEditCancel(jobId,
                "Review story outline",
                "Approve the outline to write and illustrate the story, edit it first, or cancel.",
                "/api/workflows/story-generation/resume/" + jobId,
                Map.of(OUTLINE_KEY, awaiting.get(OUTLINE_KEY))));
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    /**
     * Apply the reviewer's decision. For approve and edit the rest of the
     * workflow is scheduled on a worker; the returned snapshot is RUNNING.
     */
    @SuppressWarnings("unchecked")
    public Job resume(String jobId, ResumeDecision decision) {
        requireFlow(jobs.getJob(jobId));
        Resumption resumption = jobs.resumeWithInput(jobId, decision);
        if (!decision.proceeds()) {
            return resumption.job();
        }

        Map<String, Object> params = new LinkedHashMap<>(
                (Map<String, Object>) resumption.awaitingData().getOrDefault(CONTEXT_KEY, Map.of()));
        params.put(OUTLINE_KEY, resumption.effectivePayload(OUTLINE_KEY));
        log.info("Continuing story job {} with {} outline", jobId, decision.action().wireName());

        runner.submit(jobId, id -> workflows.finish(id,
                workflows.run(id, StoryWorkflows.WRITE_AND_ILLUSTRATE, params, 1)));
        return resumption.job();
    }

    private static void requireFlow(Job job) {
        if (!FLOW.equals(job.metadata().get("flow"))) {
            throw new IllegalArgumentException("Job " + job.id() + " is not a story generation job");
        }
    }

    private static String characterName(Map<String, Object> params) {
        Object character = params.get("character");
        if (character instanceof Map<?, ?> c && c.get("name") != null) return c.get("name").toString();
        return character == null ? "unnamed" : character.toString();
    }
}
