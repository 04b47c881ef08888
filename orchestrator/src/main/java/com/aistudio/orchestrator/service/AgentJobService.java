package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobType;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/** A single agent call tracked as a job. */
@Service
public class AgentJobService {

    private final JobQueueManager     jobs;
    private final BackgroundJobRunner runner;
    private final AgentRegistry       agents;

    public AgentJobService(JobQueueManager jobs, BackgroundJobRunner runner, AgentRegistry agents) {
        this.jobs   = jobs;
        this.runner = runner;
        this.agents = agents;
    }

    /**
     * Create and schedule a job that runs one agent and completes with its output.
     *
     * @throws com.aistudio.orchestrator.agent.AgentNotFoundException before any job is created
     */
    public String submit(String agentId, Map<String, Object> input, boolean async) {
        AgentConfig config = agents.get(agentId).config();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agentId", agentId);
        metadata.put("estimatedTimeSeconds", config.estimatedTimeSeconds());

        String jobId = jobs.createJob(jobTypeFor(agentId), config.name(), config.description(),
                1, true, metadata, null);

        BackgroundJobRunner.JobTask task = id -> {
            jobs.updateProgress(id, 0.0, "Running " + config.name(), agentId);
            Map<String, Object> output = agents.execute(agentId, input == null ? Map.of() : input,
                    new AgentContext(id, null, jobs.cancellationToken(id)));
            jobs.completeJob(id, output);
        };
        if (async) {
            runner.submit(jobId, task);
        } else {
            runner.runInline(jobId, task);
        }
        return jobId;
    }

    /** Run on the calling thread and return the finished snapshot. */
    public Job runNow(String agentId, Map<String, Object> input) {
        return jobs.getJob(submit(agentId, input, false));
    }

    static JobType jobTypeFor(String agentId) {
        return switch (agentId) {
            case "image_generator", "story_illustrator" -> JobType.GENERATE_IMAGE;
            case "story_planner", "story_writer"        -> JobType.WORKFLOW;
            default                                     -> JobType.ANALYZE;
        };
    }
}
