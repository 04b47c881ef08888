package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.workflow.SequentialWorkflowExecutor;
import com.aistudio.orchestrator.workflow.WorkflowDefinition;
import com.aistudio.orchestrator.workflow.WorkflowExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Runs workflow definitions inside jobs.
 *
 * Bridges the executor's progress callback to the job's step progress and
 * the job's cancellation token to the agents, then maps the execution's
 * outcome onto the job.
 */
@Service
public class WorkflowJobService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowJobService.class);

    private final JobQueueManager            jobs;
    private final SequentialWorkflowExecutor executor;
    private final AgentRegistry              agents;

    public WorkflowJobService(JobQueueManager jobs, SequentialWorkflowExecutor executor, AgentRegistry agents) {
        this.jobs     = jobs;
        this.executor = executor;
        this.agents   = agents;
    }

    /**
     * Execute {@code definition} for a RUNNING job.
     *
     * @param stepOffset job steps already done before this definition's first
     *                   step; lets a resumed continuation keep counting
     */
    public WorkflowExecution run(String jobId, WorkflowDefinition definition,
                                 Map<String, Object> params, int stepOffset) {
        AgentContext ctx = new AgentContext(jobId, null, jobs.cancellationToken(jobId));
        return executor.execute(definition, agents, params,
                (stepNumber, stepId, description) ->
                        jobs.reportStep(jobId, stepOffset + stepNumber, stepId, description),
                ctx);
    }

    /**
     * Record the execution's outcome on the job: its result on success, the
     * failing step's error and error type on failure. A cancelled execution leaves the job
     * alone unless it stopped because the deadline passed.
     */
    public void finish(String jobId, WorkflowExecution execution) {
        if (jobs.getJob(jobId).status() != JobStatus.RUNNING) {
            log.info("Job {} is no longer running; discarding workflow outcome ({})",
                    jobId, execution.getStatus());
            return;
        }
        switch (execution.getStatus()) {
            case COMPLETED -> jobs.completeJob(jobId, execution.getResult());
            case FAILED    -> jobs.failJob(jobId,
                    "Step '" + execution.getFailedStepId() + "' failed: " + execution.getError(),
                    execution.getErrorType());
            case CANCELLED -> jobs.expireIfOverdue(jobId);
            case RUNNING   -> throw new IllegalStateException("Execution " + execution.getExecutionId() + " not finished");
        }
    }

    /** Run then finish, for jobs that are a single workflow end to end. */
    public void runToCompletion(String jobId, WorkflowDefinition definition, Map<String, Object> params) {
        finish(jobId, run(jobId, definition, params, 0));
    }
}
