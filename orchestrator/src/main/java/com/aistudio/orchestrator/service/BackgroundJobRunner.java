package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands job bodies to the worker pool.
 *
 * The caller creates the job and returns its id at once; the body runs later
 * on a worker thread with {@code jobId} in the MDC. A QUEUED job is started
 * before the body runs. A body that throws fails the job, unless something
 * else (a cancel, the deadline sweep) already finished it.
 */
@Component
public class BackgroundJobRunner {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobRunner.class);

    /** The work done for one job. */
    @FunctionalInterface
    public interface JobTask {
        void run(String jobId) throws Exception;
    }

    private final JobQueueManager jobs;
    private final Executor        workers;

    public BackgroundJobRunner(JobQueueManager jobs, @Qualifier("jobWorkers") Executor workers) {
        this.jobs    = jobs;
        this.workers = workers;
    }

    /**
     * Schedule {@code task} for the job.
     *
     * When the task's turn comes the job must be QUEUED (it is started) or
     * RUNNING (a resume continuation); in any other state the task is skipped.
     */
    public void submit(String jobId, JobTask task) {
        try {
            workers.execute(() -> runInline(jobId, task));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected job {}: {}", jobId, e.getMessage());
            failIfActive(jobId, "Worker pool unavailable: " + e.getMessage(), "Rejected");
        }
    }

    /** Same as {@link #submit} but on the calling thread, for synchronous requests. */
    public void runInline(String jobId, JobTask task) {
        MDC.put("jobId", jobId);
        try {
            Job job = jobs.getJob(jobId);
            if (job.status() == JobStatus.QUEUED) {
                jobs.startJob(jobId);
            } else if (job.status() != JobStatus.RUNNING) {
                log.info("Skipping task for job {}: state is '{}'", jobId, job.status().wireName());
                return;
            }
            task.run(jobId);
        } catch (JobNotFoundException e) {
            log.warn("Job {} disappeared while its task was running", jobId);
        } catch (Exception e) {
            if (jobs.getJob(jobId).isTerminal()) {
                log.info("Job {} finished elsewhere while its task was running: {}", jobId, e.getMessage());
            } else {
                log.error("Unhandled error in task for job {}: {}", jobId, e.getMessage(), e);
                failIfActive(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                        e.getClass().getSimpleName());
            }
        } finally {
            MDC.remove("jobId");
        }
    }

    private void failIfActive(String jobId, String error, String errorType) {
        try {
            Job job = jobs.getJob(jobId);
            if (job.status() == JobStatus.QUEUED) {
                jobs.startJob(jobId);
            }
            jobs.failJob(jobId, error, errorType);
        } catch (InvalidTransitionException | JobNotFoundException e) {
            log.warn("Could not fail job {}: {}", jobId, e.getMessage());
        }
    }
}
