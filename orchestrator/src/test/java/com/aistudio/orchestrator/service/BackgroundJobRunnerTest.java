package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.model.JobType;
import com.aistudio.orchestrator.repository.InMemoryJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class BackgroundJobRunnerTest {

    JobQueueManager     jobs;
    BackgroundJobRunner runner;

    @BeforeEach
    void setUp() {
        jobs   = new JobQueueManager(new InMemoryJobStore(), List.of(), new SimpleMeterRegistry(), null,
                new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        runner = new BackgroundJobRunner(jobs, Runnable::run);
    }

    @Test
    void submit_startsQueuedJobAndRunsTaskWithJobIdInMdc() {
        String id = jobs.createJob(JobType.ANALYZE, "t", "d");
        List<String> seen = new ArrayList<>();

        runner.submit(id, jobId -> {
            seen.add(jobs.getJob(jobId).status().wireName());
            seen.add(MDC.get("jobId"));
            jobs.completeJob(jobId, Map.of("ok", true));
        });

        assertThat(seen).containsExactly("running", id);
        assertThat(MDC.get("jobId")).isNull();
        assertThat(jobs.getJob(id).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void throwingTask_failsJobWithExceptionType() {
        String id = jobs.createJob(JobType.ANALYZE, "t", "d");

        runner.submit(id, jobId -> { throw new IllegalStateException("provider down"); });

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error()).isEqualTo("provider down");
        assertThat(job.errorType()).isEqualTo("IllegalStateException");
    }

    @Test
    void taskThrowingAfterCancel_leavesJobCancelled() {
        String id = jobs.createJob(JobType.ANALYZE, "t", "d");

        runner.submit(id, jobId -> {
            jobs.cancelJob(jobId);
            throw new IllegalStateException("noticed too late");
        });

        assertThat(jobs.getJob(id).status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void cancelledJob_taskIsSkipped() {
        String id = jobs.createJob(JobType.ANALYZE, "t", "d");
        jobs.cancelJob(id);
        List<String> ran = new ArrayList<>();

        runner.submit(id, ran::add);

        assertThat(ran).isEmpty();
        assertThat(jobs.getJob(id).status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void rejectedByPool_failsJob() {
        BackgroundJobRunner saturated = new BackgroundJobRunner(jobs, task -> {
            throw new RejectedExecutionException("queue full");
        });
        String id = jobs.createJob(JobType.ANALYZE, "t", "d");

        saturated.submit(id, jobId -> { });

        Job job = jobs.getJob(id);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.errorType()).isEqualTo("Rejected");
    }
}
