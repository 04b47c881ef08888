package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.AgentNotFoundException;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.agent.StubAgent;
import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.model.JobType;
import com.aistudio.orchestrator.repository.InMemoryJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Batch jobs run on the calling thread ({@code Runnable::run}) so outcomes
 * can be asserted right after submit.
 */
class BatchServiceTest {

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    JobQueueManager     jobs;
    BackgroundJobRunner runner;

    @BeforeEach
    void setUp() {
        jobs   = new JobQueueManager(new InMemoryJobStore(), List.of(), meters, null,
                new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        runner = new BackgroundJobRunner(jobs, Runnable::run);
    }

    private BatchService service(StubAgent agent) {
        return new BatchService(jobs, runner, new AgentRegistry(List.of(agent), meters));
    }

    private static List<Map<String, Object>> items(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(n -> Map.<String, Object>of("n", n)).toList();
    }

    /** Fails for the given item numbers, echoes the rest. */
    private static StubAgent failingOn(String agentId, List<Integer> bad) {
        return new StubAgent(agentId, (input, ctx) -> {
            int n = (Integer) input.get("n");
            if (bad.contains(n)) throw new IllegalStateException("item " + n + " rejected");
            return Map.of("image_url", "http://img/" + n + ".png");
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void someItemsFail_batchCompletesWithBothLists() {
        StubAgent agent = failingOn("image_generator", List.of(2, 4));

        String id = service(agent).submit("image_generator", items(5));

        Job job = jobs.getJob(id);
        assertThat(job.type()).isEqualTo(JobType.BATCH_GENERATE);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(agent.calls()).hasSize(5);

        List<Map<String, Object>> succeeded = (List<Map<String, Object>>) job.result().get("succeeded");
        List<Map<String, Object>> failed    = (List<Map<String, Object>>) job.result().get("failed");
        assertThat(succeeded).extracting(m -> m.get("item")).containsExactly(1, 3, 5);
        assertThat(failed).extracting(m -> m.get("item")).containsExactly(2, 4);
        assertThat(failed.get(0).get("error").toString()).contains("item 2 rejected");
        assertThat(failed.get(0)).containsKey("errorType");
    }

    @Test
    void everyItemFails_jobFails() {
        String id = service(failingOn("tagger", List.of(1, 2, 3))).submit("tagger", items(3));

        Job job = jobs.getJob(id);
        assertThat(job.type()).isEqualTo(JobType.BATCH_ANALYZE);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.errorType()).isEqualTo(BatchService.ALL_FAILED);
        assertThat(job.error()).startsWith("All 3 items failed");
    }

    @Test
    void cancelledMidBatch_stopsBeforeNextItem() {
        AtomicReference<String> jobId = new AtomicReference<>();
        StubAgent agent = new StubAgent("tagger", (input, ctx) -> {
            if (Integer.valueOf(2).equals(input.get("n"))) jobs.cancelJob(ctx.jobId());
            jobId.set(ctx.jobId());
            return Map.of("tag", "x");
        });

        String id = service(agent).submit("tagger", items(5));

        assertThat(agent.calls()).hasSize(2);
        assertThat(jobs.getJob(id).status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(jobId.get()).isEqualTo(id);
    }

    @Test
    void emptyBatch_isRejected() {
        BatchService service = service(StubAgent.returning("tagger", Map.of()));

        assertThatThrownBy(() -> service.submit("tagger", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(jobs.listJobs(null, 10)).isEmpty();
    }

    @Test
    void unknownAgent_isRejectedBeforeAnyJobExists() {
        BatchService service = service(StubAgent.returning("tagger", Map.of()));

        assertThatThrownBy(() -> service.submit("ghost", items(2)))
                .isInstanceOf(AgentNotFoundException.class);
        assertThat(jobs.listJobs(null, 10)).isEmpty();
    }
}
