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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentJobServiceTest {

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    JobQueueManager     jobs;

    @BeforeEach
    void setUp() {
        jobs = new JobQueueManager(new InMemoryJobStore(), List.of(), meters, null,
                new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
    }

    private AgentJobService service(StubAgent... agents) {
        return new AgentJobService(jobs, new BackgroundJobRunner(jobs, Runnable::run),
                new AgentRegistry(List.of(agents), meters));
    }

    @Test
    void runNow_completesWithAgentOutput() {
        StubAgent images = StubAgent.returning("image_generator", Map.of("image_url", "http://img/1.png"));

        Job job = service(images).runNow("image_generator", Map.of("prompt", "a fox"));

        assertThat(job.type()).isEqualTo(JobType.GENERATE_IMAGE);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.result()).containsEntry("image_url", "http://img/1.png");
        assertThat(job.metadata()).containsEntry("agentId", "image_generator");
        assertThat(images.calls().get(0)).containsEntry("prompt", "a fox");
    }

    @Test
    void agentFailure_failsJob() {
        Job job = service(StubAgent.failing("entity_merger", new IllegalStateException("bad json")))
                .runNow("entity_merger", Map.of());

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.errorType()).isEqualTo("AgentExecutionException");
        assertThat(job.error()).contains("bad json");
    }

    @Test
    void unknownAgent_noJobCreated() {
        assertThatThrownBy(() -> service().submit("ghost", Map.of(), true))
                .isInstanceOf(AgentNotFoundException.class);
        assertThat(jobs.listJobs(null, 10)).isEmpty();
    }

    @Test
    void jobTypeFollowsAgent() {
        assertThat(AgentJobService.jobTypeFor("story_illustrator")).isEqualTo(JobType.GENERATE_IMAGE);
        assertThat(AgentJobService.jobTypeFor("story_planner")).isEqualTo(JobType.WORKFLOW);
        assertThat(AgentJobService.jobTypeFor("entity_merger")).isEqualTo(JobType.ANALYZE);
    }
}
