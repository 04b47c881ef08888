package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.agent.CancellationToken;
import com.aistudio.orchestrator.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one agent over independent items, collecting every outcome.
 *
 * Unlike a workflow, one item's failure does not stop the batch: each
 * attempt yields an {@link ItemResult}. The job completes with
 * {@code {succeeded: [...], failed: [...]}} when at least one item
 * succeeded, and fails when none did.
 */
@Service
public class BatchService {

    private static final Logger log = LoggerFactory.getLogger(BatchService.class);

    public static final String ALL_FAILED = "BatchFailed";

    private final JobQueueManager     jobs;
    private final BackgroundJobRunner runner;
    private final AgentRegistry       agents;

    public BatchService(JobQueueManager jobs, BackgroundJobRunner runner, AgentRegistry agents) {
        this.jobs   = jobs;
        this.runner = runner;
        this.agents = agents;
    }

    /** @return the job id */
    public String submit(String agentId, List<Map<String, Object>> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one item");
        }
        AgentConfig config = agents.get(agentId).config();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agentId", agentId);
        metadata.put("items", items.size());

        JobType type = AgentJobService.jobTypeFor(agentId) == JobType.GENERATE_IMAGE
                ? JobType.BATCH_GENERATE : JobType.BATCH_ANALYZE;
        String jobId = jobs.createJob(type, config.name() + " x" + items.size(),
                "Batch of " + items.size() + " " + agentId + " calls", items.size(), true, metadata, null);

        List<Map<String, Object>> snapshot = List.copyOf(items);
        runner.submit(jobId, id -> runBatch(id, agentId, snapshot));
        return jobId;
    }

    void runBatch(String jobId, String agentId, List<Map<String, Object>> items) {
        CancellationToken cancellation = jobs.cancellationToken(jobId);
        List<ItemResult<Map<String, Object>>> results = new ArrayList<>();

        for (int i = 0; i < items.size(); i++) {
            if (cancellation.isCancellationRequested()) {
                log.info("Batch job {} stopped after {} of {} items", jobId, i, items.size());
                jobs.expireIfOverdue(jobId);
                return;
            }
            int item = i + 1;
            jobs.reportStep(jobId, item, "item_" + item, "Processing item " + item + " of " + items.size());
            results.add(attempt(jobId, agentId, item, items.get(i), cancellation));
        }

        List<Map<String, Object>> succeeded = results.stream().filter(ItemResult::isSuccess).map(ItemResult::toMap).toList();
        List<Map<String, Object>> failed    = results.stream().filter(r -> !r.isSuccess()).map(ItemResult::toMap).toList();

        if (succeeded.isEmpty()) {
            jobs.failJob(jobId, "All " + items.size() + " items failed; first error: " + failed.get(0).get("error"),
                    ALL_FAILED);
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("succeeded", succeeded);
        payload.put("failed", failed);
        jobs.completeJob(jobId, payload);
    }

    private ItemResult<Map<String, Object>> attempt(String jobId, String agentId, int item,
                                                    Map<String, Object> input, CancellationToken cancellation) {
        try {
            Map<String, Object> output = agents.execute(agentId, input,
                    new AgentContext(jobId, "item_" + item, cancellation));
            return ItemResult.success(item, output);
        } catch (RuntimeException e) {
            log.warn("Batch job {} item {} failed: {}", jobId, item, e.getMessage());
            return ItemResult.failure(item, e);
        }
    }
}
