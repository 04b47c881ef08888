package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.model.BriefCard;
import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobType;
import com.aistudio.orchestrator.model.ResumeDecision;
import com.aistudio.orchestrator.model.Resumption;
import com.aistudio.orchestrator.repository.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human-approved entity merges.
 *
 * Two continuations share one job id:
 * <ol>
 *   <li>{@link #analyze}: the entity_merger agent proposes merged data, then
 *       the job pauses with the proposal and an approve / edit / cancel card.</li>
 *   <li>{@link #resume}: cancel ends the job with no side effects; approve or
 *       edit schedules the merge itself, which runs once on the reviewed data.</li>
 * </ol>
 */
@Service
public class MergeService {

    private static final Logger log = LoggerFactory.getLogger(MergeService.class);

    static final String FLOW         = "entity_merge";
    static final String PROPOSAL_KEY = "merged_data";

    private final JobQueueManager     jobs;
    private final BackgroundJobRunner runner;
    private final AgentRegistry       agents;
    private final EntityStore         entities;

    public MergeService(JobQueueManager jobs, BackgroundJobRunner runner,
                        AgentRegistry agents, EntityStore entities) {
        this.jobs     = jobs;
        this.runner   = runner;
        this.agents   = agents;
        this.entities = entities;
    }

    // ------------------------------------------------------------------
    // Proposal
    // ------------------------------------------------------------------

    /**
     * Start a merge analysis job.
     *
     * @param source entity that is kept; must carry an {@code id}
     * @param target entity that is archived after the merge; must carry an {@code id}
     * @return the job id
     */
    public String analyze(String entityType, Map<String, Object> source, Map<String, Object> target) {
        String sourceId = requireId(source, "source");
        String targetId = requireId(target, "target");
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Cannot merge entity " + sourceId + " into itself");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("flow", FLOW);
        metadata.put("entityType", entityType);
        metadata.put("sourceId", sourceId);
        metadata.put("targetId", targetId);

        String jobId = jobs.createJob(JobType.ANALYZE,
                "Merge " + entityType + " " + targetId + " into " + sourceId,
                "AI-assisted merge of two duplicate " + entityType + " entities",
                2, true, metadata, null);

        runner.submit(jobId, id -> propose(id, entityType, source, target, sourceId, targetId));
        return jobId;
    }

    private void propose(String jobId, String entityType, Map<String, Object> source, Map<String, Object> target,
                         String sourceId, String targetId) {
        jobs.reportStep(jobId, 1, "analyze_merge", "Analyzing entities");

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("entity_type", entityType);
        input.put("source_entity", source);
        input.put("target_entity", target);
        Map<String, Object> proposal = agents.execute("entity_merger", input,
                new AgentContext(jobId, "analyze_merge", jobs.cancellationToken(jobId)));

        Map<String, Object> awaiting = new LinkedHashMap<>();
        awaiting.put("entityType", entityType);
        awaiting.put("sourceId", sourceId);
        awaiting.put("targetId", targetId);
        awaiting.put(PROPOSAL_KEY, proposal.get(PROPOSAL_KEY));
        awaiting.put("changes_summary", proposal.get("changes_summary"));

        jobs.pauseForInput(jobId, awaiting, BriefCard.approveEditCancel(jobId,
                "Review merge of " + entityType,
                "Merge " + targetId + " into " + sourceId + ". The merged entity keeps id " + sourceId
                        + "; " + targetId + " will be archived.",
                "/api/merge/resume/" + jobId,
                awaiting));
    }

    // ------------------------------------------------------------------
    // Decision
    // ------------------------------------------------------------------

    /**
     * Apply the reviewer's decision. Only the first decision on a job is
     * accepted; a second one fails with {@link InvalidTransitionException}.
     */
    public Job resume(String jobId, ResumeDecision decision) {
        requireFlow(jobs.getJob(jobId));
        Resumption resumption = jobs.resumeWithInput(jobId, decision);
        if (!decision.proceeds()) {
            log.info("Merge job {} cancelled by reviewer", jobId);
            return resumption.job();
        }

        Map<String, Object> mergedData = resumption.effectivePayload(PROPOSAL_KEY);
        String sourceId = String.valueOf(resumption.awaitingData().get("sourceId"));
        String targetId = String.valueOf(resumption.awaitingData().get("targetId"));

        runner.submit(jobId, id -> executeMerge(id, sourceId, targetId, mergedData));
        return resumption.job();
    }

    /**
     * Update the source with the merged data, repoint references from the
     * target, archive the target.
     */
    void executeMerge(String jobId, String sourceId, String targetId, Map<String, Object> mergedData) {
        jobs.reportStep(jobId, 2, "execute_merge", "Executing merge");

        if (entities.find(sourceId).isEmpty()) {
            throw new IllegalArgumentException("Source entity not found: " + sourceId);
        }
        if (entities.find(targetId).isEmpty()) {
            throw new IllegalArgumentException("Target entity not found: " + targetId);
        }

        entities.update(sourceId, mergedData);
        int referencesUpdated = entities.reassignReferences(targetId, sourceId);
        entities.archive(targetId, sourceId);
        log.info("Merged {} into {} ({} references updated)", targetId, sourceId, referencesUpdated);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("message", "Merged " + targetId + " into " + sourceId);
        result.put("mergedEntityId", sourceId);
        result.put("archivedEntityId", targetId);
        result.put("referencesUpdated", referencesUpdated);
        jobs.completeJob(jobId, result);
    }

    private static void requireFlow(Job job) {
        if (!FLOW.equals(job.metadata().get("flow"))) {
            throw new IllegalArgumentException("Job " + job.id() + " is not a merge job");
        }
    }

    private static String requireId(Map<String, Object> entity, String role) {
        Object id = entity == null ? null : entity.get("id");
        if (id == null || id.toString().isBlank()) {
            throw new IllegalArgumentException("The " + role + " entity must have an 'id'");
        }
        return id.toString();
    }
}
