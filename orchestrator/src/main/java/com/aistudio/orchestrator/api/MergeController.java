package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.api.dto.JobAcceptedResponse;
import com.aistudio.orchestrator.api.dto.JobResponse;
import com.aistudio.orchestrator.api.dto.MergeRequest;
import com.aistudio.orchestrator.api.dto.ResumeRequest;
import com.aistudio.orchestrator.service.JobQueueManager;
import com.aistudio.orchestrator.service.MergeService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /api/merge/analyze           propose a merge; the job pauses for review
 * POST /api/merge/resume/{jobId}    approve, edit or cancel the proposal
 */
@RestController
@RequestMapping("/api/merge")
public class MergeController {

    private final MergeService    merges;
    private final JobQueueManager jobs;

    public MergeController(MergeService merges, JobQueueManager jobs) {
        this.merges = merges;
        this.jobs   = jobs;
    }

    @PostMapping("/analyze")
    public ResponseEntity<JobAcceptedResponse> analyze(@Valid @RequestBody MergeRequest request) {
        String jobId = merges.analyze(request.entityType(), request.sourceEntity(), request.targetEntity());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.from(jobs.getJob(jobId)));
    }

    /**
     * Returns the job right after the decision: RUNNING while the merge
     * executes in the background, CANCELLED for a cancel. A second decision
     * on the same job gets 409.
     */
    @PostMapping("/resume/{jobId}")
    public JobResponse resume(@PathVariable String jobId, @Valid @RequestBody ResumeRequest request) {
        return JobResponse.from(merges.resume(jobId, request.toDecision()));
    }
}
