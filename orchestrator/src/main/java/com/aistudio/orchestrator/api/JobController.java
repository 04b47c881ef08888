package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.api.dto.JobResponse;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.service.JobEventService;
import com.aistudio.orchestrator.service.JobQueueManager;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST API for observing and controlling jobs.
 *
 * GET    /api/jobs               list jobs, newest first (?status=running&limit=50)
 * GET    /api/jobs/{id}          poll one job
 * POST   /api/jobs/{id}/cancel   cancel a job that has not finished
 * DELETE /api/jobs/{id}          remove a finished job
 * GET    /api/jobs/stream        Server-Sent Events, one "job" event per state change
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobQueueManager jobs;
    private final JobEventService events;

    public JobController(JobQueueManager jobs, JobEventService events) {
        this.jobs   = jobs;
        this.events = events;
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String status,
                                  @RequestParam(defaultValue = "50") int limit) {
        JobStatus filter = status == null || status.isBlank() ? null : JobStatus.fromWireName(status);
        return jobs.listJobs(filter, limit).stream().map(JobResponse::from).toList();
    }

    /**
     * Poll the current state of a job.
     * Returns 404 if the job id is unknown.
     */
    @GetMapping("/{id}")
    public JobResponse get(@PathVariable String id) {
        return JobResponse.from(jobs.getJob(id));
    }

    /**
     * Cancel a job. Returns 409 if the job already finished or is not cancelable.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/jobs/{id}/cancel
     */
    @PostMapping("/{id}/cancel")
    public JobResponse cancel(@PathVariable String id) {
        return JobResponse.from(jobs.cancelJob(id));
    }

    /** Returns 409 for a job that has not finished yet. */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        jobs.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Stream job snapshots as they change.
     *
     * Example:
     *   curl -N http://localhost:8080/api/jobs/stream?jobId={id}
     */
    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String jobId) {
        return events.subscribe(jobId);
    }
}
