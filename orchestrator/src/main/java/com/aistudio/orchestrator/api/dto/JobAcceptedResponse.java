package com.aistudio.orchestrator.api.dto;

import com.aistudio.orchestrator.model.Job;

/** Immediate answer to an asynchronous request: poll or stream {@code jobId} for the outcome. */
public record JobAcceptedResponse(String jobId, String status, String message) {

    public static JobAcceptedResponse from(Job job) {
        return new JobAcceptedResponse(job.id(), job.status().wireName(),
                "Job queued; poll /api/jobs/" + job.id() + " or subscribe to /api/jobs/stream");
    }
}
