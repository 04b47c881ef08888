package com.aistudio.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one background unit of work.
 *
 * Immutable: the {@code JobQueueManager} replaces the stored snapshot on every
 * transition, so a reader never observes a half-applied update. Use
 * {@link #newJob} to create the initial QUEUED snapshot.
 */
public record Job(
        String              id,
        JobType             type,
        JobStatus           status,
        String              title,
        String              description,

        // Progress
        double              progress,          // 0.0 – 1.0, non-decreasing while running
        String              currentStep,
        int                 stepsTotal,
        int                 stepsCompleted,
        String              progressMessage,

        // Outcome
        Map<String, Object> result,            // set only on COMPLETED
        String              error,             // set only on FAILED
        String              errorType,

        // Human-in-the-loop
        Map<String, Object> awaitingData,      // set only while AWAITING_INPUT
        BriefCard           briefCard,
        Map<String, Object> userInput,         // the last resume decision, kept for audit

        Map<String, Object> metadata,
        boolean             cancelable,

        Instant             createdAt,
        Instant             startedAt,
        Instant             completedAt,
        Instant             deadline           // null = no deadline
) {

    public Job {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static Job newJob(String id, JobType type, String title, String description,
                             int stepsTotal, boolean cancelable, Map<String, Object> metadata,
                             Instant createdAt, Instant deadline) {
        return new Job(id, type, JobStatus.QUEUED, title, description,
                0.0, null, Math.max(stepsTotal, 1), 0, null,
                null, null, null,
                null, null, null,
                metadata, cancelable,
                createdAt, null, null, deadline);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True once the deadline has passed; never true for a job without one. */
    public boolean isPastDeadline(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
