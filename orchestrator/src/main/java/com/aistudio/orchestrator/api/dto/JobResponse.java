package com.aistudio.orchestrator.api.dto;

import com.aistudio.orchestrator.model.BriefCard;
import com.aistudio.orchestrator.model.Job;

import java.time.Instant;
import java.util.Map;

/**
 * Full job snapshot returned by the job endpoints.
 *
 * Exposes the failure as {@code error} plus {@code errorType}; stack traces
 * never leave the server.
 */
public record JobResponse(
        String              id,
        String              type,
        String              status,
        String              title,
        String              description,
        double              progress,
        String              currentStep,
        int                 stepsTotal,
        int                 stepsCompleted,
        String              progressMessage,
        Map<String, Object> result,
        String              error,
        String              errorType,
        Map<String, Object> awaitingData,
        BriefCard           briefCard,
        Map<String, Object> userInput,
        Map<String, Object> metadata,
        boolean             cancelable,
        Instant             createdAt,
        Instant             startedAt,
        Instant             completedAt,
        Instant             deadline
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.type().wireName(),
                job.status().wireName(),
                job.title(),
                job.description(),
                job.progress(),
                job.currentStep(),
                job.stepsTotal(),
                job.stepsCompleted(),
                job.progressMessage(),
                job.result(),
                job.error(),
                job.errorType(),
                job.awaitingData(),
                job.briefCard(),
                job.userInput(),
                job.metadata(),
                job.cancelable(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.deadline()
        );
    }
}
