package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.model.JobStatus;

/**
 * An operation was attempted on a job whose current state does not permit it.
 * The job is left untouched.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String    jobId;
    private final JobStatus currentStatus;

    public InvalidTransitionException(String jobId, String operation, JobStatus currentStatus) {
        super("Cannot " + operation + " job " + jobId + " in state '" + currentStatus.wireName() + "'");
        this.jobId         = jobId;
        this.currentStatus = currentStatus;
    }

    public InvalidTransitionException(String jobId, JobStatus currentStatus, String message) {
        super(message);
        this.jobId         = jobId;
        this.currentStatus = currentStatus;
    }

    public String getJobId()              { return jobId; }
    public JobStatus getCurrentStatus()   { return currentStatus; }
}
