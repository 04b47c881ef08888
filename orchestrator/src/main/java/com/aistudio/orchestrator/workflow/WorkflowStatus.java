package com.aistudio.orchestrator.workflow;

public enum WorkflowStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
