package com.aistudio.orchestrator.workflow;

/** Notified before each workflow step starts. */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NONE = (stepNumber, stepId, description) -> { };

    /**
     * @param stepNumber 1-based index of the step about to run
     */
    void onStep(int stepNumber, String stepId, String description);
}
