package com.aistudio.orchestrator.workflow;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * State of one {@link SequentialWorkflowExecutor#execute} call.
 *
 * Mutated only by the executor while the call is in progress; callers get it
 * back finished and treat it as read-only.
 */
public class WorkflowExecution {

    private final String              executionId;
    private final String              workflowId;
    private final int                 stepsTotal;
    private final Map<String, Object> context;
    private final Instant             startedAt;

    private WorkflowStatus      status = WorkflowStatus.RUNNING;
    private String              currentStep;
    private int                 stepsCompleted;
    private Map<String, Object> result;
    private String              error;
    private String              errorType;
    private String              failedStepId;
    private Instant             completedAt;

    WorkflowExecution(String workflowId, int stepsTotal, Map<String, Object> inputParams) {
        this.executionId = "wf_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        this.workflowId  = workflowId;
        this.stepsTotal  = stepsTotal;
        this.context     = new LinkedHashMap<>(inputParams == null ? Map.of() : inputParams);
        this.startedAt   = Instant.now();
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public String getExecutionId()          { return executionId; }
    public String getWorkflowId()           { return workflowId; }
    public WorkflowStatus getStatus()       { return status; }
    public String getCurrentStep()          { return currentStep; }
    public int getStepsCompleted()          { return stepsCompleted; }
    public int getStepsTotal()              { return stepsTotal; }
    public Map<String, Object> getContext() { return Collections.unmodifiableMap(context); }
    public Map<String, Object> getResult()  { return result; }
    public String getError()                { return error; }
    public String getErrorType()            { return errorType; }
    public String getFailedStepId()         { return failedStepId; }
    public Instant getStartedAt()           { return startedAt; }
    public Instant getCompletedAt()         { return completedAt; }

    public Duration getExecutionTime() {
        return completedAt == null ? null : Duration.between(startedAt, completedAt);
    }

    public boolean isCompleted() {
        return status == WorkflowStatus.COMPLETED;
    }

    // ------------------------------------------------------------------
    // Executor-only transitions
    // ------------------------------------------------------------------

    Map<String, Object> mutableContext() {
        return context;
    }

    void enterStep(String stepId) {
        this.currentStep = stepId;
    }

    void stepDone() {
        this.stepsCompleted++;
    }

    void complete(Map<String, Object> result) {
        this.status      = WorkflowStatus.COMPLETED;
        this.result      = Collections.unmodifiableMap(new LinkedHashMap<>(result));
        this.completedAt = Instant.now();
    }

    void fail(String stepId, String error, String errorType) {
        this.status       = WorkflowStatus.FAILED;
        this.failedStepId = stepId;
        this.error        = error;
        this.errorType    = errorType;
        this.completedAt  = Instant.now();
    }

    /** @param duringStep true when the step itself stopped on the token, false when it never started */
    void cancel(String stepId, boolean duringStep) {
        this.status       = WorkflowStatus.CANCELLED;
        this.failedStepId = stepId;
        this.error        = duringStep
                ? "Workflow cancelled during step '" + stepId + "'"
                : "Workflow cancelled before step '" + stepId + "'";
        this.errorType    = "Cancelled";
        this.completedAt  = Instant.now();
    }
}
