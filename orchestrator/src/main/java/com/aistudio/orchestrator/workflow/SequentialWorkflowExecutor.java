package com.aistudio.orchestrator.workflow;

import com.aistudio.orchestrator.agent.AgentContext;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.agent.ExecutionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a {@link WorkflowDefinition} step by step over a shared context.
 *
 * Each step reads its declared inputs from the context, calls its agent, and
 * writes the bound outputs back. The first failing step aborts the run; the
 * context keeps whatever earlier steps produced.
 *
 * Stateless: one instance serves any number of concurrent executions, each
 * with its own {@link WorkflowExecution}.
 */
@Component
public class SequentialWorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(SequentialWorkflowExecutor.class);

    public WorkflowExecution execute(WorkflowDefinition definition,
                                     AgentRegistry registry,
                                     Map<String, Object> inputParams,
                                     ProgressCallback progress) {
        return execute(definition, registry, inputParams, progress, AgentContext.standalone());
    }

    /**
     * Execute the workflow.
     *
     * Never throws for a step failure: the outcome is reported through the
     * returned execution's status, error and failed step id.
     *
     * @param ctx job id and cancellation token handed to every agent
     */
    public WorkflowExecution execute(WorkflowDefinition definition,
                                     AgentRegistry registry,
                                     Map<String, Object> inputParams,
                                     ProgressCallback progress,
                                     AgentContext ctx) {
        List<WorkflowStep> steps = definition.steps();
        WorkflowExecution execution = new WorkflowExecution(definition.workflowId(), steps.size(), inputParams);
        ProgressCallback callback = progress == null ? ProgressCallback.NONE : progress;

        log.info("Workflow '{}' started (execution={}, steps={})",
                definition.workflowId(), execution.getExecutionId(), steps.size());

        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);

            if (ctx.cancellation().isCancellationRequested()) {
                execution.cancel(step.stepId(), false);
                log.info("Workflow '{}' cancelled before step '{}'", definition.workflowId(), step.stepId());
                return execution;
            }

            execution.enterStep(step.stepId());
            MDC.put("stepId", step.stepId());
            try {
                callback.onStep(i + 1, step.stepId(), step.description());
                runStep(step, registry, execution.mutableContext(), ctx.forStep(step.stepId()));
                execution.stepDone();
            } catch (ExecutionCancelledException e) {
                execution.cancel(step.stepId(), true);
                log.info("Workflow '{}' cancelled during step '{}'", definition.workflowId(), step.stepId());
                return execution;
            } catch (Exception e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                execution.fail(step.stepId(), message, e.getClass().getSimpleName());
                log.warn("Workflow '{}' failed at step '{}': {}", definition.workflowId(), step.stepId(), message);
                return execution;
            } finally {
                MDC.remove("stepId");
            }
        }

        execution.complete(finalResult(steps, execution.mutableContext()));
        log.info("Workflow '{}' completed in {} ms",
                definition.workflowId(), execution.getExecutionTime().toMillis());
        return execution;
    }

    // ------------------------------------------------------------------
    // Step execution
    // ------------------------------------------------------------------

    private void runStep(WorkflowStep step, AgentRegistry registry,
                         Map<String, Object> context, AgentContext stepCtx) {
        Map<String, Object> stepInput = new LinkedHashMap<>();
        for (String key : step.inputs()) {
            if (context.containsKey(key)) {
                stepInput.put(key, context.get(key));
            }
        }

        Map<String, Object> result = registry.execute(step.agentId(), stepInput, stepCtx);

        // Resolve every binding before writing any, so a failing step leaves the context untouched.
        Map<String, Object> bound = new LinkedHashMap<>();
        for (OutputBinding binding : step.outputs()) {
            resolve(step, binding, result).ifPresent(value -> bound.put(binding.contextKey(), value));
        }
        context.putAll(bound);
    }

    /**
     * Value the binding writes, or empty when an inferred binding finds nothing.
     *
     * @throws OutputBindingException when an explicit source key is missing or a
     *                                suffix match is ambiguous
     */
    static Optional<Object> resolve(WorkflowStep step, OutputBinding binding, Map<String, Object> result) {
        return switch (binding.kind()) {
            case WHOLE_RESULT -> Optional.of(result);
            case DIRECT, RENAME_FROM -> {
                if (!result.containsKey(binding.sourceKey())) {
                    throw new OutputBindingException("Step '" + step.stepId() + "': agent result has no key '"
                            + binding.sourceKey() + "' (keys: " + result.keySet() + ")");
                }
                yield Optional.ofNullable(result.get(binding.sourceKey()));
            }
            case INFERRED -> inferred(step, binding.contextKey(), result);
        };
    }

    private static Optional<Object> inferred(WorkflowStep step, String key, Map<String, Object> result) {
        if (result.containsKey(key)) {
            return Optional.ofNullable(result.get(key));
        }
        if (step.outputs().size() == 1 && !result.isEmpty()) {
            return Optional.of(result);
        }
        List<String> matches = result.keySet().stream().filter(k -> k.endsWith(key)).toList();
        if (matches.size() > 1) {
            throw new OutputBindingException("Step '" + step.stepId() + "': output '" + key
                    + "' is ambiguous, matches result keys " + matches);
        }
        if (matches.isEmpty()) {
            log.debug("Step '{}': no result key for output '{}'", step.stepId(), key);
            return Optional.empty();
        }
        return Optional.ofNullable(result.get(matches.get(0)));
    }

    private static Map<String, Object> finalResult(List<WorkflowStep> steps, Map<String, Object> context) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (steps.isEmpty()) return result;
        for (String key : steps.get(steps.size() - 1).outputKeys()) {
            if (context.containsKey(key)) {
                result.put(key, context.get(key));
            }
        }
        return result;
    }
}
