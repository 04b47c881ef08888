package com.aistudio.orchestrator.agent;

/**
 * Cooperative cancellation signal.
 *
 * Cancelling a job only flips its state; long-running code polls this token
 * between units of work and stops on its own.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new ExecutionCancelledException("Execution cancelled");
        }
    }
}
