package com.aistudio.orchestrator.agent;

/** Raised by code that observed a cancellation request and stopped early. */
public class ExecutionCancelledException extends RuntimeException {
    public ExecutionCancelledException(String message) {
        super(message);
    }
}
