package com.aistudio.orchestrator.workflow;

/** An agent result could not be bound to the step's declared outputs. */
public class OutputBindingException extends RuntimeException {
    public OutputBindingException(String message) {
        super(message);
    }
}
