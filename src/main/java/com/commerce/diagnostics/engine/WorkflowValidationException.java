package com.commerce.diagnostics.engine;

/**
 * A workflow graph is malformed or structurally unsafe. Raised before any node runs.
 */
public class WorkflowValidationException extends RuntimeException {

    public WorkflowValidationException(String message) {
        super(message);
    }
}
