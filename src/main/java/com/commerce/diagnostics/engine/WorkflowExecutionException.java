package com.commerce.diagnostics.engine;

/**
 * Fatal interpreter failure: missing node or executor, unknown transition, exhausted step budget.
 */
public class WorkflowExecutionException extends RuntimeException {

    public WorkflowExecutionException(String message) {
        super(message);
    }

    public WorkflowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
