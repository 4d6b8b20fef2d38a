package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;

/**
 * Strategy interface for node execution.
 * Each NodeType has exactly one executor implementation.
 */
public interface NodeExecutor {

    /**
     * @return the node type this executor handles
     */
    NodeType getSupportedNodeType();

    /**
     * Run a node against the context of the current run.
     *
     * @param node    the node definition
     * @param context the run's mutable state; executors may update it in place
     * @return the transition to follow
     */
    NodeOutcome execute(WorkflowNode node, ExecutionContext context);
}
