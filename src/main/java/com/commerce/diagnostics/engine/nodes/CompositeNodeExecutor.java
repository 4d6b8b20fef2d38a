package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WorkflowExecutionException;
import com.commerce.diagnostics.engine.WorkflowValidator;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.springframework.stereotype.Component;

/**
 * Jumps into a sub-graph: {@code start_node_id}, else the first of {@code steps}.
 *
 * The composite does not loop or return. The last step of the sub-graph must itself
 * point at whatever should run after the composite.
 */
@Component
public class CompositeNodeExecutor implements NodeExecutor {

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.COMPOSITE;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        String entry = WorkflowValidator.compositeEntry(node);
        if (entry == null) {
            throw new WorkflowExecutionException("Composite node " + node.getId() + " has no entry step");
        }
        return NodeOutcome.success(entry);
    }
}
