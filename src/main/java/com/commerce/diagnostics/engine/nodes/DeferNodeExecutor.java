package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.springframework.stereotype.Component;

@Component
public class DeferNodeExecutor implements NodeExecutor {

    static final String DEFAULT_REASON = "insufficient_data";

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.DEFER;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        return NodeOutcome.deferred(node.getReason() != null ? node.getReason() : DEFAULT_REASON);
    }
}
