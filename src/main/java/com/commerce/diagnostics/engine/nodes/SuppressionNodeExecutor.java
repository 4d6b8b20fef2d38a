package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.springframework.stereotype.Component;

@Component
public class SuppressionNodeExecutor implements NodeExecutor {

    static final String DEFAULT_REASON = "unknown";

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.SUPPRESSION;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        return NodeOutcome.suppressed(node.getReason() != null ? node.getReason() : DEFAULT_REASON);
    }
}
