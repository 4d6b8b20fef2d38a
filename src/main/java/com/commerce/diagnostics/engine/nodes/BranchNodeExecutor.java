package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ConditionEvaluator;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.model.BranchRule;
import com.commerce.diagnostics.model.DefaultRoute;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes to the first rule whose condition holds, in declaration order.
 * Otherwise follows {@code default_next}; a terminate default, or no default at all,
 * suppresses the run.
 */
@Component
public class BranchNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(BranchNodeExecutor.class);

    static final String NO_MATCHING_ROUTE = "no_matching_route";

    private final ConditionEvaluator conditionEvaluator;

    public BranchNodeExecutor(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.BRANCH;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        if (node.getRules() != null) {
            for (BranchRule rule : node.getRules()) {
                if (conditionEvaluator.evaluate(rule.getCondition(), context)) {
                    log.debug("Branch {} matched {} -> {}", node.getId(), rule.getCondition(), rule.getNext());
                    return NodeOutcome.success(rule.getNext());
                }
            }
        }

        DefaultRoute defaultNext = node.getDefaultNext();
        if (defaultNext == null) {
            log.info("Branch {} has no matching rule and no default route", node.getId());
            return NodeOutcome.suppressed(NO_MATCHING_ROUTE);
        }
        if (defaultNext.isTerminate()) {
            String reason = defaultNext.getReason() != null ? defaultNext.getReason() : NO_MATCHING_ROUTE;
            log.info("Branch {} terminated by default route: {}", node.getId(), reason);
            return NodeOutcome.suppressed(reason);
        }
        return NodeOutcome.success(defaultNext.getNodeId());
    }
}
