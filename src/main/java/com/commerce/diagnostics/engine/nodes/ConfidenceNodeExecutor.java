package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.model.Finding;
import com.commerce.diagnostics.model.FunnelMetric;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores confidence in the analysis from the shape of the evidence.
 *
 * Base 0.5:
 *   +0.3 if the top cause impact is above 50, else +0.15 if above 20
 *   +0.1 for a single cause, or when the top cause is more than twice the second
 *   -0.2 when there is no cause at all
 *   -0.1 when current orders are known and below the low-volume threshold
 * Clamped to [0.1, 0.99] and rounded to two decimals.
 */
@Component
public class ConfidenceNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceNodeExecutor.class);

    static final double BASE_SCORE = 0.5;
    static final double MIN_SCORE = 0.1;
    static final double MAX_SCORE = 0.99;

    private final EngineConfig engineConfig;

    public ConfidenceNodeExecutor(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.CONFIDENCE;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        List<Finding> causes = context.getAnalysisResults().getRootCauses();
        double score = BASE_SCORE;

        if (!causes.isEmpty()) {
            Finding top = causes.get(0);
            if (top.getImpactScore() > 50) {
                score += 0.3;
            } else if (top.getImpactScore() > 20) {
                score += 0.15;
            }

            if (causes.size() == 1) {
                score += 0.1;
            } else if (top.getImpactScore() > causes.get(1).getImpactScore() * 2) {
                score += 0.1;
            }
        } else {
            score -= 0.2;
        }

        FunnelMetric orders = context.getDerived().getFunnelMetric("orders");
        if (orders != null && orders.getCurrent() < engineConfig.getThresholds().getLowVolumeOrders()) {
            score -= 0.1;
        }

        double clamped = Math.min(Math.max(score, MIN_SCORE), MAX_SCORE);
        double rounded = Math.round(clamped * 100.0) / 100.0;
        context.getAnalysisResults().setConfidence(rounded);
        log.info("Confidence {} from {} root causes", rounded, causes.size());

        return NodeOutcome.success(node.getNext());
    }
}
