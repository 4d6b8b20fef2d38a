package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.analysis.DimensionAnalysisEngine;
import com.commerce.diagnostics.analysis.DimensionCatalog;
import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WindowResolver;
import com.commerce.diagnostics.model.AnalysisResults;
import com.commerce.diagnostics.model.DimensionFilter;
import com.commerce.diagnostics.model.Finding;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-analyzes the node's dimension restricted to the top root cause's value, looking for a
 * finer-grained explanation. Runs only when the top cause is strong enough; the best new
 * finding is appended to the root causes.
 */
@Component
public class DrillDownNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(DrillDownNodeExecutor.class);

    private final DimensionAnalysisEngine dimensionAnalysisEngine;
    private final WindowResolver windowResolver;
    private final EngineConfig engineConfig;

    public DrillDownNodeExecutor(DimensionAnalysisEngine dimensionAnalysisEngine,
                                 WindowResolver windowResolver,
                                 EngineConfig engineConfig) {
        this.dimensionAnalysisEngine = dimensionAnalysisEngine;
        this.windowResolver = windowResolver;
        this.engineConfig = engineConfig;
    }

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.DRILL_DOWN;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        AnalysisResults results = context.getAnalysisResults();
        Finding topCause = results.getTopCause();
        if (topCause == null) {
            log.info("No root causes found, skipping drill-down");
            return NodeOutcome.success(node.getNext());
        }
        double minImpact = engineConfig.getThresholds().getDrillDownMinImpact();
        if (topCause.getImpactScore() <= minImpact) {
            log.info("Top cause impact too low ({}) for drill-down", topCause.getImpactScore());
            return NodeOutcome.success(node.getNext());
        }
        if (node.getDimension() == null || node.getDimension().isBlank()) {
            log.warn("Drill-down node {} declares no dimension", node.getId());
            return NodeOutcome.success(node.getNext());
        }

        String filterColumn = DimensionCatalog.filterColumnFor(topCause.getDimension());
        List<DimensionFilter> filters = List.of(DimensionFilter.builder()
                .column(filterColumn)
                .value(topCause.getValue())
                .build());
        log.info("Drilling down: analyzing '{}' where {}='{}'", node.getDimension(), filterColumn, topCause.getValue());

        List<Finding> findings = dimensionAnalysisEngine.analyze(context.getBrand().getBrandId(),
                node.getDimension(), windowResolver.resolveComparison(context.getAlert()), filters);

        if (findings.isEmpty()) {
            log.info("Drill-down yielded no specific sub-factors");
        } else {
            Finding drilled = findings.get(0);
            List<Finding> rootCauses = new ArrayList<>(results.getRootCauses());
            rootCauses.add(drilled);
            results.setRootCauses(rootCauses);
            results.setDrillDownPath(List.of(topCause.getDimension() + "=" + topCause.getValue()));
            log.info("Drill-down found specific factor: {} (impact {})",
                    drilled.getValue(), String.format("%.1f", drilled.getImpactScore()));
        }
        return NodeOutcome.success(node.getNext());
    }
}
