package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.analysis.DimensionAnalysisEngine;
import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WindowResolver;
import com.commerce.diagnostics.model.AnalysisResults;
import com.commerce.diagnostics.model.ComparisonWindows;
import com.commerce.diagnostics.model.Finding;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Runs dimension analysis over every declared dimension, merges the findings and keeps
 * only the valid ones as root causes.
 *
 * A finding is valid when its impact exceeds the absolute threshold, or exceeds the
 * relative share of the overall order drop ({@code orders_delta_pct}, 100 when unknown).
 * The top valid finding is dominant above the dominance threshold, or when it is the only
 * valid finding above the absolute threshold; otherwise several valid findings mean
 * mixed factors.
 */
@Component
public class RecursiveDimensionBreakdownNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(RecursiveDimensionBreakdownNodeExecutor.class);

    private static final double DEFAULT_TOTAL_DROP_PCT = 100.0;

    private final DimensionAnalysisEngine dimensionAnalysisEngine;
    private final WindowResolver windowResolver;
    private final EngineConfig engineConfig;

    public RecursiveDimensionBreakdownNodeExecutor(DimensionAnalysisEngine dimensionAnalysisEngine,
                                                   WindowResolver windowResolver,
                                                   EngineConfig engineConfig) {
        this.dimensionAnalysisEngine = dimensionAnalysisEngine;
        this.windowResolver = windowResolver;
        this.engineConfig = engineConfig;
    }

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.RECURSIVE_DIMENSION_BREAKDOWN;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        Long brandId = context.getBrand().getBrandId();
        List<String> dimensions = node.getDimensions() != null ? node.getDimensions() : Collections.emptyList();
        if (dimensions.isEmpty()) {
            log.warn("Breakdown node {} declares no dimensions", node.getId());
        }

        ComparisonWindows windows = windowResolver.resolveComparison(context.getAlert());
        List<Finding> allFindings = new ArrayList<>();
        for (String dimension : dimensions) {
            allFindings.addAll(dimensionAnalysisEngine.analyze(brandId, dimension, windows, Collections.emptyList()));
        }
        allFindings.sort(Comparator.comparingDouble(Finding::getImpactScore).reversed());

        EngineConfig.Thresholds thresholds = engineConfig.getThresholds();
        double totalDropPct = totalDropPct(context);
        List<Finding> validCauses = new ArrayList<>();
        for (Finding finding : allFindings) {
            double relativeImpact = finding.getImpactScore() / totalDropPct * 100.0;
            if (relativeImpact > thresholds.getValidCauseRelativePct()
                    || finding.getImpactScore() > thresholds.getValidCauseImpact()) {
                validCauses.add(finding);
            }
        }

        AnalysisResults results = context.getAnalysisResults();
        if (validCauses.isEmpty()) {
            log.info("No dominant root causes found across {} ({} weak signals)", dimensions, allFindings.size());
        } else {
            Finding top = validCauses.get(0);
            boolean dominant = top.getImpactScore() > thresholds.getDominantImpact()
                    || (validCauses.size() == 1 && top.getImpactScore() > thresholds.getValidCauseImpact());
            if (!dominant && validCauses.size() > 1) {
                log.info("Mixed factors detected, no single dominant cause among {}", validCauses.size());
                results.setMixedFactors(true);
            } else {
                log.info("Dominant cause confirmed: {}={} (impact {})",
                        top.getDimension(), top.getValue(), String.format("%.1f", top.getImpactScore()));
            }
        }

        results.setRootCauses(validCauses);
        return NodeOutcome.success(node.getNext());
    }

    private static double totalDropPct(ExecutionContext context) {
        Double ordersDelta = context.getDerived().lookup("orders_delta_pct");
        if (ordersDelta == null || ordersDelta == 0.0) {
            return DEFAULT_TOTAL_DROP_PCT;
        }
        return Math.abs(ordersDelta);
    }
}
