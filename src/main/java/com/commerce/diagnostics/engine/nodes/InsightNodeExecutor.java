package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.analysis.DimensionCatalog;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.model.AnalysisResults;
import com.commerce.diagnostics.model.FinalInsight;
import com.commerce.diagnostics.model.Finding;
import com.commerce.diagnostics.model.Insight;
import com.commerce.diagnostics.model.InsightClassification;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Terminal node: classifies the run and writes the narrative insight.
 *
 * The wording of the summary follows the confidence: above 0.8 the drop is "driven by"
 * the top cause, above 0.6 "likely associated with" it, otherwise "potentially related to" it.
 * Confidence defaults to 0.5 when no confidence node ran.
 */
@Component
public class InsightNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(InsightNodeExecutor.class);

    static final double DEFAULT_CONFIDENCE = 0.5;
    private static final double SECONDARY_FACTOR_IMPACT = 50.0;

    static final String LIMITATION_GRANULARITY = "Analysis limited to granularities defined in workflow";
    static final String LIMITATION_LOW_CONFIDENCE = "Low confidence signal - findings may be noise or secondary factors";
    static final String LIMITATION_MIXED = "Multiple contributing factors detected - causality is complex";
    static final String LIMITATION_PARTIAL = "Warning: Analysis performed on partial/incomplete window";

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.INSIGHT;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        AnalysisResults results = context.getAnalysisResults();
        List<Finding> causes = new ArrayList<>(results.getRootCauses());
        double confidence = results.getConfidence() != null ? results.getConfidence() : DEFAULT_CONFIDENCE;

        InsightClassification classification = InsightClassification.classify(causes.size(), confidence);
        String summary;
        if (causes.isEmpty()) {
            summary = "CVR drop observed, but analysis of available dimensions was inconclusive.";
            classification = InsightClassification.INCONCLUSIVE;
        } else {
            Finding top = causes.get(0);
            if (results.isMixedFactors()) {
                summary = String.format("CVR drop appears to be driven by mixed factors, primarily %s (%s).",
                        top.getDimension(), top.getValue());
            } else {
                summary = String.format("%s %s (%s).", summaryPrefix(confidence), top.getDimension(), top.getValue());
            }
        }

        List<String> details = new ArrayList<>();
        for (Finding cause : causes) {
            details.add(String.format("%s '%s': %s",
                    DimensionCatalog.label(cause.getDimension()), cause.getValue(), cause.getChange()));
        }

        List<String> limitations = new ArrayList<>();
        limitations.add(LIMITATION_GRANULARITY);
        if (confidence < 0.6) {
            limitations.add(LIMITATION_LOW_CONFIDENCE);
        }
        if (results.isMixedFactors()) {
            limitations.add(LIMITATION_MIXED);
        }
        if (context.getMetadata().isPartialData()) {
            limitations.add(LIMITATION_PARTIAL);
        }

        if (node.getTemplate() != null) {
            log.debug("Insight node {} uses template {}", node.getId(), node.getTemplate());
        }

        context.setFinalInsight(FinalInsight.builder()
                .classification(classification)
                .rootCauses(causes)
                .insight(Insight.builder()
                        .summary(summary)
                        .conclusion(conclusion(causes))
                        .details(details)
                        .limitations(limitations)
                        .confidence(confidence)
                        .build())
                .build());

        log.info("Insight generated: {} (confidence {}, {} causes)", classification, confidence, causes.size());
        return NodeOutcome.done();
    }

    static String summaryPrefix(double confidence) {
        if (confidence > 0.8) {
            return "CVR drop driven by";
        }
        if (confidence > 0.6) {
            return "CVR drop likely associated with";
        }
        return "CVR drop potentially related to";
    }

    static String conclusion(List<Finding> causes) {
        if (causes.isEmpty()) {
            return "The analysis did not identify a statistically significant primary cause for the observed drop. "
                    + "This suggests the issue may be systemic, or related to a dimension not covered in the "
                    + "current workflow (e.g. Traffic Source, Site Speed).";
        }

        Finding top = causes.get(0);
        StringBuilder narrative = new StringBuilder();
        String dimension = top.getDimension() != null ? top.getDimension() : "";
        switch (dimension) {
            case "payment_gateway":
                narrative.append("The drop is primarily caused by a failure in the ")
                        .append(top.getValue()).append(" payment gateway.");
                break;
            case "discount_code":
                narrative.append("The drop is heavily influenced by a collapse in the usage of the '")
                        .append(top.getValue()).append("' discount code.");
                break;
            case "product":
            case "product_id":
                narrative.append("A distinct decline in sales for specific products (notably ")
                        .append(top.getValue()).append(") is the main driver.");
                break;
            default:
                narrative.append("The analysis identified ").append(DimensionCatalog.label(dimension))
                        .append(" ('").append(top.getValue()).append("') as the primary contributing factor.");
                break;
        }

        narrative.append(" This factor shows ").append(changeHeadline(top.getChange()))
                .append(", which correlates strongly with the overall metric drop.");

        if (causes.size() > 1) {
            Finding second = causes.get(1);
            if (second.getImpactScore() > SECONDARY_FACTOR_IMPACT) {
                narrative.append(" Additionally, significant declines were observed in ")
                        .append(DimensionCatalog.label(second.getDimension()))
                        .append(" (").append(second.getValue())
                        .append("), suggesting a potential compounding issue.");
            }
        }
        return narrative.toString();
    }

    /**
     * "Volume dropped -20.0% (100 -> 80)" becomes "volume dropped -20.0%".
     */
    private static String changeHeadline(String change) {
        if (change == null || change.isBlank()) {
            return "a significant change";
        }
        int paren = change.indexOf('(');
        String headline = (paren >= 0 ? change.substring(0, paren) : change).trim();
        if (headline.isEmpty()) {
            return "a significant change";
        }
        return Character.toLowerCase(headline.charAt(0)) + headline.substring(1);
    }
}
