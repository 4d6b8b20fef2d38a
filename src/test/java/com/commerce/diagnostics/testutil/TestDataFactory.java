package com.commerce.diagnostics.testutil;

import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared builders for workflows, alerts and run contexts used across test classes.
 */
public final class TestDataFactory {

    public static final long BRAND_ID = 42L;
    public static final String CLOSED_WINDOW = "2026-01-10T14:00:00Z|2026-01-10T15:00:00Z";

    private TestDataFactory() {}

    public static Alert createAlert(double dropPct) {
        return Alert.builder()
                .metric("cvr")
                .dropPct(dropPct)
                .currentWindow(CLOSED_WINDOW)
                .baselineWindow("avg_prev_3_days_same_hour")
                .build();
    }

    public static Brand createBrand() {
        return Brand.builder().brandId(BRAND_ID).build();
    }

    public static EngineConfig createEngineConfig() {
        return new EngineConfig();
    }

    public static Workflow createWorkflow(String id, WorkflowNode... nodes) {
        return Workflow.builder()
                .id(id)
                .brandId(BRAND_ID)
                .version(1)
                .nodes(new ArrayList<>(Arrays.asList(nodes)))
                .build();
    }

    public static ExecutionContext createContext(Alert alert) {
        return ExecutionContext.create(alert, createBrand(), createWorkflow("test_flow"));
    }

    public static WorkflowNode validation(String id, String next, Double minDropPct) {
        return WorkflowNode.builder().id(id).type("validation").next(next).minDropPct(minDropPct).build();
    }

    public static WorkflowNode metricCompare(String id, String next) {
        return WorkflowNode.builder().id(id).type("metric_compare").next(next).build();
    }

    public static WorkflowNode branch(String id, DefaultRoute defaultNext, BranchRule... rules) {
        return WorkflowNode.builder().id(id).type("branch")
                .rules(new ArrayList<>(Arrays.asList(rules)))
                .defaultNext(defaultNext)
                .build();
    }

    public static BranchRule rule(String expression, String next) {
        return BranchRule.builder().condition(BranchCondition.expression(expression)).next(next).build();
    }

    public static WorkflowNode breakdown(String id, String next, String... dimensions) {
        return WorkflowNode.builder().id(id).type("recursive_dimension_breakdown").next(next)
                .dimensions(List.of(dimensions)).build();
    }

    public static WorkflowNode drillDown(String id, String next, String dimension) {
        return WorkflowNode.builder().id(id).type("drill_down").next(next).dimension(dimension).build();
    }

    public static WorkflowNode composite(String id, String... steps) {
        return WorkflowNode.builder().id(id).type("composite").steps(List.of(steps)).build();
    }

    public static WorkflowNode confidence(String id, String next) {
        return WorkflowNode.builder().id(id).type("confidence").next(next).build();
    }

    public static WorkflowNode insight(String id) {
        return WorkflowNode.builder().id(id).type("insight").build();
    }

    public static WorkflowNode suppression(String id, String reason) {
        return WorkflowNode.builder().id(id).type("suppression").reason(reason).build();
    }

    public static WorkflowNode defer(String id, String reason) {
        return WorkflowNode.builder().id(id).type("defer").reason(reason).build();
    }

    public static Finding createFinding(String dimension, String value, double impact) {
        return Finding.builder()
                .dimension(dimension)
                .value(value)
                .change(String.format("Volume dropped -%.1f%% (100 -> %d)", impact, 100 - Math.round(impact)))
                .impactScore(impact)
                .build();
    }

    public static FunnelMetric createFunnelMetric(double current, double baseline) {
        double pct = baseline == 0 ? 0 : (current - baseline) / baseline * 100.0;
        return FunnelMetric.builder().current(current).baseline(baseline).pctChange(pct).build();
    }
}
