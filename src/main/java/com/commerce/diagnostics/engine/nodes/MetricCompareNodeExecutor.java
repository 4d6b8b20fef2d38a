package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WindowResolver;
import com.commerce.diagnostics.model.ComparisonWindows;
import com.commerce.diagnostics.model.FunnelMetric;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.TimeWindow;
import com.commerce.diagnostics.model.WorkflowNode;
import com.commerce.diagnostics.query.ConcurrentFetcher;
import com.commerce.diagnostics.query.QueryExecutor;
import com.commerce.diagnostics.query.QueryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Computes current vs baseline funnel metrics (sessions, orders, conversion rate) from the
 * overall summary and records them in the derived metrics, namespaced and as
 * {@code <metric>_delta_pct} aliases.
 *
 * Volume metrics of a same-hour averaged baseline are divided by its day count; conversion
 * rate is a ratio and is taken as-is. A zero baseline gives a zero percent change.
 */
@Component
public class MetricCompareNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(MetricCompareNodeExecutor.class);

    static final List<String> DEFAULT_METRICS = List.of("sessions", "orders", "cvr");
    private static final Set<String> RATIO_METRICS = Set.of("cvr");

    private final WindowResolver windowResolver;
    private final QueryExecutor queryExecutor;
    private final ConcurrentFetcher concurrentFetcher;

    public MetricCompareNodeExecutor(WindowResolver windowResolver, QueryExecutor queryExecutor,
                                     ConcurrentFetcher concurrentFetcher) {
        this.windowResolver = windowResolver;
        this.queryExecutor = queryExecutor;
        this.concurrentFetcher = concurrentFetcher;
    }

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.METRIC_COMPARE;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        Long brandId = context.getBrand().getBrandId();
        ComparisonWindows windows = windowResolver.resolveComparison(context.getAlert());
        List<String> metrics = node.getMetrics() != null && !node.getMetrics().isEmpty()
                ? node.getMetrics() : DEFAULT_METRICS;

        log.info("Comparing funnel {} for brand {}: current {} - {}, baseline {} - {}", metrics, brandId,
                windows.getCurrent().getStart(), windows.getCurrent().getEnd(),
                windows.getBaseline().getStart(), windows.getBaseline().getEnd());

        List<Supplier<List<Map<String, Object>>>> fetches = List.of(
                () -> summary(brandId, windows.getCurrent()),
                () -> summary(brandId, windows.getBaseline()));
        List<List<Map<String, Object>>> results = concurrentFetcher.fetchAll(fetches);

        Map<String, Object> current = firstRow(results.get(0));
        Map<String, Object> baseline = firstRow(results.get(1));

        for (String metric : metrics) {
            double currentValue = perSample(metric, toDouble(current.get(metric)), windows.getCurrent());
            double baselineValue = perSample(metric, toDouble(baseline.get(metric)), windows.getBaseline());
            double pctChange = baselineValue == 0.0 ? 0.0 : (currentValue - baselineValue) / baselineValue * 100.0;

            context.getDerived().putFunnelMetric(metric, FunnelMetric.builder()
                    .current(currentValue)
                    .baseline(baselineValue)
                    .pctChange(pctChange)
                    .build());
            log.debug("Funnel {}: current={} baseline={} change={}%", metric, currentValue, baselineValue, pctChange);
        }

        return NodeOutcome.success(node.getNext());
    }

    private List<Map<String, Object>> summary(Long brandId, TimeWindow window) {
        return queryExecutor.execute(brandId, QueryTemplate.OVERALL_SUMMARY, window, Collections.emptyList());
    }

    private static double perSample(String metric, double value, TimeWindow window) {
        if (RATIO_METRICS.contains(metric)) {
            return value;
        }
        return value / window.getSampleCount();
    }

    private static Map<String, Object> firstRow(List<Map<String, Object>> rows) {
        return rows == null || rows.isEmpty() ? Collections.emptyMap() : rows.get(0);
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }
}
