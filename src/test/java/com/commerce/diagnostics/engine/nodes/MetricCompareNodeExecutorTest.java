package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WindowResolver;
import com.commerce.diagnostics.model.FunnelMetric;
import com.commerce.diagnostics.model.TimeWindow;
import com.commerce.diagnostics.model.WorkflowNode;
import com.commerce.diagnostics.query.ConcurrentFetcher;
import com.commerce.diagnostics.query.DataFetchException;
import com.commerce.diagnostics.query.QueryExecutor;
import com.commerce.diagnostics.query.QueryTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.commerce.diagnostics.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricCompareNodeExecutorTest {

    @Mock private QueryExecutor queryExecutor;

    private MetricCompareNodeExecutor executor;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        ConcurrentFetcher fetcher = new ConcurrentFetcher(Runnable::run, createEngineConfig());
        executor = new MetricCompareNodeExecutor(new WindowResolver(), queryExecutor, fetcher);
        context = createContext(createAlert(25.0));
    }

    private void summaries(List<Map<String, Object>> current, List<Map<String, Object>> baseline) {
        when(queryExecutor.execute(eq(BRAND_ID), eq(QueryTemplate.OVERALL_SUMMARY), any(TimeWindow.class), anyList()))
                .thenAnswer(inv -> ((TimeWindow) inv.getArgument(2)).isSameHourAverage() ? baseline : current);
    }

    @Test
    void execute_averagedBaseline_volumesDividedRatesNot() {
        summaries(
                List.of(Map.of("sessions", new BigDecimal("1000"), "orders", new BigDecimal("20"),
                        "cvr", new BigDecimal("2.0"))),
                List.of(Map.of("sessions", new BigDecimal("3000"), "orders", new BigDecimal("90"),
                        "cvr", new BigDecimal("3.0"))));

        NodeOutcome outcome = executor.execute(metricCompare("compare", "route"), context);

        assertThat(outcome.getNext()).isEqualTo("route");
        FunnelMetric sessions = context.getDerived().getFunnelMetric("sessions");
        assertThat(sessions.getBaseline()).isEqualTo(1000.0);
        assertThat(sessions.getPctChange()).isEqualTo(0.0);
        FunnelMetric orders = context.getDerived().getFunnelMetric("orders");
        assertThat(orders.getBaseline()).isEqualTo(30.0);
        assertThat(orders.getPctChange()).isCloseTo(-33.33, within(0.01));
        assertThat(context.getDerived().getFunnelMetric("cvr").getBaseline()).isEqualTo(3.0);
        assertThat(context.getDerived().lookup("orders_delta_pct")).isCloseTo(-33.33, within(0.01));
        assertThat(context.getDerived().lookup("funnel.cvr.current")).isEqualTo(2.0);
    }

    @Test
    void execute_zeroBaseline_zeroChange() {
        summaries(List.of(Map.of("sessions", 500L, "orders", 10L, "cvr", 2.0)), List.of());

        executor.execute(metricCompare("compare", "route"), context);

        assertThat(context.getDerived().lookup("sessions_delta_pct")).isEqualTo(0.0);
        assertThat(context.getDerived().getFunnelMetric("orders").getCurrent()).isEqualTo(10.0);
    }

    @Test
    void execute_declaredMetricsOnly() {
        summaries(List.of(Map.of("sessions", 500L, "orders", 10L)), List.of(Map.of("sessions", 600L, "orders", 30L)));

        WorkflowNode node = metricCompare("compare", "route");
        node.setMetrics(List.of("orders"));

        executor.execute(node, context);

        assertThat(context.getDerived().getFunnel()).containsOnlyKeys("orders");
    }

    @Test
    void execute_fetchFailure_propagates() {
        when(queryExecutor.execute(eq(BRAND_ID), eq(QueryTemplate.OVERALL_SUMMARY), any(TimeWindow.class), anyList()))
                .thenThrow(new DataFetchException("connection refused"));

        assertThatThrownBy(() -> executor.execute(metricCompare("compare", "route"), context))
                .isInstanceOf(DataFetchException.class);
    }
}
