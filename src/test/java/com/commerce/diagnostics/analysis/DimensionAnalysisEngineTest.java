package com.commerce.diagnostics.analysis;

import com.commerce.diagnostics.config.MetricsConfig;
import com.commerce.diagnostics.model.ComparisonWindows;
import com.commerce.diagnostics.model.DimensionFilter;
import com.commerce.diagnostics.model.Finding;
import com.commerce.diagnostics.model.TimeWindow;
import com.commerce.diagnostics.query.ConcurrentFetcher;
import com.commerce.diagnostics.query.QueryExecutor;
import com.commerce.diagnostics.query.QueryTemplate;
import com.commerce.diagnostics.query.QueryTimeoutException;
import com.commerce.diagnostics.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.commerce.diagnostics.testutil.TestDataFactory.BRAND_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DimensionAnalysisEngineTest {

    private static final TimeWindow CURRENT = TimeWindow.of(
            Instant.parse("2026-01-10T14:00:00Z"), Instant.parse("2026-01-10T15:00:00Z"));
    private static final TimeWindow BASELINE = TimeWindow.of(
            Instant.parse("2026-01-09T14:00:00Z"), Instant.parse("2026-01-09T15:00:00Z"));
    private static final ComparisonWindows WINDOWS =
            ComparisonWindows.builder().current(CURRENT).baseline(BASELINE).build();

    @Mock private QueryExecutor queryExecutor;
    @Mock private MetricsConfig metricsConfig;

    private DimensionAnalysisEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DimensionAnalysisEngine(queryExecutor,
                new ConcurrentFetcher(Runnable::run, TestDataFactory.createEngineConfig()), metricsConfig);
    }

    private static Map<String, Object> row(String keyColumn, Object key, Object... metrics) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(keyColumn, key);
        for (int i = 0; i < metrics.length; i += 2) {
            row.put((String) metrics[i], metrics[i + 1]);
        }
        return row;
    }

    private void rows(QueryTemplate template, TimeWindow window, List<Map<String, Object>> rows) {
        when(queryExecutor.execute(eq(BRAND_ID), eq(template), eq(window), anyList())).thenReturn(rows);
    }

    @Test
    void analyze_twentyPercentVolumeDrop_emitsImpactTwenty() {
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, CURRENT, List.of(row("gateway", "razorpay", "order_count", 80L)));
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, BASELINE, List.of(row("gateway", "razorpay", "order_count", 100L)));

        List<Finding> findings = engine.analyze(BRAND_ID, "payment_gateway", WINDOWS, List.of());

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getDimension()).isEqualTo("payment_gateway");
        assertThat(finding.getValue()).isEqualTo("razorpay");
        assertThat(finding.getImpactScore()).isCloseTo(20.0, within(1e-9));
        assertThat(finding.getChange()).isEqualTo("Volume dropped -20.0% (100 -> 80)");
    }

    @Test
    void analyze_tenPercentVolumeDrop_noFinding() {
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, CURRENT, List.of(row("gateway", "razorpay", "order_count", 90L)));
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, BASELINE, List.of(row("gateway", "razorpay", "order_count", 100L)));

        assertThat(engine.analyze(BRAND_ID, "payment_gateway", WINDOWS, List.of())).isEmpty();
    }

    @Test
    void analyze_rateIncrease_impactIsPointDifference() {
        rows(QueryTemplate.PAYMENT_GATEWAY_PENDING_RATE, CURRENT,
                List.of(row("gateway", "payu", "order_count", 200L, "pending_rate", 8.5)));
        rows(QueryTemplate.PAYMENT_GATEWAY_PENDING_RATE, BASELINE,
                List.of(row("gateway", "payu", "order_count", 210L, "pending_rate", 2.0)));

        List<Finding> findings = engine.analyze(BRAND_ID, "payment_failure_rate", WINDOWS, List.of());

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getImpactScore()).isCloseTo(6.5, within(1e-9));
        assertThat(findings.get(0).getChange()).contains("2.0%").contains("8.5%");
    }

    @Test
    void analyze_smallBaseline_volumeDropIgnored() {
        rows(QueryTemplate.DISCOUNT_CODE_BREAKDOWN, CURRENT, List.of(row("discount_codes", "VIP", "order_count", 2L)));
        rows(QueryTemplate.DISCOUNT_CODE_BREAKDOWN, BASELINE, List.of(row("discount_codes", "VIP", "order_count", 8L)));

        assertThat(engine.analyze(BRAND_ID, "discount_code", WINDOWS, List.of())).isEmpty();
    }

    @Test
    void analyze_groupMissingFromBaseline_ignored() {
        rows(QueryTemplate.DISCOUNT_CODE_BREAKDOWN, CURRENT, List.of(row("discount_codes", "NEW50", "order_count", 5L)));
        rows(QueryTemplate.DISCOUNT_CODE_BREAKDOWN, BASELINE, List.of(row("discount_codes", "OLD20", "order_count", 100L)));

        assertThat(engine.analyze(BRAND_ID, "discount_code", WINDOWS, List.of())).isEmpty();
    }

    @Test
    void analyze_sortedByImpactDescending_tiesKeepRowOrder() {
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, CURRENT, List.of(
                row("gateway", "a", "order_count", 80L),
                row("gateway", "b", "order_count", 50L),
                row("gateway", "c", "order_count", 80L)));
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, BASELINE, List.of(
                row("gateway", "a", "order_count", 100L),
                row("gateway", "b", "order_count", 100L),
                row("gateway", "c", "order_count", 100L)));

        List<Finding> findings = engine.analyze(BRAND_ID, "payment_gateway", WINDOWS, List.of());

        assertThat(findings).extracting(Finding::getValue).containsExactly("b", "a", "c");
    }

    @Test
    void analyze_averagedBaseline_countsPerDay() {
        TimeWindow averaged = TimeWindow.builder()
                .start(Instant.parse("2026-01-07T14:00:00Z"))
                .end(Instant.parse("2026-01-10T14:00:00Z"))
                .sameHourDays(3)
                .hourOfDay(14)
                .build();
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, CURRENT, List.of(row("gateway", "razorpay", "order_count", 80L)));
        rows(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION, averaged, List.of(row("gateway", "razorpay", "order_count", 300L)));

        List<Finding> findings = engine.analyze(BRAND_ID, "payment_gateway",
                ComparisonWindows.builder().current(CURRENT).baseline(averaged).build(), List.of());

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getImpactScore()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void analyze_uncataloguedDimension_groupsByColumn() {
        when(queryExecutor.executeDistribution(eq(BRAND_ID), eq("shipping_country"), any(TimeWindow.class), anyList()))
                .thenReturn(List.of(row("shipping_country", "IN", "order_count", 40L)))
                .thenReturn(List.of(row("shipping_country", "IN", "order_count", 100L)));

        List<Finding> findings = engine.analyze(BRAND_ID, "shipping_country", WINDOWS, null);

        assertThat(findings).extracting(Finding::getValue).containsExactly("IN");
        assertThat(findings.get(0).getImpactScore()).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void analyze_filtersPassedToBothWindows() {
        List<DimensionFilter> filters = List.of(DimensionFilter.builder()
                .column("payment_gateway_names").value("razorpay").build());
        when(queryExecutor.execute(eq(BRAND_ID), eq(QueryTemplate.DISCOUNT_CODE_BREAKDOWN), any(TimeWindow.class),
                eq(filters))).thenReturn(new ArrayList<>());

        engine.analyze(BRAND_ID, "discount_code", WINDOWS, filters);

        verify(queryExecutor, times(2)).execute(eq(BRAND_ID), eq(QueryTemplate.DISCOUNT_CODE_BREAKDOWN),
                any(TimeWindow.class), eq(filters));
    }

    @Test
    void analyze_fetchFailure_degradesToNoFindings() {
        when(queryExecutor.execute(eq(BRAND_ID), eq(QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION), any(TimeWindow.class),
                anyList())).thenThrow(new QueryTimeoutException("Query timeout after 5000ms"));

        List<Finding> findings = engine.analyze(BRAND_ID, "payment_gateway", WINDOWS, List.of());

        assertThat(findings).isEmpty();
        verify(metricsConfig).recordDimensionFailure("payment_gateway");
    }

    @Test
    void normalize_nullGroupValueSkipped() {
        List<DimensionAnalysisEngine.Segment> segments = DimensionAnalysisEngine.normalize(List.of(
                row("utm_source", null, "order_count", 12L),
                row("utm_source", "google", "order_count", 30L)), 1);

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).value).isEqualTo("google");
        assertThat(segments.get(0).count).isEqualTo(30.0);
        assertThat(segments.get(0).rate).isNull();
    }
}
