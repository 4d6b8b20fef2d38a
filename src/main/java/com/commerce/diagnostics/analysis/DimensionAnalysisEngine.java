package com.commerce.diagnostics.analysis;

import com.commerce.diagnostics.config.MetricsConfig;
import com.commerce.diagnostics.model.ComparisonWindows;
import com.commerce.diagnostics.model.DimensionFilter;
import com.commerce.diagnostics.model.Finding;
import com.commerce.diagnostics.model.TimeWindow;
import com.commerce.diagnostics.query.ConcurrentFetcher;
import com.commerce.diagnostics.query.QueryExecutor;
import com.commerce.diagnostics.query.QueryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Compares a dimension's grouped order distribution between the current and baseline
 * windows and scores each segment that exists in both.
 *
 * Scoring, first match wins:
 * <ol>
 *   <li>both rows carry a rate and the current rate is more than 5 points higher:
 *       impact = the point difference</li>
 *   <li>baseline count above 10 and volume change below -15%: impact = |change %|</li>
 * </ol>
 * Segments only present in the current window are ignored.
 */
@Component
public class DimensionAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(DimensionAnalysisEngine.class);

    static final double RATE_INCREASE_POINTS = 5.0;
    static final double MIN_BASELINE_COUNT = 10.0;
    static final double VOLUME_DROP_PCT = -15.0;

    private static final Set<String> METRIC_COLUMNS = Set.of("count", "order_count", "percentage", "pending_rate");

    private final QueryExecutor queryExecutor;
    private final ConcurrentFetcher concurrentFetcher;
    private final MetricsConfig metricsConfig;

    public DimensionAnalysisEngine(QueryExecutor queryExecutor, ConcurrentFetcher concurrentFetcher,
                                   MetricsConfig metricsConfig) {
        this.queryExecutor = queryExecutor;
        this.concurrentFetcher = concurrentFetcher;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Analyze one dimension. Never throws: a failed fetch or comparison yields no findings.
     *
     * @param brandId   tenant to query
     * @param dimension dimension name, a catalog entry or a raw orders column
     * @param windows   current and baseline windows
     * @param filters   equality filters applied to both windows
     * @return findings ordered by descending impact
     */
    public List<Finding> analyze(Long brandId, String dimension, ComparisonWindows windows,
                                 List<DimensionFilter> filters) {
        log.info("Analyzing dimension {} for brand {} with filters {}", dimension, brandId, filters);
        List<DimensionFilter> safeFilters = filters != null ? filters : Collections.emptyList();

        try {
            List<Supplier<List<Map<String, Object>>>> fetches = List.of(
                    () -> fetch(brandId, dimension, windows.getCurrent(), safeFilters),
                    () -> fetch(brandId, dimension, windows.getBaseline(), safeFilters));
            List<List<Map<String, Object>>> rows = concurrentFetcher.fetchAll(fetches);

            List<Segment> current = normalize(rows.get(0), windows.getCurrent().getSampleCount());
            Map<String, Segment> baseline = new LinkedHashMap<>();
            for (Segment segment : normalize(rows.get(1), windows.getBaseline().getSampleCount())) {
                baseline.putIfAbsent(segment.value, segment);
            }

            List<Finding> findings = new ArrayList<>();
            for (Segment cur : current) {
                Segment base = baseline.get(cur.value);
                if (base == null) {
                    continue;
                }
                Finding finding = score(dimension, cur, base);
                if (finding != null) {
                    findings.add(finding);
                }
            }

            findings.sort(Comparator.comparingDouble(Finding::getImpactScore).reversed());
            log.debug("Dimension {} produced {} findings", dimension, findings.size());
            return findings;
        } catch (Exception e) {
            log.error("Error analyzing dimension {} for brand {}: {}", dimension, brandId, e.getMessage(), e);
            metricsConfig.recordDimensionFailure(dimension);
            return new ArrayList<>();
        }
    }

    private List<Map<String, Object>> fetch(Long brandId, String dimension, TimeWindow window,
                                            List<DimensionFilter> filters) {
        QueryTemplate template = DimensionCatalog.templateFor(dimension);
        if (template == null) {
            return queryExecutor.executeDistribution(brandId, dimension, window, filters);
        }
        return queryExecutor.execute(brandId, template, window, filters);
    }

    /**
     * Reduce raw rows to {value, count, rate}. The group key is the first column that is not
     * a known metric; counts are divided by the window's sample count.
     */
    static List<Segment> normalize(List<Map<String, Object>> rows, int sampleCount) {
        List<Segment> segments = new ArrayList<>();
        if (rows == null) {
            return segments;
        }
        for (Map<String, Object> row : rows) {
            String keyColumn = null;
            for (String column : row.keySet()) {
                if (!METRIC_COLUMNS.contains(column.toLowerCase(Locale.ROOT))) {
                    keyColumn = column;
                    break;
                }
            }
            Object key = keyColumn != null ? row.get(keyColumn) : null;
            if (key == null) {
                // rows without a group value cannot be matched across windows
                continue;
            }

            Object rawCount = row.get("count") != null ? row.get("count") : row.get("order_count");
            double count = toDouble(rawCount) / Math.max(sampleCount, 1);
            Double rate = row.containsKey("pending_rate") ? toDouble(row.get("pending_rate")) : null;
            segments.add(new Segment(String.valueOf(key), count, rate));
        }
        return segments;
    }

    static Finding score(String dimension, Segment current, Segment baseline) {
        if (current.rate != null && baseline.rate != null) {
            double diff = current.rate - baseline.rate;
            if (diff > RATE_INCREASE_POINTS) {
                return Finding.builder()
                        .dimension(dimension)
                        .value(current.value)
                        .change(String.format(Locale.ROOT, "Rate increased from %.1f%% to %.1f%%",
                                baseline.rate, current.rate))
                        .impactScore(diff)
                        .build();
            }
        }

        if (baseline.count > MIN_BASELINE_COUNT) {
            double pctChange = (current.count - baseline.count) / baseline.count * 100.0;
            if (pctChange < VOLUME_DROP_PCT) {
                return Finding.builder()
                        .dimension(dimension)
                        .value(current.value)
                        .change(String.format(Locale.ROOT, "Volume dropped %.1f%% (%s -> %s)",
                                pctChange, formatCount(baseline.count), formatCount(current.count)))
                        .impactScore(Math.abs(pctChange))
                        .build();
            }
        }
        return null;
    }

    private static String formatCount(double count) {
        if (count == Math.rint(count)) {
            return String.valueOf((long) count);
        }
        return String.format(Locale.ROOT, "%.1f", count);
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

    static final class Segment {
        final String value;
        final double count;
        final Double rate;

        Segment(String value, double count, Double rate) {
            this.value = value;
            this.count = count;
            this.rate = rate;
        }
    }
}
