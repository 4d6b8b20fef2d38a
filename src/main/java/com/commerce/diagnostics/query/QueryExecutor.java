package com.commerce.diagnostics.query;

import com.commerce.diagnostics.config.MetricsConfig;
import com.commerce.diagnostics.model.DimensionFilter;
import com.commerce.diagnostics.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs whitelisted templates against a brand's database.
 *
 * Parameters are bound as {@code [time range..., filter values...]}. Every statement
 * carries the configured JDBC timeout; a timeout surfaces as {@link QueryTimeoutException}.
 */
@Component
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final TenantDataSourceRegistry dataSourceRegistry;
    private final MetricsConfig metricsConfig;

    public QueryExecutor(TenantDataSourceRegistry dataSourceRegistry, MetricsConfig metricsConfig) {
        this.dataSourceRegistry = dataSourceRegistry;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Execute a template by name with explicit positional parameters {@code [start, end]}.
     * For {@link QueryTemplate#DIMENSION_DISTRIBUTION} the group column comes first.
     * Same-hour windows need the {@link TimeWindow} overload.
     *
     * @throws IllegalArgumentException for an unknown template, a wrong parameter count
     *                                  or an unsafe filter column
     */
    public List<Map<String, Object>> execute(Long brandId, String templateName, List<Object> params,
                                             List<DimensionFilter> filters) {
        QueryTemplate template = QueryTemplate.fromName(templateName);
        List<Object> positional = params != null ? params : Collections.emptyList();
        SqlQuery query;
        if (template.isGeneric()) {
            if (positional.isEmpty()) {
                throw new IllegalArgumentException(templateName + " requires a group column parameter");
            }
            query = QueryTemplate.forColumn(String.valueOf(positional.get(0)));
            positional = positional.subList(1, positional.size());
        } else {
            query = template.getQuery();
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException(templateName + " takes exactly a start and an end parameter, got "
                    + positional.size());
        }
        return run(brandId, template.name(), query, positional, false, filters);
    }

    public List<Map<String, Object>> execute(Long brandId, QueryTemplate template, TimeWindow window,
                                             List<DimensionFilter> filters) {
        SqlQuery query = template.getQuery();
        return run(brandId, template.name(), query, windowParams(window, query),
                window.isSameHourAverage(), filters);
    }

    /**
     * Order counts grouped by an arbitrary column.
     */
    public List<Map<String, Object>> executeDistribution(Long brandId, String column, TimeWindow window,
                                                         List<DimensionFilter> filters) {
        SqlQuery query = QueryTemplate.forColumn(column);
        return run(brandId, QueryTemplate.DIMENSION_DISTRIBUTION.name(), query,
                windowParams(window, query), window.isSameHourAverage(), filters);
    }

    private List<Map<String, Object>> run(Long brandId, String templateName, SqlQuery query,
                                          List<Object> timeParams, boolean sameHour,
                                          List<DimensionFilter> filters) {
        List<DimensionFilter> safeFilters = filters != null ? filters : Collections.emptyList();
        String sql = query.toSql(sameHour, safeFilters);

        List<Object> params = new ArrayList<>(timeParams);
        for (DimensionFilter filter : safeFilters) {
            params.add(filter.getValue());
        }

        log.debug("Executing template {} for brand {} with params {}", templateName, brandId, params);
        JdbcTemplate jdbcTemplate = dataSourceRegistry.jdbcTemplate(brandId);
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params.toArray());
            metricsConfig.recordQuery(templateName, "success");
            return rows;
        } catch (org.springframework.dao.QueryTimeoutException e) {
            metricsConfig.recordQuery(templateName, "timeout");
            throw new QueryTimeoutException("Query timeout executing template " + templateName
                    + " for brand " + brandId, e);
        } catch (DataAccessException e) {
            metricsConfig.recordQuery(templateName, "error");
            log.error("Error executing template {} for brand {}: {}", templateName, brandId, e.getMessage());
            throw new DataFetchException("Error executing template " + templateName
                    + " for brand " + brandId + ": " + e.getMessage(), e);
        }
    }

    private static List<Object> windowParams(TimeWindow window, SqlQuery query) {
        List<Object> params = new ArrayList<>(3);
        params.add(Timestamp.from(window.getStart()));
        params.add(Timestamp.from(window.getEnd()));
        if (window.isSameHourAverage() && query.isHourly()) {
            params.add(window.getHourOfDay());
        }
        return params;
    }
}
