package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metric deltas computed during a run. Every funnel metric is reachable both namespaced
 * ({@code funnel.sessions.pct_change}) and through its flat alias ({@code sessions_delta_pct}).
 */
public class DerivedMetrics {

    public static final String FUNNEL_PREFIX = "funnel.";
    public static final String DELTA_SUFFIX = "_delta_pct";

    private final Map<String, FunnelMetric> funnel = new LinkedHashMap<>();
    private final Map<String, Double> aliases = new LinkedHashMap<>();

    public void putFunnelMetric(String metric, FunnelMetric value) {
        funnel.put(metric, value);
        aliases.put(metric + DELTA_SUFFIX, value.getPctChange());
    }

    @JsonProperty("funnel")
    public Map<String, FunnelMetric> getFunnel() {
        return Collections.unmodifiableMap(funnel);
    }

    public FunnelMetric getFunnelMetric(String metric) {
        return funnel.get(metric);
    }

    @JsonAnyGetter
    public Map<String, Double> aliases() {
        return Collections.unmodifiableMap(aliases);
    }

    /**
     * Direct lookup by a flat alias or a namespaced {@code funnel.<metric>.<field>} key.
     *
     * @return the value, or null if the key is unknown
     */
    public Double lookup(String key) {
        if (key == null) return null;
        Double alias = aliases.get(key);
        if (alias != null) {
            return alias;
        }
        if (!key.startsWith(FUNNEL_PREFIX)) {
            return null;
        }
        String[] parts = key.substring(FUNNEL_PREFIX.length()).split("\\.");
        if (parts.length != 2) {
            return null;
        }
        FunnelMetric metric = funnel.get(parts[0]);
        if (metric == null) {
            return null;
        }
        switch (parts[1]) {
            case "current":
                return metric.getCurrent();
            case "baseline":
                return metric.getBaseline();
            case "pct_change":
                return metric.getPctChange();
            default:
                return null;
        }
    }
}
