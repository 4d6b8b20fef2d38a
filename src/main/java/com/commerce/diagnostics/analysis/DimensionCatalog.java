package com.commerce.diagnostics.analysis;

import com.commerce.diagnostics.query.QueryTemplate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Known analysis dimensions: which template groups by them and which orders column
 * filters on them when drilling down. Anything not listed is treated as a raw column.
 */
public final class DimensionCatalog {

    private static final Map<String, QueryTemplate> TEMPLATES;
    private static final Map<String, String> FILTER_COLUMNS;

    static {
        Map<String, QueryTemplate> templates = new HashMap<>();
        templates.put("payment_gateway", QueryTemplate.PAYMENT_GATEWAY_DISTRIBUTION);
        templates.put("payment_failure_rate", QueryTemplate.PAYMENT_GATEWAY_PENDING_RATE);
        templates.put("discount_usage", QueryTemplate.DISCOUNT_USAGE_DISTRIBUTION);
        templates.put("discount_code", QueryTemplate.DISCOUNT_CODE_BREAKDOWN);
        templates.put("product", QueryTemplate.PRODUCT_CONVERSION_CONTRIBUTION);
        templates.put("product_id", QueryTemplate.PRODUCT_CONVERSION_CONTRIBUTION);
        templates.put("price_bucket", QueryTemplate.PRODUCT_PRICE_BUCKET_DISTRIBUTION);
        templates.put("aov_bucket", QueryTemplate.AOV_DISTRIBUTION);
        templates.put("customer_type", QueryTemplate.NEW_VS_RETURNING_CUSTOMERS);
        templates.put("time_clustering", QueryTemplate.ORDER_FAILURE_TIME_CLUSTER);
        templates.put("city", QueryTemplate.GEO_DISTRIBUTION);
        templates.put("utm_source", QueryTemplate.UTM_SOURCE_DISTRIBUTION);
        templates.put("utm_campaign", QueryTemplate.UTM_CAMPAIGN_DISTRIBUTION);
        TEMPLATES = Collections.unmodifiableMap(templates);

        Map<String, String> columns = new HashMap<>();
        columns.put("payment_gateway", "payment_gateway_names");
        columns.put("product", "_ITEM1_name");
        columns.put("discount_code", "discount_codes");
        FILTER_COLUMNS = Collections.unmodifiableMap(columns);
    }

    private DimensionCatalog() {
    }

    /**
     * @return the dedicated template, or null if the dimension is grouped generically by its own column
     */
    public static QueryTemplate templateFor(String dimension) {
        return TEMPLATES.get(dimension);
    }

    public static String filterColumnFor(String dimension) {
        return FILTER_COLUMNS.getOrDefault(dimension, dimension);
    }

    /**
     * {@code payment_gateway} becomes {@code Payment Gateway}.
     */
    public static String label(String dimension) {
        if (dimension == null || dimension.isEmpty()) {
            return "";
        }
        String[] words = dimension.replace('_', ' ').split(" ", -1);
        StringBuilder label = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) label.append(' ');
            String word = words[i];
            if (!word.isEmpty()) {
                label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return label.toString();
    }
}
