package com.commerce.diagnostics.query;

/**
 * Whitelisted read-only queries against a brand's analytics schema.
 * Only these can be issued; each takes the time range as its first two parameters.
 */
public enum QueryTemplate {

    OVERALL_SUMMARY(SqlQuery.builder()
            .select("SUM(total_sessions) AS sessions",
                    "SUM(total_orders) AS orders",
                    "SUM(total_sales) AS gmv",
                    "(SUM(total_orders) / NULLIF(SUM(total_sessions), 0)) * 100 AS cvr")
            .from("overall_summary")
            // one row per day
            .timeColumn("date")
            .hourly(false)
            .build()),

    PAYMENT_GATEWAY_DISTRIBUTION(SqlQuery.builder()
            .select("payment_gateway_names AS gateway", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("payment_gateway_names")
            .orderBy("order_count DESC")
            .build()),

    PAYMENT_GATEWAY_PENDING_RATE(SqlQuery.builder()
            .select("payment_gateway_names AS gateway",
                    "COUNT(*) AS order_count",
                    "(SUM(financial_status = 'pending') / NULLIF(COUNT(*), 0)) * 100 AS pending_rate")
            .from("shopify_orders")
            .groupBy("payment_gateway_names")
            .build()),

    DISCOUNT_USAGE_DISTRIBUTION(SqlQuery.builder()
            .select("IF(discount_codes IS NULL OR discount_codes = '', 'no_discount', 'discounted') AS discount_flag",
                    "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("discount_flag")
            .build()),

    DISCOUNT_CODE_BREAKDOWN(SqlQuery.builder()
            .select("discount_codes", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .where("discount_codes IS NOT NULL")
            .groupBy("discount_codes")
            .orderBy("order_count DESC")
            .build()),

    PRODUCT_CONVERSION_CONTRIBUTION(SqlQuery.builder()
            .select("_ITEM1_name AS product_name", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("_ITEM1_name")
            .orderBy("order_count DESC")
            .limit(20)
            .build()),

    PRODUCT_PRICE_BUCKET_DISTRIBUTION(SqlQuery.builder()
            .select("CASE WHEN line_item_price < 500 THEN '<500'"
                            + " WHEN line_item_price BETWEEN 500 AND 1000 THEN '500-1000'"
                            + " WHEN line_item_price BETWEEN 1000 AND 3000 THEN '1000-3000'"
                            + " ELSE '>3000' END AS price_bucket",
                    "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("price_bucket")
            .orderBy("order_count DESC")
            .build()),

    AOV_DISTRIBUTION(SqlQuery.builder()
            .select("CASE WHEN total_price < 500 THEN '<500'"
                            + " WHEN total_price BETWEEN 500 AND 1000 THEN '500-1000'"
                            + " WHEN total_price BETWEEN 1000 AND 3000 THEN '1000-3000'"
                            + " ELSE '>3000' END AS aov_bucket",
                    "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("aov_bucket")
            .build()),

    NEW_VS_RETURNING_CUSTOMERS(SqlQuery.builder()
            .select("CASE WHEN customer_id IS NULL THEN 'guest' ELSE 'returning' END AS customer_type",
                    "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("customer_type")
            .build()),

    ORDER_FAILURE_TIME_CLUSTER(SqlQuery.builder()
            .select("DATE_FORMAT(created_at, '%Y-%m-%d %H:00:00') AS hour", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .where("financial_status = 'pending'")
            .groupBy("1")
            .orderBy("1")
            .build()),

    GEO_DISTRIBUTION(SqlQuery.builder()
            .select("shipping_city AS city", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("shipping_city")
            .orderBy("order_count DESC")
            .limit(50)
            .build()),

    UTM_SOURCE_DISTRIBUTION(SqlQuery.builder()
            .select("utm_source", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("utm_source")
            .orderBy("order_count DESC")
            .build()),

    UTM_CAMPAIGN_DISTRIBUTION(SqlQuery.builder()
            .select("utm_campaign", "COUNT(*) AS order_count")
            .from("shopify_orders")
            .groupBy("utm_campaign")
            .orderBy("order_count DESC")
            .limit(50)
            .build()),

    // grouped by a caller-supplied column, see forColumn
    DIMENSION_DISTRIBUTION(null);

    private final SqlQuery query;

    QueryTemplate(SqlQuery query) {
        this.query = query;
    }

    public boolean isGeneric() {
        return query == null;
    }

    public SqlQuery getQuery() {
        if (query == null) {
            throw new IllegalStateException(name() + " needs a group column, use forColumn");
        }
        return query;
    }

    /**
     * Order distribution grouped by an arbitrary column of the orders table.
     *
     * @throws IllegalArgumentException if the column is not a plain identifier
     */
    public static SqlQuery forColumn(String column) {
        if (!SqlQuery.isSafeIdentifier(column)) {
            throw new IllegalArgumentException("Invalid dimension column: " + column);
        }
        return SqlQuery.builder()
                .select(column, "COUNT(*) AS order_count")
                .from("shopify_orders")
                .where(column + " IS NOT NULL")
                .groupBy(column)
                .orderBy("order_count DESC")
                .limit(50)
                .build();
    }

    /**
     * @throws IllegalArgumentException if the name is not a whitelisted template
     */
    public static QueryTemplate fromName(String name) {
        if (name != null) {
            for (QueryTemplate template : values()) {
                if (template.name().equals(name)) {
                    return template;
                }
            }
        }
        throw new IllegalArgumentException("Query template \"" + name + "\" not found or not allowed.");
    }
}
