package com.commerce.diagnostics.query;

import com.commerce.diagnostics.model.DimensionFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A read-only grouped query assembled from clauses rather than text.
 *
 * The WHERE clause always starts with the half-open time range on {@link #getTimeColumn()}.
 * Optional predicates follow in a fixed order, so positional parameters line up as
 * {@code [start, end, (hour), filter values...]}:
 * <pre>
 * SELECT ... FROM t
 * WHERE time &gt;= ? AND time &lt; ? [AND HOUR(time) = ?] [AND fixed predicates] [AND col = ?]...
 * [GROUP BY ...] [ORDER BY ...] [LIMIT n]
 * </pre>
 */
public final class SqlQuery {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z0-9_]+$");

    private final List<String> select;
    private final String from;
    private final String timeColumn;
    private final boolean hourly;
    private final List<String> predicates;
    private final String groupBy;
    private final String orderBy;
    private final Integer limit;

    private SqlQuery(Builder builder) {
        this.select = Collections.unmodifiableList(new ArrayList<>(builder.select));
        this.from = builder.from;
        this.timeColumn = builder.timeColumn;
        this.hourly = builder.hourly;
        this.predicates = Collections.unmodifiableList(new ArrayList<>(builder.predicates));
        this.groupBy = builder.groupBy;
        this.orderBy = builder.orderBy;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isSafeIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    /**
     * Whether the time column carries an hour of day. Day-level tables ignore same-hour restriction.
     */
    public boolean isHourly() {
        return hourly;
    }

    /**
     * Render the statement.
     *
     * @param sameHour whether to restrict rows to one hour of the day (one extra parameter,
     *                 only on hourly tables)
     * @param filters  equality filters, one parameter each, in order
     * @throws IllegalArgumentException if a filter column is not a plain identifier
     */
    public String toSql(boolean sameHour, List<DimensionFilter> filters) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", select))
                .append(" FROM ").append(from)
                .append(" WHERE ").append(timeColumn).append(" >= ? AND ").append(timeColumn).append(" < ?");

        if (sameHour && hourly) {
            sql.append(" AND HOUR(").append(timeColumn).append(") = ?");
        }
        for (String predicate : predicates) {
            sql.append(" AND ").append(predicate);
        }
        if (filters != null) {
            for (DimensionFilter filter : filters) {
                if (!isSafeIdentifier(filter.getColumn())) {
                    throw new IllegalArgumentException("Invalid filter column: " + filter.getColumn());
                }
                sql.append(" AND ").append(filter.getColumn()).append(" = ?");
            }
        }
        if (groupBy != null) {
            sql.append(" GROUP BY ").append(groupBy);
        }
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSql(false, Collections.emptyList());
    }

    public static final class Builder {
        private final List<String> select = new ArrayList<>();
        private String from;
        private String timeColumn = "created_at";
        private boolean hourly = true;
        private final List<String> predicates = new ArrayList<>();
        private String groupBy;
        private String orderBy;
        private Integer limit;

        public Builder select(String... expressions) {
            Collections.addAll(select, expressions);
            return this;
        }

        public Builder from(String table) {
            this.from = table;
            return this;
        }

        public Builder timeColumn(String column) {
            this.timeColumn = column;
            return this;
        }

        public Builder hourly(boolean hourly) {
            this.hourly = hourly;
            return this;
        }

        /**
         * A fixed predicate without parameters.
         */
        public Builder where(String predicate) {
            predicates.add(predicate);
            return this;
        }

        public Builder groupBy(String expression) {
            this.groupBy = expression;
            return this;
        }

        public Builder orderBy(String expression) {
            this.orderBy = expression;
            return this;
        }

        public Builder limit(int rows) {
            this.limit = rows;
            return this;
        }

        public SqlQuery build() {
            if (select.isEmpty() || from == null) {
                throw new IllegalStateException("A query needs a select list and a table");
            }
            return new SqlQuery(this);
        }
    }
}
