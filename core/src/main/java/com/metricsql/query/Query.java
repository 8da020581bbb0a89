package com.metricsql.query;

import com.metricsql.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of one analytical request against a metrics view.
 *
 * <p>Instances are immutable. Rewrite passes derive modified copies through
 * {@link #toBuilder()}, so a query handed to the compiler is never changed.
 *
 * <p>Example:
 * <pre>
 *   Query query = Query.builder("WebsiteAnalytics")
 *       .dimension(Dimension.of("country"))
 *       .measure(Measure.of("total_views"))
 *       .timeRange(TimeRange.lastDuration("P1D"))
 *       .sort(Sort.desc("total_views"))
 *       .limit(10L)
 *       .build();
 * </pre>
 */
public final class Query {

    private final String metricsView;
    private final List<Dimension> dimensions;
    private final List<Measure> measures;
    private final Expression where;
    private final Expression having;
    private final TimeRange timeRange;
    private final TimeRange comparisonTimeRange;
    private final List<Sort> sort;
    private final Long limit;
    private final Long offset;
    private final boolean rows;
    private final List<String> pivotOn;
    private final String timeZone;
    private final boolean useDisplayNames;

    private Query(Builder b) {
        this.metricsView = Objects.requireNonNull(b.metricsView, "metricsView must not be null");
        this.dimensions = Collections.unmodifiableList(new ArrayList<>(b.dimensions));
        this.measures = Collections.unmodifiableList(new ArrayList<>(b.measures));
        this.where = b.where;
        this.having = b.having;
        this.timeRange = b.timeRange;
        this.comparisonTimeRange = b.comparisonTimeRange;
        this.sort = Collections.unmodifiableList(new ArrayList<>(b.sort));
        this.limit = b.limit;
        this.offset = b.offset;
        this.rows = b.rows;
        this.pivotOn = Collections.unmodifiableList(new ArrayList<>(b.pivotOn));
        this.timeZone = b.timeZone;
        this.useDisplayNames = b.useDisplayNames;
    }

    public static Builder builder(String metricsView) {
        return new Builder(metricsView);
    }

    /**
     * Returns a builder pre-populated with this query's fields.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder(metricsView);
        b.dimensions.addAll(dimensions);
        b.measures.addAll(measures);
        b.where = where;
        b.having = having;
        b.timeRange = timeRange;
        b.comparisonTimeRange = comparisonTimeRange;
        b.sort.addAll(sort);
        b.limit = limit;
        b.offset = offset;
        b.rows = rows;
        b.pivotOn.addAll(pivotOn);
        b.timeZone = timeZone;
        b.useDisplayNames = useDisplayNames;
        return b;
    }

    public String metricsView() {
        return metricsView;
    }

    public List<Dimension> dimensions() {
        return dimensions;
    }

    public List<Measure> measures() {
        return measures;
    }

    public Expression where() {
        return where;
    }

    public Expression having() {
        return having;
    }

    public TimeRange timeRange() {
        return timeRange;
    }

    public TimeRange comparisonTimeRange() {
        return comparisonTimeRange;
    }

    public List<Sort> sort() {
        return sort;
    }

    public Long limit() {
        return limit;
    }

    public Long offset() {
        return offset;
    }

    public boolean rows() {
        return rows;
    }

    public List<String> pivotOn() {
        return pivotOn;
    }

    /**
     * Returns the IANA time zone id, or null for UTC.
     *
     * @return the time zone id
     */
    public String timeZone() {
        return timeZone;
    }

    public boolean useDisplayNames() {
        return useDisplayNames;
    }

    /**
     * Returns whether any measure asks for a period comparison.
     *
     * @return true if a comparison compute is requested
     */
    public boolean hasComparisonMeasures() {
        for (Measure m : measures) {
            if (m.isComputed() && m.compute().isComparison()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Query that)) return false;
        return rows == that.rows &&
               useDisplayNames == that.useDisplayNames &&
               metricsView.equals(that.metricsView) &&
               dimensions.equals(that.dimensions) &&
               measures.equals(that.measures) &&
               Objects.equals(where, that.where) &&
               Objects.equals(having, that.having) &&
               Objects.equals(timeRange, that.timeRange) &&
               Objects.equals(comparisonTimeRange, that.comparisonTimeRange) &&
               sort.equals(that.sort) &&
               Objects.equals(limit, that.limit) &&
               Objects.equals(offset, that.offset) &&
               pivotOn.equals(that.pivotOn) &&
               Objects.equals(timeZone, that.timeZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricsView, dimensions, measures, where, having, timeRange,
            comparisonTimeRange, sort, limit, offset, rows, pivotOn, timeZone, useDisplayNames);
    }

    @Override
    public String toString() {
        return String.format("Query(view=%s, dimensions=%s, measures=%s, limit=%s)",
            metricsView, dimensions, measures, limit);
    }

    /**
     * Builder for {@link Query}.
     */
    public static final class Builder {
        private final String metricsView;
        private final List<Dimension> dimensions = new ArrayList<>();
        private final List<Measure> measures = new ArrayList<>();
        private Expression where;
        private Expression having;
        private TimeRange timeRange;
        private TimeRange comparisonTimeRange;
        private final List<Sort> sort = new ArrayList<>();
        private Long limit;
        private Long offset;
        private boolean rows;
        private final List<String> pivotOn = new ArrayList<>();
        private String timeZone;
        private boolean useDisplayNames;

        private Builder(String metricsView) {
            this.metricsView = metricsView;
        }

        public Builder dimension(Dimension dimension) {
            dimensions.add(Objects.requireNonNull(dimension, "dimension must not be null"));
            return this;
        }

        public Builder dimensions(List<Dimension> replacement) {
            dimensions.clear();
            dimensions.addAll(replacement);
            return this;
        }

        public Builder measure(Measure measure) {
            measures.add(Objects.requireNonNull(measure, "measure must not be null"));
            return this;
        }

        public Builder measures(List<Measure> replacement) {
            measures.clear();
            measures.addAll(replacement);
            return this;
        }

        public Builder where(Expression expression) {
            this.where = expression;
            return this;
        }

        public Builder having(Expression expression) {
            this.having = expression;
            return this;
        }

        public Builder timeRange(TimeRange range) {
            this.timeRange = range;
            return this;
        }

        public Builder comparisonTimeRange(TimeRange range) {
            this.comparisonTimeRange = range;
            return this;
        }

        public Builder sort(Sort s) {
            sort.add(Objects.requireNonNull(s, "sort must not be null"));
            return this;
        }

        public Builder clearSort() {
            sort.clear();
            return this;
        }

        public Builder limit(Long value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Long value) {
            this.offset = value;
            return this;
        }

        public Builder rows(boolean value) {
            this.rows = value;
            return this;
        }

        public Builder pivotOn(String field) {
            pivotOn.add(field);
            return this;
        }

        public Builder timeZone(String zoneId) {
            this.timeZone = zoneId;
            return this;
        }

        public Builder useDisplayNames(boolean value) {
            this.useDisplayNames = value;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
