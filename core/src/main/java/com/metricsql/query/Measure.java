package com.metricsql.query;

import java.util.Objects;

/**
 * A requested measure.
 *
 * <p>Without a compute, {@code name} references a measure of the metrics view.
 * With a compute, {@code name} is the output name of a measure derived at query
 * time: a count, a period comparison, or a percent of the grand total.
 */
public record Measure(String name, Compute compute) {

    public Measure {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Measure of(String name) {
        return new Measure(name, null);
    }

    public static Measure computed(String name, Compute compute) {
        return new Measure(name, Objects.requireNonNull(compute, "compute must not be null"));
    }

    public boolean isComputed() {
        return compute != null;
    }

    /**
     * Returns a copy of this measure with a different compute.
     *
     * @param newCompute the replacement compute
     * @return the new measure
     */
    public Measure withCompute(Compute newCompute) {
        return new Measure(name, newCompute);
    }

    /**
     * Query-time computation attached to a measure.
     *
     * @param kind what is computed
     * @param target the measure (or, for COUNT_DISTINCT, the dimension) it applies to; null for COUNT
     * @param total the grand total captured for PERCENT_OF_TOTAL, null until captured
     */
    public record Compute(Kind kind, String target, Number total) {

        public Compute {
            Objects.requireNonNull(kind, "kind must not be null");
            if (kind != Kind.COUNT && target == null) {
                throw new IllegalArgumentException(kind + " requires a target");
            }
        }

        public static Compute count() {
            return new Compute(Kind.COUNT, null, null);
        }

        public static Compute countDistinct(String dimension) {
            return new Compute(Kind.COUNT_DISTINCT, dimension, null);
        }

        public static Compute comparisonValue(String measure) {
            return new Compute(Kind.COMPARISON_VALUE, measure, null);
        }

        public static Compute comparisonDelta(String measure) {
            return new Compute(Kind.COMPARISON_DELTA, measure, null);
        }

        public static Compute comparisonRatio(String measure) {
            return new Compute(Kind.COMPARISON_RATIO, measure, null);
        }

        public static Compute percentOfTotal(String measure) {
            return new Compute(Kind.PERCENT_OF_TOTAL, measure, null);
        }

        public Compute withTotal(Number captured) {
            return new Compute(kind, target, captured);
        }

        public boolean isComparison() {
            return kind == Kind.COMPARISON_VALUE || kind == Kind.COMPARISON_DELTA
                || kind == Kind.COMPARISON_RATIO;
        }
    }

    /**
     * Supported query-time computations.
     */
    public enum Kind {
        COUNT,
        COUNT_DISTINCT,
        COMPARISON_VALUE,
        COMPARISON_DELTA,
        COMPARISON_RATIO,
        PERCENT_OF_TOTAL
    }
}
