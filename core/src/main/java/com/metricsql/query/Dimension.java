package com.metricsql.query;

import java.util.Objects;

/**
 * A requested dimension: a schema dimension name, an optional time grain and an
 * optional output alias. The alias lets the same time dimension appear twice at
 * different grains.
 */
public record Dimension(String name, TimeGrain grain, String alias) {

    public Dimension {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Dimension of(String name) {
        return new Dimension(name, null, null);
    }

    public static Dimension of(String name, TimeGrain grain) {
        return new Dimension(name, grain, null);
    }

    /**
     * Returns the column name this dimension is exposed under in the result.
     *
     * @return the alias if set, otherwise the dimension name
     */
    public String outputName() {
        return alias != null ? alias : name;
    }
}
