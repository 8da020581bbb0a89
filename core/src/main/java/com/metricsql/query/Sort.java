package com.metricsql.query;

import java.util.Objects;

/**
 * Sort on a requested dimension or measure, referenced by its output name.
 */
public record Sort(String name, boolean descending) {

    public Sort {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Sort asc(String name) {
        return new Sort(name, false);
    }

    public static Sort desc(String name) {
        return new Sort(name, true);
    }
}
