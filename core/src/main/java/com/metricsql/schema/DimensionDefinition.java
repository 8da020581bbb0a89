package com.metricsql.schema;

import java.util.Objects;

/**
 * A dimension of a metrics view, backed either by a column or by a SQL expression.
 */
public record DimensionDefinition(String name, String displayName, String column, String expression) {

    public DimensionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if ((column == null) == (expression == null)) {
            throw new IllegalArgumentException(
                "dimension '" + name + "' must define exactly one of column or expression");
        }
        if (displayName == null) {
            displayName = name;
        }
    }

    public static DimensionDefinition column(String name, String column) {
        return new DimensionDefinition(name, null, column, null);
    }

    public static DimensionDefinition expression(String name, String expression) {
        return new DimensionDefinition(name, null, null, expression);
    }

    public DimensionDefinition withDisplayName(String label) {
        return new DimensionDefinition(name, label, column, expression);
    }
}
