package com.metricsql.expression;

import java.util.List;
import java.util.Objects;

/**
 * A nested request over the same metrics view: one dimension, the measures needed
 * by {@code having}, and optional pre- and post-aggregation filters. Typically the
 * right-hand side of {@code in}, e.g. "countries whose total views exceed 100".
 */
public record SubqueryExpression(String dimension, List<String> measures,
                                 Expression where, Expression having) implements Expression {

    public SubqueryExpression {
        Objects.requireNonNull(dimension, "dimension must not be null");
        measures = measures == null ? List.of() : List.copyOf(measures);
    }

    @Override
    public Kind kind() {
        return Kind.SUBQUERY;
    }
}
