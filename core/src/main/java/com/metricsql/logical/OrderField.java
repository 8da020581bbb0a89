package com.metricsql.logical;

import java.util.Objects;

/**
 * One ORDER BY entry. Nulls always sort last.
 *
 * @param expression the escaped output alias or expression
 * @param descending true for descending order
 */
public record OrderField(String expression, boolean descending) {

    public OrderField {
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
