package com.metricsql.expression;

import java.util.Objects;

/**
 * Reference to a dimension or measure by name. Resolved to its SQL expression
 * at translation time, never emitted as a literal.
 */
public record NameExpression(String name) implements Expression {

    public NameExpression {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public Kind kind() {
        return Kind.NAME;
    }
}
