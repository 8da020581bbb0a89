package com.metricsql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Literal value. A {@code null} payload is the SQL null literal; a {@link List}
 * payload is a list literal for {@code in}/{@code nin}.
 */
public final class ValueExpression implements Expression {

    private final Object value;

    public ValueExpression(Object value) {
        if (value instanceof List<?> list) {
            // Elements may be null, so List.copyOf is not an option
            this.value = Collections.unmodifiableList(new ArrayList<>(list));
        } else {
            this.value = value;
        }
    }

    @Override
    public Kind kind() {
        return Kind.VALUE;
    }

    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isList() {
        return value instanceof List;
    }

    /**
     * Returns the elements of a list literal.
     *
     * @return the elements
     * @throws IllegalStateException if this is not a list literal
     */
    public List<?> elements() {
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException("Not a list literal: " + value);
        }
        return list;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ValueExpression that)) return false;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "Value(" + value + ")";
    }
}
