package com.metricsql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An operator applied to an ordered list of child expressions.
 *
 * <p>Arity is not enforced here; it is checked by
 * {@link com.metricsql.validation.QueryValidator} and again by the translator.
 */
public final class ConditionExpression implements Expression {

    private final Operator operator;
    private final List<Expression> children;

    public ConditionExpression(Operator operator, List<Expression> children) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        // Children may contain nulls from wire input; validation reports them
        this.children = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(children, "children must not be null")));
    }

    @Override
    public Kind kind() {
        return Kind.CONDITION;
    }

    public Operator operator() {
        return operator;
    }

    public List<Expression> children() {
        return children;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ConditionExpression that)) return false;
        return operator == that.operator && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, children);
    }

    @Override
    public String toString() {
        return "Condition(" + operator.code() + ", " + children + ")";
    }
}
