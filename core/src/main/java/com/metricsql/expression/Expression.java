package com.metricsql.expression;

import com.metricsql.exception.ValidationException;

import java.util.Arrays;
import java.util.List;

/**
 * Filter and condition expression: a tagged union with exactly one variant.
 *
 * <ul>
 *   <li>{@link NameExpression} - a dimension or measure reference</li>
 *   <li>{@link ValueExpression} - a literal, the null literal, or a list literal</li>
 *   <li>{@link ConditionExpression} - an operator applied to child expressions</li>
 *   <li>{@link SubqueryExpression} - a nested dimension/measure request</li>
 * </ul>
 *
 * <p>Consumers switch exhaustively on {@link #kind()}.
 */
public sealed interface Expression
    permits NameExpression, ValueExpression, ConditionExpression, SubqueryExpression {

    /**
     * The populated variant.
     */
    enum Kind { NAME, VALUE, CONDITION, SUBQUERY }

    Kind kind();

    static NameExpression name(String name) {
        return new NameExpression(name);
    }

    static ValueExpression value(Object value) {
        return new ValueExpression(value);
    }

    static ValueExpression nullValue() {
        return new ValueExpression(null);
    }

    static ValueExpression list(Object... values) {
        return new ValueExpression(Arrays.asList(values));
    }

    static ConditionExpression condition(Operator operator, Expression... children) {
        return new ConditionExpression(operator, Arrays.asList(children));
    }

    static ConditionExpression condition(Operator operator, List<Expression> children) {
        return new ConditionExpression(operator, children);
    }

    static ConditionExpression and(Expression... children) {
        return condition(Operator.AND, children);
    }

    static ConditionExpression eq(String name, Object value) {
        return condition(Operator.EQ, name(name), value(value));
    }

    /**
     * Builds an expression from a wire-shaped record whose four variant fields are
     * all optional, as produced by API layers. Exactly one must be populated.
     *
     * @param name the name variant, or null
     * @param value the value variant payload
     * @param hasValue whether the value variant is populated (distinguishes a null literal from absence)
     * @param condition the condition variant, or null
     * @param subquery the subquery variant, or null
     * @return the expression
     * @throws ValidationException if zero or more than one variant is populated
     */
    static Expression fromFields(String name, Object value, boolean hasValue,
                                 ConditionExpression condition, SubqueryExpression subquery) {
        int populated = (name != null ? 1 : 0) + (hasValue ? 1 : 0)
            + (condition != null ? 1 : 0) + (subquery != null ? 1 : 0);
        if (populated != 1) {
            throw new ValidationException(
                "expression must have exactly one of name, value, condition, subquery populated, found " + populated,
                "expression");
        }
        if (name != null) {
            return new NameExpression(name);
        }
        if (hasValue) {
            return new ValueExpression(value);
        }
        return condition != null ? condition : subquery;
    }
}
