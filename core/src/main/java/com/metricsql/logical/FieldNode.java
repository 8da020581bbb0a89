package com.metricsql.logical;

import com.metricsql.expression.SqlFragment;

import java.util.Objects;

/**
 * One selected column of a {@link SelectBlock}.
 *
 * @param name the output name, unique within its block
 * @param displayName the human-readable label, or null
 * @param expression the SQL expression and its arguments
 */
public record FieldNode(String name, String displayName, SqlFragment expression) {

    public FieldNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    public static FieldNode of(String name, String displayName, String sql) {
        return new FieldNode(name, displayName, SqlFragment.of(sql));
    }

    public FieldNode withExpression(SqlFragment replacement) {
        return new FieldNode(name, displayName, replacement);
    }

    public FieldNode withExpression(String sql) {
        return new FieldNode(name, displayName, new SqlFragment(sql, expression.args()));
    }
}
