package com.metricsql.expression;

/**
 * Builds and emits the select block of a {@link SubqueryExpression}. Supplied to
 * the translator by the plan builder, which owns the plan arena.
 */
@FunctionalInterface
public interface SubqueryCompiler {

    /**
     * Compiles a subquery to unparenthesized SQL with its arguments.
     *
     * @param subquery the subquery
     * @return the SQL fragment
     */
    SqlFragment compile(SubqueryExpression subquery);
}
