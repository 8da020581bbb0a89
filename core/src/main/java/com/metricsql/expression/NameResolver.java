package com.metricsql.expression;

/**
 * Resolves a dimension or measure name to the SQL it stands for in the current
 * clause. WHERE clauses see dimension expressions, HAVING clauses also see
 * measure aggregates, and wrapper blocks see qualified derived-table columns.
 */
@FunctionalInterface
public interface NameResolver {

    /**
     * Resolves a name.
     *
     * @param name the dimension or measure name
     * @return the escaped SQL expression, or null if the name is not in scope
     */
    SqlFragment resolve(String name);
}
