package com.metricsql.dialect;

import com.metricsql.exception.UnsupportedFeatureException;
import com.metricsql.logical.JoinKind;
import com.metricsql.query.TimeGrain;

/**
 * Capability contract of one analytical-database backend.
 *
 * <p>The translator, builder, rewrite passes and emitter never branch on a
 * backend's name; every backend difference is expressed through this interface.
 * Implementations are stateless and shared by concurrent compilations.
 *
 * @see DialectRegistry
 * @see AbstractDialect
 */
public interface Dialect {

    /**
     * Returns the registry key of this dialect, e.g. {@code duckdb}.
     *
     * @return the dialect name
     */
    String name();

    /**
     * Escapes a column name or alias.
     *
     * @param identifier the raw identifier
     * @return the escaped identifier
     */
    String escapeIdentifier(String identifier);

    /**
     * Escapes a possibly schema-qualified table name.
     *
     * @param table the table name, e.g. {@code analytics.events}
     * @return the escaped table reference
     */
    String escapeTable(String table);

    /**
     * Returns a column of a derived table: {@code alias.column}, both escaped.
     *
     * @param alias the block alias
     * @param column the column name
     * @return the qualified reference
     */
    default String qualify(String alias, String column) {
        return escapeIdentifier(alias) + "." + escapeIdentifier(column);
    }

    /**
     * Returns whether the backend has a native case-insensitive LIKE.
     *
     * @return true if {@code ILIKE} may be emitted
     */
    boolean supportsILike();

    /**
     * Generates an expression truncating a timestamp to a grain.
     *
     * @param expr the timestamp expression
     * @param grain the grain
     * @param timeZone IANA zone id, or null for UTC
     * @param firstDayOfWeek 1 (Monday) to 7 (Sunday)
     * @param firstMonthOfYear 1 to 12
     * @return the SQL expression
     * @throws UnsupportedFeatureException if the backend cannot truncate to this grain
     */
    String dateTrunc(String expr, TimeGrain grain, String timeZone, int firstDayOfWeek, int firstMonthOfYear);

    /**
     * Generates the predicate matching one dimension across two joined blocks.
     * Both operands are already escaped and qualified.
     *
     * @param left the left operand
     * @param right the right operand
     * @return the join predicate
     */
    String joinOnExpression(String left, String right);

    /**
     * Generates a division that yields NULL instead of failing when the divisor is zero.
     *
     * @param numerator the numerator expression
     * @param denominator the denominator expression
     * @return the division expression
     */
    String safeDivide(String numerator, String denominator);

    /**
     * Wraps an expression in a deterministic first-value aggregate, used when the
     * backend requires every selected column of a grouped join to be aggregated.
     *
     * @param expr the expression
     * @return the aggregate expression
     */
    String firstValueAggregate(String expr);

    /**
     * Returns whether one-sided joins may replace exact full-outer comparison joins.
     *
     * @return true if approximate comparisons are supported
     */
    boolean supportsApproximateComparison();

    /**
     * Returns whether blocks with join children must be grouped with every
     * measure aggregated.
     *
     * @return true if grouping is required around joins
     */
    boolean requiresGroupingForJoins();

    /**
     * Returns whether GROUP BY is emitted as select-list ordinals rather than expressions.
     *
     * @return true for ordinals
     */
    boolean groupByOrdinals();

    /**
     * Returns the keyword sequence introducing a join of the given kind.
     *
     * @param kind the join kind
     * @return the keywords, e.g. {@code LEFT OUTER JOIN}
     */
    String joinKeyword(JoinKind kind);

    /**
     * Returns the row-limiting clause, without leading space.
     *
     * @param limit the limit, or null
     * @param offset the offset, or null
     * @return the clause, or an empty string when neither is set
     */
    String limitClause(Long limit, Long offset);

    /**
     * Returns the row cap applied when none is configured; 0 means unlimited.
     *
     * @return the default cap
     */
    long defaultRowCap();
}
