package com.metricsql.runtime;

import com.metricsql.compiler.CompileContext;
import com.metricsql.query.Query;
import com.metricsql.schema.SecurityPolicy;

/**
 * Executes a single-value query against the backend during compilation.
 *
 * <p>Used by the percent-of-total expansion to capture the grand total of a
 * measure. Implementations should honor the context's timeout and cancellation.
 */
@FunctionalInterface
public interface ScalarQueryExecutor {

    /**
     * Executes a query expected to return one row with one column.
     *
     * @param query the scalar query, with no dimensions
     * @param security the calling compilation's security policy; its row filter applies to the scalar query
     * @param context the calling compilation's context
     * @return the value, or null if the result is empty or NULL
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    Object executeScalar(Query query, SecurityPolicy security, CompileContext context) throws InterruptedException;

    /**
     * Executor for compilations that must not run nested queries.
     *
     * @return an executor that always fails
     */
    static ScalarQueryExecutor unavailable() {
        return (query, security, context) -> {
            throw new IllegalStateException("No scalar executor configured for metrics view '"
                + query.metricsView() + "'");
        };
    }
}
