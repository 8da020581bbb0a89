package com.metricsql.rewrite;

import com.metricsql.exception.RewriteException;
import com.metricsql.query.Query;

/**
 * A rewrite pass over the query, applied before the plan tree is built.
 *
 * <p>Passes return a new query, or the same instance when their precondition
 * does not hold. A pass never mutates its input.
 */
public interface QueryRewrite {

    /**
     * Applies this pass.
     *
     * @param query the input query
     * @param context the compilation's rewrite context
     * @return the rewritten query (or the input if nothing applied)
     * @throws RewriteException if the pass fails
     */
    Query apply(Query query, RewriteContext context);

    /**
     * Returns the name of this pass, recorded on failures and in logs.
     *
     * @return the pass name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
