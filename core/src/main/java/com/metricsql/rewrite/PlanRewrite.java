package com.metricsql.rewrite;

import com.metricsql.exception.RewriteException;
import com.metricsql.logical.PlanTree;

/**
 * A rewrite pass over the built plan tree. Tree passes edit the arena in place
 * and return it.
 */
public interface PlanRewrite {

    /**
     * Applies this pass.
     *
     * @param tree the plan tree
     * @param context the compilation's rewrite context
     * @return the rewritten tree
     * @throws RewriteException if the pass fails
     */
    PlanTree apply(PlanTree tree, RewriteContext context);

    default String name() {
        return getClass().getSimpleName();
    }
}
