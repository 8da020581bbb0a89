package com.metricsql.rewrite;

import com.metricsql.exception.MetricsQueryException;
import com.metricsql.exception.RewriteException;
import com.metricsql.logical.PlanTree;
import com.metricsql.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Ordered rewrite passes around plan building.
 *
 * <p>Query passes run before the plan tree is built, tree passes after. Order is
 * fixed and every pass runs once. The first failure aborts compilation.
 *
 * <p>The standard pipeline:
 * <ol>
 *   <li>{@link TimeRangeResolution}</li>
 *   <li>{@link RowCapEnforcement}</li>
 *   <li>{@link PercentOfTotalExpansion}</li>
 *   <li>(plan tree built here)</li>
 *   <li>{@link ApproximateComparisonJoin}</li>
 *   <li>{@link DialectNormalization}</li>
 * </ol>
 */
public class RewritePipeline {

    private static final Logger logger = LoggerFactory.getLogger(RewritePipeline.class);

    private final List<QueryRewrite> queryRewrites;
    private final List<PlanRewrite> planRewrites;

    /**
     * Creates a pipeline with custom passes.
     *
     * @param queryRewrites passes applied to the query, in order
     * @param planRewrites passes applied to the plan tree, in order
     */
    public RewritePipeline(List<QueryRewrite> queryRewrites, List<PlanRewrite> planRewrites) {
        this.queryRewrites = new ArrayList<>(queryRewrites);
        this.planRewrites = new ArrayList<>(planRewrites);
    }

    public static RewritePipeline standard() {
        return new RewritePipeline(
            Arrays.asList(
                new TimeRangeResolution(),
                new RowCapEnforcement(),
                new PercentOfTotalExpansion()),
            Arrays.asList(
                new ApproximateComparisonJoin(),
                new DialectNormalization()));
    }

    /**
     * Applies every query pass in order.
     *
     * @param query the validated query
     * @param context the rewrite context; receives the final query
     * @return the rewritten query
     * @throws RewriteException naming the failing pass
     */
    public Query rewriteQuery(Query query, RewriteContext context) {
        Query current = query;
        for (QueryRewrite pass : queryRewrites) {
            Query input = current;
            current = run(pass.name(), () -> pass.apply(input, context));
            logger.debug("Pass {} {}", pass.name(), current == input ? "skipped" : "rewrote query");
        }
        context.setQuery(current);
        return current;
    }

    /**
     * Applies every tree pass in order.
     *
     * @param tree the built plan tree
     * @param context the rewrite context
     * @return the rewritten tree
     */
    public PlanTree rewritePlan(PlanTree tree, RewriteContext context) {
        PlanTree current = tree;
        for (PlanRewrite pass : planRewrites) {
            PlanTree input = current;
            current = run(pass.name(), () -> pass.apply(input, context));
        }
        return current;
    }

    public List<QueryRewrite> queryRewrites() {
        return new ArrayList<>(queryRewrites);
    }

    public List<PlanRewrite> planRewrites() {
        return new ArrayList<>(planRewrites);
    }

    private static <T> T run(String pass, Supplier<T> body) {
        try {
            return body.get();
        } catch (MetricsQueryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RewriteException("Unexpected error: " + e.getMessage(), pass, e);
        }
    }
}
