package com.metricsql.rewrite;

import com.metricsql.exception.RewriteException;
import com.metricsql.logical.JoinChild;
import com.metricsql.logical.JoinKind;
import com.metricsql.logical.OrderField;
import com.metricsql.logical.PlanTree;
import com.metricsql.logical.SelectBlock;
import com.metricsql.query.Measure;
import com.metricsql.query.Query;
import com.metricsql.query.Sort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replaces the full outer join between the base and comparison periods with a
 * one-sided join when approximate comparisons are enabled.
 *
 * <p>The anchor side is picked from the first sort field. Sorting by a
 * comparison value anchors the comparison period (RIGHT join); sorting by a
 * delta or ratio keeps the FULL join; anything else anchors the base period
 * (LEFT join). The anchor block also receives the ordering and
 * {@code limit + offset}, so the backend can prune it before joining. The
 * pushdown is skipped when a block above the anchor filters rows after the
 * join, since pruning first would drop rows that pass that filter.
 */
public class ApproximateComparisonJoin implements PlanRewrite {

    private static final Logger logger = LoggerFactory.getLogger(ApproximateComparisonJoin.class);

    @Override
    public PlanTree apply(PlanTree tree, RewriteContext context) {
        PlanTree.ComparisonJoin join = tree.comparisonJoin();
        if (!context.config().allowApproximateComparisons() || join == null) {
            return tree;
        }
        if (!context.dialect().supportsApproximateComparison()) {
            throw new RewriteException("Dialect '" + context.dialect().name()
                + "' does not support approximate comparisons", name());
        }

        Query query = context.query();
        Sort first = query == null || query.sort().isEmpty() ? null : query.sort().get(0);
        Measure sorted = first == null ? null : findMeasure(query, first.name());

        JoinKind kind;
        String anchorAlias;
        String orderColumn;
        if (sorted != null && sorted.isComputed() && sorted.compute().kind() == Measure.Kind.COMPARISON_VALUE) {
            kind = JoinKind.RIGHT;
            anchorAlias = join.comparisonAlias();
            orderColumn = sorted.compute().target();
        } else if (sorted != null && sorted.isComputed() && sorted.compute().isComparison()) {
            logger.debug("Sorted by {}, keeping full comparison join", sorted.compute().kind());
            return tree;
        } else {
            kind = JoinKind.LEFT;
            anchorAlias = join.baseAlias();
            orderColumn = first == null ? null : first.name();
        }

        SelectBlock joining = tree.block(join.joiningAlias());
        List<JoinChild> joins = joining.joins();
        for (int i = 0; i < joins.size(); i++) {
            if (joins.get(i).alias().equals(join.comparisonAlias())) {
                joining.replaceJoin(i, joins.get(i).withKind(kind));
            }
        }

        SelectBlock anchor = tree.block(anchorAlias);
        SelectBlock root = tree.root();
        if (orderColumn != null && root.limit() != null && anchor.field(orderColumn) != null
                && !filtersAfterJoin(tree, join.joiningAlias())) {
            long offset = root.offset() == null ? 0 : root.offset();
            anchor.clearOrderBy();
            anchor.orderBy(new OrderField(context.dialect().escapeIdentifier(orderColumn), first.descending()));
            anchor.limit(root.limit() + offset);
        }
        logger.debug("Comparison join set to {} anchored on '{}'", kind, anchorAlias);
        return tree;
    }

    /**
     * Whether any block from the root down to the joining block has a WHERE or
     * HAVING predicate.
     */
    private static boolean filtersAfterJoin(PlanTree tree, String joiningAlias) {
        String alias = tree.rootAlias();
        while (alias != null) {
            SelectBlock block = tree.block(alias);
            if (block.where() != null || block.having() != null) {
                logger.debug("Block '{}' filters after the comparison join, not pushing limit", alias);
                return true;
            }
            if (alias.equals(joiningAlias)) {
                return false;
            }
            alias = block.fromBlock();
        }
        return false;
    }

    private static Measure findMeasure(Query query, String name) {
        for (Measure measure : query.measures()) {
            if (measure.name().equals(name)) {
                return measure;
            }
        }
        return null;
    }
}
