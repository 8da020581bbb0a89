package com.metricsql.rewrite;

import com.metricsql.dialect.Dialect;
import com.metricsql.logical.FieldNode;
import com.metricsql.logical.PlanTree;
import com.metricsql.logical.SelectBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Adapts the tree to backends that reject ungrouped selects over joins. Such
 * blocks are grouped by their dimensions with every measure wrapped in the
 * dialect's first-value aggregate.
 */
public class DialectNormalization implements PlanRewrite {

    private static final Logger logger = LoggerFactory.getLogger(DialectNormalization.class);

    @Override
    public PlanTree apply(PlanTree tree, RewriteContext context) {
        Dialect dialect = context.dialect();
        if (!dialect.requiresGroupingForJoins()) {
            return tree;
        }
        for (SelectBlock block : tree.blocks()) {
            if (block.joins().isEmpty() || block.grouped()) {
                continue;
            }
            block.grouped(true);
            List<FieldNode> measures = block.measures();
            for (int i = 0; i < measures.size(); i++) {
                FieldNode measure = measures.get(i);
                block.replaceMeasure(i, measure.withExpression(
                    dialect.firstValueAggregate(measure.expression().sql())));
            }
            logger.debug("Grouped join block '{}' for dialect {}", block.alias(), dialect.name());
        }
        return tree;
    }
}
