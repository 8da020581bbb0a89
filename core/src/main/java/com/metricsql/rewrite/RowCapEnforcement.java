package com.metricsql.rewrite;

import com.metricsql.exception.RewriteException;
import com.metricsql.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds the number of rows a query may return.
 *
 * <p>The cap is the configured one, else the dialect's default; 0 disables it.
 * An unlimited query gets {@code LIMIT cap + 1} so that the caller can tell a
 * truncated result from a complete one. An explicit limit above the cap is
 * rejected.
 */
public class RowCapEnforcement implements QueryRewrite {

    private static final Logger logger = LoggerFactory.getLogger(RowCapEnforcement.class);

    @Override
    public Query apply(Query query, RewriteContext context) {
        Long configured = context.config().rowCap();
        long cap = configured != null ? configured : context.dialect().defaultRowCap();
        if (cap <= 0) {
            return query;
        }

        Long limit = query.limit();
        if (limit == null) {
            logger.debug("Capping query at {} rows", cap);
            context.recordRowCap(cap);
            return query.toBuilder().limit(cap + 1).build();
        }
        if (limit > cap) {
            throw new RewriteException("Limit " + limit + " exceeds the row cap of " + cap, name());
        }
        return query;
    }
}
