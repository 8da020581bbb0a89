package com.metricsql.rewrite;

import com.metricsql.compiler.CompileContext;
import com.metricsql.exception.CompilationCancelledException;
import com.metricsql.exception.MetricsQueryException;
import com.metricsql.exception.RewriteException;
import com.metricsql.query.Measure;
import com.metricsql.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Captures the grand total behind every percent-of-total measure.
 *
 * <p>For each target measure a scalar query is run through the compilation's
 * {@link com.metricsql.runtime.ScalarQueryExecutor}: same view, filter, time
 * range, time zone and security policy, no dimensions. The value is stored on the compute and
 * later bound as an argument. An empty or NULL total counts as 0, which makes
 * every percentage NULL through the dialect's safe division.
 */
public class PercentOfTotalExpansion implements QueryRewrite {

    private static final Logger logger = LoggerFactory.getLogger(PercentOfTotalExpansion.class);

    @Override
    public Query apply(Query query, RewriteContext context) {
        boolean pending = query.measures().stream()
            .anyMatch(m -> m.isComputed() && m.compute().kind() == Measure.Kind.PERCENT_OF_TOTAL
                && m.compute().total() == null);
        if (!pending) {
            return query;
        }

        Map<String, Number> totals = new HashMap<>();
        List<Measure> measures = new ArrayList<>(query.measures().size());
        for (Measure measure : query.measures()) {
            Measure.Compute compute = measure.compute();
            if (compute == null || compute.kind() != Measure.Kind.PERCENT_OF_TOTAL || compute.total() != null) {
                measures.add(measure);
                continue;
            }
            Number total = totals.get(compute.target());
            if (total == null) {
                total = fetchTotal(query, compute.target(), context);
                totals.put(compute.target(), total);
            }
            measures.add(measure.withCompute(compute.withTotal(total)));
        }
        return query.toBuilder().measures(measures).build();
    }

    private Number fetchTotal(Query query, String target, RewriteContext context) {
        Query totalQuery = Query.builder(query.metricsView())
            .measure(Measure.of(target))
            .where(query.where())
            .timeRange(query.timeRange())
            .timeZone(query.timeZone())
            .build();

        CompileContext compileContext = context.compileContext();
        checkCancelled(compileContext);
        Object value;
        try {
            value = context.executor().executeScalar(totalQuery, context.security(), compileContext);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompilationCancelledException(name(), e);
        } catch (CancellationException e) {
            throw new CompilationCancelledException(name(), e);
        } catch (MetricsQueryException e) {
            throw new RewriteException("Failed to compute total of measure '" + target + "': "
                + e.getMessage(), name(), e);
        } catch (RuntimeException e) {
            if (compileContext.isCancelled()) {
                throw new CompilationCancelledException(name(), e);
            }
            throw new RewriteException("Failed to compute total of measure '" + target + "': "
                + e.getMessage(), name(), e);
        }
        checkCancelled(compileContext);

        Number total = toNumber(value, target);
        logger.debug("Captured total {} for measure '{}'", total, target);
        return total;
    }

    private void checkCancelled(CompileContext compileContext) {
        if (compileContext.isCancelled()) {
            throw new CompilationCancelledException(name(), null);
        }
    }

    private Number toNumber(Object value, String target) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new RewriteException("Total of measure '" + target + "' is not numeric: " + value, name(), e);
        }
    }
}
