package com.metricsql.validation;

import com.metricsql.exception.ValidationException;
import com.metricsql.expression.ConditionExpression;
import com.metricsql.expression.Expression;
import com.metricsql.expression.NameExpression;
import com.metricsql.expression.Operator;
import com.metricsql.expression.SubqueryExpression;
import com.metricsql.expression.ValueExpression;
import com.metricsql.query.Dimension;
import com.metricsql.query.Measure;
import com.metricsql.query.Query;
import com.metricsql.query.Sort;
import com.metricsql.query.TimeRange;
import com.metricsql.schema.DisplayLabels;
import com.metricsql.schema.MetricsView;
import com.metricsql.schema.SecurityPolicy;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Validates queries against a metrics view before compilation.
 *
 * <p>Validation is pure: it never changes the query and fails on the first
 * problem with a {@link ValidationException} naming the offending field.
 */
public final class QueryValidator {

    private QueryValidator() {
    }

    /**
     * Validates a query.
     *
     * @param query the query
     * @param view the metrics view it targets
     * @param security the caller's security policy
     * @throws ValidationException if the query is invalid
     */
    public static void validate(Query query, MetricsView view, SecurityPolicy security) {
        if (query == null) {
            throw new ValidationException("query must not be null", "query");
        }
        if (view == null) {
            throw new ValidationException("metrics view must not be null", "metricsView");
        }
        if (!view.name().equals(query.metricsView())) {
            throw new ValidationException("query targets metrics view '" + query.metricsView()
                + "' but was compiled against '" + view.name() + "'", "metricsView");
        }

        if (query.rows() && (!query.dimensions().isEmpty() || !query.measures().isEmpty())) {
            throw new ValidationException("raw rows cannot be combined with dimensions or measures", "rows");
        }
        if (!query.rows() && query.dimensions().isEmpty() && query.measures().isEmpty()) {
            throw new ValidationException("query selects no dimensions or measures", "measures");
        }

        Set<String> outputs = new HashSet<>();
        Set<String> dimensionOutputs = new HashSet<>();
        for (Dimension dimension : query.dimensions()) {
            requireDimension(dimension.name(), view, security, "dimensions");
            if (dimension.grain() != null && !dimension.name().equals(view.timeDimension())) {
                throw new ValidationException("time grain on non-time dimension '" + dimension.name() + "'",
                    "dimensions");
            }
            addOutput(dimension.outputName(), outputs);
            dimensionOutputs.add(dimension.outputName());
        }
        for (Measure measure : query.measures()) {
            validateMeasure(measure, query, view, security);
            addOutput(measure.name(), outputs);
        }

        for (Sort sort : query.sort()) {
            if (!query.rows() && !outputs.contains(sort.name())) {
                throw new ValidationException("sort field '" + sort.name()
                    + "' is not a requested dimension or measure", "sort");
            }
            if (query.rows() && view.dimension(sort.name()).isEmpty()) {
                throw new ValidationException("sort field '" + sort.name() + "' is not a dimension", "sort");
            }
        }

        if (query.limit() != null && query.limit() < 0) {
            throw new ValidationException("limit must not be negative: " + query.limit(), "limit");
        }
        if (query.offset() != null && query.offset() < 0) {
            throw new ValidationException("offset must not be negative: " + query.offset(), "offset");
        }

        if (query.where() != null) {
            validateExpression(query.where(), name -> isVisibleDimension(name, view, security),
                view, security, "where");
        }
        if (query.having() != null) {
            if (query.measures().isEmpty()) {
                throw new ValidationException("having requires at least one measure", "having");
            }
            Set<String> measureNames = new HashSet<>();
            query.measures().forEach(m -> measureNames.add(m.name()));
            validateExpression(query.having(),
                name -> dimensionOutputs.contains(name) || measureNames.contains(name),
                view, security, "having");
        }

        if (query.timeZone() != null) {
            try {
                ZoneId.of(query.timeZone());
            } catch (DateTimeException e) {
                throw new ValidationException("invalid time zone '" + query.timeZone() + "'", "timeZone");
            }
        }
        validateTimeRange(query.timeRange(), view, "timeRange");
        validateTimeRange(query.comparisonTimeRange(), view, "comparisonTimeRange");

        if (query.useDisplayNames()) {
            validateDisplayNames(query, view);
        }
    }

    private static void validateMeasure(Measure measure, Query query, MetricsView view, SecurityPolicy security) {
        if (!measure.isComputed()) {
            requireMeasure(measure.name(), view, security, "measures");
            return;
        }
        if (view.measure(measure.name()).isPresent()) {
            throw new ValidationException("computed measure '" + measure.name()
                + "' shadows a measure of the metrics view", "measures");
        }
        Measure.Compute compute = measure.compute();
        switch (compute.kind()) {
            case COUNT:
                break;
            case COUNT_DISTINCT:
                requireDimension(compute.target(), view, security, "measures");
                break;
            case COMPARISON_VALUE:
            case COMPARISON_DELTA:
            case COMPARISON_RATIO:
                requireMeasure(compute.target(), view, security, "measures");
                if (query.comparisonTimeRange() == null) {
                    throw new ValidationException("comparison measure '" + measure.name()
                        + "' requires a comparison time range", "comparisonTimeRange");
                }
                break;
            case PERCENT_OF_TOTAL:
                requireMeasure(compute.target(), view, security, "measures");
                break;
            default:
                throw new IllegalStateException("Unhandled compute kind: " + compute.kind());
        }
    }

    /**
     * Checks the tagged-union and arity rules of an expression tree and that
     * every name is in scope.
     */
    static void validateExpression(Expression expression, Predicate<String> inScope,
                                   MetricsView view, SecurityPolicy security, String field) {
        if (expression == null) {
            throw new ValidationException("expression has no populated variant", field);
        }
        switch (expression.kind()) {
            case NAME: {
                String name = ((NameExpression) expression).name();
                if (name == null || name.isEmpty()) {
                    throw new ValidationException("empty name in expression", field);
                }
                if (!inScope.test(name)) {
                    throw new ValidationException("unknown name '" + name + "' in expression", field);
                }
                break;
            }
            case VALUE:
                if (((ValueExpression) expression).isList()) {
                    throw new ValidationException(
                        "list values are only allowed as the second expression of 'in' or 'nin'", field);
                }
                break;
            case CONDITION:
                validateCondition((ConditionExpression) expression, inScope, view, security, field);
                break;
            case SUBQUERY:
                validateSubquery((SubqueryExpression) expression, view, security, field);
                break;
            default:
                throw new IllegalStateException("Unhandled expression kind: " + expression.kind());
        }
    }

    private static void validateCondition(ConditionExpression condition, Predicate<String> inScope,
                                          MetricsView view, SecurityPolicy security, String field) {
        Operator op = condition.operator();
        int arity = condition.children().size();
        if (op.isLogical()) {
            if (arity < 2) {
                throw new ValidationException("operator '" + op.code() + "' requires at least 2 expressions, got "
                    + arity, field);
            }
        } else if (arity != 2) {
            throw new ValidationException("operator '" + op.code() + "' requires exactly 2 expressions, got "
                + arity, field);
        }
        if (op.isMembership()) {
            Expression right = condition.children().get(1);
            boolean list = right instanceof ValueExpression value && value.isList();
            if (!list && !(right instanceof SubqueryExpression)) {
                throw new ValidationException("operator '" + op.code()
                    + "' requires a list value or subquery as second expression", field);
            }
            validateExpression(condition.children().get(0), inScope, view, security, field);
            if (!list) {
                validateExpression(right, inScope, view, security, field);
            }
            return;
        }
        for (Expression child : condition.children()) {
            validateExpression(child, inScope, view, security, field);
        }
    }

    private static void validateSubquery(SubqueryExpression subquery, MetricsView view, SecurityPolicy security,
                                         String field) {
        requireDimension(subquery.dimension(), view, security, field);
        Set<String> measures = new HashSet<>();
        for (String measure : subquery.measures()) {
            requireMeasure(measure, view, security, field);
            measures.add(measure);
        }
        if (subquery.where() != null) {
            validateExpression(subquery.where(), name -> isVisibleDimension(name, view, security),
                view, security, field);
        }
        if (subquery.having() != null) {
            if (measures.isEmpty()) {
                throw new ValidationException("subquery having requires at least one measure", field);
            }
            validateExpression(subquery.having(),
                name -> measures.contains(name) || name.equals(subquery.dimension()),
                view, security, field);
        }
    }

    private static void validateTimeRange(TimeRange range, MetricsView view, String field) {
        if (range == null) {
            return;
        }
        if (view.timeDimension() == null) {
            throw new ValidationException("metrics view '" + view.name() + "' has no time dimension", field);
        }
        if (range.start() != null && range.end() != null && !range.start().isBefore(range.end())) {
            throw new ValidationException("time range start " + range.start()
                + " must be before end " + range.end(), field);
        }
    }

    private static void validateDisplayNames(Query query, MetricsView view) {
        Set<String> labels = new HashSet<>();
        for (Dimension dimension : query.dimensions()) {
            requireUniqueLabel(DisplayLabels.of(dimension, view), labels);
        }
        for (Measure measure : query.measures()) {
            requireUniqueLabel(DisplayLabels.of(measure, view), labels);
        }
    }

    private static void requireUniqueLabel(String label, Set<String> labels) {
        if (!labels.add(label)) {
            throw new ValidationException("duplicate display name '" + label + "'", "useDisplayNames");
        }
    }

    private static void requireDimension(String name, MetricsView view, SecurityPolicy security, String field) {
        if (view.dimension(name).isEmpty()) {
            throw new ValidationException("unknown dimension '" + name + "'", field);
        }
        if (!security.canAccess(name)) {
            throw new ValidationException("access to dimension '" + name + "' is denied", field);
        }
    }

    private static void requireMeasure(String name, MetricsView view, SecurityPolicy security, String field) {
        if (view.measure(name).isEmpty()) {
            throw new ValidationException("unknown measure '" + name + "'", field);
        }
        if (!security.canAccess(name)) {
            throw new ValidationException("access to measure '" + name + "' is denied", field);
        }
    }

    private static boolean isVisibleDimension(String name, MetricsView view, SecurityPolicy security) {
        return view.dimension(name).isPresent() && security.canAccess(name);
    }

    private static void addOutput(String name, Set<String> outputs) {
        if (!outputs.add(name)) {
            throw new ValidationException("duplicate output name '" + name + "'", "measures");
        }
    }
}
