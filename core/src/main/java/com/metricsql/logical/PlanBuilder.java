package com.metricsql.logical;

import com.metricsql.dialect.Dialect;
import com.metricsql.exception.CompileInvariantException;
import com.metricsql.exception.UnsupportedFeatureException;
import com.metricsql.expression.Expression;
import com.metricsql.expression.ExpressionTranslator;
import com.metricsql.expression.NameResolver;
import com.metricsql.expression.SqlFragment;
import com.metricsql.expression.SubqueryExpression;
import com.metricsql.generator.SQLGenerator;
import com.metricsql.query.Dimension;
import com.metricsql.query.Measure;
import com.metricsql.query.Query;
import com.metricsql.query.Sort;
import com.metricsql.query.TimeRange;
import com.metricsql.schema.DimensionDefinition;
import com.metricsql.schema.DisplayLabels;
import com.metricsql.schema.MeasureDefinition;
import com.metricsql.schema.MetricsView;
import com.metricsql.schema.SecurityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the {@link PlanTree} for a validated, rewritten query.
 *
 * <p>The tree has up to three layers:
 * <ol>
 *   <li>a grouped block {@code base} over the view's table computing dimensions
 *       and the simple measures the query needs, plus a mirror block
 *       {@code comparison} over the comparison period when comparison
 *       measures are requested</li>
 *   <li>one wrapper block per level of derived measures, on each side</li>
 *   <li>a root wrapper joining the two periods and computing comparison and
 *       percent-of-total values; only requested fields reach it</li>
 * </ol>
 * A query with only simple measures and counts collapses to the single base
 * block. With display names, a final projection relabels the columns.
 */
public class PlanBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PlanBuilder.class);

    public static final String BASE_ALIAS = "base";
    public static final String COMPARISON_ALIAS = "comparison";

    private final MetricsView view;
    private final SecurityPolicy security;
    private final Dialect dialect;

    public PlanBuilder(MetricsView view, SecurityPolicy security, Dialect dialect) {
        this.view = Objects.requireNonNull(view, "view must not be null");
        this.security = Objects.requireNonNull(security, "security must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * Builds the plan tree of a query.
     *
     * @param view the metrics view
     * @param security the caller's security policy
     * @param query the validated and rewritten query
     * @param dialect the target dialect
     * @return the plan tree
     * @throws UnsupportedFeatureException for pivots or constructs the dialect cannot express
     * @throws CompileInvariantException if the query references unknown names
     */
    public static PlanTree build(MetricsView view, SecurityPolicy security, Query query, Dialect dialect) {
        return new PlanBuilder(view, security, dialect).build(query);
    }

    public PlanTree build(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        if (!query.pivotOn().isEmpty()) {
            throw new UnsupportedFeatureException("pivot", dialect.name());
        }

        PlanTree tree = new PlanTree();
        if (query.rows()) {
            buildRows(tree, query);
            return tree;
        }

        Set<String> sideMeasures = sideMeasures(query);
        boolean hasDerived = sideMeasures.stream().anyMatch(name -> measureDef(name).isDerived());
        boolean hasComparison = query.hasComparisonMeasures();
        boolean hasPercent = query.measures().stream()
            .anyMatch(m -> m.isComputed() && m.compute().kind() == Measure.Kind.PERCENT_OF_TOTAL);

        String baseTop = buildSide(tree, BASE_ALIAS, query, query.timeRange(), sideMeasures);

        SelectBlock root;
        if (!hasDerived && !hasComparison && !hasPercent) {
            root = tree.block(baseTop);
            if (query.having() != null) {
                root.having(translator(query, aggregateResolver(root, query)).translate(query.having()));
            }
        } else {
            String comparisonTop = hasComparison
                ? buildSide(tree, COMPARISON_ALIAS, query, query.comparisonTimeRange(), sideMeasures)
                : null;
            root = buildRoot(tree, query, baseTop, comparisonTop);
            if (query.having() != null) {
                SelectBlock wrapper = root;
                NameResolver resolver = name -> {
                    FieldNode field = wrapper.field(name);
                    return field == null ? null : field.expression();
                };
                root.where(translator(query, resolver).translate(query.having()));
            }
        }

        for (Sort sort : query.sort()) {
            root.orderBy(new OrderField(dialect.escapeIdentifier(sort.name()), sort.descending()));
        }
        root.limit(query.limit()).offset(query.offset());
        tree.setRoot(root.alias());

        if (query.useDisplayNames()) {
            applyDisplayNames(tree, root);
        }

        logger.debug("Built plan tree {}", tree);
        return tree;
    }

    private void buildRows(PlanTree tree, Query query) {
        SelectBlock block = tree.newBlock(BASE_ALIAS)
            .selectStar(true)
            .fromTable(view.table())
            .where(filter(query, query.timeRange(), query.where()));
        for (Sort sort : query.sort()) {
            block.orderBy(new OrderField(rawDimensionSql(dimensionDef(sort.name())), sort.descending()));
        }
        block.limit(query.limit()).offset(query.offset());
        tree.setRoot(block.alias());
    }

    /**
     * Returns the schema measures each period side must expose: plain requested
     * measures and the targets of comparison and percent-of-total computes.
     */
    private Set<String> sideMeasures(Query query) {
        Set<String> names = new LinkedHashSet<>();
        for (Measure measure : query.measures()) {
            if (!measure.isComputed()) {
                names.add(measure.name());
            } else if (measure.compute().isComparison()
                || measure.compute().kind() == Measure.Kind.PERCENT_OF_TOTAL) {
                names.add(measure.compute().target());
            }
        }
        return names;
    }

    /**
     * Builds the aggregate block of one period and its derived-measure layers.
     *
     * @return the alias of the topmost block of the side
     */
    private String buildSide(PlanTree tree, String alias, Query query, TimeRange range, Set<String> sideMeasures) {
        Map<String, Integer> depths = new LinkedHashMap<>();
        for (String name : sideMeasures) {
            depth(name, depths, new HashSet<>());
        }

        SelectBlock aggregate = tree.newBlock(alias).fromTable(view.table());
        for (Dimension dimension : query.dimensions()) {
            aggregate.addDimension(new FieldNode(dimension.outputName(), dimensionLabel(dimension),
                SqlFragment.of(dimensionSql(dimension, query.timeZone()))));
        }
        // Requested order first, then helper measures
        for (Measure measure : query.measures()) {
            if (!measure.isComputed()) {
                if (depths.get(measure.name()) == 0) {
                    addSimpleMeasure(aggregate, measure.name());
                }
                continue;
            }
            Measure.Compute compute = measure.compute();
            if (compute.kind() == Measure.Kind.COUNT) {
                aggregate.addMeasure(FieldNode.of(measure.name(), measureLabel(measure), "count(*)"));
            } else if (compute.kind() == Measure.Kind.COUNT_DISTINCT) {
                aggregate.addMeasure(FieldNode.of(measure.name(), measureLabel(measure),
                    "count(DISTINCT " + rawDimensionSql(dimensionDef(compute.target())) + ")"));
            }
        }
        for (Map.Entry<String, Integer> entry : depths.entrySet()) {
            if (entry.getValue() == 0 && aggregate.field(entry.getKey()) == null) {
                addSimpleMeasure(aggregate, entry.getKey());
            }
        }
        aggregate.where(filter(query, range, query.where()));
        aggregate.grouped(!query.dimensions().isEmpty());

        int maxDepth = depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        SelectBlock previous = aggregate;
        for (int level = 1; level <= maxDepth; level++) {
            SelectBlock layer = tree.newBlock().fromBlock(previous.alias());
            for (FieldNode dimension : previous.dimensions()) {
                layer.addDimension(FieldNode.of(dimension.name(), dimension.displayName(),
                    dialect.escapeIdentifier(dimension.name())));
            }
            for (FieldNode measure : previous.measures()) {
                layer.addMeasure(FieldNode.of(measure.name(), measure.displayName(),
                    dialect.escapeIdentifier(measure.name())));
            }
            for (Map.Entry<String, Integer> entry : depths.entrySet()) {
                if (entry.getValue() == level) {
                    MeasureDefinition def = measureDef(entry.getKey());
                    layer.addMeasure(FieldNode.of(def.name(), def.displayName(), "(" + def.expression() + ")"));
                }
            }
            previous = layer;
        }
        return previous.alias();
    }

    private void addSimpleMeasure(SelectBlock block, String name) {
        MeasureDefinition def = measureDef(name);
        block.addMeasure(FieldNode.of(def.name(), def.displayName(), def.expression()));
    }

    /**
     * Computes the derived-measure depth of a measure and of everything it
     * references: 0 for simple measures, one more than the deepest reference
     * for derived ones.
     */
    private int depth(String name, Map<String, Integer> depths, Set<String> visiting) {
        Integer known = depths.get(name);
        if (known != null) {
            return known;
        }
        MeasureDefinition def = measureDef(name);
        if (!def.isDerived()) {
            depths.put(name, 0);
            return 0;
        }
        if (!visiting.add(name)) {
            throw new CompileInvariantException("Derived measure '" + name + "' references itself");
        }
        int max = 0;
        for (String reference : def.referencedMeasures()) {
            max = Math.max(max, depth(reference, depths, visiting));
        }
        visiting.remove(name);
        depths.put(name, max + 1);
        return max + 1;
    }

    private SelectBlock buildRoot(PlanTree tree, Query query, String baseTop, String comparisonTop) {
        SelectBlock root = tree.newBlock().fromBlock(baseTop);

        if (comparisonTop != null) {
            List<String> predicates = new ArrayList<>();
            for (Dimension dimension : query.dimensions()) {
                predicates.add(dialect.joinOnExpression(
                    dialect.qualify(baseTop, dimension.outputName()),
                    dialect.qualify(comparisonTop, dimension.outputName())));
            }
            String predicate = predicates.isEmpty() ? "1 = 1" : String.join(" AND ", predicates);
            root.join(new JoinChild(comparisonTop, JoinKind.FULL, predicate));
            tree.setComparisonJoin(new PlanTree.ComparisonJoin(root.alias(), baseTop, comparisonTop));
        }

        for (Dimension dimension : query.dimensions()) {
            String column = dimension.outputName();
            String sql = comparisonTop == null
                ? dialect.escapeIdentifier(column)
                : "COALESCE(" + dialect.qualify(baseTop, column) + ", "
                    + dialect.qualify(comparisonTop, column) + ")";
            root.addDimension(FieldNode.of(column, dimensionLabel(dimension), sql));
        }

        for (Measure measure : query.measures()) {
            root.addMeasure(new FieldNode(measure.name(), measureLabel(measure),
                rootMeasureSql(measure, baseTop, comparisonTop)));
        }
        return root;
    }

    private SqlFragment rootMeasureSql(Measure measure, String baseTop, String comparisonTop) {
        String base = comparisonTop == null
            ? dialect.escapeIdentifier(measure.name())
            : dialect.qualify(baseTop, measure.name());
        if (!measure.isComputed()) {
            return SqlFragment.of(base);
        }

        Measure.Compute compute = measure.compute();
        switch (compute.kind()) {
            case COUNT:
            case COUNT_DISTINCT:
                return SqlFragment.of(base);
            case PERCENT_OF_TOTAL: {
                if (compute.total() == null) {
                    throw new CompileInvariantException("Total of measure '" + compute.target()
                        + "' was not captured before plan building");
                }
                String value = comparisonTop == null
                    ? dialect.escapeIdentifier(compute.target())
                    : dialect.qualify(baseTop, compute.target());
                return SqlFragment.of("(" + dialect.safeDivide(value, "?") + ") * 100", compute.total());
            }
            case COMPARISON_VALUE:
            case COMPARISON_DELTA:
            case COMPARISON_RATIO: {
                if (comparisonTop == null) {
                    throw new CompileInvariantException("Comparison measure '" + measure.name()
                        + "' without comparison side");
                }
                String current = dialect.qualify(baseTop, compute.target());
                String previous = dialect.qualify(comparisonTop, compute.target());
                if (compute.kind() == Measure.Kind.COMPARISON_VALUE) {
                    return SqlFragment.of(previous);
                }
                if (compute.kind() == Measure.Kind.COMPARISON_DELTA) {
                    return SqlFragment.of("(" + current + " - " + previous + ")");
                }
                return SqlFragment.of(dialect.safeDivide(current + " - " + previous, previous));
            }
            default:
                throw new IllegalStateException("Unhandled compute kind: " + compute.kind());
        }
    }

    private void applyDisplayNames(PlanTree tree, SelectBlock root) {
        SelectBlock labelled = tree.newBlock().fromBlock(root.alias());
        Map<String, String> labels = new HashMap<>();
        for (FieldNode field : root.dimensions()) {
            String label = field.displayName() != null ? field.displayName() : field.name();
            labels.put(field.name(), label);
            labelled.addDimension(FieldNode.of(label, label, dialect.escapeIdentifier(field.name())));
        }
        for (FieldNode field : root.measures()) {
            String label = field.displayName() != null ? field.displayName() : field.name();
            labels.put(field.name(), label);
            labelled.addMeasure(FieldNode.of(label, label, dialect.escapeIdentifier(field.name())));
        }

        // Ordering of a derived table is not preserved, so it moves outwards
        List<OrderField> order = new ArrayList<>(root.orderBy());
        root.clearOrderBy();
        Map<String, String> escapedLabels = new HashMap<>();
        labels.forEach((name, label) ->
            escapedLabels.put(dialect.escapeIdentifier(name), dialect.escapeIdentifier(label)));
        for (OrderField field : order) {
            labelled.orderBy(new OrderField(
                escapedLabels.getOrDefault(field.expression(), field.expression()), field.descending()));
        }
        labelled.limit(root.limit()).offset(root.offset());
        root.limit(null).offset(null);
        tree.setRoot(labelled.alias());
    }

    /**
     * Combines the time-range bounds, the query filter and the security row
     * filter into one WHERE predicate.
     */
    private SqlFragment filter(Query query, TimeRange range, Expression where) {
        List<SqlFragment> parts = new ArrayList<>();
        if (range != null && range.hasBounds()) {
            if (view.timeDimension() == null) {
                throw new CompileInvariantException("Time range on metrics view '" + view.name()
                    + "' without time dimension");
            }
            String column = dialect.escapeIdentifier(view.timeDimension());
            if (range.start() != null) {
                parts.add(SqlFragment.of(column + " >= ?", range.start()));
            }
            if (range.end() != null) {
                parts.add(SqlFragment.of(column + " < ?", range.end()));
            }
        }
        ExpressionTranslator translator = translator(query, this::resolveDimension);
        if (where != null) {
            parts.add(translator.translate(where));
        }
        security.rowFilter().ifPresent(rowFilter -> parts.add(translator.translate(rowFilter)));
        return SqlFragment.and(parts);
    }

    private ExpressionTranslator translator(Query query, NameResolver resolver) {
        return new ExpressionTranslator(dialect, resolver, subquery -> compileSubquery(query, subquery));
    }

    private NameResolver aggregateResolver(SelectBlock block, Query query) {
        Map<String, SqlFragment> byName = new HashMap<>();
        for (Dimension dimension : query.dimensions()) {
            byName.put(dimension.outputName(), SqlFragment.of(dimensionSql(dimension, query.timeZone())));
        }
        for (FieldNode measure : block.measures()) {
            byName.put(measure.name(), measure.expression());
        }
        return name -> {
            SqlFragment resolved = byName.get(name);
            return resolved != null ? resolved : resolveDimension(name);
        };
    }

    /**
     * Builds a subquery as its own tree, selecting only its dimension so that
     * it can be the right-hand side of {@code IN}. Its measures appear only in
     * HAVING. The outer time range and the security row filter apply.
     */
    private SqlFragment compileSubquery(Query outer, SubqueryExpression subquery) {
        PlanTree subTree = new PlanTree();
        SelectBlock block = subTree.newBlock().fromTable(view.table());
        DimensionDefinition dimension = dimensionDef(subquery.dimension());
        block.addDimension(FieldNode.of(subquery.dimension(), dimension.displayName(), rawDimensionSql(dimension)));
        block.where(filter(outer, outer.timeRange(), subquery.where()));
        block.grouped(true);

        if (subquery.having() != null) {
            Map<String, SqlFragment> measures = new HashMap<>();
            for (String name : subquery.measures()) {
                MeasureDefinition def = measureDef(name);
                if (def.isDerived()) {
                    throw new UnsupportedFeatureException("derived measure '" + name + "' in subquery",
                        dialect.name());
                }
                measures.put(name, SqlFragment.of(def.expression()));
            }
            NameResolver resolver = name -> {
                SqlFragment resolved = measures.get(name);
                return resolved != null ? resolved : resolveDimension(name);
            };
            block.having(translator(outer, resolver).translate(subquery.having()));
        }
        subTree.setRoot(block.alias());
        return new SQLGenerator(dialect).generate(subTree);
    }

    private SqlFragment resolveDimension(String name) {
        return view.dimension(name).map(def -> SqlFragment.of(rawDimensionSql(def))).orElse(null);
    }

    private String dimensionSql(Dimension dimension, String timeZone) {
        String raw = rawDimensionSql(dimensionDef(dimension.name()));
        if (dimension.grain() == null) {
            return raw;
        }
        return dialect.dateTrunc(raw, dimension.grain(), timeZone,
            view.firstDayOfWeek(), view.firstMonthOfYear());
    }

    private String rawDimensionSql(DimensionDefinition def) {
        return def.column() != null ? dialect.escapeIdentifier(def.column()) : "(" + def.expression() + ")";
    }

    private String dimensionLabel(Dimension dimension) {
        return DisplayLabels.of(dimension, view);
    }

    private String measureLabel(Measure measure) {
        return DisplayLabels.of(measure, view);
    }

    private DimensionDefinition dimensionDef(String name) {
        return view.dimension(name).orElseThrow(() ->
            new CompileInvariantException("Unknown dimension '" + name + "' in metrics view '" + view.name() + "'"));
    }

    private MeasureDefinition measureDef(String name) {
        return view.measure(name).orElseThrow(() ->
            new CompileInvariantException("Unknown measure '" + name + "' in metrics view '" + view.name() + "'"));
    }
}
