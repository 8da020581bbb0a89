package com.metricsql.schema;

import com.metricsql.exception.CompileInvariantException;
import com.metricsql.query.Dimension;
import com.metricsql.query.Measure;

/**
 * Output labels used when a query asks for display names.
 */
public final class DisplayLabels {

    private DisplayLabels() {
    }

    /**
     * Label of a requested dimension: its alias, or the view's display name.
     */
    public static String of(Dimension dimension, MetricsView view) {
        if (dimension.alias() != null) {
            return dimension.alias();
        }
        return dimensionDef(dimension.name(), view).displayName();
    }

    /**
     * Label of a requested measure. Computed measures are labelled after
     * their target.
     */
    public static String of(Measure measure, MetricsView view) {
        if (!measure.isComputed()) {
            return measureDef(measure.name(), view).displayName();
        }
        Measure.Compute compute = measure.compute();
        switch (compute.kind()) {
            case COUNT:
                return "Count";
            case COUNT_DISTINCT:
                return "Unique " + dimensionDef(compute.target(), view).displayName();
            case COMPARISON_VALUE:
                return measureDef(compute.target(), view).displayName() + " (previous)";
            case COMPARISON_DELTA:
                return measureDef(compute.target(), view).displayName() + " (change)";
            case COMPARISON_RATIO:
                return measureDef(compute.target(), view).displayName() + " (change %)";
            case PERCENT_OF_TOTAL:
                return measureDef(compute.target(), view).displayName() + " (% of total)";
            default:
                throw new IllegalStateException("Unhandled compute kind: " + compute.kind());
        }
    }

    private static DimensionDefinition dimensionDef(String name, MetricsView view) {
        return view.dimension(name).orElseThrow(() ->
            new CompileInvariantException("Unknown dimension '" + name + "' in metrics view '" + view.name() + "'"));
    }

    private static MeasureDefinition measureDef(String name, MetricsView view) {
        return view.measure(name).orElseThrow(() ->
            new CompileInvariantException("Unknown measure '" + name + "' in metrics view '" + view.name() + "'"));
    }
}
