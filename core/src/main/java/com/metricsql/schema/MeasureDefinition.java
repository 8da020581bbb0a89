package com.metricsql.schema;

import java.util.List;
import java.util.Objects;

/**
 * A measure of a metrics view.
 *
 * <p>A {@link Type#SIMPLE} measure is an aggregate over table columns, such as
 * {@code SUM(views)}. A {@link Type#DERIVED} measure is a non-aggregate expression
 * over other measures, referenced by name, such as {@code revenue / orders}; its
 * {@code referencedMeasures} lists the names it uses.
 */
public record MeasureDefinition(String name, String displayName, String expression,
                                Type type, List<String> referencedMeasures) {

    /**
     * Measure categories.
     */
    public enum Type { SIMPLE, DERIVED }

    public MeasureDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(type, "type must not be null");
        referencedMeasures = referencedMeasures == null ? List.of() : List.copyOf(referencedMeasures);
        if (type == Type.DERIVED && referencedMeasures.isEmpty()) {
            throw new IllegalArgumentException("derived measure '" + name + "' must reference other measures");
        }
        if (displayName == null) {
            displayName = name;
        }
    }

    public static MeasureDefinition simple(String name, String expression) {
        return new MeasureDefinition(name, null, expression, Type.SIMPLE, List.of());
    }

    public static MeasureDefinition derived(String name, String expression, String... references) {
        return new MeasureDefinition(name, null, expression, Type.DERIVED, List.of(references));
    }

    public MeasureDefinition withDisplayName(String label) {
        return new MeasureDefinition(name, label, expression, type, referencedMeasures);
    }

    public boolean isDerived() {
        return type == Type.DERIVED;
    }
}
