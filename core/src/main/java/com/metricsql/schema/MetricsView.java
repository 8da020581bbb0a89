package com.metricsql.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only binding of dimension and measure names to a base table.
 *
 * <p>Loaded once by an external schema loader and shared by concurrent
 * compilations; nothing in the compiler mutates it.
 */
public final class MetricsView {

    private final String name;
    private final String table;
    private final String timeDimension;
    private final Map<String, DimensionDefinition> dimensions;
    private final Map<String, MeasureDefinition> measures;
    private final int firstDayOfWeek;
    private final int firstMonthOfYear;

    private MetricsView(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.table = Objects.requireNonNull(b.table, "table must not be null");
        this.timeDimension = b.timeDimension;
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.dimensions));
        this.measures = Collections.unmodifiableMap(new LinkedHashMap<>(b.measures));
        if (b.firstDayOfWeek < 1 || b.firstDayOfWeek > 7) {
            throw new IllegalArgumentException("firstDayOfWeek must be between 1 and 7: " + b.firstDayOfWeek);
        }
        if (b.firstMonthOfYear < 1 || b.firstMonthOfYear > 12) {
            throw new IllegalArgumentException("firstMonthOfYear must be between 1 and 12: " + b.firstMonthOfYear);
        }
        this.firstDayOfWeek = b.firstDayOfWeek;
        this.firstMonthOfYear = b.firstMonthOfYear;
    }

    public static Builder builder(String name, String table) {
        return new Builder(name, table);
    }

    public String name() {
        return name;
    }

    public String table() {
        return table;
    }

    /**
     * Returns the time column, or null if the view has none.
     *
     * @return the time dimension column name
     */
    public String timeDimension() {
        return timeDimension;
    }

    /**
     * Looks up a dimension. The time dimension is addressable as a column
     * dimension even when it is not declared explicitly.
     *
     * @param dimension the dimension name
     * @return the definition, or empty if unknown
     */
    public Optional<DimensionDefinition> dimension(String dimension) {
        DimensionDefinition def = dimensions.get(dimension);
        if (def == null && timeDimension != null && timeDimension.equals(dimension)) {
            return Optional.of(DimensionDefinition.column(timeDimension, timeDimension));
        }
        return Optional.ofNullable(def);
    }

    public Optional<MeasureDefinition> measure(String measure) {
        return Optional.ofNullable(measures.get(measure));
    }

    public Collection<DimensionDefinition> dimensions() {
        return dimensions.values();
    }

    public Collection<MeasureDefinition> measures() {
        return measures.values();
    }

    public int firstDayOfWeek() {
        return firstDayOfWeek;
    }

    public int firstMonthOfYear() {
        return firstMonthOfYear;
    }

    @Override
    public String toString() {
        return "MetricsView(" + name + ", table=" + table + ")";
    }

    /**
     * Builder for {@link MetricsView}.
     */
    public static final class Builder {
        private final String name;
        private final String table;
        private String timeDimension;
        private final Map<String, DimensionDefinition> dimensions = new LinkedHashMap<>();
        private final Map<String, MeasureDefinition> measures = new LinkedHashMap<>();
        private int firstDayOfWeek = 1;
        private int firstMonthOfYear = 1;

        private Builder(String name, String table) {
            this.name = name;
            this.table = table;
        }

        public Builder timeDimension(String column) {
            this.timeDimension = column;
            return this;
        }

        public Builder dimension(DimensionDefinition dimension) {
            dimensions.put(dimension.name(), dimension);
            return this;
        }

        public Builder measure(MeasureDefinition measure) {
            measures.put(measure.name(), measure);
            return this;
        }

        public Builder firstDayOfWeek(int day) {
            this.firstDayOfWeek = day;
            return this;
        }

        public Builder firstMonthOfYear(int month) {
            this.firstMonthOfYear = month;
            return this;
        }

        public MetricsView build() {
            return new MetricsView(this);
        }
    }
}
