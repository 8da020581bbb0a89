package com.metricsql.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler settings shared by all compilations.
 *
 * <p>Read from system properties by {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code metricsql.rowCap} - maximum rows a query may return; 0 disables the cap,
 *       unset falls back to the dialect's default</li>
 *   <li>{@code metricsql.allowApproximateComparisons} - allow one-sided comparison joins</li>
 *   <li>{@code metricsql.dialect} - default dialect name</li>
 * </ul>
 * Invalid values are logged and replaced by the default.
 */
public final class CompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    public static final String PROP_ROW_CAP = "metricsql.rowCap";

    /** Largest row cap; the capped limit is {@code cap + 1}. */
    public static final long MAX_ROW_CAP = Long.MAX_VALUE - 1;
    public static final String PROP_ALLOW_APPROXIMATE_COMPARISONS = "metricsql.allowApproximateComparisons";
    public static final String PROP_DIALECT = "metricsql.dialect";

    public static final String DEFAULT_DIALECT = "duckdb";

    private final Long rowCap;
    private final boolean allowApproximateComparisons;
    private final String dialect;

    private CompilerConfig(Builder builder) {
        this.rowCap = builder.rowCap;
        this.allowApproximateComparisons = builder.allowApproximateComparisons;
        this.dialect = builder.dialect;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CompilerConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from system properties.
     *
     * @return the configuration
     */
    public static CompilerConfig fromSystemProperties() {
        return builder()
            .rowCap(getConfiguredRowCap())
            .allowApproximateComparisons(Boolean.parseBoolean(
                System.getProperty(PROP_ALLOW_APPROXIMATE_COMPARISONS, "false").trim()))
            .dialect(System.getProperty(PROP_DIALECT, DEFAULT_DIALECT).trim())
            .build();
    }

    /**
     * Returns the configured row cap, or null to use the dialect default.
     *
     * @return the cap
     */
    public Long rowCap() {
        return rowCap;
    }

    public boolean allowApproximateComparisons() {
        return allowApproximateComparisons;
    }

    public String dialect() {
        return dialect;
    }

    private static Long getConfiguredRowCap() {
        String value = System.getProperty(PROP_ROW_CAP);
        if (value != null) {
            try {
                long cap = Long.parseLong(value.trim());
                if (cap >= 0 && cap <= MAX_ROW_CAP) {
                    return cap;
                }
                logger.warn("Ignoring out of range {}={}", PROP_ROW_CAP, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}", PROP_ROW_CAP, value);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "CompilerConfig(rowCap=" + rowCap + ", allowApproximateComparisons="
            + allowApproximateComparisons + ", dialect=" + dialect + ")";
    }

    /**
     * Builder for {@link CompilerConfig}.
     */
    public static final class Builder {
        private Long rowCap;
        private boolean allowApproximateComparisons;
        private String dialect = DEFAULT_DIALECT;

        private Builder() {
        }

        public Builder rowCap(Long cap) {
            if (cap != null && cap < 0) {
                throw new IllegalArgumentException("rowCap must be non-negative: " + cap);
            }
            if (cap != null && cap > MAX_ROW_CAP) {
                throw new IllegalArgumentException("rowCap must be at most " + MAX_ROW_CAP + ": " + cap);
            }
            this.rowCap = cap;
            return this;
        }

        public Builder allowApproximateComparisons(boolean allow) {
            this.allowApproximateComparisons = allow;
            return this;
        }

        public Builder dialect(String name) {
            this.dialect = name;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}
