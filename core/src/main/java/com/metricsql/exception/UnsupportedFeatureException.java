package com.metricsql.exception;

/**
 * Thrown while building a plan when a construct has no generator for the
 * active dialect. The construct is never silently downgraded.
 */
public class UnsupportedFeatureException extends MetricsQueryException {

    private final String feature;
    private final String dialect;

    /**
     * Creates an unsupported-feature exception.
     *
     * @param feature the construct that cannot be generated
     * @param dialect the dialect name, or null when the feature is unsupported everywhere
     */
    public UnsupportedFeatureException(String feature, String dialect) {
        super(dialect == null
            ? "Unsupported feature: " + feature
            : "Unsupported feature for dialect " + dialect + ": " + feature);
        this.feature = feature;
        this.dialect = dialect;
    }

    public String feature() {
        return feature;
    }

    public String dialect() {
        return dialect;
    }

    @Override
    public String getUserMessage() {
        if (dialect == null) {
            return "The query uses " + feature + ", which is not supported.";
        }
        return "The query uses " + feature + ", which is not available for " + dialect + ".";
    }
}
