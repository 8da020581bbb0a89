package com.metricsql.exception;

/**
 * Thrown when a query fails validation, before any rewrite pass runs.
 *
 * <p>The exception names the offending field (for example {@code sort[1].name}
 * or {@code where.condition.exprs[0]}) so that callers can point the user at it.
 */
public class ValidationException extends MetricsQueryException {

    private final String field;

    /**
     * Creates a validation exception.
     *
     * @param message what is wrong
     * @param field the path of the offending query field
     */
    public ValidationException(String message, String field) {
        super(message + " (field: " + field + ")");
        this.field = field;
    }

    /**
     * Returns the path of the field that failed validation.
     *
     * @return the field path
     */
    public String field() {
        return field;
    }

    @Override
    public String getUserMessage() {
        return "Invalid query at '" + field + "'. Please correct the query and retry.";
    }
}
