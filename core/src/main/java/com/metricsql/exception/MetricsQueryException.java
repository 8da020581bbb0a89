package com.metricsql.exception;

/**
 * Base class for every failure raised while compiling a metrics query.
 *
 * <p>Compilation never emits partial SQL: a caller either receives a complete
 * statement with its argument list, or one of the subclasses below.
 *
 * <ul>
 *   <li>{@link ValidationException} - the query itself is malformed</li>
 *   <li>{@link RewriteException} - a rewrite pass failed</li>
 *   <li>{@link UnsupportedFeatureException} - the active dialect has no generator for a construct</li>
 *   <li>{@link CompileInvariantException} - an internal defect</li>
 * </ul>
 */
public abstract class MetricsQueryException extends RuntimeException {

    protected MetricsQueryException(String message) {
        super(message);
    }

    protected MetricsQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a short message suitable for showing to the author of the query.
     *
     * @return user-facing message
     */
    public abstract String getUserMessage();

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
