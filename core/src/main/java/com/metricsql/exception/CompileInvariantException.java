package com.metricsql.exception;

/**
 * Signals a defect in the compiler: an internal invariant was violated, for
 * example a name that passed validation failed to resolve during plan building.
 *
 * <p>Never caused by user input alone. Logged at ERROR by the compiler so that it
 * can be told apart from user errors.
 */
public class CompileInvariantException extends MetricsQueryException {

    public CompileInvariantException(String message) {
        super(message);
    }

    public CompileInvariantException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getUserMessage() {
        return "Internal error while compiling the query. Please contact support.";
    }
}
