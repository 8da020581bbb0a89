package com.metricsql.exception;

/**
 * Thrown when a rewrite pass fails. The originating pass is always recorded.
 */
public class RewriteException extends MetricsQueryException {

    private final String pass;

    public RewriteException(String message, String pass) {
        super(message + " (pass: " + pass + ")");
        this.pass = pass;
    }

    public RewriteException(String message, String pass, Throwable cause) {
        super(message + " (pass: " + pass + ")", cause);
        this.pass = pass;
    }

    /**
     * Returns the name of the rewrite pass that failed.
     *
     * @return the pass name
     */
    public String pass() {
        return pass;
    }

    @Override
    public String getUserMessage() {
        return "Failed to prepare the query in step '" + pass + "'. " +
               "Please simplify your query or contact support.";
    }
}
