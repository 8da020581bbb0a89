package com.metricsql.exception;

/**
 * Thrown when compilation is cancelled while a rewrite pass was waiting on an
 * external call. No stale or default value is ever substituted.
 */
public class CompilationCancelledException extends RewriteException {

    public CompilationCancelledException(String pass, Throwable cause) {
        super("Compilation cancelled", pass, cause);
    }

    @Override
    public String getUserMessage() {
        return "The query was cancelled before it could be compiled.";
    }
}
