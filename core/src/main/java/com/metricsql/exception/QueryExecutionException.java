package com.metricsql.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thrown when a nested query issued during compilation fails on the backend,
 * such as the grand-total query of a percent-of-total measure.
 *
 * <p>Carries the failed SQL and its arguments, and translates common DuckDB
 * errors into user-facing messages.
 */
public class QueryExecutionException extends MetricsQueryException {

    private static final Pattern MISSING_COLUMN = Pattern.compile("column \"([^\"]+)\" not found");
    private static final Pattern MISSING_TABLE = Pattern.compile("Table with name ([^ ]+) does not exist");

    private final String failedSQL;
    private final List<Object> args;

    public QueryExecutionException(String message, Throwable cause, String sql, List<Object> args) {
        super(message, cause);
        this.failedSQL = sql;
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    public List<Object> getArgs() {
        return args;
    }

    @Override
    public String getUserMessage() {
        String message = getMessage();
        if (message == null) {
            return "A query needed to compile your request failed.";
        }
        if (message.contains("Binder Error")) {
            Matcher matcher = MISSING_COLUMN.matcher(message);
            if (matcher.find()) {
                return "Column '" + matcher.group(1) + "' used by the metrics view does not exist.";
            }
        }
        if (message.contains("Catalog Error")) {
            Matcher matcher = MISSING_TABLE.matcher(message);
            if (matcher.find()) {
                return "Table " + matcher.group(1) + " of the metrics view does not exist.";
            }
            return "The metrics view refers to a missing table.";
        }
        if (message.contains("Conversion Error")) {
            return "A filter value does not match the type of its column.";
        }
        if (message.contains("INTERRUPT") || message.contains("Interrupted")) {
            return "The query was cancelled or timed out.";
        }
        return "A query needed to compile your request failed: " + message;
    }

    @Override
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder(super.getTechnicalMessage());
        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
            sb.append("Args: ").append(args).append("\n");
        }
        return sb.toString();
    }
}
