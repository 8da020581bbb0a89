package com.metricsql.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Result of a compilation: dialect SQL, its positional arguments in placeholder
 * order, and the row cap enforced on it, if any.
 */
public final class CompiledQuery {

    private final String sql;
    private final List<Object> args;
    private final OptionalLong rowCap;

    public CompiledQuery(String sql, List<Object> args, OptionalLong rowCap) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.rowCap = rowCap == null ? OptionalLong.empty() : rowCap;
    }

    public String sql() {
        return sql;
    }

    public List<Object> args() {
        return args;
    }

    /**
     * Returns the cap applied by row-cap enforcement. When present the query
     * selects one row more than the cap so that callers can detect truncation.
     *
     * @return the cap, or empty if the query is not capped
     */
    public OptionalLong rowCap() {
        return rowCap;
    }

    /**
     * Returns whether a result of the given size exceeded the row cap. Callers
     * should then drop the extra row and report the result as truncated.
     *
     * @param rowCount number of rows the backend returned
     * @return true if the result was cut off by the cap
     */
    public boolean isTruncated(long rowCount) {
        return rowCap.isPresent() && rowCount > rowCap.getAsLong();
    }

    @Override
    public String toString() {
        return "CompiledQuery(" + sql + ", args=" + args + ")";
    }
}
