package com.metricsql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL text with the positional arguments its {@code ?} placeholders
 * bind to, in text order.
 */
public record SqlFragment(String sql, List<Object> args) {

    public SqlFragment {
        Objects.requireNonNull(sql, "sql must not be null");
        // Arguments may be null (a bound SQL NULL)
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static SqlFragment of(String sql) {
        return new SqlFragment(sql, List.of());
    }

    public static SqlFragment of(String sql, Object... args) {
        List<Object> list = new ArrayList<>(args.length);
        Collections.addAll(list, args);
        return new SqlFragment(sql, list);
    }

    /**
     * Joins non-null fragments with {@code AND}, preserving argument order.
     *
     * @param parts the fragments, nulls are skipped
     * @return the conjunction, or null if no fragment was given
     */
    public static SqlFragment and(List<SqlFragment> parts) {
        StringBuilder sql = new StringBuilder();
        List<Object> args = new ArrayList<>();
        for (SqlFragment part : parts) {
            if (part == null) {
                continue;
            }
            if (sql.length() > 0) {
                sql.append(" AND ");
            }
            sql.append(part.sql());
            args.addAll(part.args());
        }
        return sql.length() == 0 ? null : new SqlFragment(sql.toString(), args);
    }

    @Override
    public String toString() {
        return args.isEmpty() ? sql : sql + " " + args;
    }
}
