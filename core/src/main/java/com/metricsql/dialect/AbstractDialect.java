package com.metricsql.dialect;

import com.metricsql.logical.JoinKind;

/**
 * Shared defaults for ANSI-leaning backends: double-quoted identifiers,
 * {@code LIMIT n OFFSET m}, standard join keywords and null-safe join predicates.
 *
 * <p>Backends override only the hooks where their syntax differs.
 */
public abstract class AbstractDialect implements Dialect {

    @Override
    public String escapeIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        // Escape double quotes by doubling them (SQL standard)
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String escapeTable(String table) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        if (table.contains(";") || table.contains("--")) {
            throw new IllegalArgumentException("Table name contains invalid characters: " + table);
        }
        String[] parts = table.split("\\.");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(escapeIdentifier(parts[i]));
        }
        return sb.toString();
    }

    @Override
    public String joinOnExpression(String left, String right) {
        return left + " IS NOT DISTINCT FROM " + right;
    }

    @Override
    public String safeDivide(String numerator, String denominator) {
        return "(" + numerator + ") / NULLIF(" + denominator + ", 0)";
    }

    @Override
    public String firstValueAggregate(String expr) {
        return "ANY_VALUE(" + expr + ")";
    }

    @Override
    public boolean groupByOrdinals() {
        return false;
    }

    @Override
    public String joinKeyword(JoinKind kind) {
        switch (kind) {
            case INNER:
                return "INNER JOIN";
            case LEFT:
                return "LEFT OUTER JOIN";
            case RIGHT:
                return "RIGHT OUTER JOIN";
            case FULL:
                return "FULL OUTER JOIN";
            default:
                throw new IllegalStateException("Unsupported join kind: " + kind);
        }
    }

    @Override
    public String limitClause(Long limit, Long offset) {
        StringBuilder sb = new StringBuilder();
        if (limit != null) {
            sb.append("LIMIT ").append(limit);
        }
        if (offset != null && offset > 0) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("OFFSET ").append(offset);
        }
        return sb.toString();
    }

    @Override
    public long defaultRowCap() {
        return 0;
    }

    /**
     * Quotes a string literal that is part of generated syntax (time zone names,
     * unit keywords). User values are always bound as arguments instead.
     *
     * @param value the value
     * @return the quoted literal
     */
    protected static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Returns the time zone to use, treating null and UTC alike.
     *
     * @param timeZone the requested zone
     * @return the zone id, or null for UTC
     */
    protected static String effectiveZone(String timeZone) {
        if (timeZone == null || timeZone.isEmpty() || timeZone.equals("UTC") || timeZone.equals("Etc/UTC")) {
            return null;
        }
        return timeZone;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name() + ")";
    }
}
