package com.metricsql.expression;

/**
 * Closed set of condition operators.
 */
public enum Operator {
    EQ("eq", "="),
    NEQ("neq", "!="),
    LT("lt", "<"),
    LTE("lte", "<="),
    GT("gt", ">"),
    GTE("gte", ">="),
    IN("in", "IN"),
    NIN("nin", "NOT IN"),
    ILIKE("ilike", "ILIKE"),
    NILIKE("nilike", "NOT ILIKE"),
    LIKE("like", "LIKE"),
    NLIKE("nlike", "NOT LIKE"),
    AND("and", "AND"),
    OR("or", "OR");

    private final String code;
    private final String symbol;

    Operator(String code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public String code() {
        return code;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return this == EQ || this == NEQ || this == LT || this == LTE || this == GT || this == GTE;
    }

    public boolean isLike() {
        return this == LIKE || this == NLIKE || this == ILIKE || this == NILIKE;
    }

    public boolean isMembership() {
        return this == IN || this == NIN;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * Returns whether this operator negates its base form (neq, nin, nlike, nilike).
     *
     * @return true for negated operators
     */
    public boolean isNegated() {
        return this == NEQ || this == NIN || this == NLIKE || this == NILIKE;
    }

    /**
     * Looks up an operator by its wire code.
     *
     * @param code the code, e.g. {@code "nilike"}
     * @return the operator
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Operator fromCode(String code) {
        for (Operator op : values()) {
            if (op.code.equals(code)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: '" + code + "'");
    }
}
