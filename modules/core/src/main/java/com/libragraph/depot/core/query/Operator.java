package com.libragraph.depot.core.query;

/**
 * Comparison operators, keyed by their where-document keyword.
 */
public enum Operator {
    EQ("eq"),
    NE("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("inq"),
    NIN("nin");

    private final String keyword;

    Operator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isSetOperator() {
        return this == IN || this == NIN;
    }

    public boolean isOrdering() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    public static Operator fromKeyword(String keyword) {
        for (Operator op : values()) {
            if (op.keyword.equals(keyword)) return op;
        }
        throw new InvalidFilterException("Unknown filter operator: " + keyword);
    }
}
