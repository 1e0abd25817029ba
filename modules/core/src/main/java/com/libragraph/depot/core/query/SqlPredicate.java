package com.libragraph.depot.core.query;

import java.util.List;
import java.util.Objects;

/**
 * A SQL boolean expression with positional ({@code ?}) arguments, in order.
 */
public record SqlPredicate(String sql, List<Object> args) {

    public static final SqlPredicate TRUE = new SqlPredicate("TRUE", List.of());
    public static final SqlPredicate FALSE = new SqlPredicate("FALSE", List.of());

    public SqlPredicate {
        Objects.requireNonNull(sql, "sql cannot be null");
        // arguments may be SQL NULL
        args = java.util.Collections.unmodifiableList(new java.util.ArrayList<>(args));
    }
}
