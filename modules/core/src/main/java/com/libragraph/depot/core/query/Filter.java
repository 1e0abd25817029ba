package com.libragraph.depot.core.query;

import com.libragraph.depot.types.FileField;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Store-independent filter expression over file version fields.
 *
 * <p>Translated to a store's native predicate by a {@link QueryTranslator}.
 */
public interface Filter {

    /** Matches every record. */
    record All() implements Filter {}

    record Comparison(FieldRef field, Operator operator, Object value) implements Filter {
        public Comparison {
            Objects.requireNonNull(field, "field cannot be null");
            Objects.requireNonNull(operator, "operator cannot be null");
            if (operator.isSetOperator()) {
                if (!(value instanceof Collection<?> values)) {
                    throw new InvalidFilterException(
                            "Operator " + operator.keyword() + " on " + field + " needs a list");
                }
                // set values may legitimately contain null
                value = Collections.unmodifiableList(new ArrayList<>(values));
            }
        }
    }

    record And(List<Filter> filters) implements Filter {
        public And {
            filters = List.copyOf(filters);
        }
    }

    record Or(List<Filter> filters) implements Filter {
        public Or {
            filters = List.copyOf(filters);
        }
    }

    // -- factories --

    static Filter all() {
        return new All();
    }

    static Filter compare(FieldRef field, Operator operator, Object value) {
        return new Comparison(field, operator, value);
    }

    static Filter eq(FileField field, Object value) {
        return compare(FieldRef.of(field), Operator.EQ, value);
    }

    static Filter in(FileField field, Collection<?> values) {
        return compare(FieldRef.of(field), Operator.IN, values);
    }

    static Filter notIn(FileField field, Collection<?> values) {
        return compare(FieldRef.of(field), Operator.NIN, values);
    }

    static Filter container(String container) {
        return eq(FileField.CONTAINER, container);
    }

    /** Versions of one {@code container + filename} lineage. */
    static Filter lineage(String container, String filename) {
        return and(container(container), eq(FileField.FILENAME, filename));
    }

    /**
     * Conjunction that drops nulls and match-all operands; collapses to the
     * single remaining operand, or to match-all when none remain.
     */
    static Filter and(Filter... filters) {
        List<Filter> operands = new ArrayList<>();
        for (Filter f : Arrays.asList(filters)) {
            if (f != null && !(f instanceof All)) operands.add(f);
        }
        if (operands.isEmpty()) return all();
        if (operands.size() == 1) return operands.get(0);
        return new And(operands);
    }

    static Filter or(Filter... filters) {
        return new Or(Arrays.asList(filters));
    }
}
