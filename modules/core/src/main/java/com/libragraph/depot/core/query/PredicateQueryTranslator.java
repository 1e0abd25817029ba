package com.libragraph.depot.core.query;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.util.FileId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Translates filters into in-process predicates over {@link FileVersion} records.
 *
 * <p>Semantics match {@link SqlQueryTranslator}: numbers compare numerically
 * whatever their boxed type, ordering against a missing or mistyped metadata
 * value never matches, and NE/NIN match when the metadata key is absent.
 */
public class PredicateQueryTranslator extends QueryTranslator<Predicate<FileVersion>> {

    private static final int NOT_COMPARABLE = Integer.MIN_VALUE;

    @Override
    protected Predicate<FileVersion> matchAll() {
        return v -> true;
    }

    @Override
    protected Predicate<FileVersion> matchNone() {
        return v -> false;
    }

    @Override
    protected Predicate<FileVersion> and(List<Predicate<FileVersion>> operands) {
        return v -> operands.stream().allMatch(p -> p.test(v));
    }

    @Override
    protected Predicate<FileVersion> or(List<Predicate<FileVersion>> operands) {
        return v -> operands.stream().anyMatch(p -> p.test(v));
    }

    @Override
    protected Predicate<FileVersion> compare(FieldRef field, Operator operator, Object value) {
        if (operator.isOrdering() && value == null) {
            throw new InvalidFilterException("Cannot order " + field + " against null");
        }
        return v -> {
            boolean present = !field.isMetadata() || v.metadata().containsKey(field.key());
            Object actual = read(v, field);
            if (operator.isOrdering()) {
                int cmp = present ? order(actual, value) : NOT_COMPARABLE;
                if (cmp == NOT_COMPARABLE) return false;
                return switch (operator) {
                    case GT -> cmp > 0;
                    case GTE -> cmp >= 0;
                    case LT -> cmp < 0;
                    default -> cmp <= 0;
                };
            }
            return switch (operator) {
                case EQ -> present && same(actual, value);
                case NE -> !present || !same(actual, value);
                case IN -> present && ((List<?>) value).stream().anyMatch(x -> same(actual, x));
                default -> !present || ((List<?>) value).stream().noneMatch(x -> same(actual, x));
            };
        };
    }

    private static Object read(FileVersion v, FieldRef field) {
        return switch (field.field()) {
            case ID -> v.id();
            case FILENAME -> v.filename();
            case CONTAINER -> v.container();
            case UPLOADED_AT -> v.uploadedAt();
            case LENGTH -> v.length();
            case CONTENT_TYPE -> v.contentType();
            case METADATA -> v.metadata().get(field.key());
        };
    }

    private static boolean same(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return decimal(a).compareTo(decimal(e)) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Compares two values of compatible types; {@link #NOT_COMPARABLE} otherwise.
     * Numbers compare numerically, anything against a string compares as text.
     * Identifiers, instants and booleans only order against their own type.
     */
    private static int order(Object actual, Object expected) {
        if (actual == null) {
            return NOT_COMPARABLE;
        }
        int cmp;
        if (expected instanceof Number e) {
            if (!(actual instanceof Number a)) return NOT_COMPARABLE;
            cmp = decimal(a).compareTo(decimal(e));
        } else if (expected instanceof String e) {
            cmp = String.valueOf(actual).compareTo(e);
        } else if (expected instanceof FileId e) {
            if (!(actual instanceof FileId a)) return NOT_COMPARABLE;
            cmp = a.compareTo(e);
        } else if (expected instanceof Instant e) {
            if (!(actual instanceof Instant a)) return NOT_COMPARABLE;
            cmp = a.compareTo(e);
        } else if (expected instanceof Boolean e) {
            if (!(actual instanceof Boolean a)) return NOT_COMPARABLE;
            cmp = a.compareTo(e);
        } else {
            return NOT_COMPARABLE;
        }
        return Integer.signum(cmp);
    }

    private static BigDecimal decimal(Number n) {
        return n instanceof BigDecimal bd ? bd : new BigDecimal(n.toString());
    }
}
