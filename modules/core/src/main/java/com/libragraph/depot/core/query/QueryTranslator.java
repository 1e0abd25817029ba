package com.libragraph.depot.core.query;

import com.libragraph.depot.util.FileId;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Converts a {@link Filter} into a store's native predicate form {@code P}.
 *
 * <p>Subclasses only build native fragments; this base class walks the
 * expression and normalizes values first:
 * <ul>
 *   <li>{@code id} strings become {@link FileId}, or fail with {@link InvalidIdentifierException}</li>
 *   <li>{@code uploadedAt} ISO-8601 strings, epoch millis and dates become {@link Instant}</li>
 *   <li>{@code length} becomes a {@code Long}</li>
 * </ul>
 * A null filter translates to match-all. Implementations hold no mutable state.
 */
public abstract class QueryTranslator<P> {

    public final P translate(Filter filter) {
        if (filter == null || filter instanceof Filter.All) {
            return matchAll();
        }
        if (filter instanceof Filter.And and) {
            if (and.filters().isEmpty()) return matchAll();
            return and(translateEach(and.filters()));
        }
        if (filter instanceof Filter.Or or) {
            if (or.filters().isEmpty()) return matchNone();
            return or(translateEach(or.filters()));
        }
        if (filter instanceof Filter.Comparison c) {
            return compare(c.field(), c.operator(), normalize(c.field(), c.operator(), c.value()));
        }
        throw new InvalidFilterException("Unsupported filter: " + filter.getClass().getName());
    }

    protected abstract P matchAll();

    protected abstract P matchNone();

    protected abstract P and(List<P> operands);

    protected abstract P or(List<P> operands);

    /**
     * Builds one comparison. {@code value} is already normalized; for IN/NIN it is a
     * {@code List} of normalized elements.
     */
    protected abstract P compare(FieldRef field, Operator operator, Object value);

    private List<P> translateEach(List<Filter> filters) {
        List<P> out = new ArrayList<>(filters.size());
        for (Filter f : filters) {
            out.add(translate(f));
        }
        return out;
    }

    static Object normalize(FieldRef field, Operator operator, Object value) {
        if (operator.isSetOperator()) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                converted.add(normalizeScalar(field, element));
            }
            return converted;
        }
        return normalizeScalar(field, value);
    }

    private static Object normalizeScalar(FieldRef field, Object value) {
        return switch (field.field()) {
            case ID -> toFileId(value);
            case UPLOADED_AT -> toInstant(value);
            case LENGTH -> toLong(field, value);
            case FILENAME, CONTAINER, CONTENT_TYPE -> toText(field, value);
            case METADATA -> value;
        };
    }

    private static FileId toFileId(Object value) {
        if (value instanceof FileId id) {
            return id;
        }
        String text = String.valueOf(value);
        try {
            return FileId.parse(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidIdentifierException(text, e);
        }
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) return instant;
        if (value instanceof Date date) return date.toInstant();
        if (value instanceof Number millis) return Instant.ofEpochMilli(millis.longValue());
        if (value instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new InvalidFilterException("Invalid timestamp: " + text, e);
            }
        }
        throw new InvalidFilterException("Invalid timestamp value: " + value);
    }

    private static Long toLong(FieldRef field, Object value) {
        if (value instanceof Number n) return n.longValue();
        if (value instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new InvalidFilterException("Invalid number for " + field + ": " + text, e);
            }
        }
        throw new InvalidFilterException("Invalid number for " + field + ": " + value);
    }

    private static String toText(FieldRef field, Object value) {
        if (value == null) {
            throw new InvalidFilterException("Field " + field + " cannot be compared with null");
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new InvalidFilterException("Invalid value for " + field + ": " + value);
    }
}
