package com.libragraph.depot.core.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON-style where documents into {@link Filter} expressions.
 *
 * <pre>
 * {"filename": "a.txt"}                              equality
 * {"uploadedAt": {"gte": "2024-01-01T00:00:00Z"}}    operator object
 * {"metadata.tag": {"inq": ["x", "y"]}}              set membership
 * {"or": [{"filename": "a"}, {"filename": "b"}]}     boolean lists
 * </pre>
 *
 * Multiple keys in one document are AND-ed, as are multiple operators on one field.
 */
public final class WhereParser {

    private static final String AND = "and";
    private static final String OR = "or";

    private WhereParser() {}

    /** Parses a where document; null or empty yields match-all. */
    public static Filter parse(Map<String, ?> where) {
        if (where == null || where.isEmpty()) {
            return Filter.all();
        }
        List<Filter> terms = new ArrayList<>();
        for (Map.Entry<String, ?> entry : where.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (AND.equals(key)) {
                terms.add(Filter.and(parseList(key, value).toArray(Filter[]::new)));
            } else if (OR.equals(key)) {
                List<Filter> branches = parseList(key, value);
                terms.add(branches.size() == 1 ? branches.get(0) : Filter.or(branches.toArray(Filter[]::new)));
            } else {
                terms.add(parseField(key, value));
            }
        }
        return Filter.and(terms.toArray(Filter[]::new));
    }

    private static List<Filter> parseList(String key, Object value) {
        if (!(value instanceof Collection<?> items)) {
            throw new InvalidFilterException("'" + key + "' needs a list of where documents");
        }
        List<Filter> out = new ArrayList<>(items.size());
        for (Object item : items) {
            out.add(parse(asDocument(key, item)));
        }
        return out;
    }

    private static Filter parseField(String path, Object value) {
        FieldRef field = FieldRef.parse(path);
        if (!(value instanceof Map<?, ?> ops)) {
            return Filter.compare(field, Operator.EQ, value);
        }
        if (ops.isEmpty()) {
            throw new InvalidFilterException("Empty operator object for " + path);
        }
        List<Filter> terms = new ArrayList<>(ops.size());
        for (Map.Entry<?, ?> op : ops.entrySet()) {
            Operator operator = Operator.fromKeyword(String.valueOf(op.getKey()));
            terms.add(Filter.compare(field, operator, op.getValue()));
        }
        return Filter.and(terms.toArray(Filter[]::new));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asDocument(String key, Object item) {
        if (item instanceof Map<?, ?> map) {
            for (Object k : map.keySet()) {
                if (!(k instanceof String)) {
                    throw new InvalidFilterException("Non-string key in '" + key + "' document: " + k);
                }
            }
            return (Map<String, ?>) map;
        }
        throw new InvalidFilterException("'" + key + "' items must be where documents, got: " + item);
    }
}
