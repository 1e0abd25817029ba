package com.libragraph.depot.core.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.depot.types.FileField;
import com.libragraph.depot.util.FileId;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Translates filters into {@code WHERE} fragments over the {@code depot_file} table.
 *
 * <p>Fixed fields map to columns. Metadata keys address the {@code metadata jsonb}
 * column: equality compares jsonb values, ordering compares numbers numerically
 * and everything else as text. NE and NIN also match rows where the key is absent.
 */
public class SqlQueryTranslator extends QueryTranslator<SqlPredicate> {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    protected SqlPredicate matchAll() {
        return SqlPredicate.TRUE;
    }

    @Override
    protected SqlPredicate matchNone() {
        return SqlPredicate.FALSE;
    }

    @Override
    protected SqlPredicate and(List<SqlPredicate> operands) {
        return join(operands, " AND ");
    }

    @Override
    protected SqlPredicate or(List<SqlPredicate> operands) {
        return join(operands, " OR ");
    }

    @Override
    protected SqlPredicate compare(FieldRef field, Operator operator, Object value) {
        return field.isMetadata()
                ? compareMetadata(field.key(), operator, value)
                : compareColumn(column(field.field()), operator, value);
    }

    static String column(FileField field) {
        return switch (field) {
            case ID -> "id";
            case FILENAME -> "filename";
            case CONTAINER -> "container";
            case UPLOADED_AT -> "upload_date";
            case LENGTH -> "length";
            case CONTENT_TYPE -> "content_type";
            case METADATA -> "metadata";
        };
    }

    private SqlPredicate compareColumn(String column, Operator operator, Object value) {
        return switch (operator) {
            case EQ -> new SqlPredicate(column + " = ?", List.of(arg(value)));
            case NE -> new SqlPredicate(column + " <> ?", List.of(arg(value)));
            case GT -> new SqlPredicate(column + " > ?", List.of(arg(value)));
            case GTE -> new SqlPredicate(column + " >= ?", List.of(arg(value)));
            case LT -> new SqlPredicate(column + " < ?", List.of(arg(value)));
            case LTE -> new SqlPredicate(column + " <= ?", List.of(arg(value)));
            case IN -> inList(column, (List<?>) value, false);
            case NIN -> inList(column, (List<?>) value, true);
        };
    }

    private SqlPredicate inList(String column, List<?> values, boolean negate) {
        if (values.isEmpty()) {
            return negate ? SqlPredicate.TRUE : SqlPredicate.FALSE;
        }
        List<Object> args = new ArrayList<>(values.size());
        for (Object v : values) {
            args.add(arg(v));
        }
        String placeholders = String.join(", ", Collections.nCopies(values.size(), "?"));
        return new SqlPredicate(column + (negate ? " NOT IN (" : " IN (") + placeholders + ")", args);
    }

    private SqlPredicate compareMetadata(String key, Operator operator, Object value) {
        String path = "(metadata -> CAST(? AS text))";
        return switch (operator) {
            case EQ -> new SqlPredicate(path + " = CAST(? AS jsonb)", List.of(key, json(value)));
            case NE -> new SqlPredicate(path + " IS DISTINCT FROM CAST(? AS jsonb)", List.of(key, json(value)));
            case IN, NIN -> metadataInList(path, key, (List<?>) value, operator == Operator.NIN);
            case GT, GTE, LT, LTE -> metadataOrdering(key, operator, value);
        };
    }

    private SqlPredicate metadataInList(String path, String key, List<?> values, boolean negate) {
        if (values.isEmpty()) {
            return negate ? SqlPredicate.TRUE : SqlPredicate.FALSE;
        }
        List<Object> args = new ArrayList<>();
        args.add(key);
        for (Object v : values) {
            args.add(json(v));
        }
        String placeholders = String.join(", ", Collections.nCopies(values.size(), "CAST(? AS jsonb)"));
        if (!negate) {
            return new SqlPredicate(path + " IN (" + placeholders + ")", args);
        }
        List<Object> negated = new ArrayList<>();
        negated.add(key);
        negated.addAll(args);
        return new SqlPredicate("(" + path + " IS NULL OR " + path + " NOT IN (" + placeholders + "))", negated);
    }

    private SqlPredicate metadataOrdering(String key, Operator operator, Object value) {
        if (value == null) {
            throw new InvalidFilterException("Cannot order metadata." + key + " against null");
        }
        String symbol = switch (operator) {
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
            default -> throw new IllegalStateException("Not an ordering operator: " + operator);
        };
        if (value instanceof Number n) {
            String numeric = "CASE WHEN jsonb_typeof(metadata -> CAST(? AS text)) = 'number' "
                    + "THEN CAST(metadata ->> CAST(? AS text) AS numeric) END";
            return new SqlPredicate(numeric + " " + symbol + " ?",
                    List.of(key, key, new BigDecimal(n.toString())));
        }
        return new SqlPredicate("(metadata ->> CAST(? AS text)) " + symbol + " ?",
                List.of(key, String.valueOf(value)));
    }

    private static SqlPredicate join(List<SqlPredicate> operands, String separator) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        StringJoiner sql = new StringJoiner(separator, "(", ")");
        List<Object> args = new ArrayList<>();
        for (SqlPredicate p : operands) {
            sql.add(p.sql());
            args.addAll(p.args());
        }
        return new SqlPredicate(sql.toString(), args);
    }

    /** Converts normalized values to JDBC-bindable arguments. */
    private static Object arg(Object value) {
        if (value instanceof FileId id) return id.value();
        if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC);
        return value;
    }

    private static String json(Object value) {
        Object plain = value instanceof FileId || value instanceof Instant ? value.toString() : value;
        try {
            return JSON.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new InvalidFilterException("Cannot encode filter value: " + value, e);
        }
    }
}
