package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.types.FileField;
import com.libragraph.depot.util.EntryNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds archive entry and download names from a version's fields.
 *
 * <p>A format is a sequence of field and literal segments. Templates use
 * {@code {field}} placeholders, with an optional {@code $} and any field alias:
 * {@code {$_id}_{$filename}} and {@code {id}_{filename}} are equivalent.
 * Resolved names are always passed through {@link EntryNames#sanitize(String)}.
 */
public final class EntryNameFormat {

    /** One piece of a name. */
    public interface Segment {
        String resolve(FileVersion version);
    }

    public record Field(FileField field) implements Segment {
        public Field {
            Objects.requireNonNull(field, "field cannot be null");
            if (field == FileField.METADATA) {
                throw new IllegalArgumentException("Metadata cannot be used in entry names");
            }
        }

        @Override
        public String resolve(FileVersion v) {
            return switch (field) {
                case ID -> v.id().toString();
                case FILENAME -> v.filename();
                case CONTAINER -> v.container();
                case UPLOADED_AT -> v.uploadedAt().toString();
                case LENGTH -> Long.toString(v.length());
                case CONTENT_TYPE -> v.contentType();
                case METADATA -> throw new IllegalStateException("unreachable");
            };
        }
    }

    public record Literal(String text) implements Segment {
        public Literal {
            Objects.requireNonNull(text, "text cannot be null");
        }

        @Override
        public String resolve(FileVersion v) {
            return text;
        }
    }

    /** {@code {filename}} */
    public static final EntryNameFormat FILENAME = builder().field(FileField.FILENAME).build();

    /** {@code {id}_{filename}} */
    public static final EntryNameFormat VERSIONED =
            builder().field(FileField.ID).literal("_").field(FileField.FILENAME).build();

    private final List<Segment> segments;

    private EntryNameFormat(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    /** A caller-supplied alias, itself a template. */
    public static EntryNameFormat alias(String alias) {
        return parse(alias);
    }

    /** {@code {id}_} followed by the alias template. */
    public static EntryNameFormat versionedAlias(String alias) {
        return builder().field(FileField.ID).literal("_").append(parse(alias)).build();
    }

    /**
     * Parses a template. Text outside braces is literal; an unknown field name
     * or an unclosed brace raises {@link IllegalArgumentException}.
     */
    public static EntryNameFormat parse(String template) {
        Objects.requireNonNull(template, "template cannot be null");
        Builder builder = builder();
        int i = 0;
        while (i < template.length()) {
            int open = template.indexOf('{', i);
            if (open < 0) {
                builder.literal(template.substring(i));
                break;
            }
            if (open > i) {
                builder.literal(template.substring(i, open));
            }
            int close = template.indexOf('}', open);
            if (close < 0) {
                throw new IllegalArgumentException("Unclosed '{' in name template: " + template);
            }
            String name = template.substring(open + 1, close);
            if (name.startsWith("$")) {
                name = name.substring(1);
            }
            String fieldName = name;
            FileField field = FileField.find(fieldName)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown field '" + fieldName + "' in name template: " + template));
            builder.field(field);
            i = close + 1;
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Segment> segments() {
        return segments;
    }

    /** The sanitized name for {@code version}. */
    public String format(FileVersion version) {
        StringBuilder sb = new StringBuilder();
        for (Segment s : segments) {
            sb.append(s.resolve(version));
        }
        return EntryNames.sanitize(sb.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EntryNameFormat other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Segment s : segments) {
            if (s instanceof Field f) {
                sb.append('{').append(f.field().label()).append('}');
            } else if (s instanceof Literal l) {
                sb.append(l.text());
            }
        }
        return sb.toString();
    }

    public static final class Builder {
        private final List<Segment> segments = new ArrayList<>();

        private Builder() {}

        public Builder field(FileField field) {
            segments.add(new Field(field));
            return this;
        }

        public Builder literal(String text) {
            if (!text.isEmpty()) {
                segments.add(new Literal(text));
            }
            return this;
        }

        public Builder append(EntryNameFormat other) {
            segments.addAll(other.segments);
            return this;
        }

        public EntryNameFormat build() {
            return new EntryNameFormat(segments);
        }
    }
}
