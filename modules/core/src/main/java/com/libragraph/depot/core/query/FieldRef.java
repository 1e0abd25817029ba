package com.libragraph.depot.core.query;

import com.libragraph.depot.types.FileField;

import java.util.Objects;

/**
 * A filterable field: a fixed {@link FileField}, or a key inside the free-form metadata.
 */
public record FieldRef(FileField field, String key) {

    private static final String METADATA_PREFIX = "metadata.";

    public FieldRef {
        Objects.requireNonNull(field, "field cannot be null");
        if (field == FileField.METADATA) {
            if (key == null || key.isBlank()) {
                throw new InvalidFilterException("Metadata field reference needs a key");
            }
        } else if (key != null) {
            throw new InvalidFilterException("Only metadata fields take a key: " + field);
        }
    }

    public static FieldRef of(FileField field) {
        return new FieldRef(field, null);
    }

    public static FieldRef metadata(String key) {
        return new FieldRef(FileField.METADATA, key);
    }

    /**
     * Parses a field path such as {@code filename}, {@code _id} or {@code metadata.author}.
     */
    public static FieldRef parse(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidFilterException("Empty field name");
        }
        var fixed = FileField.find(path);
        if (fixed.isPresent() && fixed.get() != FileField.METADATA) {
            return of(fixed.get());
        }
        if (path.startsWith(METADATA_PREFIX) && path.length() > METADATA_PREFIX.length()) {
            return metadata(path.substring(METADATA_PREFIX.length()));
        }
        throw new InvalidFilterException("Unknown filter field: " + path);
    }

    public boolean isMetadata() {
        return field == FileField.METADATA;
    }

    @Override
    public String toString() {
        return isMetadata() ? METADATA_PREFIX + key : field.label();
    }
}
