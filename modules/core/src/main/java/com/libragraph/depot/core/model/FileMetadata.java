package com.libragraph.depot.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form, insertion-ordered metadata attached to a file version.
 *
 * <p>Immutable. Updates go through {@link #merge(Map)}, which never lets an
 * overlay rewrite the container.
 */
public final class FileMetadata {

    /** Reserved key: the container is a first-class field, never a metadata value. */
    public static final String CONTAINER_KEY = "container";

    private static final FileMetadata EMPTY = new FileMetadata(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private FileMetadata(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FileMetadata empty() {
        return EMPTY;
    }

    /** Copies {@code values}, dropping the reserved container key. */
    public static FileMetadata of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(CONTAINER_KEY);
        return new FileMetadata(copy);
    }

    /**
     * Overlays {@code overlay} onto these values: overlay keys win, existing key
     * order is kept and new keys are appended. A container key in the overlay is ignored.
     */
    public FileMetadata merge(Map<String, ?> overlay) {
        if (overlay == null || overlay.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, Object> merged = new LinkedHashMap<>(values);
        overlay.forEach(merged::put);
        merged.remove(CONTAINER_KEY);
        return new FileMetadata(merged);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Unmodifiable view, in insertion order. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileMetadata other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
