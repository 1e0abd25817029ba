package com.libragraph.depot.util;

import java.util.Objects;

/**
 * Opaque identifier of a stored file version.
 *
 * <p>Assigned by the chunk store from a monotonically increasing sequence, so
 * ids also order versions by insertion. String format is 16 lowercase hex
 * digits, e.g. {@code 000000000000002a}.
 */
public record FileId(long value) implements Comparable<FileId> {

    public static final int HEX_LENGTH = 16;

    public FileId {
        if (value <= 0) {
            throw new IllegalArgumentException("FileId must be > 0, got: " + value);
        }
    }

    public static FileId of(long value) {
        return new FileId(value);
    }

    /**
     * Parses the external string form.
     *
     * @throws IllegalArgumentException if the string is not 16 hex digits or encodes zero
     */
    public static FileId parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        if (text.length() != HEX_LENGTH) {
            throw new IllegalArgumentException(
                    "Invalid FileId (expected " + HEX_LENGTH + " hex digits): " + text);
        }
        long value;
        try {
            value = Long.parseUnsignedLong(text, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FileId (not hex): " + text, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid FileId (must be > 0): " + text);
        }
        return new FileId(value);
    }

    @Override
    public int compareTo(FileId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.format("%016x", value);
    }
}
