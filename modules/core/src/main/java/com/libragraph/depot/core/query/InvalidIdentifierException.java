package com.libragraph.depot.core.query;

/**
 * Thrown when a file version id supplied as a string cannot be converted to a {@code FileId}.
 */
public class InvalidIdentifierException extends InvalidFilterException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, Throwable cause) {
        super("Invalid file version id: " + identifier, cause);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
