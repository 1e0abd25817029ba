package com.libragraph.depot.core.query;

/**
 * Thrown when a filter expression or where document cannot be translated.
 */
public class InvalidFilterException extends RuntimeException {

    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
