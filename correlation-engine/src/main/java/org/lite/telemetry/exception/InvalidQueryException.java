package org.lite.telemetry.exception;

/**
 * Thrown when an inbound query lacks a required parameter or names an unknown query kind.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
