package org.lite.telemetry.exception;

/**
 * Thrown when an upstream body cannot be read as a JSON object, or answers without any of the
 * containers the query expects. Individual missing or mistyped fields never raise this; they
 * are defaulted during normalization.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
