package org.lite.telemetry.exception;

/**
 * Thrown when an upstream answered with a non-success HTTP status.
 */
public class UpstreamFailureException extends RuntimeException {

    private final int statusCode;

    public UpstreamFailureException(String upstream, int statusCode, String body) {
        super(String.format("%s returned %d: %s", upstream, statusCode, body));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
