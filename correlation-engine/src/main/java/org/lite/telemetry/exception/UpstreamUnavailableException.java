package org.lite.telemetry.exception;

/**
 * Thrown when an upstream could not be reached in time: connection refused, reset, or the
 * per-call timeout elapsed. Never retried.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String upstream, Throwable cause) {
        super(String.format("%s unavailable: %s", upstream, describe(cause)), cause);
    }

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    private static String describe(Throwable cause) {
        if (cause instanceof java.util.concurrent.TimeoutException) {
            return "Request timeout";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
