package org.lite.telemetry.util;

import org.lite.telemetry.exception.MalformedPayloadException;
import org.lite.telemetry.exception.UpstreamFailureException;
import org.lite.telemetry.exception.UpstreamUnavailableException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient and Reactor failures onto the upstream exception taxonomy.
 */
public final class UpstreamErrors {

    private UpstreamErrors() {
    }

    public static Throwable translate(String upstream, Throwable error) {
        if (error instanceof UpstreamUnavailableException
                || error instanceof UpstreamFailureException
                || error instanceof MalformedPayloadException) {
            return error;
        }
        if (error instanceof TimeoutException
                || error instanceof WebClientRequestException
                || error instanceof ConnectException) {
            return new UpstreamUnavailableException(upstream, error);
        }
        if (error instanceof WebClientResponseException responseError) {
            return new UpstreamFailureException(upstream, responseError.getStatusCode().value(),
                    responseError.getResponseBodyAsString());
        }
        if (error instanceof CodecException) {
            return new MalformedPayloadException(upstream + " returned an unreadable body", error);
        }
        return error;
    }
}
