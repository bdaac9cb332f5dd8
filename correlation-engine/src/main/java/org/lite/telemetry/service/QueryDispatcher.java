package org.lite.telemetry.service;

import org.lite.telemetry.dto.QueryRequest;
import org.lite.telemetry.dto.ResultEnvelope;
import reactor.core.publisher.Mono;

/**
 * Routes a transport-agnostic {@link QueryRequest} to the service answering its query kind.
 */
public interface QueryDispatcher {

    /**
     * Errors with {@link org.lite.telemetry.exception.InvalidQueryException} when a required
     * parameter is missing; every other failure is reported through the envelope status.
     */
    Mono<ResultEnvelope<?>> dispatch(QueryRequest request);
}
